/*
 * Copyright 2025 The Tapegraph Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tapegraph.trace;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Location;
import org.tapegraph.util.StringUtil;

/**
 * An operand as it appears in a recorded {@link Node}: either a {@link Constant} or a {@link
 * Reference} to an earlier node.
 */
public sealed interface TapeValue {

  static Constant constant(@Nullable Object value) {
    return new Constant(value);
  }

  /** Returns an unbound Reference to whatever was most recently recorded at {@code location}. */
  static Reference reference(Location location) {
    return new Reference(location, Reference.UNBOUND);
  }

  /** A value known without further resolution (a literal, a global, or a runtime value). */
  record Constant(@Nullable Object value) implements TapeValue {
    @Override
    public String toString() {
      return StringUtil.literal(value);
    }
  }

  /**
   * A reference to the node recorded at {@code location}.
   *
   * <p>References created by instrumentation are unbound ({@code target == 0}); the {@link
   * Recorder} binds each reference when it records the node containing it, setting {@code target}
   * to the position (among the recording node's siblings) of the node most recently recorded at
   * {@code location}. Binding at record time is what makes a reference inside a loop body refer
   * to the current iteration.
   */
  record Reference(Location location, int target) implements TapeValue {
    static final int UNBOUND = 0;

    public Reference {
      Preconditions.checkArgument(target >= UNBOUND);
    }

    public boolean isBound() {
      return target != UNBOUND;
    }

    /** Returns a bound copy of this Reference. */
    Reference bind(int target) {
      Preconditions.checkArgument(target > UNBOUND);
      return new Reference(location, target);
    }

    @Override
    public String toString() {
      return isBound() ? location + "⟨" + target + "⟩" : location.toString();
    }
  }
}
