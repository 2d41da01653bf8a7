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

package org.tapegraph.ir;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;
import org.tapegraph.util.StringUtil;

/**
 * An input to a statement or branch. There are exactly two implementations: {@link Variable}, an
 * SSA variable defined by a block argument or a statement, and {@link Const}, a literal or global
 * that evaluates to itself.
 */
public sealed interface Operand {

  /**
   * Converts a builder argument to an Operand: Operands are returned unchanged, anything else
   * (including null) is wrapped in a {@link Const}.
   */
  static Operand of(@Nullable Object x) {
    return (x instanceof Operand operand) ? operand : new Const(x);
  }

  /**
   * An SSA variable. Ids are unique within an {@link Ir} (not just within a block), since values
   * defined in one block may be used by any block it dominates.
   */
  record Variable(int id) implements Operand {
    public Variable {
      Preconditions.checkArgument(id > 0, "Variable ids start at 1");
    }

    @Override
    public String toString() {
      return "%" + id;
    }
  }

  /** A value known when the IR is built. */
  record Const(@Nullable Object value) implements Operand {
    @Override
    public String toString() {
      return StringUtil.literal(value);
    }
  }
}
