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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Location;

/**
 * What an instrumented program passes to {@link Recorder#record} for each element it executes.
 * There are exactly six implementations, one for each kind of {@link Node} except that both kinds
 * of call share {@link Call}.
 *
 * <p>TapeValues in a Description are usually unbound References, created when the program was
 * instrumented; the Recorder binds them.
 */
public sealed interface Description {

  /** The element of the original IR that is being recorded. */
  Location location();

  /** A literal or global. */
  record Constant(Location location, @Nullable Object value) implements Description {}

  /**
   * A block argument. {@code branch} is the position of the Jump node that was recorded when
   * control entered the block, or 0 if the block was entered by calling the function.
   */
  record Argument(Location location, @Nullable Object value, int branch, int number)
      implements Description {
    public Argument {
      Preconditions.checkArgument(branch >= 0 && number > 0);
    }
  }

  /**
   * A call, with both the runtime values of the callee and its arguments and their
   * representations in the trace.
   */
  record Call(
      Location location,
      @Nullable Object callee,
      List<@Nullable Object> args,
      TapeValue calleeRepr,
      ImmutableList<TapeValue> argReprs)
      implements Description {
    public Call {
      Preconditions.checkArgument(args.size() == argReprs.size());
      // The runtime values may include nulls, so ImmutableList isn't an option.
      args = Collections.unmodifiableList(new ArrayList<>(args));
    }
  }

  /** A special form that has already been evaluated to {@code value}. */
  record Special(
      Location location, String head, @Nullable Object value, ImmutableList<TapeValue> argReprs)
      implements Description {}

  /**
   * A jump to block {@code target}. {@code conditional} is false for an unconditional jump
   * (including a fallthrough), in which case {@code condition} is {@code Constant(true)}.
   */
  record Jump(
      Location location,
      int target,
      ImmutableList<TapeValue> argReprs,
      TapeValue condition,
      boolean conditional)
      implements Description {
    public Jump {
      Preconditions.checkArgument(target > 0);
      Preconditions.checkArgument(conditional || condition.equals(TapeValue.constant(true)));
    }
  }

  /** A return from the function. */
  record Return(Location location, TapeValue argRepr) implements Description {}
}
