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
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.tapegraph.util.StringUtil;

/**
 * One of the control transfers that end a {@link Block}. There are exactly two implementations:
 * {@link Jump} and {@link Return}.
 *
 * <p>A block's branches are tried in order; the first one that is taken ends the block. If none is
 * taken (the last branch is a conditional jump whose condition was false, or the block has no
 * branches) control falls through to the next block, passing no arguments.
 */
public sealed interface Branch {

  /**
   * Transfers control to block {@code target}, passing {@code args} as its block arguments. If
   * {@code condition} is non-null the jump is only taken if it evaluates to {@code true}.
   */
  record Jump(int target, ImmutableList<Operand> args, @Nullable Operand condition)
      implements Branch {
    public Jump {
      Preconditions.checkArgument(target > 0, "Block ids start at 1");
    }

    public boolean isConditional() {
      return condition != null;
    }

    @Override
    public String toString() {
      String result = "br " + target;
      if (!args.isEmpty()) {
        result += StringUtil.joinElements(" (", ")", args);
      }
      return isConditional() ? result + " if " + condition : result;
    }
  }

  /** Returns {@code value} from the function. */
  record Return(Operand value) implements Branch {
    @Override
    public String toString() {
      return "return " + value;
    }
  }
}
