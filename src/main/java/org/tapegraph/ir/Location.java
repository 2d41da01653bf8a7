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

/**
 * Identifies an element of an {@link Ir}: a block argument or statement ({@link VarIndex}) or a
 * branch ({@link BranchIndex}). Use {@link Ir#elementAt} to get the element itself.
 */
public sealed interface Location {

  /** The id of the block containing the element. */
  int block();

  /** The argument or statement of {@code block} that defines variable {@code %variable}. */
  record VarIndex(int block, int variable) implements Location {
    public VarIndex {
      Preconditions.checkArgument(block > 0 && variable > 0);
    }

    @Override
    public String toString() {
      return "@" + block + ":%" + variable;
    }
  }

  /** The {@code ordinal}'th (1-based) branch of {@code block}. */
  record BranchIndex(int block, int ordinal) implements Location {
    public BranchIndex {
      Preconditions.checkArgument(block > 0 && ordinal > 0);
    }

    @Override
    public String toString() {
      return "@" + block + "#" + ordinal;
    }
  }
}
