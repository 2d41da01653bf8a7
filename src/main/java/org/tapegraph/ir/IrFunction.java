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
import java.util.List;

/**
 * A function defined by an {@link Ir}.
 *
 * <p>When an IrFunction is called, the first argument of its block 1 is bound to the IrFunction
 * itself and the remaining arguments to the caller's arguments; an IrFunction with {@code n}
 * parameters therefore has {@code n + 1} block 1 arguments. Among other things this lets a
 * function call itself recursively without referring to a global.
 */
public record IrFunction(String name, Ir ir) {
  public IrFunction {
    Preconditions.checkArgument(
        !ir.block(1).arguments().isEmpty(),
        "Block 1 of %s must have at least one argument (the function itself)",
        name);
  }

  /** The number of arguments callers must pass. */
  public int numParameters() {
    return ir.block(1).arguments().size() - 1;
  }

  /** Throws an {@link IrException} if {@code args} has the wrong number of elements. */
  public void checkArguments(List<?> args) {
    if (args.size() != numParameters()) {
      throw new IrException(
          String.format("%s expects %s arguments, got %s", name, numParameters(), args.size()));
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
