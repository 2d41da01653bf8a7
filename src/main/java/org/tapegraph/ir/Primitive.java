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

import java.util.List;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/** A host function that can be called from IR; as far as IR is concerned, calls are atomic. */
@FunctionalInterface
public interface Primitive {
  /** Applies this function; {@code args} is unmodifiable and may contain nulls. */
  @Nullable Object apply(List<@Nullable Object> args);

  /** Returns a Primitive that behaves like {@code fn} and prints as {@code name}. */
  static Primitive named(String name, Function<List<@Nullable Object>, @Nullable Object> fn) {
    return new Primitive() {
      @Override
      public @Nullable Object apply(List<@Nullable Object> args) {
        return fn.apply(args);
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }
}
