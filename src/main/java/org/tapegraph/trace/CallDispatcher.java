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

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Decides how each call made by an instrumented program is recorded, and carries it out.
 *
 * <p>{@code args} is unmodifiable and may contain nulls.
 */
public interface CallDispatcher {

  /** True if the call should be recorded as a single {@link Node.PrimitiveCall}. */
  boolean isPrimitive(@Nullable Object callee, List<@Nullable Object> args);

  /** Makes a call that was classified as primitive and returns its result. */
  @Nullable Object callPrimitive(@Nullable Object callee, List<@Nullable Object> args);

  /**
   * Makes a call that was classified as nested, recording its execution, and returns the
   * resulting Tape.
   */
  Tape callNested(@Nullable Object callee, List<@Nullable Object> args);
}
