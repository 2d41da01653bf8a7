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


package org.tapegraph.track;

import org.jspecify.annotations.Nullable;
import org.tapegraph.trace.Node;

/**
 * The result of {@link Tracker#track}: the value returned by the traced function, and the root of
 * the trace of its execution.
 */
public record Traced(@Nullable Object value, Node.NestedCall root) {}
