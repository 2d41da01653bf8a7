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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Ir;

/**
 * The result of executing an instrumented function: the value it returned, the nodes recorded
 * (not yet attached to a parent), and the IR they were recorded from.
 */
public record Tape(@Nullable Object value, ImmutableList<Node> children, Ir ir) {

  /**
   * Returns the root of a new trace: a NestedCall of {@code callee} with {@code args}, whose
   * children are this Tape's nodes.
   */
  public Node.NestedCall toRoot(@Nullable Object callee, List<@Nullable Object> args) {
    return new Node.NestedCall(
        NodeInfo.root(),
        TapeValue.constant(callee),
        args.stream().<TapeValue>map(TapeValue::constant).collect(toImmutableList()),
        this);
  }
}
