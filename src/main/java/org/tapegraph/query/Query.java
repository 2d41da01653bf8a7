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


package org.tapegraph.query;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.tapegraph.trace.Node;

/**
 * Structural navigation over a trace. Every method is pure and total: an axis that doesn't apply
 * to a node (e.g. PRECEDING on a trace root, or CHILD on a leaf) returns an empty list.
 */
public class Query {

  private Query() {}

  /** Returns the nodes reached from {@code node} along {@code axis}, in axis order. */
  public static ImmutableList<Node> query(Node node, Axis axis) {
    switch (axis) {
      case PARENT:
        Node.NestedCall parent = node.parent();
        return (parent == null) ? ImmutableList.of() : ImmutableList.of(parent);
      case CHILD:
        return node.children();
      case PRECEDING:
        return siblings(node, false);
      case FOLLOWING:
        return siblings(node, true);
      case ANCESTOR:
        return ancestors(node);
      case DESCENDANT:
        return descendants(node);
    }
    throw new AssertionError(axis);
  }

  /** Returns the NestedCall that {@code node} is a child of, or null for a trace root. */
  public static Node.@Nullable NestedCall parent(Node node) {
    return node.parent();
  }

  private static ImmutableList<Node> siblings(Node node, boolean following) {
    Node.NestedCall parent = node.parent();
    if (parent == null) {
      return ImmutableList.of();
    }
    ImmutableList<Node> children = parent.children();
    // Positions are 1-based, so the node itself is at index position - 1.
    int index = node.position() - 1;
    return following
        ? children.subList(index + 1, children.size())
        : children.subList(0, index);
  }

  private static ImmutableList<Node> ancestors(Node node) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node n = node.parent(); n != null; n = n.parent()) {
      result.add(n);
    }
    return result.build();
  }

  /**
   * Returns all the descendants of {@code node} in breadth-first order: its children, then their
   * children, and so on.
   */
  private static ImmutableList<Node> descendants(Node node) {
    List<Node> result = new ArrayList<>(node.children());
    // Each element before the cursor has had its children appended.
    for (int cursor = 0; cursor < result.size(); cursor++) {
      result.addAll(result.get(cursor).children());
    }
    return ImmutableList.copyOf(result);
  }
}
