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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;
import org.tapegraph.trace.Node;
import org.tapegraph.trace.TapeValue;

/**
 * Data dependency analysis over a trace.
 *
 * <p>{@link #referenced} gives the nodes a node immediately depends on, {@link #dependents} the
 * nodes that immediately depend on it; {@link #backward} and {@link #forward} compute the
 * transitive closures of those relations. Nodes are compared by identity throughout.
 */
public class Dependencies {

  private Dependencies() {}

  /** Equivalent to {@code referenced(node, ReferenceAxis.PRECEDING)}. */
  public static ImmutableList<Node> referenced(Node node) {
    return referenced(node, ReferenceAxis.PRECEDING);
  }

  /**
   * Returns the nodes that {@code node} immediately depends on, using the rule selected by {@code
   * axis}. The result may contain duplicates if a node's payload refers to the same node more than
   * once.
   */
  public static ImmutableList<Node> referenced(Node node, ReferenceAxis axis) {
    boolean parentRule =
        (axis == ReferenceAxis.PARENT)
            || (axis == ReferenceAxis.PRECEDING_OR_PARENT && node instanceof Node.Argument);
    if (!parentRule) {
      return precedingReferences(node);
    }
    if (!(node instanceof Node.Argument arg)) {
      return ImmutableList.of();
    }
    Node.NestedCall parent = arg.parent();
    if (parent == null) {
      return ImmutableList.of();
    }
    // The first block argument is the function being called; the others correspond to the call's
    // arguments.
    TapeValue source;
    if (arg.number() == 1) {
      source = parent.callee();
    } else if (arg.number() - 2 < parent.arguments().size()) {
      source = parent.arguments().get(arg.number() - 2);
    } else {
      return ImmutableList.of();
    }
    Node resolved = parent.resolve(source);
    return (resolved == null) ? ImmutableList.of() : ImmutableList.of(resolved);
  }

  /**
   * Resolves each reference in {@code node}'s payload. Constant and Argument nodes only carry
   * constants, so their result is always empty.
   */
  private static ImmutableList<Node> precedingReferences(Node node) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (TapeValue operand : node.operands()) {
      Node target = node.resolve(operand);
      if (target != null) {
        result.add(target);
      }
    }
    return result.build();
  }

  /**
   * Returns the nodes among {@code node}'s following siblings that refer to it, i.e. those nodes
   * {@code f} for which {@code referenced(f, PRECEDING)} contains {@code node}.
   */
  public static ImmutableList<Node> dependents(Node node) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node f : Query.query(node, Axis.FOLLOWING)) {
      if (containsIdentical(referenced(f, ReferenceAxis.PRECEDING), node)) {
        result.add(f);
      }
    }
    return result.build();
  }

  /** Equivalent to {@code backward(node, ReferenceAxis.PRECEDING)}. */
  public static ImmutableSet<Node> backward(Node node) {
    return backward(node, ReferenceAxis.PRECEDING);
  }

  /**
   * Returns every node that {@code node} transitively depends on, in the order they were reached.
   */
  public static ImmutableSet<Node> backward(Node node, ReferenceAxis axis) {
    Set<Node> result = new LinkedHashSet<>();
    backward(node, axis, (n, refs) -> result.addAll(refs));
    return ImmutableSet.copyOf(result);
  }

  /**
   * Traverses the nodes that {@code node} transitively depends on. {@code visitor} is first called
   * with {@code node} and the nodes it references, then once with each node reached and the nodes
   * it references.
   */
  public static void backward(
      Node node, ReferenceAxis axis, BiConsumer<Node, ImmutableList<Node>> visitor) {
    traverse(node, n -> referenced(n, axis), visitor);
  }

  /**
   * Returns every node that transitively depends on {@code node}, in the order they were reached.
   */
  public static ImmutableSet<Node> forward(Node node) {
    Set<Node> result = new LinkedHashSet<>();
    forward(node, (n, deps) -> result.addAll(deps));
    return ImmutableSet.copyOf(result);
  }

  /**
   * Traverses the nodes that transitively depend on {@code node}, calling {@code visitor} as
   * {@link #backward(Node, ReferenceAxis, BiConsumer)} does.
   */
  public static void forward(Node node, BiConsumer<Node, ImmutableList<Node>> visitor) {
    traverse(node, Dependencies::dependents, visitor);
  }

  /**
   * A worklist traversal of the graph defined by {@code edges}, starting from {@code start}. Each
   * node is visited at most once; the graphs we traverse are acyclic, so this terminates.
   */
  private static void traverse(
      Node start,
      Function<Node, ImmutableList<Node>> edges,
      BiConsumer<Node, ImmutableList<Node>> visitor) {
    Set<Node> seen = new HashSet<>();
    seen.add(start);
    Deque<Node> pending = new ArrayDeque<>();
    Node current = start;
    for (; ; ) {
      ImmutableList<Node> next = edges.apply(current);
      visitor.accept(current, next);
      for (Node n : next) {
        if (seen.add(n)) {
          pending.addLast(n);
        }
      }
      if (pending.isEmpty()) {
        return;
      }
      current = pending.removeFirst();
    }
  }

  private static boolean containsIdentical(ImmutableList<Node> nodes, Node node) {
    for (Node n : nodes) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }
}
