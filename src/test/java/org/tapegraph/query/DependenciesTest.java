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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.tapegraph.query.QueryTest.Sample;
import org.tapegraph.testing.SamplePrograms;
import org.tapegraph.trace.Node;
import org.tapegraph.trace.TapeValue;
import org.tapegraph.track.Tracker;

@RunWith(TestParameterInjector.class)
public class DependenciesTest {

  private static boolean containsIdentical(List<Node> nodes, Node node) {
    return nodes.stream().anyMatch(n -> n == node);
  }

  @Test
  public void referencedAndDependentsAreDual(@TestParameter Sample sample) {
    List<Node> all = QueryTest.allNodes(sample.trace());
    for (Node n : all) {
      for (Node f : all) {
        assertWithMessage("%s / %s", n, f)
            .that(containsIdentical(Dependencies.dependents(n), f))
            .isEqualTo(containsIdentical(Dependencies.referenced(f), n));
      }
    }
  }

  @Test
  public void noForwardReferences(@TestParameter Sample sample) {
    for (Node node : QueryTest.allNodes(sample.trace())) {
      for (TapeValue operand : node.operands()) {
        if (operand instanceof TapeValue.Reference ref) {
          assertThat(ref.isBound()).isTrue();
          assertThat(ref.target()).isLessThan(node.position());
          assertThat(node.resolve(ref).location()).isEqualTo(ref.location());
        }
      }
    }
  }

  @Test
  public void backwardIsClosed(@TestParameter Sample sample, @TestParameter ReferenceAxis axis) {
    for (Node node : QueryTest.allNodes(sample.trace())) {
      ImmutableSet<Node> closure = Dependencies.backward(node, axis);
      assertThat(closure).containsAtLeastElementsIn(Dependencies.referenced(node, axis));
      for (Node m : closure) {
        assertThat(closure).containsAtLeastElementsIn(Dependencies.referenced(m, axis));
      }
    }
  }

  @Test
  public void forwardIsClosed(@TestParameter Sample sample) {
    for (Node node : QueryTest.allNodes(sample.trace())) {
      ImmutableSet<Node> closure = Dependencies.forward(node);
      assertThat(closure).containsAtLeastElementsIn(Dependencies.dependents(node));
      for (Node m : closure) {
        assertThat(closure).containsAtLeastElementsIn(Dependencies.dependents(m));
      }
    }
  }

  @Test
  public void straightLineSlices() {
    Node.NestedCall root = Tracker.create().track(SamplePrograms.INCREMENT, 1).root();
    Node x = root.child(2);
    Node add = root.child(3);
    Node ret = root.child(4);
    assertThat(Dependencies.backward(ret)).containsExactly(add, x).inOrder();
    assertThat(Dependencies.forward(x)).containsExactly(add, ret).inOrder();
    assertThat(Dependencies.referenced(x)).isEmpty();
    assertThat(Dependencies.dependents(ret)).isEmpty();
    assertThat(Dependencies.backward(root.child(1))).isEmpty();
  }

  @Test
  public void loopSlice() {
    Node.NestedCall root = Tracker.create().track(SamplePrograms.SUM_BELOW, 2).root();
    Node.Return ret = (Node.Return) root.child(root.children().size());
    ImmutableSet<Node> slice = Dependencies.backward(ret);
    // The returned value is a block argument, and block arguments depend on nothing that
    // precedes them.
    assertThat(slice).containsExactly(root.child(root.children().size() - 1));
    // The exit condition depends on the loop counter and on n.
    Node.Jump exit = (Node.Jump) root.child(root.children().size() - 2);
    ImmutableSet<Node> exitSlice = Dependencies.backward(exit);
    assertThat(exitSlice).contains(root.child(2));
    assertThat(exitSlice.stream().filter(n -> n instanceof Node.Argument).count()).isAtLeast(2);
  }

  @Test
  public void parentAxisCrossesCallBoundaries() {
    Node.NestedCall root = Tracker.create().track(SamplePrograms.FACTORIAL, 3).root();
    Node.NestedCall inner = null;
    for (Node child : root.children()) {
      if (child instanceof Node.NestedCall nested) {
        inner = nested;
      }
    }
    assertThat(inner).isNotNull();
    Node.Argument innerSelf = (Node.Argument) inner.child(1);
    Node.Argument innerN = (Node.Argument) inner.child(2);

    // Argument 1 is the callee, which was the outer call's own first argument.
    assertThat(Dependencies.referenced(innerSelf, ReferenceAxis.PARENT))
        .containsExactly(root.child(1));
    // Argument 2 is the first argument of the call, n - 1.
    Node nMinusOne = root.child(inner.position() - 1);
    assertThat(nMinusOne).isInstanceOf(Node.PrimitiveCall.class);
    assertThat(inner.resolve(inner.arguments().get(0))).isSameInstanceAs(nMinusOne);
    assertThat(Dependencies.referenced(innerN, ReferenceAxis.PARENT)).containsExactly(nMinusOne);

    assertThat(Dependencies.referenced(innerN, ReferenceAxis.PRECEDING)).isEmpty();
    assertThat(Dependencies.referenced(innerN, ReferenceAxis.PRECEDING_OR_PARENT))
        .containsExactly(nMinusOne);
    Node innerCompare = inner.child(3);
    assertThat(Dependencies.referenced(innerCompare, ReferenceAxis.PARENT)).isEmpty();
    assertThat(Dependencies.referenced(innerCompare, ReferenceAxis.PRECEDING_OR_PARENT))
        .containsExactly(innerN);

    // Combining both rules traces the inner comparison back to the outer argument.
    ImmutableSet<Node> slice =
        Dependencies.backward(innerCompare, ReferenceAxis.PRECEDING_OR_PARENT);
    assertThat(slice).containsAtLeast(innerN, nMinusOne);
    // The root's arguments were passed in as constants.
    assertThat(Dependencies.referenced(root.child(2), ReferenceAxis.PARENT)).isEmpty();
  }

  @Test
  public void customVisitor() {
    Node.NestedCall root = Tracker.create().track(SamplePrograms.ABS, -3).root();
    Node ret = root.child(root.children().size());
    List<Node> visited = new ArrayList<>();
    List<ImmutableList<Node>> refs = new ArrayList<>();
    Dependencies.backward(
        ret,
        ReferenceAxis.PRECEDING,
        (node, referenced) -> {
          visited.add(node);
          refs.add(referenced);
        });
    // The start node first, then each node reached exactly once.
    assertThat(visited.get(0)).isSameInstanceAs(ret);
    assertThat(visited).containsNoDuplicates();
    assertThat(visited.subList(1, visited.size()))
        .containsExactlyElementsIn(Dependencies.backward(ret));
    for (int i = 0; i < visited.size(); i++) {
      assertThat(refs.get(i)).isEqualTo(Dependencies.referenced(visited.get(i)));
    }

    List<Node> forwardVisited = new ArrayList<>();
    Dependencies.forward(root.child(2), (node, deps) -> forwardVisited.add(node));
    assertThat(forwardVisited.get(0)).isSameInstanceAs(root.child(2));
    assertThat(forwardVisited).containsNoDuplicates();
  }
}
