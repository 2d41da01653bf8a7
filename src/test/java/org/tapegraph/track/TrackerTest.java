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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.tapegraph.ir.Interpreter;
import org.tapegraph.ir.IrBuilder;
import org.tapegraph.ir.IrException;
import org.tapegraph.ir.IrFunction;
import org.tapegraph.ir.Location.BranchIndex;
import org.tapegraph.ir.Location.VarIndex;
import org.tapegraph.ir.Operand.Variable;
import org.tapegraph.ir.Primitives;
import org.tapegraph.query.Axis;
import org.tapegraph.query.Dependencies;
import org.tapegraph.query.Query;
import org.tapegraph.testing.SamplePrograms;
import org.tapegraph.trace.Node;
import org.tapegraph.trace.TapeValue;
import org.tapegraph.trace.TrackingException;

@RunWith(TestParameterInjector.class)
public class TrackerTest {

  private final Tracker tracker = Tracker.create();

  /** The sample programs that take one integer argument. */
  enum Program {
    INCREMENT(SamplePrograms.INCREMENT),
    ABS(SamplePrograms.ABS),
    SUM_BELOW(SamplePrograms.SUM_BELOW),
    ADD_TWO(SamplePrograms.ADD_TWO),
    FACTORIAL(SamplePrograms.FACTORIAL),
    INCREMENT_OUT_OF_ORDER(SamplePrograms.INCREMENT_OUT_OF_ORDER);

    final IrFunction fn;

    Program(IrFunction fn) {
      this.fn = fn;
    }
  }

  @Test
  public void preservesValues(
      @TestParameter Program program, @TestParameter({"-2", "0", "1", "2", "5"}) int x) {
    Object expected = new Interpreter().call(program.fn, List.of(x));
    Traced traced = tracker.track(program.fn, x);
    assertWithMessage("%s(%s)", program.fn, x).that(traced.value()).isEqualTo(expected);
    assertThat(traced.root().value()).isEqualTo(expected);
    Node last = traced.root().children().get(traced.root().children().size() - 1);
    assertThat(last).isInstanceOf(Node.Return.class);
  }

  @Test
  public void straightLine() {
    Traced traced = tracker.track(SamplePrograms.INCREMENT, 41);
    Node.NestedCall root = traced.root();
    assertThat(traced.value()).isEqualTo(42);
    assertThat(root.callee()).isEqualTo(TapeValue.constant(SamplePrograms.INCREMENT));
    assertThat(root.arguments()).containsExactly(TapeValue.constant(41));

    ImmutableList<Node> children = root.children();
    assertThat(children).hasSize(4);
    Node.Argument self = (Node.Argument) children.get(0);
    Node.Argument x = (Node.Argument) children.get(1);
    Node.PrimitiveCall add = (Node.PrimitiveCall) children.get(2);
    Node.Return ret = (Node.Return) children.get(3);

    assertThat(self.number()).isEqualTo(1);
    assertThat(self.value()).isSameInstanceAs(SamplePrograms.INCREMENT);
    assertThat(self.originatingBranch()).isNull();
    assertThat(x.number()).isEqualTo(2);
    assertThat(x.value()).isEqualTo(41);
    assertThat(x.location()).isEqualTo(new VarIndex(1, 2));
    assertThat(add.callee()).isEqualTo(TapeValue.constant(Primitives.ADD));
    assertThat(add.arguments())
        .containsExactly(new TapeValue.Reference(new VarIndex(1, 2), 2), TapeValue.constant(1))
        .inOrder();
    assertThat(add.value()).isEqualTo(42);
    assertThat(ret.location()).isEqualTo(new BranchIndex(1, 1));
    assertThat(ret.ir().elementAt(ret.location()).toString()).isEqualTo("return %3");

    assertThat(Dependencies.referenced(ret)).containsExactly(add);
    assertThat(Dependencies.dependents(x)).containsExactly(add);
  }

  @Test
  public void conditionalJumpTaken() {
    Node.NestedCall root = tracker.track(SamplePrograms.ABS, -7).root();
    assertThat(root.value()).isEqualTo(7);
    ImmutableList<Node> children = root.children();
    assertThat(children).hasSize(7);
    Node.Jump jump = (Node.Jump) children.get(3);
    assertThat(jump.location()).isEqualTo(new BranchIndex(1, 1));
    assertThat(jump.target()).isEqualTo(3);
    assertThat(jump.isConditional()).isTrue();
    assertThat(jump.arguments()).containsExactly(new TapeValue.Reference(new VarIndex(1, 2), 2));
    assertThat(jump.resolve(jump.condition())).isSameInstanceAs(children.get(2));
    assertThat(Dependencies.referenced(jump))
        .containsExactly(children.get(1), children.get(2))
        .inOrder();
    // The jump is recorded at the head of its target block, so the target's nodes follow it.
    assertThat(Query.query(jump, Axis.FOLLOWING))
        .containsExactly(children.get(4), children.get(5), children.get(6))
        .inOrder();

    Node.Argument y = (Node.Argument) children.get(4);
    assertThat(y.location()).isEqualTo(new VarIndex(3, 4));
    assertThat(y.number()).isEqualTo(1);
    assertThat(y.value()).isEqualTo(-7);
    assertThat(y.originatingBranch()).isSameInstanceAs(jump);
    assertThat(children.get(6)).isInstanceOf(Node.Return.class);
  }

  @Test
  public void definitionInLaterNumberedBlock() {
    Traced traced = tracker.track(SamplePrograms.INCREMENT_OUT_OF_ORDER, 41);
    assertThat(traced.value()).isEqualTo(42);
    ImmutableList<Node> children = traced.root().children();
    assertThat(children).hasSize(6);
    Node.Jump toDefinition = (Node.Jump) children.get(2);
    assertThat(toDefinition.target()).isEqualTo(3);
    Node.PrimitiveCall add = (Node.PrimitiveCall) children.get(3);
    assertThat(add.location()).isEqualTo(new VarIndex(3, 3));
    assertThat(add.value()).isEqualTo(42);
    Node.Jump toUse = (Node.Jump) children.get(4);
    assertThat(toUse.target()).isEqualTo(2);
    Node.Return ret = (Node.Return) children.get(5);
    assertThat(ret.location()).isEqualTo(new BranchIndex(2, 1));
    assertThat(Dependencies.referenced(ret)).containsExactly(add);
  }

  @Test
  public void jumpOnConstantTrueIsStillConditional() {
    IrBuilder ib = new IrBuilder();
    int b2 = ib.newBlock();
    ib.argument();
    Variable x = ib.argument();
    ib.jumpIf(true, b2, x);
    ib.ret(0);
    ib.setBlock(b2);
    ib.ret(ib.argument());
    IrFunction fn = new IrFunction("alwaysTrue", ib.build());

    ImmutableList<Node> children = tracker.track(fn, 5).root().children();
    assertThat(children).hasSize(5);
    Node.Jump jump = (Node.Jump) children.get(2);
    assertThat(jump.condition()).isEqualTo(TapeValue.constant(true));
    assertThat(jump.isConditional()).isTrue();
    assertThat(children.get(3).value()).isEqualTo(5);
  }

  @Test
  public void fallthroughIsRecordedAsUnconditionalJump() {
    Node.NestedCall root = tracker.track(SamplePrograms.ABS, 7).root();
    ImmutableList<Node> children = root.children();
    assertThat(children).hasSize(5);
    Node.Jump jump = (Node.Jump) children.get(3);
    assertThat(jump.target()).isEqualTo(2);
    assertThat(jump.isConditional()).isFalse();
    assertThat(jump.location()).isEqualTo(new BranchIndex(1, 2));
    assertThat(jump.ir().elementAt(jump.location())).isNull();
    assertThat(Dependencies.referenced(children.get(4))).containsExactly(children.get(1));
  }

  @Test
  public void loopReferencesBindToCurrentIteration() {
    Node.NestedCall root = tracker.track(SamplePrograms.SUM_BELOW, 3).root();
    assertThat(root.value()).isEqualTo(3);
    assertThat(root.children()).hasSize(8 * 3 + 10);
    // Each iteration records 8 nodes, starting with the jump into block 2 at position 3.
    for (int i = 0; i < 3; i++) {
      int start = 3 + 8 * i;
      Node.Jump entry = (Node.Jump) root.child(start);
      assertThat(entry.target()).isEqualTo(2);
      Node.Argument counter = (Node.Argument) root.child(start + 1);
      assertThat(counter.value()).isEqualTo(i);
      assertThat(counter.originatingBranch()).isSameInstanceAs(entry);
      Node.PrimitiveCall sum = (Node.PrimitiveCall) root.child(start + 6);
      assertThat(Dependencies.referenced(sum))
          .containsExactly(root.child(start + 2), counter)
          .inOrder();
    }
    Node.Jump exit = (Node.Jump) root.child(8 * 3 + 10 - 2);
    assertThat(exit.target()).isEqualTo(4);
    assertThat(exit.resolve(exit.arguments().get(0))).isSameInstanceAs(root.child(8 * 3 + 5));
  }

  @Test
  public void nestedCalls() {
    Traced traced = tracker.track(SamplePrograms.ADD_TWO, 3);
    Node.NestedCall root = traced.root();
    assertThat(traced.value()).isEqualTo(5);
    assertThat(root.children()).hasSize(5);
    Node.NestedCall first = (Node.NestedCall) root.child(3);
    Node.NestedCall second = (Node.NestedCall) root.child(4);
    assertThat(first.value()).isEqualTo(4);
    assertThat(first.calleeIr()).isSameInstanceAs(SamplePrograms.INCREMENT.ir());
    assertThat(first.children()).hasSize(4);
    assertThat(first.child(2).value()).isEqualTo(3);
    assertThat(first.child(3).value()).isEqualTo(4);
    assertThat(first.child(3).parent()).isSameInstanceAs(first);
    assertThat(second.child(2).value()).isEqualTo(4);
    assertThat(Dependencies.referenced(second)).containsExactly(first);

    ImmutableList<Node> descendants = Query.query(root, Axis.DESCENDANT);
    assertThat(descendants).hasSize(5 + 4 + 4);
    assertThat(descendants).containsAtLeastElementsIn(first.children());
    assertThat(descendants).containsAtLeastElementsIn(second.children());
  }

  @Test
  public void recursion() {
    Node.NestedCall root = tracker.track(SamplePrograms.FACTORIAL, 3).root();
    assertThat(root.value()).isEqualTo(6);
    int depth = 0;
    for (Node.NestedCall call = root; call != null; depth++) {
      Node.NestedCall next = null;
      for (Node child : call.children()) {
        if (child instanceof Node.NestedCall nested) {
          next = nested;
        }
      }
      call = next;
    }
    assertThat(depth).isEqualTo(3);
  }

  @Test
  public void primitivePolicy() {
    Tracker shallow =
        Tracker.builder().setPrimitivePolicy(fn -> fn == SamplePrograms.INCREMENT).build();
    Node.NestedCall root = shallow.track(SamplePrograms.ADD_TWO, 3).root();
    assertThat(root.child(3)).isInstanceOf(Node.PrimitiveCall.class);
    assertThat(root.child(3).value()).isEqualTo(4);
    assertThat(root.child(4)).isInstanceOf(Node.PrimitiveCall.class);
    assertThat(Query.query(root, Axis.DESCENDANT)).hasSize(5);
  }

  @Test
  public void policyFailureIsDispatchError() {
    RuntimeException cause = new IllegalStateException("no");
    Tracker failing =
        Tracker.builder()
            .setPrimitivePolicy(
                fn -> {
                  throw cause;
                })
            .build();
    TrackingException e =
        assertThrows(TrackingException.class, () -> failing.track(SamplePrograms.ADD_TWO, 3));
    assertThat(e.kind()).isEqualTo(TrackingException.Kind.DISPATCH);
    assertThat(e).hasCauseThat().isSameInstanceAs(cause);
  }

  /** Returns a function whose block 1 is a jump target, which can't be instrumented. */
  private static IrFunction uninstrumentable() {
    IrBuilder ib = new IrBuilder();
    int b2 = ib.newBlock();
    Variable self = ib.argument();
    Variable x = ib.argument();
    ib.jumpIf(ib.call(Primitives.LESS_THAN, x, 0), b2);
    ib.ret(x);
    ib.setBlock(b2);
    ib.jump(1, self, 0);
    return new IrFunction("uninstrumentable", ib.build());
  }

  @Test
  public void instrumentationFailures() {
    IrFunction bad = uninstrumentable();
    TrackingException e = assertThrows(TrackingException.class, () -> tracker.track(bad, 1));
    assertThat(e.kind()).isEqualTo(TrackingException.Kind.TRANSFORMATION);

    IrBuilder ib = new IrBuilder();
    ib.argument();
    ib.ret(ib.call(bad, ib.argument()));
    IrFunction caller = new IrFunction("caller", ib.build());
    e = assertThrows(TrackingException.class, () -> tracker.track(caller, 1));
    assertThat(e.kind()).isEqualTo(TrackingException.Kind.DISPATCH);
    assertThat(e).hasCauseThat().isInstanceOf(TrackingException.class);

    // Recording it as a primitive avoids instrumenting it.
    Tracker shallow = Tracker.builder().setPrimitivePolicy(fn -> fn == bad).build();
    assertThat(shallow.track(caller, -1).value()).isEqualTo(0);
  }

  @Test
  public void programErrorsPropagate() {
    assertThrows(IrException.class, () -> tracker.track(SamplePrograms.ADD_TWO, "x"));
    assertThrows(IrException.class, () -> tracker.track(SamplePrograms.INCREMENT, 1, 2));
  }

  @Test
  public void specialForms() {
    Traced traced = tracker.track(SamplePrograms.SECOND, "a", "b");
    assertThat(traced.value()).isEqualTo("b");
    Node.NestedCall root = traced.root();
    assertThat(root.child(4)).isInstanceOf(Node.Constant.class);
    assertThat(root.child(4).value()).isEqualTo("pair");
    Node.SpecialCall tuple = (Node.SpecialCall) root.child(5);
    assertThat(tuple.head()).isEqualTo("tuple");
    assertThat(tuple.value()).isEqualTo(List.of("a", "b", "pair"));
    assertThat(Dependencies.referenced(tuple))
        .containsExactly(root.child(2), root.child(3), root.child(4))
        .inOrder();
    Node.SpecialCall getIndex = (Node.SpecialCall) root.child(6);
    assertThat(getIndex.value()).isEqualTo("b");
    assertThat(Dependencies.referenced(getIndex)).containsExactly(tuple);
  }

  @Test
  public void cachesInstrumentedIr() {
    Tracker verbose = Tracker.builder().setVerbose(true).build();
    assertThat(verbose.listing(SamplePrograms.ADD_TWO.ir())).isNull();
    verbose.track(SamplePrograms.ADD_TWO, 1);
    assertThat(verbose.instrumented(SamplePrograms.INCREMENT.ir()))
        .isSameInstanceAs(verbose.instrumented(SamplePrograms.INCREMENT.ir()));
    assertThat(verbose.listing(SamplePrograms.ADD_TWO.ir())).contains("RECORD_CALL");
    assertThat(verbose.listing(SamplePrograms.INCREMENT.ir())).contains("FINISH");
    assertThat(tracker.listing(SamplePrograms.INCREMENT.ir())).isNull();
  }

  @Test
  public void sharedBetweenThreads() {
    List<Object> results =
        IntStream.range(0, 64)
            .parallel()
            .mapToObj(i -> tracker.track(SamplePrograms.SUM_BELOW, i % 8).value())
            .toList();
    for (int i = 0; i < 64; i++) {
      int n = i % 8;
      assertThat(results.get(i)).isEqualTo(n * (n - 1) / 2);
    }
  }
}
