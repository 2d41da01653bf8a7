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
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Ir;
import org.tapegraph.ir.Location;
import org.tapegraph.trace.TrackingException.Kind;

/**
 * Accumulates the nodes recorded during one execution of an instrumented function.
 *
 * <p>A Recorder is created at the start of each execution and used by a single thread. Its
 * lifecycle is
 *
 * <ul>
 *   <li>one call to {@link #record} for each argument, statement, and branch executed, in
 *       execution order; then
 *   <li>one call to {@link #finish}, which returns the completed {@link Tape}.
 * </ul>
 */
public final class Recorder {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Ir ir;
  private final CallDispatcher dispatcher;
  private final List<Node> children = new ArrayList<>();

  /**
   * For each location that has been recorded, the position of the node most recently recorded
   * there.
   */
  private final Map<Location, Integer> positions = new HashMap<>();

  private boolean finished;

  /**
   * Creates a Recorder for an execution of {@code ir} (the original, uninstrumented IR); nested
   * calls will be made through {@code dispatcher}.
   */
  public Recorder(Ir ir, CallDispatcher dispatcher) {
    this.ir = ir;
    this.dispatcher = dispatcher;
  }

  public Ir ir() {
    return ir;
  }

  /** The number of nodes recorded so far. */
  public int size() {
    return children.size();
  }

  /**
   * Records a new node as described; for a call, this is also where the call is made (through
   * the CallDispatcher). Returns the new node.
   *
   * <p>Exceptions thrown by the callee of a call are propagated unchanged, and nothing is recorded.
   */
  public Node record(Description description) {
    if (finished) {
      throw new TrackingException(
          Kind.INTERNAL, "Recording " + description.location() + " after finish()");
    }
    NodeInfo info = new NodeInfo(description.location(), children.size() + 1);
    Node node;
    if (description instanceof Description.Constant c) {
      node = new Node.Constant(info, TapeValue.constant(c.value()));
    } else if (description instanceof Description.Argument arg) {
      if (arg.branch() > children.size()
          || (arg.branch() != 0 && !(children.get(arg.branch() - 1) instanceof Node.Jump))) {
        throw new TrackingException(
            Kind.INTERNAL, "Argument at " + arg.location() + " has no branch " + arg.branch());
      }
      node = new Node.Argument(info, TapeValue.constant(arg.value()), arg.branch(), arg.number());
    } else if (description instanceof Description.Call call) {
      node = recordCall(info, call);
    } else if (description instanceof Description.Special special) {
      node = new Node.SpecialCall(info, special.head(), bind(special.argReprs()), special.value());
    } else if (description instanceof Description.Jump jump) {
      node =
          new Node.Jump(
              info,
              jump.target(),
              bind(jump.argReprs()),
              bind(jump.condition()),
              jump.conditional());
    } else if (description instanceof Description.Return ret) {
      node = new Node.Return(info, bind(ret.argRepr()));
    } else {
      throw new TrackingException(Kind.INTERNAL, "Unexpected description " + description);
    }
    children.add(node);
    positions.put(description.location(), info.position());
    logger.atFinest().log("Recorded %s", node);
    return node;
  }

  private Node recordCall(NodeInfo info, Description.Call call) {
    TapeValue callee = bind(call.calleeRepr());
    ImmutableList<TapeValue> args = bind(call.argReprs());
    boolean isPrimitive;
    try {
      isPrimitive = dispatcher.isPrimitive(call.callee(), call.args());
    } catch (TrackingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TrackingException(
          Kind.DISPATCH, "Unable to classify call at " + call.location(), e);
    }
    if (isPrimitive) {
      Object value = dispatcher.callPrimitive(call.callee(), call.args());
      return new Node.PrimitiveCall(info, callee, args, value);
    }
    Tape tape = dispatcher.callNested(call.callee(), call.args());
    return new Node.NestedCall(info, callee, args, tape);
  }

  /**
   * Returns the Tape of everything recorded. No further calls to {@link #record} are allowed.
   */
  public Tape finish(@Nullable Object value) {
    if (finished) {
      throw new TrackingException(Kind.INTERNAL, "finish() called twice");
    }
    finished = true;
    return new Tape(value, ImmutableList.copyOf(children), ir);
  }

  private ImmutableList<TapeValue> bind(ImmutableList<TapeValue> values) {
    return values.stream().map(this::bind).collect(toImmutableList());
  }

  /**
   * If {@code value} is an unbound Reference, returns a copy bound to the node most recently
   * recorded at its location; otherwise returns it unchanged.
   */
  private TapeValue bind(TapeValue value) {
    if (value instanceof TapeValue.Reference ref && !ref.isBound()) {
      Integer position = positions.get(ref.location());
      if (position == null) {
        throw new TrackingException(
            Kind.INTERNAL, "Reference to " + ref.location() + ", which has not been recorded");
      }
      return ref.bind(position);
    }
    return value;
  }
}
