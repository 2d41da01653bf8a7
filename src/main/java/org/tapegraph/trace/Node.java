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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Ir;
import org.tapegraph.ir.Location;
import org.tapegraph.util.StringUtil;

/**
 * One recorded element of a trace. There are exactly seven subclasses, all defined in this file:
 *
 * <ul>
 *   <li>Data flow: {@link Constant}, {@link Argument}, {@link PrimitiveCall}, {@link NestedCall},
 *       and {@link SpecialCall}.
 *   <li>Control flow: {@link Return} and {@link Jump}.
 * </ul>
 *
 * <p>Only a NestedCall has children; it is also the only possible parent, and the root of every
 * trace is a NestedCall. A node's children are in execution order, so a {@link TapeValue.Reference}
 * in a node's payload always refers to one of its preceding siblings.
 *
 * <p>Nodes compare by identity.
 */
public abstract sealed class Node
    permits Node.Constant,
        Node.Argument,
        Node.PrimitiveCall,
        Node.NestedCall,
        Node.SpecialCall,
        Node.Return,
        Node.Jump {

  private final NodeInfo info;

  private Node(NodeInfo info) {
    this.info = info;
  }

  public final NodeInfo info() {
    return info;
  }

  /** See {@link NodeInfo#location}. */
  public final @Nullable Location location() {
    return info.location();
  }

  /** See {@link NodeInfo#position}. */
  public final int position() {
    return info.position();
  }

  /** See {@link NodeInfo#parent}. */
  public final @Nullable NestedCall parent() {
    return info.parent();
  }

  /** Returns this node's children; empty for everything except a {@link NestedCall}. */
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  /**
   * Returns the value recorded for this node: the result of a call, the value of a constant or an
   * argument. Null for control flow nodes.
   */
  public @Nullable Object value() {
    return null;
  }

  /**
   * Returns every TapeValue in this node's payload (callee, arguments, condition, ...), in order.
   * Does not include the payloads of children.
   */
  public abstract ImmutableList<TapeValue> operands();

  /** A short name for this kind of node, used when printing. */
  public abstract String kind();

  /**
   * Returns the IR this node was recorded from, i.e. the IR of the function whose execution
   * recorded it. {@code ir().elementAt(location())} returns the argument, statement, or branch
   * that produced this node. Null for a trace root.
   */
  public final @Nullable Ir ir() {
    NestedCall parent = parent();
    return (parent == null) ? null : parent.calleeIr();
  }

  /**
   * Returns the sibling node that {@code value} refers to, or null if it is a Constant (or if this
   * node has no parent to resolve against).
   */
  public final @Nullable Node resolve(TapeValue value) {
    NestedCall parent = parent();
    if (parent == null
        || !(value instanceof TapeValue.Reference ref)
        || !ref.isBound()
        || ref.target() > parent.children().size()) {
      return null;
    }
    return parent.child(ref.target());
  }

  /** Returns the metadata value for {@code key}, or null if none has been set. */
  public final @Nullable Object getMetadata(String key) {
    return info.getMetadata(key);
  }

  /** Sets the metadata value for {@code key}. */
  public final void setMetadata(String key, Object value) {
    info.setMetadata(key, value);
  }

  /** Returns a description of this node's payload, without its position or kind. */
  abstract String payloadToString();

  @Override
  public String toString() {
    String loc = (location() == null) ? "" : " " + location();
    return "⟨" + position() + "⟩ " + kind() + loc + " " + payloadToString();
  }

  private static String call(TapeValue callee, ImmutableList<TapeValue> args) {
    return callee + StringUtil.joinElements("(", ")", args);
  }

  private static String result(@Nullable Object value) {
    return " → " + StringUtil.literal(value);
  }

  /** A literal or global. */
  public static final class Constant extends Node {
    private final TapeValue.Constant constant;

    Constant(NodeInfo info, TapeValue.Constant constant) {
      super(info);
      this.constant = constant;
    }

    public TapeValue.Constant constant() {
      return constant;
    }

    @Override
    public @Nullable Object value() {
      return constant.value();
    }

    @Override
    public ImmutableList<TapeValue> operands() {
      return ImmutableList.of(constant);
    }

    @Override
    public String kind() {
      return "Constant";
    }

    @Override
    String payloadToString() {
      return constant.toString();
    }
  }

  /**
   * A block argument, or (as a special case) a function argument. For the arguments of block 1,
   * {@code number} 1 is the function being called and the function's own arguments start at 2.
   */
  public static final class Argument extends Node {
    private final TapeValue.Constant argValue;
    private final int branch;
    private final int number;

    Argument(NodeInfo info, TapeValue.Constant argValue, int branch, int number) {
      super(info);
      Preconditions.checkArgument(branch >= 0 && branch < info.position() && number > 0);
      this.argValue = argValue;
      this.branch = branch;
      this.number = number;
    }

    /** The value of the argument when it was recorded. */
    public TapeValue.Constant argValue() {
      return argValue;
    }

    @Override
    public @Nullable Object value() {
      return argValue.value();
    }

    /** The (1-based) index of this argument among its block's arguments. */
    public int number() {
      return number;
    }

    /**
     * The position of the {@link Jump} that transferred control to this argument's block, or 0 for
     * function arguments.
     */
    public int branchPosition() {
      return branch;
    }

    /**
     * Returns the Jump that transferred control to this argument's block, or null if this is a
     * function argument.
     */
    public @Nullable Jump originatingBranch() {
      NestedCall parent = parent();
      return (branch == 0 || parent == null) ? null : (Jump) parent.child(branch);
    }

    @Override
    public ImmutableList<TapeValue> operands() {
      return ImmutableList.of(argValue);
    }

    @Override
    public String kind() {
      return "Argument";
    }

    @Override
    String payloadToString() {
      String from = (branch == 0) ? "" : " from ⟨" + branch + "⟩";
      return "#" + number + " = " + argValue + from;
    }
  }

  /** A call that was recorded as a single step, without tracing its execution. */
  public static final class PrimitiveCall extends Node {
    private final TapeValue callee;
    private final ImmutableList<TapeValue> arguments;
    private final @Nullable Object value;

    PrimitiveCall(
        NodeInfo info,
        TapeValue callee,
        ImmutableList<TapeValue> arguments,
        @Nullable Object value) {
      super(info);
      this.callee = callee;
      this.arguments = arguments;
      this.value = value;
    }

    public TapeValue callee() {
      return callee;
    }

    public ImmutableList<TapeValue> arguments() {
      return arguments;
    }

    @Override
    public @Nullable Object value() {
      return value;
    }

    @Override
    public ImmutableList<TapeValue> operands() {
      return ImmutableList.<TapeValue>builder().add(callee).addAll(arguments).build();
    }

    @Override
    public String kind() {
      return "PrimitiveCall";
    }

    @Override
    String payloadToString() {
      return call(callee, arguments) + result(value);
    }
  }

  /**
   * A call whose execution was itself traced; its children are the callee's arguments,
   * statements, and branches, in the order they were executed, ending with a {@link Return}.
   */
  public static final class NestedCall extends Node {
    private final TapeValue callee;
    private final ImmutableList<TapeValue> arguments;
    private final ImmutableList<Node> children;
    private final @Nullable Object value;
    private final @Nullable Ir calleeIr;

    NestedCall(
        NodeInfo info,
        TapeValue callee,
        ImmutableList<TapeValue> arguments,
        Tape tape) {
      super(info);
      this.callee = callee;
      this.arguments = arguments;
      this.children = tape.children();
      this.value = tape.value();
      this.calleeIr = tape.ir();
      for (int i = 0; i < children.size(); i++) {
        Node child = children.get(i);
        Preconditions.checkArgument(child.position() == i + 1, "Misplaced child %s", child);
        child.info().attach(this);
      }
    }

    public TapeValue callee() {
      return callee;
    }

    public ImmutableList<TapeValue> arguments() {
      return arguments;
    }

    @Override
    public ImmutableList<Node> children() {
      return children;
    }

    /** Returns the child at the given position; positions start at 1. */
    public Node child(int position) {
      Preconditions.checkElementIndex(position - 1, children.size(), "position");
      return children.get(position - 1);
    }

    /** Returns the {@link Argument} children of this call. */
    public ImmutableList<Argument> argumentNodes() {
      return children.stream()
          .filter(child -> child instanceof Argument)
          .map(child -> (Argument) child)
          .collect(toImmutableList());
    }

    /** The IR of the callee, from which the children were recorded. */
    public @Nullable Ir calleeIr() {
      return calleeIr;
    }

    @Override
    public @Nullable Object value() {
      return value;
    }

    @Override
    public ImmutableList<TapeValue> operands() {
      return ImmutableList.<TapeValue>builder().add(callee).addAll(arguments).build();
    }

    @Override
    public String kind() {
      return "NestedCall";
    }

    @Override
    String payloadToString() {
      return call(callee, arguments) + result(value) + " [" + children.size() + " children]";
    }
  }

  /** A non-call form (see {@link org.tapegraph.ir.Expr.Special}). */
  public static final class SpecialCall extends Node {
    private final String head;
    private final ImmutableList<TapeValue> arguments;
    private final @Nullable Object value;

    SpecialCall(
        NodeInfo info, String head, ImmutableList<TapeValue> arguments, @Nullable Object value) {
      super(info);
      this.head = head;
      this.arguments = arguments;
      this.value = value;
    }

    public String head() {
      return head;
    }

    public ImmutableList<TapeValue> arguments() {
      return arguments;
    }

    @Override
    public @Nullable Object value() {
      return value;
    }

    @Override
    public ImmutableList<TapeValue> operands() {
      return arguments;
    }

    @Override
    public String kind() {
      return "SpecialCall";
    }

    @Override
    String payloadToString() {
      return "$" + head + StringUtil.joinElements("(", ")", arguments) + result(value);
    }
  }

  /** The return that ended a traced call; always the last child of its parent. */
  public static final class Return extends Node {
    private final TapeValue argument;

    Return(NodeInfo info, TapeValue argument) {
      super(info);
      this.argument = argument;
    }

    public TapeValue argument() {
      return argument;
    }

    @Override
    public ImmutableList<TapeValue> operands() {
      return ImmutableList.of(argument);
    }

    @Override
    public String kind() {
      return "Return";
    }

    @Override
    String payloadToString() {
      return argument.toString();
    }
  }

  /**
   * A jump that was taken. {@code condition} is {@code Constant(true)} for an unconditional jump
   * (including a fallthrough); otherwise it is the (true) condition that caused the jump. Whether
   * the jump was conditional is recorded separately, since a conditional jump's condition may be
   * the constant {@code true}.
   */
  public static final class Jump extends Node {
    private final int target;
    private final ImmutableList<TapeValue> arguments;
    private final TapeValue condition;
    private final boolean conditional;

    Jump(
        NodeInfo info,
        int target,
        ImmutableList<TapeValue> arguments,
        TapeValue condition,
        boolean conditional) {
      super(info);
      this.target = target;
      this.arguments = arguments;
      this.condition = condition;
      this.conditional = conditional;
    }

    /** The id of the block jumped to. */
    public int target() {
      return target;
    }

    public ImmutableList<TapeValue> arguments() {
      return arguments;
    }

    public TapeValue condition() {
      return condition;
    }

    public boolean isConditional() {
      return conditional;
    }

    @Override
    public ImmutableList<TapeValue> operands() {
      return ImmutableList.<TapeValue>builder().addAll(arguments).add(condition).build();
    }

    @Override
    public String kind() {
      return "Jump";
    }

    @Override
    String payloadToString() {
      String result = "br " + target;
      if (!arguments.isEmpty()) {
        result += StringUtil.joinElements(" (", ")", arguments);
      }
      return isConditional() ? result + " if " + condition : result;
    }
  }
}
