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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Branch.Jump;
import org.tapegraph.ir.Branch.Return;
import org.tapegraph.ir.Operand.Variable;

/**
 * An IrBuilder is used to assemble a single {@link Ir}. The lifecycle of an IrBuilder is
 *
 * <ul>
 *   <li>Create the blocks with {@link #newBlock} (block 1 exists from the start and is the initial
 *       current block).
 *   <li>For each block, make it current with {@link #setBlock} and add its arguments, then its
 *       statements, then its branches.
 *   <li>Call {@link #build} to check the result and get the Ir.
 * </ul>
 *
 * <p>Methods that take operands accept either {@link Operand}s or arbitrary values; anything that
 * isn't an Operand (including null) is treated as a constant.
 */
public class IrBuilder {

  private final List<BlockBuilder> blocks = new ArrayList<>();

  /** Variable ids are assigned sequentially, across all blocks. */
  private int nextVariable = 1;

  private BlockBuilder current;

  public IrBuilder() {
    newBlock();
    current = blocks.get(0);
  }

  /** Adds a new, empty block and returns its id. Does not change the current block. */
  public int newBlock() {
    blocks.add(new BlockBuilder(blocks.size() + 1));
    return blocks.size();
  }

  /** Subsequent arguments, statements, and branches will be added to the specified block. */
  @CanIgnoreReturnValue
  public IrBuilder setBlock(int id) {
    Preconditions.checkElementIndex(id - 1, blocks.size(), "block id");
    current = blocks.get(id - 1);
    return this;
  }

  public int numBlocks() {
    return blocks.size();
  }

  /** Adds an argument to the current block; must be called before any statements are added. */
  public Variable argument() {
    Preconditions.checkState(
        current.statements.isEmpty() && current.branches.isEmpty(),
        "Arguments must be added to block %s before its statements",
        current.id);
    Variable v = newVariable();
    current.arguments.add(v);
    return v;
  }

  /** Adds a statement to the current block and returns the variable it defines. */
  @CanIgnoreReturnValue
  public Variable add(Expr expr) {
    Preconditions.checkState(
        current.branches.isEmpty(),
        "Statements must be added to block %s before its branches",
        current.id);
    Variable v = newVariable();
    current.statements.add(new Statement(v, expr));
    return v;
  }

  /** Adds a call statement to the current block. */
  @CanIgnoreReturnValue
  public Variable call(@Nullable Object callee, @Nullable Object... args) {
    return add(new Expr.Call(Operand.of(callee), operands(args)));
  }

  /** Adds a special-form statement to the current block. */
  @CanIgnoreReturnValue
  public Variable special(String head, @Nullable Object... args) {
    return add(new Expr.Special(head, operands(args)));
  }

  /** Adds a literal statement to the current block. */
  @CanIgnoreReturnValue
  public Variable literal(@Nullable Object value) {
    return add(new Expr.Literal(value));
  }

  /** Adds a branch to the current block. */
  public void add(Branch branch) {
    if (!current.branches.isEmpty()) {
      Branch last = current.branches.get(current.branches.size() - 1);
      Preconditions.checkState(
          last instanceof Jump jump && jump.isConditional(),
          "Block %s already ends with %s",
          current.id,
          last);
    }
    current.branches.add(branch);
  }

  /** Adds an unconditional jump to the current block. */
  public void jump(int target, @Nullable Object... args) {
    add(new Jump(target, operands(args), null));
  }

  /** Adds a jump to the current block that is only taken if {@code condition} is true. */
  public void jumpIf(@Nullable Object condition, int target, @Nullable Object... args) {
    add(new Jump(target, operands(args), Operand.of(condition)));
  }

  /** Adds a return to the current block. */
  public void ret(@Nullable Object value) {
    add(new Return(Operand.of(value)));
  }

  /** Returns the completed Ir; throws an {@link IrException} if it is not well formed. */
  public Ir build() {
    return new Ir(blocks.stream().map(BlockBuilder::build).collect(toImmutableList()));
  }

  private Variable newVariable() {
    return new Variable(nextVariable++);
  }

  private static ImmutableList<Operand> operands(@Nullable Object[] args) {
    return Arrays.stream(args).map(Operand::of).collect(toImmutableList());
  }

  private static class BlockBuilder {
    final int id;
    final List<Variable> arguments = new ArrayList<>();
    final List<Statement> statements = new ArrayList<>();
    final List<Branch> branches = new ArrayList<>();

    BlockBuilder(int id) {
      this.id = id;
    }

    Block build() {
      return new Block(
          id,
          ImmutableList.copyOf(arguments),
          ImmutableList.copyOf(statements),
          ImmutableList.copyOf(branches));
    }
  }
}
