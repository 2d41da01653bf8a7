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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Branch.Jump;
import org.tapegraph.ir.Branch.Return;
import org.tapegraph.ir.Location.BranchIndex;
import org.tapegraph.ir.Location.VarIndex;
import org.tapegraph.ir.Operand.Variable;

/**
 * The control-flow graph of a single function: blocks numbered from 1, with execution starting at
 * block 1. Irs are immutable; use an {@link IrBuilder} to create one.
 *
 * <p>Irs compare by identity, so that they can be used as keys when caching derived IR.
 */
public final class Ir {
  private final ImmutableList<Block> blocks;

  /** Creates a new Ir; throws an {@link IrException} if the given blocks are not well formed. */
  Ir(ImmutableList<Block> blocks) {
    this.blocks = blocks;
    validate();
  }

  public int numBlocks() {
    return blocks.size();
  }

  /** Returns the block with the given id; ids start at 1. */
  public Block block(int id) {
    Preconditions.checkElementIndex(id - 1, blocks.size(), "block id");
    return blocks.get(id - 1);
  }

  public ImmutableList<Block> blocks() {
    return blocks;
  }

  /**
   * Returns the element named by {@code location}: a {@link Variable} for a block argument, a
   * {@link Statement}, or a {@link Branch}. Returns null if there is no such element (e.g. the
   * location of a fallthrough that was made explicit by instrumentation).
   */
  public @Nullable Object elementAt(Location location) {
    if (location.block() > blocks.size()) {
      return null;
    }
    Block block = block(location.block());
    if (location instanceof BranchIndex branchIndex) {
      int i = branchIndex.ordinal() - 1;
      return (i < block.branches().size()) ? block.branches().get(i) : null;
    }
    int id = ((VarIndex) location).variable();
    for (Variable arg : block.arguments()) {
      if (arg.id() == id) {
        return arg;
      }
    }
    for (Statement statement : block.statements()) {
      if (statement.result().id() == id) {
        return statement;
      }
    }
    return null;
  }

  /**
   * Checks that branch targets exist, that the last block doesn't fall through, and that each
   * variable is defined exactly once and every variable used is defined somewhere.
   */
  private void validate() {
    if (blocks.isEmpty()) {
      throw new IrException("IR must have at least one block");
    }
    Set<Variable> defined = new HashSet<>();
    for (Block block : blocks) {
      for (Variable arg : block.arguments()) {
        define(defined, arg, block);
      }
      for (Statement statement : block.statements()) {
        define(defined, statement.result(), block);
      }
    }
    for (Block block : blocks) {
      for (Statement statement : block.statements()) {
        checkDefined(defined, statement.expr().operands(), block);
      }
      for (Branch branch : block.branches()) {
        if (branch instanceof Jump jump) {
          if (jump.target() > blocks.size()) {
            throw new IrException(
                String.format("Block %s jumps to nonexistent block %s", block.id(), jump.target()));
          }
          checkDefined(defined, jump.args(), block);
          if (jump.condition() != null) {
            checkDefined(defined, ImmutableList.of(jump.condition()), block);
          }
        } else {
          checkDefined(defined, ImmutableList.of(((Return) branch).value()), block);
        }
      }
    }
    if (blocks.get(blocks.size() - 1).fallsThrough()) {
      throw new IrException("Last block (" + blocks.size() + ") falls through");
    }
  }

  private static void define(Set<Variable> defined, Variable v, Block block) {
    if (!defined.add(v)) {
      throw new IrException(
          String.format("%s is defined more than once (in block %s)", v, block.id()));
    }
  }

  private static void checkDefined(
      Set<Variable> defined, ImmutableList<Operand> operands, Block block) {
    for (Operand operand : operands) {
      if (operand instanceof Variable v && !defined.contains(v)) {
        throw new IrException(
            String.format("%s is used in block %s but never defined", v, block.id()));
      }
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    blocks.forEach(sb::append);
    return sb.toString();
  }
}
