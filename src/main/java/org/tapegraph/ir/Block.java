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

import com.google.common.collect.ImmutableList;
import org.tapegraph.ir.Branch.Jump;
import org.tapegraph.ir.Operand.Variable;
import org.tapegraph.util.StringUtil;

/**
 * A basic block: a sequence of statements that is entered only at the top (binding its
 * arguments) and left only through one of its branches (or by falling through to the next block).
 */
public final class Block {
  private final int id;
  private final ImmutableList<Variable> arguments;
  private final ImmutableList<Statement> statements;
  private final ImmutableList<Branch> branches;

  Block(
      int id,
      ImmutableList<Variable> arguments,
      ImmutableList<Statement> statements,
      ImmutableList<Branch> branches) {
    this.id = id;
    this.arguments = arguments;
    this.statements = statements;
    this.branches = branches;
  }

  /** The index of this block in its {@link Ir}, starting from 1. */
  public int id() {
    return id;
  }

  public ImmutableList<Variable> arguments() {
    return arguments;
  }

  public ImmutableList<Statement> statements() {
    return statements;
  }

  public ImmutableList<Branch> branches() {
    return branches;
  }

  /**
   * True if control can reach the end of this block without any branch being taken, i.e. if it
   * has no branches or its last branch is a conditional jump. Control then continues with block
   * {@code id() + 1}.
   */
  public boolean fallsThrough() {
    if (branches.isEmpty()) {
      return true;
    }
    return branches.get(branches.size() - 1) instanceof Jump jump && jump.isConditional();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(id).append(":");
    if (!arguments.isEmpty()) {
      sb.append(StringUtil.joinElements(" (", ")", arguments));
    }
    sb.append("\n");
    for (Statement statement : statements) {
      sb.append("  ").append(statement).append("\n");
    }
    for (Branch branch : branches) {
      sb.append("  ").append(branch).append("\n");
    }
    return sb.toString();
  }
}
