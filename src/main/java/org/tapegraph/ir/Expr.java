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
import org.jspecify.annotations.Nullable;
import org.tapegraph.util.StringUtil;

/**
 * The right hand side of a {@link Statement}. There are exactly three implementations: {@link
 * Call}, {@link Special}, and {@link Literal}.
 */
public sealed interface Expr {

  /** Returns the operands this expression reads; empty for a {@link Literal}. */
  ImmutableList<Operand> operands();

  /** A call of {@code callee} with {@code args}. */
  record Call(Operand callee, ImmutableList<Operand> args) implements Expr {
    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.<Operand>builder().add(callee).addAll(args).build();
    }

    @Override
    public String toString() {
      return callee + StringUtil.joinElements("(", ")", args);
    }
  }

  /**
   * A non-call form, identified by its head (e.g. {@code "new"}, {@code "boundscheck"}); evaluated
   * by the {@link SpecialForms} registered for that head.
   */
  record Special(String head, ImmutableList<Operand> args) implements Expr {
    @Override
    public ImmutableList<Operand> operands() {
      return args;
    }

    @Override
    public String toString() {
      return "$" + head + StringUtil.joinElements("(", ")", args);
    }
  }

  /** A literal or global that evaluates to itself. */
  record Literal(@Nullable Object value) implements Expr {
    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return StringUtil.literal(value);
    }
  }
}
