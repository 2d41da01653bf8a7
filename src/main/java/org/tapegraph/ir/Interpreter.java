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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Branch.Jump;
import org.tapegraph.ir.Branch.Return;
import org.tapegraph.ir.Operand.Const;
import org.tapegraph.ir.Operand.Variable;

/**
 * Executes {@link Ir}. Interpreters are stateless (apart from their {@link SpecialForms}) and may
 * be shared between threads.
 */
public class Interpreter {
  private final SpecialForms specialForms;

  public Interpreter(SpecialForms specialForms) {
    this.specialForms = specialForms;
  }

  public Interpreter() {
    this(SpecialForms.DEFAULT);
  }

  public SpecialForms specialForms() {
    return specialForms;
  }

  /**
   * Calls {@code callee} with the given arguments. An {@link IrFunction} is run (with itself
   * prepended to the arguments), a {@link Primitive} is applied; anything else is an error.
   */
  public @Nullable Object call(@Nullable Object callee, List<@Nullable Object> args) {
    if (callee instanceof IrFunction fn) {
      fn.checkArguments(args);
      return run(fn.ir(), withCallee(fn, args));
    } else if (callee instanceof Primitive primitive) {
      return primitive.apply(Collections.unmodifiableList(args));
    }
    throw new IrException("Not callable: " + callee);
  }

  /**
   * Returns a new list containing {@code callee} followed by {@code args}; this is the argument
   * list for block 1 of an {@link IrFunction}.
   */
  public static List<@Nullable Object> withCallee(
      @Nullable Object callee, List<@Nullable Object> args) {
    List<@Nullable Object> result = new ArrayList<>(args.size() + 1);
    result.add(callee);
    result.addAll(args);
    return result;
  }

  /**
   * Executes {@code ir} starting at block 1, with {@code args} as block 1's arguments, and returns
   * the value of the first return branch taken.
   */
  public @Nullable Object run(Ir ir, List<@Nullable Object> args) {
    // Variables are unique across the whole Ir, so a single map serves as the environment for
    // every block.
    Map<Variable, @Nullable Object> env = new HashMap<>();
    Block block = ir.block(1);
    List<@Nullable Object> blockArgs = args;
    for (; ; ) {
      if (blockArgs.size() != block.arguments().size()) {
        throw new IrException(
            String.format(
                "Block %s expects %s arguments, got %s",
                block.id(), block.arguments().size(), blockArgs.size()));
      }
      for (int i = 0; i < blockArgs.size(); i++) {
        env.put(block.arguments().get(i), blockArgs.get(i));
      }
      for (Statement statement : block.statements()) {
        env.put(statement.result(), evaluate(statement.expr(), env));
      }
      Jump taken = null;
      for (Branch branch : block.branches()) {
        if (branch instanceof Return ret) {
          return value(ret.value(), env);
        }
        Jump jump = (Jump) branch;
        if (jump.condition() == null || isTrue(value(jump.condition(), env), block)) {
          taken = jump;
          break;
        }
      }
      if (taken != null) {
        blockArgs = values(taken.args(), env);
        block = ir.block(taken.target());
      } else {
        // The last block can't fall through (see Ir.validate()).
        blockArgs = List.of();
        block = ir.block(block.id() + 1);
      }
    }
  }

  private @Nullable Object evaluate(Expr expr, Map<Variable, @Nullable Object> env) {
    if (expr instanceof Expr.Call call) {
      return call(value(call.callee(), env), values(call.args(), env));
    } else if (expr instanceof Expr.Special special) {
      return specialForms.evaluate(
          special.head(), Collections.unmodifiableList(values(special.args(), env)));
    } else {
      return ((Expr.Literal) expr).value();
    }
  }

  private static boolean isTrue(@Nullable Object condition, Block block) {
    if (condition instanceof Boolean b) {
      return b;
    }
    throw new IrException(
        String.format("Branch condition in block %s is not a Boolean: %s", block.id(), condition));
  }

  private static @Nullable Object value(Operand operand, Map<Variable, @Nullable Object> env) {
    if (operand instanceof Const c) {
      return c.value();
    }
    Variable v = (Variable) operand;
    if (!env.containsKey(v)) {
      throw new IrException("Undefined variable " + v);
    }
    return env.get(v);
  }

  private static List<@Nullable Object> values(
      List<Operand> operands, Map<Variable, @Nullable Object> env) {
    List<@Nullable Object> result = new ArrayList<>(operands.size());
    for (Operand operand : operands) {
      result.add(value(operand, env));
    }
    return result;
  }
}
