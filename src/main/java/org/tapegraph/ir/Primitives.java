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

import java.util.List;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.IntBinaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * Static-only class with a small set of arithmetic and comparison {@link Primitive}s.
 *
 * <p>The arithmetic primitives take two numbers; if both are Integers the result is an Integer
 * (overflow throws an ArithmeticException), otherwise both are converted to double.
 */
public class Primitives {

  private Primitives() {}

  public static final Primitive ADD = arithmetic("+", Math::addExact, Double::sum);

  public static final Primitive SUBTRACT = arithmetic("-", Math::subtractExact, (x, y) -> x - y);

  public static final Primitive MULTIPLY = arithmetic("*", Math::multiplyExact, (x, y) -> x * y);

  public static final Primitive LESS_THAN =
      Primitive.named(
          "<",
          args -> {
            checkArity("<", args, 2);
            Number x = number("<", args, 0);
            Number y = number("<", args, 1);
            if (x instanceof Integer && y instanceof Integer) {
              return x.intValue() < y.intValue();
            }
            return x.doubleValue() < y.doubleValue();
          });

  public static final Primitive EQUAL =
      Primitive.named(
          "==",
          args -> {
            checkArity("==", args, 2);
            return Objects.equals(args.get(0), args.get(1));
          });

  public static final Primitive NOT =
      Primitive.named(
          "!",
          args -> {
            checkArity("!", args, 1);
            if (!(args.get(0) instanceof Boolean b)) {
              throw new IrException("! expects a Boolean, got " + args.get(0));
            }
            return !b;
          });

  private static Primitive arithmetic(
      String name, IntBinaryOperator intOp, DoubleBinaryOperator doubleOp) {
    return Primitive.named(
        name,
        args -> {
          checkArity(name, args, 2);
          Number x = number(name, args, 0);
          Number y = number(name, args, 1);
          if (x instanceof Integer && y instanceof Integer) {
            return intOp.applyAsInt(x.intValue(), y.intValue());
          }
          return doubleOp.applyAsDouble(x.doubleValue(), y.doubleValue());
        });
  }

  private static void checkArity(String name, List<@Nullable Object> args, int arity) {
    if (args.size() != arity) {
      throw new IrException(
          String.format("%s expects %s arguments, got %s", name, arity, args.size()));
    }
  }

  private static Number number(String name, List<@Nullable Object> args, int i) {
    if (args.get(i) instanceof Number n) {
      return n;
    }
    throw new IrException(String.format("%s expects numbers, got %s", name, args.get(i)));
  }
}
