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

import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Interpreter;
import org.tapegraph.ir.Ir;
import org.tapegraph.ir.IrException;
import org.tapegraph.ir.IrFunction;
import org.tapegraph.ir.Primitive;
import org.tapegraph.ir.SpecialForms;
import org.tapegraph.trace.CallDispatcher;
import org.tapegraph.trace.Tape;
import org.tapegraph.trace.TrackingException;
import org.tapegraph.trace.TrackingException.Kind;

/**
 * Runs {@link IrFunction}s while recording a trace of their execution.
 *
 * <p>Calls made by a traced function are recorded according to the Tracker's primitive policy:
 * {@link Primitive}s (and anything else that isn't an IrFunction) are always recorded as
 * primitive calls, while an IrFunction is traced recursively unless the policy says it is
 * primitive.
 *
 * <p>The instrumented version of each function is computed on first use and cached. A Tracker
 * may be shared between threads; each call to {@link #track} records its own trace.
 */
public final class Tracker implements CallDispatcher {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Predicate<IrFunction> primitivePolicy;
  private final boolean verbose;
  private final Interpreter interpreter;

  /** Maps each original Ir to its instrumented version. */
  private final Map<Ir, Ir> instrumented = new ConcurrentHashMap<>();

  /** If verbose, the listing of each instrumented Ir, keyed by the original. */
  private final Map<Ir, String> listings = new ConcurrentHashMap<>();

  private Tracker(Builder builder) {
    this.primitivePolicy = builder.primitivePolicy;
    this.verbose = builder.verbose;
    this.interpreter = new Interpreter(builder.specialForms);
  }

  /** Returns a Tracker with the default configuration. */
  public static Tracker create() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Calls {@code fn} with the given arguments and returns its result along with its trace. */
  public Traced track(IrFunction fn, @Nullable Object... args) {
    return track(fn, Arrays.asList(args));
  }

  /**
   * Calls {@code fn} with the given arguments and returns its result along with its trace.
   *
   * @throws TrackingException with kind TRANSFORMATION if {@code fn} can't be instrumented, or
   *     DISPATCH if one of the functions it calls can't be
   */
  public Traced track(IrFunction fn, List<@Nullable Object> args) {
    fn.checkArguments(args);
    Tape tape = run(instrumented(fn.ir()), fn, args);
    return new Traced(tape.value(), tape.toRoot(fn, args));
  }

  /**
   * Returns the instrumented version of {@code ir}, computing it if this is the first time it has
   * been requested.
   */
  public Ir instrumented(Ir ir) {
    return instrumented.computeIfAbsent(
        ir,
        original -> {
          Ir result = TrackBuilder.instrument(original, this);
          logger.atFine().log("Instrumented %s blocks", original.numBlocks());
          if (verbose) {
            listings.put(original, result.toString());
          }
          return result;
        });
  }

  /**
   * Returns the listing of the instrumented version of {@code ir}, or null if it has not been
   * instrumented or this Tracker is not verbose.
   */
  public @Nullable String listing(Ir ir) {
    return listings.get(ir);
  }

  @Override
  public boolean isPrimitive(@Nullable Object callee, List<@Nullable Object> args) {
    return !(callee instanceof IrFunction fn) || primitivePolicy.test(fn);
  }

  @Override
  public @Nullable Object callPrimitive(@Nullable Object callee, List<@Nullable Object> args) {
    return interpreter.call(callee, args);
  }

  @Override
  public Tape callNested(@Nullable Object callee, List<@Nullable Object> args) {
    Preconditions.checkArgument(callee instanceof IrFunction, "Can't trace %s", callee);
    IrFunction fn = (IrFunction) callee;
    fn.checkArguments(args);
    logger.atFiner().log("Tracing nested call of %s", fn);
    Ir ir;
    try {
      ir = instrumented(fn.ir());
    } catch (TrackingException | IrException e) {
      throw new TrackingException(Kind.DISPATCH, "Unable to instrument " + fn, e);
    }
    return run(ir, fn, args);
  }

  private Tape run(Ir instrumentedIr, IrFunction fn, List<@Nullable Object> args) {
    return (Tape) interpreter.run(instrumentedIr, Interpreter.withCallee(fn, args));
  }

  /** A builder for Trackers. */
  public static final class Builder {
    private Predicate<IrFunction> primitivePolicy = fn -> false;
    private SpecialForms specialForms = SpecialForms.DEFAULT;
    private boolean verbose;

    private Builder() {}

    /**
     * Calls to an IrFunction for which {@code policy} returns true will be recorded as primitive
     * calls rather than traced. By default all IrFunctions are traced.
     */
    @CanIgnoreReturnValue
    public Builder setPrimitivePolicy(Predicate<IrFunction> policy) {
      this.primitivePolicy = Preconditions.checkNotNull(policy);
      return this;
    }

    /** Sets the special forms available to traced functions. */
    @CanIgnoreReturnValue
    public Builder setSpecialForms(SpecialForms specialForms) {
      this.specialForms = Preconditions.checkNotNull(specialForms);
      return this;
    }

    /** If true, the listing of each instrumented function is kept; see {@link Tracker#listing}. */
    @CanIgnoreReturnValue
    public Builder setVerbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public Tracker build() {
      return new Tracker(this);
    }
  }
}
