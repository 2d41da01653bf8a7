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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Ir;
import org.tapegraph.ir.Location;
import org.tapegraph.ir.Primitive;
import org.tapegraph.trace.CallDispatcher;
import org.tapegraph.trace.Description;
import org.tapegraph.trace.Recorder;
import org.tapegraph.trace.TapeValue;
import org.tapegraph.trace.TrackingException;
import org.tapegraph.trace.TrackingException.Kind;

/**
 * The primitives that instrumented IR calls to build its trace. The first argument of each
 * (except {@link #NEW_RECORDER}) is the {@link Recorder} created on entry to the function.
 */
public enum RecordOp implements Primitive {
  /** {@code (dispatcher, originalIr) -> Recorder} */
  NEW_RECORDER(2, false) {
    @Override
    @Nullable Object run(List<@Nullable Object> args) {
      if (!(args.get(0) instanceof CallDispatcher dispatcher) || !(args.get(1) instanceof Ir ir)) {
        throw new TrackingException(Kind.INTERNAL, "Invalid arguments to NEW_RECORDER: " + args);
      }
      return new Recorder(ir, dispatcher);
    }
  },

  /** {@code (recorder, location, value) -> value} */
  RECORD_CONSTANT(3, false) {
    @Override
    @Nullable Object run(List<@Nullable Object> args) {
      return record(args, new Description.Constant(location(args), args.get(2)));
    }
  },

  /** {@code (recorder, location, number, branchPosition, value) -> value} */
  RECORD_ARGUMENT(5, false) {
    @Override
    @Nullable Object run(List<@Nullable Object> args) {
      int number = (Integer) args.get(2);
      int branch = (Integer) args.get(3);
      return record(args, new Description.Argument(location(args), args.get(4), branch, number));
    }
  },

  /**
   * {@code (recorder, location, calleeRepr, argReprs, callee, args...) -> result}; the call is
   * made (or traced) by the Recorder.
   */
  RECORD_CALL(5, true) {
    @Override
    @Nullable Object run(List<@Nullable Object> args) {
      Description.Call call =
          new Description.Call(
              location(args),
              args.get(4),
              args.subList(5, args.size()),
              (TapeValue) args.get(2),
              reprs(args.get(3)));
      return record(args, call);
    }
  },

  /** {@code (recorder, location, head, argReprs, value) -> value} */
  RECORD_SPECIAL(5, false) {
    @Override
    @Nullable Object run(List<@Nullable Object> args) {
      Description.Special special =
          new Description.Special(
              location(args), (String) args.get(2), args.get(4), reprs(args.get(3)));
      return record(args, special);
    }
  },

  /**
   * {@code (recorder, description) -> position}; records the Jump or Return described and
   * returns its position.
   */
  RECORD_BRANCH(2, false) {
    @Override
    @Nullable Object run(List<@Nullable Object> args) {
      if (!(args.get(1) instanceof Description description)) {
        throw new TrackingException(Kind.INTERNAL, "Not a branch description: " + args.get(1));
      }
      return recorder(args).record(description).position();
    }
  },

  /** {@code (recorder, value) -> Tape} */
  FINISH(2, false) {
    @Override
    @Nullable Object run(List<@Nullable Object> args) {
      return recorder(args).finish(args.get(1));
    }
  };

  private final int numArgs;
  private final boolean varArgs;

  RecordOp(int numArgs, boolean varArgs) {
    this.numArgs = numArgs;
    this.varArgs = varArgs;
  }

  @Override
  public final @Nullable Object apply(List<@Nullable Object> args) {
    if (varArgs ? args.size() < numArgs : args.size() != numArgs) {
      throw new TrackingException(
          Kind.INTERNAL, String.format("%s called with %s arguments", this, args.size()));
    }
    return run(args);
  }

  abstract @Nullable Object run(List<@Nullable Object> args);

  private static Recorder recorder(List<@Nullable Object> args) {
    if (args.get(0) instanceof Recorder recorder) {
      return recorder;
    }
    throw new TrackingException(Kind.INTERNAL, "Recording without a Recorder: " + args.get(0));
  }

  private static Location location(List<@Nullable Object> args) {
    return (Location) args.get(1);
  }

  @SuppressWarnings("unchecked")
  private static ImmutableList<TapeValue> reprs(@Nullable Object x) {
    return (ImmutableList<TapeValue>) x;
  }

  private static @Nullable Object record(List<@Nullable Object> args, Description description) {
    return recorder(args).record(description).value();
  }
}
