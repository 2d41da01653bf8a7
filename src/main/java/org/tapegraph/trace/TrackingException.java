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

/**
 * Thrown when instrumentation or recording fails. These failures are always fatal: nothing is
 * retried, and a partially recorded trace is discarded.
 *
 * <p>Errors raised by the program being traced (e.g. by one of its primitives) are not wrapped;
 * they propagate out of the instrumented program exactly as they would out of the original.
 */
public class TrackingException extends RuntimeException {

  /** The categories of tracking failure. */
  public enum Kind {
    /** The input IR contains something the transformer can't instrument. */
    TRANSFORMATION,

    /**
     * An internal consistency check failed, e.g. recording without a Recorder, recording after
     * the Recorder was finished, or referencing a location that has not been recorded.
     */
    INTERNAL,

    /** The dispatch policy failed while classifying a call or instrumenting a nested callee. */
    DISPATCH
  }

  private final Kind kind;

  public TrackingException(Kind kind, String message) {
    super(kind + ": " + message);
    this.kind = kind;
  }

  public TrackingException(Kind kind, String message, Throwable cause) {
    super(kind + ": " + message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
