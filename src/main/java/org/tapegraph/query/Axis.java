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


package org.tapegraph.query;

/** The structural directions that {@link Query#query} can navigate from a node. */
public enum Axis {
  PARENT(false),
  CHILD(true),
  PRECEDING(false),
  FOLLOWING(true),
  ANCESTOR(false),
  DESCENDANT(true);

  private final boolean forward;

  Axis(boolean forward) {
    this.forward = forward;
  }

  /**
   * True for the axes that move forward in execution order (or down the tree): CHILD, FOLLOWING,
   * and DESCENDANT.
   */
  public boolean isForward() {
    return forward;
  }
}
