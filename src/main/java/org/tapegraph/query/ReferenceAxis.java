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

/** Selects which rule {@link Dependencies#referenced} uses to find a node's dependencies. */
public enum ReferenceAxis {
  /**
   * Only references to preceding siblings; a Constant or Argument node depends on nothing under
   * this axis.
   */
  PRECEDING,

  /**
   * An Argument node depends on the node that supplied its value in the enclosing call: argument
   * 1 on the call's callee, argument {@code k} on the call's argument {@code k - 1}. Every other
   * node depends on nothing.
   */
  PARENT,

  /** The PARENT rule for Argument nodes, the PRECEDING rule for everything else. */
  PRECEDING_OR_PARENT
}
