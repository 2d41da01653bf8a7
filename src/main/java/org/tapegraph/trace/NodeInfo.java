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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Location;

/**
 * The bookkeeping shared by every {@link Node}: where it was recorded from, where it sits in the
 * trace, and a metadata store for annotations added by later analyses.
 *
 * <p>Everything except the parent and the metadata is fixed when the node is recorded. The parent
 * is attached exactly once, when the {@link Node.NestedCall} whose children include this node is
 * constructed (a call's node can only be built after the call has returned, so its children are
 * recorded first). The root of a trace has no parent, no location, and position 0.
 */
public final class NodeInfo {
  private final @Nullable Location location;
  private final int position;
  private Node.@Nullable NestedCall parent;
  private @Nullable Map<String, Object> metadata;

  NodeInfo(@Nullable Location location, int position) {
    this.location = location;
    this.position = position;
  }

  /** Returns a NodeInfo for the root of a trace. */
  static NodeInfo root() {
    return new NodeInfo(null, 0);
  }

  /** The location in the original IR this node was recorded from; null only for a trace root. */
  public @Nullable Location location() {
    return location;
  }

  /** This node's index (starting from 1) in its parent's children. */
  public int position() {
    return position;
  }

  /** The NestedCall this node is a child of; null for a trace root (or a node still recording). */
  public Node.@Nullable NestedCall parent() {
    return parent;
  }

  void attach(Node.NestedCall parent) {
    Preconditions.checkState(this.parent == null, "Node at %s already has a parent", location);
    Preconditions.checkArgument(position > 0);
    this.parent = parent;
  }

  /** Returns the metadata value for {@code key}, or null if none has been set. */
  public synchronized @Nullable Object getMetadata(String key) {
    return (metadata == null) ? null : metadata.get(key);
  }

  /** Returns the metadata value for {@code key}, or {@code defaultValue} if none has been set. */
  public synchronized Object getMetadata(String key, Object defaultValue) {
    Object result = getMetadata(key);
    return (result == null) ? defaultValue : result;
  }

  public synchronized boolean hasMetadata(String key) {
    return metadata != null && metadata.containsKey(key);
  }

  /** Sets the metadata value for {@code key}, replacing any previous value. */
  public synchronized void setMetadata(String key, Object value) {
    Preconditions.checkNotNull(value);
    if (metadata == null) {
      metadata = new HashMap<>();
    }
    metadata.put(key, value);
  }

  /**
   * Returns the metadata value for {@code key}; if there is none, computes one with {@code
   * compute}, stores it, and returns it.
   */
  @CanIgnoreReturnValue
  public synchronized Object computeMetadataIfAbsent(String key, Function<String, Object> compute) {
    if (metadata == null) {
      metadata = new HashMap<>();
    }
    return metadata.computeIfAbsent(key, compute);
  }
}
