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
import com.google.common.collect.ImmutableSetMultimap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.tapegraph.ir.Block;
import org.tapegraph.ir.Branch;
import org.tapegraph.ir.Ir;

/** Computes the control flow edges between the blocks of an {@link Ir}. */
public class JumpTargets {

  private JumpTargets() {}

  /**
   * Returns a multimap from each block id to the ids of the blocks that can transfer control to
   * it, either by an explicit jump or by falling through. Blocks that can't be reached from any
   * other block have no entry.
   */
  public static ImmutableSetMultimap<Integer, Integer> compute(Ir ir) {
    ImmutableSetMultimap.Builder<Integer, Integer> result = ImmutableSetMultimap.builder();
    for (Block block : ir.blocks()) {
      for (int target : successors(ir, block)) {
        result.put(target, block.id());
      }
    }
    return result.build();
  }

  /**
   * Returns the ids of the blocks that {@code block} can transfer control to, in branch order,
   * without duplicates.
   */
  static ImmutableList<Integer> successors(Ir ir, Block block) {
    List<Integer> result = new ArrayList<>();
    for (Branch branch : block.branches()) {
      if (branch instanceof Branch.Jump jump && !result.contains(jump.target())) {
        result.add(jump.target());
      }
    }
    int next = block.id() + 1;
    if (block.fallsThrough() && block.id() < ir.numBlocks() && !result.contains(next)) {
      result.add(next);
    }
    return ImmutableList.copyOf(result);
  }

  /**
   * Returns the ids of all blocks, starting with those reachable from block 1 in reverse postorder
   * (so each reachable block follows every block that dominates it), followed by any unreachable
   * blocks in id order.
   */
  public static ImmutableList<Integer> reversePostorder(Ir ir) {
    boolean[] visited = new boolean[ir.numBlocks() + 1];
    List<Integer> postorder = new ArrayList<>();
    Deque<Integer> path = new ArrayDeque<>();
    Deque<Iterator<Integer>> pending = new ArrayDeque<>();
    visited[1] = true;
    path.push(1);
    pending.push(successors(ir, ir.block(1)).iterator());
    while (!path.isEmpty()) {
      Iterator<Integer> next = pending.peek();
      if (next.hasNext()) {
        int target = next.next();
        if (!visited[target]) {
          visited[target] = true;
          path.push(target);
          pending.push(successors(ir, ir.block(target)).iterator());
        }
      } else {
        postorder.add(path.pop());
        pending.pop();
      }
    }
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    result.addAll(ImmutableList.copyOf(postorder).reverse());
    for (int id = 1; id <= ir.numBlocks(); id++) {
      if (!visited[id]) {
        result.add(id);
      }
    }
    return result.build();
  }
}
