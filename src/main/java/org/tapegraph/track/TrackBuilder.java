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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.tapegraph.ir.Block;
import org.tapegraph.ir.Branch;
import org.tapegraph.ir.Expr;
import org.tapegraph.ir.Ir;
import org.tapegraph.ir.IrBuilder;
import org.tapegraph.ir.Location;
import org.tapegraph.ir.Location.BranchIndex;
import org.tapegraph.ir.Location.VarIndex;
import org.tapegraph.ir.Operand;
import org.tapegraph.ir.Operand.Const;
import org.tapegraph.ir.Operand.Variable;
import org.tapegraph.ir.Statement;
import org.tapegraph.trace.CallDispatcher;
import org.tapegraph.trace.Description;
import org.tapegraph.trace.TapeValue;
import org.tapegraph.trace.TrackingException;
import org.tapegraph.trace.TrackingException.Kind;

/**
 * Rewrites an {@link Ir} into an equivalent one that also records a trace of its execution.
 *
 * <p>Block {@code i} of the instrumented IR corresponds to block {@code i} of the original, with
 * each argument, statement, and branch recorded (by calling one of the {@link RecordOp}s) in
 * execution order. One block is added at the end; every return of the original jumps there, and it
 * returns the {@link org.tapegraph.trace.Tape} built by the Recorder (which includes the original
 * return value).
 *
 * <p>A jump is not recorded where it is taken. Instead each jump passes a {@link Description.Jump}
 * as an additional trailing argument to its target, and the target block records it before its
 * own arguments, so only the jump actually taken appears in the trace. A conditional jump in last
 * position (or a block with no branches) falls through to the next block; the instrumented IR
 * makes that fallthrough an explicit jump so that it can carry a Description too.
 *
 * <p>Block 1 creates the Recorder. Since it is the only block that has no incoming jump to record,
 * it must not be the target of any jump. The remaining blocks are rewritten in reverse postorder,
 * so a variable may be used in a lower-numbered block than the one that defines it as long as the
 * definition dominates the use.
 */
public class TrackBuilder {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Ir original;
  private final CallDispatcher dispatcher;
  private final ImmutableSetMultimap<Integer, Integer> jumpTargets;
  private final IrBuilder out = new IrBuilder();

  /** The id of the added block that all returns are redirected to. */
  private final int returnBlock;

  /** Maps each variable of the original IR to the location that defines it. */
  private final Map<Variable, Location> definitions = new HashMap<>();

  /**
   * Maps each variable of the original IR to the variable of the instrumented IR that holds the
   * same value. Entries are added as blocks are rewritten, in reverse postorder.
   */
  private final Map<Variable, Variable> variableMap = new HashMap<>();

  private TrackBuilder(Ir original, CallDispatcher dispatcher) {
    this.original = original;
    this.dispatcher = dispatcher;
    this.jumpTargets = JumpTargets.compute(original);
    this.returnBlock = original.numBlocks() + 1;
    for (Block block : original.blocks()) {
      for (Variable arg : block.arguments()) {
        definitions.put(arg, new VarIndex(block.id(), arg.id()));
      }
      for (Statement statement : block.statements()) {
        Variable v = statement.result();
        definitions.put(v, new VarIndex(block.id(), v.id()));
      }
    }
  }

  /**
   * Returns an instrumented version of {@code ir}. Executing the result with the same block 1
   * arguments as {@code ir} returns a {@link org.tapegraph.trace.Tape}; calls are recorded by
   * {@code dispatcher}.
   *
   * @throws TrackingException with kind TRANSFORMATION if {@code ir} can't be instrumented
   */
  public static Ir instrument(Ir ir, CallDispatcher dispatcher) {
    Ir result = new TrackBuilder(ir, dispatcher).build();
    logger.atFine().log("Instrumented IR:\n%s\nas:\n%s", ir, lazy(result::toString));
    return result;
  }

  private Ir build() {
    if (jumpTargets.containsKey(1)) {
      throw new TrackingException(
          Kind.TRANSFORMATION,
          "Block 1 is the target of a jump from " + jumpTargets.get(1) + "; it must be the entry");
    }
    // Block 1 already exists; the return block is added last.
    for (int i = 2; i <= original.numBlocks(); i++) {
      out.newBlock();
    }
    Block first = original.block(1);
    out.setBlock(1);
    List<Variable> args = copyArguments(first);
    Variable recorder = out.call(RecordOp.NEW_RECORDER, dispatcher, original);
    BlockTracker tracker = new BlockTracker(recorder);
    tracker.trackBlock(first, args, null);
    // Blocks keep their ids, but are rewritten so that each definition is seen before its uses.
    for (int i : JumpTargets.reversePostorder(original)) {
      if (i == 1) {
        continue;
      }
      Block block = original.block(i);
      out.setBlock(i);
      args = copyArguments(block);
      Variable branchArg = jumpTargets.containsKey(i) ? out.argument() : null;
      tracker.trackBlock(block, args, branchArg);
    }
    tracker.addReturnBlock();
    try {
      return out.build();
    } catch (RuntimeException e) {
      throw new TrackingException(Kind.TRANSFORMATION, "Instrumented IR is malformed", e);
    }
  }

  /** Adds arguments to the current block corresponding to the arguments of {@code block}. */
  private List<Variable> copyArguments(Block block) {
    List<Variable> result = new ArrayList<>();
    for (Variable arg : block.arguments()) {
      Variable newArg = out.argument();
      variableMap.put(arg, newArg);
      result.add(newArg);
    }
    return result;
  }

  /** Returns the operand of the instrumented IR that corresponds to {@code operand}. */
  private Operand substitute(Operand operand, Location usedAt) {
    if (operand instanceof Variable v) {
      Variable result = variableMap.get(v);
      if (result == null) {
        throw new TrackingException(
            Kind.TRANSFORMATION,
            String.format("%s used at %s is not dominated by its definition", v, usedAt));
      }
      return result;
    }
    return operand;
  }

  private Object[] substitute(List<Operand> operands, Location usedAt) {
    return operands.stream().map(x -> substitute(x, usedAt)).toArray();
  }

  /** Returns the representation of {@code operand} in a trace. */
  private TapeValue tapeValue(Operand operand) {
    if (operand instanceof Variable v) {
      return TapeValue.reference(definitions.get(v));
    }
    return TapeValue.constant(((Const) operand).value());
  }

  private ImmutableList<TapeValue> tapeValues(List<Operand> operands) {
    return operands.stream().map(this::tapeValue).collect(toImmutableList());
  }

  /**
   * Emits the recording code for each block. Only created once the recorder variable has been
   * defined (in block 1), since everything it emits passes that variable to a RecordOp.
   */
  private class BlockTracker {
    final Variable recorder;

    BlockTracker(Variable recorder) {
      this.recorder = recorder;
    }

    /**
     * Emits the instrumented version of {@code block} into the current block of {@code out}, which
     * already has arguments {@code args} (corresponding to those of {@code block}) and {@code
     * branchArg} (which will receive the description of the jump that entered the block, or null
     * if the block can't be entered by a jump).
     */
    void trackBlock(Block block, List<Variable> args, @Nullable Variable branchArg) {
      Object branchPosition = 0;
      if (branchArg != null) {
        branchPosition = out.call(RecordOp.RECORD_BRANCH, recorder, branchArg);
      }
      for (int i = 0; i < args.size(); i++) {
        Location location = new VarIndex(block.id(), block.arguments().get(i).id());
        out.call(RecordOp.RECORD_ARGUMENT, recorder, location, i + 1, branchPosition, args.get(i));
      }
      for (Statement statement : block.statements()) {
        trackStatement(block, statement);
      }
      trackBranches(block);
    }

    void trackStatement(Block block, Statement statement) {
      Variable v = statement.result();
      Location location = new VarIndex(block.id(), v.id());
      Variable result;
      if (statement.expr() instanceof Expr.Call call) {
        List<Object> args = new ArrayList<>();
        args.add(recorder);
        args.add(location);
        args.add(tapeValue(call.callee()));
        args.add(tapeValues(call.args()));
        args.add(substitute(call.callee(), location));
        args.addAll(List.of(substitute(call.args(), location)));
        result = out.call(RecordOp.RECORD_CALL, args.toArray());
      } else if (statement.expr() instanceof Expr.Special special) {
        Variable value = out.special(special.head(), substitute(special.args(), location));
        result =
            out.call(
                RecordOp.RECORD_SPECIAL,
                recorder,
                location,
                special.head(),
                tapeValues(special.args()),
                value);
      } else if (statement.expr() instanceof Expr.Literal literal) {
        result = out.call(RecordOp.RECORD_CONSTANT, recorder, location, literal.value());
      } else {
        throw new TrackingException(
            Kind.TRANSFORMATION, "Can't instrument statement at " + location + ": " + statement);
      }
      variableMap.put(v, result);
    }

    void trackBranches(Block block) {
      ImmutableList<Branch> branches = block.branches();
      for (int i = 0; i < branches.size(); i++) {
        Location location = new BranchIndex(block.id(), i + 1);
        Branch branch = branches.get(i);
        if (branch instanceof Branch.Return ret) {
          Description record = new Description.Return(location, tapeValue(ret.value()));
          out.jump(returnBlock, substitute(ret.value(), location), Operand.of(record));
        } else if (branch instanceof Branch.Jump jump) {
          TapeValue condition =
              (jump.condition() == null)
                  ? TapeValue.constant(true)
                  : tapeValue(jump.condition());
          Description record =
              new Description.Jump(
                  location,
                  jump.target(),
                  tapeValues(jump.args()),
                  condition,
                  jump.isConditional());
          ImmutableList<Operand> args =
              ImmutableList.<Operand>builder()
                  .addAll(jump.args().stream().map(x -> substitute(x, location)).iterator())
                  .add(Operand.of(record))
                  .build();
          Operand newCondition =
              (jump.condition() == null) ? null : substitute(jump.condition(), location);
          out.add(new Branch.Jump(jump.target(), args, newCondition));
        } else {
          throw new TrackingException(
              Kind.TRANSFORMATION, "Can't instrument branch at " + location + ": " + branch);
        }
      }
      if (block.fallsThrough()) {
        // Only possible if this isn't the last block (see Ir.validate()).
        Location location = new BranchIndex(block.id(), branches.size() + 1);
        Description record =
            new Description.Jump(
                location, block.id() + 1, ImmutableList.of(), TapeValue.constant(true), false);
        out.jump(block.id() + 1, Operand.of(record));
      }
    }

    /** Emits the block that all returns jump to. */
    void addReturnBlock() {
      int id = out.newBlock();
      assert id == returnBlock;
      out.setBlock(id);
      Variable value = out.argument();
      Variable record = out.argument();
      out.call(RecordOp.RECORD_BRANCH, recorder, record);
      out.ret(out.call(RecordOp.FINISH, recorder, value));
    }
  }
}
