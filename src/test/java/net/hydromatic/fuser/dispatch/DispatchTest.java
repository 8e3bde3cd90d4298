/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.fuser.dispatch;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import net.hydromatic.fuser.FuserTests;
import net.hydromatic.fuser.ir.ConstIr;
import net.hydromatic.fuser.ir.Fusion;
import net.hydromatic.fuser.ir.Ir;
import net.hydromatic.fuser.ir.Statement;
import org.junit.jupiter.api.Test;

/** Tests for {@link Dispatch}. */
public class DispatchTest {
  /** Tests that {@link Dispatch#dispatch(IrVisitor, Statement)} calls the
   * handler method for exactly the node's kind. */
  @Test
  void testDispatchEachKind() {
    final Map<String, Statement> kinds = FuserTests.allKinds(new Fusion());
    kinds.forEach((kind, statement) -> {
      final Recorder recorder = new Recorder();
      Dispatch.dispatch(recorder, statement);
      assertThat(recorder.kinds, is(Collections.singletonList(kind)));
    });
  }

  /** As {@link #testDispatchEachKind()}, but routing via the per-category
   * methods. */
  @Test
  void testDispatchByCategory() {
    final Map<String, Statement> kinds = FuserTests.allKinds(new Fusion());
    final Recorder recorder = new Recorder();
    for (String kind : FuserTests.VAL_KINDS) {
      Dispatch.dispatch(recorder, (Ir.Val) kinds.get(kind));
    }
    assertThat(recorder.kinds, is(FuserTests.VAL_KINDS));
    recorder.kinds.clear();
    for (String kind : FuserTests.EXPR_KINDS) {
      Dispatch.dispatch(recorder, (Ir.Expr) kinds.get(kind));
    }
    assertThat(recorder.kinds, is(FuserTests.EXPR_KINDS));
  }

  @Test
  void testConstDispatchEachKind() {
    final Map<String, Statement> kinds = FuserTests.allKinds(new Fusion());
    kinds.forEach((kind, statement) -> {
      final ConstRecorder recorder = new ConstRecorder();
      final ConstIr.Statement view = statement;
      Dispatch.constDispatch(recorder, view);
      assertThat(recorder.kinds, is(Collections.singletonList(kind)));
    });
  }

  @Test
  void testMutatorDispatchEachKind() {
    final Map<String, Statement> kinds = FuserTests.allKinds(new Fusion());
    kinds.forEach((kind, statement) -> {
      final RecordingMutator mutator = new RecordingMutator();
      final Statement result = Dispatch.mutatorDispatch(mutator, statement);
      assertThat(mutator.kinds, is(Collections.singletonList(kind)));
      assertThat(result, sameInstance(statement));
    });
  }

  /** Tests that identity mutation preserves each node's category. */
  @Test
  void testIdentityMutationPreservesCategory() {
    final Map<String, Statement> kinds = FuserTests.allKinds(new Fusion());
    final OptOutMutator identity = new OptOutMutator();
    kinds.forEach((kind, statement) -> {
      final Statement result = Dispatch.mutatorDispatch(identity, statement);
      assertThat(kind, result.isVal(), is(statement.isVal()));
      assertThat(kind, result.isExpr(), is(statement.isExpr()));
    });
  }

  /** Tests that an {@link Ir.IfThenElse} is routed to the mutate method for
   * IfThenElse, not the one for ForLoop. */
  @Test
  void testMutateIfThenElse() {
    final Fusion f = new Fusion();
    final Map<String, Statement> kinds = FuserTests.allKinds(f);
    final Ir.Int forLoopMarker = f.intScalar(1);
    final Ir.Int ifThenElseMarker = f.intScalar(2);
    final IrMutator mutator = new OptOutMutator() {
      @Override public Statement mutate(Ir.ForLoop forLoop) {
        return forLoopMarker;
      }

      @Override public Statement mutate(Ir.IfThenElse ifThenElse) {
        return ifThenElseMarker;
      }
    };
    assertThat(Dispatch.mutatorDispatch(mutator, kinds.get("IfThenElse")),
        sameInstance(ifThenElseMarker));
    assertThat(Dispatch.mutatorDispatch(mutator, kinds.get("ForLoop")),
        sameInstance(forLoopMarker));
  }

  /** Tests that the dispatcher returns whatever the mutator returns, even a
   * value in place of an expression. Checking is the caller's job. */
  @Test
  void testMutatorDispatchDoesNotCheckCategory() {
    final Fusion f = new Fusion();
    final Map<String, Statement> kinds = FuserTests.allKinds(f);
    final Ir.Int marker = f.intScalar(7);
    final Statement result =
        Dispatch.mutatorDispatch(
            new OptOutMutator() {
              @Override protected Statement unhandled(Ir.Expr expr) {
                return marker;
              }
            },
            (Ir.Expr) kinds.get("Merge"));
    assertThat(result, sameInstance(marker));
    assertThat(result.isVal(), is(true));
  }

  /** Visitor that records the kind of each node it is given. Implements
   * every method, so the compiler checks that no kind is missing. */
  static class Recorder implements IrVisitor {
    final List<String> kinds = new ArrayList<>();

    @Override public void handle(Ir.IterDomain iterDomain) {
      kinds.add("IterDomain");
    }

    @Override public void handle(Ir.TensorDomain tensorDomain) {
      kinds.add("TensorDomain");
    }

    @Override public void handle(Ir.Tensor tensor) {
      kinds.add("Tensor");
    }

    @Override public void handle(Ir.TensorView tensorView) {
      kinds.add("TensorView");
    }

    @Override public void handle(Ir.Float aFloat) {
      kinds.add("Float");
    }

    @Override public void handle(Ir.Int anInt) {
      kinds.add("Int");
    }

    @Override public void handle(Ir.Split split) {
      kinds.add("Split");
    }

    @Override public void handle(Ir.Merge merge) {
      kinds.add("Merge");
    }

    @Override public void handle(Ir.Reorder reorder) {
      kinds.add("Reorder");
    }

    @Override public void handle(Ir.UnaryOp unaryOp) {
      kinds.add("UnaryOp");
    }

    @Override public void handle(Ir.BinaryOp binaryOp) {
      kinds.add("BinaryOp");
    }

    @Override public void handle(Ir.ForLoop forLoop) {
      kinds.add("ForLoop");
    }

    @Override public void handle(Ir.IfThenElse ifThenElse) {
      kinds.add("IfThenElse");
    }
  }

  /** Read-only visitor that records the kind of each node it is given. */
  static class ConstRecorder implements ConstIrVisitor {
    final List<String> kinds = new ArrayList<>();

    @Override public void handle(ConstIr.IterDomain iterDomain) {
      kinds.add("IterDomain");
    }

    @Override public void handle(ConstIr.TensorDomain tensorDomain) {
      kinds.add("TensorDomain");
    }

    @Override public void handle(ConstIr.Tensor tensor) {
      kinds.add("Tensor");
    }

    @Override public void handle(ConstIr.TensorView tensorView) {
      kinds.add("TensorView");
    }

    @Override public void handle(ConstIr.Float aFloat) {
      kinds.add("Float");
    }

    @Override public void handle(ConstIr.Int anInt) {
      kinds.add("Int");
    }

    @Override public void handle(ConstIr.Split split) {
      kinds.add("Split");
    }

    @Override public void handle(ConstIr.Merge merge) {
      kinds.add("Merge");
    }

    @Override public void handle(ConstIr.Reorder reorder) {
      kinds.add("Reorder");
    }

    @Override public void handle(ConstIr.UnaryOp unaryOp) {
      kinds.add("UnaryOp");
    }

    @Override public void handle(ConstIr.BinaryOp binaryOp) {
      kinds.add("BinaryOp");
    }

    @Override public void handle(ConstIr.ForLoop forLoop) {
      kinds.add("ForLoop");
    }

    @Override public void handle(ConstIr.IfThenElse ifThenElse) {
      kinds.add("IfThenElse");
    }
  }

  /** Mutator that records the kind of each node and returns it
   * unchanged. */
  static class RecordingMutator extends OptOutMutator {
    final List<String> kinds = new ArrayList<>();

    @Override protected Statement unhandled(Ir.Val val) {
      kinds.add(val.getClass().getSimpleName());
      return val;
    }

    @Override protected Statement unhandled(Ir.Expr expr) {
      kinds.add(expr.getClass().getSimpleName());
      return expr;
    }
  }
}

// End DispatchTest.java
