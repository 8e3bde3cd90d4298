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
package net.hydromatic.fuser.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fuser.pass.IrPrinter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Creates, names and owns the nodes of one fusion.
 *
 * <p>Values are numbered in order of creation, as are expressions. Each
 * expression is appended to the list of top-level expressions when it is
 * created, and leaves it when it becomes part of the body of a
 * {@link Ir.ForLoop} or {@link Ir.IfThenElse}.
 *
 * <p>Not thread-safe.
 */
public class Fusion {
  private final List<Ir.Val> vals = new ArrayList<>();
  private final List<Ir.Expr> exprs = new ArrayList<>();
  private final Map<Ir.Val, Ir.Expr> origins = new IdentityHashMap<>();
  private int exprCount;

  /** Returns the values created by this fusion, in order of creation. */
  public ImmutableList<Ir.Val> vals() {
    return ImmutableList.copyOf(vals);
  }

  /** Returns the top-level expressions, in program order. */
  public ImmutableList<Ir.Expr> exprs() {
    return ImmutableList.copyOf(exprs);
  }

  /** Returns the expression that most recently produced {@code val}, or null
   * if {@code val} is an input. */
  public Ir.@Nullable Expr origin(Ir.Val val) {
    return origins.get(val);
  }

  // values

  /** Creates a symbolic integer scalar. */
  public Ir.Int intScalar() {
    return register(new Ir.Int(vals.size(), null));
  }

  /** Creates a constant integer scalar. */
  public Ir.Int intScalar(int value) {
    return register(new Ir.Int(vals.size(), value));
  }

  /** Creates a symbolic floating-point scalar. */
  public Ir.Float floatScalar() {
    return register(new Ir.Float(vals.size(), null));
  }

  /** Creates a constant floating-point scalar. */
  public Ir.Float floatScalar(double value) {
    return register(new Ir.Float(vals.size(), value));
  }

  /** Creates a serial, non-reduction iteration domain. */
  public Ir.IterDomain iterDomain(Ir.Int start, Ir.Int extent) {
    return iterDomain(start, extent, ParallelType.SERIAL, false);
  }

  /** Creates an iteration domain. */
  public Ir.IterDomain iterDomain(Ir.Int start, Ir.Int extent,
      ParallelType parallelType, boolean reduction) {
    return register(
        new Ir.IterDomain(vals.size(), start, extent, parallelType,
            reduction));
  }

  /** Creates a tensor domain. */
  public Ir.TensorDomain tensorDomain(List<Ir.IterDomain> domain) {
    return register(new Ir.TensorDomain(vals.size(), domain));
  }

  /** Creates a tensor domain. */
  public Ir.TensorDomain tensorDomain(Ir.IterDomain... domain) {
    return tensorDomain(ImmutableList.copyOf(domain));
  }

  /** Creates a tensor. */
  public Ir.Tensor tensor(DataType dataType,
      Ir.@Nullable TensorDomain domain) {
    return register(new Ir.Tensor(vals.size(), dataType, domain));
  }

  /** Creates a view of a tensor through its own domain. */
  public Ir.TensorView tensorView(Ir.Tensor tensor) {
    final Ir.TensorDomain domain = tensor.domain();
    checkArgument(domain != null, "tensor %s has no domain", tensor.name());
    return tensorView(tensor, domain);
  }

  /** Creates a view of a tensor through a given domain. */
  public Ir.TensorView tensorView(Ir.Tensor tensor,
      Ir.TensorDomain domain) {
    return register(new Ir.TensorView(vals.size(), tensor, domain));
  }

  // expressions

  /** Creates a split. */
  public Ir.Split split(Ir.TensorDomain out, Ir.TensorDomain in, int axis,
      Ir.Int factor) {
    return register(new Ir.Split(exprCount++, out, in, axis, factor));
  }

  /** Creates a merge. */
  public Ir.Merge merge(Ir.TensorDomain out, Ir.TensorDomain in, int axis) {
    return register(new Ir.Merge(exprCount++, out, in, axis));
  }

  /** Creates a reorder. */
  public Ir.Reorder reorder(Ir.TensorDomain out, Ir.TensorDomain in,
      List<Integer> pos2axis) {
    return register(new Ir.Reorder(exprCount++, out, in, pos2axis));
  }

  /** Creates a unary operation. */
  public Ir.UnaryOp unaryOp(UnaryOpType opType, Ir.Val out, Ir.Val in) {
    return register(new Ir.UnaryOp(exprCount++, opType, out, in));
  }

  /** Creates a binary operation. */
  public Ir.BinaryOp binaryOp(BinaryOpType opType, Ir.Val out, Ir.Val lhs,
      Ir.Val rhs) {
    return register(new Ir.BinaryOp(exprCount++, opType, out, lhs, rhs));
  }

  /** Creates a loop. The expressions in {@code body} are no longer
   * top-level. */
  public Ir.ForLoop forLoop(Ir.Int index, Ir.IterDomain range,
      List<? extends Ir.Expr> body) {
    nest(body);
    return register(new Ir.ForLoop(exprCount++, index, range, body));
  }

  /** Creates a conditional. The expressions in {@code body} and
   * {@code elseBody} are no longer top-level. */
  public Ir.IfThenElse ifThenElse(Ir.Int cond, List<? extends Ir.Expr> body,
      List<? extends Ir.Expr> elseBody) {
    nest(body);
    nest(elseBody);
    return register(new Ir.IfThenElse(exprCount++, cond, body, elseBody));
  }

  /**
   * Replaces a top-level expression.
   *
   * <p>The replacement takes the position of {@code expr} in the list of
   * top-level expressions, and becomes the origin of its outputs. Values
   * that {@code expr} produced and the replacement does not are now
   * inputs.
   */
  public void replaceExpr(Ir.Expr expr, Ir.Expr replacement) {
    requireNonNull(replacement, "replacement");
    if (expr == replacement) {
      return;
    }
    checkArgument(indexOfIdentical(exprs, expr) >= 0,
        "expression %s is not top-level", expr.name());
    removeIdentical(exprs, replacement);
    exprs.set(indexOfIdentical(exprs, expr), replacement);
    for (Ir.Val output : expr.outputs()) {
      if (origins.get(output) == expr) {
        origins.remove(output);
      }
    }
    for (Ir.Val output : replacement.outputs()) {
      origins.put(output, replacement);
    }
  }

  @Override public String toString() {
    return IrPrinter.toString(this);
  }

  private <V extends Ir.Val> V register(V val) {
    vals.add(val);
    return val;
  }

  private <E extends Ir.Expr> E register(E expr) {
    exprs.add(expr);
    for (Ir.Val output : expr.outputs()) {
      origins.put(output, expr);
    }
    return expr;
  }

  private void nest(List<? extends Ir.Expr> body) {
    for (Ir.Expr expr : body) {
      removeIdentical(exprs, expr);
    }
  }

  private static int indexOfIdentical(List<?> list, Object o) {
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i) == o) {
        return i;
      }
    }
    return -1;
  }

  private static void removeIdentical(List<?> list, Object o) {
    final int i = indexOfIdentical(list, o);
    if (i >= 0) {
      list.remove(i);
    }
  }
}

// End Fusion.java
