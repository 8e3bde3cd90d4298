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
package net.hydromatic.fuser.pass;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.fuser.dispatch.OptOutMutator;
import net.hydromatic.fuser.ir.Fusion;
import net.hydromatic.fuser.ir.Ir;
import net.hydromatic.fuser.ir.Statement;

/**
 * Replaces values with other values throughout expressions.
 *
 * <p>An expression whose operands are unchanged is returned as is;
 * otherwise it is rebuilt, via the {@link Fusion}, with the new operands.
 * Loops and conditionals are rebuilt if anything in their bodies changes.
 * Values are replaced where expressions use them, not inside other values;
 * for example, replacing an extent does not rebuild the iteration domains
 * that use it.
 */
public class ReplaceAll extends OptOutMutator {
  private final Fusion fusion;
  private final ImmutableMap<Ir.Val, Ir.Val> replacements;

  private ReplaceAll(Fusion fusion,
      Map<Ir.Val, ? extends Ir.Val> replacements) {
    this.fusion = requireNonNull(fusion);
    this.replacements = ImmutableMap.copyOf(replacements);
    this.replacements.forEach((val, replacement) ->
        checkArgument(val.valType() == replacement.valType()
                && val.dataType() == replacement.dataType(),
            "cannot replace %s with %s", val, replacement));
  }

  /** Creates a ReplaceAll. Each value must be replaced by a value of the
   * same kind. */
  public static ReplaceAll of(Fusion fusion,
      Map<Ir.Val, ? extends Ir.Val> replacements) {
    return new ReplaceAll(fusion, replacements);
  }

  /**
   * Replaces values in an expression.
   *
   * <p>If anything changes, returns a new expression, which the fusion
   * records as top-level alongside {@code expr}. The caller should splice it
   * in place of {@code expr} by calling {@link Fusion#replaceExpr}, as
   * {@link Rewriter} does.
   */
  public static Ir.Expr substitute(Fusion fusion,
      Map<Ir.Val, ? extends Ir.Val> replacements, Ir.Expr expr) {
    if (replacements.isEmpty()) {
      return expr;
    }
    return (Ir.Expr) of(fusion, replacements).mutate(expr);
  }

  @Override protected Statement unhandled(Ir.Val val) {
    final Ir.Val replacement = replacements.get(val);
    return replacement != null ? replacement : val;
  }

  /** Mutates a value. The cast is safe because replacements have the same
   * kind as the values they replace. */
  @SuppressWarnings("unchecked")
  private <V extends Ir.Val> V mutateVal(V val) {
    return (V) mutate(val);
  }

  /** Mutates a list of expressions; returns the list itself if no element
   * changed. */
  private List<Ir.Expr> mutateExprs(List<Ir.Expr> exprs) {
    final List<Ir.Expr> list = new ArrayList<>();
    boolean changed = false;
    for (Ir.Expr expr : exprs) {
      final Ir.Expr expr2 = (Ir.Expr) mutate(expr);
      changed |= expr2 != expr;
      list.add(expr2);
    }
    return changed ? list : exprs;
  }

  @Override public Statement mutate(Ir.Split split) {
    final Ir.TensorDomain out = mutateVal(split.out());
    final Ir.TensorDomain in = mutateVal(split.in());
    final Ir.Int factor = mutateVal(split.factor());
    if (out == split.out() && in == split.in() && factor == split.factor()) {
      return split;
    }
    return fusion.split(out, in, split.axis(), factor);
  }

  @Override public Statement mutate(Ir.Merge merge) {
    final Ir.TensorDomain out = mutateVal(merge.out());
    final Ir.TensorDomain in = mutateVal(merge.in());
    if (out == merge.out() && in == merge.in()) {
      return merge;
    }
    return fusion.merge(out, in, merge.axis());
  }

  @Override public Statement mutate(Ir.Reorder reorder) {
    final Ir.TensorDomain out = mutateVal(reorder.out());
    final Ir.TensorDomain in = mutateVal(reorder.in());
    if (out == reorder.out() && in == reorder.in()) {
      return reorder;
    }
    return fusion.reorder(out, in, reorder.pos2axis());
  }

  @Override public Statement mutate(Ir.UnaryOp unaryOp) {
    final Ir.Val out = mutateVal(unaryOp.out());
    final Ir.Val in = mutateVal(unaryOp.in());
    if (out == unaryOp.out() && in == unaryOp.in()) {
      return unaryOp;
    }
    return fusion.unaryOp(unaryOp.opType(), out, in);
  }

  @Override public Statement mutate(Ir.BinaryOp binaryOp) {
    final Ir.Val out = mutateVal(binaryOp.out());
    final Ir.Val lhs = mutateVal(binaryOp.lhs());
    final Ir.Val rhs = mutateVal(binaryOp.rhs());
    if (out == binaryOp.out()
        && lhs == binaryOp.lhs()
        && rhs == binaryOp.rhs()) {
      return binaryOp;
    }
    return fusion.binaryOp(binaryOp.opType(), out, lhs, rhs);
  }

  @Override public Statement mutate(Ir.ForLoop forLoop) {
    final Ir.Int index = mutateVal(forLoop.index());
    final Ir.IterDomain range = mutateVal(forLoop.range());
    final List<Ir.Expr> body = mutateExprs(forLoop.body());
    if (index == forLoop.index()
        && range == forLoop.range()
        && body == forLoop.body()) {
      return forLoop;
    }
    return fusion.forLoop(index, range, body);
  }

  @Override public Statement mutate(Ir.IfThenElse ifThenElse) {
    final Ir.Int cond = mutateVal(ifThenElse.cond());
    final List<Ir.Expr> body = mutateExprs(ifThenElse.body());
    final List<Ir.Expr> elseBody = mutateExprs(ifThenElse.elseBody());
    if (cond == ifThenElse.cond()
        && body == ifThenElse.body()
        && elseBody == ifThenElse.elseBody()) {
      return ifThenElse;
    }
    return fusion.ifThenElse(cond, body, elseBody);
  }
}

// End ReplaceAll.java
