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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fuser.dispatch.DispatchException;
import net.hydromatic.fuser.dispatch.OptOutMutator;
import net.hydromatic.fuser.ir.BinaryOpType;
import net.hydromatic.fuser.ir.Fusion;
import net.hydromatic.fuser.ir.Ir;
import net.hydromatic.fuser.ir.Statement;
import net.hydromatic.fuser.ir.UnaryOpType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Rewriter}, {@link ReplaceAll} and
 * {@link ValCollector}. */
public class RewriterTest {
  /** Mutator that rewrites "-x" to "0 - x". */
  private static class NegToSub extends OptOutMutator {
    private final Fusion fusion;
    private final Ir.Float zero;

    NegToSub(Fusion fusion, Ir.Float zero) {
      this.fusion = fusion;
      this.zero = zero;
    }

    @Override public Statement mutate(Ir.UnaryOp unaryOp) {
      if (unaryOp.opType() != UnaryOpType.NEG) {
        return unaryOp;
      }
      return fusion.binaryOp(BinaryOpType.SUB, unaryOp.out(), zero,
          unaryOp.in());
    }
  }

  @Test
  void testRewrite() {
    final Fusion f = new Fusion();
    final Ir.Float zero = f.floatScalar(0);
    final Ir.Float x = f.floatScalar();
    final Ir.Float a = f.floatScalar();
    final Ir.Float b = f.floatScalar();
    final Ir.Float c = f.floatScalar();
    final Ir.UnaryOp neg1 = f.unaryOp(UnaryOpType.NEG, a, x);
    final Ir.BinaryOp add = f.binaryOp(BinaryOpType.ADD, b, a, a);
    final Ir.UnaryOp neg2 = f.unaryOp(UnaryOpType.NEG, c, b);
    assertThat(f.exprs(), is(ImmutableList.<Ir.Expr>of(neg1, add, neg2)));

    final List<Ir.Expr> replacements = new ArrayList<>();
    final List<Integer> counts = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnPass(
            Tracers.withOnReplace(Tracers.empty(), replacements::add),
            counts::add);
    final Map<Prop, Object> map = new HashMap<>();
    Prop.REWRITE_PASS_COUNT.set(map, 3);
    final int n =
        new Rewriter(map, tracer).rewrite(f, new NegToSub(f, zero));
    assertThat(n, is(2));
    assertThat(replacements, hasSize(2));
    assertThat(counts, is(Arrays.asList(2, 0)));

    final List<Ir.Expr> exprs = f.exprs();
    assertThat(exprs, hasSize(3));
    assertThat(exprs.get(0), sameInstance(replacements.get(0)));
    assertThat(exprs.get(1), sameInstance(add));
    assertThat(exprs.get(2), sameInstance(replacements.get(1)));
    assertThat(f.origin(a), sameInstance(exprs.get(0)));
    assertThat(f.origin(c), sameInstance(exprs.get(2)));
    assertThat(f,
        hasToString("%kernel {\n"
            + "f2 = f0 - f1\n"
            + "f3 = f2 + f2\n"
            + "f4 = f0 - f3\n"
            + "}\n"));
  }

  /** Tests that, by default, the rewriter makes one pass, and that a
   * rewriter that changes nothing reports zero. */
  @Test
  void testRewriteDefaults() {
    final Fusion f = new Fusion();
    final Ir.Float zero = f.floatScalar(0);
    final Ir.UnaryOp neg =
        f.unaryOp(UnaryOpType.NEG, f.floatScalar(), f.floatScalar());
    final Rewriter rewriter = Rewriter.create();
    assertThat(rewriter.rewrite(f, new NegToSub(f, zero)), is(1));
    assertThat(f.exprs().get(0), not(sameInstance((Ir.Expr) neg)));
    assertThat(f.exprs().get(0), instanceOf(Ir.BinaryOp.class));
    assertThat(rewriter.rewrite(f, new NegToSub(f, zero)), is(0));
    assertThat(rewriter.rewrite(f, new OptOutMutator()), is(0));
  }

  /** Tests that a mutator that replaces an expression with a value fails,
   * and that the failure is traced. */
  @Test
  void testRewriteCategoryMismatch() {
    final Fusion f = new Fusion();
    f.unaryOp(UnaryOpType.NEG, f.floatScalar(), f.floatScalar());
    final OptOutMutator mutator = new OptOutMutator() {
      @Override public Statement mutate(Ir.UnaryOp unaryOp) {
        return unaryOp.out();
      }
    };
    final List<DispatchException> exceptions = new ArrayList<>();
    final Rewriter rewriter =
        new Rewriter(ImmutableMap.of(),
            Tracers.withOnException(Tracers.empty(), exceptions::add));
    final DispatchException e =
        assertThrows(DispatchException.class,
            () -> rewriter.rewrite(f, mutator));
    assertThat(e.reason(), is(DispatchException.Reason.CATEGORY_MISMATCH));
    assertThat(exceptions, hasSize(1));
    assertThat(exceptions.get(0), sameInstance(e));
  }

  @Test
  void testReplaceAll() {
    final Fusion f = new Fusion();
    final Ir.Float x = f.floatScalar();
    final Ir.Float y = f.floatScalar();
    final Ir.Float z = f.floatScalar();
    final Ir.Float w = f.floatScalar();
    final Ir.BinaryOp add = f.binaryOp(BinaryOpType.ADD, z, x, y);

    final Map<Ir.Val, Ir.Val> map = ImmutableMap.<Ir.Val, Ir.Val>of(x, w);
    final Ir.Expr expr = ReplaceAll.substitute(f, map, add);
    assertThat(expr, hasToString("f2 = f3 + f1"));
    assertThat(add, hasToString("f2 = f0 + f1"));

    // The new expression sits beside the old until the caller splices it
    assertThat(f.exprs(), is(ImmutableList.<Ir.Expr>of(add, expr)));
    f.replaceExpr(add, expr);
    assertThat(f.exprs(), is(ImmutableList.<Ir.Expr>of(expr)));
    assertThat(f.origin(z), sameInstance(expr));

    assertThat(
        ReplaceAll.substitute(f, ImmutableMap.<Ir.Val, Ir.Val>of(), add),
        sameInstance((Ir.Expr) add));
    assertThat(
        ReplaceAll.substitute(f, ImmutableMap.<Ir.Val, Ir.Val>of(w, x), add),
        sameInstance((Ir.Expr) add));
  }

  @Test
  void testReplaceAllInLoop() {
    final Fusion f = new Fusion();
    final Ir.Float x = f.floatScalar();
    final Ir.Float y = f.floatScalar();
    final Ir.Float w = f.floatScalar();
    final Ir.Int index = f.intScalar();
    final Ir.IterDomain range = f.iterDomain(f.intScalar(0), f.intScalar());
    final Ir.BinaryOp mul = f.binaryOp(BinaryOpType.MUL, y, x, x);
    final Ir.ForLoop loop = f.forLoop(index, range, ImmutableList.of(mul));

    final Ir.Expr expr =
        ReplaceAll.substitute(f, ImmutableMap.<Ir.Val, Ir.Val>of(x, w), loop);
    assertThat(expr, instanceOf(Ir.ForLoop.class));
    assertThat(expr, not(sameInstance((Ir.Expr) loop)));
    assertThat(expr,
        hasToString("for(i3 in iS6{i5}) {\n"
            + "  f1 = f2 * f2\n"
            + "}"));
    assertThat(((Ir.ForLoop) expr).body().get(0),
        not(sameInstance((Ir.Expr) mul)));
    assertThat(loop.body().get(0), sameInstance((Ir.Expr) mul));
  }

  @Test
  void testReplaceAllKindMismatch() {
    final Fusion f = new Fusion();
    final Ir.Float x = f.floatScalar();
    final Ir.Int n = f.intScalar();
    final Map<Ir.Val, Ir.Val> map = ImmutableMap.<Ir.Val, Ir.Val>of(x, n);
    assertThrows(IllegalArgumentException.class,
        () -> ReplaceAll.of(f, map));
  }

  @Test
  void testValCollector() {
    final Fusion f = new Fusion();
    final Ir.Float x = f.floatScalar();
    final Ir.Float y = f.floatScalar();
    final Ir.Int index = f.intScalar();
    final Ir.IterDomain range = f.iterDomain(f.intScalar(0), f.intScalar());
    final Ir.BinaryOp mul = f.binaryOp(BinaryOpType.MUL, y, x, x);
    f.forLoop(index, range, ImmutableList.of(mul));
    final Ir.Int cond = f.intScalar();
    final Ir.Float z = f.floatScalar();
    final Ir.UnaryOp neg = f.unaryOp(UnaryOpType.NEG, z, y);
    f.ifThenElse(cond, ImmutableList.of(), ImmutableList.of(neg));

    final List<Ir.Val> vals = ValCollector.collect(f.exprs());
    assertThat(vals,
        is(Arrays.<Ir.Val>asList(index, range, x, y, cond, z)));
  }
}

// End RewriterTest.java
