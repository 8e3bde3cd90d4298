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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.fuser.dispatch.Dispatch;
import net.hydromatic.fuser.dispatch.DispatchException;
import net.hydromatic.fuser.dispatch.IrMutator;
import net.hydromatic.fuser.ir.Fusion;
import net.hydromatic.fuser.ir.Ir;
import net.hydromatic.fuser.ir.Statement;

/**
 * Applies a mutator to the top-level expressions of a fusion, and splices
 * the replacements into the fusion.
 *
 * <p>Each pass visits the expressions in program order. A replacement must
 * be an expression; otherwise the rewrite fails with a
 * {@link DispatchException} whose reason is
 * {@link DispatchException.Reason#CATEGORY_MISMATCH}. Passes repeat until one
 * replaces nothing or until {@link Prop#REWRITE_PASS_COUNT} passes have run.
 */
public class Rewriter {
  private final Map<Prop, Object> map;
  private final Tracer tracer;

  public Rewriter(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a Rewriter with default properties and no tracing. */
  public static Rewriter create() {
    return new Rewriter(ImmutableMap.of(), Tracers.empty());
  }

  /** Rewrites a fusion. Returns the total number of replacements. */
  public int rewrite(Fusion fusion, IrMutator mutator) {
    final int passCount = Prop.REWRITE_PASS_COUNT.intValue(map);
    int total = 0;
    for (int pass = 0; pass < passCount; pass++) {
      final int count = rewriteOnce(pass, fusion, mutator);
      tracer.onPass(pass, count);
      total += count;
      if (count == 0) {
        break;
      }
    }
    return total;
  }

  private int rewriteOnce(int pass, Fusion fusion, IrMutator mutator) {
    int count = 0;
    for (Ir.Expr expr : fusion.exprs()) {
      final Statement result;
      try {
        result = Dispatch.mutatorDispatch(mutator, expr);
        if (!result.isExpr()) {
          throw DispatchException.categoryMismatch(expr, result);
        }
      } catch (DispatchException e) {
        tracer.onException(e);
        throw e;
      }
      if (result != expr) {
        final Ir.Expr replacement = (Ir.Expr) result;
        fusion.replaceExpr(expr, replacement);
        tracer.onReplace(pass, expr, replacement);
        ++count;
      }
    }
    return count;
  }
}

// End Rewriter.java
