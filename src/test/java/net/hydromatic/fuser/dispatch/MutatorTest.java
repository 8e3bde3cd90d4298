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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import net.hydromatic.fuser.FuserTests;
import net.hydromatic.fuser.ir.BinaryOpType;
import net.hydromatic.fuser.ir.Fusion;
import net.hydromatic.fuser.ir.Ir;
import net.hydromatic.fuser.ir.Statement;
import net.hydromatic.fuser.ir.UnaryOpType;
import org.junit.jupiter.api.Test;

/** Tests for the mutator base classes {@link OptOutMutator} and
 * {@link OptInMutator}. */
public class MutatorTest {
  /** Tests that a mutator with no overrides returns every node
   * unchanged. */
  @Test
  void testOptOutIdentity() {
    final OptOutMutator mutator = new OptOutMutator();
    final Map<String, Statement> kinds = FuserTests.allKinds(new Fusion());
    kinds.forEach((kind, statement) ->
        assertThat(kind, mutator.mutate(statement), sameInstance(statement)));
  }

  /** Tests a mutator that rewrites one kind of expression, reading its
   * operands through the entry points. */
  @Test
  void testOptOutOverride() {
    final Fusion f = new Fusion();
    final Ir.Float zero = f.floatScalar(0);
    final OptOutMutator mutator = new OptOutMutator() {
      // "-x" becomes "0 - x"
      @Override public Statement mutate(Ir.UnaryOp unaryOp) {
        if (unaryOp.opType() != UnaryOpType.NEG) {
          return unaryOp;
        }
        return f.binaryOp(BinaryOpType.SUB, unaryOp.out(), zero,
            unaryOp.in());
      }
    };

    final Ir.Float x = f.floatScalar();
    final Ir.UnaryOp neg = f.unaryOp(UnaryOpType.NEG, f.floatScalar(), x);
    final Statement result = mutator.mutate((Ir.Expr) neg);
    assertThat(result.isExpr(), is(true));
    final Ir.BinaryOp sub = (Ir.BinaryOp) result;
    assertThat(sub.opType(), is(BinaryOpType.SUB));
    assertThat(sub.lhs(), sameInstance(zero));
    assertThat(sub.rhs(), sameInstance(x));
    assertThat(sub.out(), sameInstance(neg.out()));
    assertThat(f.origin(sub.out()), sameInstance(sub));

    final Ir.UnaryOp cast = f.unaryOp(UnaryOpType.CAST, f.intScalar(), x);
    assertThat(mutator.mutate((Ir.Expr) cast), sameInstance(cast));

    // Other kinds are untouched
    final Ir.BinaryOp add = f.binaryOp(BinaryOpType.ADD, f.floatScalar(), x, x);
    assertThat(mutator.mutate((Ir.Expr) add), sameInstance(add));
  }

  /** Tests that the value category handler sees every value kind. */
  @Test
  void testOptOutValCategory() {
    final StringBuilder log = new StringBuilder();
    final OptOutMutator mutator = new OptOutMutator() {
      @Override protected Statement unhandled(Ir.Val val) {
        log.append(val.valType().name().charAt(0));
        return val;
      }
    };
    FuserTests.allKinds(new Fusion()).values().forEach(mutator::mutate);
    assertThat(log.toString(), is("ITTTSS"));
  }

  /** Tests that an exhaustive-required mutator fails on a kind it does not
   * handle. */
  @Test
  void testOptIn() {
    final Fusion f = new Fusion();
    final OptInMutator mutator = new OptInMutator() {
      @Override public Statement mutate(Ir.Int anInt) {
        final Integer value = anInt.value();
        return value == null ? anInt : f.intScalar(value + 1);
      }
    };
    final Ir.Int three = f.intScalar(3);
    final Ir.Int four = (Ir.Int) mutator.mutate((Ir.Val) three);
    assertThat(four.value(), is(4));

    final Ir.Int n = f.intScalar();
    assertThat(mutator.mutate((Ir.Val) n), sameInstance(n));

    final Ir.Float x = f.floatScalar();
    final DispatchException e =
        assertThrows(DispatchException.class,
            () -> mutator.mutate((Ir.Val) x));
    assertThat(e.reason(), is(DispatchException.Reason.UNHANDLED_KIND));
    assertThat(e.getMessage(), containsString("Float"));

    final Ir.UnaryOp neg = f.unaryOp(UnaryOpType.NEG, f.floatScalar(), x);
    final DispatchException e2 =
        assertThrows(DispatchException.class,
            () -> Dispatch.mutatorDispatch(mutator, neg));
    assertThat(e2.getMessage(), containsString("UnaryOp"));
  }
}

// End MutatorTest.java
