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

import com.google.common.collect.ImmutableList;
import java.util.IdentityHashMap;
import java.util.Map;
import net.hydromatic.fuser.dispatch.OptOutDispatch;
import net.hydromatic.fuser.ir.Ir;
import net.hydromatic.fuser.ir.Statement;

/** Collects the values that expressions read and write, in order of first
 * occurrence. */
public class ValCollector extends OptOutDispatch {
  private final Map<Ir.Val, Boolean> vals = new IdentityHashMap<>();
  private final ImmutableList.Builder<Ir.Val> list = ImmutableList.builder();

  /** Returns the values used by a list of expressions and, recursively,
   * the expressions in their bodies. */
  public static ImmutableList<Ir.Val> collect(
      Iterable<? extends Statement> statements) {
    final ValCollector collector = new ValCollector();
    for (Statement statement : statements) {
      collector.handle(statement);
    }
    return collector.list.build();
  }

  private void add(Ir.Val val) {
    if (vals.put(val, Boolean.TRUE) == null) {
      list.add(val);
    }
  }

  @Override protected void unhandled(Ir.Val val) {
    add(val);
  }

  @Override protected void unhandled(Ir.Expr expr) {
    expr.inputs().forEach(this::add);
    expr.outputs().forEach(this::add);
  }

  @Override public void handle(Ir.ForLoop forLoop) {
    unhandled(forLoop);
    for (Ir.Expr expr : forLoop.body()) {
      handle(expr);
    }
  }

  @Override public void handle(Ir.IfThenElse ifThenElse) {
    unhandled(ifThenElse);
    for (Ir.Expr expr : ifThenElse.body()) {
      handle(expr);
    }
    for (Ir.Expr expr : ifThenElse.elseBody()) {
      handle(expr);
    }
  }
}

// End ValCollector.java
