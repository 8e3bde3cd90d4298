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

import net.hydromatic.fuser.ir.Ir;
import net.hydromatic.fuser.ir.Statement;

/**
 * Visitor that ignores the kinds it does not handle.
 *
 * <p>Override the {@code handle} methods for the kinds you care about. A
 * kind you do not override falls back to its category's handler, {@link
 * #unhandled(Ir.Val)} or {@link #unhandled(Ir.Expr)}; both fall back to
 * {@link #unhandled(Statement)}, which does nothing. So a visitor that
 * overrides only {@code unhandled(Ir.Expr)} sees every expression, whatever
 * its kind.
 *
 * <p>The methods {@link #handle(Statement)}, {@link #handle(Ir.Val)} and
 * {@link #handle(Ir.Expr)} are entry points: they route a node to its
 * concrete {@code handle} method. A handler method visits children by
 * calling an entry point; the order in which it does so is up to it.
 *
 * @see OptInDispatch
 */
public class OptOutDispatch implements IrVisitor {
  /** Routes a statement to the handler method for its kind. */
  public void handle(Statement statement) {
    Dispatch.dispatch(this, statement);
  }

  /** Routes a value to the handler method for its kind. */
  public void handle(Ir.Val val) {
    Dispatch.dispatch(this, val);
  }

  /** Routes an expression to the handler method for its kind. */
  public void handle(Ir.Expr expr) {
    Dispatch.dispatch(this, expr);
  }

  /** Called for a value whose kind has no override. */
  protected void unhandled(Ir.Val val) {
    unhandled((Statement) val);
  }

  /** Called for an expression whose kind has no override. */
  protected void unhandled(Ir.Expr expr) {
    unhandled((Statement) expr);
  }

  /** Called for a statement whose kind has no override, unless its
   * category's handler is overridden. Does nothing. */
  protected void unhandled(Statement statement) {}

  // values

  @Override public void handle(Ir.IterDomain iterDomain) {
    unhandled(iterDomain);
  }

  @Override public void handle(Ir.TensorDomain tensorDomain) {
    unhandled(tensorDomain);
  }

  @Override public void handle(Ir.Tensor tensor) {
    unhandled(tensor);
  }

  @Override public void handle(Ir.TensorView tensorView) {
    unhandled(tensorView);
  }

  @Override public void handle(Ir.Float aFloat) {
    unhandled(aFloat);
  }

  @Override public void handle(Ir.Int anInt) {
    unhandled(anInt);
  }

  // expressions

  @Override public void handle(Ir.Split split) {
    unhandled(split);
  }

  @Override public void handle(Ir.Merge merge) {
    unhandled(merge);
  }

  @Override public void handle(Ir.Reorder reorder) {
    unhandled(reorder);
  }

  @Override public void handle(Ir.UnaryOp unaryOp) {
    unhandled(unaryOp);
  }

  @Override public void handle(Ir.BinaryOp binaryOp) {
    unhandled(binaryOp);
  }

  @Override public void handle(Ir.ForLoop forLoop) {
    unhandled(forLoop);
  }

  @Override public void handle(Ir.IfThenElse ifThenElse) {
    unhandled(ifThenElse);
  }
}

// End OptOutDispatch.java
