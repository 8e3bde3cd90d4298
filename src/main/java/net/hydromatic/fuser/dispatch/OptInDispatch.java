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
 * Visitor that fails on the kinds it does not handle.
 *
 * <p>Every concrete {@code handle} method throws {@link DispatchException}
 * with reason {@link DispatchException.Reason#UNHANDLED_KIND} unless a
 * sub-class overrides it. Overriding an entry point such as
 * {@link #handle(Ir.Expr)} does not change that: {@link Dispatch} routes to
 * the concrete method.
 *
 * <p>To have the compiler check that every kind is handled, implement
 * {@link IrVisitor} directly.
 *
 * @see OptOutDispatch
 */
public abstract class OptInDispatch implements IrVisitor {
  public void handle(Statement statement) {
    Dispatch.dispatch(this, statement);
  }

  public void handle(Ir.Val val) {
    Dispatch.dispatch(this, val);
  }

  public void handle(Ir.Expr expr) {
    Dispatch.dispatch(this, expr);
  }

  private DispatchException unhandled(Statement statement) {
    return DispatchException.unhandledKind(this, statement);
  }

  // values

  @Override public void handle(Ir.IterDomain iterDomain) {
    throw unhandled(iterDomain);
  }

  @Override public void handle(Ir.TensorDomain tensorDomain) {
    throw unhandled(tensorDomain);
  }

  @Override public void handle(Ir.Tensor tensor) {
    throw unhandled(tensor);
  }

  @Override public void handle(Ir.TensorView tensorView) {
    throw unhandled(tensorView);
  }

  @Override public void handle(Ir.Float aFloat) {
    throw unhandled(aFloat);
  }

  @Override public void handle(Ir.Int anInt) {
    throw unhandled(anInt);
  }

  // expressions

  @Override public void handle(Ir.Split split) {
    throw unhandled(split);
  }

  @Override public void handle(Ir.Merge merge) {
    throw unhandled(merge);
  }

  @Override public void handle(Ir.Reorder reorder) {
    throw unhandled(reorder);
  }

  @Override public void handle(Ir.UnaryOp unaryOp) {
    throw unhandled(unaryOp);
  }

  @Override public void handle(Ir.BinaryOp binaryOp) {
    throw unhandled(binaryOp);
  }

  @Override public void handle(Ir.ForLoop forLoop) {
    throw unhandled(forLoop);
  }

  @Override public void handle(Ir.IfThenElse ifThenElse) {
    throw unhandled(ifThenElse);
  }
}

// End OptInDispatch.java
