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

import net.hydromatic.fuser.ir.ConstIr;

/**
 * Read-only visitor that fails on the kinds it does not handle.
 *
 * <p>Same policy as {@link OptInDispatch}, but every method receives a
 * {@link ConstIr} view, so a sub-class cannot modify the nodes it visits.
 * Use it for printers and analyses.
 */
public abstract class OptInConstDispatch implements ConstIrVisitor {
  public void handle(ConstIr.Statement statement) {
    Dispatch.constDispatch(this, statement);
  }

  public void handle(ConstIr.Val val) {
    Dispatch.constDispatch(this, val);
  }

  public void handle(ConstIr.Expr expr) {
    Dispatch.constDispatch(this, expr);
  }

  private DispatchException unhandled(ConstIr.Statement statement) {
    return DispatchException.unhandledKind(this, statement);
  }

  // values

  @Override public void handle(ConstIr.IterDomain iterDomain) {
    throw unhandled(iterDomain);
  }

  @Override public void handle(ConstIr.TensorDomain tensorDomain) {
    throw unhandled(tensorDomain);
  }

  @Override public void handle(ConstIr.Tensor tensor) {
    throw unhandled(tensor);
  }

  @Override public void handle(ConstIr.TensorView tensorView) {
    throw unhandled(tensorView);
  }

  @Override public void handle(ConstIr.Float aFloat) {
    throw unhandled(aFloat);
  }

  @Override public void handle(ConstIr.Int anInt) {
    throw unhandled(anInt);
  }

  // expressions

  @Override public void handle(ConstIr.Split split) {
    throw unhandled(split);
  }

  @Override public void handle(ConstIr.Merge merge) {
    throw unhandled(merge);
  }

  @Override public void handle(ConstIr.Reorder reorder) {
    throw unhandled(reorder);
  }

  @Override public void handle(ConstIr.UnaryOp unaryOp) {
    throw unhandled(unaryOp);
  }

  @Override public void handle(ConstIr.BinaryOp binaryOp) {
    throw unhandled(binaryOp);
  }

  @Override public void handle(ConstIr.ForLoop forLoop) {
    throw unhandled(forLoop);
  }

  @Override public void handle(ConstIr.IfThenElse ifThenElse) {
    throw unhandled(ifThenElse);
  }
}

// End OptInConstDispatch.java
