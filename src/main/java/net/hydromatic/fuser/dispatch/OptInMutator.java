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
 * Mutator that fails on the kinds it does not handle.
 *
 * <p>Same policy as {@link OptInDispatch}: every concrete {@code mutate}
 * method throws {@link DispatchException} with reason
 * {@link DispatchException.Reason#UNHANDLED_KIND} unless overridden.
 */
public abstract class OptInMutator implements IrMutator {
  public Statement mutate(Statement statement) {
    return Dispatch.mutatorDispatch(this, statement);
  }

  public Statement mutate(Ir.Val val) {
    return Dispatch.mutatorDispatch(this, val);
  }

  public Statement mutate(Ir.Expr expr) {
    return Dispatch.mutatorDispatch(this, expr);
  }

  private DispatchException unhandled(Statement statement) {
    return DispatchException.unhandledKind(this, statement);
  }

  // values

  @Override public Statement mutate(Ir.IterDomain iterDomain) {
    throw unhandled(iterDomain);
  }

  @Override public Statement mutate(Ir.TensorDomain tensorDomain) {
    throw unhandled(tensorDomain);
  }

  @Override public Statement mutate(Ir.Tensor tensor) {
    throw unhandled(tensor);
  }

  @Override public Statement mutate(Ir.TensorView tensorView) {
    throw unhandled(tensorView);
  }

  @Override public Statement mutate(Ir.Float aFloat) {
    throw unhandled(aFloat);
  }

  @Override public Statement mutate(Ir.Int anInt) {
    throw unhandled(anInt);
  }

  // expressions

  @Override public Statement mutate(Ir.Split split) {
    throw unhandled(split);
  }

  @Override public Statement mutate(Ir.Merge merge) {
    throw unhandled(merge);
  }

  @Override public Statement mutate(Ir.Reorder reorder) {
    throw unhandled(reorder);
  }

  @Override public Statement mutate(Ir.UnaryOp unaryOp) {
    throw unhandled(unaryOp);
  }

  @Override public Statement mutate(Ir.BinaryOp binaryOp) {
    throw unhandled(binaryOp);
  }

  @Override public Statement mutate(Ir.ForLoop forLoop) {
    throw unhandled(forLoop);
  }

  @Override public Statement mutate(Ir.IfThenElse ifThenElse) {
    throw unhandled(ifThenElse);
  }
}

// End OptInMutator.java
