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
 * Mutator that leaves unchanged the kinds it does not handle.
 *
 * <p>Structured like {@link OptOutDispatch}: a kind without an override
 * falls back to {@link #unhandled(Ir.Val)} or {@link #unhandled(Ir.Expr)},
 * which return their argument. Entry points {@link #mutate(Statement)},
 * {@link #mutate(Ir.Val)} and {@link #mutate(Ir.Expr)} route a node to its
 * concrete {@code mutate} method.
 *
 * <p>An override that rewrites a value must return a value, and one that
 * rewrites an expression must return an expression.
 */
public class OptOutMutator implements IrMutator {
  /** Routes a statement to the mutate method for its kind. */
  public Statement mutate(Statement statement) {
    return Dispatch.mutatorDispatch(this, statement);
  }

  /** Routes a value to the mutate method for its kind. */
  public Statement mutate(Ir.Val val) {
    return Dispatch.mutatorDispatch(this, val);
  }

  /** Routes an expression to the mutate method for its kind. */
  public Statement mutate(Ir.Expr expr) {
    return Dispatch.mutatorDispatch(this, expr);
  }

  /** Called for a value whose kind has no override. Returns the value. */
  protected Statement unhandled(Ir.Val val) {
    return val;
  }

  /** Called for an expression whose kind has no override. Returns the
   * expression. */
  protected Statement unhandled(Ir.Expr expr) {
    return expr;
  }

  // values

  @Override public Statement mutate(Ir.IterDomain iterDomain) {
    return unhandled(iterDomain);
  }

  @Override public Statement mutate(Ir.TensorDomain tensorDomain) {
    return unhandled(tensorDomain);
  }

  @Override public Statement mutate(Ir.Tensor tensor) {
    return unhandled(tensor);
  }

  @Override public Statement mutate(Ir.TensorView tensorView) {
    return unhandled(tensorView);
  }

  @Override public Statement mutate(Ir.Float aFloat) {
    return unhandled(aFloat);
  }

  @Override public Statement mutate(Ir.Int anInt) {
    return unhandled(anInt);
  }

  // expressions

  @Override public Statement mutate(Ir.Split split) {
    return unhandled(split);
  }

  @Override public Statement mutate(Ir.Merge merge) {
    return unhandled(merge);
  }

  @Override public Statement mutate(Ir.Reorder reorder) {
    return unhandled(reorder);
  }

  @Override public Statement mutate(Ir.UnaryOp unaryOp) {
    return unhandled(unaryOp);
  }

  @Override public Statement mutate(Ir.BinaryOp binaryOp) {
    return unhandled(binaryOp);
  }

  @Override public Statement mutate(Ir.ForLoop forLoop) {
    return unhandled(forLoop);
  }

  @Override public Statement mutate(Ir.IfThenElse ifThenElse) {
    return unhandled(ifThenElse);
  }
}

// End OptOutMutator.java
