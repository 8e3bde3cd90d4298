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
package net.hydromatic.fuser.ir;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Read-only views of IR nodes.
 *
 * <p>Each class in {@link Ir} implements the interface of the same name in
 * this namespace. The interfaces declare accessors only, and accessors that
 * return nodes return read-only views; so a handler that is given a view
 * cannot modify the node, nor any node it reaches through it.
 *
 * @see net.hydromatic.fuser.dispatch.ConstIrVisitor
 */
public class ConstIr {
  private ConstIr() {}

  /** Read-only view of a {@link net.hydromatic.fuser.ir.Statement}. */
  public interface Statement {
    int name();

    boolean isVal();

    boolean isExpr();
  }

  /** Read-only view of an {@link Ir.Val}. */
  public interface Val extends Statement {
    ValType valType();

    /** Returns the data type; null for iteration and tensor domains. */
    @Nullable DataType dataType();
  }

  /** Read-only view of an {@link Ir.Expr}. */
  public interface Expr extends Statement {
    ExprType exprType();

    List<? extends Val> inputs();

    List<? extends Val> outputs();
  }

  /** Read-only view of an {@link Ir.IterDomain}. */
  public interface IterDomain extends Val {
    Int start();

    Int extent();

    ParallelType parallelType();

    boolean isReduction();
  }

  /** Read-only view of an {@link Ir.TensorDomain}. */
  public interface TensorDomain extends Val {
    List<? extends IterDomain> domain();

    int nDims();

    IterDomain axis(int i);
  }

  /** Read-only view of an {@link Ir.Tensor}. */
  public interface Tensor extends Val {
    @Nullable TensorDomain domain();
  }

  /** Read-only view of an {@link Ir.TensorView}. */
  public interface TensorView extends Val {
    Tensor tensor();

    TensorDomain domain();
  }

  /** Read-only view of an {@link Ir.Scalar}. */
  public interface Scalar extends Val {
    boolean isSymbolic();
  }

  /** Read-only view of an {@link Ir.Float}. */
  public interface Float extends Scalar {
    @Nullable Double value();
  }

  /** Read-only view of an {@link Ir.Int}. */
  public interface Int extends Scalar {
    @Nullable Integer value();
  }

  /** Read-only view of an {@link Ir.Split}. */
  public interface Split extends Expr {
    TensorDomain out();

    TensorDomain in();

    int axis();

    Int factor();
  }

  /** Read-only view of an {@link Ir.Merge}. */
  public interface Merge extends Expr {
    TensorDomain out();

    TensorDomain in();

    int axis();
  }

  /** Read-only view of an {@link Ir.Reorder}. */
  public interface Reorder extends Expr {
    TensorDomain out();

    TensorDomain in();

    List<Integer> pos2axis();
  }

  /** Read-only view of an {@link Ir.UnaryOp}. */
  public interface UnaryOp extends Expr {
    UnaryOpType opType();

    Val out();

    Val in();
  }

  /** Read-only view of a {@link Ir.BinaryOp}. */
  public interface BinaryOp extends Expr {
    BinaryOpType opType();

    Val out();

    Val lhs();

    Val rhs();
  }

  /** Read-only view of a {@link Ir.ForLoop}. */
  public interface ForLoop extends Expr {
    Int index();

    IterDomain range();

    List<? extends Expr> body();
  }

  /** Read-only view of an {@link Ir.IfThenElse}. */
  public interface IfThenElse extends Expr {
    Int cond();

    List<? extends Expr> body();

    List<? extends Expr> elseBody();

    boolean hasElse();
  }
}

// End ConstIr.java
