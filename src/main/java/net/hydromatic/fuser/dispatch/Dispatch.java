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
import net.hydromatic.fuser.ir.DataType;
import net.hydromatic.fuser.ir.Ir;
import net.hydromatic.fuser.ir.Statement;

/**
 * Routes a statement to the handler method for its concrete kind.
 *
 * <p>Routing looks only at the category predicates ({@link
 * Statement#isVal()}, {@link Statement#isExpr()}) and the kind tags ({@link
 * Ir.Val#valType()}, {@link Ir.Val#dataType()} for scalars, {@link
 * Ir.Expr#exprType()}), then casts the statement to the class that the tag
 * names. Each call invokes exactly one handler method. The handler method
 * may visit children by calling back into this class.
 *
 * <p>There are three families of methods: {@code dispatch} for handlers
 * that may modify nodes, {@code constDispatch} for handlers that see
 * read-only views, and {@code mutatorDispatch} for handlers that return a
 * replacement.
 *
 * <p>When you add a kind, add a case to each of the three families, a
 * method to {@link IrVisitor}, {@link ConstIrVisitor} and {@link
 * IrMutator}, and a default to each base class.
 */
public class Dispatch {
  private Dispatch() {}

  /** Routes a statement to a visitor. */
  public static void dispatch(IrVisitor handler, Statement statement) {
    if (statement.isVal()) {
      dispatch(handler, (Ir.Val) statement);
    } else if (statement.isExpr()) {
      dispatch(handler, (Ir.Expr) statement);
    } else {
      throw DispatchException.unrecognizedCategory(statement);
    }
  }

  /** Routes a value to a visitor. */
  public static void dispatch(IrVisitor handler, Ir.Val val) {
    switch (val.valType()) {
    case ITER_DOMAIN:
      handler.handle((Ir.IterDomain) val);
      return;
    case TENSOR_DOMAIN:
      handler.handle((Ir.TensorDomain) val);
      return;
    case TENSOR:
      handler.handle((Ir.Tensor) val);
      return;
    case TENSOR_VIEW:
      handler.handle((Ir.TensorView) val);
      return;
    case SCALAR:
      switch (scalarType(val)) {
      case FLOAT:
        handler.handle((Ir.Float) val);
        return;
      case INT:
        handler.handle((Ir.Int) val);
        return;
      default:
        throw DispatchException.unrecognizedKind("datatype", val.dataType());
      }
    default:
      throw DispatchException.unrecognizedKind("valtype", val.valType());
    }
  }

  /** Routes an expression to a visitor. */
  public static void dispatch(IrVisitor handler, Ir.Expr expr) {
    switch (expr.exprType()) {
    case SPLIT:
      handler.handle((Ir.Split) expr);
      return;
    case MERGE:
      handler.handle((Ir.Merge) expr);
      return;
    case REORDER:
      handler.handle((Ir.Reorder) expr);
      return;
    case UNARY_OP:
      handler.handle((Ir.UnaryOp) expr);
      return;
    case BINARY_OP:
      handler.handle((Ir.BinaryOp) expr);
      return;
    case FOR_LOOP:
      handler.handle((Ir.ForLoop) expr);
      return;
    case IF_THEN_ELSE:
      handler.handle((Ir.IfThenElse) expr);
      return;
    default:
      throw DispatchException.unrecognizedKind("exprtype", expr.exprType());
    }
  }

  /** Routes a read-only view of a statement to a visitor. */
  public static void constDispatch(ConstIrVisitor handler,
      ConstIr.Statement statement) {
    if (statement.isVal()) {
      constDispatch(handler, (ConstIr.Val) statement);
    } else if (statement.isExpr()) {
      constDispatch(handler, (ConstIr.Expr) statement);
    } else {
      throw DispatchException.unrecognizedCategory(statement);
    }
  }

  /** Routes a read-only view of a value to a visitor. */
  public static void constDispatch(ConstIrVisitor handler, ConstIr.Val val) {
    switch (val.valType()) {
    case ITER_DOMAIN:
      handler.handle((ConstIr.IterDomain) val);
      return;
    case TENSOR_DOMAIN:
      handler.handle((ConstIr.TensorDomain) val);
      return;
    case TENSOR:
      handler.handle((ConstIr.Tensor) val);
      return;
    case TENSOR_VIEW:
      handler.handle((ConstIr.TensorView) val);
      return;
    case SCALAR:
      switch (scalarType(val)) {
      case FLOAT:
        handler.handle((ConstIr.Float) val);
        return;
      case INT:
        handler.handle((ConstIr.Int) val);
        return;
      default:
        throw DispatchException.unrecognizedKind("datatype", val.dataType());
      }
    default:
      throw DispatchException.unrecognizedKind("valtype", val.valType());
    }
  }

  /** Routes a read-only view of an expression to a visitor. */
  public static void constDispatch(ConstIrVisitor handler,
      ConstIr.Expr expr) {
    switch (expr.exprType()) {
    case SPLIT:
      handler.handle((ConstIr.Split) expr);
      return;
    case MERGE:
      handler.handle((ConstIr.Merge) expr);
      return;
    case REORDER:
      handler.handle((ConstIr.Reorder) expr);
      return;
    case UNARY_OP:
      handler.handle((ConstIr.UnaryOp) expr);
      return;
    case BINARY_OP:
      handler.handle((ConstIr.BinaryOp) expr);
      return;
    case FOR_LOOP:
      handler.handle((ConstIr.ForLoop) expr);
      return;
    case IF_THEN_ELSE:
      handler.handle((ConstIr.IfThenElse) expr);
      return;
    default:
      throw DispatchException.unrecognizedKind("exprtype", expr.exprType());
    }
  }

  /** Routes a statement to a mutator, and returns the mutator's
   * replacement. */
  public static Statement mutatorDispatch(IrMutator mutator,
      Statement statement) {
    if (statement.isVal()) {
      return mutatorDispatch(mutator, (Ir.Val) statement);
    }
    if (statement.isExpr()) {
      return mutatorDispatch(mutator, (Ir.Expr) statement);
    }
    throw DispatchException.unrecognizedCategory(statement);
  }

  /** Routes a value to a mutator, and returns the mutator's replacement. */
  public static Statement mutatorDispatch(IrMutator mutator, Ir.Val val) {
    switch (val.valType()) {
    case ITER_DOMAIN:
      return mutator.mutate((Ir.IterDomain) val);
    case TENSOR_DOMAIN:
      return mutator.mutate((Ir.TensorDomain) val);
    case TENSOR:
      return mutator.mutate((Ir.Tensor) val);
    case TENSOR_VIEW:
      return mutator.mutate((Ir.TensorView) val);
    case SCALAR:
      switch (scalarType(val)) {
      case FLOAT:
        return mutator.mutate((Ir.Float) val);
      case INT:
        return mutator.mutate((Ir.Int) val);
      default:
        throw DispatchException.unrecognizedKind("datatype", val.dataType());
      }
    default:
      throw DispatchException.unrecognizedKind("valtype", val.valType());
    }
  }

  /** Routes an expression to a mutator, and returns the mutator's
   * replacement. */
  public static Statement mutatorDispatch(IrMutator mutator, Ir.Expr expr) {
    switch (expr.exprType()) {
    case SPLIT:
      return mutator.mutate((Ir.Split) expr);
    case MERGE:
      return mutator.mutate((Ir.Merge) expr);
    case REORDER:
      return mutator.mutate((Ir.Reorder) expr);
    case UNARY_OP:
      return mutator.mutate((Ir.UnaryOp) expr);
    case BINARY_OP:
      return mutator.mutate((Ir.BinaryOp) expr);
    case FOR_LOOP:
      return mutator.mutate((Ir.ForLoop) expr);
    case IF_THEN_ELSE:
      return mutator.mutate((Ir.IfThenElse) expr);
    default:
      throw DispatchException.unrecognizedKind("exprtype", expr.exprType());
    }
  }

  /** Returns the data type of a scalar. */
  private static DataType scalarType(ConstIr.Val val) {
    final DataType dataType = val.dataType();
    if (dataType == null) {
      throw DispatchException.unrecognizedKind("datatype", null);
    }
    return dataType;
  }
}

// End Dispatch.java
