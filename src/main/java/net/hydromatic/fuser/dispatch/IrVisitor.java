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

/**
 * Handler that observes IR nodes, one method per concrete kind.
 *
 * <p>A class that implements this interface directly must handle every
 * kind; the compiler rejects a class that omits one. To handle only some
 * kinds, extend {@link OptOutDispatch} (other kinds are ignored) or
 * {@link OptInDispatch} (other kinds fail at dispatch time).
 *
 * @see Dispatch#dispatch(IrVisitor, net.hydromatic.fuser.ir.Statement)
 */
public interface IrVisitor {
  // values

  void handle(Ir.IterDomain iterDomain);

  void handle(Ir.TensorDomain tensorDomain);

  void handle(Ir.Tensor tensor);

  void handle(Ir.TensorView tensorView);

  void handle(Ir.Float aFloat);

  void handle(Ir.Int anInt);

  // expressions

  void handle(Ir.Split split);

  void handle(Ir.Merge merge);

  void handle(Ir.Reorder reorder);

  void handle(Ir.UnaryOp unaryOp);

  void handle(Ir.BinaryOp binaryOp);

  void handle(Ir.ForLoop forLoop);

  void handle(Ir.IfThenElse ifThenElse);
}

// End IrVisitor.java
