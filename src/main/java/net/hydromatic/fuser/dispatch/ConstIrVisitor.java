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
 * Handler that observes read-only views of IR nodes, one method per
 * concrete kind.
 *
 * <p>Printers and analyses implement this interface, or extend
 * {@link OptInConstDispatch}. Because each method receives a
 * {@link ConstIr} view, the compiler rejects a handler that tries to
 * modify the node it is visiting.
 *
 * @see Dispatch#constDispatch(ConstIrVisitor, ConstIr.Statement)
 */
public interface ConstIrVisitor {
  // values

  void handle(ConstIr.IterDomain iterDomain);

  void handle(ConstIr.TensorDomain tensorDomain);

  void handle(ConstIr.Tensor tensor);

  void handle(ConstIr.TensorView tensorView);

  void handle(ConstIr.Float aFloat);

  void handle(ConstIr.Int anInt);

  // expressions

  void handle(ConstIr.Split split);

  void handle(ConstIr.Merge merge);

  void handle(ConstIr.Reorder reorder);

  void handle(ConstIr.UnaryOp unaryOp);

  void handle(ConstIr.BinaryOp binaryOp);

  void handle(ConstIr.ForLoop forLoop);

  void handle(ConstIr.IfThenElse ifThenElse);
}

// End ConstIrVisitor.java
