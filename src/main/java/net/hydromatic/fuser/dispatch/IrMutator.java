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
 * Handler that rewrites IR nodes, one method per concrete kind.
 *
 * <p>Each method returns either its argument, if nothing changed, or a
 * replacement. A method that rewrites a value must return a value, and a
 * method that rewrites an expression must return an expression; the
 * dispatcher does not check this. Whoever splices the result into the tree
 * (for example {@link net.hydromatic.fuser.pass.Rewriter}) takes ownership
 * of a new node.
 *
 * @see Dispatch#mutatorDispatch(IrMutator, Statement)
 */
public interface IrMutator {
  // values

  Statement mutate(Ir.IterDomain iterDomain);

  Statement mutate(Ir.TensorDomain tensorDomain);

  Statement mutate(Ir.Tensor tensor);

  Statement mutate(Ir.TensorView tensorView);

  Statement mutate(Ir.Float aFloat);

  Statement mutate(Ir.Int anInt);

  // expressions

  Statement mutate(Ir.Split split);

  Statement mutate(Ir.Merge merge);

  Statement mutate(Ir.Reorder reorder);

  Statement mutate(Ir.UnaryOp unaryOp);

  Statement mutate(Ir.BinaryOp binaryOp);

  Statement mutate(Ir.ForLoop forLoop);

  Statement mutate(Ir.IfThenElse ifThenElse);
}

// End IrMutator.java
