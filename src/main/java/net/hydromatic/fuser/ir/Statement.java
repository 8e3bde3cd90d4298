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

import net.hydromatic.fuser.pass.IrPrinter;

/**
 * Node of the fusion intermediate representation.
 *
 * <p>Every statement is exactly one of {@link Ir.Val} or {@link Ir.Expr}.
 * The set of sub-classes is closed: the constructor is package-private, and
 * each concrete class fixes its kind tag when it is constructed.
 */
public abstract class Statement implements ConstIr.Statement {
  private final int name;

  Statement(int name) {
    this.name = name;
  }

  @Override public int name() {
    return name;
  }

  /** Returns whether this statement is a value. */
  @Override public abstract boolean isVal();

  /** Returns whether this statement is an expression. */
  @Override public abstract boolean isExpr();

  /**
   * Converts this statement to a string.
   *
   * <p>Uses {@link IrPrinter} with default properties. The string is for
   * debugging; its format may change.
   */
  @Override public final String toString() {
    return IrPrinter.toString(this);
  }
}

// End Statement.java
