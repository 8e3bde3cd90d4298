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
package net.hydromatic.fuser.pass;

import net.hydromatic.fuser.dispatch.DispatchException;
import net.hydromatic.fuser.ir.Ir;

/** Called on various events during rewriting. */
public interface Tracer {
  /** Called when a pass replaces a top-level expression. */
  void onReplace(int pass, Ir.Expr expr, Ir.Expr replacement);

  /** Called at the end of each pass with the number of expressions that it
   * replaced. */
  void onPass(int pass, int replacementCount);

  /**
   * Called with an exception thrown during a rewrite. The exception
   * propagates to the caller of {@link Rewriter#rewrite} after this method
   * returns.
   */
  void onException(DispatchException e);
}

// End Tracer.java
