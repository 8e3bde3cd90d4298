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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Kind of {@link Ir.Val}. */
public enum ValType {
  ITER_DOMAIN("iS"),
  TENSOR_DOMAIN("TD"),
  TENSOR("T"),
  TENSOR_VIEW("TV"),
  /** Scalar; refined by {@link DataType}. */
  SCALAR(null);

  /** Prefix used when printing a value of this kind by name, e.g. "T" in
   * "T3"; null for scalars, whose prefix comes from their data type. */
  public final @Nullable String prefix;

  ValType(@Nullable String prefix) {
    this.prefix = prefix;
  }
}

// End ValType.java
