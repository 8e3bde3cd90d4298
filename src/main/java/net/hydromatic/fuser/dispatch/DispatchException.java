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

import static java.util.Objects.requireNonNull;

/**
 * A statement could not be routed to a handler method.
 *
 * <p>There is no recovery from this exception; it means that a node's tags
 * are corrupt, that a kind was added without a matching dispatch case, or
 * that a handler rejected a kind it does not handle.
 */
public class DispatchException extends RuntimeException {
  private final Reason reason;

  public DispatchException(Reason reason, String message) {
    super(message);
    this.reason = requireNonNull(reason);
  }

  /** Returns why dispatch failed. */
  public Reason reason() {
    return reason;
  }

  @Override public String toString() {
    return super.toString() + " [" + reason + "]";
  }

  /** Creates an exception for a statement that is neither a value nor an
   * expression. */
  static DispatchException unrecognizedCategory(Object statement) {
    return new DispatchException(Reason.UNRECOGNIZED_CATEGORY,
        "Unknown stmttype in dispatch: " + statement.getClass().getName());
  }

  /** Creates an exception for a kind tag that has no dispatch case. */
  static DispatchException unrecognizedKind(String category, Object tag) {
    return new DispatchException(Reason.UNRECOGNIZED_KIND,
        "Unknown " + category + " in dispatch: " + tag);
  }

  /** Creates an exception for a statement whose kind a handler does not
   * handle. */
  static DispatchException unhandledKind(Object handler, Object statement) {
    return new DispatchException(Reason.UNHANDLED_KIND,
        "Handle not overridden for " + statement.getClass().getSimpleName()
            + " in " + handler.getClass().getName());
  }

  /** Creates an exception for a rewrite that changed a statement's
   * category. */
  public static DispatchException categoryMismatch(Object original,
      Object replacement) {
    return new DispatchException(Reason.CATEGORY_MISMATCH,
        "Rewrite of " + original + " returned " + replacement
            + ", which has a different category");
  }

  /** Why dispatch failed. */
  public enum Reason {
    /** Statement is neither a value nor an expression. */
    UNRECOGNIZED_CATEGORY,
    /** Kind tag has no case in a dispatch table. */
    UNRECOGNIZED_KIND,
    /** Handler that requires explicit handling did not handle a kind. */
    UNHANDLED_KIND,
    /** Mutator replaced a value with an expression, or vice versa. */
    CATEGORY_MISMATCH
  }
}

// End DispatchException.java
