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

import java.util.function.Consumer;
import net.hydromatic.fuser.dispatch.DispatchException;
import net.hydromatic.fuser.ir.Ir;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each replacement,
   * then calls the underlying tracer. */
  public static Tracer withOnReplace(Tracer tracer,
      Consumer<Ir.Expr> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onReplace(int pass, Ir.Expr expr,
          Ir.Expr replacement) {
        consumer.accept(replacement);
        super.onReplace(pass, expr, replacement);
      }
    };
  }

  /** Returns a tracer that performs the given action on the replacement
   * count of each pass, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer, Consumer<Integer> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPass(int pass, int replacementCount) {
        consumer.accept(replacementCount);
        super.onPass(pass, replacementCount);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<DispatchException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onException(DispatchException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onReplace(int pass, Ir.Expr expr,
        Ir.Expr replacement) {
    }

    @Override public void onPass(int pass, int replacementCount) {
    }

    @Override public void onException(DispatchException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onReplace(int pass, Ir.Expr expr,
        Ir.Expr replacement) {
      tracer.onReplace(pass, expr, replacement);
    }

    @Override public void onPass(int pass, int replacementCount) {
      tracer.onPass(pass, replacementCount);
    }

    @Override public void onException(DispatchException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
