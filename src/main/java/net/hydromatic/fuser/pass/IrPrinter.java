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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fuser.dispatch.OptInConstDispatch;
import net.hydromatic.fuser.ir.ConstIr;
import net.hydromatic.fuser.ir.Fusion;
import net.hydromatic.fuser.ir.ParallelType;

/**
 * Prints IR as text.
 *
 * <p>A value prints as its name or, for domains and views, as its structure,
 * for example "{@code T2}", "{@code i4}", "{@code iS3{i1}}",
 * "{@code TV5[iS3{i1}]}". An expression prints as one or more lines, for
 * example "{@code T6 = T2 + T5}".
 *
 * <p>The printer sees read-only views of the nodes, and therefore cannot
 * modify them.
 */
public class IrPrinter extends OptInConstDispatch {
  private final StringBuilder buf;
  private final boolean printInline;
  private final int indentSize;
  private int indent;

  /** Creates an IrPrinter that appends to a given buffer. */
  public IrPrinter(StringBuilder buf, Map<Prop, Object> map) {
    this.buf = requireNonNull(buf);
    this.printInline = Prop.PRINT_INLINE.booleanValue(map);
    this.indentSize = Prop.INDENT.intValue(map);
  }

  /** Prints a statement with default properties. */
  public static String toString(ConstIr.Statement statement) {
    return toString(statement, ImmutableMap.of());
  }

  /** Prints a statement. An expression's trailing line break is
   * removed. */
  public static String toString(ConstIr.Statement statement,
      Map<Prop, Object> map) {
    final StringBuilder buf = new StringBuilder();
    new IrPrinter(buf, map).handle(statement);
    return trimEnd(buf);
  }

  /** Prints the top-level expressions of a fusion with default
   * properties. */
  public static String toString(Fusion fusion) {
    return toString(fusion, ImmutableMap.of());
  }

  /** Prints the top-level expressions of a fusion. */
  public static String toString(Fusion fusion, Map<Prop, Object> map) {
    final StringBuilder buf = new StringBuilder();
    new IrPrinter(buf, map).printFusion(fusion);
    return buf.toString();
  }

  /** Prints the top-level expressions of a fusion, wrapped in
   * "{@code %kernel { ... }}". */
  public IrPrinter printFusion(Fusion fusion) {
    buf.append("%kernel {\n");
    print(fusion.exprs());
    buf.append("}\n");
    return this;
  }

  private static String trimEnd(StringBuilder buf) {
    int end = buf.length();
    while (end > 0 && buf.charAt(end - 1) == '\n') {
      --end;
    }
    return buf.substring(0, end);
  }

  private void print(List<? extends ConstIr.Expr> exprs) {
    for (ConstIr.Expr expr : exprs) {
      handle(expr);
    }
  }

  private void printBody(List<? extends ConstIr.Expr> body) {
    ++indent;
    print(body);
    --indent;
  }

  private static String prefix(ConstIr.Scalar scalar) {
    return requireNonNull(scalar.dataType()).prefix;
  }

  private void startLine() {
    buf.append(Strings.repeat(" ", indent * indentSize));
  }

  // values

  @Override public void handle(ConstIr.IterDomain iterDomain) {
    buf.append(iterDomain.isReduction() ? "rS" : iterDomain.valType().prefix)
        .append(iterDomain.name())
        .append('{');
    final ConstIr.Int start = iterDomain.start();
    if (start.isSymbolic() || start.value() != 0) {
      handle(start);
      buf.append(" : ");
    }
    handle(iterDomain.extent());
    buf.append('}');
    if (iterDomain.parallelType() != ParallelType.SERIAL) {
      buf.append('(').append(iterDomain.parallelType().label).append(')');
    }
  }

  @Override public void handle(ConstIr.TensorDomain tensorDomain) {
    buf.append('[');
    for (int i = 0; i < tensorDomain.nDims(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      handle(tensorDomain.axis(i));
    }
    buf.append(']');
  }

  @Override public void handle(ConstIr.Tensor tensor) {
    buf.append(tensor.valType().prefix).append(tensor.name());
  }

  @Override public void handle(ConstIr.TensorView tensorView) {
    buf.append(tensorView.valType().prefix).append(tensorView.name());
    handle(tensorView.domain());
  }

  @Override public void handle(ConstIr.Float aFloat) {
    final Double value = aFloat.value();
    if (printInline && value != null) {
      buf.append(value).append('f');
    } else {
      buf.append(prefix(aFloat)).append(aFloat.name());
    }
  }

  @Override public void handle(ConstIr.Int anInt) {
    final Integer value = anInt.value();
    if (printInline && value != null) {
      buf.append(value);
    } else {
      buf.append(prefix(anInt)).append(anInt.name());
    }
  }

  // expressions

  @Override public void handle(ConstIr.Split split) {
    startLine();
    buf.append("Split: ");
    handle(split.in());
    buf.append(" axis ").append(split.axis()).append(" by factor ");
    handle(split.factor());
    buf.append(" -> ");
    handle(split.out());
    buf.append('\n');
  }

  @Override public void handle(ConstIr.Merge merge) {
    startLine();
    buf.append("Merge: ");
    handle(merge.in());
    buf.append(" axis ").append(merge.axis())
        .append(" with ").append(merge.axis() + 1)
        .append(" -> ");
    handle(merge.out());
    buf.append('\n');
  }

  @Override public void handle(ConstIr.Reorder reorder) {
    startLine();
    buf.append("Reorder: ");
    handle(reorder.in());
    buf.append(" -> ");
    handle(reorder.out());
    buf.append(" by ").append(reorder.pos2axis()).append('\n');
  }

  @Override public void handle(ConstIr.UnaryOp unaryOp) {
    startLine();
    handle(unaryOp.out());
    buf.append(" = ");
    switch (unaryOp.opType()) {
    case NEG:
      buf.append('-');
      break;
    case CAST:
      buf.append('(')
          .append(requireNonNull(unaryOp.out().dataType()).typeName)
          .append(") ");
      break;
    default:
      throw new AssertionError("unknown unary op " + unaryOp.opType());
    }
    handle(unaryOp.in());
    buf.append('\n');
  }

  @Override public void handle(ConstIr.BinaryOp binaryOp) {
    startLine();
    handle(binaryOp.out());
    buf.append(" = ");
    handle(binaryOp.lhs());
    buf.append(binaryOp.opType().padded);
    handle(binaryOp.rhs());
    buf.append('\n');
  }

  @Override public void handle(ConstIr.ForLoop forLoop) {
    startLine();
    buf.append("for(");
    handle(forLoop.index());
    buf.append(" in ");
    handle(forLoop.range());
    buf.append(") {\n");
    printBody(forLoop.body());
    startLine();
    buf.append("}\n");
  }

  @Override public void handle(ConstIr.IfThenElse ifThenElse) {
    startLine();
    buf.append("if(");
    handle(ifThenElse.cond());
    buf.append(") {\n");
    printBody(ifThenElse.body());
    if (ifThenElse.hasElse()) {
      startLine();
      buf.append("} else {\n");
      printBody(ifThenElse.elseBody());
    }
    startLine();
    buf.append("}\n");
  }
}

// End IrPrinter.java
