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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Nodes of the fusion IR.
 *
 * <p>This class functions as a namespace, so that we can keep the class
 * names short. Nodes are created by {@link Fusion}, which assigns their
 * names.
 */
public class Ir {
  private Ir() {}

  /** Base class of value nodes: dimensions, domains, tensors, views and
   * scalars. */
  public abstract static class Val extends Statement implements ConstIr.Val {
    private final ValType valType;
    private final @Nullable DataType dataType;

    Val(int name, ValType valType, @Nullable DataType dataType) {
      super(name);
      this.valType = requireNonNull(valType);
      this.dataType = dataType;
    }

    @Override public final boolean isVal() {
      return true;
    }

    @Override public final boolean isExpr() {
      return false;
    }

    @Override public ValType valType() {
      return valType;
    }

    @Override public @Nullable DataType dataType() {
      return dataType;
    }
  }

  /** Base class of expression nodes. An expression relates input values to
   * output values. */
  public abstract static class Expr extends Statement implements ConstIr.Expr {
    private final ExprType exprType;
    private final ImmutableList<Val> inputs;
    private final ImmutableList<Val> outputs;

    Expr(int name, ExprType exprType, List<? extends Val> inputs,
        List<? extends Val> outputs) {
      super(name);
      this.exprType = requireNonNull(exprType);
      this.inputs = ImmutableList.copyOf(inputs);
      this.outputs = ImmutableList.copyOf(outputs);
    }

    @Override public final boolean isVal() {
      return false;
    }

    @Override public final boolean isExpr() {
      return true;
    }

    @Override public ExprType exprType() {
      return exprType;
    }

    @Override public ImmutableList<Val> inputs() {
      return inputs;
    }

    @Override public ImmutableList<Val> outputs() {
      return outputs;
    }
  }

  /** One dimension of a tensor domain: iterates from {@code start} for
   * {@code extent} steps. */
  public static class IterDomain extends Val implements ConstIr.IterDomain {
    private final Int start;
    private final Int extent;
    private final boolean reduction;
    private ParallelType parallelType;

    IterDomain(int name, Int start, Int extent, ParallelType parallelType,
        boolean reduction) {
      super(name, ValType.ITER_DOMAIN, null);
      this.start = requireNonNull(start, "start");
      this.extent = requireNonNull(extent, "extent");
      this.parallelType = requireNonNull(parallelType, "parallelType");
      this.reduction = reduction;
    }

    @Override public Int start() {
      return start;
    }

    @Override public Int extent() {
      return extent;
    }

    @Override public ParallelType parallelType() {
      return parallelType;
    }

    @Override public boolean isReduction() {
      return reduction;
    }

    /** Binds this dimension to a parallel type. */
    public void parallelize(ParallelType parallelType) {
      this.parallelType = requireNonNull(parallelType);
    }
  }

  /** Ordered list of dimensions. */
  public static class TensorDomain extends Val
      implements ConstIr.TensorDomain {
    private final ImmutableList<IterDomain> domain;

    TensorDomain(int name, List<IterDomain> domain) {
      super(name, ValType.TENSOR_DOMAIN, null);
      this.domain = ImmutableList.copyOf(domain);
    }

    @Override public ImmutableList<IterDomain> domain() {
      return domain;
    }

    @Override public int nDims() {
      return domain.size();
    }

    @Override public IterDomain axis(int i) {
      checkElementIndex(i, domain.size(), "axis");
      return domain.get(i);
    }
  }

  /** Tensor of a given data type, optionally with a known domain. */
  public static class Tensor extends Val implements ConstIr.Tensor {
    private final @Nullable TensorDomain domain;

    Tensor(int name, DataType dataType, @Nullable TensorDomain domain) {
      super(name, ValType.TENSOR, requireNonNull(dataType, "dataType"));
      this.domain = domain;
    }

    @Override public @Nullable TensorDomain domain() {
      return domain;
    }
  }

  /** View of a tensor through a domain. Scheduling replaces the domain as
   * it splits, merges and reorders dimensions. */
  public static class TensorView extends Val implements ConstIr.TensorView {
    private final Tensor tensor;
    private TensorDomain domain;

    TensorView(int name, Tensor tensor, TensorDomain domain) {
      super(name, ValType.TENSOR_VIEW, tensor.dataType());
      this.tensor = tensor;
      this.domain = requireNonNull(domain, "domain");
    }

    @Override public Tensor tensor() {
      return tensor;
    }

    @Override public TensorDomain domain() {
      return domain;
    }

    /** Replaces the domain through which this view sees its tensor. */
    public void setDomain(TensorDomain domain) {
      this.domain = requireNonNull(domain);
    }
  }

  /** Base class of scalar values. A scalar is either a constant or
   * symbolic. */
  public abstract static class Scalar extends Val implements ConstIr.Scalar {
    Scalar(int name, DataType dataType) {
      super(name, ValType.SCALAR, requireNonNull(dataType, "dataType"));
    }

    @Override public DataType dataType() {
      return requireNonNull(super.dataType());
    }

    /** Returns whether this scalar's value is unknown until run time. */
    @Override public abstract boolean isSymbolic();
  }

  /** Floating-point scalar. */
  public static class Float extends Scalar implements ConstIr.Float {
    private final @Nullable Double value;

    Float(int name, @Nullable Double value) {
      super(name, DataType.FLOAT);
      this.value = value;
    }

    @Override public @Nullable Double value() {
      return value;
    }

    @Override public boolean isSymbolic() {
      return value == null;
    }
  }

  /** Integer scalar. */
  public static class Int extends Scalar implements ConstIr.Int {
    private final @Nullable Integer value;

    Int(int name, @Nullable Integer value) {
      super(name, DataType.INT);
      this.value = value;
    }

    @Override public @Nullable Integer value() {
      return value;
    }

    @Override public boolean isSymbolic() {
      return value == null;
    }
  }

  /** Splits dimension {@code axis} of a domain into two dimensions, the
   * inner of which has extent {@code factor}. */
  public static class Split extends Expr implements ConstIr.Split {
    private final TensorDomain out;
    private final TensorDomain in;
    private final int axis;
    private final Int factor;

    Split(int name, TensorDomain out, TensorDomain in, int axis, Int factor) {
      super(name, ExprType.SPLIT, ImmutableList.of(in, factor),
          ImmutableList.of(out));
      checkElementIndex(axis, in.nDims(), "axis");
      this.out = out;
      this.in = in;
      this.axis = axis;
      this.factor = factor;
    }

    @Override public TensorDomain out() {
      return out;
    }

    @Override public TensorDomain in() {
      return in;
    }

    @Override public int axis() {
      return axis;
    }

    @Override public Int factor() {
      return factor;
    }
  }

  /** Merges dimensions {@code axis} and {@code axis + 1} of a domain. */
  public static class Merge extends Expr implements ConstIr.Merge {
    private final TensorDomain out;
    private final TensorDomain in;
    private final int axis;

    Merge(int name, TensorDomain out, TensorDomain in, int axis) {
      super(name, ExprType.MERGE, ImmutableList.of(in), ImmutableList.of(out));
      checkArgument(axis >= 0 && axis + 1 < in.nDims(),
          "cannot merge axis %s of a domain with %s dimensions", axis,
          in.nDims());
      this.out = out;
      this.in = in;
      this.axis = axis;
    }

    @Override public TensorDomain out() {
      return out;
    }

    @Override public TensorDomain in() {
      return in;
    }

    @Override public int axis() {
      return axis;
    }
  }

  /** Permutes the dimensions of a domain. Element {@code i} of
   * {@code pos2axis} is the position in the output of input axis
   * {@code i}. */
  public static class Reorder extends Expr implements ConstIr.Reorder {
    private final TensorDomain out;
    private final TensorDomain in;
    private final ImmutableList<Integer> pos2axis;

    Reorder(int name, TensorDomain out, TensorDomain in,
        List<Integer> pos2axis) {
      super(name, ExprType.REORDER, ImmutableList.of(in),
          ImmutableList.of(out));
      this.pos2axis = ImmutableList.copyOf(pos2axis);
      checkArgument(this.pos2axis.size() == in.nDims(),
          "reorder of %s dimensions has %s positions", in.nDims(),
          this.pos2axis.size());
      final Set<Integer> seen = new HashSet<>();
      for (int pos : this.pos2axis) {
        checkElementIndex(pos, in.nDims(), "position");
        checkArgument(seen.add(pos), "duplicate position %s", pos);
      }
      this.out = out;
      this.in = in;
    }

    @Override public TensorDomain out() {
      return out;
    }

    @Override public TensorDomain in() {
      return in;
    }

    @Override public ImmutableList<Integer> pos2axis() {
      return pos2axis;
    }
  }

  /** Applies a unary operator, {@code out = op(in)}. */
  public static class UnaryOp extends Expr implements ConstIr.UnaryOp {
    private final UnaryOpType opType;
    private final Val out;
    private final Val in;

    UnaryOp(int name, UnaryOpType opType, Val out, Val in) {
      super(name, ExprType.UNARY_OP, ImmutableList.of(in),
          ImmutableList.of(out));
      this.opType = requireNonNull(opType);
      this.out = out;
      this.in = in;
      checkArgument(opType != UnaryOpType.CAST || out.dataType() != null,
          "cast target %s has no data type", out.name());
    }

    @Override public UnaryOpType opType() {
      return opType;
    }

    @Override public Val out() {
      return out;
    }

    @Override public Val in() {
      return in;
    }
  }

  /** Applies a binary operator, {@code out = lhs op rhs}. */
  public static class BinaryOp extends Expr implements ConstIr.BinaryOp {
    private final BinaryOpType opType;
    private final Val out;
    private final Val lhs;
    private final Val rhs;

    BinaryOp(int name, BinaryOpType opType, Val out, Val lhs, Val rhs) {
      super(name, ExprType.BINARY_OP, ImmutableList.of(lhs, rhs),
          ImmutableList.of(out));
      this.opType = requireNonNull(opType);
      this.out = out;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    @Override public BinaryOpType opType() {
      return opType;
    }

    @Override public Val out() {
      return out;
    }

    @Override public Val lhs() {
      return lhs;
    }

    @Override public Val rhs() {
      return rhs;
    }
  }

  /** Loop that binds {@code index} to each point of {@code range} and
   * evaluates its body. */
  public static class ForLoop extends Expr implements ConstIr.ForLoop {
    private final Int index;
    private final IterDomain range;
    private final ImmutableList<Expr> body;

    ForLoop(int name, Int index, IterDomain range, List<? extends Expr> body) {
      super(name, ExprType.FOR_LOOP, ImmutableList.of(index, range),
          ImmutableList.of());
      this.index = index;
      this.range = range;
      this.body = ImmutableList.copyOf(body);
    }

    @Override public Int index() {
      return index;
    }

    @Override public IterDomain range() {
      return range;
    }

    @Override public ImmutableList<Expr> body() {
      return body;
    }
  }

  /** Conditional. Evaluates {@code body} if {@code cond} is non-zero,
   * otherwise {@code elseBody}. */
  public static class IfThenElse extends Expr implements ConstIr.IfThenElse {
    private final Int cond;
    private final ImmutableList<Expr> body;
    private final ImmutableList<Expr> elseBody;

    IfThenElse(int name, Int cond, List<? extends Expr> body,
        List<? extends Expr> elseBody) {
      super(name, ExprType.IF_THEN_ELSE, ImmutableList.of(cond),
          ImmutableList.of());
      this.cond = cond;
      this.body = ImmutableList.copyOf(body);
      this.elseBody = ImmutableList.copyOf(elseBody);
    }

    @Override public Int cond() {
      return cond;
    }

    @Override public ImmutableList<Expr> body() {
      return body;
    }

    @Override public ImmutableList<Expr> elseBody() {
      return elseBody;
    }

    @Override public boolean hasElse() {
      return !elseBody.isEmpty();
    }
  }
}

// End Ir.java
