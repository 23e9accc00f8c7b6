/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.wgsl.ast.expr;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.ShaderTree;
import exm.wgsl.common.lang.OpTypeEvaluator;
import exm.wgsl.common.lang.Operators.BinaryOp;
import exm.wgsl.common.lang.Operators.UnaryOp;
import exm.wgsl.common.lang.Types.DataType;

/**
 * An expression paired with its resolved type.
 *
 * The type is trusted: it must be what {@link OpTypeEvaluator} (or the
 * constructed type, for type constructors) gives for the expression.
 * The static builders below compute it that way; the public constructor
 * takes it as given.
 */
public class ExprNode extends ShaderTree {
  private final DataType dataType;
  private final Expr expr;

  public ExprNode(DataType dataType, Expr expr) {
    this.dataType = Preconditions.checkNotNull(dataType);
    this.expr = Preconditions.checkNotNull(expr);
  }

  public DataType dataType() {
    return dataType;
  }

  public Expr expr() {
    return expr;
  }

  public static ExprNode lit(Lit lit) {
    return new ExprNode(lit.dataType(), new LitExpr(lit));
  }

  public static ExprNode boolLit(boolean v) {
    return lit(Lit.createBoolLit(v));
  }

  public static ExprNode intLit(int v) {
    return lit(Lit.createIntLit(v));
  }

  public static ExprNode uintLit(long v) {
    return lit(Lit.createUIntLit(v));
  }

  /**
   * @param name
   * @param type declared type of the variable, as resolved by the caller
   */
  public static ExprNode varRef(String name, DataType type) {
    return new ExprNode(type, new VarExpr(name));
  }

  public static ExprNode typeCons(DataType type, List<ExprNode> args) {
    return new ExprNode(type, new TypeConsExpr(type, args));
  }

  public static ExprNode typeCons(DataType type, ExprNode... args) {
    return typeCons(type, Arrays.asList(args));
  }

  public static ExprNode unOp(UnaryOp op, ExprNode operand) {
    DataType type = OpTypeEvaluator.evalUnary(op, operand.dataType());
    return new ExprNode(type, new UnOpExpr(op, operand));
  }

  public static ExprNode binOp(BinaryOp op, ExprNode left, ExprNode right) {
    DataType type = OpTypeEvaluator.evalBinary(op, left.dataType(),
                                               right.dataType());
    return new ExprNode(type, new BinOpExpr(op, left, right));
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    // Type is not printed
    expr.appendTo(out);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ExprNode)) {
      return false;
    }
    ExprNode other = (ExprNode)o;
    return dataType.equals(other.dataType) && expr.equals(other.expr);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dataType, expr);
  }
}
