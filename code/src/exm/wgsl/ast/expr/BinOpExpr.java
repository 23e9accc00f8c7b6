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
import java.util.Objects;

import com.google.common.base.Preconditions;

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.common.lang.Operators.BinaryOp;

/**
 * Binary operator application.  Both operands are always parenthesized
 * when printed, e.g. (a) + (b), so precedence and associativity never
 * need to be considered.
 */
public class BinOpExpr extends Expr {
  private final BinaryOp op;
  private final ExprNode left;
  private final ExprNode right;

  public BinOpExpr(BinaryOp op, ExprNode left, ExprNode right) {
    this.op = Preconditions.checkNotNull(op);
    this.left = Preconditions.checkNotNull(left);
    this.right = Preconditions.checkNotNull(right);
  }

  public BinaryOp op() {
    return op;
  }

  public ExprNode left() {
    return left;
  }

  public ExprNode right() {
    return right;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.BIN_OP;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    out.append('(');
    left.appendTo(out);
    out.append(") ");
    out.append(op.symbol());
    out.append(" (");
    right.appendTo(out);
    out.append(')');
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof BinOpExpr)) {
      return false;
    }
    BinOpExpr other = (BinOpExpr)o;
    return op == other.op && left.equals(other.left) &&
           right.equals(other.right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, left, right);
  }
}
