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
import exm.wgsl.common.lang.Operators.UnaryOp;

/**
 * Unary operator application.  The operand is always parenthesized
 * when printed, e.g. -(x).
 */
public class UnOpExpr extends Expr {
  private final UnaryOp op;
  private final ExprNode operand;

  public UnOpExpr(UnaryOp op, ExprNode operand) {
    this.op = Preconditions.checkNotNull(op);
    this.operand = Preconditions.checkNotNull(operand);
  }

  public UnaryOp op() {
    return op;
  }

  public ExprNode operand() {
    return operand;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.UN_OP;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    out.append(op.symbol());
    out.append('(');
    operand.appendTo(out);
    out.append(')');
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof UnOpExpr)) {
      return false;
    }
    UnOpExpr other = (UnOpExpr)o;
    return op == other.op && operand.equals(other.operand);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, operand);
  }
}
