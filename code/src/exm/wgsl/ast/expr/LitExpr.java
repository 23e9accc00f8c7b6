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

import com.google.common.base.Preconditions;

import exm.wgsl.ast.CodeWriter;

public class LitExpr extends Expr {
  private final Lit lit;

  public LitExpr(Lit lit) {
    this.lit = Preconditions.checkNotNull(lit);
  }

  public Lit lit() {
    return lit;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.LIT;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    lit.appendTo(out);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof LitExpr)) {
      return false;
    }
    return lit.equals(((LitExpr)o).lit);
  }

  @Override
  public int hashCode() {
    return lit.hashCode();
  }
}
