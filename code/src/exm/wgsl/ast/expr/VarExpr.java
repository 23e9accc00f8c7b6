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

/**
 * Reference to a named variable
 */
public class VarExpr extends Expr {
  private final String name;

  public VarExpr(String name) {
    this.name = Preconditions.checkNotNull(name);
  }

  public String name() {
    return name;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.VAR;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    out.append(name);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof VarExpr)) {
      return false;
    }
    return name.equals(((VarExpr)o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }
}
