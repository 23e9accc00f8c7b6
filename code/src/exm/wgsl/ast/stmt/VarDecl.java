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
package exm.wgsl.ast.stmt;

import java.io.IOException;
import java.util.Objects;

import com.google.common.base.Preconditions;

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.expr.ExprNode;

/**
 * Mutable local variable, e.g. var x = 1;
 */
public class VarDecl extends Statement {
  private final String name;
  private final ExprNode initializer;

  public VarDecl(String name, ExprNode initializer) {
    this.name = Preconditions.checkNotNull(name);
    this.initializer = Preconditions.checkNotNull(initializer);
  }

  public String name() {
    return name;
  }

  public ExprNode initializer() {
    return initializer;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.VAR_DECL;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    out.append("var ");
    out.append(name);
    out.append(" = ");
    initializer.appendTo(out);
    out.append(';');
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof VarDecl)) {
      return false;
    }
    VarDecl other = (VarDecl)o;
    return name.equals(other.name) && initializer.equals(other.initializer);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, initializer);
  }
}
