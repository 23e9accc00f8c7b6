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
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.common.lang.Types.DataType;

/**
 * Construct a value of a type from argument values, e.g. vec2<i32>(1, 2).
 *
 * The number and types of arguments are assumed to match the type;
 * they are not checked.
 */
public class TypeConsExpr extends Expr {
  private final DataType type;
  private final ImmutableList<ExprNode> args;

  public TypeConsExpr(DataType type, List<ExprNode> args) {
    this.type = Preconditions.checkNotNull(type);
    this.args = ImmutableList.copyOf(args);
  }

  public DataType type() {
    return type;
  }

  public List<ExprNode> args() {
    return args;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.TYPE_CONS;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    out.append(type.typeName());
    out.append('(');
    out.appendCommaSeparated(args);
    out.append(')');
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TypeConsExpr)) {
      return false;
    }
    TypeConsExpr other = (TypeConsExpr)o;
    return type.equals(other.type) && args.equals(other.args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, args);
  }
}
