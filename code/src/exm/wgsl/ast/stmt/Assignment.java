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

public class Assignment extends Statement {
  private final AssignmentLhs lhs;
  private final ExprNode value;

  public Assignment(AssignmentLhs lhs, ExprNode value) {
    this.lhs = Preconditions.checkNotNull(lhs);
    this.value = Preconditions.checkNotNull(value);
  }

  public AssignmentLhs lhs() {
    return lhs;
  }

  public ExprNode value() {
    return value;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.ASSIGNMENT;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    lhs.appendTo(out);
    out.append(" = ");
    value.appendTo(out);
    out.append(';');
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Assignment)) {
      return false;
    }
    Assignment other = (Assignment)o;
    return lhs.equals(other.lhs) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lhs, value);
  }
}
