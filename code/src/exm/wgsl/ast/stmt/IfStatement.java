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
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.expr.ExprNode;

/**
 * If-then construct.  There is no else block.
 */
public class IfStatement extends Statement {
  private final ExprNode condition;
  private final ImmutableList<Statement> thenBlock;

  public IfStatement(ExprNode condition, List<Statement> thenBlock) {
    this.condition = Preconditions.checkNotNull(condition);
    this.thenBlock = ImmutableList.copyOf(thenBlock);
  }

  public ExprNode condition() {
    return condition;
  }

  public List<Statement> thenBlock() {
    return thenBlock;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.IF;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    out.append("if (");
    condition.appendTo(out);
    out.append(") {");
    appendBlockBody(out, thenBlock);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof IfStatement)) {
      return false;
    }
    IfStatement other = (IfStatement)o;
    return condition.equals(other.condition) &&
           thenBlock.equals(other.thenBlock);
  }

  @Override
  public int hashCode() {
    return Objects.hash(condition, thenBlock);
  }
}
