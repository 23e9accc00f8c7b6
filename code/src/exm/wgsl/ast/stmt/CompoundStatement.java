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
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.wgsl.ast.CodeWriter;

/**
 * Braced block of statements with its own scope
 */
public class CompoundStatement extends Statement {
  private final ImmutableList<Statement> stmts;

  public CompoundStatement(List<Statement> stmts) {
    this.stmts = ImmutableList.copyOf(stmts);
  }

  public CompoundStatement(Statement... stmts) {
    this(Arrays.asList(stmts));
  }

  public List<Statement> statements() {
    return stmts;
  }

  @Override
  public StatementKind kind() {
    return StatementKind.COMPOUND;
  }

  @Override
  public List<Statement> toCompoundStatements() {
    return stmts;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    out.append('{');
    appendBlockBody(out, stmts);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CompoundStatement)) {
      return false;
    }
    return stmts.equals(((CompoundStatement)o).stmts);
  }

  @Override
  public int hashCode() {
    return stmts.hashCode();
  }
}
