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

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.ShaderTree;
import exm.wgsl.common.exceptions.WGSLRuntimeError;

/**
 * A statement inside a function body.  Compound statements and if
 * statements contain further statements and nest to any depth.
 */
public abstract class Statement extends ShaderTree {
  public static enum StatementKind {
    LET_DECL, VAR_DECL, ASSIGNMENT, COMPOUND, IF
  }

  public abstract StatementKind kind();

  /**
   * Extract the inner statements of a compound statement.
   *
   * Precondition: kind() is COMPOUND.  Calling this on any other
   * statement is a bug in the caller and fails with WGSLRuntimeError.
   * @return the statements of the block
   */
  public List<Statement> toCompoundStatements() {
    throw new WGSLRuntimeError("toCompoundStatements() called on " +
                               kind() + " statement, expected COMPOUND");
  }

  /**
   * Append statements as a braced block: an opening brace is assumed to
   * have been written already; each statement goes on its own line one
   * level deeper, then the closing brace at the current level.
   */
  static void appendBlockBody(CodeWriter out, List<Statement> stmts)
      throws IOException {
    out.newline();
    out.appendIndentedLines(stmts);
    out.append('}');
  }
}
