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

import exm.wgsl.ast.ShaderTree;

/**
 * An expression without its type.  See {@link ExprNode} for the typed
 * form that appears in the tree.
 */
public abstract class Expr extends ShaderTree {
  public static enum ExprKind {
    LIT, TYPE_CONS, VAR, UN_OP, BIN_OP
  }

  public abstract ExprKind kind();
}
