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
package exm.wgsl.ast.decl;

import java.io.IOException;
import java.util.Objects;

import com.google.common.base.Preconditions;

import exm.wgsl.ast.AttrList;
import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.ShaderTree;
import exm.wgsl.ast.expr.ExprNode;
import exm.wgsl.common.lang.Types.DataType;

/**
 * Module-scope variable, e.g.
 * <pre>
 * [[binding(0), group(0)]]
 * var&lt;storage, read_write&gt; buf: Buffer;
 * </pre>
 */
public class GlobalVarDecl extends ShaderTree {
  private final AttrList<GlobalVarAttr> attrs;
  /** null if unqualified */
  private final VarQualifier qualifier;
  private final String name;
  private final DataType dataType;
  /** null if uninitialized */
  private final ExprNode initializer;

  public GlobalVarDecl(AttrList<GlobalVarAttr> attrs, VarQualifier qualifier,
                       String name, DataType dataType,
                       ExprNode initializer) {
    this.attrs = Preconditions.checkNotNull(attrs);
    this.qualifier = qualifier;
    this.name = Preconditions.checkNotNull(name);
    this.dataType = Preconditions.checkNotNull(dataType);
    this.initializer = initializer;
  }

  public AttrList<GlobalVarAttr> attrs() {
    return attrs;
  }

  public VarQualifier qualifier() {
    return qualifier;
  }

  public String name() {
    return name;
  }

  public DataType dataType() {
    return dataType;
  }

  public ExprNode initializer() {
    return initializer;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    attrs.appendTo(out);
    out.newline();

    out.append("var");
    if (qualifier != null) {
      qualifier.appendTo(out);
    }

    out.append(' ');
    out.append(name);
    out.append(": ");
    out.append(dataType.typeName());

    if (initializer != null) {
      out.append(" = ");
      initializer.appendTo(out);
    }

    out.append(';');
    out.newline();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof GlobalVarDecl)) {
      return false;
    }
    GlobalVarDecl other = (GlobalVarDecl)o;
    return attrs.equals(other.attrs) &&
           Objects.equals(qualifier, other.qualifier) &&
           name.equals(other.name) && dataType.equals(other.dataType) &&
           Objects.equals(initializer, other.initializer);
  }

  @Override
  public int hashCode() {
    return Objects.hash(attrs, qualifier, name, dataType, initializer);
  }
}
