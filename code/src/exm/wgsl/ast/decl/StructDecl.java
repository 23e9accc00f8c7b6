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
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.ShaderTree;
import exm.wgsl.common.lang.Types;
import exm.wgsl.common.lang.Types.DataType;

/**
 * Struct declaration.  Member order is the memory layout order.
 */
public class StructDecl extends ShaderTree {
  private final String name;
  private final ImmutableList<StructMember> members;

  public StructDecl(String name, List<StructMember> members) {
    this.name = Preconditions.checkNotNull(name);
    this.members = ImmutableList.copyOf(members);
  }

  public String name() {
    return name;
  }

  public List<StructMember> members() {
    return members;
  }

  /**
   * @return type referring to this struct by name
   */
  public DataType asType() {
    return Types.named(name);
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    out.append("struct ");
    out.append(name);
    out.append(" {");
    out.newline();
    out.appendIndentedLines(members);
    out.append("};");
    out.newline();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof StructDecl)) {
      return false;
    }
    StructDecl other = (StructDecl)o;
    return name.equals(other.name) && members.equals(other.members);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, members);
  }
}
