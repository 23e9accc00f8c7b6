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

import exm.wgsl.ast.AttrList;
import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.ShaderTree;
import exm.wgsl.ast.stmt.Statement;

/**
 * Function declaration.  Printed as the attribute line, then the header
 * and the braced body:
 * <pre>
 * [[stage(compute), workgroup_size(1)]]
 * fn main(a: i32) -> i32 {
 *     ...
 * }
 * </pre>
 */
public class FnDecl extends ShaderTree {
  private final AttrList<FnAttr> attrs;
  private final String name;
  private final ImmutableList<FnInput> inputs;
  /** null if function returns nothing */
  private final FnOutput output;
  private final ImmutableList<Statement> body;

  public FnDecl(AttrList<FnAttr> attrs, String name, List<FnInput> inputs,
                FnOutput output, List<Statement> body) {
    this.attrs = Preconditions.checkNotNull(attrs);
    this.name = Preconditions.checkNotNull(name);
    this.inputs = ImmutableList.copyOf(inputs);
    this.output = output;
    this.body = ImmutableList.copyOf(body);
  }

  public AttrList<FnAttr> attrs() {
    return attrs;
  }

  public String name() {
    return name;
  }

  public List<FnInput> inputs() {
    return inputs;
  }

  public boolean hasOutput() {
    return output != null;
  }

  /**
   * @return the output, or null if none
   */
  public FnOutput output() {
    return output;
  }

  public List<Statement> body() {
    return body;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    attrs.appendTo(out);
    out.newline();

    out.append("fn ");
    out.append(name);
    out.append('(');
    out.appendCommaSeparated(inputs);
    out.append(") ");

    if (output != null) {
      out.append("-> ");
      output.appendTo(out);
      out.append(' ');
    }

    out.append('{');
    out.newline();
    out.appendIndentedLines(body);
    out.append('}');
    out.newline();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FnDecl)) {
      return false;
    }
    FnDecl other = (FnDecl)o;
    return attrs.equals(other.attrs) && name.equals(other.name) &&
           inputs.equals(other.inputs) &&
           Objects.equals(output, other.output) && body.equals(other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(attrs, name, inputs, output, body);
  }
}
