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

package exm.wgsl.ast;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.wgsl.ast.decl.FnDecl;
import exm.wgsl.ast.decl.GlobalVarDecl;
import exm.wgsl.ast.decl.StructDecl;

/**
 * Root of the tree: structs, global variables, functions and the entry
 * point.
 *
 * Printing writes the structs, then the globals, each followed by a
 * blank line, then the entry point.  The other functions are not
 * printed: how a call to a user function would be written is not
 * defined by this tree, so they are left to whoever emits them.
 * {@link ShaderPrinter} warns once when it drops them.
 */
public class ShaderModule extends ShaderTree
{
  private final ImmutableList<StructDecl> structs;
  private final ImmutableList<GlobalVarDecl> vars;
  private final ImmutableList<FnDecl> functions;
  private final FnDecl entryPoint;

  public ShaderModule(List<StructDecl> structs, List<GlobalVarDecl> vars,
                      List<FnDecl> functions, FnDecl entryPoint)
  {
    this.structs = ImmutableList.copyOf(structs);
    this.vars = ImmutableList.copyOf(vars);
    this.functions = ImmutableList.copyOf(functions);
    this.entryPoint = Preconditions.checkNotNull(entryPoint);
  }

  public List<StructDecl> structs()
  {
    return structs;
  }

  public List<GlobalVarDecl> vars()
  {
    return vars;
  }

  /**
   * @return functions other than the entry point
   */
  public List<FnDecl> functions()
  {
    return functions;
  }

  public FnDecl entryPoint()
  {
    return entryPoint;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException
  {
    for (StructDecl decl: structs) {
      decl.appendTo(out);
      out.newline();
    }

    for (GlobalVarDecl decl: vars) {
      decl.appendTo(out);
      out.newline();
    }

    entryPoint.appendTo(out);
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof ShaderModule)) {
      return false;
    }
    ShaderModule other = (ShaderModule)o;
    return structs.equals(other.structs) && vars.equals(other.vars) &&
           functions.equals(other.functions) &&
           entryPoint.equals(other.entryPoint);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(structs, vars, functions, entryPoint);
  }
}
