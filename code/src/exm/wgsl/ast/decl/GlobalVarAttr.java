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

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.ShaderTree;
import exm.wgsl.common.exceptions.WGSLRuntimeError;

/**
 * Resource binding attribute of a global variable
 */
public class GlobalVarAttr extends ShaderTree {
  public static enum GlobalVarAttrKind {
    BINDING, GROUP
  }

  public final GlobalVarAttrKind kind;
  private final int index;

  private GlobalVarAttr(GlobalVarAttrKind kind, int index) {
    this.kind = kind;
    this.index = index;
  }

  public static GlobalVarAttr binding(int slot) {
    return new GlobalVarAttr(GlobalVarAttrKind.BINDING, slot);
  }

  public static GlobalVarAttr group(int group) {
    return new GlobalVarAttr(GlobalVarAttrKind.GROUP, group);
  }

  public int index() {
    return index;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    switch (kind) {
      case BINDING:
        out.append("binding(");
        break;
      case GROUP:
        out.append("group(");
        break;
      default:
        throw new WGSLRuntimeError("Unknown global variable attribute "
                                   + kind);
    }
    out.append(Integer.toString(index));
    out.append(')');
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof GlobalVarAttr)) {
      return false;
    }
    GlobalVarAttr other = (GlobalVarAttr)o;
    return kind == other.kind && index == other.index;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, index);
  }
}
