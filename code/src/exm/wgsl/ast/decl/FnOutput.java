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
import exm.wgsl.common.lang.Types.DataType;

/**
 * Function return descriptor
 */
public class FnOutput extends ShaderTree {
  private final AttrList<FnOutputAttr> attrs;
  private final DataType dataType;

  public FnOutput(AttrList<FnOutputAttr> attrs, DataType dataType) {
    this.attrs = Preconditions.checkNotNull(attrs);
    this.dataType = Preconditions.checkNotNull(dataType);
  }

  public FnOutput(DataType dataType) {
    this(AttrList.<FnOutputAttr>empty(), dataType);
  }

  public AttrList<FnOutputAttr> attrs() {
    return attrs;
  }

  public DataType dataType() {
    return dataType;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    // Output attributes are not written
    out.append(dataType.typeName());
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FnOutput)) {
      return false;
    }
    FnOutput other = (FnOutput)o;
    return attrs.equals(other.attrs) && dataType.equals(other.dataType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(attrs, dataType);
  }
}
