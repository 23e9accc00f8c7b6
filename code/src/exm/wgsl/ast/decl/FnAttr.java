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

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.ShaderTree;
import exm.wgsl.common.exceptions.WGSLRuntimeError;

/**
 * Function attribute: stage(...) or workgroup_size(...)
 */
public class FnAttr extends ShaderTree {
  public static enum FnAttrKind {
    STAGE, WORKGROUP_SIZE
  }

  public final FnAttrKind kind;

  private final ShaderStage stage;
  private final long workgroupSize;

  private FnAttr(FnAttrKind kind, ShaderStage stage, long workgroupSize) {
    this.kind = kind;
    this.stage = stage;
    this.workgroupSize = workgroupSize;
  }

  public static FnAttr stage(ShaderStage stage) {
    return new FnAttr(FnAttrKind.STAGE, Preconditions.checkNotNull(stage), 0);
  }

  /**
   * @param size unsigned 32-bit count
   */
  public static FnAttr workgroupSize(long size) {
    Preconditions.checkArgument(size >= 0 && size <= 0xFFFFFFFFL,
                                "Bad workgroup size: %s", size);
    return new FnAttr(FnAttrKind.WORKGROUP_SIZE, null, size);
  }

  public ShaderStage getStage() {
    assert(kind == FnAttrKind.STAGE);
    return stage;
  }

  public long getWorkgroupSize() {
    assert(kind == FnAttrKind.WORKGROUP_SIZE);
    return workgroupSize;
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    switch (kind) {
      case STAGE:
        out.append("stage(");
        stage.appendTo(out);
        out.append(')');
        break;
      case WORKGROUP_SIZE:
        out.append("workgroup_size(");
        out.append(Long.toString(workgroupSize));
        out.append(')');
        break;
      default:
        throw new WGSLRuntimeError("Unknown function attribute " + kind);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FnAttr)) {
      return false;
    }
    FnAttr other = (FnAttr)o;
    return kind == other.kind && stage == other.stage &&
           workgroupSize == other.workgroupSize;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, stage, workgroupSize);
  }
}
