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

/**
 * Storage class and optional access mode of a global variable.
 * Whether the access mode is allowed for the storage class is not
 * checked.
 */
public class VarQualifier extends ShaderTree {
  private final StorageClass storageClass;
  /** null if not specified */
  private final AccessMode accessMode;

  public VarQualifier(StorageClass storageClass, AccessMode accessMode) {
    this.storageClass = Preconditions.checkNotNull(storageClass);
    this.accessMode = accessMode;
  }

  public VarQualifier(StorageClass storageClass) {
    this(storageClass, null);
  }

  public StorageClass storageClass() {
    return storageClass;
  }

  /**
   * @return access mode, or null if none given
   */
  public AccessMode accessMode() {
    return accessMode;
  }

  /**
   * Append including angle brackets, e.g. {@code <storage, read_write>}
   */
  @Override
  public void appendTo(CodeWriter out) throws IOException {
    out.append('<');
    storageClass.appendTo(out);
    if (accessMode != null) {
      out.append(", ");
      accessMode.appendTo(out);
    }
    out.append('>');
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof VarQualifier)) {
      return false;
    }
    VarQualifier other = (VarQualifier)o;
    return storageClass == other.storageClass &&
           accessMode == other.accessMode;
  }

  @Override
  public int hashCode() {
    return Objects.hash(storageClass, accessMode);
  }
}
