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

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.Printable;

/**
 * Attributes of a function input.  No attributes are supported yet, so
 * this has no values and any AttrList of it is empty.
 */
public enum FnInputAttr implements Printable {
  ;

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    out.append(name().toLowerCase());
  }
}
