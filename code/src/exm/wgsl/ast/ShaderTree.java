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

/**
 * The ShaderTree class hierarchy represents all constructs of a
 * shader module, from literals up to the module itself.
 *
 * Trees are built once, bottom-up, and are not modified afterwards.
 * Each node exclusively owns its children.  Nodes compare structurally.
 *
 * ShaderTree is the most abstract construct
 * */
public abstract class ShaderTree implements Printable
{
  @Override
  public abstract boolean equals(Object o);

  @Override
  public abstract int hashCode();

  /**
   * Render with the configured indentation
   */
  @Override
  public String toString()
  {
    return ShaderPrinter.render(this);
  }
}
