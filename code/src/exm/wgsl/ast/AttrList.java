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
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Ordered list of attributes of one kind, e.g. [[binding(0), group(1)]].
 * An empty list prints as nothing at all.
 * @param <T> attribute kind
 */
public class AttrList<T extends Printable> extends ShaderTree
{
  private final ImmutableList<T> attrs;

  public AttrList(List<T> attrs)
  {
    this.attrs = ImmutableList.copyOf(attrs);
  }

  public static <T extends Printable> AttrList<T> empty()
  {
    return new AttrList<T>(ImmutableList.<T>of());
  }

  @SafeVarargs
  public static <T extends Printable> AttrList<T> of(T... attrs)
  {
    return new AttrList<T>(Arrays.asList(attrs));
  }

  public List<T> attrs()
  {
    return attrs;
  }

  public boolean isEmpty()
  {
    return attrs.isEmpty();
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException
  {
    if (attrs.isEmpty()) {
      return;
    }
    out.append("[[");
    out.appendCommaSeparated(attrs);
    out.append("]]");
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof AttrList)) {
      return false;
    }
    return attrs.equals(((AttrList<?>)o).attrs);
  }

  @Override
  public int hashCode()
  {
    return attrs.hashCode();
  }
}
