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

import com.google.common.base.Preconditions;

import exm.wgsl.common.Settings;
import exm.wgsl.common.util.StringUtil;

/**
 * Output sink for printing code.
 *
 * A child writer obtained from {@link #indented()} prefixes every
 * non-empty line written through it with one indent unit, then passes
 * the text on to its parent.  Children of children therefore indent one
 * more level each, with no limit on depth.  Empty lines are never
 * indented.
 *
 * A writer is owned by a single print call; it is not thread-safe.
 */
public class CodeWriter implements Appendable
{
  public static final String LIST_SEPARATOR = ", ";

  private final Appendable out;

  /** Unit added by each level of nesting */
  private final String indentUnit;

  /** Prefix added by this writer to each line */
  private final String prefix;

  private boolean needsIndent = true;

  public CodeWriter(Appendable out)
  {
    this(out, Settings.DEFAULT_INDENT_WIDTH);
  }

  public CodeWriter(Appendable out, int indentWidth)
  {
    this(out, indentUnit(indentWidth), "");
  }

  private static String indentUnit(int indentWidth)
  {
    Preconditions.checkArgument(indentWidth >= 0,
                                "Negative indent width %s", indentWidth);
    return StringUtil.spaces(indentWidth);
  }

  private CodeWriter(Appendable out, String indentUnit, String prefix)
  {
    this.out = Preconditions.checkNotNull(out);
    this.indentUnit = indentUnit;
    this.prefix = prefix;
  }

  /**
   * @return writer for the body of a block nested inside this one
   */
  public CodeWriter indented()
  {
    return new CodeWriter(this, indentUnit, indentUnit);
  }

  /**
   * Append each item on its own line, one level deeper than this writer
   * @param items
   * @throws IOException
   */
  public void appendIndentedLines(List<? extends Printable> items)
      throws IOException
  {
    CodeWriter body = indented();
    for (Printable item: items) {
      item.appendTo(body);
      body.newline();
    }
  }

  /**
   * Append items with separator in between, none after the last one
   * @throws IOException
   */
  public void appendSeparated(List<? extends Printable> items,
      String separator) throws IOException
  {
    for (int i = 0; i < items.size(); i++) {
      items.get(i).appendTo(this);
      if (i < items.size() - 1) {
        append(separator);
      }
    }
  }

  public void appendCommaSeparated(List<? extends Printable> items)
      throws IOException
  {
    appendSeparated(items, LIST_SEPARATOR);
  }

  public CodeWriter newline() throws IOException
  {
    return append('\n');
  }

  @Override
  public CodeWriter append(CharSequence csq) throws IOException
  {
    if (csq == null) {
      csq = "null";
    }
    if (prefix.length() == 0) {
      out.append(csq);
      return this;
    }

    int start = 0;
    for (int i = 0; i < csq.length(); i++) {
      if (csq.charAt(i) == '\n') {
        appendSegment(csq, start, i);
        out.append('\n');
        needsIndent = true;
        start = i + 1;
      }
    }
    appendSegment(csq, start, csq.length());
    return this;
  }

  private void appendSegment(CharSequence csq, int start, int end)
      throws IOException
  {
    if (start == end) {
      // Don't indent a line unless it actually has text on it
      return;
    }
    if (needsIndent) {
      out.append(prefix);
      needsIndent = false;
    }
    out.append(csq, start, end);
  }

  @Override
  public CodeWriter append(CharSequence csq, int start, int end)
      throws IOException
  {
    if (csq == null) {
      csq = "null";
    }
    return append(csq.subSequence(start, end));
  }

  @Override
  public CodeWriter append(char c) throws IOException
  {
    return append(String.valueOf(c));
  }
}
