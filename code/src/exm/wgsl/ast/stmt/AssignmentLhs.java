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
package exm.wgsl.ast.stmt;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.ShaderTree;
import exm.wgsl.ast.expr.ExprNode;

/**
 * Left hand side of an assignment: either the discard target _ or a
 * variable followed by any number of index and member accessors,
 * e.g. a[i].x
 */
public abstract class AssignmentLhs extends ShaderTree {

  public static final AssignmentLhs UNDERSCORE = new Underscore();

  public static AssignmentLhs simple(String name, List<Postfix> postfixes) {
    return new Simple(name, postfixes);
  }

  public static AssignmentLhs simple(String name, Postfix... postfixes) {
    return new Simple(name, Arrays.asList(postfixes));
  }

  public abstract boolean isUnderscore();

  public static class Underscore extends AssignmentLhs {
    private Underscore() {
    }

    @Override
    public boolean isUnderscore() {
      return true;
    }

    @Override
    public void appendTo(CodeWriter out) throws IOException {
      out.append('_');
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Underscore;
    }

    @Override
    public int hashCode() {
      return Underscore.class.hashCode();
    }
  }

  public static class Simple extends AssignmentLhs {
    private final String name;
    private final ImmutableList<Postfix> postfixes;

    public Simple(String name, List<Postfix> postfixes) {
      this.name = Preconditions.checkNotNull(name);
      this.postfixes = ImmutableList.copyOf(postfixes);
    }

    public String name() {
      return name;
    }

    public List<Postfix> postfixes() {
      return postfixes;
    }

    @Override
    public boolean isUnderscore() {
      return false;
    }

    @Override
    public void appendTo(CodeWriter out) throws IOException {
      out.append(name);
      for (Postfix postfix: postfixes) {
        postfix.appendTo(out);
      }
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Simple)) {
        return false;
      }
      Simple other = (Simple)o;
      return name.equals(other.name) && postfixes.equals(other.postfixes);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, postfixes);
    }
  }

  /**
   * Accessor applied after the variable name
   */
  public abstract static class Postfix extends ShaderTree {
    public static Postfix arrayIndex(ExprNode index) {
      return new ArrayIndex(index);
    }

    public static Postfix member(String field) {
      return new Member(field);
    }
  }

  public static class ArrayIndex extends Postfix {
    private final ExprNode index;

    public ArrayIndex(ExprNode index) {
      this.index = Preconditions.checkNotNull(index);
    }

    public ExprNode index() {
      return index;
    }

    @Override
    public void appendTo(CodeWriter out) throws IOException {
      out.append('[');
      index.appendTo(out);
      out.append(']');
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof ArrayIndex)) {
        return false;
      }
      return index.equals(((ArrayIndex)o).index);
    }

    @Override
    public int hashCode() {
      return index.hashCode();
    }
  }

  public static class Member extends Postfix {
    private final String field;

    public Member(String field) {
      this.field = Preconditions.checkNotNull(field);
    }

    public String field() {
      return field;
    }

    @Override
    public void appendTo(CodeWriter out) throws IOException {
      out.append('.');
      out.append(field);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Member)) {
        return false;
      }
      return field.equals(((Member)o).field);
    }

    @Override
    public int hashCode() {
      return field.hashCode();
    }
  }
}
