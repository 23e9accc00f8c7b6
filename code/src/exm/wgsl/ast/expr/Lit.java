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
package exm.wgsl.ast.expr;

import java.io.IOException;

import com.google.common.base.Preconditions;

import exm.wgsl.ast.CodeWriter;
import exm.wgsl.ast.ShaderTree;
import exm.wgsl.common.exceptions.WGSLRuntimeError;
import exm.wgsl.common.lang.Types;
import exm.wgsl.common.lang.Types.DataType;

/**
 * Literal value: bool, signed 32-bit or unsigned 32-bit integer
 */
public class Lit extends ShaderTree {
  public static enum LitKind {
    BOOL, INT, UINT
  }

  public static final long MAX_UINT = 0xFFFFFFFFL;

  public final LitKind kind;

  /** Storage for literal, dependent on kind.  UINT keeps the raw bits */
  private final boolean boollit;
  private final int intlit;

  /**
   * Private constructor so that it can only be built using static builder
   * methods (below)
   */
  private Lit(LitKind kind, boolean boollit, int intlit) {
    this.kind = kind;
    this.boollit = boollit;
    this.intlit = intlit;
  }

  public static Lit createBoolLit(boolean v) {
    return new Lit(LitKind.BOOL, v, 0);
  }

  public static Lit createIntLit(int v) {
    return new Lit(LitKind.INT, false, v);
  }

  /**
   * @param v must be in range 0 to 2^32-1
   */
  public static Lit createUIntLit(long v) {
    Preconditions.checkArgument(v >= 0 && v <= MAX_UINT,
                                "Unsigned literal out of range: %s", v);
    return new Lit(LitKind.UINT, false, (int)v);
  }

  public boolean getBoolLit() {
    checkKind(LitKind.BOOL);
    return boollit;
  }

  public int getIntLit() {
    checkKind(LitKind.INT);
    return intlit;
  }

  public long getUIntLit() {
    checkKind(LitKind.UINT);
    return Integer.toUnsignedLong(intlit);
  }

  private void checkKind(LitKind expected) {
    if (kind != expected) {
      throw new WGSLRuntimeError("Expected " + expected + " literal but was "
                                 + kind);
    }
  }

  /**
   * @return the type of this literal: bool, i32 or u32
   */
  public DataType dataType() {
    switch (kind) {
      case BOOL:
        return Types.BOOL;
      case INT:
        return Types.I32;
      case UINT:
        return Types.U32;
      default:
        throw new WGSLRuntimeError("Unknown literal kind " + kind);
    }
  }

  @Override
  public void appendTo(CodeWriter out) throws IOException {
    switch (kind) {
      case BOOL:
        out.append(Boolean.toString(boollit));
        break;
      case INT:
        out.append(Integer.toString(intlit));
        break;
      case UINT:
        out.append(Integer.toUnsignedString(intlit));
        out.append('u');
        break;
      default:
        throw new WGSLRuntimeError("Unknown literal kind " + kind);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Lit)) {
      return false;
    }
    Lit other = (Lit)o;
    return kind == other.kind && boollit == other.boollit &&
           intlit == other.intlit;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = kind.hashCode();
    result = prime * result + (boollit ? 1 : 0);
    result = prime * result + intlit;
    return result;
  }
}
