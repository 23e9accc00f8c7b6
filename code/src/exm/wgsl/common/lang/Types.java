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
package exm.wgsl.common.lang;

import java.util.Objects;

import com.google.common.base.Preconditions;

import exm.wgsl.common.exceptions.WGSLRuntimeError;

/**
 * Data types attributed to expressions and declarations.
 *
 * The base class for all types is DataType.  Types are immutable values
 * compared structurally; two separately built vec3<i32> are equal.
 */
public class Types {

  /**
   * Element-level classification of a value, independent of vector width.
   */
  public static enum ScalarType {
    BOOL, I32, U32;

    public String typeName() {
      switch (this) {
        case BOOL:
          return "bool";
        case I32:
          return "i32";
        case U32:
          return "u32";
        default:
          throw new WGSLRuntimeError("typeName not implemented for " +
                                          this);
      }
    }
  }

  public abstract static class DataType {

    /** Print out the type as it is written in source */
    public abstract String typeName();

    /**
     * Replace the scalar component kind, preserving shape.
     * Types without a scalar component are returned unchanged.
     * @param kind
     * @return
     */
    public abstract DataType withScalarKind(ScalarType kind);

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public String toString() {
      return typeName();
    }
  }

  public static class ScalarDataType extends DataType {
    private final ScalarType scalarType;

    public ScalarDataType(ScalarType scalarType) {
      this.scalarType = Preconditions.checkNotNull(scalarType);
    }

    public ScalarType scalarType() {
      return scalarType;
    }

    @Override
    public String typeName() {
      return scalarType.typeName();
    }

    @Override
    public DataType withScalarKind(ScalarType kind) {
      return scalar(kind);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof ScalarDataType)) {
        return false;
      }
      return ((ScalarDataType)o).scalarType == scalarType;
    }

    @Override
    public int hashCode() {
      return scalarType.hashCode();
    }
  }

  public static class VectorDataType extends DataType {
    public static final int MIN_WIDTH = 2;
    public static final int MAX_WIDTH = 4;

    private final int width;
    private final ScalarType scalarType;

    public VectorDataType(int width, ScalarType scalarType) {
      Preconditions.checkArgument(width >= MIN_WIDTH && width <= MAX_WIDTH,
                                  "Bad vector width %s", width);
      this.width = width;
      this.scalarType = Preconditions.checkNotNull(scalarType);
    }

    public int width() {
      return width;
    }

    public ScalarType scalarType() {
      return scalarType;
    }

    @Override
    public String typeName() {
      return "vec" + width + "<" + scalarType.typeName() + ">";
    }

    @Override
    public DataType withScalarKind(ScalarType kind) {
      return vector(width, kind);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof VectorDataType)) {
        return false;
      }
      VectorDataType other = (VectorDataType)o;
      return other.width == width && other.scalarType == scalarType;
    }

    @Override
    public int hashCode() {
      return scalarType.hashCode() * 31 + width;
    }
  }

  /**
   * Array with element type and optional fixed size.  Runtime-sized arrays
   * have a null size.
   */
  public static class ArrayDataType extends DataType {
    private final DataType elemType;
    private final Integer size;

    public ArrayDataType(DataType elemType, Integer size) {
      this.elemType = Preconditions.checkNotNull(elemType);
      Preconditions.checkArgument(size == null || size > 0,
                                  "Array size must be positive: %s", size);
      this.size = size;
    }

    public DataType elemType() {
      return elemType;
    }

    public boolean isRuntimeSized() {
      return size == null;
    }

    public Integer size() {
      return size;
    }

    @Override
    public String typeName() {
      if (size == null) {
        return "array<" + elemType.typeName() + ">";
      }
      return "array<" + elemType.typeName() + ", " + size + ">";
    }

    @Override
    public DataType withScalarKind(ScalarType kind) {
      return new ArrayDataType(elemType.withScalarKind(kind), size);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof ArrayDataType)) {
        return false;
      }
      ArrayDataType other = (ArrayDataType)o;
      return elemType.equals(other.elemType) &&
             Objects.equals(size, other.size);
    }

    @Override
    public int hashCode() {
      return Objects.hash(elemType, size);
    }
  }

  /**
   * Type referred to by name, e.g. a struct declared in the module
   */
  public static class NamedDataType extends DataType {
    private final String name;

    public NamedDataType(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    public String name() {
      return name;
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public DataType withScalarKind(ScalarType kind) {
      // No scalar component to replace
      return this;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof NamedDataType)) {
        return false;
      }
      return name.equals(((NamedDataType)o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  public static final DataType BOOL = new ScalarDataType(ScalarType.BOOL);
  public static final DataType I32 = new ScalarDataType(ScalarType.I32);
  public static final DataType U32 = new ScalarDataType(ScalarType.U32);

  public static DataType scalar(ScalarType kind) {
    switch (kind) {
      case BOOL:
        return BOOL;
      case I32:
        return I32;
      case U32:
        return U32;
      default:
        return new ScalarDataType(kind);
    }
  }

  public static DataType vector(int width, ScalarType kind) {
    return new VectorDataType(width, kind);
  }

  public static DataType array(DataType elemType, int size) {
    return new ArrayDataType(elemType, size);
  }

  public static DataType runtimeArray(DataType elemType) {
    return new ArrayDataType(elemType, null);
  }

  public static DataType named(String name) {
    return new NamedDataType(name);
  }
}
