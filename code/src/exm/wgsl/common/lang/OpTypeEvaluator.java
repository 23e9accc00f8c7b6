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

import exm.wgsl.common.exceptions.WGSLRuntimeError;
import exm.wgsl.common.lang.Operators.BinaryOp;
import exm.wgsl.common.lang.Operators.UnaryOp;
import exm.wgsl.common.lang.Types.DataType;
import exm.wgsl.common.lang.Types.ScalarType;

/**
 * Result types of operator applications.
 *
 * Operand compatibility is the caller's responsibility: these functions
 * never check it and never fail.
 */
public class OpTypeEvaluator {

  /**
   * All unary operators produce the operand type.
   * @param op
   * @param operand
   * @return
   */
  public static DataType evalUnary(UnaryOp op, DataType operand) {
    return operand;
  }

  /**
   * Result type is derived from the left operand only.
   * @param op
   * @param left
   * @param right not consulted
   * @return
   */
  public static DataType evalBinary(BinaryOp op, DataType left,
                                    DataType right) {
    switch (op.group()) {
      case ARITHMETIC:
        return left;
      case LOGICAL:
        return Types.BOOL;
      case RELATIONAL:
        // Same number of components as the left operand
        return left.withScalarKind(ScalarType.BOOL);
      default:
        throw new WGSLRuntimeError("Unknown group " + op.group());
    }
  }
}
