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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * This class serves to define details of builtin operators
 */
public class Operators {

  public static enum UnaryOp {
    NEGATE("-"), NOT("!"), BIT_NOT("~");

    private final String symbol;

    private UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  /**
   * Binary operator groups.  Each group shares one result type rule.
   */
  public static enum OpGroup {
    /** Arithmetic and bitwise: result has left operand type */
    ARITHMETIC,
    /** Result is always scalar bool */
    LOGICAL,
    /** Relational and equality: bool with shape of left operand */
    RELATIONAL,
  }

  public static enum BinaryOp {
    PLUS("+", OpGroup.ARITHMETIC),
    MINUS("-", OpGroup.ARITHMETIC),
    TIMES("*", OpGroup.ARITHMETIC),
    DIVIDE("/", OpGroup.ARITHMETIC),
    MOD("%", OpGroup.ARITHMETIC),
    LOG_AND("&&", OpGroup.LOGICAL),
    LOG_OR("||", OpGroup.LOGICAL),
    BIT_AND("&", OpGroup.ARITHMETIC),
    BIT_OR("|", OpGroup.ARITHMETIC),
    BIT_XOR("^", OpGroup.ARITHMETIC),
    LSHIFT("<<", OpGroup.ARITHMETIC),
    RSHIFT(">>", OpGroup.ARITHMETIC),
    EQUAL("==", OpGroup.RELATIONAL),
    NOT_EQUAL("!=", OpGroup.RELATIONAL),
    LESS("<", OpGroup.RELATIONAL),
    LESS_EQUAL("<=", OpGroup.RELATIONAL),
    GREATER(">", OpGroup.RELATIONAL),
    GREATER_EQUAL(">=", OpGroup.RELATIONAL);

    private final String symbol;
    private final OpGroup group;

    private BinaryOp(String symbol, OpGroup group) {
      this.symbol = symbol;
      this.group = group;
    }

    public String symbol() {
      return symbol;
    }

    public OpGroup group() {
      return group;
    }
  }

  /** Map of group -> member operators, in declaration order */
  private static final Map<OpGroup, List<BinaryOp>> groupMembers =
                            new EnumMap<OpGroup, List<BinaryOp>>(OpGroup.class);

  static {
    for (OpGroup g: OpGroup.values()) {
      groupMembers.put(g, new ArrayList<BinaryOp>());
    }
    for (BinaryOp op: BinaryOp.values()) {
      groupMembers.get(op.group()).add(op);
    }
  }

  /**
   * @param group
   * @return all binary operators in group
   */
  public static List<BinaryOp> getOps(OpGroup group) {
    return Collections.unmodifiableList(groupMembers.get(group));
  }
}
