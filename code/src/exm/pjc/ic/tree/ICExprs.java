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
package exm.pjc.ic.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.pjc.common.lang.Operators.BinaryOp;
import exm.pjc.common.lang.Operators.CompareOp;
import exm.pjc.common.lang.Operators.UnaryOp;
import exm.pjc.common.util.StringUtil;

/**
 * Expression nodes of the intermediate representation
 */
public class ICExprs {

  public static enum ExprType {
    NAME,
    NUMBER,
    STRING,
    BOOL,
    NULL,
    BINARY_OP,
    UNARY_OP,
    SUBSCRIPT,
    CALL,
    COMPARE,
    LIST,
  }

  public static abstract class Expr {
    public abstract ExprType type();

    public abstract void prettyPrint(StringBuilder sb);

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb);
      return sb.toString();
    }
  }

  /** Variable reference */
  public static class Name extends Expr {
    private final String id;

    public Name(String id) {
      this.id = Preconditions.checkNotNull(id);
    }

    public String id() {
      return id;
    }

    @Override
    public ExprType type() {
      return ExprType.NAME;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append(id);
    }
  }

  /**
   * Integer (arbitrary precision) or floating point literal
   */
  public static class NumberLiteral extends Expr {
    /** Significant digits that always identify a double */
    private static final int MAX_DOUBLE_DIGITS = 17;

    private final Number value;

    public NumberLiteral(BigInteger value) {
      this.value = Preconditions.checkNotNull(value);
    }

    public NumberLiteral(long value) {
      this(BigInteger.valueOf(value));
    }

    public NumberLiteral(double value) {
      this.value = Double.valueOf(value);
    }

    public Number value() {
      return value;
    }

    public boolean isInteger() {
      return value instanceof BigInteger;
    }

    /**
     * Canonical text of the value, as the source language prints it.
     * Source formatting such as trailing zeroes is not preserved.
     */
    public String canonicalText() {
      if (isInteger()) {
        return value.toString();
      }
      return floatText(value.doubleValue());
    }

    /**
     * Shortest round-tripping form, positional for exponents -4..15 and
     * scientific with a signed two-digit exponent otherwise
     */
    static String floatText(double d) {
      if (Double.isNaN(d)) {
        return "NaN";
      } else if (Double.isInfinite(d)) {
        return d > 0 ? "Infinity" : "-Infinity";
      } else if (d == 0.0) {
        return (1.0 / d < 0) ? "-0.0" : "0.0";
      }

      BigDecimal dec = shortestDecimal(d);
      int exponent = dec.precision() - dec.scale() - 1;
      if (exponent >= -4 && exponent < 16) {
        String plain = dec.toPlainString();
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
      }

      String digits = dec.unscaledValue().abs().toString();
      StringBuilder sb = new StringBuilder();
      if (dec.signum() < 0) {
        sb.append('-');
      }
      sb.append(digits.charAt(0));
      if (digits.length() > 1) {
        sb.append('.').append(digits, 1, digits.length());
      }
      sb.append('e').append(exponent < 0 ? '-' : '+');
      int absExp = Math.abs(exponent);
      if (absExp < 10) {
        sb.append('0');
      }
      sb.append(absExp);
      return sb.toString();
    }

    /**
     * Fewest significant digits that read back as the same double
     */
    private static BigDecimal shortestDecimal(double d) {
      BigDecimal exact = new BigDecimal(d);
      for (int p = 1; p < MAX_DOUBLE_DIGITS; p++) {
        BigDecimal rounded = exact.round(new MathContext(p,
                                              RoundingMode.HALF_EVEN));
        if (rounded.doubleValue() == d) {
          return rounded.stripTrailingZeros();
        }
      }
      return exact.round(new MathContext(MAX_DOUBLE_DIGITS,
                            RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    @Override
    public ExprType type() {
      return ExprType.NUMBER;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append(canonicalText());
    }
  }

  public static class StringLiteral extends Expr {
    private final String value;

    public StringLiteral(String value) {
      this.value = Preconditions.checkNotNull(value);
    }

    public String value() {
      return value;
    }

    @Override
    public ExprType type() {
      return ExprType.STRING;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append('"').append(StringUtil.describe(value)).append('"');
    }
  }

  public static class BoolLiteral extends Expr {
    public static final BoolLiteral TRUE = new BoolLiteral(true);
    public static final BoolLiteral FALSE = new BoolLiteral(false);

    private final boolean value;

    private BoolLiteral(boolean value) {
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    public ExprType type() {
      return ExprType.BOOL;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append(value ? "True" : "False");
    }
  }

  public static class NullLiteral extends Expr {
    public static final NullLiteral INSTANCE = new NullLiteral();

    private NullLiteral() {
    }

    @Override
    public ExprType type() {
      return ExprType.NULL;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("None");
    }
  }

  public static class BinaryExpr extends Expr {
    private final Expr left;
    private final BinaryOp op;
    private final Expr right;

    public BinaryExpr(Expr left, BinaryOp op, Expr right) {
      this.left = Preconditions.checkNotNull(left);
      this.op = Preconditions.checkNotNull(op);
      this.right = Preconditions.checkNotNull(right);
    }

    public Expr left() {
      return left;
    }

    public BinaryOp op() {
      return op;
    }

    public Expr right() {
      return right;
    }

    @Override
    public ExprType type() {
      return ExprType.BINARY_OP;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append('(').append(op.symbol()).append(' ');
      left.prettyPrint(sb);
      sb.append(' ');
      right.prettyPrint(sb);
      sb.append(')');
    }
  }

  public static class UnaryExpr extends Expr {
    private final UnaryOp op;
    private final Expr operand;

    public UnaryExpr(UnaryOp op, Expr operand) {
      this.op = Preconditions.checkNotNull(op);
      this.operand = Preconditions.checkNotNull(operand);
    }

    public UnaryOp op() {
      return op;
    }

    public Expr operand() {
      return operand;
    }

    @Override
    public ExprType type() {
      return ExprType.UNARY_OP;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append('(').append(op.sourceSymbol()).append(' ');
      operand.prettyPrint(sb);
      sb.append(')');
    }
  }

  /** value[index] */
  public static class Subscript extends Expr {
    private final Expr value;
    private final Expr index;

    public Subscript(Expr value, Expr index) {
      this.value = Preconditions.checkNotNull(value);
      this.index = Preconditions.checkNotNull(index);
    }

    public Expr value() {
      return value;
    }

    public Expr index() {
      return index;
    }

    @Override
    public ExprType type() {
      return ExprType.SUBSCRIPT;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("(index ");
      value.prettyPrint(sb);
      sb.append(' ');
      index.prettyPrint(sb);
      sb.append(')');
    }
  }

  public static class Call extends Expr {
    private final Expr callee;
    private final ImmutableList<Expr> args;

    public Call(Expr callee, List<? extends Expr> args) {
      this.callee = Preconditions.checkNotNull(callee);
      this.args = ImmutableList.copyOf(args);
    }

    public Expr callee() {
      return callee;
    }

    public List<Expr> args() {
      return args;
    }

    /**
     * @return true if callee is a bare name with given identifier
     */
    public boolean calls(String name) {
      return callee.type() == ExprType.NAME &&
             ((Name)callee).id().equals(name);
    }

    @Override
    public ExprType type() {
      return ExprType.CALL;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("(call ");
      callee.prettyPrint(sb);
      for (Expr arg: args) {
        sb.append(' ');
        arg.prettyPrint(sb);
      }
      sb.append(')');
    }
  }

  /**
   * Possibly chained comparison: left op[0] comparators[0] op[1] ...
   */
  public static class Compare extends Expr {
    private final Expr left;
    private final ImmutableList<CompareOp> ops;
    private final ImmutableList<Expr> comparators;

    public Compare(Expr left, List<CompareOp> ops,
                   List<? extends Expr> comparators) {
      Preconditions.checkArgument(!ops.isEmpty(),
                                  "comparison needs at least one operator");
      Preconditions.checkArgument(ops.size() == comparators.size(),
          "operators and comparators must pair up: %s vs %s",
          ops.size(), comparators.size());
      this.left = Preconditions.checkNotNull(left);
      this.ops = ImmutableList.copyOf(ops);
      this.comparators = ImmutableList.copyOf(comparators);
    }

    public Compare(Expr left, CompareOp op, Expr right) {
      this(left, ImmutableList.of(op), ImmutableList.of(right));
    }

    public Expr left() {
      return left;
    }

    public List<CompareOp> ops() {
      return ops;
    }

    public List<Expr> comparators() {
      return comparators;
    }

    public boolean isChained() {
      return ops.size() > 1;
    }

    @Override
    public ExprType type() {
      return ExprType.COMPARE;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("(compare ");
      left.prettyPrint(sb);
      for (int i = 0; i < ops.size(); i++) {
        sb.append(' ').append(ops.get(i).sourceSymbol()).append(' ');
        comparators.get(i).prettyPrint(sb);
      }
      sb.append(')');
    }
  }

  public static class ListLiteral extends Expr {
    private final ImmutableList<Expr> elements;

    public ListLiteral(List<? extends Expr> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    public List<Expr> elements() {
      return elements;
    }

    @Override
    public ExprType type() {
      return ExprType.LIST;
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append('[');
      boolean first = true;
      for (Expr e: elements) {
        if (!first) {
          sb.append(", ");
        }
        e.prettyPrint(sb);
        first = false;
      }
      sb.append(']');
    }
  }
}
