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
package exm.pjc.common.lang;

import com.google.common.collect.ImmutableMap;

/**
 * This class serves to define details of the operators of the source
 * language and how each is spelled in the target language
 */
public class Operators {

  /**
   * Arithmetic and bitwise binary operators
   */
  public static enum BinaryOp {
    PLUS("+"), MINUS("-"), MULT("*"), DIV("/"), MOD("%"),
    /** Exponentiation, lowered to a library call */
    POW("**"),
    /** Floor division, lowered to a library call */
    FLOOR_DIV("//"),
    BIT_AND("&"), BIT_OR("|"), BIT_XOR("^"),
    LSHIFT("<<"), RSHIFT(">>");

    private final String symbol;

    private BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    /**
     * @return spelling, which is the same in source and target
     */
    public String symbol() {
      return symbol;
    }

    /**
     * @return true if target has no infix operator with same meaning
     */
    public boolean needsLowering() {
      return this == POW || this == FLOOR_DIV;
    }
  }

  public static enum UnaryOp {
    PLUS("+", "+"),
    MINUS("-", "-"),
    NOT("not", "!"),
    INVERT("~", "~");

    private final String sourceSymbol;
    private final String targetSymbol;

    private UnaryOp(String sourceSymbol, String targetSymbol) {
      this.sourceSymbol = sourceSymbol;
      this.targetSymbol = targetSymbol;
    }

    public String sourceSymbol() {
      return sourceSymbol;
    }

    public String targetSymbol() {
      return targetSymbol;
    }
  }

  /**
   * Relational operators.  Equality and identity both map to strict
   * equality in the target.
   */
  public static enum CompareOp {
    EQ("==", "==="),
    NOT_EQ("!=", "!=="),
    LT("<", "<"),
    LTE("<=", "<="),
    GT(">", ">"),
    GTE(">=", ">="),
    IS("is", "==="),
    IS_NOT("is not", "!=="),
    IN("in", "in"),
    /** Rendered as negated membership test */
    NOT_IN("not in", "in");

    private final String sourceSymbol;
    private final String targetSymbol;

    private CompareOp(String sourceSymbol, String targetSymbol) {
      this.sourceSymbol = sourceSymbol;
      this.targetSymbol = targetSymbol;
    }

    public String sourceSymbol() {
      return sourceSymbol;
    }

    public String targetSymbol() {
      return targetSymbol;
    }

    /**
     * @return true if the target test must be negated
     */
    public boolean negated() {
      return this == NOT_IN;
    }
  }

  private static final ImmutableMap<String, BinaryOp> binaryBySymbol;
  private static final ImmutableMap<String, BinaryOp> augmentedBySymbol;
  private static final ImmutableMap<String, CompareOp> compareBySymbol;

  static {
    ImmutableMap.Builder<String, BinaryOp> bin = ImmutableMap.builder();
    ImmutableMap.Builder<String, BinaryOp> aug = ImmutableMap.builder();
    for (BinaryOp op: BinaryOp.values()) {
      bin.put(op.symbol(), op);
      aug.put(op.symbol() + "=", op);
    }
    binaryBySymbol = bin.build();
    augmentedBySymbol = aug.build();

    ImmutableMap.Builder<String, CompareOp> cmp = ImmutableMap.builder();
    for (CompareOp op: CompareOp.values()) {
      cmp.put(op.sourceSymbol(), op);
    }
    compareBySymbol = cmp.build();
  }

  /**
   * @param symbol e.g. "+" or "//"
   * @return operator or null if not a binary operator
   */
  public static BinaryOp binaryOp(String symbol) {
    return binaryBySymbol.get(symbol);
  }

  /**
   * @param symbol augmented assignment symbol, e.g. "+=" or "**="
   * @return underlying binary operator, or null if not an augmented
   *         assignment symbol
   */
  public static BinaryOp augmentedOp(String symbol) {
    return augmentedBySymbol.get(symbol);
  }

  /**
   * @param symbol e.g. "<" or "not in"
   * @return operator or null if not a comparison
   */
  public static CompareOp compareOp(String symbol) {
    return compareBySymbol.get(symbol);
  }
}
