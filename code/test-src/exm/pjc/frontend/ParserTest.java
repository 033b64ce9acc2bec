package exm.pjc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.pjc.common.exceptions.InvalidSyntaxException;
import exm.pjc.common.exceptions.UnsupportedConstructException;
import exm.pjc.common.exceptions.UserException;
import exm.pjc.common.lang.Operators.BinaryOp;
import exm.pjc.common.lang.Operators.CompareOp;
import exm.pjc.common.lang.Operators.UnaryOp;
import exm.pjc.frontend.Token.Kind;
import exm.pjc.ic.tree.ICExprs.BinaryExpr;
import exm.pjc.ic.tree.ICExprs.BoolLiteral;
import exm.pjc.ic.tree.ICExprs.Call;
import exm.pjc.ic.tree.ICExprs.Compare;
import exm.pjc.ic.tree.ICExprs.ExprType;
import exm.pjc.ic.tree.ICExprs.ListLiteral;
import exm.pjc.ic.tree.ICExprs.NullLiteral;
import exm.pjc.ic.tree.ICExprs.NumberLiteral;
import exm.pjc.ic.tree.ICExprs.StringLiteral;
import exm.pjc.ic.tree.ICExprs.Subscript;
import exm.pjc.ic.tree.ICExprs.UnaryExpr;
import exm.pjc.ic.tree.ICStatements.AugAssign;
import exm.pjc.ic.tree.ICStatements.ExprStatement;
import exm.pjc.ic.tree.ICStatements.ForStatement;
import exm.pjc.ic.tree.ICStatements.FunctionDef;
import exm.pjc.ic.tree.ICStatements.IfStatement;
import exm.pjc.ic.tree.ICStatements.Return;
import exm.pjc.ic.tree.ICStatements.VariableAssign;
import exm.pjc.ic.tree.ICStatements.WhileStatement;
import exm.pjc.ic.tree.ICTree.Program;
import exm.pjc.ic.tree.ICTree.StatementType;

public class ParserTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Program parse(String src) throws UserException {
    return new Parser("test.py", Lexer.tokenize(src)).parse();
  }

  private static VariableAssign assign(String src) throws UserException {
    Program p = parse(src);
    assertEquals(1, p.body().size());
    return (VariableAssign)p.body().get(0);
  }

  @Test
  public void testAssignment() throws UserException {
    VariableAssign a = assign("x = 1 + 2 * 3\n");
    assertEquals("x", a.name());
    BinaryExpr sum = (BinaryExpr)a.value();
    assertEquals(BinaryOp.PLUS, sum.op());
    assertEquals(BinaryOp.MULT, ((BinaryExpr)sum.right()).op());
  }

  @Test
  public void testLeftAssociative() throws UserException {
    BinaryExpr e = (BinaryExpr)assign("x = a - b - c\n").value();
    assertEquals(BinaryOp.MINUS, e.op());
    assertEquals(ExprType.BINARY_OP, e.left().type());
    assertEquals(ExprType.NAME, e.right().type());
  }

  @Test
  public void testPowerRightAssociative() throws UserException {
    BinaryExpr e = (BinaryExpr)assign("x = 2 ** 3 ** 2\n").value();
    assertEquals(BinaryOp.POW, e.op());
    assertEquals(ExprType.NUMBER, e.left().type());
    assertEquals(BinaryOp.POW, ((BinaryExpr)e.right()).op());
  }

  @Test
  public void testUnaryMinusLooserThanPower() throws UserException {
    UnaryExpr e = (UnaryExpr)assign("x = -y ** 2\n").value();
    assertEquals(UnaryOp.MINUS, e.op());
    assertEquals(BinaryOp.POW, ((BinaryExpr)e.operand()).op());

    BinaryExpr p = (BinaryExpr)assign("x = 2 ** -1\n").value();
    assertEquals(ExprType.UNARY_OP, p.right().type());
  }

  @Test
  public void testBitwisePrecedence() throws UserException {
    // | < ^ < & < shifts < +
    BinaryExpr e = (BinaryExpr)assign("x = a | b ^ c & d << 1 + 2\n")
                                                               .value();
    assertEquals(BinaryOp.BIT_OR, e.op());
    BinaryExpr xor = (BinaryExpr)e.right();
    assertEquals(BinaryOp.BIT_XOR, xor.op());
    BinaryExpr and = (BinaryExpr)xor.right();
    assertEquals(BinaryOp.BIT_AND, and.op());
    BinaryExpr shift = (BinaryExpr)and.right();
    assertEquals(BinaryOp.LSHIFT, shift.op());
    assertEquals(BinaryOp.PLUS, ((BinaryExpr)shift.right()).op());
  }

  @Test
  public void testNotLooserThanComparison() throws UserException {
    UnaryExpr e = (UnaryExpr)assign("x = not a == b\n").value();
    assertEquals(UnaryOp.NOT, e.op());
    assertEquals(ExprType.COMPARE, e.operand().type());
  }

  @Test
  public void testChainedComparison() throws UserException {
    Compare c = (Compare)assign("x = a < b <= c\n").value();
    assertTrue(c.isChained());
    assertEquals(Arrays.asList(CompareOp.LT, CompareOp.LTE), c.ops());
    assertEquals(2, c.comparators().size());
  }

  @Test
  public void testWordComparisons() throws UserException {
    Compare c = (Compare)assign("x = a not in b\n").value();
    assertEquals(Arrays.asList(CompareOp.NOT_IN), c.ops());
    c = (Compare)assign("x = a is not None\n").value();
    assertEquals(Arrays.asList(CompareOp.IS_NOT), c.ops());
    assertSame(NullLiteral.INSTANCE, c.comparators().get(0));
    c = (Compare)assign("x = a in b\n").value();
    assertEquals(Arrays.asList(CompareOp.IN), c.ops());
    c = (Compare)assign("x = a is b\n").value();
    assertEquals(Arrays.asList(CompareOp.IS), c.ops());
  }

  @Test
  public void testLiterals() throws UserException {
    ListLiteral l = (ListLiteral)assign(
        "x = [1, 2.5, 'a' \"b\", True, False, None,]\n").value();
    assertEquals(6, l.elements().size());
    assertEquals(BigInteger.ONE,
                 ((NumberLiteral)l.elements().get(0)).value());
    assertFalse(((NumberLiteral)l.elements().get(1)).isInteger());
    assertEquals("ab", ((StringLiteral)l.elements().get(2)).value());
    assertSame(BoolLiteral.TRUE, l.elements().get(3));
    assertSame(BoolLiteral.FALSE, l.elements().get(4));
    assertSame(NullLiteral.INSTANCE, l.elements().get(5));

    assertEquals(0, ((ListLiteral)assign("x = []\n").value())
                                        .elements().size());
  }

  @Test
  public void testPostfixChains() throws UserException {
    Call call = (Call)assign("x = f(a)[0](b, c)\n").value();
    assertEquals(2, call.args().size());
    Subscript sub = (Subscript)call.callee();
    Call inner = (Call)sub.value();
    assertTrue(inner.calls("f"));
  }

  @Test
  public void testAugAssign() throws UserException {
    String[] ops = {"+", "-", "*", "/", "%", "**", "//", "&", "|", "^",
                    "<<", ">>"};
    for (String op: ops) {
      Program p = parse("x " + op + "= 2\n");
      AugAssign a = (AugAssign)p.body().get(0);
      assertEquals("x", a.target());
      assertEquals(op, a.op().symbol());
    }
  }

  @Test
  public void testFunctionDef() throws UserException {
    Program p = parse("def add(a, b):\n    return a + b\n\ndef nop():\n" +
                      "    return\n");
    FunctionDef add = (FunctionDef)p.body().get(0);
    assertEquals("add", add.name());
    assertEquals(Arrays.asList("a", "b"), add.params());
    assertEquals(StatementType.RETURN, add.body().get(0).type());
    FunctionDef nop = (FunctionDef)p.body().get(1);
    assertEquals(0, nop.params().size());
    assertFalse(((Return)nop.body().get(0)).hasValue());
  }

  @Test
  public void testElifFolding() throws UserException {
    String src =
        "if a:\n" +
        "    x = 1\n" +
        "elif b:\n" +
        "    x = 2\n" +
        "elif c:\n" +
        "    x = 3\n" +
        "else:\n" +
        "    x = 4\n";
    Program p = parse(src);
    assertEquals(1, p.body().size());
    IfStatement first = (IfStatement)p.body().get(0);
    IfStatement second = first.elseIf();
    IfStatement third = second.elseIf();
    assertEquals(1, first.elseBlock().size());
    assertEquals(1, second.elseBlock().size());
    assertNull(third.elseIf());
    assertEquals(StatementType.VARIABLE_ASSIGN,
                 third.elseBlock().get(0).type());
  }

  @Test
  public void testIfWithoutElse() throws UserException {
    IfStatement s = (IfStatement)parse("if a:\n    f()\n").body().get(0);
    assertFalse(s.hasElse());
    assertNull(s.elseIf());
  }

  @Test
  public void testLoops() throws UserException {
    Program p = parse("for i in range(5): print(i)\n" +
                      "while i < 3:\n    i += 1\n");
    ForStatement f = (ForStatement)p.body().get(0);
    assertEquals("i", f.target());
    assertTrue(((Call)f.iterable()).calls("range"));
    assertEquals(StatementType.EXPR, f.body().get(0).type());
    WhileStatement w = (WhileStatement)p.body().get(1);
    assertEquals(ExprType.COMPARE, w.test().type());
  }

  @Test
  public void testSemicolonSeparatedStatements() throws UserException {
    Program p = parse("a = 1; b = 2; f(a);\n");
    assertEquals(3, p.body().size());
    assertEquals(StatementType.EXPR, p.body().get(2).type());
    assertEquals(ExprType.CALL,
                 ((ExprStatement)p.body().get(2)).value().type());
  }

  @Test
  public void testNamedConstantsCanonicalized() throws UserException {
    // Identifier tokens spelled like the constants are literals too
    List<Token> toks = new ArrayList<Token>();
    toks.add(new Token(Kind.IDENT, "x", null, 1, 0, 1));
    toks.add(new Token(Kind.SYMBOL, "=", null, 1, 2, 3));
    toks.add(new Token(Kind.IDENT, "None", null, 1, 4, 8));
    toks.add(new Token(Kind.NEWLINE, "\n", null, 1, 8, 9));
    toks.add(new Token(Kind.EOF, "", null, 2, 0, 0));
    Program p = new Parser(null, toks).parse();
    VariableAssign a = (VariableAssign)p.body().get(0);
    assertSame(NullLiteral.INSTANCE, a.value());

    assertSame(BoolLiteral.TRUE, assign("x = True\n").value());
  }

  @Test
  public void testIncompleteExpression() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("test.py:1:8: parse error: expected " +
                            "expression but found end of line");
    parse("x = 1 +\n");
  }

  @Test
  public void testMissingIndentedBlock() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("expected indented block");
    parse("if a:\nx = 1\n");
  }

  @Test
  public void testUnexpectedIndent() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("unexpected indent");
    parse("x = 1\n    y = 2\n");
  }

  @Test
  public void testTrailingGarbage() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("expected end of line but found 'y'");
    parse("x = 1 y\n");
  }

  @Test
  public void testStringPrefixes() throws UserException {
    assertUnsupported("x = r\"a\\\\b\"\n", "string prefix");
    assertUnsupported("print(f'{x}')\n", "string prefix");
    assertUnsupported("x = B'raw'\n", "string prefix");
    assertUnsupported("x = Rb\"\"\"doc\"\"\"\n", "string prefix");
    // Separated by a space, or not a prefix letter: ordinary names
    Program p = parse("x = r + \"a\"\nx = rs\n");
    assertEquals(2, p.body().size());
  }

  private static void assertUnsupported(String src, String construct)
      throws UserException {
    try {
      parse(src);
      fail("expected unsupported construct in: " + src);
    } catch (UnsupportedConstructException e) {
      assertEquals(src, construct, e.getConstruct());
      assertTrue(e.getMessage().contains("unsupported construct: " +
                                         construct));
    }
  }

  @Test
  public void testUnsupportedStatements() throws UserException {
    assertUnsupported("a = b = 1\n", "multiple assignment targets");
    assertUnsupported("a[0] = 1\n", "assignment to non-identifier target");
    assertUnsupported("a[0] += 1\n",
                      "augmented assignment to non-identifier target");
    assertUnsupported("a, b = 1, 2\n", "tuple");
    assertUnsupported("for a, b in xs:\n    f()\n", "tuple loop target");
    assertUnsupported("class A:\n    x = 1\n", "class definition");
    assertUnsupported("import os\n", "import statement");
    assertUnsupported("while a:\n    break\n", "break statement");
    assertUnsupported("pass\n", "pass statement");
    assertUnsupported("def f(a=1):\n    return a\n",
                      "default parameter value");
    assertUnsupported("def f(*args):\n    return 1\n",
                      "variadic or positional-only parameters");
    assertUnsupported("for i in xs:\n    f()\nelse:\n    g()\n",
                      "for-else clause");
    assertUnsupported("x: int = 1\n", "variable annotation");
  }

  @Test
  public void testUnsupportedExpressions() throws UserException {
    assertUnsupported("x = a and b\n", "boolean operator 'and'");
    assertUnsupported("x = a or b\n", "boolean operator 'or'");
    assertUnsupported("x = 1 if a else 2\n", "conditional expression");
    assertUnsupported("x = lambda: 1\n", "lambda");
    assertUnsupported("x = a.b\n", "attribute access");
    assertUnsupported("x = a[1:2]\n", "slice");
    assertUnsupported("x = f(k=1)\n", "keyword argument");
    assertUnsupported("x = f(*xs)\n", "starred argument");
    assertUnsupported("x = (1, 2)\n", "tuple");
    assertUnsupported("x = {}\n", "dict or set literal");
    assertUnsupported("x = [i for i in xs]\n", "list comprehension");
  }

  @Test
  public void testUnsupportedPosition() throws UserException {
    try {
      parse("x = 1\ny = a and b\n");
      fail();
    } catch (UnsupportedConstructException e) {
      assertEquals(2, e.getLine());
      assertEquals(6, e.getColumn());
    }
  }
}
