package exm.pjc.jsbackend.tree;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

import exm.pjc.common.exceptions.PJCRuntimeError;
import exm.pjc.jsbackend.tree.Layout.IndentPolicy;

public class JsTreeTest {

  private static Sequence seq(JsTree... trees) {
    return new Sequence(Arrays.asList(trees));
  }

  private static JsTree call(String f) {
    return new ExprStatement(new Call(f));
  }

  @Test
  public void testLayout() {
    Layout cumulative = new Layout(IndentPolicy.CUMULATIVE, 3);
    assertEquals(9, cumulative.bodyIndentation(6));
    assertEquals(6, cumulative.closingIndentation(6));

    Layout flat = new Layout(IndentPolicy.FLAT, 3);
    assertEquals(3, flat.bodyIndentation(6));
    assertEquals(0, flat.closingIndentation(6));

    assertEquals(IndentPolicy.FLAT, IndentPolicy.fromString(" Flat "));
  }

  @Test(expected=IllegalArgumentException.class)
  public void testBadWidth() {
    new Layout(IndentPolicy.CUMULATIVE, 0);
  }

  @Test
  public void testEmptyBlock() {
    WhileLoop loop = new WhileLoop(new Token("true"), new Sequence());
    assertEquals("while (true) {\n}\n", loop.toString());
  }

  @Test
  public void testNestedIndentation() {
    If inner = new If(new Token("b"), seq(call("g")));
    FunctionDecl f = new FunctionDecl("f", Arrays.asList("a"),
                                      seq(call("h"), inner));
    Sequence top = seq(f);
    assertEquals("function f(a) {\n" +
                 "    h();\n" +
                 "    if (b) {\n" +
                 "        g();\n" +
                 "    }\n" +
                 "}\n", top.toString());

    top.setLayout(new Layout(IndentPolicy.FLAT, 2));
    assertEquals("function f(a) {\n" +
                 "  h();\n" +
                 "  if (b) {\n" +
                 "  g();\n" +
                 "}\n" +
                 "}\n", top.toString());
  }

  @Test
  public void testElseIfOnSameLine() {
    If last = new If(new Token("c"), seq(call("h")), seq(call("k")));
    If middle = new If(new Token("b"), seq(call("g")));
    middle.setElseIf(last);
    If first = new If(new Token("a"), seq(call("f")));
    first.setElseIf(middle);
    Sequence body = seq(first);
    body.setIndentation(2);
    assertEquals("  if (a) {\n      f();\n  } else if (b) {\n      g();\n" +
                 "  } else if (c) {\n      h();\n  } else {\n      k();\n" +
                 "  }\n", body.toString());
  }

  @Test(expected=PJCRuntimeError.class)
  public void testSecondElse() {
    If i = new If(new Token("a"), seq(call("f")), seq(call("g")));
    i.setElseIf(new If(new Token("b"), seq(call("h"))));
  }

  @Test
  public void testExpressions() {
    assertEquals("Math.floor(a / b)", new Call("Math.floor",
        new BinaryExpr(new Token("a"), "/", new Token("b"), false))
        .toString());
    assertEquals("(a && b)", new Conjunction(Arrays.asList(
        new Token("a"), new Token("b"))).toString());
    assertEquals("!(x in xs)", new Not(new BinaryExpr(new Token("x"), "in",
        new Token("xs"))).toString());
    assertEquals("+ +x", new Prefix("+", new Prefix("+", new Token("x")))
                                .toString());
    assertEquals("-~x", new Prefix("-", new Prefix("~", new Token("x")))
                                .toString());
    assertEquals("xs[0]", new Index(new Token("xs"), new Token("0"))
                                .toString());
    assertEquals("[\"a\\\\\", 1]", new JsArray(Arrays.asList(
        new JsString("a\\"), new Token("1"))).toString());
  }

  @Test
  public void testStatements() {
    assertEquals("let x = 1;\n",
                 SetVariable.declare("x", new Token("1")).toString());
    assertEquals("x -= 1;\n",
                 SetVariable.update("x", "-=", new Token("1")).toString());
    assertEquals("return;\n", new Return().toString());
    assertEquals("for (let i = 0; i < n; i += 2) {\n    f();\n}\n",
        new ForLoop("i", new Token("0"), new Token("n"), new Token("2"),
                    seq(call("f"))).toString());
    assertEquals("for (let v of vs) {\n    f();\n}\n",
        new ForOf("v", new Token("vs"), seq(call("f"))).toString());
  }
}
