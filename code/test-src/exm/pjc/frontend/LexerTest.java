package exm.pjc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import exm.pjc.common.exceptions.LexException;
import exm.pjc.common.lang.Stage;
import exm.pjc.frontend.Token.Kind;

public class LexerTest {

  private static List<Kind> kinds(List<Token> tokens) {
    List<Kind> result = new ArrayList<Kind>();
    for (Token t: tokens) {
      result.add(t.kind());
    }
    return result;
  }

  private static int count(List<Token> tokens, Kind kind) {
    int n = 0;
    for (Token t: tokens) {
      if (t.is(kind)) {
        n++;
      }
    }
    return n;
  }

  @Test
  public void testSimpleAssignment() throws LexException {
    List<Token> toks = Lexer.tokenize("x = 42\n");
    assertEquals(5, toks.size());
    assertTrue(toks.get(0).is(Kind.IDENT, "x"));
    assertTrue(toks.get(1).isSymbol("="));
    assertEquals(Kind.NUMBER, toks.get(2).kind());
    assertEquals(BigInteger.valueOf(42), toks.get(2).value());
    assertEquals(Kind.NEWLINE, toks.get(3).kind());
    assertEquals(Kind.EOF, toks.get(4).kind());

    assertEquals(1, toks.get(2).line());
    assertEquals(4, toks.get(2).column());
    assertEquals(6, toks.get(2).endColumn());
  }

  @Test
  public void testMissingFinalNewline() throws LexException {
    List<Token> toks = Lexer.tokenize("print(x)");
    assertEquals(Kind.NEWLINE, toks.get(toks.size() - 2).kind());
    assertEquals(Kind.EOF, toks.get(toks.size() - 1).kind());
  }

  @Test
  public void testIndentDedentBalanced() throws LexException {
    String src =
        "def f(a):\n" +
        "    if a:\n" +
        "        return 1\n" +
        "\n" +
        "    # comment at other level\n" +
        "            # deeper comment\n" +
        "    return 2\n" +
        "x = f(1)\n";
    List<Token> toks = Lexer.tokenize(src);
    assertEquals(2, count(toks, Kind.INDENT));
    assertEquals(2, count(toks, Kind.DEDENT));

    // Stack discipline: never more DEDENTs than INDENTs at any prefix
    int depth = 0;
    for (Token t: toks) {
      if (t.is(Kind.INDENT)) {
        depth++;
      } else if (t.is(Kind.DEDENT)) {
        depth--;
        assertTrue(depth >= 0);
      }
    }
    assertEquals(0, depth);
  }

  @Test
  public void testDedentsClosedAtEnd() throws LexException {
    String src = "while a:\n  while b:\n    c = 1";
    List<Token> toks = Lexer.tokenize(src);
    int n = toks.size();
    assertEquals(Kind.NEWLINE, toks.get(n - 4).kind());
    assertEquals(Kind.DEDENT, toks.get(n - 3).kind());
    assertEquals(Kind.DEDENT, toks.get(n - 2).kind());
    assertEquals(Kind.EOF, toks.get(n - 1).kind());
  }

  @Test
  public void testTabsExpandToFourColumns() throws LexException {
    // A tab-indented block followed by a four-space line is one level
    String src = "if a:\n\tb = 1\nif c:\n    d = 2\n";
    List<Token> toks = Lexer.tokenize(src);
    for (Token t: toks) {
      if (t.is(Kind.INDENT)) {
        assertEquals(4, t.value());
      }
    }
    assertEquals(2, count(toks, Kind.INDENT));
  }

  @Test
  public void testMixedTabsAndSpaces() {
    try {
      Lexer.tokenize("if a:\n  \tb = 1\n");
      fail("expected lex error");
    } catch (LexException e) {
      assertEquals(Stage.LEX, e.getStage());
      assertEquals(2, e.getLine());
      assertTrue(e.getMessage(),
                 e.getMessage().contains("inconsistent use of tabs"));
    }
  }

  @Test
  public void testInconsistentDedent() {
    try {
      Lexer.tokenize("if a:\n        b = 1\n    c = 2\n");
      fail("expected lex error");
    } catch (LexException e) {
      assertEquals(3, e.getLine());
      assertTrue(e.getRawMessage().startsWith("unindent does not match"));
    }
  }

  @Test
  public void testMalformedNumbers() {
    String[] bad = {"x = 1.2.3\n", "x = 0x1F\n", "x = 1_000\n",
                    "x = 12abc\n"};
    for (String src: bad) {
      try {
        Lexer.tokenize(src);
        fail("expected lex error for " + src);
      } catch (LexException e) {
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
        assertTrue(e.getRawMessage().startsWith("malformed numeric literal"));
      }
    }
  }

  @Test
  public void testNumberClassification() throws LexException {
    List<Token> toks = Lexer.tokenize(
            "a = 3 + 2.5 + 1e3 + 7. + 123456789012345678901234567890\n");
    assertEquals(BigInteger.valueOf(3), toks.get(2).value());
    assertEquals(Double.valueOf(2.5), toks.get(4).value());
    assertEquals(Double.valueOf(1000.0), toks.get(6).value());
    assertEquals(Double.valueOf(7.0), toks.get(8).value());
    assertEquals(new BigInteger("123456789012345678901234567890"),
                 toks.get(10).value());
  }

  @Test
  public void testLeadingDotFloat() throws LexException {
    List<Token> toks = Lexer.tokenize("a = .5 + .25e2 + x.y\n");
    assertEquals(Kind.NUMBER, toks.get(2).kind());
    assertEquals(".5", toks.get(2).text());
    assertEquals(Double.valueOf(0.5), toks.get(2).value());
    assertEquals(Double.valueOf(25.0), toks.get(4).value());
    assertTrue(toks.get(7).isSymbol("."));
    assertEquals("y", toks.get(8).text());
  }

  @Test
  public void testExponentWithSign() throws LexException {
    List<Token> toks = Lexer.tokenize("a = 1.5e-7-1\n");
    assertEquals("1.5e-7", toks.get(2).text());
    assertTrue(toks.get(3).isSymbol("-"));
    assertEquals("1", toks.get(4).text());
  }

  @Test
  public void testUnexpectedCharacter() {
    try {
      Lexer.tokenize("x = 1\ny = $\n");
      fail("expected lex error");
    } catch (LexException e) {
      assertEquals(2, e.getLine());
      assertEquals(4, e.getColumn());
      assertEquals("2:5: lex error: unexpected character '$'",
                   e.getMessage());
    }
  }

  @Test
  public void testErrorMessageWithFile() {
    try {
      new Lexer("prog.py", "a = ?\n").tokenize();
      fail("expected lex error");
    } catch (LexException e) {
      assertEquals("prog.py:1:5: lex error: unexpected character '?'",
                   e.getMessage());
    }
  }

  @Test
  public void testStringEscapes() throws LexException {
    List<Token> toks = Lexer.tokenize(
        "a = 'it\\'s'\nb = \"say \\\"hi\\\" \\\\ \\n\"\n");
    assertEquals("it's", toks.get(2).value());
    // \n is kept as written
    assertEquals("say \"hi\" \\ \\n", toks.get(6).value());
  }

  @Test
  public void testTripleQuotedStringAdvancesLine() throws LexException {
    String src = "s = \"\"\"one\ntwo\nthree\"\"\"\nt = 1\n";
    List<Token> toks = Lexer.tokenize(src);
    Token str = toks.get(2);
    assertEquals(Kind.STRING, str.kind());
    assertEquals("one\ntwo\nthree", str.value());
    assertEquals(1, str.line());

    Token t = toks.get(4);
    assertTrue(t.is(Kind.IDENT, "t"));
    assertEquals(4, t.line());
    assertEquals(0, t.column());
  }

  @Test
  public void testUnterminatedString() {
    try {
      Lexer.tokenize("x = 1\ns = 'abc\n");
      fail("expected lex error");
    } catch (LexException e) {
      assertEquals(2, e.getLine());
      assertEquals(4, e.getColumn());
      assertEquals("unterminated string literal", e.getRawMessage());
    }
  }

  @Test
  public void testImplicitLineJoining() throws LexException {
    String src = "xs = [1,\n      2,\n  3]\ny = 2\n";
    List<Token> toks = Lexer.tokenize(src);
    assertEquals(0, count(toks, Kind.INDENT));
    assertEquals(2, count(toks, Kind.NEWLINE));
  }

  @Test
  public void testKeywordsAndSymbols() throws LexException {
    List<Token> toks = Lexer.tokenize("x **= y // 2 if not z is None\n");
    List<Kind> expected = new ArrayList<Kind>();
    expected.add(Kind.IDENT);
    expected.add(Kind.SYMBOL);
    expected.add(Kind.IDENT);
    expected.add(Kind.SYMBOL);
    expected.add(Kind.NUMBER);
    expected.add(Kind.KEYWORD);
    expected.add(Kind.KEYWORD);
    expected.add(Kind.IDENT);
    expected.add(Kind.KEYWORD);
    expected.add(Kind.KEYWORD);
    expected.add(Kind.NEWLINE);
    expected.add(Kind.EOF);
    assertEquals(expected, kinds(toks));
    assertEquals("**=", toks.get(1).text());
    assertEquals("//", toks.get(3).text());
    // print is an ordinary identifier
    assertEquals(Kind.IDENT, Lexer.tokenize("print").get(0).kind());
  }

  @Test
  public void testBlankAndCommentLinesIgnored() throws LexException {
    List<Token> toks = Lexer.tokenize("\n\n# only a comment\n   \nx = 1\n");
    assertEquals(Kind.IDENT, toks.get(0).kind());
    assertEquals(5, toks.get(0).line());
  }

  @Test
  public void testTokenizeIsCached() throws LexException {
    Lexer lexer = new Lexer(null, "a = 1\n");
    assertTrue(lexer.tokenize() == lexer.tokenize());
  }
}
