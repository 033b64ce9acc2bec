package exm.pjc.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.pjc.common.lang.Operators.BinaryOp;
import exm.pjc.common.lang.Operators.CompareOp;

public class OperatorsTest {

  @Test
  public void testLookups() {
    assertEquals(BinaryOp.FLOOR_DIV, Operators.binaryOp("//"));
    assertEquals(BinaryOp.POW, Operators.augmentedOp("**="));
    assertEquals(BinaryOp.RSHIFT, Operators.augmentedOp(">>="));
    assertNull(Operators.augmentedOp("=="));
    assertNull(Operators.binaryOp("@"));
    assertEquals(CompareOp.NOT_IN, Operators.compareOp("not in"));
    assertEquals(CompareOp.IS_NOT, Operators.compareOp("is not"));
    assertNull(Operators.compareOp("="));
  }

  @Test
  public void testTargetSpelling() {
    assertEquals("===", CompareOp.EQ.targetSymbol());
    assertEquals("===", CompareOp.IS.targetSymbol());
    assertEquals("!==", CompareOp.IS_NOT.targetSymbol());
    assertEquals("in", CompareOp.NOT_IN.targetSymbol());
    assertTrue(CompareOp.NOT_IN.negated());
    assertFalse(CompareOp.IN.negated());
    assertEquals("!", Operators.UnaryOp.NOT.targetSymbol());
  }

  @Test
  public void testLowering() {
    for (BinaryOp op: BinaryOp.values()) {
      assertEquals(op.toString(),
          op == BinaryOp.POW || op == BinaryOp.FLOOR_DIV, op.needsLowering());
    }
  }
}
