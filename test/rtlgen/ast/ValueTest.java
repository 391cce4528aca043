package rtlgen.ast;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ValueTest {

  @Test
  void testConstCast() {
    Assertions.assertEquals(Shape.unsigned(3), Const.cast(5).shape());
    Assertions.assertEquals(Shape.signed(2), Const.cast(-2).shape());
    Assertions.assertEquals(1, Const.cast(true).getValue());
    Assertions.assertEquals(Shape.unsigned(1), Const.cast(false).shape());
    Assertions.assertThrows(IllegalArgumentException.class, () -> Const.cast("1"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Const.cast(new Signal("s")));
  }

  @Test
  void testConstNormalize() {
    Assertions.assertEquals(1, new Const(5, Shape.unsigned(2)).getValue());
    Assertions.assertEquals(-1, new Const(3, Shape.signed(2)).getValue());
  }

  @Test
  void testCatOfConsts() {
    // First part in the least significant bits.
    Const cat = Const.cast(new Cat(new Const(1, Shape.unsigned(1)), new Const(2, Shape.unsigned(2))));
    Assertions.assertEquals(0b101, cat.getValue());
    Assertions.assertEquals(3, cat.width());
  }

  @Test
  void testAssignTargets() {
    Signal a = new Signal("a");
    Signal b = new Signal(2, "b");
    Assign assign = new Cat(a, b).eq(0);
    Assertions.assertEquals(List.of(a, b), List.copyOf(assign.lhsSignals()));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Const(1).eq(a));
    Assertions.assertThrows(IllegalArgumentException.class, () -> a.bool().eq(1));
  }

  @Test
  void testOperatorShapes() {
    Signal s = new Signal(Shape.signed(4), "s");
    Assertions.assertEquals(Shape.signed(4), s.not().shape());
    Assertions.assertEquals(Shape.unsigned(1), s.bool().shape());
    Assertions.assertEquals(Shape.unsigned(1), s.equalTo(3).shape());
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Operator("+", List.of(s, s)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Operator("b", List.of(s, s)));
  }

  @Test
  void testStatementListCast() {
    Signal a = new Signal("a");
    Signal b = new Signal("b");
    StatementList list = StatementList.cast(new Object[] {a.eq(1), List.of(b.eq(0), List.of(Property.Assert(a)))});
    Assertions.assertEquals(3, list.size());
    Assertions.assertEquals(List.of(a, b), List.copyOf(list.lhsSignals()));
    Assertions.assertThrows(IllegalArgumentException.class, () -> StatementList.cast(List.of(a)));
  }

  @Test
  void testShapeForRange() {
    Assertions.assertEquals(0, Shape.forRange(0).getWidth());
    Assertions.assertEquals(0, Shape.forRange(1).getWidth());
    Assertions.assertEquals(1, Shape.forRange(2).getWidth());
    Assertions.assertEquals(2, Shape.forRange(3).getWidth());
    Assertions.assertEquals(2, Shape.forRange(4).getWidth());
    Assertions.assertEquals(3, Shape.forRange(5).getWidth());
  }

  @Test
  void testSrcLocPointsAtCaller() {
    SrcLoc loc = SrcLoc.capture();
    Assertions.assertEquals("ValueTest.java", loc.getFile());
  }
}
