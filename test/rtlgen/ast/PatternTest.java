package rtlgen.ast;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PatternTest {

  @Test
  void testBitsIgnoreWhitespace() {
    Pattern pattern = Pattern.ofBits("1 0\t-");
    Assertions.assertTrue(pattern.isBits());
    Assertions.assertEquals("10-", pattern.getBits());
    Assertions.assertEquals(Pattern.ofBits("10-"), pattern);
  }

  @ParameterizedTest
  @ValueSource(strings = {"10x", "2", "1_0"})
  void testBitsRejectMalformed(String bits) {
    Assertions.assertThrows(IllegalArgumentException.class, () -> Pattern.ofBits(bits));
  }

  @Test
  void testMatches() {
    Pattern dontCare = Pattern.ofBits("1-");
    Assertions.assertTrue(dontCare.matches(0b10, 2));
    Assertions.assertTrue(dontCare.matches(0b11, 2));
    Assertions.assertFalse(dontCare.matches(0b01, 2));

    Pattern value = Pattern.ofValue(3);
    Assertions.assertTrue(value.matches(3, 4));
    Assertions.assertFalse(value.matches(7, 4));
    Assertions.assertEquals("0011", value.toBits(4));
    Assertions.assertThrows(IllegalArgumentException.class, () -> dontCare.toBits(3));
  }

  @Test
  void testValueAndBitsDistinct() {
    Assertions.assertNotEquals(Pattern.ofValue(1), Pattern.ofBits("1"));
    Assertions.assertEquals(Pattern.ofValue(1), Pattern.ofValue(1));
    Assertions.assertThrows(IllegalStateException.class, () -> Pattern.ofValue(1).getBits());
    Assertions.assertThrows(IllegalStateException.class, () -> Pattern.ofBits("1").getValue());
  }

  @Test
  void testSwitchSelectTakesFirstMatch() {
    Signal sel = new Signal(2, "sel");
    Signal y = new Signal(2, "y");
    StatementList first = new StatementList(List.of(y.eq(1)));
    StatementList second = new StatementList(List.of(y.eq(2)));
    StatementList fallback = new StatementList(List.of(y.eq(3)));
    Switch sw = new Switch(sel,
                           List.of(new Switch.Case(List.of(Pattern.ofBits("1-")), first, SrcLoc.UNKNOWN),
                                   new Switch.Case(List.of(Pattern.ofValue(3)), second, SrcLoc.UNKNOWN),
                                   new Switch.Case(List.of(), fallback, SrcLoc.UNKNOWN)),
                           SrcLoc.UNKNOWN);
    Assertions.assertSame(first, sw.select(3).get().getBody());
    Assertions.assertSame(first, sw.select(2).get().getBody());
    Assertions.assertSame(fallback, sw.select(1).get().getBody());
    Assertions.assertSame(fallback, sw.getDefault().get());
    Assertions.assertEquals(List.of(y), List.copyOf(sw.lhsSignals()));
  }

  @Test
  void testSwitchRejectsPatternWidth() {
    Signal sel = new Signal(2, "sel");
    Assertions.assertThrows(IllegalArgumentException.class,
                            ()
                                -> new Switch(sel, List.of(new Switch.Case(List.of(Pattern.ofBits("1")), new StatementList(), SrcLoc.UNKNOWN)),
                                              SrcLoc.UNKNOWN));
  }
}
