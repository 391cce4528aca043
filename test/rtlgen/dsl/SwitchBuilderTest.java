package rtlgen.dsl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import rtlgen.ast.Assign;
import rtlgen.ast.Const;
import rtlgen.ast.Pattern;
import rtlgen.ast.Signal;
import rtlgen.ast.StatementList;
import rtlgen.ast.Switch;
import rtlgen.ir.Fragment;
import rtlgen.ui.RTLGenConfig;

class SwitchBuilderTest {

  Module m;
  Signal sel, y;

  @BeforeEach
  void setUp() throws Exception {
    m = new Module();
    sel = new Signal(2, "sel");
    y = new Signal(4, "y");
  }

  static long rhsValue(StatementList body) { return ((Const)((Assign)body.get(0)).getRhs()).getValue(); }

  @Test
  void testCasesAndDefault() {
    m.Switch(sel, () -> {
      m.Case("00", () -> m.d("comb").add(y.eq(1)));
      m.Case(List.of(1, "1-"), () -> m.d("comb").add(y.eq(2)));
      m.Default(() -> m.d("comb").add(y.eq(3)));
    });
    Fragment fragment = m.elaborate(null);

    Switch sw = (Switch)fragment.getStatements("comb").get(0);
    Assertions.assertSame(sel, sw.getTest());
    Assertions.assertEquals(3, sw.getCases().size());
    Assertions.assertEquals(List.of(Pattern.ofValue(1), Pattern.ofBits("1-")), sw.getCases().get(1).getPatterns());
    Assertions.assertEquals(1, rhsValue(sw.select(0).get().getBody()));
    Assertions.assertEquals(2, rhsValue(sw.select(1).get().getBody()));
    Assertions.assertEquals(2, rhsValue(sw.select(3).get().getBody()));
    Assertions.assertEquals(3, rhsValue(sw.getDefault().get()));
    Assertions.assertTrue(m.getDiagnostics().isEmpty());
  }

  @Test
  void testDuplicateCaseKeepsFirst() {
    m.Switch(sel, () -> {
      m.Case("01", () -> m.d("comb").add(y.eq(1)));
      m.Case("01", () -> m.d("comb").add(y.eq(2)));
    });
    Switch sw = (Switch)m.elaborate(null).getStatements("comb").get(0);
    Assertions.assertEquals(1, sw.getCases().size());
    Assertions.assertEquals(1, rhsValue(sw.getCases().get(0).getBody()));
    Assertions.assertTrue(m.getDiagnostics().isEmpty());
  }

  @Test
  void testOversizedPatternDropped() {
    m.Switch(sel, () -> m.Case(5, () -> m.d("comb").add(y.eq(1))));
    Fragment fragment = m.elaborate(null);
    Assertions.assertTrue(fragment.getStatements("comb").isEmpty());
    Assertions.assertEquals(1, m.getDiagnostics().getDiagnostics().size());
    Assertions.assertEquals(Diagnostic.Kind.DeadCase, m.getDiagnostics().getDiagnostics().get(0).getKind());
  }

  @Test
  void testOversizedPatternAmongOthers() {
    m.Switch(sel, () -> m.Case(List.of(4, 3), () -> m.d("comb").add(y.eq(1))));
    Switch sw = (Switch)m.elaborate(null).getStatements("comb").get(0);
    Assertions.assertEquals(List.of(Pattern.ofValue(3)), sw.getCases().get(0).getPatterns());
    Assertions.assertEquals(1, m.getDiagnostics().getDiagnostics(Diagnostic.Kind.DeadCase).size());
  }

  @Test
  void testLargestConstantPattern() {
    Signal wide = new Signal(64, "wide");
    m.Switch(wide, () -> {
      m.Case(Long.MAX_VALUE, () -> m.d("comb").add(y.eq(1)));
      m.Case(-1L, () -> m.d("comb").add(y.eq(2)));
    });
    Switch sw = (Switch)m.elaborate(null).getStatements("comb").get(0);
    Assertions.assertEquals(List.of(Pattern.ofValue(Long.MAX_VALUE)), sw.getCases().get(0).getPatterns());
    Assertions.assertEquals(1, rhsValue(sw.select(Long.MAX_VALUE).get().getBody()));
    Assertions.assertEquals(2, rhsValue(sw.select(-1L).get().getBody()));
    Assertions.assertTrue(m.getDiagnostics().isEmpty());
    Assertions.assertEquals(63, new Const(Long.MAX_VALUE).width());
    Assertions.assertEquals(Long.MAX_VALUE, ((Const)wide.eq(Long.MAX_VALUE).getRhs()).getValue());
  }

  @Test
  void testZeroPatternFitsZeroWidth() {
    Signal empty = new Signal(0, "empty");
    m.Switch(empty, () -> m.Case(0, () -> m.d("comb").add(y.eq(1))));
    Switch sw = (Switch)m.elaborate(null).getStatements("comb").get(0);
    Assertions.assertEquals(1, sw.getCases().size());
    Assertions.assertTrue(m.getDiagnostics().isEmpty());
  }

  @Test
  void testCaseAfterDefault() {
    m.Switch(sel, () -> {
      m.Default(() -> m.d("comb").add(y.eq(1)));
      m.Case("11", () -> m.d("comb").add(y.eq(2)));
      m.Default(() -> m.d("comb").add(y.eq(3)));
    });
    Switch sw = (Switch)m.elaborate(null).getStatements("comb").get(0);
    Assertions.assertEquals(2, m.getDiagnostics().getDiagnostics(Diagnostic.Kind.CaseAfterDefault).size());
    // The second Default is dropped, the late Case is kept but never selected.
    Assertions.assertEquals(2, sw.getCases().size());
    Assertions.assertEquals(1, rhsValue(sw.select(3).get().getBody()));
  }

  @ParameterizedTest
  @ValueSource(strings = {"0x", "011", "1", "ab"})
  void testMalformedPattern(String pattern) {
    Assertions.assertThrows(PatternException.class, () -> m.Switch(sel, () -> m.Case(pattern, () -> {})));
  }

  @Test
  void testWhitespaceInPattern() {
    m.Switch(sel, () -> m.Case("1 0", () -> m.d("comb").add(y.eq(1))));
    Switch sw = (Switch)m.elaborate(null).getStatements("comb").get(0);
    Assertions.assertEquals(List.of(Pattern.ofBits("10")), sw.getCases().get(0).getPatterns());
  }

  @Test
  void testNonConstantPattern() {
    PatternException e = Assertions.assertThrows(PatternException.class, () -> m.Switch(sel, () -> m.Case(y, () -> {})));
    Assertions.assertTrue(e.getCause() instanceof IllegalArgumentException);
  }

  @Test
  void testDiagnosticsAsErrors() {
    RTLGenConfig config = new RTLGenConfig();
    config.diagnostics_as_errors = true;
    Module strict = new Module(config);
    DiagnosticException e = Assertions.assertThrows(
        DiagnosticException.class, () -> strict.Switch(sel, () -> strict.Case(7, () -> strict.d("comb").add(y.eq(1)))));
    Assertions.assertEquals(Diagnostic.Kind.DeadCase, e.getDiagnostic().getKind());
    // The failed Switch leaves nothing behind.
    strict.d("comb").add(y.eq(2));
    Assertions.assertEquals(1, strict.elaborate(null).getStatements("comb").size());
  }

  @Test
  void testSwitchInsideCase() {
    Signal inner = new Signal("inner");
    Signal q = new Signal(4, "q");
    m.Switch(sel, () -> m.Case("00", () -> {
      m.Switch(inner, () -> {
        m.Case(1, () -> m.d("comb").add(y.eq(1)));
        m.Default(() -> m.d("sync").add(q.eq(2)));
      });
    }));
    StatementList comb = m.elaborate(null).getStatements("comb");
    Assertions.assertEquals(1, comb.size());
    Switch innerSw = (Switch)((Switch)comb.get(0)).getCases().get(0).getBody().get(0);
    Assertions.assertSame(inner, innerSw.getTest());
    Assertions.assertEquals(2, innerSw.getCases().size());
  }

  @Test
  void testDomainsLoweredSeparately() {
    Signal q = new Signal(4, "q");
    m.Switch(sel, () -> {
      m.Case("00", () -> m.d("comb").add(y.eq(1)));
      m.Case("01", () -> m.d("sync").add(q.eq(1)));
    });
    Fragment fragment = m.elaborate(null);
    Switch combSw = (Switch)fragment.getStatements("comb").get(0);
    Switch syncSw = (Switch)fragment.getStatements("sync").get(0);
    Assertions.assertEquals(2, combSw.getCases().size());
    Assertions.assertTrue(combSw.getCases().get(1).getBody().isEmpty());
    Assertions.assertTrue(syncSw.getCases().get(0).getBody().isEmpty());
    Assertions.assertEquals(Set.of(q), fragment.getDrivers("sync"));
  }

  @RepeatedTest(64)
  void testCaseCount_random() {
    long seed = new Random().nextLong();
    try {
      testCaseCount(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testCaseCount with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 42, 7355608, -2875234650927402873L})
  void testCaseCount(long seed) {
    Random rand = new Random(seed);
    int numCases = 1 + rand.nextInt(12);
    List<List<Integer>> submitted = new ArrayList<>();
    for (int i = 0; i < numCases; ++i) {
      List<Integer> patterns = new ArrayList<>();
      int numPatterns = 1 + rand.nextInt(2);
      for (int j = 0; j < numPatterns; ++j)
        patterns.add(rand.nextInt(7));
      submitted.add(patterns);
    }

    m.Switch(sel, () -> {
      for (List<Integer> patterns : submitted)
        m.Case(patterns, () -> m.d("comb").add(y.eq(patterns.get(0))));
    });
    Fragment fragment = m.elaborate(null);

    // Values above 3 do not fit into sel and are dropped.
    Set<List<Integer>> kept = new LinkedHashSet<>();
    int dropped = 0;
    for (List<Integer> patterns : submitted) {
      List<Integer> fitting = new ArrayList<>();
      for (int value : patterns) {
        if (value <= 3)
          fitting.add(value);
        else
          ++dropped;
      }
      if (!fitting.isEmpty())
        kept.add(fitting);
    }
    Assertions.assertEquals(dropped, m.getDiagnostics().getDiagnostics(Diagnostic.Kind.DeadCase).size());
    StatementList comb = fragment.getStatements("comb");
    int caseCount = comb.isEmpty() ? 0 : ((Switch)comb.get(0)).getCases().size();
    Assertions.assertTrue(caseCount <= kept.size());
    Assertions.assertEquals(kept.size(), caseCount);
  }
}
