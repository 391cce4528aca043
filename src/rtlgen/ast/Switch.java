package rtlgen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Multi-way branch statement. Cases are checked in order and the first matching case is taken.
 * A case with an empty pattern list is the default case and always matches.
 */
public final class Switch extends Statement {

  /** One case of a Switch. */
  public static final class Case {
    private final List<Pattern> patterns;
    private final StatementList body;
    private final SrcLoc srcLoc;

    public Case(List<Pattern> patterns, StatementList body, SrcLoc srcLoc) {
      this.patterns = List.copyOf(patterns);
      this.body = body;
      this.srcLoc = srcLoc;
    }

    public List<Pattern> getPatterns() { return patterns; }
    public StatementList getBody() { return body; }
    public SrcLoc getSrcLoc() { return srcLoc; }
    public boolean isDefault() { return patterns.isEmpty(); }

    @Override
    public String toString() {
      if (patterns.isEmpty())
        return "(default " + body + ")";
      return "(case " + patterns.stream().map(Object::toString).collect(Collectors.joining(" ")) + " " + body + ")";
    }
  }

  private final Value test;
  private final List<Case> cases;
  private final SrcLoc srcLoc;

  /**
   * @param test the value to match against
   * @param cases the cases in priority order
   * @param srcLoc the location of the construct that produced the switch
   * @throws IllegalArgumentException if a bit pattern does not match the width of test
   */
  public Switch(Value test, List<Case> cases, SrcLoc srcLoc) {
    this.test = test;
    this.cases = new ArrayList<>(cases);
    this.srcLoc = srcLoc;
    for (Case c : cases) {
      for (Pattern pattern : c.getPatterns()) {
        if (pattern.isBits() && pattern.getBits().length() != test.width())
          throw new IllegalArgumentException(String.format("Switch pattern '%s' must have the same width as the test value (which is %d)",
                                                           pattern, test.width()));
      }
    }
  }

  public Value getTest() { return test; }
  public List<Case> getCases() { return Collections.unmodifiableList(cases); }
  public SrcLoc getSrcLoc() { return srcLoc; }

  /** Returns the body of the default case, if there is one. */
  public Optional<StatementList> getDefault() {
    return cases.stream().filter(Case::isDefault).findFirst().map(Case::getBody);
  }

  /**
   * Selects the case taken for a given value of the test expression.
   * @param testValue the value of the test expression
   * @return the first matching case, or an empty Optional if no case matches
   */
  public Optional<Case> select(long testValue) {
    int width = test.width();
    return cases.stream()
        .filter(c -> c.isDefault() || c.getPatterns().stream().anyMatch(pattern -> pattern.matches(testValue, width)))
        .findFirst();
  }

  @Override
  public Set<Signal> lhsSignals() {
    Set<Signal> ret = new LinkedHashSet<>();
    for (Case c : cases)
      ret.addAll(c.getBody().lhsSignals());
    return ret;
  }

  @Override
  public String toString() {
    return "(switch " + test + " " + cases.stream().map(Object::toString).collect(Collectors.joining(" ")) + ")";
  }
}
