package rtlgen.ast;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A formal property check (assertion, assumption or cover point).
 */
public final class Property extends Statement {
  public enum Kind { Assert, Assume, Cover }

  private final Kind kind;
  private final Value test;
  private final String name;

  public Property(Kind kind, Value test) { this(kind, test, null); }

  /**
   * @param kind the kind of check
   * @param test the checked condition, reduced to a boolean if wider than one bit
   * @param name an optional name, or null
   */
  public Property(Kind kind, Value test, String name) {
    this.kind = kind;
    this.test = test.width() == 1 ? test : test.bool();
    this.name = name;
  }

  public static Property Assert(Object test) { return new Property(Kind.Assert, Value.cast(test)); }
  public static Property Assume(Object test) { return new Property(Kind.Assume, Value.cast(test)); }
  public static Property Cover(Object test) { return new Property(Kind.Cover, Value.cast(test)); }

  public Kind getKind() { return kind; }
  public Value getTest() { return test; }
  public String getName() { return name; }

  @Override
  public Set<Signal> lhsSignals() {
    return new LinkedHashSet<>();
  }

  @Override
  public String toString() {
    return "(" + kind.name().toLowerCase() + (name != null ? " " + name : "") + " " + test + ")";
  }
}
