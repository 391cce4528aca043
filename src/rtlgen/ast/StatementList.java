package rtlgen.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An ordered list of statements.
 */
public class StatementList extends ArrayList<Statement> {
  private static final long serialVersionUID = 1L;

  public StatementList() {}
  public StatementList(Collection<? extends Statement> other) { super(other); }

  /**
   * Returns the union of the signals written by all statements in the list.
   * @return an ordered set of signals
   */
  public Set<Signal> lhsSignals() {
    Set<Signal> ret = new LinkedHashSet<>();
    for (Statement stmt : this)
      ret.addAll(stmt.lhsSignals());
    return ret;
  }

  /**
   * Normalizes a statement, an array or an Iterable (possibly nested) of statements into a flat list.
   * @param obj the statement(s)
   * @return the flat statement list
   * @throws IllegalArgumentException if obj contains anything other than statements
   */
  public static StatementList cast(Object obj) {
    StatementList ret = new StatementList();
    castInto(obj, ret);
    return ret;
  }

  private static void castInto(Object obj, StatementList out) {
    if (obj instanceof Statement) {
      out.add((Statement)obj);
    } else if (obj instanceof Iterable) {
      for (Object inner : (Iterable<?>)obj)
        castInto(inner, out);
    } else if (obj instanceof Object[]) {
      for (Object inner : (Object[])obj)
        castInto(inner, out);
    } else {
      throw new IllegalArgumentException("Object " + obj + " cannot be converted to a statement");
    }
  }

  @Override
  public String toString() {
    return "(" + stream().map(Object::toString).collect(Collectors.joining(" ")) + ")";
  }
}
