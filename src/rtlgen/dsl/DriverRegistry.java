package rtlgen.dsl;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import rtlgen.ast.Assign;
import rtlgen.ast.Signal;
import rtlgen.ast.Statement;

/**
 * Tracks which domain drives each signal. A signal may only be driven from a single domain.
 */
public class DriverRegistry {
  private final Map<Signal, String> driving = new LinkedHashMap<>();

  /**
   * Checks that all signals written by an assignment are either undriven or driven by the given domain.
   * Statements other than {@link Assign} are ignored.
   * @param stmt the statement
   * @param domain the domain the statement is added to
   * @throws DriverConflictException if a written signal is already driven from another domain
   */
  public void check(Statement stmt, String domain) {
    if (!(stmt instanceof Assign))
      return;
    for (Signal signal : stmt.lhsSignals()) {
      String current = driving.get(signal);
      if (current != null && !current.equals(domain))
        throw new DriverConflictException(signal, current, domain);
    }
  }

  /**
   * Records the domain as the driver of all signals written by an assignment.
   * @param stmt the statement
   * @param domain the domain the statement is added to
   * @throws DriverConflictException if a written signal is already driven from another domain
   */
  public void claim(Statement stmt, String domain) {
    check(stmt, domain);
    if (stmt instanceof Assign) {
      for (Signal signal : stmt.lhsSignals())
        driving.putIfAbsent(signal, domain);
    }
  }

  /** Returns a mark for {@link #rollback(int)}. Claims are only ever appended. */
  public int mark() { return driving.size(); }

  /**
   * Forgets all signals first claimed after the mark was taken.
   * @param mark a value returned by {@link #mark()}
   */
  public void rollback(int mark) {
    Iterator<Signal> iter = driving.keySet().iterator();
    for (int i = 0; iter.hasNext(); ++i) {
      iter.next();
      if (i >= mark)
        iter.remove();
    }
  }

  /** Returns the domain driving a signal, if any. */
  public Optional<String> getDomain(Signal signal) { return Optional.ofNullable(driving.get(signal)); }

  public Map<Signal, String> getDrivers() { return Collections.unmodifiableMap(driving); }
}
