package rtlgen.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import rtlgen.ast.Signal;
import rtlgen.ast.Statement;
import rtlgen.ast.StatementList;

/**
 * Elaborated design unit: statements grouped by domain, the signals each domain drives, clock domains and subfragments.
 */
public class Fragment implements Elaboratable {

  /** A subfragment with an optional name. */
  public static class Subfragment {
    public final Fragment fragment;
    /** The instance name, or null for anonymous subfragments. */
    public final String name;

    public Subfragment(Fragment fragment, String name) {
      this.fragment = fragment;
      this.name = name;
    }
  }

  private final List<Subfragment> subfragments = new ArrayList<>();
  private final Map<String, StatementList> statements = new LinkedHashMap<>();
  private final Map<String, Set<Signal>> drivers = new LinkedHashMap<>();
  private final Map<String, ClockDomain> domains = new LinkedHashMap<>();
  private final Map<String, Object> generated = new LinkedHashMap<>();

  public Fragment() {}

  /**
   * Elaborates obj until a Fragment is produced.
   * @param obj the object to elaborate
   * @param platform the platform passed to each elaboration step
   * @return the resulting Fragment
   */
  public static Fragment get(Elaboratable obj, Object platform) {
    if (obj == null)
      throw new IllegalArgumentException("Cannot elaborate null");
    while (!(obj instanceof Fragment)) {
      Elaboratable next = obj.elaborate(platform);
      if (next == null)
        throw new IllegalStateException("Object " + obj + " returned null from elaborate()");
      if (next == obj)
        throw new IllegalStateException("Object " + obj + " returned itself from elaborate()");
      obj = next;
    }
    return (Fragment)obj;
  }

  @Override
  public Elaboratable elaborate(Object platform) {
    return this;
  }

  public void addSubfragment(Fragment subfragment, String name) { subfragments.add(new Subfragment(subfragment, name)); }

  public void addStatements(String domain, Collection<? extends Statement> stmts) {
    statements.computeIfAbsent(domain, d -> new StatementList()).addAll(stmts);
  }

  public void addDriver(Signal signal, String domain) { drivers.computeIfAbsent(domain, d -> new LinkedHashSet<>()).add(signal); }

  public void addDomains(Collection<ClockDomain> newDomains) {
    for (ClockDomain domain : newDomains) {
      if (domains.containsKey(domain.getName()))
        throw new IllegalArgumentException("Clock domain '" + domain.getName() + "' is already part of the fragment");
      domains.put(domain.getName(), domain);
    }
  }

  public List<Subfragment> getSubfragments() { return Collections.unmodifiableList(subfragments); }

  /** Returns the statements of a domain, or an empty list. */
  public StatementList getStatements(String domain) {
    StatementList ret = statements.get(domain);
    return ret == null ? new StatementList() : ret;
  }

  public Map<String, StatementList> getStatements() { return Collections.unmodifiableMap(statements); }

  /** Returns the signals driven by a domain, or an empty set. */
  public Set<Signal> getDrivers(String domain) { return Collections.unmodifiableSet(drivers.getOrDefault(domain, Set.of())); }

  public Map<String, ClockDomain> getDomains() { return Collections.unmodifiableMap(domains); }

  /** Named objects generated during elaboration (e.g. state machines), for introspection. */
  public Map<String, Object> getGenerated() { return generated; }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    toString(sb, "");
    return sb.toString();
  }

  private void toString(StringBuilder sb, String indent) {
    sb.append(indent).append("(fragment\n");
    for (ClockDomain domain : domains.values())
      sb.append(indent).append("  ").append(domain).append('\n');
    statements.forEach((domain, stmts) -> {
      sb.append(indent).append("  (").append(domain).append('\n');
      for (Statement stmt : stmts)
        sb.append(indent).append("    ").append(stmt).append('\n');
      sb.append(indent).append("  )\n");
    });
    for (Subfragment sub : subfragments) {
      sb.append(indent).append("  (subfragment ").append(sub.name == null ? "<anonymous>" : sub.name).append('\n');
      sub.fragment.toString(sb, indent + "    ");
      sb.append(indent).append("  )\n");
    }
    sb.append(indent).append(")\n");
  }
}
