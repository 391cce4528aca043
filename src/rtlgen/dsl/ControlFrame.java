package rtlgen.dsl;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import rtlgen.ast.SrcLoc;
import rtlgen.ast.Statement;
import rtlgen.ast.StatementList;

/**
 * An open control construct (If chain, Switch or FSM) on the {@link ControlStack}.
 */
abstract class ControlFrame {
  protected final SrcLoc srcLoc;

  protected ControlFrame(SrcLoc srcLoc) { this.srcLoc = srcLoc; }

  /** Name of the construct, for messages. */
  abstract String getName();

  /**
   * Lowers the construct into branch statements.
   * @param out the per-domain accumulator of the enclosing scope to append the lowered statements to
   * @param topComb the module-level combinational statements, for logic that is always combinational
   */
  abstract void lower(Map<String, StatementList> out, StatementList topComb);

  /** Collects the domains used by any of the bodies, in first-use order. */
  static Set<String> collectDomains(Collection<Map<String, StatementList>> bodies) {
    Set<String> domains = new LinkedHashSet<>();
    for (Map<String, StatementList> body : bodies)
      domains.addAll(body.keySet());
    return domains;
  }

  static StatementList bodyFor(Map<String, StatementList> body, String domain) {
    StatementList stmts = body.get(domain);
    return stmts == null ? new StatementList() : stmts;
  }

  static void append(Map<String, StatementList> out, String domain, Statement stmt) {
    out.computeIfAbsent(domain, d -> new StatementList()).add(stmt);
  }

  @Override
  public String toString() {
    return getName() + "@" + srcLoc;
  }
}
