package rtlgen.dsl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlgen.ast.Pattern;
import rtlgen.ast.SrcLoc;
import rtlgen.ast.StatementList;
import rtlgen.ast.Switch;
import rtlgen.ast.Value;

/**
 * A Switch with its registered cases. An empty pattern list denotes the Default case.
 */
class SwitchFrame extends ControlFrame {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Value test;
  private final Map<List<Pattern>, Map<String, StatementList>> cases = new LinkedHashMap<>();
  private final Map<List<Pattern>, SrcLoc> caseSrcLocs = new LinkedHashMap<>();

  SwitchFrame(Value test, SrcLoc srcLoc) {
    super(srcLoc);
    this.test = test;
  }

  @Override
  String getName() {
    return "Switch";
  }

  Value getTest() { return test; }

  boolean hasDefault() { return cases.containsKey(List.of()); }

  /**
   * Registers a case body. The first registration of a pattern list wins; later ones are dropped.
   * @param patterns the patterns, or an empty list for the Default case
   * @param body the statements of the case
   * @param caseSrcLoc the location of the Case/Default call
   * @return true iff the case was registered
   */
  boolean addCase(List<Pattern> patterns, Map<String, StatementList> body, SrcLoc caseSrcLoc) {
    List<Pattern> key = List.copyOf(patterns);
    if (cases.containsKey(key)) {
      logger.debug("Dropping duplicate case {} at {}", key, caseSrcLoc);
      return false;
    }
    cases.put(key, body);
    caseSrcLocs.put(key, caseSrcLoc);
    return true;
  }

  int getCaseCount() { return cases.size(); }

  @Override
  void lower(Map<String, StatementList> out, StatementList topComb) {
    Set<String> domains = collectDomains(cases.values());
    logger.debug("Lowering Switch at {} with {} case(s) into {} domain(s)", srcLoc, cases.size(), domains.size());
    for (String domain : domains) {
      List<Switch.Case> domainCases = new ArrayList<>();
      cases.forEach((patterns, body) -> domainCases.add(new Switch.Case(patterns, bodyFor(body, domain), caseSrcLocs.get(patterns))));
      append(out, domain, new Switch(test, domainCases, srcLoc));
    }
  }
}
