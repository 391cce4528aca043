package rtlgen.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlgen.ast.Cat;
import rtlgen.ast.Pattern;
import rtlgen.ast.SrcLoc;
import rtlgen.ast.StatementList;
import rtlgen.ast.Switch;
import rtlgen.ast.Value;

/**
 * An If/Elif/Else chain. Lowered into one priority-encoded Switch per domain.
 */
class IfFrame extends ControlFrame {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final int depth;
  private final List<Value> tests = new ArrayList<>();
  private final List<Map<String, StatementList>> bodies = new ArrayList<>();
  private final List<SrcLoc> srcLocs = new ArrayList<>();

  IfFrame(int depth, SrcLoc srcLoc) {
    super(srcLoc);
    this.depth = depth;
  }

  @Override
  String getName() {
    return "If";
  }

  /** The builder depth the chain was opened at. Elif and Else only attach at the same depth. */
  int getDepth() { return depth; }

  /**
   * Adds a branch.
   * @param test the condition, or null for the Else branch
   * @param body the statements of the branch
   * @param branchSrcLoc the location of the If/Elif/Else call
   */
  void addBranch(Value test, Map<String, StatementList> body, SrcLoc branchSrcLoc) {
    if (test != null)
      tests.add(test);
    bodies.add(body);
    srcLocs.add(branchSrcLoc);
  }

  /**
   * Builds the priority pattern of branch i out of n conditions: bit i set, all other bits don't care.
   * @param i the branch index
   * @param n the number of conditions
   * @return the bit pattern, MSB first
   */
  static String priorityPattern(int i, int n) {
    StringBuilder sb = new StringBuilder(n);
    for (int bit = n - 1; bit >= 0; --bit)
      sb.append(bit == i ? '1' : '-');
    return sb.toString();
  }

  @Override
  void lower(Map<String, StatementList> out, StatementList topComb) {
    Set<String> domains = collectDomains(bodies);
    List<Value> boolTests = new ArrayList<>();
    for (Value test : tests)
      boolTests.add(test.width() == 1 ? test : test.bool());
    logger.debug("Lowering If chain at {} with {} condition(s) into {} domain(s)", srcLoc, tests.size(), domains.size());

    for (String domain : domains) {
      List<Switch.Case> cases = new ArrayList<>();
      for (int i = 0; i < bodies.size(); ++i) {
        List<Pattern> patterns =
            i < boolTests.size() ? List.of(Pattern.ofBits(priorityPattern(i, boolTests.size()))) : List.of();
        cases.add(new Switch.Case(patterns, bodyFor(bodies.get(i), domain), srcLocs.get(i)));
      }
      append(out, domain, new Switch(new Cat(boolTests), cases, srcLoc));
    }
  }
}
