package rtlgen.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlgen.ast.Pattern;
import rtlgen.ast.Shape;
import rtlgen.ast.Signal;
import rtlgen.ast.SrcLoc;
import rtlgen.ast.StatementList;
import rtlgen.ast.Switch;

/**
 * A finite-state machine under construction.
 * States get provisional encodings in first-reference order; the final encoding is fixed when the frame is lowered.
 */
class FSMFrame extends ControlFrame {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String fsmName;
  private final String init;
  private final String domain;
  private final Map<String, Integer> encoding = new LinkedHashMap<>();
  private final Map<Integer, String> decoding = new LinkedHashMap<>();
  private final Map<String, Map<String, StatementList>> states = new LinkedHashMap<>();
  private final Map<String, SrcLoc> stateSrcLocs = new LinkedHashMap<>();
  private final Map<String, Signal> ongoing = new LinkedHashMap<>();
  private Signal signal = null;

  /**
   * @param fsmName the FSM name, used as prefix for generated signals
   * @param init the initial state, or null to use the first defined state
   * @param domain the domain driving the state register
   * @param srcLoc the location of the FSM call
   */
  FSMFrame(String fsmName, String init, String domain, SrcLoc srcLoc) {
    super(srcLoc);
    this.fsmName = fsmName;
    this.init = init;
    this.domain = domain;
  }

  @Override
  String getName() {
    return "FSM " + fsmName;
  }

  String getFsmName() { return fsmName; }
  String getDomain() { return domain; }
  boolean isClosed() { return signal != null; }
  boolean hasState(String state) { return states.containsKey(state); }

  /**
   * Registers a reference to a state, assigning the next free encoding if it has not been seen.
   * @param state the state name
   * @return the ongoing indicator of the state
   */
  Signal reference(String state) {
    if (state == null || state.isEmpty())
      throw new IllegalArgumentException("FSM state name must not be empty");
    Signal ongoingSig = ongoing.get(state);
    if (ongoingSig != null)
      return ongoingSig;
    if (isClosed())
      throw new DslNameException("FSM state '" + state + "' is referenced but not defined");
    encoding.put(state, encoding.size());
    ongoingSig = new Signal(fsmName + "_ongoing_" + state);
    ongoing.put(state, ongoingSig);
    return ongoingSig;
  }

  void addState(String state, Map<String, StatementList> body, SrcLoc stateSrcLoc) {
    states.put(state, body);
    stateSrcLocs.put(state, stateSrcLoc);
  }

  /** @throws DslNameException if a state was referenced but never given a body */
  void checkReferencedStatesDefined() {
    for (String state : encoding.keySet()) {
      if (!states.containsKey(state))
        throw new DslNameException("FSM state '" + state + "' is referenced but not defined");
    }
  }

  /** The state encodings; provisional until the frame is lowered. */
  Map<String, Integer> getEncoding() { return Collections.unmodifiableMap(encoding); }
  /** Inverse of {@link #getEncoding()}, only filled after the frame is lowered. */
  Map<Integer, String> getDecoding() { return Collections.unmodifiableMap(decoding); }
  /** The state register, or null before the frame is lowered. */
  Signal getSignal() { return signal; }

  @Override
  void lower(Map<String, StatementList> out, StatementList topComb) {
    if (states.isEmpty()) {
      logger.debug("FSM {} has no states", fsmName);
      signal = new Signal(Shape.unsigned(0), fsmName + "_state");
      return;
    }
    String initState = (init != null) ? init : states.keySet().iterator().next();
    if (!states.containsKey(initState))
      throw new DslNameException("FSM initial state '" + initState + "' is not defined");

    // The initial state gets encoding 0, all others keep their reference order.
    List<String> order = new ArrayList<>(encoding.keySet());
    order.remove(initState);
    order.add(0, initState);
    encoding.clear();
    for (int i = 0; i < order.size(); ++i) {
      encoding.put(order.get(i), i);
      decoding.put(i, order.get(i));
    }
    logger.debug("FSM {} encoding: {}", fsmName, encoding);

    signal = new Signal(Shape.forRange(encoding.size()), fsmName + "_state", 0, n -> decoding.get((int)n) + "/" + n);

    ongoing.forEach((state, ongoingSig) -> topComb.add(ongoingSig.eq(signal.equalTo(encoding.get(state)))));

    Set<String> domains = collectDomains(states.values());
    for (String stmtDomain : domains) {
      List<Switch.Case> cases = new ArrayList<>();
      states.forEach((state, body)
                         -> cases.add(new Switch.Case(List.of(Pattern.ofValue(encoding.get(state))), bodyFor(body, stmtDomain),
                                                      stateSrcLocs.get(state))));
      append(out, stmtDomain, new Switch(signal, cases, srcLoc));
    }
  }
}
