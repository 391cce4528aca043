package rtlgen.dsl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlgen.ast.Assign;
import rtlgen.ast.Const;
import rtlgen.ast.LateBoundStatement;
import rtlgen.ast.Pattern;
import rtlgen.ast.Property;
import rtlgen.ast.Signal;
import rtlgen.ast.SrcLoc;
import rtlgen.ast.Statement;
import rtlgen.ast.StatementList;
import rtlgen.ast.Value;
import rtlgen.ir.Elaboratable;
import rtlgen.ir.Fragment;
import rtlgen.ui.RTLGenConfig;
import rtlgen.util.Bits;

/**
 * Procedural builder for a hardware module.
 *
 * Statements are added to named domains through {@link #d(String)}. Control constructs take their body as a lambda:
 * <pre>
 * m.If(a, () -&gt; m.d("comb").add(y.eq(1)));
 * m.Else(() -&gt; m.d("comb").add(y.eq(0)));
 * </pre>
 * On {@link #elaborate(Object)}, the recorded constructs are lowered into {@link rtlgen.ast.Switch} statements per domain.
 * A Module is built by a single thread and elaborated once.
 */
public final class Module implements Elaboratable {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String COMB = "comb";
  public static final String SYNC = "sync";

  private static final String CTX_SWITCH = "Switch";
  private static final String CTX_FSM = "FSM";

  static {
    SrcLoc.addSkippedClass(Module.class);
    SrcLoc.addSkippedClass(ModuleDomain.class);
  }

  private final RTLGenConfig config;
  private final DiagnosticSink diagnostics;
  private final DriverRegistry driving = new DriverRegistry();
  private final ControlStack ctrlStack = new ControlStack();
  private final SubmoduleSet submodules = new SubmoduleSet();
  private final DomainSet domains = new DomainSet();
  private final Map<String, Object> generated = new LinkedHashMap<>();
  private final StatementList topCombStatements = new StatementList();
  private final SrcLoc srcLoc;

  /** Accumulator of the scope currently being recorded. */
  private Map<String, StatementList> statements = new LinkedHashMap<>();
  /** "Switch" or "FSM" while directly inside such a construct, null otherwise. */
  private String ctrlContext = null;
  private int depth = 0;
  private boolean elaborated = false;

  public Module() { this(new RTLGenConfig()); }

  public Module(RTLGenConfig config) {
    this.config = Objects.requireNonNull(config);
    this.diagnostics = new DiagnosticSink(config.diagnostics_as_errors);
    this.srcLoc = SrcLoc.capture();
  }

  /**
   * Guard for a statement scope. Restores the enclosing accumulator, depth and control context on close,
   * including when the body throws. A scope that is closed without {@link #complete()} also drops the constructs
   * opened and the drivers claimed inside it, so a failed body leaves the enclosing scope as it was.
   */
  private final class Scope implements AutoCloseable {
    private final Map<String, StatementList> outerStatements;
    private final String outerContext;
    private final int depthDelta;
    private final int stackMark;
    private final int driverMark;
    private boolean completed = false;

    /**
     * @param depthDelta the depth increment for the scope
     * @param innerContext the control context inside the scope
     * @param isolate true to record into a fresh accumulator
     */
    Scope(int depthDelta, String innerContext, boolean isolate) {
      this.outerStatements = statements;
      this.outerContext = ctrlContext;
      this.depthDelta = depthDelta;
      this.stackMark = ctrlStack.size();
      this.driverMark = driving.mark();
      if (isolate)
        statements = new LinkedHashMap<>();
      ctrlContext = innerContext;
      depth += depthDelta;
    }

    /** The statements recorded in this scope so far. */
    Map<String, StatementList> captured() { return statements; }

    /** Marks the body as finished; the scope's effects are kept. */
    void complete() { completed = true; }

    @Override
    public void close() {
      if (!completed) {
        ctrlStack.truncate(stackMark);
        driving.rollback(driverMark);
      }
      depth -= depthDelta;
      ctrlContext = outerContext;
      statements = outerStatements;
    }
  }

  //////////   registries   //////////

  /**
   * Returns the accessor for adding statements to a domain.
   * @param domain the domain name, e.g. {@link #COMB} or {@link #SYNC}
   * @return the domain accessor
   */
  public ModuleDomain d(String domain) {
    if (domain == null || domain.isEmpty())
      throw new IllegalArgumentException("Domain name must not be empty");
    if (domain.equals("submodules") || domain.equals("domains")) {
      report(Diagnostic.Kind.SuspiciousDomainName,
             String.format("Using d(\"%s\") would add statements to clock domain '%s'; did you mean %s() instead?", domain, domain, domain),
             SrcLoc.capture());
    }
    return new ModuleDomain(this, domain);
  }

  public SubmoduleSet submodules() { return submodules; }

  public DomainSet domains() { return domains; }

  public DiagnosticSink getDiagnostics() { return diagnostics; }

  /** Returns the domain that drives a signal in this module so far. */
  public Optional<String> getDriver(Signal signal) { return driving.getDomain(signal); }

  //////////   control stack handling   //////////

  private void checkContext(String construct, String context) {
    if (!Objects.equals(ctrlContext, context)) {
      if (ctrlContext == null)
        throw new ScopeException(construct + " is not permitted outside of " + context);
      String secondaryContext = ctrlContext.equals(CTX_SWITCH) ? "Case" : "State";
      throw new ScopeException(String.format("%s is not permitted directly inside of %s; it is permitted inside of %s %s", construct,
                                             ctrlContext, ctrlContext, secondaryContext));
    }
  }

  private void flushCtrl() { ctrlStack.closeTo(depth, statements, topCombStatements); }

  private <T extends ControlFrame> T setCtrl(T frame) {
    flushCtrl();
    ctrlStack.open(frame);
    return frame;
  }

  private void popCtrl() { ctrlStack.closeTop(statements, topCombStatements); }

  private void report(Diagnostic.Kind kind, String message, SrcLoc location) {
    diagnostics.report(new Diagnostic(kind, message, location));
  }

  private Value checkSignedCond(Object cond, SrcLoc location) {
    Value value = Value.cast(cond);
    if (value.shape().isSigned() && config.warn_signed_conditions) {
      report(Diagnostic.Kind.SignedCondition,
             "Signed values in If/Elif conditions usually result from inverting a boolean with not(), which leads to unexpected "
                 + "results. Compare against zero instead. (If this is intended, use `cond.bool()` to silence this diagnostic.)",
             location);
    }
    return value;
  }

  //////////   If / Elif / Else   //////////

  /**
   * Starts a conditional chain. The chain stays open for Elif/Else until a sibling construct or statement follows.
   * @param cond the condition; multi-bit values are true if any bit is set
   * @param body records the statements of the branch
   */
  public void If(Object cond, Runnable body) {
    checkContext("If", null);
    SrcLoc location = SrcLoc.capture();
    Value test = checkSignedCond(cond, location);
    IfFrame frame = setCtrl(new IfFrame(depth, location));
    try {
      captureBranch(frame, test, body, location);
    } catch (RuntimeException | Error e) {
      ctrlStack.discard(frame);
      throw e;
    }
  }

  /**
   * Adds a branch to the preceding If at the same depth.
   * @param cond the condition
   * @param body records the statements of the branch
   * @throws ScopeException if there is no preceding If
   */
  public void Elif(Object cond, Runnable body) {
    checkContext("Elif", null);
    SrcLoc location = SrcLoc.capture();
    Value test = checkSignedCond(cond, location);
    IfFrame frame = ctrlStack.top(IfFrame.class);
    if (frame == null || frame.getDepth() != depth)
      throw new ScopeException("Elif without preceding If");
    captureBranch(frame, test, body, location);
  }

  /**
   * Adds the final branch to the preceding If at the same depth and closes the chain.
   * @param body records the statements of the branch
   * @throws ScopeException if there is no preceding If/Elif
   */
  public void Else(Runnable body) {
    checkContext("Else", null);
    SrcLoc location = SrcLoc.capture();
    IfFrame frame = ctrlStack.top(IfFrame.class);
    if (frame == null || frame.getDepth() != depth)
      throw new ScopeException("Else without preceding If/Elif");
    captureBranch(frame, null, body, location);
    popCtrl();
  }

  private void captureBranch(IfFrame frame, Value test, Runnable body, SrcLoc location) {
    try (Scope scope = new Scope(1, null, true)) {
      body.run();
      flushCtrl();
      frame.addBranch(test, scope.captured(), location);
      scope.complete();
    }
  }

  //////////   Switch / Case / Default   //////////

  /**
   * Starts a multi-way branch on a value. The body may only contain Case and Default.
   * @param test the value to match
   * @param body declares the cases
   */
  public void Switch(Object test, Runnable body) {
    checkContext("Switch", null);
    SrcLoc location = SrcLoc.capture();
    SwitchFrame frame = setCtrl(new SwitchFrame(Value.cast(test), location));
    try (Scope scope = new Scope(1, CTX_SWITCH, false)) {
      body.run();
      scope.complete();
    } catch (RuntimeException | Error e) {
      ctrlStack.discard(frame);
      throw e;
    }
    popCtrl();
  }

  /** @see #Case(List, Runnable) */
  public void Case(Object pattern, Runnable body) { Case(List.of(pattern), body); }

  /**
   * Adds a case to the enclosing Switch, taken if any of the patterns matches.
   * Patterns are bit strings of 0, 1 and - (don't care) with the width of the switch value, or constant-castable values.
   * Constants too wide to ever match are dropped; a case without patterns is never taken and is dropped.
   * If a case with the same patterns already exists, the new one is dropped.
   * @param patterns the patterns
   * @param body records the statements of the case
   * @throws PatternException if a pattern is malformed
   */
  public void Case(List<?> patterns, Runnable body) {
    checkContext("Case", CTX_SWITCH);
    SrcLoc location = SrcLoc.capture();
    SwitchFrame frame = ctrlStack.top(SwitchFrame.class);
    if (frame == null)
      throw new ScopeException("Case is not permitted outside of Switch");
    if (frame.hasDefault())
      report(Diagnostic.Kind.CaseAfterDefault, "A case defined after the default case will never be active", location);
    List<Pattern> newPatterns = castPatterns(patterns, frame.getTest(), location);
    try (Scope scope = new Scope(0, null, true)) {
      body.run();
      flushCtrl();
      if (!newPatterns.isEmpty())
        frame.addCase(newPatterns, scope.captured(), location);
      scope.complete();
    }
  }

  /**
   * Adds the default case to the enclosing Switch. Only the first Default is kept.
   * @param body records the statements of the case
   */
  public void Default(Runnable body) {
    checkContext("Default", CTX_SWITCH);
    SrcLoc location = SrcLoc.capture();
    SwitchFrame frame = ctrlStack.top(SwitchFrame.class);
    if (frame == null)
      throw new ScopeException("Default is not permitted outside of Switch");
    if (frame.hasDefault())
      report(Diagnostic.Kind.CaseAfterDefault, "A case defined after the default case will never be active", location);
    try (Scope scope = new Scope(0, null, true)) {
      body.run();
      flushCtrl();
      if (!frame.hasDefault())
        frame.addCase(List.of(), scope.captured(), location);
      scope.complete();
    }
  }

  private List<Pattern> castPatterns(List<?> patterns, Value test, SrcLoc location) {
    int width = test.width();
    List<Pattern> ret = new ArrayList<>();
    for (Object pattern : patterns) {
      if (pattern instanceof String) {
        String str = (String)pattern;
        if (str.chars().anyMatch(c -> "01- \t".indexOf(c) < 0))
          throw new PatternException("Case pattern '" + str + "' must consist of 0, 1, and - (don't care) bits, and may include whitespace");
        Pattern bits = Pattern.ofBits(str);
        if (bits.getBits().length() != width)
          throw new PatternException("Case pattern '" + str + "' must have the same width as switch value (which is " + width + ")");
        ret.add(bits);
        continue;
      }
      Const value;
      try {
        value = Const.cast(pattern);
      } catch (IllegalArgumentException e) {
        throw new PatternException("Case pattern must be a string or a constant-castable expression, not " + pattern, e);
      }
      int patternLen = value.getValue() == 0 ? 0 : Bits.bitsFor(value.getValue());
      if (patternLen > width) {
        report(Diagnostic.Kind.DeadCase,
               String.format("Case pattern '%s' (%d'%s) is wider than switch value (which has width %d); comparison will never be true",
                             pattern, patternLen, Bits.toBinaryString(value.getValue(), patternLen), width),
               location);
        continue;
      }
      ret.add(Pattern.ofValue(value.getValue()));
    }
    return ret;
  }

  //////////   FSM / State / next   //////////

  /** Starts an FSM with the configured default domain and name; the first defined state is the initial state. */
  public FSM FSM(Consumer<FSM> body) { return FSM(null, config.default_fsm_domain, config.default_fsm_name, body); }

  /** Starts an FSM with the configured default domain and name. */
  public FSM FSM(String init, Consumer<FSM> body) { return FSM(init, config.default_fsm_domain, config.default_fsm_name, body); }

  /**
   * Starts a finite-state machine. The body may only contain State.
   * States are created by the first reference through State, {@link #next(String)} or {@link FSM#ongoing(String)};
   * the initial state always has encoding 0.
   * @param init the initial state, or null for the first defined state
   * @param domain the domain driving the state register; must not be "comb"
   * @param name the FSM name, used as prefix of the generated signals
   * @param body declares the states
   * @return the FSM handle
   * @throws DslNameException if a referenced state is not defined
   */
  public FSM FSM(String init, String domain, String name, Consumer<FSM> body) {
    checkContext("FSM", null);
    if (COMB.equals(domain))
      throw new IllegalArgumentException("FSM may not be driven by the '" + domain + "' domain");
    SrcLoc location = SrcLoc.capture();
    FSMFrame frame = setCtrl(new FSMFrame(name, init, domain, location));
    FSM fsm = new FSM(frame);
    generated.put(name, fsm);
    try (Scope scope = new Scope(1, CTX_FSM, false)) {
      body.accept(fsm);
      frame.checkReferencedStatesDefined();
      scope.complete();
    } catch (RuntimeException | Error e) {
      ctrlStack.discard(frame);
      generated.remove(name, fsm);
      throw e;
    }
    try {
      popCtrl();
    } catch (DslNameException e) {
      generated.remove(name, fsm);
      throw e;
    }
    return fsm;
  }

  /**
   * Defines the body of an FSM state.
   * @param name the state name
   * @param body records the statements active in this state
   * @throws DslNameException if the state is already defined
   */
  public void State(String name, Runnable body) {
    checkContext("FSM State", CTX_FSM);
    SrcLoc location = SrcLoc.capture();
    FSMFrame frame = ctrlStack.top(FSMFrame.class);
    if (frame == null)
      throw new ScopeException("FSM State is not permitted outside of FSM");
    if (frame.hasState(name))
      throw new DslNameException("FSM state '" + name + "' is already defined");
    frame.reference(name);
    try (Scope scope = new Scope(0, null, true)) {
      body.run();
      flushCtrl();
      frame.addState(name, scope.captured(), location);
      scope.complete();
    }
  }

  /**
   * Transitions the innermost FSM to a state. The state may be defined later.
   * @param state the target state
   * @throws ScopeException if not inside an FSM state
   */
  public void next(String state) {
    if (ctrlContext == null) {
      FSMFrame frame = ctrlStack.innermost(FSMFrame.class);
      if (frame != null) {
        frame.reference(state);
        addStatement(new FSMNextStatement(frame, state), frame.getDomain());
        return;
      }
    }
    throw new ScopeException("`next(...)` is only permitted inside an FSM state");
  }

  //////////   statements   //////////

  void addStatement(Object stmts, String domain) {
    if (ctrlContext != null) {
      String secondaryContext = ctrlContext.equals(CTX_SWITCH) ? "Case" : "State";
      throw new ScopeException(String.format("Statements are not permitted directly inside of %s; they are permitted inside of %s %s",
                                             ctrlContext, ctrlContext, secondaryContext));
    }
    flushCtrl();

    StatementList newStatements = StatementList.cast(stmts);
    for (Statement stmt : newStatements) {
      if (!(stmt instanceof Assign || stmt instanceof Property || stmt instanceof LateBoundStatement))
        throw new ScopeException("Only assignments and property checks may be appended to d." + domain);
      driving.check(stmt, domain);
    }
    for (Statement stmt : newStatements) {
      driving.claim(stmt, domain);
      statements.computeIfAbsent(domain, d -> new StatementList()).add(stmt);
    }
  }

  //////////   elaboration   //////////

  private void flush() {
    while (!ctrlStack.isEmpty())
      popCtrl();
  }

  /**
   * Closes all open constructs and produces the fragment. May only be called once.
   * @param platform passed on to the elaboration of submodules
   * @return the fragment
   */
  @Override
  public Fragment elaborate(Object platform) {
    if (elaborated)
      throw new IllegalStateException("Module created at " + srcLoc + " has already been elaborated");
    elaborated = true;
    flush();

    Fragment fragment = new Fragment();
    statements.forEach((domain, stmts) -> {
      StatementList resolved = StatementResolver.resolveAll(stmts);
      fragment.addStatements(domain, resolved);
      for (Signal signal : resolved.lhsSignals())
        fragment.addDriver(signal, domain);
    });
    if (!topCombStatements.isEmpty()) {
      fragment.addStatements(COMB, topCombStatements);
      for (Signal signal : topCombStatements.lhsSignals())
        fragment.addDriver(signal, COMB);
    }
    submodules.getNamed().forEach((name, submodule) -> fragment.addSubfragment(Fragment.get(submodule, platform), name));
    for (Elaboratable submodule : submodules.getAnonymous())
      fragment.addSubfragment(Fragment.get(submodule, platform), null);
    fragment.addDomains(domains.values());
    fragment.getGenerated().putAll(generated);

    logger.debug("Elaborated module from {}: {} domain(s), {} subfragment(s)", srcLoc, fragment.getStatements().size(),
                 fragment.getSubfragments().size());
    return fragment;
  }

  @Override
  public String toString() {
    return "Module@" + srcLoc;
  }
}
