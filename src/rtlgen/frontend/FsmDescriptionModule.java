package rtlgen.frontend;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlgen.ast.Shape;
import rtlgen.ast.Signal;
import rtlgen.ast.Value;
import rtlgen.dsl.DiagnosticSink;
import rtlgen.dsl.FSM;
import rtlgen.dsl.Module;
import rtlgen.ir.Elaboratable;
import rtlgen.ui.RTLGenConfig;

/**
 * Builds the state machine of an {@link FsmDescription} with the procedural {@link Module} builder.
 * Transitions of a state become an If/Elif/Else chain in declaration order.
 */
public class FsmDescriptionModule implements Elaboratable {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final FsmDescription desc;
  private final RTLGenConfig config;
  private final Map<String, Signal> signals = new LinkedHashMap<>();

  private FSM fsm = null;
  private DiagnosticSink diagnostics = null;

  public FsmDescriptionModule(FsmDescription desc, RTLGenConfig config) {
    this.desc = desc;
    this.config = config;
    for (FsmDescription.SignalDesc signalDesc : desc.signals) {
      Shape shape = signalDesc.signed ? Shape.signed(signalDesc.width) : Shape.unsigned(signalDesc.width);
      if (signals.put(signalDesc.name, new Signal(shape, signalDesc.name)) != null)
        throw new IllegalArgumentException("Signal '" + signalDesc.name + "' is declared twice");
    }
  }

  /** Returns a declared signal by name. */
  public Signal getSignal(String name) {
    Signal ret = signals.get(name);
    if (ret == null)
      throw new IllegalArgumentException("Signal '" + name + "' is not declared in FSM description '" + desc.name + "'");
    return ret;
  }

  /** The built FSM, or null before elaboration. */
  public FSM getFSM() { return fsm; }

  /** The diagnostics of the builder, or null before elaboration. */
  public DiagnosticSink getDiagnostics() { return diagnostics; }

  private Value toValue(Object val) {
    if (val instanceof String)
      return getSignal((String)val);
    return Value.cast(val);
  }

  private Value toCondition(String when) {
    if (when.startsWith("!"))
      return getSignal(when.substring(1).trim()).equalTo(0);
    return getSignal(when);
  }

  private void buildTransitions(Module m, String stateName, List<FsmDescription.TransitionDesc> transitions) {
    boolean inChain = false;
    for (int i = 0; i < transitions.size(); ++i) {
      FsmDescription.TransitionDesc transition = transitions.get(i);
      String target = transition.to;
      if (transition.when == null) {
        if (i != transitions.size() - 1)
          throw new IllegalArgumentException("Unconditional transition of state '" + stateName + "' must be the last one");
        if (inChain)
          m.Else(() -> m.next(target));
        else
          m.next(target);
      } else if (!inChain) {
        m.If(toCondition(transition.when), () -> m.next(target));
        inChain = true;
      } else {
        m.Elif(toCondition(transition.when), () -> m.next(target));
      }
    }
  }

  @Override
  public Elaboratable elaborate(Object platform) {
    Module m = new Module(config);
    logger.debug("Building FSM '{}' with {} state(s)", desc.name, desc.states.size());
    fsm = m.FSM(desc.init, desc.domain, desc.name, handle -> {
      for (FsmDescription.StateDesc state : desc.states) {
        m.State(state.name, () -> {
          state.assignments.forEach(
              (domain, assigns) -> assigns.forEach((sigName, val) -> m.d(domain).add(getSignal(sigName).eq(toValue(val)))));
          buildTransitions(m, state.name, state.transitions);
        });
      }
    });
    diagnostics = m.getDiagnostics();
    return m;
  }
}
