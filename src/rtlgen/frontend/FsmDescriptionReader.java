package rtlgen.frontend;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;

/**
 * Parses a YAML state machine description:
 * <pre>
 * name: handshake
 * domain: sync
 * init: IDLE
 * signals:
 *   - {name: start, width: 1}
 * states:
 *   IDLE:
 *     comb: {busy: 0}
 *     next: [{when: start, to: RUN}]
 * </pre>
 * Every key of a state other than "next" names a domain.
 */
public class FsmDescriptionReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public FsmDescription read(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return parse(new Yaml().load(in));
    }
  }

  public FsmDescription read(Reader reader) { return parse(new Yaml().load(reader)); }

  public FsmDescription read(String yaml) { return parse(new Yaml().load(yaml)); }

  private static Map<?, ?> asMap(Object obj, String key) {
    if (!(obj instanceof Map))
      throw new IllegalArgumentException("Expected a mapping for '" + key + "', got " + obj);
    return (Map<?, ?>)obj;
  }

  private static List<?> asList(Object obj, String key) {
    if (!(obj instanceof List))
      throw new IllegalArgumentException("Expected a list for '" + key + "', got " + obj);
    return (List<?>)obj;
  }

  private static String asString(Object obj, String key) {
    if (obj == null)
      throw new IllegalArgumentException("Missing value for '" + key + "'");
    return obj.toString();
  }

  FsmDescription parse(Object root) {
    Map<?, ?> rootMap = asMap(root, "<root>");
    FsmDescription desc = new FsmDescription();
    for (Map.Entry<?, ?> entry : rootMap.entrySet()) {
      String setting = entry.getKey().toString();
      Object value = entry.getValue();
      switch (setting) {
      case "name":
        desc.name = asString(value, setting);
        break;
      case "domain":
        desc.domain = asString(value, setting);
        break;
      case "init":
        desc.init = asString(value, setting);
        break;
      case "signals":
        for (Object signalObj : asList(value, setting))
          desc.signals.add(parseSignal(asMap(signalObj, "signals")));
        break;
      case "states":
        asMap(value, setting).forEach((stateName, stateObj) -> desc.states.add(parseState(stateName.toString(), stateObj)));
        break;
      default:
        logger.warn("Ignoring unknown key '{}' in FSM description", setting);
      }
    }
    if (desc.states.isEmpty())
      logger.warn("FSM description '{}' has no states", desc.name);
    return desc;
  }

  private static FsmDescription.SignalDesc parseSignal(Map<?, ?> signalMap) {
    String name = asString(signalMap.get("name"), "signals.name");
    Object width = signalMap.get("width");
    if (width != null && !(width instanceof Integer))
      throw new IllegalArgumentException("Expected an integer for 'signals.width' of " + name + ", got " + width);
    Object signed = signalMap.get("signed");
    return new FsmDescription.SignalDesc(name, width == null ? 1 : (Integer)width, Boolean.TRUE.equals(signed));
  }

  private static FsmDescription.StateDesc parseState(String name, Object stateObj) {
    FsmDescription.StateDesc state = new FsmDescription.StateDesc(name);
    if (stateObj == null)
      return state;
    String key = "states." + name;
    for (Map.Entry<?, ?> entry : asMap(stateObj, key).entrySet()) {
      String setting = entry.getKey().toString();
      if (setting.equals("next")) {
        for (Object transitionObj : asList(entry.getValue(), key + ".next")) {
          Map<?, ?> transitionMap = asMap(transitionObj, key + ".next");
          Object when = transitionMap.get("when");
          state.transitions.add(
              new FsmDescription.TransitionDesc(when == null ? null : when.toString(), asString(transitionMap.get("to"), key + ".next.to")));
        }
        continue;
      }
      Map<String, Object> domainAssigns = state.assignments.computeIfAbsent(setting, d -> new LinkedHashMap<>());
      asMap(entry.getValue(), key + "." + setting).forEach((sig, val) -> {
        if (!(val instanceof Integer || val instanceof String))
          throw new IllegalArgumentException("Expected an integer or a signal name for '" + key + "." + setting + "." + sig + "', got " + val);
        domainAssigns.put(sig.toString(), val);
      });
    }
    return state;
  }
}
