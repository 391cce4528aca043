package rtlgen.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import rtlgen.ir.Elaboratable;

/**
 * The named and anonymous submodules of a {@link Module}.
 */
public class SubmoduleSet {
  private final Map<String, Elaboratable> named = new LinkedHashMap<>();
  private final List<Elaboratable> anonymous = new ArrayList<>();

  SubmoduleSet() {}

  /**
   * Adds anonymous submodules.
   * @param submodules the submodules
   */
  public void add(Elaboratable... submodules) {
    for (Elaboratable submodule : submodules) {
      if (submodule == null)
        throw new IllegalArgumentException("Trying to add null as a submodule");
    }
    Collections.addAll(anonymous, submodules);
  }

  /**
   * Adds a named submodule.
   * @param name the instance name
   * @param submodule the submodule
   * @throws DslNameException if a submodule with the name already exists
   */
  public void put(String name, Elaboratable submodule) {
    if (submodule == null)
      throw new IllegalArgumentException("Trying to add null as submodule '" + name + "'");
    if (named.containsKey(name))
      throw new DslNameException("Submodule named '" + name + "' already exists");
    named.put(name, submodule);
  }

  /**
   * Looks up a named submodule.
   * @param name the instance name
   * @return the submodule
   * @throws DslNameException if there is no submodule with that name
   */
  public Elaboratable get(String name) {
    Elaboratable ret = named.get(name);
    if (ret == null)
      throw new DslNameException("No submodule named '" + name + "' exists");
    return ret;
  }

  public Map<String, Elaboratable> getNamed() { return Collections.unmodifiableMap(named); }
  public List<Elaboratable> getAnonymous() { return Collections.unmodifiableList(anonymous); }
}
