package rtlgen.dsl;

/**
 * Adds statements to one domain of a {@link Module}, at the current position of the builder.
 */
public class ModuleDomain {
  private final Module module;
  private final String name;

  ModuleDomain(Module module, String name) {
    this.module = module;
    this.name = name;
  }

  public String getName() { return name; }

  /**
   * Adds statements to the domain.
   * @param stmts statements, or (nested) arrays and Iterables of statements
   * @return this
   */
  public ModuleDomain add(Object... stmts) {
    module.addStatement(stmts, name);
    return this;
  }
}
