package rtlgen.dsl;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import rtlgen.ir.ClockDomain;

/**
 * The clock domains declared by a {@link Module}.
 */
public class DomainSet {
  private final Map<String, ClockDomain> domains = new LinkedHashMap<>();

  DomainSet() {}

  /**
   * Declares clock domains.
   * @param newDomains the domains
   * @throws DslNameException if a domain with the same name is already declared
   */
  public void add(ClockDomain... newDomains) {
    for (ClockDomain domain : newDomains) {
      if (domain == null)
        throw new IllegalArgumentException("Only clock domains may be added to the domain set, not null");
      if (domains.containsKey(domain.getName()))
        throw new DslNameException("Clock domain named '" + domain.getName() + "' already exists");
      domains.put(domain.getName(), domain);
    }
  }

  /**
   * Declares a clock domain under an explicit name, which has to match the domain's own name.
   * @param name the expected name
   * @param domain the domain
   */
  public void put(String name, ClockDomain domain) {
    if (domain != null && !domain.getName().equals(name))
      throw new DslNameException(
          String.format("Clock domain name '%s' must match name in `domains().put(\"%s\", ...)`", domain.getName(), name));
    add(domain);
  }

  public Optional<ClockDomain> get(String name) { return Optional.ofNullable(domains.get(name)); }

  public Collection<ClockDomain> values() { return Collections.unmodifiableCollection(domains.values()); }
}
