package rtlgen.dsl;

import rtlgen.ast.Signal;

/**
 * A signal is assigned from a domain other than the one already driving it.
 */
public class DriverConflictException extends DslException {
  private static final long serialVersionUID = 1L;

  private final transient Signal signal;
  private final String currentDomain;
  private final String newDomain;

  public DriverConflictException(Signal signal, String currentDomain, String newDomain) {
    super(String.format("Driver-driver conflict: trying to drive %s from d.%s, but it is already driven from d.%s", signal, newDomain,
                        currentDomain));
    this.signal = signal;
    this.currentDomain = currentDomain;
    this.newDomain = newDomain;
  }

  public Signal getSignal() { return signal; }
  /** The domain that drove the signal first. */
  public String getCurrentDomain() { return currentDomain; }
  /** The domain of the rejected assignment. */
  public String getNewDomain() { return newDomain; }
}
