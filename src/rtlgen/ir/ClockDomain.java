package rtlgen.ir;

import java.util.Optional;
import rtlgen.ast.Signal;

/**
 * A synchronous clock domain with a clock and an optional reset signal.
 */
public class ClockDomain {
  public enum ClockEdge { Pos, Neg }

  private final String name;
  private final Signal clk;
  private final Optional<Signal> rst;
  private final ClockEdge clkEdge;
  private final boolean local;

  /** Creates a positive-edge, non-local clock domain with a reset signal. */
  public ClockDomain(String name) { this(name, ClockEdge.Pos, false, false); }

  /**
   * @param name the domain name; must not be "comb"
   * @param clkEdge the active clock edge
   * @param resetLess true iff the domain has no reset signal
   * @param local true iff the domain is only visible in the fragment that declares it
   */
  public ClockDomain(String name, ClockEdge clkEdge, boolean resetLess, boolean local) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Clock domain name must not be empty");
    if (name.equals("comb"))
      throw new IllegalArgumentException("Domain 'comb' may not be clocked");
    this.name = name;
    this.clkEdge = clkEdge;
    this.local = local;
    String prefix = name.equals("sync") ? "" : name + "_";
    this.clk = new Signal(prefix + "clk");
    this.rst = resetLess ? Optional.empty() : Optional.of(new Signal(prefix + "rst"));
  }

  public String getName() { return name; }
  public Signal getClk() { return clk; }
  public Optional<Signal> getRst() { return rst; }
  public ClockEdge getClkEdge() { return clkEdge; }
  public boolean isLocal() { return local; }

  @Override
  public String toString() {
    return "(domain " + name + " " + clkEdge.name().toLowerCase() + (rst.isEmpty() ? " reset-less" : "") + ")";
  }
}
