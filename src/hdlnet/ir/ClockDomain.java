package hdlnet.ir;

import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.ast.SrcLoc;
import hdlnet.error.DomainError;

/**
 * A clock domain: a clock, an optional reset and the clock edge registers update on.
 * The identity is fixed, but renaming updates the domain name and the names of its signals.
 */
public class ClockDomain {
  public enum ClockEdge {
    POS("pos"),
    NEG("neg");

    private final String serialName;
    ClockEdge(String serialName) { this.serialName = serialName; }
    public String getSerialName() { return serialName; }

    public static ClockEdge fromSerialName(String name) {
      for (ClockEdge edge : values())
        if (edge.serialName.equals(name))
          return edge;
      throw new IllegalArgumentException("Clock edge must be 'pos' or 'neg', not '" + name + "'");
    }
  }

  private String name;
  private final Signal clk;
  private final Signal rst;
  private final ClockEdge clkEdge;
  private final boolean asyncReset;
  private final boolean local;
  private final SrcLoc srcLoc;

  /** A positive-edge domain with a synchronous reset. */
  public ClockDomain(SignalArena arena, String name) { this(arena, name, ClockEdge.POS, false, false, false); }

  public ClockDomain(SignalArena arena, String name, ClockEdge clkEdge, boolean resetLess, boolean asyncReset, boolean local) {
    if (name.equals("comb"))
      throw new DomainError("Domain '" + name + "' may not be clocked");
    this.name = name;
    this.clkEdge = clkEdge;
    this.asyncReset = asyncReset;
    this.local = local;
    this.srcLoc = SrcLoc.capture();
    this.clk = arena.newSignal(1).name(signalName(name, "clk")).build();
    this.rst = resetLess ? null : arena.newSignal(1).name(signalName(name, "rst")).resetLess(true).build();
  }

  private static String signalName(String domainName, String signalName) {
    return domainName.equals("sync") ? signalName : domainName + "_" + signalName;
  }

  public String getName() { return name; }
  public Signal getClk() { return clk; }
  /** The reset signal, or null for a reset-less domain. */
  public Signal getRst() { return rst; }
  public ClockEdge getClkEdge() { return clkEdge; }
  public boolean isAsyncReset() { return asyncReset; }
  /** Local domains are not propagated to the parent fragment. */
  public boolean isLocal() { return local; }
  public SrcLoc getSrcLoc() { return srcLoc; }

  public void rename(String newName) {
    this.name = newName;
    clk.setName(signalName(newName, "clk"));
    if (rst != null)
      rst.setName(signalName(newName, "rst"));
  }

  @Override
  public String toString() {
    return "(domain " + name + ")";
  }
}
