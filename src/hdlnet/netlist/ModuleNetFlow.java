package hdlnet.netlist;

/** How a net crosses the boundary of a module. A net that is absent from a module's flow map does not occur in it. */
public enum ModuleNetFlow {
  /** Used or routed inside the module's subtree only. */
  INTERNAL("internal"),
  /** Used inside, driven outside the subtree. */
  INPUT("input"),
  /** Driven inside, used outside the subtree. */
  OUTPUT("output"),
  /** A pad of the design that passes through the module. */
  INOUT("inout");

  private final String serialName;
  ModuleNetFlow(String serialName) { this.serialName = serialName; }
  public String getSerialName() { return serialName; }
}
