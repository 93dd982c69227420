package hdlnet.ir;

import hdlnet.ast.Value;

/**
 * A requested top-level port. Name and direction are optional: unnamed ports take the name of their signal
 * and the direction of an undirected port is inferred when the netlist is built.
 * The signal must be a {@code Signal}, {@code ClockSignal} or {@code ResetSignal}.
 */
public record PortSpec(String name, Value signal, PortDirection direction) {
  public static PortSpec of(Value signal) { return new PortSpec(null, signal, null); }
  public static PortSpec of(String name, Value signal) { return new PortSpec(name, signal, null); }
  public static PortSpec input(String name, Value signal) { return new PortSpec(name, signal, PortDirection.INPUT); }
  public static PortSpec output(String name, Value signal) { return new PortSpec(name, signal, PortDirection.OUTPUT); }
  public static PortSpec inout(String name, Value signal) { return new PortSpec(name, signal, PortDirection.INOUT); }

  /** The value half of a name-keyed port map entry. */
  public record Binding(Value signal, PortDirection direction) {}
}
