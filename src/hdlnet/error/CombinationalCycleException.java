package hdlnet.error;

import java.util.List;

/** A combinational loop was found in a finished netlist. */
public class CombinationalCycleException extends HdlException {
  private static final long serialVersionUID = 1L;

  private final List<String> path;

  public CombinationalCycleException(List<String> path) {
    super(ErrorKind.COMBINATIONAL_CYCLE, "Combinational cycle detected, path:\n  " + String.join("\n  ", path), null);
    this.path = List.copyOf(path);
  }

  /** The cycle as a list of human readable hops, starting and ending at the same net. */
  public List<String> getPath() { return path; }
}
