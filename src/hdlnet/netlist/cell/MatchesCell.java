package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.NetValue;
import java.util.List;
import java.util.function.UnaryOperator;

/** One bit that is set when {@code value} matches any of the patterns. An empty pattern list never matches. */
public class MatchesCell extends Cell {
  private NetValue value;
  private final List<String> patterns;

  public MatchesCell(int module, NetValue value, List<String> patterns, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.value = value;
    this.patterns = List.copyOf(patterns);
  }

  public NetValue getValue() { return value; }
  public List<String> getPatterns() { return patterns; }

  @Override
  public int getWidth() {
    return 1;
  }

  @Override
  protected List<NetValue> inputs() {
    return List.of(value);
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    value = resolver.apply(value);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return edgesFrom(value);
  }

  @Override
  public String toString() {
    return "(matches " + value + (patterns.isEmpty() ? "" : " " + String.join(" ", patterns)) + ")";
  }
}
