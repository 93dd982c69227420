package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.NetValue;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/** The storage of a memory. Ports refer to it by cell index; the cell itself has no inputs or outputs. */
public class MemoryCell extends Cell {
  private final String name;
  private final int width;
  private final int depth;
  private final List<BigInteger> init;
  private final Map<String, Object> attrs;

  public MemoryCell(int module, String name, int width, int depth, List<BigInteger> init, Map<String, Object> attrs, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.name = name;
    this.width = width;
    this.depth = depth;
    this.init = List.copyOf(init);
    this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
  }

  public String getName() { return name; }
  public int getMemoryWidth() { return width; }
  public int getDepth() { return depth; }
  public List<BigInteger> getInit() { return init; }
  public Map<String, Object> getAttrs() { return attrs; }

  @Override
  public int getWidth() {
    return 0;
  }

  @Override
  protected List<NetValue> inputs() {
    return List.of();
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {}

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return List.of();
  }

  @Override
  public String toString() {
    String words = init.stream().map(BigInteger::toString).collect(Collectors.joining(" "));
    return "(memory " + quote(name) + " " + width + " " + depth + " (init " + words + ")" + attrsRepr(attrs) + ")";
  }
}
