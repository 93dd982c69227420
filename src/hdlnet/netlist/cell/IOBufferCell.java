package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/** Drives {@code o} onto {@code pad} while {@code oe} is set; the outputs are the pad value as seen from inside. */
public class IOBufferCell extends Cell {
  private NetValue pad;
  private NetValue o;
  private Net oe;

  public IOBufferCell(int module, NetValue pad, NetValue o, Net oe, SrcLoc srcLoc) {
    super(module, srcLoc);
    if (pad.size() != o.size())
      throw new IllegalArgumentException("IO buffer pad width " + pad.size() + " does not match output width " + o.size());
    this.pad = pad;
    this.o = o;
    this.oe = oe;
  }

  public NetValue getPad() { return pad; }
  public NetValue getO() { return o; }
  public Net getOe() { return oe; }

  @Override
  public int getWidth() {
    return pad.size();
  }

  @Override
  protected List<NetValue> inputs() {
    return List.of(pad, o, NetValue.of(oe));
  }

  @Override
  public Set<Net> ioNets() {
    Set<Net> result = new LinkedHashSet<>();
    pad.forEach(result::add);
    return result;
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    pad = resolver.apply(pad);
    o = resolver.apply(o);
    oe = resolver.apply(NetValue.of(oe)).get(0);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    return edgesFrom(NetValue.of(o.get(bit), oe));
  }

  @Override
  public String toString() {
    return "(iob " + pad + " " + o + " " + oe + ")";
  }
}
