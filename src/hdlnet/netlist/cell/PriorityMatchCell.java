package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Keeps only the first set bit of {@code inputs}, and only while {@code en} is set.
 * Output bit {@code i} is {@code en & inputs[i] & !inputs[0..i)}.
 */
public class PriorityMatchCell extends Cell {
  private Net en;
  private NetValue inputs;

  public PriorityMatchCell(int module, Net en, NetValue inputs, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.en = en;
    this.inputs = inputs;
  }

  public Net getEn() { return en; }
  public NetValue getInputValues() { return inputs; }

  @Override
  public int getWidth() {
    return inputs.size();
  }

  @Override
  protected List<NetValue> inputs() {
    return List.of(NetValue.of(en), inputs);
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    en = resolver.apply(NetValue.of(en)).get(0);
    inputs = resolver.apply(inputs);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    List<CombEdge> result = new ArrayList<>();
    result.add(new CombEdge(en, srcLoc));
    for (int i = 0; i <= bit; ++i)
      result.add(new CombEdge(inputs.get(i), srcLoc));
    return result;
  }

  @Override
  public String toString() {
    return "(priority_match " + en + " " + inputs + ")";
  }
}
