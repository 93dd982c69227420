package hdlnet.ir;

import hdlnet.ast.Const;
import hdlnet.ast.Signal;
import hdlnet.ast.SrcLoc;
import hdlnet.ast.Value;
import hdlnet.error.DomainError;
import hdlnet.error.HdlSyntaxError;
import hdlnet.error.ShapeError;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A word-addressed storage array with synchronous write ports and synchronous or asynchronous read ports.
 * Becomes a memory cell plus one cell per port inside the parent module.
 */
public class MemoryInstance extends Fragment {
  /** A read port; comb-domain ports are asynchronous and always enabled. */
  public record ReadPort(String domain, Value addr, Value data, Value en, List<Integer> transparentFor) {}

  /** A write port; {@code en} has one bit per {@code granularity()} data bits. */
  public record WritePort(String domain, Value addr, Value data, Value en) {
    public int granularity() { return data.width() == 0 ? 1 : data.width() / en.width(); }
  }

  private final int width;
  private final int depth;
  private final List<BigInteger> init;
  private final List<ReadPort> readPorts = new ArrayList<>();
  private final List<WritePort> writePorts = new ArrayList<>();

  public MemoryInstance(int width, int depth, List<? extends Number> init) { this(width, depth, init, SrcLoc.capture()); }

  public MemoryInstance(int width, int depth, List<? extends Number> init, SrcLoc srcLoc) {
    super(srcLoc);
    if (width < 0 || depth < 0)
      throw new ShapeError("Memory width and depth must be non-negative, not " + width + " and " + depth, srcLoc);
    this.width = width;
    this.depth = depth;
    List<? extends Number> words = init == null ? List.of() : init;
    if (words.size() > depth)
      throw new ShapeError("Memory initialization value count exceeds memory depth (" + words.size() + " > " + depth + ")", srcLoc);
    BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    List<BigInteger> masked = new ArrayList<>(depth);
    for (Number word : words)
      masked.add((word instanceof BigInteger ? (BigInteger)word : BigInteger.valueOf(word.longValue())).and(mask));
    while (masked.size() < depth)
      masked.add(BigInteger.ZERO);
    this.init = Collections.unmodifiableList(masked);
  }

  public int getWidth() { return width; }
  public int getDepth() { return depth; }
  public List<BigInteger> getInit() { return init; }
  public List<ReadPort> getReadPorts() { return Collections.unmodifiableList(readPorts); }
  public List<WritePort> getWritePorts() { return Collections.unmodifiableList(writePorts); }

  public int getAddrWidth() { return depth <= 1 ? 0 : 64 - Long.numberOfLeadingZeros(depth - 1L); }

  private void checkPort(Value addr, Value data) {
    if (data.width() != width)
      throw new ShapeError("Memory port data width " + data.width() + " does not match memory width " + width, srcLoc);
    if (addr.width() != getAddrWidth())
      throw new ShapeError("Memory port address width " + addr.width() + " does not match required width " + getAddrWidth(), srcLoc);
  }

  /** Adds an asynchronous read port driving {@code data}. */
  public void addReadPort(Object addr, Object data) { addReadPort("comb", addr, data, Const.of(1, 1), List.of()); }

  public void addReadPort(String domain, Object addr, Object data, Object en, List<Integer> transparentFor) {
    checkNotFrozen();
    Value addrValue = Value.cast(addr);
    Value dataValue = Value.cast(data);
    Value enValue = Value.cast(en);
    checkPort(addrValue, dataValue);
    if (!dataValue.isAssignable())
      throw new HdlSyntaxError("Memory read port data must be assignable, not " + dataValue, srcLoc);
    if (enValue.width() != 1)
      throw new ShapeError("Memory read port enable must be 1 bit wide, not " + enValue.width(), srcLoc);
    if (domain.equals("comb")) {
      if (!(enValue instanceof Const) || ((Const)enValue).getValue().signum() == 0)
        throw new DomainError("Asynchronous memory read port must be always enabled", srcLoc);
      if (!transparentFor.isEmpty())
        throw new DomainError("Asynchronous memory read port cannot be transparent", srcLoc);
    }
    for (int index : transparentFor) {
      if (index < 0 || index >= writePorts.size())
        throw new HdlSyntaxError("Transparency refers to nonexistent write port " + index, srcLoc);
      if (!writePorts.get(index).domain().equals(domain))
        throw new DomainError("Transparent read port must be in the same domain as write port " + index, srcLoc);
    }
    readPorts.add(new ReadPort(domain, addrValue, dataValue, enValue, List.copyOf(transparentFor)));
  }

  /** @return The index of the new port, used to refer to it for read port transparency */
  public int addWritePort(String domain, Object addr, Object data, Object en) {
    checkNotFrozen();
    if (domain.equals("comb"))
      throw new DomainError("Memory write port cannot be asynchronous", srcLoc);
    Value addrValue = Value.cast(addr);
    Value dataValue = Value.cast(data);
    Value enValue = Value.cast(en);
    checkPort(addrValue, dataValue);
    if (dataValue.width() != 0 && (enValue.width() == 0 || dataValue.width() % enValue.width() != 0))
      throw new ShapeError("Memory write port enable width " + enValue.width() + " must divide data width " + dataValue.width(), srcLoc);
    writePorts.add(new WritePort(domain, addrValue, dataValue, enValue));
    return writePorts.size() - 1;
  }

  @Override
  public boolean isLeaf() {
    return true;
  }

  @Override
  protected Set<String> extraUsedDomains() {
    Set<String> result = new LinkedHashSet<>();
    for (WritePort port : writePorts)
      result.add(port.domain());
    for (ReadPort port : readPorts)
      if (!port.domain().equals("comb"))
        result.add(port.domain());
    return result;
  }

  @Override
  protected void renameDomainReferences(Map<String, String> renames) {
    super.renameDomainReferences(renames);
    readPorts.replaceAll(p -> new ReadPort(renames.getOrDefault(p.domain(), p.domain()), p.addr(), p.data(), p.en(), p.transparentFor()));
    writePorts.replaceAll(p -> new WritePort(renames.getOrDefault(p.domain(), p.domain()), p.addr(), p.data(), p.en()));
  }

  @Override
  protected Set<Signal> portSignals() {
    Set<Signal> result = new LinkedHashSet<>();
    for (String domain : extraUsedDomains()) {
      ClockDomain cd = domains.get(domain);
      if (cd != null)
        result.add(cd.getClk());
    }
    for (WritePort port : writePorts) {
      result.addAll(port.addr().rhsSignals());
      result.addAll(port.data().rhsSignals());
      result.addAll(port.en().rhsSignals());
    }
    for (ReadPort port : readPorts) {
      result.addAll(port.addr().rhsSignals());
      result.addAll(port.data().lhsSignals());
      result.addAll(port.en().rhsSignals());
    }
    return result;
  }

  /** Gates the enables of ports in the given domains with their control signal. */
  void gatePorts(Map<String, Value> controls) {
    checkNotFrozen();
    readPorts.replaceAll(p -> {
      Value control = controls.get(p.domain());
      return control == null ? p : new ReadPort(p.domain(), p.addr(), p.data(), p.en().bitAnd(control), p.transparentFor());
    });
    writePorts.replaceAll(p -> {
      Value control = controls.get(p.domain());
      return control == null ? p : new WritePort(p.domain(), p.addr(), p.data(), Value.mux(control, p.en(), Const.of(0, p.en().width())));
    });
  }

  @Override
  protected void transformValues(ValueTransformer transformer) {
    readPorts.replaceAll(p -> new ReadPort(p.domain(), transformer.onValue(p.addr()), transformer.onValue(p.data()),
                                           transformer.onValue(p.en()), p.transparentFor()));
    writePorts.replaceAll(p -> new WritePort(p.domain(), transformer.onValue(p.addr()), transformer.onValue(p.data()),
                                             transformer.onValue(p.en())));
  }

  @Override
  protected void visitValues(ValueTransformer transformer) {
    for (ReadPort p : readPorts) {
      transformer.onValue(p.addr());
      transformer.onValue(p.data());
      transformer.onValue(p.en());
    }
    for (WritePort p : writePorts) {
      transformer.onValue(p.addr());
      transformer.onValue(p.data());
      transformer.onValue(p.en());
    }
  }
}
