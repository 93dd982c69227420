package hdlnet.netlist;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.function.UnaryOperator;

/** An immutable sequence of nets, least significant bit first. Equal iff the nets are equal. */
public final class NetValue implements Iterable<Net> {
  public static final NetValue EMPTY = new NetValue(List.of());

  private final List<Net> nets;

  private NetValue(List<Net> nets) { this.nets = nets; }

  public static NetValue of(Collection<Net> nets) { return new NetValue(List.copyOf(nets)); }
  public static NetValue of(Net... nets) { return new NetValue(List.of(nets)); }

  /** The low {@code width} bits of {@code value} in two's complement. */
  public static NetValue fromConst(BigInteger value, int width) {
    List<Net> nets = new ArrayList<>(width);
    for (int bit = 0; bit < width; ++bit)
      nets.add(value.testBit(bit) ? Net.ONE : Net.ZERO);
    return new NetValue(List.copyOf(nets));
  }

  public static NetValue fromConst(long value, int width) { return fromConst(BigInteger.valueOf(value), width); }
  public static NetValue zeros(int width) { return fromConst(0, width); }
  public static NetValue ones(int width) { return fromConst(-1, width); }

  public int size() { return nets.size(); }
  public Net get(int index) { return nets.get(index); }
  public List<Net> nets() { return nets; }

  public NetValue slice(int start, int stop) { return new NetValue(List.copyOf(nets.subList(start, stop))); }

  public NetValue concat(NetValue other) {
    List<Net> result = new ArrayList<>(nets);
    result.addAll(other.nets);
    return new NetValue(List.copyOf(result));
  }

  public NetValue map(UnaryOperator<Net> mapper) {
    List<Net> result = new ArrayList<>(nets.size());
    for (Net net : nets)
      result.add(mapper.apply(net));
    return new NetValue(List.copyOf(result));
  }

  public boolean isConst() { return nets.stream().allMatch(Net::isConst); }

  @Override
  public Iterator<Net> iterator() {
    return nets.iterator();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof NetValue && nets.equals(((NetValue)obj).nets);
  }

  @Override
  public int hashCode() {
    return nets.hashCode();
  }

  /** Runs of constants, consecutive late nets and consecutive bits of one cell are printed as one chunk. */
  @Override
  public String toString() {
    List<String> chunks = new ArrayList<>();
    int pos = 0;
    while (pos < nets.size()) {
      int next = pos;
      Net first = nets.get(pos);
      if (first.isConst()) {
        BigInteger value = BigInteger.ZERO;
        while (next < nets.size() && nets.get(next).isConst()) {
          if (nets.get(next).getConst() == 1)
            value = value.setBit(next - pos);
          ++next;
        }
        chunks.add((next - pos) + "'d" + value);
      } else if (first.isLate()) {
        while (next < nets.size() && nets.get(next).isLate() && nets.get(next).raw() == first.raw() + (next - pos))
          ++next;
        int width = next - pos;
        chunks.add(width == 1 ? "(late " + first.raw() + ")" : "(late " + first.raw() + ":" + (first.raw() + width) + ")");
      } else {
        while (next < nets.size() && nets.get(next).isCell() && nets.get(next).getCell() == first.getCell() &&
               nets.get(next).getBit() == first.getBit() + (next - pos))
          ++next;
        int width = next - pos;
        chunks.add(width == 1 ? first.toString() : first.getCell() + "." + first.getBit() + ":" + (first.getBit() + width));
      }
      pos = next;
    }
    if (chunks.isEmpty())
      return "()";
    if (chunks.size() == 1)
      return chunks.get(0);
    return "(cat " + String.join(" ", chunks) + ")";
  }
}
