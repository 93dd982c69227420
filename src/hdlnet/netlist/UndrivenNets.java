package hdlnet.netlist;

import hdlnet.ast.Signal;
import hdlnet.ir.ClockDomain.ClockEdge;
import hdlnet.netlist.cell.FlipFlopCell;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Connects signal bits that nothing drives. This only happens for signals that are never assigned,
 * or that are partially driven by instances.
 */
public final class UndrivenNets {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Attribute that marks flip-flops inserted by {@link #insertStorage}. */
  public static final String UNDRIVEN_ATTR = "hdlnet.undriven";

  private UndrivenNets() {}

  private static List<Integer> undrivenBits(Netlist netlist, NetValue value) {
    List<Integer> bits = new ArrayList<>();
    for (int bit = 0; bit < value.size(); ++bit) {
      Net net = value.get(bit);
      if (net.isLate() && !netlist.isConnected(net))
        bits.add(bit);
    }
    return bits;
  }

  /** Ties every undriven bit to the corresponding bit of the signal's initial value. */
  public static void tieToInit(Netlist netlist) {
    int count = 0;
    for (Map.Entry<Signal, NetValue> entry : netlist.getSignals().entrySet()) {
      BigInteger init = entry.getKey().getInit();
      for (int bit : undrivenBits(netlist, entry.getValue())) {
        netlist.connect(entry.getValue().get(bit), init.testBit(bit) ? Net.ONE : Net.ZERO);
        ++count;
      }
    }
    if (count > 0)
      logger.debug("Tied {} undriven signal bits to their initial values", count);
  }

  /**
   * Gives the undriven bits of every signal storage of their own: a flip-flop that never changes its value,
   * so that a simulator can set those bits from the outside.
   * @param signalModules The module each signal belongs to; signals not listed go to the top module
   */
  public static void insertStorage(Netlist netlist, Map<Signal, Integer> signalModules) {
    for (Map.Entry<Signal, NetValue> entry : new ArrayList<>(netlist.getSignals().entrySet())) {
      Signal signal = entry.getKey();
      List<Integer> bits = undrivenBits(netlist, entry.getValue());
      if (bits.isEmpty())
        continue;
      BigInteger init = BigInteger.ZERO;
      for (int i = 0; i < bits.size(); ++i)
        if (signal.getInit().testBit(bits.get(i)))
          init = init.setBit(i);
      int module = signalModules.getOrDefault(signal, 0);
      FlipFlopCell cell = new FlipFlopCell(module, NetValue.zeros(bits.size()), init, Net.ZERO, ClockEdge.POS, Net.ZERO,
                                           Map.of(UNDRIVEN_ATTR, signal.getName()), signal.getSrcLoc());
      NetValue storage = netlist.addValueCell(bits.size(), cell);
      cell.setData(storage);
      for (int i = 0; i < bits.size(); ++i)
        netlist.connect(entry.getValue().get(bits.get(i)), storage.get(i));
      logger.debug("Inserted storage for {} undriven bits of signal {}", bits.size(), signal.getName());
    }
  }
}
