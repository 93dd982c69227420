package hdlnet.netlist;

import hdlnet.ast.Print;
import hdlnet.ast.Property;
import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.dsl.Module;
import hdlnet.error.DriverConflictException;
import hdlnet.error.ErrorKind;
import hdlnet.ir.MemoryInstance;
import hdlnet.ir.PortSpec;
import hdlnet.netlist.cell.Cell;
import hdlnet.netlist.cell.MatchesCell;
import hdlnet.netlist.cell.PartCell;
import hdlnet.netlist.cell.PrintCell;
import hdlnet.netlist.cell.PropertyCell;
import hdlnet.netlist.cell.SyncReadPortCell;
import hdlnet.netlist.cell.SyncWritePortCell;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatementEmissionTest {
  private SignalArena arena;

  @BeforeEach
  void setUp() {
    arena = new SignalArena();
  }

  private static <T extends Cell> List<T> cellsOf(Netlist netlist, Class<T> type) {
    return netlist.getCells().stream().filter(type::isInstance).map(type::cast).toList();
  }

  @Test
  void testCombPrint() {
    Signal en = arena.signal(1, "en");
    Signal x = arena.signal(4, "x");
    Module m = new Module(arena);
    m.when(en, () -> m.comb(Print.of("x =", x)));
    Netlist netlist = NetlistBuilder.buildNetlist(m, List.of(PortSpec.input("en", en), PortSpec.input("x", x)));

    List<PrintCell> prints = cellsOf(netlist, PrintCell.class);
    Assertions.assertEquals(1, prints.size());
    Assertions.assertFalse(prints.get(0).isSync());
    Assertions.assertTrue(prints.get(0).getEn().isCell());
    Assertions.assertTrue(prints.get(0).toString().startsWith("(print "));
  }

  @Test
  void testSyncAssertion() {
    Signal x = arena.signal(4, "x");
    Module m = new Module(arena);
    m.sync(Property.assertion(x.equalTo(3)), Property.cover(x.equalTo(5)));
    Netlist netlist = NetlistBuilder.buildNetlist(m, List.of(PortSpec.input("x", x)));

    List<PropertyCell> properties = cellsOf(netlist, PropertyCell.class);
    Assertions.assertEquals(2, properties.size());
    Assertions.assertEquals(Property.Kind.ASSERT, properties.get(0).getKind());
    Assertions.assertEquals(Property.Kind.COVER, properties.get(1).getKind());
    for (PropertyCell property : properties) {
      Assertions.assertTrue(property.isSync());
      Assertions.assertEquals(Net.fromCell(0, 6), property.getClk());
    }
    Assertions.assertEquals(List.of("x", "clk", "rst"), List.copyOf(netlist.getModule(0).getPorts().keySet()));
  }

  @Test
  void testVariableBitSelect() {
    Signal x = arena.signal(4, "x");
    Signal sel = arena.signal(2, "sel");
    Signal o = arena.signal(1, "o");
    Module m = new Module(arena);
    m.comb(o.assign(x.bitSelect(sel, 1)));
    Netlist netlist = NetlistBuilder.buildNetlist(m, List.of(PortSpec.input("x", x), PortSpec.input("sel", sel), PortSpec.output("o", o)));

    List<PartCell> parts = cellsOf(netlist, PartCell.class);
    Assertions.assertEquals(1, parts.size());
    Assertions.assertEquals("(part 0.2:6 unsigned 0.6:8 1 1)", parts.get(0).toString());
  }

  @Test
  void testZeroWidthOffsetAssignsAtZero() {
    Signal a = arena.signal(2, "a");
    Signal sel = arena.signal(0, "sel");
    Signal o = arena.signal(4, "o");
    Module m = new Module(arena);
    m.comb(o.bitSelect(sel, 2).assign(a));
    Netlist netlist = NetlistBuilder.buildNetlist(m, List.of(PortSpec.input("a", a), PortSpec.output("o", o)));

    Assertions.assertTrue(cellsOf(netlist, MatchesCell.class).isEmpty());
    Assertions.assertEquals(3, new CombEvaluator(netlist, Map.of("a", 3L)).output("o"));
    Assertions.assertEquals(2, new CombEvaluator(netlist, Map.of("a", 2L)).output("o"));
  }

  @Test
  void testTransparentSyncReadPort() {
    Signal addr = arena.signal(3, "addr");
    Signal wdata = arena.signal(16, "wdata");
    Signal we = arena.signal(2, "we");
    Signal rdata = arena.signal(16, "rdata");
    MemoryInstance mem = new MemoryInstance(16, 8, null);
    int writePort = mem.addWritePort("sync", addr, wdata, we);
    mem.addReadPort("sync", addr, rdata, 1, List.of(writePort));
    Module m = new Module(arena);
    m.submodule("mem", mem);
    Netlist netlist = NetlistBuilder.buildNetlist(m, List.of(PortSpec.input("addr", addr), PortSpec.input("wdata", wdata),
                                                             PortSpec.input("we", we), PortSpec.output("rdata", rdata)));

    List<SyncWritePortCell> writes = cellsOf(netlist, SyncWritePortCell.class);
    List<SyncReadPortCell> reads = cellsOf(netlist, SyncReadPortCell.class);
    Assertions.assertEquals(1, writes.size());
    Assertions.assertEquals(1, reads.size());
    Assertions.assertEquals(List.of(netlist.getCells().indexOf(writes.get(0))), reads.get(0).getTransparentFor());
    // each enable bit covers one 8-bit lane
    NetValue en = writes.get(0).getEn();
    Assertions.assertEquals(en.get(0), en.get(7));
    Assertions.assertEquals(en.get(8), en.get(15));
    Assertions.assertNotEquals(en.get(0), en.get(8));
  }

  @Test
  void testErrorKind() {
    Signal x = arena.signal(4, "x");
    Module m = new Module(arena);
    m.comb(x.assign(1));
    DriverConflictException e = Assertions.assertThrows(DriverConflictException.class, () -> m.sync(x.assign(2)));
    Assertions.assertEquals(ErrorKind.DRIVER_CONFLICT, e.getKind());
    Assertions.assertNotNull(e.getOtherSrcLoc());
  }
}
