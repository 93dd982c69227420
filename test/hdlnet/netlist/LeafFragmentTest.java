package hdlnet.netlist;

import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.dsl.Module;
import hdlnet.error.DomainError;
import hdlnet.error.ShapeError;
import hdlnet.ir.IOBufferInstance;
import hdlnet.ir.Instance;
import hdlnet.ir.MemoryInstance;
import hdlnet.ir.PortSpec;
import hdlnet.netlist.cell.AsyncReadPortCell;
import hdlnet.netlist.cell.Cell;
import hdlnet.netlist.cell.IOBufferCell;
import hdlnet.netlist.cell.InstanceCell;
import hdlnet.netlist.cell.MemoryCell;
import hdlnet.netlist.cell.SyncWritePortCell;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LeafFragmentTest {
  private SignalArena arena;

  @BeforeEach
  void setUp() {
    arena = new SignalArena();
  }

  private static <T extends Cell> List<T> cellsOf(Netlist netlist, Class<T> type) {
    return netlist.getCells().stream().filter(type::isInstance).map(type::cast).toList();
  }

  @Test
  void testInstance() {
    Signal a = arena.signal(4, "a");
    Signal o = arena.signal(4, "o");
    Module m = new Module(arena);
    m.submodule("buf", new Instance("BUF").parameter("WIDTH", 4).input("I", a).output("O", o));
    Netlist netlist = NetlistBuilder.buildNetlist(m, List.of(PortSpec.input("a", a), PortSpec.output("o", o)));

    List<InstanceCell> instances = cellsOf(netlist, InstanceCell.class);
    Assertions.assertEquals(1, instances.size());
    String text = instances.get(0).toString();
    Assertions.assertTrue(text.startsWith("(instance 'BUF' 'buf'"));
    Assertions.assertTrue(text.contains("(param 'WIDTH' 4)"));
    Assertions.assertTrue(text.contains("(input 'I' 0.2:6)"));
    Assertions.assertTrue(text.contains("(output 'O' 0:4)"));

    int cell = netlist.getCells().indexOf(instances.get(0));
    Assertions.assertEquals(cell + ".0:4", netlist.getSignalValue(o).toString());
    // instances become cells of the parent module
    Assertions.assertEquals(1, netlist.getModules().size());
  }

  @Test
  void testMemory() {
    Signal waddr = arena.signal(2, "waddr");
    Signal wdata = arena.signal(8, "wdata");
    Signal we = arena.signal(1, "we");
    Signal raddr = arena.signal(2, "raddr");
    Signal rdata = arena.signal(8, "rdata");
    MemoryInstance mem = new MemoryInstance(8, 4, List.of(1, 2, 3));
    mem.addWritePort("sync", waddr, wdata, we);
    mem.addReadPort(raddr, rdata);
    Module m = new Module(arena);
    m.submodule("mem", mem);
    Netlist netlist = NetlistBuilder.buildNetlist(m, List.of(PortSpec.input("waddr", waddr), PortSpec.input("wdata", wdata),
                                                             PortSpec.input("we", we), PortSpec.input("raddr", raddr),
                                                             PortSpec.output("rdata", rdata)));

    List<MemoryCell> memories = cellsOf(netlist, MemoryCell.class);
    Assertions.assertEquals(1, memories.size());
    Assertions.assertEquals("(memory 'mem' 8 4 (init 1 2 3 0))", memories.get(0).toString());
    int memoryCell = netlist.getCells().indexOf(memories.get(0));

    List<SyncWritePortCell> writes = cellsOf(netlist, SyncWritePortCell.class);
    Assertions.assertEquals(1, writes.size());
    Assertions.assertEquals(memoryCell, writes.get(0).getMemory());
    Assertions.assertEquals(8, writes.get(0).getEn().size());

    List<AsyncReadPortCell> reads = cellsOf(netlist, AsyncReadPortCell.class);
    Assertions.assertEquals(1, reads.size());
    int readCell = netlist.getCells().indexOf(reads.get(0));
    Assertions.assertEquals(readCell + ".0:8", netlist.getSignalValue(rdata).toString());
    Assertions.assertTrue(netlist.getModule(0).getPorts().containsKey("clk"));
  }

  @Test
  void testMemoryChecks() {
    Signal addr = arena.signal(2, "addr");
    Signal data = arena.signal(8, "data");
    MemoryInstance mem = new MemoryInstance(8, 4, null);
    Assertions.assertThrows(ShapeError.class, () -> new MemoryInstance(8, 2, List.of(1, 2, 3)));
    Assertions.assertThrows(ShapeError.class, () -> mem.addReadPort(arena.signal(3, "wide"), data));
    Assertions.assertThrows(DomainError.class, () -> mem.addWritePort("comb", addr, data, 1));
    Assertions.assertThrows(ShapeError.class, () -> mem.addWritePort("sync", addr, data, arena.signal(3, "en")));
    Assertions.assertEquals(0, mem.addWritePort("sync", addr, data, arena.signal(4, "en")));
    Assertions.assertEquals(2, mem.getWritePorts().get(0).granularity());
  }

  @Test
  void testIOBuffer() {
    Signal pad = arena.signal(2, "pad");
    Signal i = arena.signal(2, "i");
    Signal o = arena.signal(2, "o");
    Signal oe = arena.signal(1, "oe");
    Module m = new Module(arena);
    m.submodule(new IOBufferInstance(pad, i, o, oe));
    Netlist netlist = NetlistBuilder.buildNetlist(m, List.of(PortSpec.inout("pad", pad), PortSpec.output("i", i), PortSpec.input("o", o),
                                                             PortSpec.input("oe", oe)));

    List<IOBufferCell> buffers = cellsOf(netlist, IOBufferCell.class);
    Assertions.assertEquals(1, buffers.size());
    int cell = netlist.getCells().indexOf(buffers.get(0));
    Assertions.assertEquals(cell + ".0:2", netlist.getSignalValue(i).toString());
    Assertions.assertEquals(ModuleNetFlow.INOUT, netlist.getModule(0).getPorts().get("pad").flow());
  }

  @Test
  void testIOBufferChecks() {
    Signal pad = arena.signal(2, "pad");
    Assertions.assertThrows(ShapeError.class, () -> new IOBufferInstance(pad, arena.signal(3, "i"), null, null));
    Assertions.assertThrows(ShapeError.class, () -> new IOBufferInstance(pad, null, null, arena.signal(1, "oe")));
    Assertions.assertThrows(ShapeError.class, () -> new IOBufferInstance(pad, null, arena.signal(2, "o"), arena.signal(2, "oe")));
  }
}
