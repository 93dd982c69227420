package hdlnet.netlist;

import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.dsl.Module;
import hdlnet.ir.PortSpec;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

class NetlistYamlTest {
  private Netlist netlist;

  @BeforeEach
  void setUp() {
    SignalArena arena = new SignalArena();
    Signal ctr = arena.signal(4, "ctr");
    Module m = new Module(arena);
    m.sync(ctr.assign(ctr.add(1)));
    netlist = NetlistBuilder.buildNetlist(m, List.of(PortSpec.of(ctr)));
  }

  @SuppressWarnings("unchecked")
  @Test
  void testModules() {
    Map<String, Object> map = NetlistYaml.toMap(netlist);
    List<Object> modules = (List<Object>)map.get("modules");
    Assertions.assertEquals(1, modules.size());
    Map<String, Object> top = (Map<String, Object>)modules.get(0);
    Assertions.assertNull(top.get("parent"));
    Assertions.assertEquals(List.of("top"), top.get("name"));
    Map<String, Object> ports = (Map<String, Object>)top.get("ports");
    Assertions.assertEquals(List.of("clk", "rst", "ctr"), List.copyOf(ports.keySet()));
    Assertions.assertEquals(Map.of("flow", "output", "value", "5.0:4"), ports.get("ctr"));
    Assertions.assertEquals(List.of(0, 1, 2, 3, 4, 5), top.get("cells"));
  }

  @SuppressWarnings("unchecked")
  @Test
  void testCells() {
    Map<String, Object> map = NetlistYaml.toMap(netlist);
    List<Object> cells = (List<Object>)map.get("cells");
    Assertions.assertEquals(6, cells.size());
    Map<String, Object> adder = (Map<String, Object>)cells.get(1);
    Assertions.assertEquals(1, adder.get("index"));
    Assertions.assertEquals(0, adder.get("module"));
    Assertions.assertEquals("(+ (cat 5.0:4 1'd0) 5'd1)", adder.get("cell"));
    Map<String, Object> top = (Map<String, Object>)((List<Object>)map.get("modules")).get(0);
    Map<String, Object> signals = (Map<String, Object>)top.get("signals");
    Assertions.assertEquals("5.0:4", signals.get("ctr"));
    Assertions.assertEquals("0.2", signals.get("clk"));
  }

  @SuppressWarnings("unchecked")
  @Test
  void testDumpIsLoadable() throws Exception {
    StringWriter writer = new StringWriter();
    NetlistYaml.dump(netlist, writer);
    Map<String, Object> loaded = new Yaml().load(writer.toString());
    List<Object> cells = (List<Object>)loaded.get("cells");
    Map<String, Object> ff = (Map<String, Object>)cells.get(5);
    Assertions.assertEquals("(flipflop 4.0:4 0 pos 0.2 0)", ff.get("cell"));
    Assertions.assertEquals(NetlistYaml.dump(netlist), writer.toString());
  }

  @SuppressWarnings("unchecked")
  @Test
  void testSignalsWithSameNameAndIndex() {
    SignalArena arena = new SignalArena();
    Signal userClk = arena.signal(1, "clk");
    Signal ctr = arena.signal(4, "ctr");
    Module m = new Module(arena);
    m.sync(ctr.assign(ctr.add(1)));
    m.comb(userClk.assign(ctr.bool()));
    Netlist built = NetlistBuilder.buildNetlist(m, List.of(PortSpec.of(ctr)));
    Assertions.assertEquals(0, userClk.getIndex());

    Map<String, Object> top = (Map<String, Object>)((List<Object>)NetlistYaml.toMap(built).get("modules")).get(0);
    Map<String, Object> signals = (Map<String, Object>)top.get("signals");
    Assertions.assertEquals("0.2", signals.get("clk"));
    List<String> userKeys = signals.keySet().stream().filter(key -> key.startsWith("clk$")).toList();
    Assertions.assertEquals(1, userKeys.size());
    Assertions.assertEquals(built.getSignalValue(userClk).toString(), signals.get(userKeys.get(0)));
    Assertions.assertEquals(4, signals.size());
  }
}
