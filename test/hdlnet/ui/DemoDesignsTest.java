package hdlnet.ui;

import hdlnet.HdlNet;
import hdlnet.ast.SignalArena;
import hdlnet.netlist.Netlist;
import hdlnet.netlist.cell.Cell;
import hdlnet.netlist.cell.FlipFlopCell;
import java.io.ByteArrayInputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.yaml.snakeyaml.Yaml;

class DemoDesignsTest {
  private static Netlist build(HdlNet hdlNet, String name) {
    DemoDesigns.Demo demo = DemoDesigns.create(name, new SignalArena());
    return hdlNet.buildNetlist(demo.top(), demo.ports());
  }

  private static List<FlipFlopCell> flipFlops(Netlist netlist) {
    return netlist.getCells().stream().filter(cell -> cell instanceof FlipFlopCell).map(cell -> (FlipFlopCell)cell).toList();
  }

  @Test
  void testNames() {
    Assertions.assertEquals(List.of("blinker", "counter", "decoder"), DemoDesigns.names());
    Assertions.assertThrows(IllegalArgumentException.class, () -> DemoDesigns.create("cpu", new SignalArena()));
  }

  @ParameterizedTest
  @ValueSource(strings = {"counter", "decoder", "blinker"})
  void testSexprOutput(String name) throws Exception {
    HdlNet hdlNet = new HdlNet();
    StringWriter writer = new StringWriter();
    hdlNet.writeNetlist(build(hdlNet, name), writer);
    String text = writer.toString();
    Assertions.assertTrue(text.startsWith("(module 0 - ('top')"));
    Assertions.assertTrue(text.endsWith("\n"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"counter", "decoder", "blinker"})
  void testYamlOutput(String name) throws Exception {
    HdlNetConfig cfg = new HdlNetConfig();
    cfg.output_format = "yaml";
    cfg.name = name;
    HdlNet hdlNet = new HdlNet(cfg);
    StringWriter writer = new StringWriter();
    hdlNet.writeNetlist(build(hdlNet, name), writer);
    Map<String, Object> loaded = new Yaml().load(writer.toString());
    List<?> modules = (List<?>)loaded.get("modules");
    Assertions.assertEquals(List.of(name), ((Map<?, ?>)modules.get(0)).get("name"));
  }

  @Test
  void testDecoderIsCombinational() {
    Netlist netlist = build(new HdlNet(), "decoder");
    Assertions.assertTrue(flipFlops(netlist).isEmpty());
    Assertions.assertEquals(List.of("sel", "en", "out"), List.copyOf(netlist.getModule(0).getPorts().keySet()));
  }

  @Test
  void testBlinkerRegisters() {
    Netlist netlist = build(new HdlNet(), "blinker");
    List<FlipFlopCell> ffs = flipFlops(netlist);
    // prescaler and FSM state
    Assertions.assertEquals(2, ffs.size());
    Assertions.assertEquals(List.of("clk", "rst", "led"), List.copyOf(netlist.getModule(0).getPorts().keySet()));
  }

  @Test
  void testConfiguredClockEdge() {
    HdlNetConfig cfg = HdlNetConfig.load(new ByteArrayInputStream("default_clk_edge: neg\n".getBytes(StandardCharsets.UTF_8)));
    Netlist netlist = build(new HdlNet(cfg), "counter");
    for (Cell cell : flipFlops(netlist))
      Assertions.assertTrue(cell.toString().contains(" neg "));
  }
}
