package hdlnet.ui;

import hdlnet.ast.SignalArena;
import hdlnet.ir.ClockDomain;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HdlNetConfigTest {
  private static HdlNetConfig parse(String yaml) {
    return HdlNetConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void testDefaults() {
    HdlNetConfig cfg = parse("");
    Assertions.assertEquals("top", cfg.name);
    Assertions.assertTrue(cfg.propagate_domains);
    Assertions.assertFalse(cfg.undriven_as_storage);
    Assertions.assertEquals("pos", cfg.default_clk_edge);
    Assertions.assertEquals("sexpr", cfg.output_format);
  }

  @Test
  void testLoadResource() throws Exception {
    HdlNetConfig cfg;
    try (InputStream in = getClass().getResourceAsStream("storage.yaml")) {
      Assertions.assertNotNull(in);
      cfg = HdlNetConfig.load(in);
    }
    Assertions.assertEquals("chip", cfg.name);
    Assertions.assertTrue(cfg.undriven_as_storage);
    Assertions.assertEquals("neg", cfg.default_clk_edge);
    Assertions.assertEquals("yaml", cfg.output_format);
    Assertions.assertTrue(cfg.propagate_domains);
  }

  @ParameterizedTest
  @ValueSource(strings = {"default_clk_edge: rising", "output_format: verilog", "propagate_domains: maybe", "undriven_as_storage: 1"})
  void testInvalidValues(String yaml) {
    Assertions.assertThrows(IllegalArgumentException.class, () -> parse(yaml));
  }

  @Test
  void testUnknownKeyIgnored() {
    HdlNetConfig cfg = parse("name: alu\nfrobnicate: true\n");
    Assertions.assertEquals("alu", cfg.name);
  }

  @Test
  void testResolver() {
    HdlNetConfig cfg = parse("default_clk_edge: neg\ndefault_async_reset: true\n");
    ClockDomain domain = (ClockDomain)cfg.createResolver(new SignalArena()).resolve("fast");
    Assertions.assertEquals("fast", domain.getName());
    Assertions.assertEquals(ClockDomain.ClockEdge.NEG, domain.getClkEdge());
    Assertions.assertTrue(domain.isAsyncReset());
    Assertions.assertEquals("fast_clk", domain.getClk().getName());
  }

  @ParameterizedTest
  @ValueSource(strings = {"- name\n- alu\n", "just a string", "42"})
  void testDocumentMustBeMapping(String yaml) {
    IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
        () -> HdlNetConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "broken.yaml"));
    Assertions.assertTrue(e.getMessage().contains("broken.yaml"), e.getMessage());
  }

  @Test
  void testNonStringKeys() {
    HdlNetConfig cfg = parse("1: true\nname: alu\n");
    Assertions.assertEquals("alu", cfg.name);
  }
}
