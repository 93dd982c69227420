package hdlnet;

import hdlnet.ast.SignalArena;
import hdlnet.ir.PortSpec;
import hdlnet.netlist.Netlist;
import hdlnet.netlist.NetlistBuilder;
import hdlnet.netlist.NetlistYaml;
import hdlnet.ui.HdlNetConfig;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point tying configuration, netlist construction and output together.
 */
public class HdlNet {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final HdlNetConfig cfg;

  public HdlNet() { this(new HdlNetConfig()); }
  public HdlNet(HdlNetConfig cfg) { this.cfg = cfg; }

  public HdlNetConfig getConfig() { return cfg; }

  /** Prepares {@code top} (an elaboratable or fragment) with the requested ports and builds its netlist. */
  public Netlist buildNetlist(Object top, List<PortSpec> ports) {
    logger.debug("Building netlist for {} with {} requested ports", top, ports.size());
    return new NetlistBuilder()
        .name(cfg.name)
        .propagateDomains(cfg.propagate_domains)
        .undrivenAsStorage(cfg.undriven_as_storage)
        .missingDomainResolver(cfg.createResolver(new SignalArena()))
        .build(top, ports);
  }

  /** Writes the netlist in the configured output format. */
  public void writeNetlist(Netlist netlist, Writer writer) throws IOException {
    if (cfg.output_format.equals("yaml")) {
      NetlistYaml.dump(netlist, writer);
    } else {
      writer.write(netlist.toString());
      writer.write('\n');
    }
    writer.flush();
  }
}
