package hdlnet.netlist;

import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.ir.Design;
import hdlnet.ir.Fragment;
import hdlnet.ir.MissingDomainResolver;
import hdlnet.ir.PortSpec;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns a design into a netlist: emission, connection of undriven bits, net resolution,
 * combinational cycle check, net flows and ports, in this order.
 */
public class NetlistBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private String name = "top";
  private boolean propagateDomains = true;
  private boolean undrivenAsStorage = false;
  private MissingDomainResolver resolver;

  /** Hierarchical name of the top module. */
  public NetlistBuilder name(String name) {
    this.name = name;
    return this;
  }

  public NetlistBuilder propagateDomains(boolean propagateDomains) {
    this.propagateDomains = propagateDomains;
    return this;
  }

  /** Gives undriven signal bits storage of their own instead of tying them to their initial value. Meant for simulation. */
  public NetlistBuilder undrivenAsStorage(boolean undrivenAsStorage) {
    this.undrivenAsStorage = undrivenAsStorage;
    return this;
  }

  /** Resolver for missing domains; by default every missing domain becomes a plain clock domain. */
  public NetlistBuilder missingDomainResolver(MissingDomainResolver resolver) {
    this.resolver = resolver;
    return this;
  }

  /**
   * @param obj A prepared {@link Design}, or a fragment or elaboratable to be prepared with {@code ports}
   * @param ports Requested top-level ports; ignored for a prepared design
   */
  public Netlist build(Object obj, List<PortSpec> ports) {
    Design design;
    if (obj instanceof Design) {
      design = (Design)obj;
      if (!ports.isEmpty())
        logger.warn("Ports are ignored when building a netlist from a prepared design");
    } else {
      MissingDomainResolver domainResolver = resolver != null ? resolver : MissingDomainResolver.createDefault(new SignalArena());
      design = Fragment.get(obj).prepare(ports, domainResolver, propagateDomains, List.of(name));
    }

    Netlist netlist = new Netlist();
    NetlistEmitter emitter = new NetlistEmitter(netlist, design);
    emitter.emit();
    if (undrivenAsStorage) {
      Map<Signal, Integer> signalModules = new HashMap<>();
      design.getSignalLca().forEach((signal, fragment) -> {
        Integer module = emitter.getModuleOfFragment().get(fragment);
        if (module != null)
          signalModules.put(signal, module);
      });
      UndrivenNets.insertStorage(netlist, signalModules);
    } else {
      UndrivenNets.tieToInit(netlist);
    }
    netlist.resolveAllNets();
    netlist.checkCombCycles();
    NetFlows.computeNetFlows(netlist);
    NetFlows.computePorts(netlist);
    logger.info("Built netlist '{}': {} modules, {} cells", name, netlist.getModules().size(), netlist.getCells().size());
    return netlist;
  }

  public static Netlist buildNetlist(Object obj, List<PortSpec> ports) { return new NetlistBuilder().build(obj, ports); }
}
