package hdlnet.ui;

import hdlnet.ast.SignalArena;
import hdlnet.ir.ClockDomain;
import hdlnet.ir.MissingDomainResolver;
import java.io.InputStream;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;

/**
 * Data-Class to hold tool options.
 */
public class HdlNetConfig {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public String name = "top";
  public boolean propagate_domains = true;
  public boolean undriven_as_storage = false;

  // Domains created for names that are used but never defined
  public String default_clk_edge = "pos";
  public boolean default_async_reset = false;
  public boolean default_reset_less = false;

  /** "sexpr" or "yaml" */
  public String output_format = "sexpr";

  public static HdlNetConfig load(InputStream in) { return load(in, "<stream>"); }

  /**
   * Reads options from a YAML mapping; keys that are not present keep their default.
   * An empty document yields the defaults.
   * @param source Name of the file being read, for error messages
   */
  public static HdlNetConfig load(InputStream in, String source) {
    Object data = new Yaml().load(in);
    HdlNetConfig cfg = new HdlNetConfig();
    if (data == null)
      return cfg;
    if (!(data instanceof Map<?, ?>))
      throw new IllegalArgumentException("Config " + source + " must be a YAML mapping of options, not " + data.getClass().getSimpleName());
    for (Map.Entry<?, ?> entry : ((Map<?, ?>)data).entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      switch (key) {
      case "name":
        cfg.name = String.valueOf(value);
        break;
      case "propagate_domains":
        cfg.propagate_domains = asBoolean(key, value);
        break;
      case "undriven_as_storage":
        cfg.undriven_as_storage = asBoolean(key, value);
        break;
      case "default_clk_edge":
        cfg.default_clk_edge = String.valueOf(value);
        ClockDomain.ClockEdge.fromSerialName(cfg.default_clk_edge);
        break;
      case "default_async_reset":
        cfg.default_async_reset = asBoolean(key, value);
        break;
      case "default_reset_less":
        cfg.default_reset_less = asBoolean(key, value);
        break;
      case "output_format":
        cfg.output_format = String.valueOf(value);
        if (!cfg.output_format.equals("sexpr") && !cfg.output_format.equals("yaml"))
          throw new IllegalArgumentException("output_format must be 'sexpr' or 'yaml', not '" + cfg.output_format + "'");
        break;
      default:
        logger.warn("Ignoring unknown config option {} in {}", key, source);
      }
    }
    return cfg;
  }

  private static boolean asBoolean(String key, Object value) {
    if (!(value instanceof Boolean))
      throw new IllegalArgumentException("Config option " + key + " must be true or false, not " + value);
    return (Boolean)value;
  }

  /** Creates missing domains with the configured edge and reset style. */
  public MissingDomainResolver createResolver(SignalArena arena) {
    ClockDomain.ClockEdge edge = ClockDomain.ClockEdge.fromSerialName(default_clk_edge);
    return domainName -> new ClockDomain(arena, domainName, edge, default_reset_less, default_async_reset, false);
  }
}
