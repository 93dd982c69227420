package hdlnet.netlist;

import hdlnet.netlist.cell.Cell;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/** Writes a built netlist as YAML: modules with their ports and named signals, and cells with their textual form. */
public final class NetlistYaml {
  private NetlistYaml() {}

  /** The netlist as nested maps and lists of strings and integers. */
  public static Map<String, Object> toMap(Netlist netlist) {
    List<Object> modules = new ArrayList<>();
    for (int idx = 0; idx < netlist.getModules().size(); ++idx) {
      NetlistModule module = netlist.getModule(idx);
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("index", idx);
      entry.put("parent", module.getParent());
      entry.put("name", new ArrayList<>(module.getName()));
      Map<String, Object> ports = new LinkedHashMap<>();
      module.getPorts().forEach((name, port) -> {
        Map<String, Object> portEntry = new LinkedHashMap<>();
        portEntry.put("flow", port.flow().getSerialName());
        portEntry.put("value", port.value().toString());
        ports.put(name, portEntry);
      });
      entry.put("ports", ports);
      entry.put("cells", new ArrayList<>(module.getCells()));
      // Local names are unique within a module, unlike the signals' own names.
      Map<String, Object> signals = new LinkedHashMap<>();
      module.getSignalNames().forEach((signal, name) -> {
        NetValue value = netlist.getSignalValue(signal);
        if (value != null)
          signals.put(name, value.toString());
      });
      entry.put("signals", signals);
      modules.add(entry);
    }

    List<Object> cells = new ArrayList<>();
    for (int idx = 0; idx < netlist.getCells().size(); ++idx) {
      Cell cell = netlist.getCell(idx);
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("index", idx);
      entry.put("module", cell.getModule());
      entry.put("cell", cell.toString());
      if (cell.getSrcLoc() != null)
        entry.put("src_loc", cell.getSrcLoc().toString());
      cells.add(entry);
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("modules", modules);
    result.put("cells", cells);
    return result;
  }

  private static Yaml createYaml() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setWidth(160);
    return new Yaml(options);
  }

  public static String dump(Netlist netlist) { return createYaml().dump(toMap(netlist)); }

  public static void dump(Netlist netlist, Writer writer) throws IOException {
    createYaml().dump(toMap(netlist), writer);
    writer.flush();
  }
}
