package hdlnet.ir;

import hdlnet.ast.Signal;
import hdlnet.ast.SrcLoc;
import hdlnet.ast.Value;
import hdlnet.error.HdlNameError;
import hdlnet.error.HdlSyntaxError;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A black-box cell of a foreign type, e.g. a vendor primitive, connected through named ports.
 * <p>
 * Instances have no statements and become a single cell inside the parent module.
 */
public class Instance extends Fragment {
  /** A port connection; output and inout connections must be assignable. */
  public record InstancePort(Value value, PortDirection direction) {}

  private final String type;
  private final LinkedHashMap<String, Object> parameters = new LinkedHashMap<>();
  private final LinkedHashMap<String, InstancePort> ports = new LinkedHashMap<>();

  public Instance(String type) { this(type, SrcLoc.capture()); }

  public Instance(String type, SrcLoc srcLoc) {
    super(srcLoc);
    if (type == null || type.isEmpty())
      throw new HdlNameError("Instance type must be a non-empty string", srcLoc);
    this.type = type;
  }

  public String getType() { return type; }
  public Map<String, Object> getParameters() { return Collections.unmodifiableMap(parameters); }
  public Map<String, InstancePort> getPorts() { return Collections.unmodifiableMap(ports); }

  /** Sets a parameter; values are integers, strings, booleans or constants. */
  public Instance parameter(String name, Object value) {
    checkNotFrozen();
    parameters.put(name, value);
    return this;
  }

  public Instance attribute(String name, Object value) {
    setAttr(name, value);
    return this;
  }

  public Instance input(String name, Object value) { return port(name, Value.cast(value), PortDirection.INPUT); }
  public Instance output(String name, Object value) { return port(name, Value.cast(value), PortDirection.OUTPUT); }
  public Instance inout(String name, Object value) { return port(name, Value.cast(value), PortDirection.INOUT); }

  private Instance port(String name, Value value, PortDirection direction) {
    checkNotFrozen();
    if (direction != PortDirection.INPUT && !value.isAssignable())
      throw new HdlSyntaxError("Port '" + name + "' of instance '" + type + "' must be connected to an assignable value, not " + value,
                               srcLoc);
    if (ports.containsKey(name))
      throw new HdlNameError("Port '" + name + "' of instance '" + type + "' is connected more than once", srcLoc);
    ports.put(name, new InstancePort(value, direction));
    return this;
  }

  @Override
  public boolean isLeaf() {
    return true;
  }

  @Override
  protected Set<Signal> portSignals() {
    Set<Signal> result = new LinkedHashSet<>();
    for (InstancePort port : ports.values()) {
      result.addAll(port.value().lhsSignals());
      result.addAll(port.value().rhsSignals());
    }
    return result;
  }

  @Override
  protected void transformValues(ValueTransformer transformer) {
    super.transformValues(transformer);
    ports.replaceAll((name, port) -> new InstancePort(transformer.onValue(port.value()), port.direction()));
  }

  @Override
  protected void visitValues(ValueTransformer transformer) {
    for (InstancePort port : ports.values())
      transformer.onValue(port.value());
  }

  @Override
  public String toString() {
    return "(instance " + type + ")";
  }
}
