package hdlnet.ir;

import hdlnet.ast.Signal;
import hdlnet.ast.SrcLoc;
import hdlnet.ast.Statement;
import hdlnet.ast.Switch;
import hdlnet.ast.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adds a clock enable to clock domains. While the control signal is low, signals driven in the
 * domain hold their value, properties are not checked and memory ports in the domain are idle.
 */
public class EnableInserter extends ControlInserter {
  public EnableInserter(Object control) { this(Map.of("sync", control)); }

  public EnableInserter(Map<String, ?> controls) { super(controls, SrcLoc.capture()); }

  @Override
  protected List<Statement> insertControl(List<Statement> stmts, Value control, Set<Signal> driven) {
    List<Statement> wrapped = new ArrayList<>();
    wrapped.add(new Switch(control, List.of(new Switch.Case(List.of("1"), stmts, srcLoc)), srcLoc));
    return wrapped;
  }

  @Override
  protected void onLeaf(Fragment fragment) {
    if (fragment instanceof MemoryInstance)
      ((MemoryInstance)fragment).gatePorts(controls);
  }
}
