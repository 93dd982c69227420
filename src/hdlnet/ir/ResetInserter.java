package hdlnet.ir;

import hdlnet.ast.Const;
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
 * Adds a synchronous reset condition to clock domains. While the control signal is high, every
 * signal driven in the domain (except reset-less ones) is loaded with its initial value.
 */
public class ResetInserter extends ControlInserter {
  public ResetInserter(Object control) { this(Map.of("sync", control)); }

  public ResetInserter(Map<String, ?> controls) { super(controls, SrcLoc.capture()); }

  @Override
  protected List<Statement> insertControl(List<Statement> stmts, Value control, Set<Signal> driven) {
    List<Statement> resets = new ArrayList<>();
    for (Signal signal : driven)
      if (!signal.isResetLess())
        resets.add(signal.assign(new Const(signal.getInit(), signal.shape())));
    // Appended last so that it takes priority over every other assignment.
    stmts.add(new Switch(control, List.of(new Switch.Case(List.of("1"), resets, srcLoc)), srcLoc));
    return stmts;
  }
}
