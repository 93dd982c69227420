package hdlnet.netlist;

import hdlnet.ast.Signal;
import hdlnet.ast.SrcLoc;
import hdlnet.ir.ClockDomain;
import hdlnet.netlist.cell.Assignment;
import hdlnet.netlist.cell.AssignmentListCell;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the conditional assignments to one signal from one module and domain.
 * All of them become a single assignment list cell, followed by a flip-flop for clocked domains.
 */
class NetlistDriver {
  private final int module;
  private final Signal signal;
  private final ClockDomain domain;
  private final SrcLoc srcLoc;
  private final List<Assignment> assignments = new ArrayList<>();

  NetlistDriver(int module, Signal signal, ClockDomain domain, SrcLoc srcLoc) {
    this.module = module;
    this.signal = signal;
    this.domain = domain;
    this.srcLoc = srcLoc;
  }

  int getModule() { return module; }
  Signal getSignal() { return signal; }
  /** The clock domain, or null for combinational logic. */
  ClockDomain getDomain() { return domain; }
  SrcLoc getSrcLoc() { return srcLoc; }
  List<Assignment> getAssignments() { return Collections.unmodifiableList(assignments); }

  void addAssignment(Assignment assignment) { assignments.add(assignment); }

  String getDomainName() { return domain == null ? "comb" : domain.getName(); }

  /**
   * The value the signal takes before any clock edge: combinational signals default to their initial value,
   * registers hold their current value.
   */
  NetValue emitValue(NetlistEmitter emitter) {
    NetValue defaultValue;
    if (domain == null)
      defaultValue = NetValue.fromConst(signal.getInit(), signal.width());
    else
      defaultValue = emitter.emitSignal(signal);
    if (assignments.size() == 1) {
      Assignment assignment = assignments.get(0);
      if (assignment.cond().equals(Net.ONE) && assignment.start() == 0 && assignment.value().size() == defaultValue.size())
        return assignment.value();
    }
    AssignmentListCell cell = new AssignmentListCell(module, defaultValue, assignments, signal.getSrcLoc());
    return emitter.getNetlist().addValueCell(defaultValue.size(), cell);
  }
}
