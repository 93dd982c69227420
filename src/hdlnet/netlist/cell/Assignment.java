package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.Net;
import hdlnet.netlist.NetValue;

/** Overrides bits {@code [start, start + value.size())} of an assignment list when {@code cond} is set. */
public record Assignment(Net cond, int start, NetValue value, SrcLoc srcLoc) {
  public int stop() { return start + value.size(); }

  @Override
  public String toString() {
    return "(" + cond + " " + start + ":" + stop() + " " + value + ")";
  }
}
