package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.Net;

/** A combinational dependency of a cell output bit on {@code source}. */
public record CombEdge(Net source, SrcLoc srcLoc) {}
