package hdlnet.netlist;

import hdlnet.ast.Assign;
import hdlnet.ast.ClockSignal;
import hdlnet.ast.Concat;
import hdlnet.ast.Const;
import hdlnet.ast.Format;
import hdlnet.ast.Operator;
import hdlnet.ast.Part;
import hdlnet.ast.Print;
import hdlnet.ast.Property;
import hdlnet.ast.ResetSignal;
import hdlnet.ast.Shape;
import hdlnet.ast.Signal;
import hdlnet.ast.Slice;
import hdlnet.ast.SrcLoc;
import hdlnet.ast.Statement;
import hdlnet.ast.Switch;
import hdlnet.ast.SwitchValue;
import hdlnet.ast.Value;
import hdlnet.error.DriverConflictException;
import hdlnet.error.HdlSyntaxError;
import hdlnet.ir.ClockDomain;
import hdlnet.ir.Design;
import hdlnet.ir.Fragment;
import hdlnet.ir.IOBufferInstance;
import hdlnet.ir.Instance;
import hdlnet.ir.MemoryInstance;
import hdlnet.ir.PortDirection;
import hdlnet.netlist.cell.Assignment;
import hdlnet.netlist.cell.AssignmentListCell;
import hdlnet.netlist.cell.AsyncReadPortCell;
import hdlnet.netlist.cell.Cell;
import hdlnet.netlist.cell.FlipFlopCell;
import hdlnet.netlist.cell.IOBufferCell;
import hdlnet.netlist.cell.InstanceCell;
import hdlnet.netlist.cell.MatchesCell;
import hdlnet.netlist.cell.MemoryCell;
import hdlnet.netlist.cell.NetFormat;
import hdlnet.netlist.cell.OperatorCell;
import hdlnet.netlist.cell.PartCell;
import hdlnet.netlist.cell.PrintCell;
import hdlnet.netlist.cell.PriorityMatchCell;
import hdlnet.netlist.cell.PropertyCell;
import hdlnet.netlist.cell.SyncReadPortCell;
import hdlnet.netlist.cell.SyncWritePortCell;
import hdlnet.netlist.cell.Top;
import hdlnet.netlist.cell.Top.PortRange;
import hdlnet.util.IdentityKey;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers the statements of a prepared design into netlist cells.
 * <p>
 * Right-hand sides are compiled into operator and decision cells, cached per expression node.
 * Assignments are not emitted directly: they are collected per signal into {@link NetlistDriver}s,
 * which become assignment lists and flip-flops once the whole tree has been visited.
 * Signals are referenced through late nets until then.
 */
public class NetlistEmitter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A compiled right-hand side and whether it is to be interpreted as signed. */
  record Emitted(NetValue value, boolean signed) {}

  private record Unified(NetValue a, NetValue b, boolean signed) {}

  private final Netlist netlist;
  private final Design design;
  private final LinkedHashMap<Signal, NetlistDriver> drivers = new LinkedHashMap<>();
  private final Map<IdentityKey<Value>, Emitted> rhsCache = new HashMap<>();
  private final Map<Net, SrcLoc> connectSrcLoc = new HashMap<>();
  private final Map<Fragment, Integer> moduleOfFragment = new IdentityHashMap<>();

  public NetlistEmitter(Netlist netlist, Design design) {
    this.netlist = netlist;
    this.design = design;
  }

  public Netlist getNetlist() { return netlist; }

  /** The module each non-leaf fragment was emitted into. */
  public Map<Fragment, Integer> getModuleOfFragment() { return moduleOfFragment; }

  /** Emits the whole design, including drivers and top-level ports. Undriven signal bits stay unconnected. */
  public void emit() {
    Fragment root = design.getFragment();
    if (root.isLeaf())
      throw new HdlSyntaxError("The top-level fragment cannot be " + root.getClass().getSimpleName(), root.getSrcLoc());
    emitFragment(root, null);
    emitDrivers();
    emitTopPorts();
    logger.debug("Emitted {} cells in {} modules for design '{}'", netlist.getCells().size(), netlist.getModules().size(),
                 String.join(".", design.getHierarchy()));
  }

  //// Signals and connections ////

  NetValue emitSignal(Signal signal) {
    NetValue value = netlist.getSignalValue(signal);
    if (value != null)
      return value;
    return netlist.allocLateValue(signal);
  }

  /** The nets driven through an assignable value, for instance outputs, read port data and IO buffers. */
  private NetValue emitLhs(Value value) {
    if (value instanceof Signal)
      return emitSignal((Signal)value);
    if (value instanceof Concat) {
      NetValue result = NetValue.EMPTY;
      for (Value part : ((Concat)value).getParts())
        result = result.concat(emitLhs(part));
      return result;
    }
    if (value instanceof Slice) {
      Slice slice = (Slice)value;
      return emitLhs(slice.getBase()).slice(slice.getStart(), slice.getStop());
    }
    if (value instanceof Operator && (((Operator)value).getOperator().equals("u") || ((Operator)value).getOperator().equals("s")))
      return emitLhs(value.operands().get(0));
    throw new HdlSyntaxError("Value " + value + " cannot be connected to a port", value.getSrcLoc());
  }

  private void connect(NetValue lhs, NetValue rhs, SrcLoc srcLoc) {
    if (lhs.size() != rhs.size())
      throw new IllegalStateException("Cannot connect " + rhs.size() + " nets to " + lhs.size() + " nets");
    for (int i = 0; i < lhs.size(); ++i) {
      Net left = lhs.get(i);
      if (netlist.isConnected(left)) {
        Netlist.SignalBit signalBit = netlist.getLateToSignal().get(left);
        SrcLoc other = connectSrcLoc.get(left);
        throw new DriverConflictException("Bit " + signalBit.bit() + " of signal " + signalBit.signal() + " has multiple drivers: " + other +
                                              " and " + srcLoc,
                                          srcLoc, other);
      }
      netlist.connect(left, rhs.get(i));
      connectSrcLoc.put(left, srcLoc);
    }
  }

  //// Right-hand sides ////

  static NetValue extend(NetValue value, boolean signed, int width) {
    List<Net> nets = new ArrayList<>(value.nets());
    while (nets.size() < width)
      nets.add(signed ? nets.get(nets.size() - 1) : Net.ZERO);
    return NetValue.of(nets);
  }

  private NetValue emitOperator(int module, String operator, SrcLoc srcLoc, NetValue... inputs) {
    OperatorCell cell = new OperatorCell(module, operator, List.of(inputs), srcLoc);
    return netlist.addValueCell(cell.getWidth(), cell);
  }

  private static Unified unifyBitwise(Emitted a, Emitted b) {
    int widthA = a.value().size(), widthB = b.value().size();
    int width;
    if (a.signed() == b.signed())
      width = Math.max(widthA, widthB);
    else if (a.signed())
      width = Math.max(widthA, widthB + 1);
    else
      width = Math.max(widthA + 1, widthB);
    return new Unified(extend(a.value(), a.signed(), width), extend(b.value(), b.signed(), width), a.signed() || b.signed());
  }

  Emitted emitRhs(int module, Value value) {
    IdentityKey<Value> key = new IdentityKey<>(value);
    Emitted cached = rhsCache.get(key);
    if (cached != null)
      return cached;

    Emitted result;
    if (value instanceof Const) {
      Const constant = (Const)value;
      result = new Emitted(NetValue.fromConst(constant.getValue(), constant.width()), constant.shape().isSigned());
    } else if (value instanceof Signal) {
      result = new Emitted(emitSignal((Signal)value), value.shape().isSigned());
    } else if (value instanceof Operator) {
      result = emitOperatorRhs(module, (Operator)value);
    } else if (value instanceof Slice) {
      Slice slice = (Slice)value;
      NetValue inner = emitRhs(module, slice.getBase()).value();
      result = new Emitted(inner.slice(slice.getStart(), slice.getStop()), false);
    } else if (value instanceof Part) {
      Part part = (Part)value;
      Emitted inner = emitRhs(module, part.getBase());
      Emitted offset = emitRhs(module, part.getOffset());
      PartCell cell = new PartCell(module, inner.value(), inner.signed(), offset.value(), part.width(), part.getStride(), part.getSrcLoc());
      result = new Emitted(netlist.addValueCell(part.width(), cell), false);
    } else if (value instanceof Concat) {
      NetValue nets = NetValue.EMPTY;
      for (Value item : ((Concat)value).getParts())
        nets = nets.concat(emitRhs(module, item).value());
      result = new Emitted(nets, false);
    } else if (value instanceof SwitchValue) {
      result = emitSwitchValue(module, (SwitchValue)value);
    } else if (value instanceof ClockSignal || value instanceof ResetSignal) {
      throw new IllegalStateException("Domain placeholder " + value + " was not lowered before emission");
    } else {
      throw new IllegalStateException("Cannot emit value " + value);
    }
    if (result.value().size() != value.width())
      throw new IllegalStateException("Value " + value + " with shape " + value.shape() + " was emitted with width " + result.value().size());
    rhsCache.put(key, result);
    return result;
  }

  private Emitted emitOperatorRhs(int module, Operator op) {
    String operator = op.getOperator();
    List<Value> operands = op.operands();
    SrcLoc loc = op.getSrcLoc();
    if (operands.size() == 1) {
      Emitted a = emitRhs(module, operands.get(0));
      switch (operator) {
      case "s":
        return new Emitted(a.value(), true);
      case "u":
        return new Emitted(a.value(), false);
      case "+":
        return a;
      case "-":
        return new Emitted(emitOperator(module, "-", loc, extend(a.value(), a.signed(), a.value().size() + 1)), true);
      case "~":
        return new Emitted(emitOperator(module, "~", loc, a.value()), a.signed());
      case "b":
      case "r|":
      case "r&":
      case "r^":
        return new Emitted(emitOperator(module, operator, loc, a.value()), false);
      default:
        throw new IllegalStateException("Unknown unary operator '" + operator + "'");
      }
    }
    if (operands.size() == 2) {
      Emitted a = emitRhs(module, operands.get(0));
      Emitted b = emitRhs(module, operands.get(1));
      switch (operator) {
      case "|":
      case "&":
      case "^": {
        Unified u = unifyBitwise(a, b);
        return new Emitted(emitOperator(module, operator, loc, u.a(), u.b()), u.signed());
      }
      case "+":
      case "-": {
        Unified u = unifyBitwise(a, b);
        int width = u.a().size() + 1;
        NetValue result = emitOperator(module, operator, loc, extend(u.a(), u.signed(), width), extend(u.b(), u.signed(), width));
        return new Emitted(result, operator.equals("-") || u.signed());
      }
      case "*": {
        int width = a.value().size() + b.value().size();
        NetValue result = emitOperator(module, "*", loc, extend(a.value(), a.signed(), width), extend(b.value(), b.signed(), width));
        return new Emitted(result, a.signed() || b.signed());
      }
      case "//": {
        int width = a.value().size() + (b.signed() ? 1 : 0);
        Unified u = unifyBitwise(a, b);
        NetValue opA = u.a(), opB = u.b();
        if (opA.size() < width) {
          opA = extend(opA, u.signed(), width);
          opB = extend(opB, u.signed(), width);
        }
        NetValue result = emitOperator(module, u.signed() ? "s//" : "u//", loc, opA, opB);
        return new Emitted(result.slice(0, width), u.signed());
      }
      case "%": {
        int width = b.value().size();
        Unified u = unifyBitwise(a, b);
        NetValue result = emitOperator(module, u.signed() ? "s%" : "u%", loc, u.a(), u.b());
        return new Emitted(result.slice(0, width), b.signed());
      }
      case "<<": {
        // The shifted operand is widened to hold the largest possible shift.
        NetValue opA = extend(a.value(), a.signed(), op.width());
        return new Emitted(emitOperator(module, "<<", loc, opA, b.value()), a.signed());
      }
      case ">>":
        return new Emitted(emitOperator(module, a.signed() ? "s>>" : "u>>", loc, a.value(), b.value()), a.signed());
      case "==":
      case "!=": {
        Unified u = unifyBitwise(a, b);
        return new Emitted(emitOperator(module, operator, loc, u.a(), u.b()), false);
      }
      case "<":
      case ">":
      case "<=":
      case ">=": {
        Unified u = unifyBitwise(a, b);
        return new Emitted(emitOperator(module, (u.signed() ? "s" : "u") + operator, loc, u.a(), u.b()), false);
      }
      default:
        throw new IllegalStateException("Unknown binary operator '" + operator + "'");
      }
    }
    if (operands.size() == 3 && operator.equals("m")) {
      NetValue sel = emitRhs(module, operands.get(0)).value();
      Emitted a = emitRhs(module, operands.get(1));
      Emitted b = emitRhs(module, operands.get(2));
      if (sel.size() != 1)
        sel = emitOperator(module, "b", loc, sel);
      Unified u = unifyBitwise(a, b);
      return new Emitted(emitOperator(module, "m", loc, sel, u.a(), u.b()), u.signed());
    }
    throw new IllegalStateException("Unknown operator '" + operator + "' with " + operands.size() + " operands");
  }

  /** The condition net for one case: constant 1 for the default, constant 0 if no pattern is left. */
  private Net emitCaseCondition(int module, NetValue test, List<String> patterns, SrcLoc srcLoc) {
    if (patterns == null)
      return Net.ONE;
    if (patterns.isEmpty())
      return Net.ZERO;
    for (String pattern : patterns)
      if (pattern.length() != test.size())
        throw new IllegalStateException("Pattern '" + pattern + "' does not match the test width " + test.size());
    return netlist.addValueCell(1, new MatchesCell(module, test, patterns, srcLoc)).get(0);
  }

  private Emitted emitSwitchValue(int module, SwitchValue value) {
    Shape shape = value.shape();
    int width = shape.getWidth();
    List<SwitchValue.Case> cases = value.getCases();
    SrcLoc loc = value.getSrcLoc();
    NetValue test = emitRhs(module, value.getTest()).value();
    List<NetValue> values = new ArrayList<>();
    for (SwitchValue.Case c : cases) {
      Emitted emitted = emitRhs(module, c.value());
      values.add(extend(emitted.value(), emitted.signed(), width));
    }
    if (cases.isEmpty())
      return new Emitted(NetValue.zeros(width), shape.isSigned());

    // A selection between a single exact pattern and the default is a plain multiplexer.
    if (cases.size() == 2 && cases.get(1).patterns() == null && cases.get(0).patterns() != null &&
        cases.get(0).patterns().size() == 1 && !test.nets().isEmpty() && !cases.get(0).patterns().get(0).contains("-")) {
      String pattern = cases.get(0).patterns().get(0);
      NetValue onMatch = values.get(0), otherwise = values.get(1);
      NetValue sel;
      if (test.size() == 1) {
        sel = test;
        if (pattern.equals("0")) {
          onMatch = values.get(1);
          otherwise = values.get(0);
        }
      } else {
        sel = emitOperator(module, "==", loc, test, NetValue.fromConst(new BigInteger(pattern, 2), pattern.length()));
      }
      return new Emitted(emitOperator(module, "m", loc, sel, onMatch, otherwise), shape.isSigned());
    }

    List<Net> conds = new ArrayList<>();
    for (SwitchValue.Case c : cases)
      conds.add(emitCaseCondition(module, test, c.patterns(), loc));
    NetValue selected = netlist.addValueCell(conds.size(), new PriorityMatchCell(module, Net.ONE, NetValue.of(conds), loc));
    List<Assignment> assignments = new ArrayList<>();
    for (int i = 0; i < cases.size(); ++i)
      assignments.add(new Assignment(selected.get(i), 0, values.get(i), loc));
    AssignmentListCell cell = new AssignmentListCell(module, NetValue.zeros(width), assignments, loc);
    return new Emitted(netlist.addValueCell(width, cell), shape.isSigned());
  }

  //// Assignments ////

  private static String moduleName(NetlistModule module) {
    return module.getName().isEmpty() ? "<toplevel>" : String.join(".", module.getName());
  }

  /** Assigns {@code rhs} to {@code lhs[lhsStart:lhsStart+rhs.size()]} under {@code cond}. */
  private void emitAssign(int module, ClockDomain domain, Value lhs, int lhsStart, NetValue rhs, Net cond, SrcLoc srcLoc) {
    if (lhs instanceof Signal) {
      Signal signal = (Signal)lhs;
      NetlistDriver driver = drivers.get(signal);
      if (driver == null) {
        driver = new NetlistDriver(module, signal, domain, srcLoc);
        drivers.put(signal, driver);
      } else if (driver.getDomain() != domain) {
        String domainName = domain == null ? "comb" : domain.getName();
        throw new DriverConflictException("Signal " + signal + " driven from domain " + domainName + " at " + srcLoc + " and domain " +
                                              driver.getDomainName() + " at " + driver.getSrcLoc(),
                                          srcLoc, driver.getSrcLoc());
      } else if (driver.getModule() != module) {
        throw new DriverConflictException("Signal " + signal + " driven from module " + moduleName(netlist.getModule(module)) + " at " +
                                              srcLoc + " and module " + moduleName(netlist.getModule(driver.getModule())) + " at " +
                                              driver.getSrcLoc(),
                                          srcLoc, driver.getSrcLoc());
      }
      driver.addAssignment(new Assignment(cond, lhsStart, rhs, srcLoc));
    } else if (lhs instanceof Slice) {
      Slice slice = (Slice)lhs;
      emitAssign(module, domain, slice.getBase(), lhsStart + slice.getStart(), rhs, cond, srcLoc);
    } else if (lhs instanceof Concat) {
      int partStop = 0;
      for (Value part : ((Concat)lhs).getParts()) {
        int partStart = partStop;
        partStop = partStart + part.width();
        if (lhsStart >= partStop || lhsStart + rhs.size() <= partStart)
          continue;
        int partLhsStart, partRhsStart, partRhsStop;
        if (lhsStart < partStart) {
          partLhsStart = 0;
          partRhsStart = partStart - lhsStart;
        } else {
          partLhsStart = lhsStart - partStart;
          partRhsStart = 0;
        }
        if (lhsStart + rhs.size() >= partStop)
          partRhsStop = partStop - lhsStart;
        else
          partRhsStop = rhs.size();
        emitAssign(module, domain, part, partLhsStart, rhs.slice(partRhsStart, partRhsStop), cond, srcLoc);
      }
    } else if (lhs instanceof Part) {
      Part part = (Part)lhs;
      NetValue offset = emitRhs(module, part.getOffset()).value();
      int width = part.getBase().width();
      int stride = part.getStride();
      if (offset.size() == 0) {
        // The only reachable offset is zero.
        if (lhsStart < width) {
          NetValue subRhs = lhsStart + rhs.size() > width ? rhs.slice(0, width - lhsStart) : rhs;
          emitAssign(module, domain, part.getBase(), lhsStart, subRhs, cond, srcLoc);
        }
        return;
      }
      long reachable = offset.size() >= 31 ? Long.MAX_VALUE : 1L << offset.size();
      int numCases = (int)Math.min((width + stride - 1) / stride, reachable);
      List<Net> conds = new ArrayList<>();
      for (int index = 0; index < numCases; ++index) {
        String binary = Integer.toBinaryString(index);
        String pattern = "0".repeat(Math.max(0, offset.size() - binary.length())) + binary;
        conds.add(netlist.addValueCell(1, new MatchesCell(module, offset, List.of(pattern), part.getSrcLoc())).get(0));
      }
      NetValue selected = netlist.addValueCell(conds.size(), new PriorityMatchCell(module, cond, NetValue.of(conds), part.getSrcLoc()));
      for (int index = 0; index < selected.size(); ++index) {
        int start = lhsStart + index * stride;
        if (start >= width)
          continue;
        NetValue subRhs = start + rhs.size() >= width ? rhs.slice(0, width - start) : rhs;
        emitAssign(module, domain, part.getBase(), start, subRhs, selected.get(index), srcLoc);
      }
    } else if (lhs instanceof Operator && (((Operator)lhs).getOperator().equals("u") || ((Operator)lhs).getOperator().equals("s"))) {
      emitAssign(module, domain, lhs.operands().get(0), lhsStart, rhs, cond, srcLoc);
    } else if (lhs instanceof SwitchValue) {
      SwitchValue switchValue = (SwitchValue)lhs;
      NetValue test = emitRhs(module, switchValue.getTest()).value();
      List<Net> conds = new ArrayList<>();
      for (SwitchValue.Case c : switchValue.getCases())
        conds.add(emitCaseCondition(module, test, c.patterns(), lhs.getSrcLoc()));
      NetValue selected = netlist.addValueCell(conds.size(), new PriorityMatchCell(module, cond, NetValue.of(conds), lhs.getSrcLoc()));
      for (int index = 0; index < selected.size(); ++index) {
        Value target = switchValue.getCases().get(index).value();
        NetValue subRhs = rhs.size() > target.width() ? rhs.slice(0, target.width()) : rhs;
        emitAssign(module, domain, target, lhsStart, subRhs, selected.get(index), srcLoc);
      }
    } else {
      throw new HdlSyntaxError("Value " + lhs + " cannot be assigned to", srcLoc);
    }
  }

  //// Statements ////

  /** A one-bit enable that is set exactly when {@code cond} is set. */
  private Net emitEnable(int module, Net cond, SrcLoc srcLoc) {
    AssignmentListCell cell = new AssignmentListCell(module, NetValue.zeros(1), List.of(new Assignment(cond, 0, NetValue.ones(1), srcLoc)), srcLoc);
    return netlist.addValueCell(1, cell).get(0);
  }

  private NetFormat emitFormat(int module, Format format) {
    List<Object> chunks = new ArrayList<>();
    for (Object chunk : format.getChunks()) {
      if (chunk instanceof Format.Field) {
        Format.Field field = (Format.Field)chunk;
        Emitted emitted = emitRhs(module, field.value());
        chunks.add(new NetFormat.FormatValue(emitted.value(), field.spec(), emitted.signed()));
      } else {
        chunks.add(chunk);
      }
    }
    return new NetFormat(chunks);
  }

  private void emitStmt(int module, Fragment fragment, String domainName, Statement stmt, Net cond) {
    ClockDomain domain = domainName.equals("comb") ? null : fragment.getDomains().get(domainName);
    if (stmt instanceof Assign) {
      Assign assign = (Assign)stmt;
      Emitted rhs = emitRhs(module, assign.getRhs());
      int width = assign.getLhs().width();
      NetValue value = rhs.value();
      if (value.size() > width)
        value = value.slice(0, width);
      if (value.size() < width)
        value = extend(value, rhs.signed(), width);
      emitAssign(module, domain, assign.getLhs(), 0, value, cond, stmt.getSrcLoc());
    } else if (stmt instanceof Property) {
      Property property = (Property)stmt;
      NetValue test = emitRhs(module, property.getTest()).value();
      if (test.size() != 1)
        test = emitOperator(module, "b", stmt.getSrcLoc(), test);
      Net en = emitEnable(module, cond, stmt.getSrcLoc());
      NetFormat message = property.getMessage() == null ? null : emitFormat(module, property.getMessage());
      Cell cell;
      if (domain == null)
        cell = new PropertyCell(module, property.getKind(), test.get(0), en, null, null, message, stmt.getSrcLoc());
      else
        cell = new PropertyCell(module, property.getKind(), test.get(0), en, emitSignal(domain.getClk()).get(0), domain.getClkEdge(), message,
                                stmt.getSrcLoc());
      netlist.addCell(cell);
    } else if (stmt instanceof Print) {
      Net en = emitEnable(module, cond, stmt.getSrcLoc());
      NetFormat format = emitFormat(module, ((Print)stmt).getFormat());
      if (domain == null)
        netlist.addCell(new PrintCell(module, en, format, stmt.getSrcLoc()));
      else
        netlist.addCell(new PrintCell(module, en, emitSignal(domain.getClk()).get(0), domain.getClkEdge(), format, stmt.getSrcLoc()));
    } else if (stmt instanceof Switch) {
      Switch sw = (Switch)stmt;
      NetValue test = emitRhs(module, sw.getTest()).value();
      List<Net> conds = new ArrayList<>();
      for (Switch.Case c : sw.getCases())
        conds.add(emitCaseCondition(module, test, c.patterns(), c.srcLoc()));
      NetValue selected = netlist.addValueCell(conds.size(), new PriorityMatchCell(module, cond, NetValue.of(conds), stmt.getSrcLoc()));
      for (int i = 0; i < sw.getCases().size(); ++i)
        for (Statement substmt : sw.getCases().get(i).body())
          emitStmt(module, fragment, domainName, substmt, selected.get(i));
    } else {
      throw new IllegalStateException("Statement " + stmt + " must be resolved before emission");
    }
  }

  //// Fragments ////

  private void emitFragment(Fragment fragment, Integer parentModule) {
    List<String> name = design.getFragmentName(fragment);
    if (fragment instanceof Instance) {
      emitInstance(parentModule, (Instance)fragment, name.get(name.size() - 1));
    } else if (fragment instanceof MemoryInstance) {
      MemoryInstance memory = (MemoryInstance)fragment;
      int memoryCell = emitMemory(parentModule, memory, name.get(name.size() - 1));
      List<Integer> writePorts = new ArrayList<>();
      for (MemoryInstance.WritePort port : memory.getWritePorts())
        writePorts.add(emitWritePort(parentModule, memory, port, memoryCell));
      for (MemoryInstance.ReadPort port : memory.getReadPorts())
        emitReadPort(parentModule, memory, port, memoryCell, writePorts);
    } else if (fragment instanceof IOBufferInstance) {
      emitIOBuffer(parentModule, (IOBufferInstance)fragment);
    } else if (fragment.isLeaf()) {
      throw new IllegalStateException("Cannot emit fragment of type " + fragment.getClass().getSimpleName());
    } else {
      int module = netlist.addModule(parentModule, name, fragment.getSrcLoc());
      moduleOfFragment.put(fragment, module);
      Map<Signal, String> signalNames = design.getSignalNames(fragment);
      netlist.getModule(module).setSignalNames(signalNames);
      for (Signal signal : signalNames.keySet())
        emitSignal(signal);
      for (Map.Entry<String, List<Statement>> entry : fragment.getStatements().entrySet())
        for (Statement stmt : entry.getValue())
          emitStmt(module, fragment, entry.getKey(), stmt, Net.ONE);
      for (Fragment.Subfragment sub : fragment.getSubfragments())
        emitFragment(sub.fragment(), module);
    }
  }

  private void emitInstance(int module, Instance instance, String name) {
    Map<String, NetValue> portsI = new LinkedHashMap<>();
    Map<String, PortRange> portsO = new LinkedHashMap<>();
    Map<String, NetValue> portsIO = new LinkedHashMap<>();
    List<NetValue> outputs = new ArrayList<>();
    List<Integer> outputStarts = new ArrayList<>();
    int nextOutputBit = 0;
    for (Map.Entry<String, Instance.InstancePort> entry : instance.getPorts().entrySet()) {
      Value value = entry.getValue().value();
      switch (entry.getValue().direction()) {
      case INPUT:
        portsI.put(entry.getKey(), emitRhs(module, value).value());
        break;
      case OUTPUT: {
        NetValue nets = emitLhs(value);
        portsO.put(entry.getKey(), new PortRange(nextOutputBit, nets.size()));
        outputs.add(nets);
        outputStarts.add(nextOutputBit);
        nextOutputBit += nets.size();
        break;
      }
      case INOUT:
        portsIO.put(entry.getKey(), emitLhs(value));
        break;
      default:
        throw new IllegalStateException("Unknown port direction " + entry.getValue().direction());
      }
    }
    InstanceCell cell = new InstanceCell(module, instance.getType(), name, instance.getParameters(), instance.getAttrs(), portsI, portsO,
                                         portsIO, instance.getSrcLoc());
    NetValue outputNets = netlist.addValueCell(nextOutputBit, cell);
    for (int i = 0; i < outputs.size(); ++i) {
      int start = outputStarts.get(i);
      connect(outputs.get(i), outputNets.slice(start, start + outputs.get(i).size()), instance.getSrcLoc());
    }
  }

  private void emitIOBuffer(int module, IOBufferInstance buffer) {
    NetValue pad = emitLhs(buffer.getPad());
    NetValue o = emitRhs(module, buffer.getO()).value();
    Net oe = emitRhs(module, buffer.getOe()).value().get(0);
    NetValue value = netlist.addValueCell(pad.size(), new IOBufferCell(module, pad, o, oe, buffer.getSrcLoc()));
    if (buffer.getI() != null)
      connect(emitLhs(buffer.getI()), value, buffer.getSrcLoc());
  }

  private int emitMemory(int module, MemoryInstance memory, String name) {
    return netlist.addCell(new MemoryCell(module, name, memory.getWidth(), memory.getDepth(), memory.getInit(), memory.getAttrs(),
                                          memory.getSrcLoc()));
  }

  private int emitWritePort(int module, MemoryInstance memory, MemoryInstance.WritePort port, int memoryCell) {
    NetValue data = emitRhs(module, port.data()).value();
    NetValue addr = emitRhs(module, port.addr()).value();
    NetValue en = emitRhs(module, port.en()).value();
    int granularity = port.granularity();
    List<Net> enBits = new ArrayList<>();
    for (int bit = 0; bit < data.size(); ++bit)
      enBits.add(en.get(bit / granularity));
    ClockDomain domain = memory.getDomains().get(port.domain());
    Net clk = emitSignal(domain.getClk()).get(0);
    return netlist.addCell(new SyncWritePortCell(module, memoryCell, data, addr, NetValue.of(enBits), clk, domain.getClkEdge(),
                                                 port.data().getSrcLoc()));
  }

  private void emitReadPort(int module, MemoryInstance memory, MemoryInstance.ReadPort port, int memoryCell, List<Integer> writePorts) {
    NetValue addr = emitRhs(module, port.addr()).value();
    int width = port.data().width();
    Cell cell;
    if (port.domain().equals("comb")) {
      cell = new AsyncReadPortCell(module, memoryCell, width, addr, port.data().getSrcLoc());
    } else {
      Net en = emitRhs(module, port.en()).value().get(0);
      ClockDomain domain = memory.getDomains().get(port.domain());
      Net clk = emitSignal(domain.getClk()).get(0);
      List<Integer> transparentFor = port.transparentFor().stream().map(writePorts::get).toList();
      cell = new SyncReadPortCell(module, memoryCell, width, addr, en, clk, domain.getClkEdge(), transparentFor, port.data().getSrcLoc());
    }
    NetValue data = netlist.addValueCell(width, cell);
    connect(emitLhs(port.data()), data, port.data().getSrcLoc());
  }

  //// Drivers and ports ////

  private void emitDrivers() {
    for (NetlistDriver driver : drivers.values()) {
      ClockDomain domain = driver.getDomain();
      Signal signal = driver.getSignal();
      int module = driver.getModule();
      if (domain != null && domain.getRst() != null && !domain.isAsyncReset() && !signal.isResetLess()) {
        Signal rst = domain.getRst();
        Net match = netlist.addValueCell(1, new MatchesCell(module, emitSignal(rst), List.of("1"), rst.getSrcLoc())).get(0);
        Net reset = netlist.addValueCell(1, new PriorityMatchCell(module, Net.ONE, NetValue.of(match), rst.getSrcLoc())).get(0);
        driver.addAssignment(new Assignment(reset, 0, NetValue.fromConst(signal.getInit(), signal.width()), signal.getSrcLoc()));
      }
      NetValue value = driver.emitValue(this);
      if (domain != null) {
        Net clk = emitSignal(domain.getClk()).get(0);
        Net arst = Net.ZERO;
        if (domain.getRst() != null && domain.isAsyncReset() && !signal.isResetLess())
          arst = emitSignal(domain.getRst()).get(0);
        FlipFlopCell cell = new FlipFlopCell(module, value, signal.getInit(), clk, domain.getClkEdge(), arst, signal.getAttrs(), signal.getSrcLoc());
        value = netlist.addValueCell(value.size(), cell);
      }
      SrcLoc srcLoc = driver.getAssignments().isEmpty() ? signal.getSrcLoc() : driver.getAssignments().get(0).srcLoc();
      connect(emitSignal(signal), value, srcLoc);
    }
  }

  private void emitTopPorts() {
    Set<Net> inouts = new LinkedHashSet<>();
    for (Cell cell : netlist.getCells())
      inouts.addAll(cell.ioNets());

    int nextInputBit = 2;
    Top top = netlist.getTop();
    for (Design.DesignPort port : design.getPorts()) {
      Signal signal = port.signal();
      NetValue signalValue = emitSignal(signal);
      PortDirection direction = port.direction();
      if (direction == null) {
        boolean driven = false, inout = false;
        for (Net net : signalValue) {
          driven |= netlist.isConnected(net);
          inout |= inouts.contains(net);
        }
        direction = driven ? PortDirection.OUTPUT : inout ? PortDirection.INOUT : PortDirection.INPUT;
        logger.trace("Inferred direction {} for port '{}'", direction.getSerialName(), port.name());
      }
      switch (direction) {
      case INPUT: {
        PortRange range = new PortRange(nextInputBit, signal.width());
        top.addInput(port.name(), range);
        nextInputBit += signal.width();
        connect(signalValue, top.valueOf(range), signal.getSrcLoc());
        break;
      }
      case OUTPUT:
        top.addOutput(port.name(), signalValue);
        break;
      case INOUT: {
        PortRange range = new PortRange(nextInputBit, signal.width());
        top.addInout(port.name(), range);
        nextInputBit += signal.width();
        connect(signalValue, top.valueOf(range), signal.getSrcLoc());
        break;
      }
      default:
        throw new IllegalStateException("Unknown port direction " + direction);
      }
    }
  }
}
