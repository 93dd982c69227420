package hdlnet.ir;

import hdlnet.ast.Assign;
import hdlnet.ast.ClockSignal;
import hdlnet.ast.Concat;
import hdlnet.ast.Const;
import hdlnet.ast.Format;
import hdlnet.ast.LateBoundStatement;
import hdlnet.ast.Operator;
import hdlnet.ast.Part;
import hdlnet.ast.Print;
import hdlnet.ast.Property;
import hdlnet.ast.ResetSignal;
import hdlnet.ast.Signal;
import hdlnet.ast.Slice;
import hdlnet.ast.Statement;
import hdlnet.ast.Switch;
import hdlnet.ast.SwitchValue;
import hdlnet.ast.Value;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds expressions and statements bottom-up, replacing domain placeholders.
 * Unchanged subexpressions are returned as-is so that shared nodes stay shared.
 */
public abstract class ValueTransformer {
  private final Map<Value, Value> cache = new IdentityHashMap<>();

  protected Value onClockSignal(ClockSignal value) { return value; }
  protected Value onResetSignal(ResetSignal value) { return value; }

  public Value onValue(Value value) {
    Value cached = cache.get(value);
    if (cached != null)
      return cached;
    Value result = transform(value);
    cache.put(value, result);
    return result;
  }

  private Value transform(Value value) {
    if (value instanceof Const || value instanceof Signal)
      return value;
    if (value instanceof ClockSignal)
      return onClockSignal((ClockSignal)value);
    if (value instanceof ResetSignal)
      return onResetSignal((ResetSignal)value);
    List<Value> operands = value.operands();
    List<Value> newOperands = new ArrayList<>(operands.size());
    boolean changed = false;
    for (Value operand : operands) {
      Value newOperand = onValue(operand);
      changed |= newOperand != operand;
      newOperands.add(newOperand);
    }
    if (!changed)
      return value;
    if (value instanceof Operator)
      return new Operator(((Operator)value).getOperator(), newOperands, value.getSrcLoc());
    if (value instanceof Slice)
      return new Slice(newOperands.get(0), ((Slice)value).getStart(), ((Slice)value).getStop(), value.getSrcLoc());
    if (value instanceof Part) {
      Part part = (Part)value;
      return new Part(newOperands.get(0), newOperands.get(1), part.width(), part.getStride(), value.getSrcLoc());
    }
    if (value instanceof Concat)
      return new Concat(newOperands, value.getSrcLoc());
    if (value instanceof SwitchValue) {
      SwitchValue sv = (SwitchValue)value;
      List<SwitchValue.Case> cases = new ArrayList<>();
      for (int i = 0; i < sv.getCases().size(); ++i)
        cases.add(new SwitchValue.Case(sv.getCases().get(i).patterns(), newOperands.get(i + 1)));
      return new SwitchValue(newOperands.get(0), cases, value.getSrcLoc());
    }
    throw new IllegalStateException("Unknown value type " + value.getClass().getName());
  }

  public Format onFormat(Format format) { return format == null ? null : format.mapValues(this::onValue); }

  public Statement onStatement(Statement stmt) {
    if (stmt instanceof Assign) {
      Assign assign = (Assign)stmt;
      Value lhs = onValue(assign.getLhs());
      Value rhs = onValue(assign.getRhs());
      if (lhs == assign.getLhs() && rhs == assign.getRhs())
        return stmt;
      return new Assign(lhs, rhs, stmt.getSrcLoc());
    }
    if (stmt instanceof Print)
      return new Print(onFormat(((Print)stmt).getFormat()), stmt.getSrcLoc());
    if (stmt instanceof Property) {
      Property prop = (Property)stmt;
      return new Property(prop.getKind(), onValue(prop.getTest()), onFormat(prop.getMessage()), stmt.getSrcLoc());
    }
    if (stmt instanceof Switch) {
      Switch sw = (Switch)stmt;
      List<Switch.Case> cases = new ArrayList<>();
      for (Switch.Case c : sw.getCases())
        cases.add(new Switch.Case(c.patterns(), onStatements(c.body()), c.srcLoc()));
      return new Switch(onValue(sw.getTest()), cases, stmt.getSrcLoc());
    }
    if (stmt instanceof LateBoundStatement)
      throw new IllegalStateException("Unresolved statement " + stmt + " reached a transform");
    throw new IllegalStateException("Unknown statement type " + stmt.getClass().getName());
  }

  public List<Statement> onStatements(List<Statement> stmts) {
    List<Statement> result = new ArrayList<>(stmts.size());
    for (Statement stmt : stmts)
      result.add(onStatement(stmt));
    return result;
  }
}
