package hdlnet.ast;

import hdlnet.error.ShapeError;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An arithmetic, logic, comparison or selection operator.
 * <p>
 * Unary: {@code ~ - b r| r& r^ u s}. Binary: {@code + - * // % & | ^ << >> == != < <= > >=}.
 * Ternary: {@code m} (multiplexer, operands are selector, true value, false value).
 * The result shape is computed once, when the node is constructed.
 */
public final class Operator extends Value {
  private final String operator;
  private final List<Value> operands;
  private final Shape shape;

  public Operator(String operator, List<Value> operands, SrcLoc srcLoc) {
    super(srcLoc);
    this.operator = operator;
    this.operands = List.copyOf(operands);
    this.shape = computeShape();
  }

  public String getOperator() { return operator; }

  @Override
  public List<Value> operands() {
    return operands;
  }

  @Override
  public Shape shape() {
    return shape;
  }

  private Shape computeShape() {
    if (operands.size() == 1) {
      Shape a = operands.get(0).shape();
      switch (operator) {
      case "~":
        return a;
      case "-":
        return Shape.signed(a.getWidth() + 1);
      case "b":
      case "r|":
      case "r&":
      case "r^":
        return Shape.unsigned(1);
      case "u":
        return Shape.unsigned(a.getWidth());
      case "s":
        return Shape.signed(a.getWidth());
      default:
        break;
      }
    } else if (operands.size() == 2) {
      Shape a = operands.get(0).shape();
      Shape b = operands.get(1).shape();
      switch (operator) {
      case "+": {
        Shape unified = Shape.unify(a, b);
        return new Shape(unified.getWidth() + 1, unified.isSigned());
      }
      case "-":
        return Shape.signed(Shape.unify(a, b).getWidth() + 1);
      case "*":
        return new Shape(a.getWidth() + b.getWidth(), a.isSigned() || b.isSigned());
      case "//":
        return new Shape(a.getWidth() + (b.isSigned() ? 1 : 0), a.isSigned() || b.isSigned());
      case "%":
        return b;
      case "==":
      case "!=":
      case "<":
      case "<=":
      case ">":
      case ">=":
        return Shape.unsigned(1);
      case "&":
      case "|":
      case "^":
        return Shape.unify(a, b);
      case "<<": {
        requireUnsignedShift(b);
        if (b.getWidth() > 24)
          throw new ShapeError("Shift amount of width " + b.getWidth() + " is too wide", srcLoc);
        return new Shape(a.getWidth() + (1 << b.getWidth()) - 1, a.isSigned());
      }
      case ">>":
        requireUnsignedShift(b);
        return a;
      default:
        break;
      }
    } else if (operands.size() == 3 && operator.equals("m")) {
      return Shape.unify(operands.get(1).shape(), operands.get(2).shape());
    }
    throw new ShapeError("Unknown operator '" + operator + "' with " + operands.size() + " operands", srcLoc);
  }

  private void requireUnsignedShift(Shape amount) {
    if (amount.isSigned())
      throw new ShapeError("Shift amount must be unsigned", srcLoc);
  }

  @Override
  public boolean isAssignable() {
    return (operator.equals("u") || operator.equals("s")) && operands.get(0).isAssignable();
  }

  @Override
  protected void collectLhsSignals(Set<Signal> out) {
    if (isAssignable())
      operands.get(0).collectLhsSignals(out);
  }

  @Override
  public String toString() {
    return "(" + operator + " " + operands.stream().map(Object::toString).collect(Collectors.joining(" ")) + ")";
  }
}
