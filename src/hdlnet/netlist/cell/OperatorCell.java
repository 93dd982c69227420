package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.NetValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * A pure combinational operator.
 * <p>
 * Operands are already extended to the widths the operator requires, and signedness is part of the
 * operator name where it matters ({@code u<}, {@code s//}, {@code s>>}, ...).
 */
public class OperatorCell extends Cell {
  private static final Set<String> SAME_WIDTH = Set.of("~", "-", "+", "*", "&", "^", "|", "u//", "s//", "u%", "s%", "<<", "u>>", "s>>");
  private static final Set<String> ONE_BIT = Set.of("b", "r&", "r^", "r|", "==", "!=", "u<", "s<", "u>", "s>", "u<=", "s<=", "u>=", "s>=");

  private final String operator;
  private final List<NetValue> operands;

  public OperatorCell(int module, String operator, List<NetValue> operands, SrcLoc srcLoc) {
    super(module, srcLoc);
    if (!SAME_WIDTH.contains(operator) && !ONE_BIT.contains(operator) && !operator.equals("m"))
      throw new IllegalArgumentException("Unknown netlist operator '" + operator + "'");
    this.operator = operator;
    this.operands = new ArrayList<>(operands);
  }

  public String getOperator() { return operator; }
  public List<NetValue> getOperands() { return operands; }

  @Override
  public int getWidth() {
    if (SAME_WIDTH.contains(operator))
      return operands.get(0).size();
    if (ONE_BIT.contains(operator))
      return 1;
    return operands.get(1).size();
  }

  @Override
  protected List<NetValue> inputs() {
    return operands;
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    operands.replaceAll(resolver);
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    if (operands.size() == 1) {
      if (operator.equals("~"))
        return edgesFrom(NetValue.of(operands.get(0).get(bit)));
      return edgesFrom(operands.get(0));
    }
    if (operands.size() == 2) {
      if (operator.equals("&") || operator.equals("|") || operator.equals("^"))
        return edgesFrom(NetValue.of(operands.get(0).get(bit), operands.get(1).get(bit)));
      return edgesFrom(operands.get(0), operands.get(1));
    }
    return edgesFrom(NetValue.of(operands.get(0).get(0), operands.get(1).get(bit), operands.get(2).get(bit)));
  }

  @Override
  public String getKindName() {
    return "operator " + operator;
  }

  @Override
  public String toString() {
    return "(" + operator + " " + operands.stream().map(NetValue::toString).collect(Collectors.joining(" ")) + ")";
  }
}
