package hdlnet.netlist.cell;

import hdlnet.ast.SrcLoc;
import hdlnet.netlist.NetValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/** A default value overridden by each applicable assignment in order; the last applicable one wins. */
public class AssignmentListCell extends Cell {
  private NetValue defaultValue;
  private final List<Assignment> assignments;

  public AssignmentListCell(int module, NetValue defaultValue, List<Assignment> assignments, SrcLoc srcLoc) {
    super(module, srcLoc);
    this.defaultValue = defaultValue;
    this.assignments = new ArrayList<>(assignments);
    for (Assignment assignment : assignments)
      if (assignment.stop() > defaultValue.size())
        throw new IllegalArgumentException("Assignment " + assignment + " exceeds width " + defaultValue.size());
  }

  public NetValue getDefault() { return defaultValue; }
  public List<Assignment> getAssignments() { return assignments; }

  @Override
  public int getWidth() {
    return defaultValue.size();
  }

  @Override
  protected List<NetValue> inputs() {
    List<NetValue> result = new ArrayList<>();
    result.add(defaultValue);
    for (Assignment assignment : assignments) {
      result.add(NetValue.of(assignment.cond()));
      result.add(assignment.value());
    }
    return result;
  }

  @Override
  public void resolveNets(UnaryOperator<NetValue> resolver) {
    defaultValue = resolver.apply(defaultValue);
    assignments.replaceAll(a -> new Assignment(resolver.apply(NetValue.of(a.cond())).get(0), a.start(), resolver.apply(a.value()), a.srcLoc()));
  }

  @Override
  public List<CombEdge> combEdgesTo(int bit) {
    List<CombEdge> result = new ArrayList<>();
    result.add(new CombEdge(defaultValue.get(bit), srcLoc));
    for (Assignment assignment : assignments) {
      if (bit >= assignment.start() && bit < assignment.stop()) {
        result.add(new CombEdge(assignment.cond(), assignment.srcLoc()));
        result.add(new CombEdge(assignment.value().get(bit - assignment.start()), assignment.srcLoc()));
      }
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(assignment_list ").append(defaultValue);
    for (Assignment assignment : assignments)
      sb.append(' ').append(assignment);
    return sb.append(')').toString();
  }
}
