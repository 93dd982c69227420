package hdlnet.dsl;

import hdlnet.ast.Assign;
import hdlnet.ast.Const;
import hdlnet.ast.LateBoundStatement;
import hdlnet.ast.SrcLoc;
import hdlnet.ast.Statement;
import hdlnet.error.HdlSyntaxError;

/** Transition to another FSM state. Resolves to an assignment of the state register once the FSM is closed. */
public class FsmNextStatement extends LateBoundStatement {
  private final Fsm fsm;
  private final String target;

  FsmNextStatement(Fsm fsm, String target, SrcLoc srcLoc) {
    super(srcLoc);
    this.fsm = fsm;
    this.target = target;
  }

  public String getTarget() { return target; }

  @Override
  public Statement resolve() {
    if (!fsm.isClosed())
      throw new HdlSyntaxError("Transition to '" + target + "' cannot be resolved before FSM '" + fsm.getName() + "' is closed", srcLoc);
    return new Assign(fsm.getState(), Const.of(fsm.getEncoding().get(target), fsm.getState().shape()), srcLoc);
  }

  @Override
  public String toString() {
    return "(next " + fsm.getName() + " " + target + ")";
  }
}
