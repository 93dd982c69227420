package hdlnet.dsl;

import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.ast.SrcLoc;
import hdlnet.ast.Statement;
import hdlnet.error.HdlNameError;
import hdlnet.error.HdlSyntaxError;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handle to a finite state machine declared with {@link Module#beginFsm}.
 * <p>
 * States are numbered in order of first reference. When the FSM block closes, the numbering is
 * adjusted so that the initial state is encoded as 0.
 */
public class Fsm {
  private final SignalArena arena;
  private final String name;
  private final String init;
  private final String domain;
  private final SrcLoc srcLoc;

  final LinkedHashMap<String, Integer> encoding = new LinkedHashMap<>();
  final LinkedHashMap<String, Signal> ongoing = new LinkedHashMap<>();
  final LinkedHashMap<String, Map<String, List<Statement>>> states = new LinkedHashMap<>();
  final LinkedHashMap<String, SrcLoc> stateSrcLocs = new LinkedHashMap<>();
  private Signal state;

  Fsm(SignalArena arena, String name, String init, String domain, SrcLoc srcLoc) {
    this.arena = arena;
    this.name = name;
    this.init = init;
    this.domain = domain;
    this.srcLoc = srcLoc;
  }

  public String getName() { return name; }
  public String getDomain() { return domain; }
  /** The explicitly requested initial state, or null if the first defined state is initial. */
  public String getInit() { return init; }
  public SrcLoc getSrcLoc() { return srcLoc; }
  public boolean isClosed() { return state != null; }

  /** The state register. Only available once the FSM block is closed. */
  public Signal getState() {
    if (state == null)
      throw new HdlSyntaxError("The state signal of FSM '" + name + "' is only available after the FSM is closed", srcLoc);
    return state;
  }

  void setState(Signal state) { this.state = state; }

  public Map<String, Integer> getEncoding() { return Collections.unmodifiableMap(encoding); }

  public Map<Integer, String> getDecoding() {
    Map<Integer, String> decoding = new LinkedHashMap<>();
    encoding.forEach((stateName, enc) -> decoding.put(enc, stateName));
    return decoding;
  }

  /** Encoding of a state, allocating one for a forward reference. */
  int encode(String stateName) {
    Integer enc = encoding.get(stateName);
    if (enc == null) {
      if (isClosed())
        throw new HdlNameError("FSM state '" + stateName + "' is referenced but not defined", srcLoc);
      enc = encoding.size();
      encoding.put(stateName, enc);
      ongoing.put(stateName, arena.newSignal(1).name(name + "_ongoing_" + stateName).build());
    }
    return enc;
  }

  /** A one-bit signal that is set while the FSM is in the given state. */
  public Signal ongoing(String stateName) {
    encode(stateName);
    return ongoing.get(stateName);
  }

  /** Exchanges the encodings of two states. */
  void swapEncodings(String a, String b) {
    int encA = encoding.get(a);
    encoding.put(a, encoding.get(b));
    encoding.put(b, encA);
  }

  @Override
  public String toString() {
    return "(fsm " + name + ")";
  }
}
