package hdlnet.ui;

import hdlnet.ast.Signal;
import hdlnet.ast.SignalArena;
import hdlnet.dsl.Module;
import hdlnet.ir.PortSpec;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Small designs selectable from the command line.
 */
public final class DemoDesigns {
  /** A design together with the ports it is meant to be built with. */
  public record Demo(Object top, List<PortSpec> ports) {}

  private static final Map<String, Function<SignalArena, Demo>> demos = new TreeMap<>();
  static {
    demos.put("counter", DemoDesigns::counter);
    demos.put("decoder", DemoDesigns::decoder);
    demos.put("blinker", DemoDesigns::blinker);
  }

  private DemoDesigns() {}

  public static List<String> names() { return List.copyOf(demos.keySet()); }

  public static Demo create(String name, SignalArena arena) {
    Function<SignalArena, Demo> factory = demos.get(name);
    if (factory == null)
      throw new IllegalArgumentException("Unknown demo design '" + name + "', expected one of " + names());
    return factory.apply(arena);
  }

  /** 4-bit free running counter. */
  public static Demo counter(SignalArena arena) {
    Signal ctr = arena.signal(4, "ctr");
    Module m = new Module(arena);
    m.sync(ctr.assign(ctr.add(1)));
    return new Demo(m, List.of(PortSpec.of(ctr)));
  }

  /** Combinational 2-to-4 one-hot decoder with an enable. */
  public static Demo decoder(SignalArena arena) {
    Signal sel = arena.signal(2, "sel");
    Signal en = arena.signal(1, "en");
    Signal out = arena.signal(4, "out");
    Module m = new Module(arena);
    m.when(en, () -> m.switchOn(sel, () -> {
      for (int i = 0; i < 4; ++i) {
        final int idx = i;
        m.caseOf(idx, () -> m.comb(out.assign(1 << idx)));
      }
    }));
    return new Demo(m, List.of(PortSpec.input("sel", sel), PortSpec.input("en", en), PortSpec.output("out", out)));
  }

  /** Two-state machine toggling an LED each time a prescaler wraps. */
  public static Demo blinker(SignalArena arena) {
    Signal prescaler = arena.signal(8, "prescaler");
    Signal led = arena.signal(1, "led");
    Module m = new Module(arena);
    m.sync(prescaler.assign(prescaler.add(1)));
    m.fsm("OFF", "sync", "fsm", fsm -> {
      m.state("OFF", () -> {
        m.comb(led.assign(0));
        m.when(prescaler.all(), () -> m.next("ON"));
      });
      m.state("ON", () -> {
        m.comb(led.assign(1));
        m.when(prescaler.all(), () -> m.next("OFF"));
      });
    });
    return new Demo(m, List.of(PortSpec.output("led", led)));
  }
}
