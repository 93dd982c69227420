package hdlnet.ir;

import hdlnet.ast.SignalArena;

/**
 * Supplies a definition for a domain that is used but not defined anywhere in the design.
 * Returns a {@link ClockDomain}, an {@link Elaboratable} or {@link Fragment} that defines the domain, or null.
 */
@FunctionalInterface
public interface MissingDomainResolver {
  Object resolve(String domainName);

  /** Creates a plain positive-edge domain with synchronous reset for every missing name. */
  static MissingDomainResolver createDefault(SignalArena arena) {
    return name -> new ClockDomain(arena, name);
  }

  /** Rejects every missing domain. */
  static MissingDomainResolver none() {
    return name -> null;
  }
}
