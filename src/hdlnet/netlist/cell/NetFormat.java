package hdlnet.netlist.cell;

import hdlnet.netlist.NetValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/** A print or property message: literal strings interleaved with formatted net values. */
public final class NetFormat {
  /** A value to be printed according to a format specifier such as {@code 08x}. */
  public record FormatValue(NetValue value, String spec, boolean signed) {
    @Override
    public String toString() {
      return "(" + (signed ? "s" : "u") + " " + value + " " + Cell.quote(spec) + ")";
    }
  }

  /** Either {@link String} or {@link FormatValue}. */
  private final List<Object> chunks;

  public NetFormat(List<Object> chunks) {
    for (Object chunk : chunks)
      if (!(chunk instanceof String || chunk instanceof FormatValue))
        throw new IllegalArgumentException("Invalid format chunk " + chunk);
    this.chunks = List.copyOf(chunks);
  }

  public List<Object> getChunks() { return chunks; }

  List<NetValue> values() {
    List<NetValue> result = new ArrayList<>();
    for (Object chunk : chunks)
      if (chunk instanceof FormatValue)
        result.add(((FormatValue)chunk).value());
    return result;
  }

  NetFormat resolve(UnaryOperator<NetValue> resolver) {
    List<Object> result = new ArrayList<>();
    for (Object chunk : chunks) {
      if (chunk instanceof FormatValue) {
        FormatValue value = (FormatValue)chunk;
        result.add(new FormatValue(resolver.apply(value.value()), value.spec(), value.signed()));
      } else {
        result.add(chunk);
      }
    }
    return new NetFormat(result);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(format");
    for (Object chunk : chunks) {
      sb.append(' ');
      sb.append(chunk instanceof String ? Cell.quote((String)chunk) : chunk.toString());
    }
    return sb.append(')').toString();
  }
}
