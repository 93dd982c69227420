package hdlnet.ast;

import hdlnet.error.HdlSyntaxError;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A message with embedded values for {@link Print} and {@link Property}.
 * Templates use {@code {}} or {@code {:spec}} placeholders and {@code {{}}/{@code }}} escapes.
 */
public final class Format {
  /** A placeholder: a value and its format specifier, e.g. {@code 08x}. */
  public record Field(Value value, String spec) {}

  private static final Pattern SPEC = Pattern.compile("(.?[<>=^])?[-+ ]?#?0?[0-9]*[bodxXc]?");

  /** Either {@link String} or {@link Field}. */
  private final List<Object> chunks;

  private Format(List<Object> chunks) { this.chunks = List.copyOf(chunks); }

  public static Format of(String template, Object... args) {
    List<Object> chunks = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int nextArg = 0;
    for (int i = 0; i < template.length(); ++i) {
      char c = template.charAt(i);
      if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '{') {
        literal.append('{');
        ++i;
      } else if (c == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
        literal.append('}');
        ++i;
      } else if (c == '{') {
        int end = template.indexOf('}', i);
        if (end < 0)
          throw new HdlSyntaxError("Unterminated placeholder in format string '" + template + "'");
        String field = template.substring(i + 1, end);
        String spec = "";
        if (!field.isEmpty()) {
          if (!field.startsWith(":"))
            throw new HdlSyntaxError("Format placeholder '{" + field + "}' must be empty or start with ':'");
          spec = field.substring(1);
        }
        if (!SPEC.matcher(spec).matches())
          throw new HdlSyntaxError("Invalid format specifier '" + spec + "'");
        if (nextArg >= args.length)
          throw new HdlSyntaxError("Format string '" + template + "' has more placeholders than arguments");
        if (literal.length() > 0) {
          chunks.add(literal.toString());
          literal.setLength(0);
        }
        chunks.add(new Field(Value.cast(args[nextArg++]), spec));
        i = end;
      } else if (c == '}') {
        throw new HdlSyntaxError("Single '}' in format string '" + template + "'");
      } else {
        literal.append(c);
      }
    }
    if (nextArg != args.length)
      throw new HdlSyntaxError("Format string '" + template + "' has fewer placeholders than arguments");
    if (literal.length() > 0)
      chunks.add(literal.toString());
    return new Format(chunks);
  }

  /** Joins the printable representations of {@code args} with {@code sep} and appends {@code end}. */
  public static Format join(List<?> args, String sep, String end) {
    List<Object> chunks = new ArrayList<>();
    for (int i = 0; i < args.size(); ++i) {
      if (i > 0)
        chunks.add(sep);
      Object arg = args.get(i);
      if (arg instanceof Format)
        chunks.addAll(((Format)arg).chunks);
      else if (arg instanceof String)
        chunks.add(arg);
      else
        chunks.add(new Field(Value.cast(arg), ""));
    }
    chunks.add(end);
    return new Format(mergeStrings(chunks));
  }

  private static List<Object> mergeStrings(List<Object> chunks) {
    List<Object> result = new ArrayList<>();
    for (Object chunk : chunks) {
      if (chunk instanceof String && !result.isEmpty() && result.get(result.size() - 1) instanceof String)
        result.set(result.size() - 1, result.get(result.size() - 1) + (String)chunk);
      else if (!(chunk instanceof String && ((String)chunk).isEmpty()))
        result.add(chunk);
    }
    return result;
  }

  public List<Object> getChunks() { return chunks; }

  public Set<Signal> rhsSignals() {
    Set<Signal> result = new LinkedHashSet<>();
    for (Object chunk : chunks)
      if (chunk instanceof Field)
        result.addAll(((Field)chunk).value().rhsSignals());
    return result;
  }

  /** A copy with every field value replaced through {@code mapper}. */
  public Format mapValues(UnaryOperator<Value> mapper) {
    return new Format(chunks.stream()
                          .map(chunk -> chunk instanceof Field ? new Field(mapper.apply(((Field)chunk).value()), ((Field)chunk).spec()) : chunk)
                          .collect(Collectors.toList()));
  }

  @Override
  public String toString() {
    return "(format " +
        chunks.stream().map(chunk -> chunk instanceof String ? "'" + chunk + "'" : ((Field)chunk).value() + ":" + ((Field)chunk).spec())
            .collect(Collectors.joining(" ")) +
        ")";
  }
}
