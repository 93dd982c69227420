package hdlnet.ast;

import hdlnet.error.HdlSyntaxError;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class FormatTest {

  @Test
  void testPlaceholders() {
    SignalArena arena = new SignalArena();
    Signal a = arena.signal(4, "a");
    Signal b = arena.signal(8, "b");
    Format format = Format.of("x={:04x} {{y}}={}", a, b);
    List<Object> chunks = format.getChunks();
    Assertions.assertEquals(4, chunks.size());
    Assertions.assertEquals("x=", chunks.get(0));
    Assertions.assertEquals(new Format.Field(a, "04x"), chunks.get(1));
    Assertions.assertEquals(" {y}=", chunks.get(2));
    Assertions.assertEquals("", ((Format.Field)chunks.get(3)).spec());
    Assertions.assertEquals(List.of(a, b), List.copyOf(format.rhsSignals()));
  }

  @Test
  void testMalformed() {
    Signal a = new SignalArena().signal(4, "a");
    Assertions.assertThrows(HdlSyntaxError.class, () -> Format.of("{", a));
    Assertions.assertThrows(HdlSyntaxError.class, () -> Format.of("{} {}", a));
    Assertions.assertThrows(HdlSyntaxError.class, () -> Format.of("}", a));
    Assertions.assertThrows(HdlSyntaxError.class, () -> Format.of("{:q}", a));
    Assertions.assertThrows(HdlSyntaxError.class, () -> Format.of("text", a));
  }

  @Test
  void testJoin() {
    Signal a = new SignalArena().signal(4, "a");
    Format format = Format.join(List.of("a:", a, "done"), " ", "\n");
    Assertions.assertEquals(3, format.getChunks().size());
    Assertions.assertEquals("a: ", format.getChunks().get(0));
    Assertions.assertEquals(" done\n", format.getChunks().get(2));
  }
}
