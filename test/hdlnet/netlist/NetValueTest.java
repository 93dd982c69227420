package hdlnet.netlist;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class NetValueTest {
  @Test
  void testNetEncoding() {
    Net net = Net.fromCell(3, 7);
    Assertions.assertEquals((3L << 16) | 7, net.raw());
    Assertions.assertEquals(3, net.getCell());
    Assertions.assertEquals(7, net.getBit());
    Assertions.assertEquals("3.7", net.toString());
    Assertions.assertTrue(net.isCell());
    Assertions.assertFalse(net.isConst());

    Assertions.assertSame(Net.ONE, Net.fromConst(1));
    Assertions.assertEquals("0", Net.ZERO.toString());
    Assertions.assertEquals("(late -4)", Net.fromLate(-4).toString());
    Assertions.assertTrue(Net.fromLate(-4).isLate());
  }

  @Test
  void testInvalidNets() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> Net.fromCell(0, 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Net.fromCell(-1, 4));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Net.fromCell(1, 1 << 16));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Net.fromConst(2));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Net.fromLate(0));
    Assertions.assertThrows(IllegalStateException.class, () -> Net.ONE.getCell());
    Assertions.assertThrows(IllegalStateException.class, () -> Net.fromCell(2, 0).getConst());
  }

  @Test
  void testOrdering() {
    List<Net> sorted = List.of(Net.fromCell(2, 0), Net.fromLate(-1), Net.ONE, Net.fromCell(1, 5), Net.ZERO)
                           .stream()
                           .sorted()
                           .toList();
    Assertions.assertEquals(List.of(Net.fromLate(-1), Net.ZERO, Net.ONE, Net.fromCell(1, 5), Net.fromCell(2, 0)), sorted);
  }

  @Test
  void testConstValues() {
    Assertions.assertEquals("4'd5", NetValue.fromConst(5, 4).toString());
    Assertions.assertEquals("3'd7", NetValue.fromConst(-1, 3).toString());
    Assertions.assertEquals(NetValue.ones(3), NetValue.fromConst(BigInteger.valueOf(-1), 3));
    Assertions.assertTrue(NetValue.zeros(2).isConst());
    Assertions.assertEquals("()", NetValue.EMPTY.toString());
  }

  @Test
  void testCellRunsCoalesce() {
    NetValue value = NetValue.of(Net.fromCell(5, 0), Net.fromCell(5, 1), Net.fromCell(5, 2), Net.fromCell(5, 3));
    Assertions.assertEquals("5.0:4", value.toString());
    Assertions.assertEquals("5.1", value.slice(1, 2).toString());
    Assertions.assertEquals("(cat 5.0:4 1'd0)", value.concat(NetValue.zeros(1)).toString());
  }

  @Test
  void testMixedChunks() {
    NetValue value = NetValue.of(Net.fromCell(2, 3), Net.fromCell(2, 5), Net.ONE, Net.ONE, Net.fromLate(-8), Net.fromLate(-7));
    Assertions.assertEquals("(cat 2.3 2.5 2'd3 (late -8:-6))", value.toString());
    Assertions.assertFalse(value.isConst());
  }

  @Test
  void testMapAndEquality() {
    NetValue late = NetValue.of(Net.fromLate(-2), Net.fromLate(-1));
    NetValue resolved = late.map(net -> Net.fromCell(4, (int)(net.raw() + 2)));
    Assertions.assertEquals(NetValue.of(Net.fromCell(4, 0), Net.fromCell(4, 1)), resolved);
    Assertions.assertEquals(resolved.hashCode(), NetValue.of(List.of(Net.fromCell(4, 0), Net.fromCell(4, 1))).hashCode());
    Assertions.assertNotEquals(late, resolved);
  }
}
