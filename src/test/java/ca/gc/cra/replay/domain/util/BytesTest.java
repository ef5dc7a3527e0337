package ca.gc.cra.replay.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BytesTest {
  private static final byte[] DATA = {(byte) 0x34, (byte) 0x12, (byte) 0xFF, (byte) 0xFF, (byte) 0x80};

  @Test
  void readsLittleEndianWidths() {
    assertEquals(0x34, Bytes.u8(DATA, 0));
    assertEquals(0x1234L, Bytes.uLe(DATA, 0, 2));
    assertEquals(0xFFFF1234L, Bytes.u32le(DATA, 0));
    assertEquals(0x80FFFFL, Bytes.uLe(DATA, 2, 3));
  }

  @Test
  void signedReadsSignExtend() {
    assertEquals(-1L, Bytes.sLe(DATA, 2, 2));
    assertEquals(0x1234L, Bytes.sLe(DATA, 0, 2));
    assertEquals(-128L, Bytes.sLe(DATA, 4, 1));
  }

  @Test
  void outOfBoundsReadsYieldZero() {
    assertEquals(0, Bytes.u8(DATA, 5));
    assertEquals(0L, Bytes.u32le(DATA, 2));
    assertEquals(0L, Bytes.uLe(null, 0, 1));
    assertThrows(IllegalArgumentException.class, () -> Bytes.uLe(DATA, 0, 9));
  }

  @Test
  void hasRemainingChecksRange() {
    assertTrue(Bytes.hasRemaining(DATA, 1, 4));
    assertFalse(Bytes.hasRemaining(DATA, 2, 4));
    assertFalse(Bytes.hasRemaining(DATA, -1, 1));
    assertFalse(Bytes.hasRemaining(DATA, 0, -1));
  }

  @Test
  void unsignedToDoubleHandlesHighBit() {
    assertEquals(42.0, Bytes.unsignedToDouble(42L));
    assertEquals(18446744073709551615.0, Bytes.unsignedToDouble(-1L));
  }
}
