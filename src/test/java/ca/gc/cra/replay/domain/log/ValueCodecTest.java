package ca.gc.cra.replay.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.replay.testutil.WpiLogFixtures;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ValueCodecTest {

  @Test
  void decodesScalars() {
    assertEquals("true", ValueCodec.decode(ValueType.BOOLEAN, new byte[] {2}));
    assertEquals("false", ValueCodec.decode(ValueType.BOOLEAN, new byte[] {0}));
    assertEquals("-2", ValueCodec.decode(ValueType.INT64, WpiLogFixtures.le(-2, 8)));
    assertEquals("-1", ValueCodec.decode(ValueType.INT64, new byte[] {(byte) 0xFF}));
    assertEquals("1.5", ValueCodec.decode(ValueType.DOUBLE, WpiLogFixtures.le(Double.doubleToLongBits(1.5), 8)));
    assertEquals("0.25", ValueCodec.decode(ValueType.FLOAT, WpiLogFixtures.le(Float.floatToIntBits(0.25f), 4)));
    assertEquals("héllo", ValueCodec.decode(ValueType.STRING, "héllo".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void decodesArrays() {
    assertEquals("true,false,true", ValueCodec.decode(ValueType.BOOLEAN_ARRAY, new byte[] {1, 0, 1}));
    ByteArrayOutputStream ints = new ByteArrayOutputStream();
    ints.writeBytes(WpiLogFixtures.le(3, 8));
    ints.writeBytes(WpiLogFixtures.le(-4, 8));
    assertEquals("3,-4", ValueCodec.decode(ValueType.INT64_ARRAY, ints.toByteArray()));
    assertEquals("", ValueCodec.decode(ValueType.DOUBLE_ARRAY, new byte[0]));

    ByteArrayOutputStream strings = new ByteArrayOutputStream();
    strings.writeBytes(WpiLogFixtures.le(2, 4));
    strings.writeBytes(WpiLogFixtures.le(2, 4));
    strings.writeBytes("ab".getBytes(StandardCharsets.UTF_8));
    strings.writeBytes(WpiLogFixtures.le(1, 4));
    strings.writeBytes("c".getBytes(StandardCharsets.UTF_8));
    assertEquals("ab,c", ValueCodec.decode(ValueType.STRING_ARRAY, strings.toByteArray()));
  }

  @Test
  void rawIsLowercaseHex() {
    assertEquals("00ff1a", ValueCodec.decode(ValueType.RAW, new byte[] {0, (byte) 0xFF, 0x1A}));
  }

  @Test
  void malformedPayloadsThrow() {
    assertThrows(IllegalArgumentException.class, () -> ValueCodec.decode(ValueType.BOOLEAN, new byte[0]));
    assertThrows(IllegalArgumentException.class, () -> ValueCodec.decode(ValueType.DOUBLE, new byte[4]));
    assertThrows(IllegalArgumentException.class, () -> ValueCodec.decode(ValueType.INT64, new byte[9]));
    assertThrows(IllegalArgumentException.class, () -> ValueCodec.decode(ValueType.FLOAT_ARRAY, new byte[6]));
    assertThrows(IllegalArgumentException.class,
        () -> ValueCodec.decode(ValueType.STRING, new byte[] {(byte) 0xC3, (byte) 0x28}));
    assertThrows(IllegalArgumentException.class,
        () -> ValueCodec.decode(ValueType.STRING_ARRAY, new byte[] {1, 0, 0, 0, 9, 0, 0, 0}));
  }

  @Test
  void unknownTypeNamesMapToRaw() {
    assertEquals(ValueType.RAW, ValueType.fromTypeName("struct:Pose2d"));
    assertEquals(ValueType.DOUBLE_ARRAY, ValueType.fromTypeName("double[]"));
  }
}
