package ca.gc.cra.replay.domain.util;

/**
 * <strong>What:</strong> Utility methods for reading little-endian integers from byte arrays.
 * <p><strong>Why:</strong> The binary log stores every length, id, and timestamp as a little-endian field of
 * variable width.</p>
 * <p><strong>Role:</strong> Domain support functions reused by the log codec and value decoders.</p>
 * <p><strong>Thread-safety:</strong> Stateless static helpers; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Constant-time bit manipulations; callers check bounds before reading.</p>
 *
 * @since 0.1.0
 */
public final class Bytes {
  private Bytes() {}

  /**
   * Reads an unsigned 8-bit value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset in the array
   * @return unsigned value in the range {@code [0,255]} or {@code 0} if out of bounds
   */
  public static int u8(byte[] a, int off) {
    if (a == null || off < 0 || off >= a.length) {
      return 0;
    }
    return a[off] & 0xFF;
  }

  /**
   * Reads an unsigned 32-bit little-endian value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset of the least significant byte
   * @return unsigned value widened to {@code long}, or {@code 0} if fewer than four bytes remain
   */
  public static long u32le(byte[] a, int off) {
    return uLe(a, off, 4);
  }

  /**
   * Reads an unsigned little-endian integer of {@code width} bytes.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset of the least significant byte
   * @param width field width in bytes, {@code 1..8}
   * @return the value; widths of eight bytes may yield a negative {@code long} for values above
   *     {@link Long#MAX_VALUE}. Returns {@code 0} when the field runs past the array.
   * @throws IllegalArgumentException if {@code width} is outside {@code 1..8}
   */
  public static long uLe(byte[] a, int off, int width) {
    if (width < 1 || width > 8) {
      throw new IllegalArgumentException("width must be 1..8 (was " + width + ")");
    }
    if (!hasRemaining(a, off, width)) {
      return 0L;
    }
    long value = 0L;
    for (int i = width - 1; i >= 0; i--) {
      value = (value << 8) | (a[off + i] & 0xFFL);
    }
    return value;
  }

  /**
   * Reads a signed little-endian two's complement integer of {@code width} bytes.
   *
   * @param a byte array source
   * @param off offset of the least significant byte
   * @param width field width in bytes, {@code 1..8}
   * @return the sign-extended value
   */
  public static long sLe(byte[] a, int off, int width) {
    long raw = uLe(a, off, width);
    int shift = 64 - width * 8;
    return (raw << shift) >> shift;
  }

  /**
   * Checks that {@code count} bytes are available starting at {@code off}.
   *
   * @param a byte array source; may be {@code null}
   * @param off starting offset
   * @param count number of bytes required
   * @return {@code true} when the range lies inside the array
   */
  public static boolean hasRemaining(byte[] a, long off, long count) {
    return a != null && off >= 0 && count >= 0 && off + count <= a.length;
  }

  /**
   * Converts an unsigned 64-bit value to the nearest {@code double}.
   *
   * @param value unsigned value held in a {@code long}
   * @return the non-negative magnitude as a double
   */
  public static double unsignedToDouble(long value) {
    if (value >= 0) {
      return value;
    }
    return ((value >>> 1) * 2.0) + (value & 1L);
  }
}
