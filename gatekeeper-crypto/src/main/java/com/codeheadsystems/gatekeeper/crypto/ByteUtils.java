package com.codeheadsystems.gatekeeper.crypto;

/**
 * Utility methods for byte array handling.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Returns a copy of {@code source[from, to)}.
   *
   * @param source the source
   * @param from   inclusive start
   * @param to     exclusive end
   * @return the byte [ ]
   */
  public static byte[] slice(byte[] source, int from, int to) {
    if (from < 0 || to > source.length || from > to) {
      throw new IllegalArgumentException("Slice out of range");
    }
    byte[] result = new byte[to - from];
    System.arraycopy(source, from, result, 0, result.length);
    return result;
  }
}
