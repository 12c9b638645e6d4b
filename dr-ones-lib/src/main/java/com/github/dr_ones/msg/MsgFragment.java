// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

import java.util.Arrays;
import java.util.zip.CRC32;

/// One fragment of a higher level message. The routing core only ever looks at the fragment index. Splitting and
/// reassembling the data is the business of the client and server nodes.
///
/// @param fragmentIndex  the position of this fragment within the message.
/// @param totalFragments how many fragments make up the message.
/// @param length         how many bytes of `data` are in use.
/// @param data           the fragment bytes, at most [#MAX_DATA] long.
public record MsgFragment(long fragmentIndex, long totalFragments, int length, byte[] data) implements PacketType {
  public static final int MAX_DATA = 128;

  public MsgFragment {
    if (data == null) {
      throw new IllegalArgumentException("data cannot be null");
    }
    if (data.length > MAX_DATA) {
      throw new IllegalArgumentException("data cannot exceed " + MAX_DATA + " bytes but was " + data.length);
    }
    if (length < 0 || length > data.length) {
      throw new IllegalArgumentException("length " + length + " does not fit data of " + data.length + " bytes");
    }
    if (fragmentIndex < 0 || totalFragments < 0) {
      throw new IllegalArgumentException("fragmentIndex=" + fragmentIndex + " totalFragments=" + totalFragments);
    }
    data = data.clone();
  }

  public MsgFragment(long fragmentIndex, long totalFragments, byte[] data) {
    this(fragmentIndex, totalFragments, data.length, data);
  }

  @Override
  public byte[] data() {
    return data.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MsgFragment other)) {
      return false;
    }
    return fragmentIndex == other.fragmentIndex
        && totalFragments == other.totalFragments
        && length == other.length
        && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(fragmentIndex);
    result = 31 * result + Long.hashCode(totalFragments);
    result = 31 * result + length;
    return 31 * result + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    CRC32 crc32 = new CRC32();
    crc32.update(data, 0, length);
    return String.format("MsgFragment[fragmentIndex=%d, totalFragments=%d, data=byte[%d]:CRC32=%d]",
        fragmentIndex,
        totalFragments,
        length,
        crc32.getValue());
  }
}
