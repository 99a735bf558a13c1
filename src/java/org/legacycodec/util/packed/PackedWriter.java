package org.legacycodec.util.packed;

/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.io.IOException;

import org.legacycodec.store.DataOutput;

/**
 * Packs high order bit first, to match
 * {@link Packed64#get(int)} and the byte-aligned layout it reads.
 */
final class PackedWriter extends PackedInts.Writer {

  private int pending;      // bits not yet flushed, right-aligned
  private int pendingBits;  // 0..7
  private int written;

  PackedWriter(DataOutput out, int valueCount, int bitsPerValue) {
    super(out, valueCount, bitsPerValue);
  }

  @Override
  protected PackedInts.Format getFormat() {
    return PackedInts.Format.PACKED;
  }

  @Override
  public void add(long v) throws IOException {
    assert bitsPerValue == 64 || (v >= 0 && v <= PackedInts.maxValue(bitsPerValue)) : v;
    if (written >= valueCount) {
      throw new IllegalStateException("already wrote " + valueCount + " values");
    }
    int remaining = bitsPerValue;
    while (remaining > 0) {
      final int take = Math.min(8 - pendingBits, remaining);
      final int chunk = (int) ((v >>> (remaining - take)) & ((1L << take) - 1));
      pending = (pending << take) | chunk;
      pendingBits += take;
      remaining -= take;
      if (pendingBits == 8) {
        out.writeByte((byte) pending);
        pending = 0;
        pendingBits = 0;
      }
    }
    ++written;
  }

  @Override
  public void finish() throws IOException {
    while (written < valueCount) {
      add(0L);
    }
    if (pendingBits > 0) {
      out.writeByte((byte) (pending << (8 - pendingBits)));
      pending = 0;
      pendingBits = 0;
    }
  }
}
