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
import java.util.Arrays;

import org.legacycodec.store.DataInput;
import org.legacycodec.util.RamUsageEstimator;

/**
 * This class is similar to {@link Packed64} except that it trades space for
 * speed by ensuring that a single block needs to be read/written in order to
 * read/write a value. Values are stored lowest bits first within a block.
 */
final class Packed64SingleBlock extends PackedInts.Reader {

  public static final int MAX_SUPPORTED_BITS_PER_VALUE = 32;
  private static final int[] SUPPORTED_BITS_PER_VALUE = new int[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 12, 16, 21, 32};

  public static boolean isSupported(int bitsPerValue) {
    return Arrays.binarySearch(SUPPORTED_BITS_PER_VALUE, bitsPerValue) >= 0;
  }

  private static int requiredCapacity(int valueCount, int valuesPerBlock) {
    return valueCount / valuesPerBlock
        + (valueCount % valuesPerBlock == 0 ? 0 : 1);
  }

  final long[] blocks;
  private final int valueCount;
  private final int bitsPerValue;
  private final int valuesPerBlock;
  private final long mask;

  Packed64SingleBlock(int valueCount, int bitsPerValue) {
    assert isSupported(bitsPerValue);
    this.valueCount = valueCount;
    this.bitsPerValue = bitsPerValue;
    this.valuesPerBlock = 64 / bitsPerValue;
    this.blocks = new long[requiredCapacity(valueCount, valuesPerBlock)];
    this.mask = (1L << bitsPerValue) - 1L;
  }

  public static Packed64SingleBlock create(DataInput in,
      int valueCount, int bitsPerValue) throws IOException {
    Packed64SingleBlock reader = new Packed64SingleBlock(valueCount, bitsPerValue);
    for (int i = 0; i < reader.blocks.length; ++i) {
      reader.blocks[i] = in.readLong();
    }
    return reader;
  }

  @Override
  public long get(int index) {
    final int o = index / valuesPerBlock;
    final int b = index % valuesPerBlock;
    final int shift = b * bitsPerValue;
    return (blocks[o] >>> shift) & mask;
  }

  @Override
  public int size() {
    return valueCount;
  }

  @Override
  public int getBitsPerValue() {
    return bitsPerValue;
  }

  @Override
  public long ramBytesUsed() {
    return RamUsageEstimator.alignObjectSize(
        RamUsageEstimator.NUM_BYTES_OBJECT_HEADER
        + 3 * RamUsageEstimator.NUM_BYTES_INT // valueCount,bitsPerValue,valuesPerBlock
        + RamUsageEstimator.NUM_BYTES_LONG // mask
        + RamUsageEstimator.NUM_BYTES_OBJECT_REF) // blocks ref
        + RamUsageEstimator.sizeOf(blocks);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(bitsPerValue=" + bitsPerValue
        + ", size=" + size() + ", elements.length=" + blocks.length + ")";
  }
}
