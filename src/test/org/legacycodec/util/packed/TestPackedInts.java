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
import java.util.Random;

import org.legacycodec.codecs.CodecUtil;
import org.legacycodec.index.CorruptIndexException;
import org.legacycodec.index.IndexFormatTooNewException;
import org.legacycodec.store.IndexInput;
import org.legacycodec.store.IndexOutput;
import org.legacycodec.store.MockDirectoryWrapper;
import org.legacycodec.util.CodecTestCase;

public class TestPackedInts extends CodecTestCase {

  public void testBitsRequired() {
    assertEquals(1, PackedInts.bitsRequired(0));
    assertEquals(1, PackedInts.bitsRequired(1));
    assertEquals(2, PackedInts.bitsRequired(2));
    assertEquals(8, PackedInts.bitsRequired(255));
    assertEquals(9, PackedInts.bitsRequired(256));
    assertEquals(61, PackedInts.bitsRequired((long)Math.pow(2, 61)-1));
    assertEquals(63, PackedInts.bitsRequired(Long.MAX_VALUE));
    try {
      PackedInts.bitsRequired(-1);
      fail();
    } catch (IllegalArgumentException expected) {
      // expected
    }
  }

  public void testMaxValues() {
    assertEquals("1 bit -> max == 1",
            1, PackedInts.maxValue(1));
    assertEquals("2 bit -> max == 3",
            3, PackedInts.maxValue(2));
    assertEquals("8 bit -> max == 255",
            255, PackedInts.maxValue(8));
    assertEquals("63 bit -> max == Long.MAX_VALUE",
            Long.MAX_VALUE, PackedInts.maxValue(63));
    assertEquals("64 bit -> max == Long.MAX_VALUE (same as for 63 bit)",
            Long.MAX_VALUE, PackedInts.maxValue(64));
  }

  public void testPackedInts() throws IOException {
    Random random = random();
    int num = atLeast(5);
    for (int iter = 0; iter < num; iter++) {
      for(int nbits=1;nbits<=64;nbits++) {
        final long maxValue = PackedInts.maxValue(nbits);
        final int valueCount = random.nextInt(300);
        final long[] values = new long[valueCount];
        for(int i=0;i<valueCount;i++) {
          values[i] = nbits == 64 ? random.nextLong() : random.nextLong() & maxValue;
        }

        MockDirectoryWrapper d = newDirectory();
        IndexOutput out = d.createOutput("out.bin");
        PackedInts.Writer w = PackedInts.getWriter(out, valueCount, nbits);
        assertEquals(nbits, w.bitsPerValue());
        for(int i=0;i<valueCount;i++) {
          w.add(values[i]);
        }
        w.finish();
        final long fp = out.getFilePointer();
        out.close();

        IndexInput in = d.openInput("out.bin");
        PackedInts.Reader r = PackedInts.getReader(in);
        assertEquals("nbits=" + nbits, fp, in.getFilePointer());
        assertEquals(valueCount, r.size());
        assertEquals(nbits, r.getBitsPerValue());
        for(int i=0;i<valueCount;i++) {
          assertEquals("index=" + i + " valueCount=" + valueCount + " nbits=" + nbits,
              values[i], r.get(i));
        }
        CodecUtil.checkEOF(in);
        in.close();
        d.close();
      }
    }
  }

  public void testFinishPadsMissingValues() throws IOException {
    MockDirectoryWrapper d = newDirectory();
    IndexOutput out = d.createOutput("out.bin");
    PackedInts.Writer w = PackedInts.getWriter(out, 5, 3);
    w.add(7);
    w.add(5);
    w.finish();
    out.close();

    IndexInput in = d.openInput("out.bin");
    PackedInts.Reader r = PackedInts.getReader(in);
    assertEquals(5, r.size());
    assertEquals(7, r.get(0));
    assertEquals(5, r.get(1));
    assertEquals(0, r.get(2));
    assertEquals(0, r.get(4));
    CodecUtil.checkEOF(in);
    in.close();
    d.close();
  }

  public void testTooManyValues() throws IOException {
    MockDirectoryWrapper d = newDirectory();
    IndexOutput out = d.createOutput("out.bin");
    PackedInts.Writer w = PackedInts.getWriter(out, 1, 4);
    w.add(3);
    try {
      w.add(4);
      fail();
    } catch (IllegalStateException expected) {
      // expected
    }
    out.close();
    d.close();
  }

  public void testLongAlignedVersion() throws IOException {
    MockDirectoryWrapper d = newDirectory();
    IndexOutput out = d.createOutput("out.bin");
    CodecUtil.writeHeader(out, PackedInts.CODEC_NAME, PackedInts.VERSION_START);
    out.writeVInt(8);
    out.writeVInt(3);
    out.writeVInt(PackedInts.Format.PACKED.getId());
    // the first version pads to a whole long
    out.writeLong(0x0102030000000000L);
    out.close();

    IndexInput in = d.openInput("out.bin");
    PackedInts.Reader r = PackedInts.getReader(in);
    assertEquals(1, r.get(0));
    assertEquals(2, r.get(1));
    assertEquals(3, r.get(2));
    CodecUtil.checkEOF(in);
    in.close();
    d.close();
  }

  public void testSingleBlockFormat() throws IOException {
    final long a = 1, b = 0x1FFFFFL, c = 12345, e = 42;
    MockDirectoryWrapper d = newDirectory();
    IndexOutput out = d.createOutput("out.bin");
    CodecUtil.writeHeader(out, PackedInts.CODEC_NAME, PackedInts.VERSION_CURRENT);
    out.writeVInt(21);
    out.writeVInt(4);
    out.writeVInt(PackedInts.Format.PACKED_SINGLE_BLOCK.getId());
    // three 21-bit values per long, lowest bits first, no value spans two longs
    out.writeLong(a | (b << 21) | (c << 42));
    out.writeLong(e);
    out.close();

    IndexInput in = d.openInput("out.bin");
    PackedInts.Reader r = PackedInts.getReader(in);
    assertEquals(4, r.size());
    assertEquals(21, r.getBitsPerValue());
    assertEquals(a, r.get(0));
    assertEquals(b, r.get(1));
    assertEquals(c, r.get(2));
    assertEquals(e, r.get(3));
    CodecUtil.checkEOF(in);
    in.close();
    d.close();
  }

  public void testSingleBlockSupportedBits() {
    assertTrue(PackedInts.Format.PACKED_SINGLE_BLOCK.isSupported(21));
    assertFalse(PackedInts.Format.PACKED_SINGLE_BLOCK.isSupported(11));
    assertFalse(PackedInts.Format.PACKED_SINGLE_BLOCK.isSupported(64));
    for (int bpv = 1; bpv <= 64; bpv++) {
      assertTrue(PackedInts.Format.PACKED.isSupported(bpv));
    }
  }

  public void testCorruptHeaders() throws IOException {
    // bitsPerValue out of range
    assertCorrupt(PackedInts.VERSION_CURRENT, 0, 1, PackedInts.Format.PACKED.getId());
    assertCorrupt(PackedInts.VERSION_CURRENT, 65, 1, PackedInts.Format.PACKED.getId());
    // negative value count
    assertCorrupt(PackedInts.VERSION_CURRENT, 4, -5, PackedInts.Format.PACKED.getId());
    // unknown format
    assertCorrupt(PackedInts.VERSION_CURRENT, 4, 1, 7);
    // unsupported width for single-block layout
    assertCorrupt(PackedInts.VERSION_CURRENT, 11, 1, PackedInts.Format.PACKED_SINGLE_BLOCK.getId());
  }

  public void testVersionTooNew() throws IOException {
    MockDirectoryWrapper d = newDirectory();
    writeHeader(d, PackedInts.VERSION_CURRENT + 1, 4, 1, PackedInts.Format.PACKED.getId());
    IndexInput in = d.openInput("out.bin");
    try {
      PackedInts.getReader(in);
      fail();
    } catch (IndexFormatTooNewException expected) {
      // expected
    }
    in.close();
    d.close();
  }

  public void testCheckVersion() {
    PackedInts.checkVersion(PackedInts.VERSION_START);
    PackedInts.checkVersion(PackedInts.VERSION_CURRENT);
    try {
      PackedInts.checkVersion(PackedInts.VERSION_CURRENT + 1);
      fail();
    } catch (IllegalArgumentException expected) {
      // expected
    }
  }

  private void writeHeader(MockDirectoryWrapper d, int version, int bitsPerValue, int valueCount, int formatId) throws IOException {
    IndexOutput out = d.createOutput("out.bin");
    CodecUtil.writeHeader(out, PackedInts.CODEC_NAME, version);
    out.writeVInt(bitsPerValue);
    out.writeVInt(valueCount);
    out.writeVInt(formatId);
    out.writeLong(0L);
    out.close();
  }

  private void assertCorrupt(int version, int bitsPerValue, int valueCount, int formatId) throws IOException {
    MockDirectoryWrapper d = newDirectory();
    writeHeader(d, version, bitsPerValue, valueCount, formatId);
    IndexInput in = d.openInput("out.bin");
    try {
      PackedInts.getReader(in);
      fail("bitsPerValue=" + bitsPerValue + " valueCount=" + valueCount + " format=" + formatId + " should be rejected");
    } catch (CorruptIndexException expected) {
      // expected
    } finally {
      in.close();
    }
    d.close();
  }
}
