package org.legacycodec.util;

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

import java.util.Random;

import org.legacycodec.store.IndexInput;
import org.legacycodec.store.IndexOutput;
import org.legacycodec.store.MockDirectoryWrapper;

public class TestPagedBytes extends CodecTestCase {

  public void testDataInputOutput() throws Exception {
    Random random = random();
    for(int iter=0;iter<5*RANDOM_MULTIPLIER;iter++) {
      final MockDirectoryWrapper dir = newDirectory();
      final int blockBits = nextInt(random, 1, 20);
      final int blockSize = 1 << blockBits;
      final int numBytes = random.nextInt(1000000 >> (20 - blockBits));

      final byte[] answer = new byte[numBytes];
      random.nextBytes(answer);
      IndexOutput out = dir.createOutput("bytes");
      int written = 0;
      while(written < numBytes) {
        final int chunk = Math.min(random.nextInt(1000), numBytes - written);
        out.writeBytes(answer, written, chunk);
        written += chunk;
      }
      out.close();

      final PagedBytes p = new PagedBytes(blockBits);
      IndexInput in = dir.openInput("bytes");
      // copy in random chunks, so that block boundaries fall in the middle of copies
      long left = numBytes;
      while(left > 0) {
        final long chunk = Math.min(left, 1 + random.nextInt(3 * blockSize));
        p.copy(in, chunk);
        left -= chunk;
      }
      assertEquals(numBytes, p.getPointer());
      in.close();

      final PagedBytes.Reader reader = p.freeze(random.nextBoolean());
      final BytesRef slice = new BytesRef();
      for(int iter2=0;iter2<100;iter2++) {
        if (numBytes == 0) {
          break;
        }
        final int pos = random.nextInt(numBytes);
        final int len = random.nextInt(Math.min(blockSize, numBytes - pos) + 1);
        reader.fillSlice(slice, pos, len);
        assertEquals(len, slice.length);
        for(int byteUpto=0;byteUpto<len;byteUpto++) {
          assertEquals(answer[pos + byteUpto], slice.bytes[slice.offset + byteUpto]);
        }
      }
      dir.close();
    }
  }

  public void testEmptyFreeze() throws Exception {
    final PagedBytes p = new PagedBytes(4);
    assertEquals(0, p.getPointer());
    final PagedBytes.Reader reader = p.freeze(true);
    final BytesRef slice = new BytesRef();
    reader.fillSlice(slice, 0, 0);
    assertEquals(0, slice.length);
    assertTrue(reader.ramBytesUsed() >= 0);
  }

  public void testFreezeTwice() throws Exception {
    final PagedBytes p = new PagedBytes(4);
    p.freeze(false);
    try {
      p.freeze(false);
      fail("second freeze must fail");
    } catch (IllegalStateException expected) {
      // expected
    }
  }

  public void testRamBytesUsedGrows() throws Exception {
    final MockDirectoryWrapper dir = newDirectory();
    IndexOutput out = dir.createOutput("bytes");
    for(int i=0;i<100;i++) {
      out.writeByte((byte) i);
    }
    out.close();
    final PagedBytes p = new PagedBytes(5);
    IndexInput in = dir.openInput("bytes");
    p.copy(in, 10);
    final long small = p.ramBytesUsed();
    p.copy(in, 90);
    in.close();
    assertTrue(p.ramBytesUsed() > small);
    assertEquals(100, p.getPointer());
    dir.close();
  }
}
