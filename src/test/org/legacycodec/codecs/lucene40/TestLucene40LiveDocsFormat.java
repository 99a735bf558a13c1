package org.legacycodec.codecs.lucene40;

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

import java.util.ArrayList;
import java.util.List;

import org.legacycodec.codecs.Codec;
import org.legacycodec.codecs.LiveDocsFormat;
import org.legacycodec.index.SegmentInfo;
import org.legacycodec.store.MockDirectoryWrapper;
import org.legacycodec.util.Bits;
import org.legacycodec.util.CodecTestCase;
import org.legacycodec.util.MutableBits;
import org.legacycodec.util.RecordingInfoStream;

public class TestLucene40LiveDocsFormat extends CodecTestCase {

  public void testNewLiveDocsAllLive() throws Exception {
    LiveDocsFormat format = new Lucene40LiveDocsFormat();
    MutableBits bits = format.newLiveDocs(17);
    assertEquals(17, bits.length());
    for (int i = 0; i < 17; i++) {
      assertTrue(bits.get(i));
    }
    assertEquals(17, ((BitVector) bits).count());
  }

  public void testNewLiveDocsFromExistingIsIndependent() throws Exception {
    LiveDocsFormat format = new Lucene40LiveDocsFormat();
    MutableBits bits = format.newLiveDocs(10);
    bits.clear(3);
    MutableBits copy = format.newLiveDocs(bits);
    copy.clear(4);
    assertFalse(copy.get(3));
    assertFalse(copy.get(4));
    assertTrue(bits.get(4));
  }

  public void testWriteThenRead() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    RecordingInfoStream infoStream = new RecordingInfoStream();
    LiveDocsFormat format = new Lucene40LiveDocsFormat(infoStream);
    final int maxDoc = atLeast(100);
    SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
    assertFalse(info.hasDeletions());

    MutableBits bits = format.newLiveDocs(maxDoc);
    int deleted = 0;
    for (int i = 0; i < maxDoc; i++) {
      if (random().nextInt(5) == 0) {
        bits.clear(i);
        deleted++;
      }
    }
    format.writeLiveDocs(bits, dir, info, deleted);
    assertTrue(info.hasDeletions());
    assertEquals(1, info.getDelGen());
    assertEquals(deleted, info.getDelCount());
    assertTrue(dir.fileExists("_0_1.del"));

    List<String> files = new ArrayList<String>();
    format.files(info, files);
    assertEquals(1, files.size());
    assertEquals("_0_1.del", files.get(0));

    Bits read = format.readLiveDocs(dir, info);
    assertEquals(maxDoc, read.length());
    for (int i = 0; i < maxDoc; i++) {
      assertEquals(bits.get(i), read.get(i));
    }
    List<String> messages = infoStream.getMessages(Lucene40LiveDocsFormat.INFO_COMPONENT);
    assertEquals(2, messages.size());
    assertTrue(messages.get(0), messages.get(0).startsWith("wrote _0_1.del"));
    assertTrue(messages.get(1), messages.get(1).startsWith("read _0_1.del"));

    // a second round of deletes goes to the next generation
    MutableBits next = format.newLiveDocs(read);
    int firstLive = 0;
    while (!next.get(firstLive)) {
      firstLive++;
    }
    next.clear(firstLive);
    format.writeLiveDocs(next, dir, info, 1);
    assertEquals(2, info.getDelGen());
    assertEquals(deleted + 1, info.getDelCount());
    assertTrue(dir.fileExists("_0_2.del"));
    Bits read2 = format.readLiveDocs(dir, info);
    assertFalse(read2.get(firstLive));
    dir.close();
  }

  public void testNoFilesWithoutDeletions() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    SegmentInfo info = new SegmentInfo(dir, "_3", 10);
    List<String> files = new ArrayList<String>();
    new Lucene40LiveDocsFormat().files(info, files);
    assertTrue(files.isEmpty());
    dir.close();
  }

  public void testCodecProvidesFormat() throws Exception {
    Codec codec = Codec.forName("Lucene40");
    assertTrue(codec.liveDocsFormat() instanceof Lucene40LiveDocsFormat);
  }
}
