package org.legacycodec.codecs;

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

import org.legacycodec.index.CorruptIndexException;
import org.legacycodec.index.IndexFormatTooNewException;
import org.legacycodec.index.IndexFormatTooOldException;
import org.legacycodec.store.ChecksumIndexInput;
import org.legacycodec.store.IndexInput;
import org.legacycodec.store.IndexOutput;
import org.legacycodec.store.MockDirectoryWrapper;
import org.legacycodec.util.CodecTestCase;

/** tests for codecutil methods */
public class TestCodecUtil extends CodecTestCase {

  public void testHeaderLength() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    IndexOutput output = dir.createOutput("file");
    CodecUtil.writeHeader(output, "FooBar", 5);
    output.writeString("this is the data");
    output.close();

    IndexInput input = dir.openInput("file");
    input.seek(CodecUtil.headerLength("FooBar"));
    assertEquals("this is the data", input.readString());
    input.close();
    dir.close();
  }

  public void testWriteTooLongHeader() throws Exception {
    StringBuilder tooLong = new StringBuilder();
    for (int i = 0; i < 128; i++) {
      tooLong.append('a');
    }
    MockDirectoryWrapper dir = newDirectory();
    IndexOutput output = dir.createOutput("file");
    try {
      CodecUtil.writeHeader(output, tooLong.toString(), 5);
      fail("didn't get expected exception");
    } catch (IllegalArgumentException expected) {
      // expected
    }
    output.close();
    dir.close();
  }

  public void testWriteNonAsciiHeader() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    IndexOutput output = dir.createOutput("file");
    try {
      CodecUtil.writeHeader(output, "\u1234", 5);
      fail("didn't get expected exception");
    } catch (IllegalArgumentException expected) {
      // expected
    }
    output.close();
    dir.close();
  }

  public void testReadHeaderWrongMagic() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    IndexOutput output = dir.createOutput("file");
    output.writeInt(1234);
    output.close();

    IndexInput input = dir.openInput("file");
    try {
      CodecUtil.checkHeader(input, "bogus", 1, 1);
      fail("didn't get expected exception");
    } catch (CorruptIndexException expected) {
      // expected
    }
    input.close();
    dir.close();
  }

  public void testReadHeaderWrongCodec() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    IndexOutput output = dir.createOutput("file");
    CodecUtil.writeHeader(output, "FooBar", 5);
    output.close();

    IndexInput input = dir.openInput("file");
    try {
      CodecUtil.checkHeader(input, "BarFoo", 5, 5);
      fail("didn't get expected exception");
    } catch (CorruptIndexException expected) {
      // expected
    }
    input.close();
    dir.close();
  }

  public void testReadHeaderVersionRange() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    IndexOutput output = dir.createOutput("file");
    CodecUtil.writeHeader(output, "FooBar", 5);
    output.close();

    IndexInput input = dir.openInput("file");
    assertEquals(5, CodecUtil.checkHeader(input, "FooBar", 3, 7));
    input.seek(0);
    try {
      CodecUtil.checkHeader(input, "FooBar", 6, 7);
      fail("didn't get expected exception");
    } catch (IndexFormatTooOldException expected) {
      // expected
    }
    input.seek(0);
    try {
      CodecUtil.checkHeader(input, "FooBar", 1, 4);
      fail("didn't get expected exception");
    } catch (IndexFormatTooNewException expected) {
      // expected
    }
    input.close();
    dir.close();
  }

  public void testCheckFooter() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    IndexOutput output = dir.createOutput("file");
    CodecUtil.writeHeader(output, "FooBar", 5);
    output.writeString("this is the data");
    CodecUtil.writeFooter(output);
    output.close();

    ChecksumIndexInput input = dir.openChecksumInput("file");
    CodecUtil.checkHeader(input, "FooBar", 5, 5);
    assertEquals("this is the data", input.readString());
    assertEquals(input.length() - CodecUtil.footerLength(), input.getFilePointer());
    CodecUtil.checkFooter(input);
    input.close();
    dir.close();
  }

  public void testCheckFooterCorruptChecksum() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    IndexOutput output = dir.createOutput("file");
    CodecUtil.writeHeader(output, "FooBar", 5);
    output.writeString("this is the data");
    output.writeInt(CodecUtil.FOOTER_MAGIC);
    output.writeInt(0);
    output.writeLong(output.getChecksum() ^ 1L);
    output.close();

    ChecksumIndexInput input = dir.openChecksumInput("file");
    CodecUtil.checkHeader(input, "FooBar", 5, 5);
    input.readString();
    try {
      CodecUtil.checkFooter(input);
      fail("didn't get expected exception");
    } catch (CorruptIndexException expected) {
      assertTrue(expected.getMessage().contains("checksum failed"));
    }
    input.close();
    dir.close();
  }

  public void testCheckEOF() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    IndexOutput output = dir.createOutput("file");
    output.writeVInt(42);
    output.writeByte((byte) 7);
    output.close();

    IndexInput input = dir.openInput("file");
    assertEquals(42, input.readVInt());
    try {
      CodecUtil.checkEOF(input);
      fail("trailing byte was not detected");
    } catch (CorruptIndexException expected) {
      // expected
    }
    input.readByte();
    CodecUtil.checkEOF(input);
    input.close();
    dir.close();
  }
}
