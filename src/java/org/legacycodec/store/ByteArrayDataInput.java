package org.legacycodec.store;

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

import java.io.EOFException;

import org.legacycodec.util.BytesRef;

/**
 * DataInput over a slice of a byte array. Used to decode the
 * per-block term metadata that the postings reader buffers.
 * Reading past the slice raises {@link EOFException}.
 */
public final class ByteArrayDataInput extends DataInput {

  private byte[] bytes;

  private int pos;
  private int limit;

  public ByteArrayDataInput(byte[] bytes) {
    reset(bytes);
  }

  public ByteArrayDataInput(byte[] bytes, int offset, int len) {
    reset(bytes, offset, len);
  }

  public ByteArrayDataInput() {
    reset(BytesRef.EMPTY_BYTES);
  }

  public void reset(byte[] bytes) {
    reset(bytes, 0, bytes.length);
  }

  public void reset(byte[] bytes, int offset, int len) {
    this.bytes = bytes;
    pos = offset;
    limit = offset + len;
  }

  @Override
  public byte readByte() throws EOFException {
    if (pos >= limit) {
      throw new EOFException("read past end of block: pos=" + pos + " limit=" + limit);
    }
    return bytes[pos++];
  }

  @Override
  public void readBytes(byte[] b, int offset, int len) throws EOFException {
    if (pos + len > limit) {
      throw new EOFException("read past end of block: pos=" + pos + " len=" + len + " limit=" + limit);
    }
    System.arraycopy(bytes, pos, b, offset, len);
    pos += len;
  }

  @Override
  public void skipBytes(long count) throws EOFException {
    if (pos + count > limit) {
      throw new EOFException("skip past end of block: pos=" + pos + " count=" + count + " limit=" + limit);
    }
    pos += count;
  }
}
