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

import java.io.Closeable;
import java.io.IOException;

import org.legacycodec.index.FieldInfo;
import org.legacycodec.store.IndexOutput;
import org.legacycodec.util.BytesRef;

/**
 * Extension of {@link PostingsReaderBase}'s counterpart on the write
 * side: the terms dictionary calls this to encode the postings of each
 * term, and it hands back the per-term metadata blocks the terms
 * dictionary stores.
 */
public abstract class PostingsWriterBase implements Closeable {

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected PostingsWriterBase() {
  }

  /** Called once after startup, before any terms have been
   *  added.  Implementations typically write a header to
   *  the provided {@code termsOut}. */
  public abstract void start(IndexOutput termsOut) throws IOException;

  /** Start a new term.  Note that a matching call to {@link
   *  #finishTerm} is done, only if the term has at least one
   *  document. */
  public abstract void startTerm() throws IOException;

  /** Finishes the current term.  The provided docFreq and
   *  totalTermFreq describe the term that was just added. */
  public abstract void finishTerm(int docFreq, long totalTermFreq) throws IOException;

  /** Flush the metadata of all terms finished since the last
   *  flush to {@code termsOut} as one block. */
  public abstract void flushTermsBlock(IndexOutput termsOut) throws IOException;

  /** Called when the writing switches to another field. */
  public abstract void setField(FieldInfo fieldInfo);

  /** Adds a new doc in this term. */
  public abstract void startDoc(int docID, int freq) throws IOException;

  /** Add a new position and payload, and start/end offset.  A
   *  null payload means no payload; a non-null payload with
   *  zero length also means no payload. */
  public abstract void addPosition(int position, BytesRef payload, int startOffset, int endOffset) throws IOException;

  /** Called when we are done adding positions and payloads
   *  for each doc. */
  public abstract void finishDoc() throws IOException;

  @Override
  public abstract void close() throws IOException;
}
