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

import java.io.IOException;

import org.legacycodec.codecs.PostingsFormat;
import org.legacycodec.codecs.PostingsReaderBase;
import org.legacycodec.codecs.PostingsWriterBase;
import org.legacycodec.index.SegmentReadState;
import org.legacycodec.index.SegmentWriteState;

/**
 * Lucene 4.0 Postings format.
 * <p>
 * Files:
 * <ul>
 *   <li><code>.frq</code>: Frequencies</li>
 *   <li><code>.prx</code>: Positions</li>
 * </ul>
 * <p>
 * The <code>.frq</code> file holds, for each term, the documents containing
 * the term as a list of doc deltas. When frequencies are indexed each delta
 * is shifted left by one and the low bit set when the frequency is one;
 * otherwise the frequency follows as a vint. Terms with at least
 * <code>skipMinimum</code> documents are followed by multi-level skip data.
 * <p>
 * The <code>.prx</code> file holds position deltas per document, optionally
 * interleaved with payload and offset lengths that are only written when
 * they change.
 * <p>
 * This format is read-only: segments in it can be searched, but new
 * segments must be written with a newer format.
 */
public class Lucene40PostingsFormat extends PostingsFormat {

  /** Extension of freq postings file */
  static final String FREQ_EXTENSION = "frq";

  /** Extension of prox postings file */
  static final String PROX_EXTENSION = "prx";

  /** Creates {@code Lucene40PostingsFormat}. */
  public Lucene40PostingsFormat() {
    super("Lucene40");
  }

  @Override
  public PostingsWriterBase postingsWriter(SegmentWriteState state) throws IOException {
    throw new UnsupportedOperationException("this codec can only be used for reading");
  }

  @Override
  public PostingsReaderBase postingsReader(SegmentReadState state) throws IOException {
    return new Lucene40PostingsReader(state.directory, state.fieldInfos, state.segmentInfo,
                                      state.segmentSuffix, state.infoStream);
  }

  @Override
  public String toString() {
    return getName();
  }
}
