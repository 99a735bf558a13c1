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

import org.legacycodec.codecs.DocValuesConsumer;
import org.legacycodec.codecs.DocValuesProducer;
import org.legacycodec.codecs.NormsFormat;
import org.legacycodec.index.IndexFileNames;
import org.legacycodec.index.SegmentReadState;
import org.legacycodec.index.SegmentWriteState;

/**
 * Lucene 4.0 Norms Format.
 * <p>
 * Files:
 * <ul>
 *   <li><code>.nrm.cfs</code>: {@link org.legacycodec.store.CompoundFileDirectory compound container}</li>
 *   <li><code>.nrm.cfe</code>: {@link org.legacycodec.store.CompoundFileDirectory compound entries}</li>
 * </ul>
 * Norms are encoded the same way as doc values; the type of each field's
 * norms is recorded under its own attribute key.
 *
 * @see Lucene40DocValuesFormat
 */
public class Lucene40NormsFormat extends NormsFormat {

  /** Sole constructor. */
  public Lucene40NormsFormat() {}

  @Override
  public DocValuesConsumer normsConsumer(SegmentWriteState state) throws IOException {
    throw new UnsupportedOperationException("this codec can only be used for reading");
  }

  @Override
  public DocValuesProducer normsProducer(SegmentReadState state) throws IOException {
    String filename = IndexFileNames.segmentFileName(state.segmentInfo.name,
                                                     "nrm",
                                                     IndexFileNames.COMPOUND_FILE_EXTENSION);
    return new Lucene40DocValuesReader(state, filename, LegacyDocValuesType.LEGACY_NORM_TYPE_KEY);
  }
}
