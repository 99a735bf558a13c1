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

import org.legacycodec.codecs.Codec;
import org.legacycodec.codecs.DocValuesFormat;
import org.legacycodec.codecs.LiveDocsFormat;
import org.legacycodec.codecs.NormsFormat;
import org.legacycodec.codecs.PostingsFormat;

/**
 * Reader for the 4.0 file format.
 * <p>
 * Segments written in this format can be read, but not written: the
 * write entry points of its formats throw
 * {@link UnsupportedOperationException}.
 */
public class Lucene40Codec extends Codec {
  private final PostingsFormat postingsFormat = new Lucene40PostingsFormat();
  private final DocValuesFormat docValuesFormat = new Lucene40DocValuesFormat();
  private final NormsFormat normsFormat = new Lucene40NormsFormat();
  private final LiveDocsFormat liveDocsFormat = new Lucene40LiveDocsFormat();

  /** Sole constructor. */
  public Lucene40Codec() {
    super("Lucene40");
  }

  @Override
  public final PostingsFormat postingsFormat() {
    return postingsFormat;
  }

  @Override
  public DocValuesFormat docValuesFormat() {
    return docValuesFormat;
  }

  @Override
  public NormsFormat normsFormat() {
    return normsFormat;
  }

  @Override
  public final LiveDocsFormat liveDocsFormat() {
    return liveDocsFormat;
  }
}
