package org.legacycodec.index;

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

import org.legacycodec.store.Directory;
import org.legacycodec.util.InfoStream;

/**
 * Holder class for common parameters used during write.
 * <p>
 * The legacy formats never write; this is what their write entry
 * points are handed before they refuse.
 */
public class SegmentWriteState {
  /** {@link Directory} where this segment will be written to. */
  public final Directory directory;

  /** {@link SegmentInfo} describing this segment. */
  public final SegmentInfo segmentInfo;

  /** {@link FieldInfos} describing all fields in this
   *  segment. */
  public final FieldInfos fieldInfos;

  /** Unique suffix for any postings files written for this
   *  segment. */
  public final String segmentSuffix;

  /** {@link InfoStream} used for debugging messages. */
  public final InfoStream infoStream;

  /** Sole constructor. */
  public SegmentWriteState(Directory directory, SegmentInfo segmentInfo, FieldInfos fieldInfos,
                           String segmentSuffix, InfoStream infoStream) {
    this.directory = directory;
    this.segmentInfo = segmentInfo;
    this.fieldInfos = fieldInfos;
    this.segmentSuffix = segmentSuffix;
    this.infoStream = infoStream;
  }

  public SegmentWriteState(Directory directory, SegmentInfo segmentInfo, FieldInfos fieldInfos) {
    this(directory, segmentInfo, fieldInfos, "", InfoStream.getDefault());
  }
}
