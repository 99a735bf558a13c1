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
 * Holder class for common parameters used during read.
 */
public class SegmentReadState {
  /** {@link Directory} where this segment is read from. */
  public final Directory directory;

  /** {@link SegmentInfo} describing this segment. */
  public final SegmentInfo segmentInfo;

  /** {@link FieldInfos} describing all fields in this
   *  segment. */
  public final FieldInfos fieldInfos;

  /** Unique suffix for any postings files read for this
   *  segment.  Empty unless the postings format is wrapped
   *  in a per-field format. */
  public final String segmentSuffix;

  /** Where the readers report what they do. */
  public final InfoStream infoStream;

  /** Create a {@code SegmentReadState}. */
  public SegmentReadState(Directory dir, SegmentInfo info, FieldInfos fieldInfos) {
    this(dir, info, fieldInfos, "", InfoStream.getDefault());
  }

  /** Create a {@code SegmentReadState}. */
  public SegmentReadState(Directory dir, SegmentInfo info, FieldInfos fieldInfos,
                          String segmentSuffix, InfoStream infoStream) {
    this.directory = dir;
    this.segmentInfo = info;
    this.fieldInfos = fieldInfos;
    this.segmentSuffix = segmentSuffix;
    this.infoStream = infoStream;
  }

  /** Create a {@code SegmentReadState} with a different segment suffix. */
  public SegmentReadState(SegmentReadState other, String newSegmentSuffix) {
    this(other.directory, other.segmentInfo, other.fieldInfos, newSegmentSuffix, other.infoStream);
  }
}
