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

/**
 * Information about a segment such as its name, directory, document
 * count and the generation of its live-docs (deletions) file.
 */
public final class SegmentInfo {

  /** Used by some member fields to mean not present (e.g.,
   *  deletions file). */
  public static final int NO = -1;

  /** Unique segment name in the directory. */
  public final String name;

  /** Where this segment resides. */
  public final Directory dir;

  private final int docCount;

  // Generation number of the live docs file (-1 if there
  // are no deletes yet):
  private long delGen;

  private int delCount;

  public SegmentInfo(Directory dir, String name, int docCount) {
    this(dir, name, docCount, NO, 0);
  }

  public SegmentInfo(Directory dir, String name, int docCount, long delGen, int delCount) {
    assert !(dir instanceof org.legacycodec.store.CompoundFileDirectory);
    if (docCount < 0) {
      throw new IllegalArgumentException("docCount must be >= 0, got " + docCount);
    }
    this.dir = dir;
    this.name = name;
    this.docCount = docCount;
    this.delGen = delGen;
    this.delCount = delCount;
  }

  /** Returns number of documents in this segment (deletions
   *  are not taken into account). */
  public int getDocCount() {
    return docCount;
  }

  /** Returns true if there are any deletions for the
   * segment at this commit. */
  public boolean hasDeletions() {
    return delGen != NO;
  }

  /** Returns generation number of the live docs file
   *  or -1 if there are no deletes yet. */
  public long getDelGen() {
    return delGen;
  }

  /** Returns the next available generation number
   *  of the live docs file. */
  public long getNextDelGen() {
    if (delGen == NO) {
      return 1;
    } else {
      return delGen + 1;
    }
  }

  /** Called when we succeed in writing deletes */
  public void advanceDelGen() {
    delGen = getNextDelGen();
  }

  /**
   * Returns the number of deleted docs in the segment.
   */
  public int getDelCount() {
    return delCount;
  }

  public void setDelCount(int delCount) {
    if (delCount < 0 || delCount > docCount) {
      throw new IllegalArgumentException("invalid delCount=" + delCount + " (docCount=" + docCount + ")");
    }
    this.delCount = delCount;
  }

  @Override
  public String toString() {
    return name + "(" + docCount + (delGen != NO ? ",delGen=" + delGen : "") + ")";
  }
}
