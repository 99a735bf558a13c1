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

import java.util.HashMap;
import java.util.Map;

/**
 *  Access to the Field Info file that describes document fields and whether or
 *  not they are indexed. Each segment has a separate Field Info file. Objects
 *  of this class are thread-safe for multiple readers, but only one thread can
 *  be adding documents at a time, with no other reader or writer threads
 *  accessing this object.
 */
public final class FieldInfo {
  /** Field's name */
  public final String name;
  /** Internal field number */
  public final int number;

  private final IndexOptions indexOptions;
  private final boolean storePayloads; // whether this field stores payloads together with term positions

  private Map<String,String> attributes;

  /**
   * Controls how much information is stored in the postings lists.
   */
  public static enum IndexOptions {
    // NOTE: order is important here; FieldInfo uses this
    // order to merge two conflicting IndexOptions (always
    // "downgrades" by picking the lowest).
    /** only documents are indexed: term frequencies and positions are omitted */
    DOCS_ONLY,
    /** only documents and term frequencies are indexed: positions are omitted */
    DOCS_AND_FREQS,
    /** documents, frequencies and positions */
    DOCS_AND_FREQS_AND_POSITIONS,
    /** documents, frequencies, positions and offsets */
    DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS,
  }

  public FieldInfo(String name, int number, IndexOptions indexOptions, boolean storePayloads) {
    this(name, number, indexOptions, storePayloads, null);
  }

  public FieldInfo(String name, int number, IndexOptions indexOptions, boolean storePayloads,
                   Map<String,String> attributes) {
    this.name = name;
    this.number = number;
    this.indexOptions = indexOptions;
    // payloads only make sense with positions
    this.storePayloads = storePayloads
        && indexOptions != null
        && indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0;
    if (attributes != null) {
      this.attributes = new HashMap<String,String>(attributes);
    }
    assert checkConsistency();
  }

  private boolean checkConsistency() {
    assert number >= 0 : "number=" + number;
    return true;
  }

  /** Returns IndexOptions for the field, or null if the field is not indexed */
  public IndexOptions getIndexOptions() {
    return indexOptions;
  }

  /** Returns true if this field is indexed. */
  public boolean isIndexed() {
    return indexOptions != null;
  }

  /** Returns true if any payloads exist for this field. */
  public boolean hasPayloads() {
    return storePayloads;
  }

  /**
   * Get a codec attribute value, or null if it does not exist
   */
  public synchronized String getAttribute(String key) {
    if (attributes == null) {
      return null;
    } else {
      return attributes.get(key);
    }
  }

  /**
   * Puts a codec attribute value.
   * <p>
   * This is a key-value mapping for the field that the codec can use
   * to store additional metadata; the 4.0 doc values and norms formats
   * keep their legacy type tag here.
   * <p>
   * If a value already exists for the field, it will be replaced with
   * the new value.
   */
  public synchronized String putAttribute(String key, String value) {
    if (attributes == null) {
      attributes = new HashMap<String,String>();
    }
    return attributes.put(key, value);
  }

  @Override
  public String toString() {
    return "FieldInfo(name=" + name + ",number=" + number + ",indexOptions=" + indexOptions
        + ",payloads=" + storePayloads + ")";
  }
}
