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

import org.legacycodec.index.CorruptIndexException;
import org.legacycodec.index.FieldInfo;

/**
 * The per-field doc values types of the 4.0 index format, as recorded in a
 * field's attributes.
 * <p>
 * Each type belongs to one access family: numeric types are read through
 * {@link Lucene40DocValuesReader#getNumeric}, straight and dereferenced bytes
 * through {@link Lucene40DocValuesReader#getBinary} and sorted bytes through
 * {@link Lucene40DocValuesReader#getSorted}.
 */
enum LegacyDocValuesType {
  NONE(Family.NONE),
  VAR_INTS(Family.NUMERIC),
  FLOAT_32(Family.NUMERIC),
  FLOAT_64(Family.NUMERIC),
  BYTES_FIXED_STRAIGHT(Family.BINARY),
  BYTES_FIXED_DEREF(Family.BINARY),
  BYTES_VAR_STRAIGHT(Family.BINARY),
  BYTES_VAR_DEREF(Family.BINARY),
  FIXED_INTS_16(Family.NUMERIC),
  FIXED_INTS_32(Family.NUMERIC),
  FIXED_INTS_64(Family.NUMERIC),
  FIXED_INTS_8(Family.NUMERIC),
  BYTES_FIXED_SORTED(Family.SORTED),
  BYTES_VAR_SORTED(Family.SORTED);

  /** Attribute key holding a field's doc values type. */
  static final String LEGACY_DV_TYPE_KEY = "Lucene40FieldInfosReader.dvtype";
  /** Attribute key holding a field's norms type. */
  static final String LEGACY_NORM_TYPE_KEY = "Lucene40FieldInfosReader.normtype";

  /** Which accessor a type is read through. */
  enum Family { NONE, NUMERIC, BINARY, SORTED }

  final Family family;

  private LegacyDocValuesType(Family family) {
    this.family = family;
  }

  /**
   * Returns the type stored under <code>legacyKey</code> in the field's
   * attributes.
   * @throws CorruptIndexException if the attribute is missing or names no
   *         known type
   */
  static LegacyDocValuesType forField(FieldInfo field, String legacyKey) throws CorruptIndexException {
    final String value = field.getAttribute(legacyKey);
    if (value == null) {
      throw new CorruptIndexException("field=\"" + field.name + "\" has no legacy doc values type (key=" + legacyKey + ")");
    }
    try {
      return valueOf(value);
    } catch (IllegalArgumentException e) {
      throw new CorruptIndexException("field=\"" + field.name + "\" has invalid legacy doc values type: " + value, e);
    }
  }
}
