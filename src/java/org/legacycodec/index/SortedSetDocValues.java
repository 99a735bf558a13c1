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

import org.legacycodec.util.BytesRef;

/**
 * A per-document set of presorted byte[] values.
 * <p>
 * Segments written by the 4.0 format never carry this kind of values;
 * the type exists so readers can refuse it explicitly.
 */
public abstract class SortedSetDocValues {

  /** When returned by {@link #nextOrd()} it means there are no more
   *  ordinals for the document. */
  public static final long NO_MORE_ORDS = -1;

  /** Sole constructor. (For invocation by subclass
   * constructors, typically implicit.) */
  protected SortedSetDocValues() {}

  /** Returns the next ordinal for the current document (previously
   *  set by {@link #setDocument(int)}, or {@link #NO_MORE_ORDS}. */
  public abstract long nextOrd();

  /** Sets iteration to the specified docID */
  public abstract void setDocument(int docID);

  /** Retrieves the value for the specified ordinal. */
  public abstract void lookupOrd(long ord, BytesRef result);

  /** Returns the number of unique values. */
  public abstract long getValueCount();
}
