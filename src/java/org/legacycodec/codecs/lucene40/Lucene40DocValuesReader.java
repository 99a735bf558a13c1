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
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.legacycodec.codecs.CodecUtil;
import org.legacycodec.codecs.DocValuesProducer;
import org.legacycodec.index.BinaryDocValues;
import org.legacycodec.index.CorruptIndexException;
import org.legacycodec.index.FieldInfo;
import org.legacycodec.index.IndexFileNames;
import org.legacycodec.index.NumericDocValues;
import org.legacycodec.index.SegmentReadState;
import org.legacycodec.index.SortedDocValues;
import org.legacycodec.index.SortedSetDocValues;
import org.legacycodec.store.CompoundFileDirectory;
import org.legacycodec.store.Directory;
import org.legacycodec.store.IndexInput;
import org.legacycodec.util.Bits;
import org.legacycodec.util.BytesRef;
import org.legacycodec.util.IOUtils;
import org.legacycodec.util.InfoStream;
import org.legacycodec.util.PagedBytes;
import org.legacycodec.util.RamUsageEstimator;
import org.legacycodec.util.packed.PackedInts;

/**
 * Reads the 4.0 format of norms/docvalues.
 * <p>
 * Every field is decoded fully into memory on first access and cached for
 * the lifetime of this reader. Cache hits do not lock; a miss locks the
 * reader, checks again, and publishes the decoded instance.
 */
final class Lucene40DocValuesReader extends DocValuesProducer {
  private final Directory dir;
  private final SegmentReadState state;
  private final String legacyKey;
  private final InfoStream infoStream;
  private static final String segmentSuffix = "dv";

  /** Info stream component name */
  static final String INFO_COMPONENT = "DV";

  // ram instances we have already loaded
  private final Map<Integer,NumericDocValues> numericInstances =
      new ConcurrentHashMap<Integer,NumericDocValues>();
  private final Map<Integer,BinaryDocValues> binaryInstances =
      new ConcurrentHashMap<Integer,BinaryDocValues>();
  private final Map<Integer,SortedDocValues> sortedInstances =
      new ConcurrentHashMap<Integer,SortedDocValues>();

  private final AtomicLong ramBytesUsed;

  Lucene40DocValuesReader(SegmentReadState state, String filename, String legacyKey) throws IOException {
    this.state = state;
    this.legacyKey = legacyKey;
    this.infoStream = state.infoStream;
    this.dir = new CompoundFileDirectory(state.directory, filename);
    ramBytesUsed = new AtomicLong(RamUsageEstimator.shallowSizeOfInstance(getClass()));
    if (infoStream.isEnabled(INFO_COMPONENT)) {
      infoStream.message(INFO_COMPONENT, "open " + filename + " key=" + legacyKey + " maxDoc=" + maxDoc());
    }
  }

  private int maxDoc() {
    return state.segmentInfo.getDocCount();
  }

  private String dataName(FieldInfo field) {
    return IndexFileNames.segmentFileName(state.segmentInfo.name + "_" + Integer.toString(field.number), segmentSuffix, "dat");
  }

  private String indexName(FieldInfo field) {
    return IndexFileNames.segmentFileName(state.segmentInfo.name + "_" + Integer.toString(field.number), segmentSuffix, "idx");
  }

  private LegacyDocValuesType typeOf(FieldInfo field, LegacyDocValuesType.Family expected) throws CorruptIndexException {
    final LegacyDocValuesType type = LegacyDocValuesType.forField(field, legacyKey);
    if (type.family != expected) {
      throw new IllegalStateException("field=\"" + field.name + "\" has doc values type " + type
          + " which cannot be read as " + expected);
    }
    return type;
  }

  @Override
  public NumericDocValues getNumeric(FieldInfo field) throws IOException {
    NumericDocValues instance = numericInstances.get(field.number);
    if (instance == null) {
      synchronized (this) {
        instance = numericInstances.get(field.number);
        if (instance == null) {
          instance = loadNumeric(field);
          numericInstances.put(field.number, instance);
        }
      }
    }
    return instance;
  }

  private NumericDocValues loadNumeric(FieldInfo field) throws IOException {
    final LegacyDocValuesType type = typeOf(field, LegacyDocValuesType.Family.NUMERIC);
    IndexInput input = dir.openInput(dataName(field));
    boolean success = false;
    try {
      final NumericDocValues instance;
      switch (type) {
        case VAR_INTS:
          instance = loadVarIntsField(field, input);
          break;
        case FIXED_INTS_8:
          instance = loadByteField(field, input);
          break;
        case FIXED_INTS_16:
          instance = loadShortField(field, input);
          break;
        case FIXED_INTS_32:
          instance = loadIntField(field, input);
          break;
        case FIXED_INTS_64:
          instance = loadLongField(field, input);
          break;
        case FLOAT_32:
          instance = loadFloatField(field, input);
          break;
        case FLOAT_64:
          instance = loadDoubleField(field, input);
          break;
        default:
          throw new AssertionError();
      }
      CodecUtil.checkEOF(input);
      success = true;
      return instance;
    } finally {
      if (success) {
        IOUtils.close(input);
      } else {
        IOUtils.closeWhileHandlingException(input);
      }
    }
  }

  private NumericDocValues loadVarIntsField(FieldInfo field, IndexInput input) throws IOException {
    CodecUtil.checkHeader(input, Lucene40DocValuesFormat.VAR_INTS_CODEC_NAME,
                                 Lucene40DocValuesFormat.VAR_INTS_VERSION_START,
                                 Lucene40DocValuesFormat.VAR_INTS_VERSION_CURRENT);
    byte header = input.readByte();
    if (header == Lucene40DocValuesFormat.VAR_INTS_FIXED_64) {
      int maxDoc = maxDoc();
      final long values[] = new long[maxDoc];
      for (int i = 0; i < values.length; i++) {
        values[i] = input.readLong();
      }
      ramBytesUsed.addAndGet(RamUsageEstimator.sizeOf(values));
      return new NumericDocValues() {
        @Override
        public long get(int docID) {
          return values[docID];
        }
      };
    } else if (header == Lucene40DocValuesFormat.VAR_INTS_PACKED) {
      final long minValue = input.readLong();
      final long defaultValue = input.readLong();
      final PackedInts.Reader reader = PackedInts.getReader(input);
      checkValueCount(reader, maxDoc(), input);
      ramBytesUsed.addAndGet(reader.ramBytesUsed());
      return new NumericDocValues() {
        @Override
        public long get(int docID) {
          final long value = reader.get(docID);
          if (value == defaultValue) {
            return 0;
          } else {
            return minValue + value;
          }
        }
      };
    } else {
      throw new CorruptIndexException("invalid VAR_INTS header byte: " + header + " (resource=" + input + ")");
    }
  }

  private static void checkValueSize(int valueSize, int expected, IndexInput input) throws CorruptIndexException {
    if (valueSize != expected) {
      throw new CorruptIndexException("invalid valueSize: " + valueSize + " (expected " + expected + ", resource=" + input + ")");
    }
  }

  private static void checkValueCount(PackedInts.Reader reader, int minSize, IndexInput input) throws CorruptIndexException {
    if (reader.size() < minSize) {
      throw new CorruptIndexException("packed ints hold " + reader.size() + " values but "
          + minSize + " are needed (resource=" + input + ")");
    }
  }

  private NumericDocValues loadByteField(FieldInfo field, IndexInput input) throws IOException {
    CodecUtil.checkHeader(input, Lucene40DocValuesFormat.INTS_CODEC_NAME,
                                 Lucene40DocValuesFormat.INTS_VERSION_START,
                                 Lucene40DocValuesFormat.INTS_VERSION_CURRENT);
    checkValueSize(input.readInt(), 1, input);
    int maxDoc = maxDoc();
    final byte values[] = new byte[maxDoc];
    input.readBytes(values, 0, values.length);
    ramBytesUsed.addAndGet(RamUsageEstimator.sizeOf(values));
    return new NumericDocValues() {
      @Override
      public long get(int docID) {
        return values[docID];
      }
    };
  }

  private NumericDocValues loadShortField(FieldInfo field, IndexInput input) throws IOException {
    CodecUtil.checkHeader(input, Lucene40DocValuesFormat.INTS_CODEC_NAME,
                                 Lucene40DocValuesFormat.INTS_VERSION_START,
                                 Lucene40DocValuesFormat.INTS_VERSION_CURRENT);
    checkValueSize(input.readInt(), 2, input);
    int maxDoc = maxDoc();
    final short values[] = new short[maxDoc];
    for (int i = 0; i < values.length; i++) {
      values[i] = input.readShort();
    }
    ramBytesUsed.addAndGet(RamUsageEstimator.sizeOf(values));
    return new NumericDocValues() {
      @Override
      public long get(int docID) {
        return values[docID];
      }
    };
  }

  private NumericDocValues loadIntField(FieldInfo field, IndexInput input) throws IOException {
    CodecUtil.checkHeader(input, Lucene40DocValuesFormat.INTS_CODEC_NAME,
                                 Lucene40DocValuesFormat.INTS_VERSION_START,
                                 Lucene40DocValuesFormat.INTS_VERSION_CURRENT);
    checkValueSize(input.readInt(), 4, input);
    int maxDoc = maxDoc();
    final int values[] = new int[maxDoc];
    for (int i = 0; i < values.length; i++) {
      values[i] = input.readInt();
    }
    ramBytesUsed.addAndGet(RamUsageEstimator.sizeOf(values));
    return new NumericDocValues() {
      @Override
      public long get(int docID) {
        return values[docID];
      }
    };
  }

  private NumericDocValues loadLongField(FieldInfo field, IndexInput input) throws IOException {
    CodecUtil.checkHeader(input, Lucene40DocValuesFormat.INTS_CODEC_NAME,
                                 Lucene40DocValuesFormat.INTS_VERSION_START,
                                 Lucene40DocValuesFormat.INTS_VERSION_CURRENT);
    checkValueSize(input.readInt(), 8, input);
    int maxDoc = maxDoc();
    final long values[] = new long[maxDoc];
    for (int i = 0; i < values.length; i++) {
      values[i] = input.readLong();
    }
    ramBytesUsed.addAndGet(RamUsageEstimator.sizeOf(values));
    return new NumericDocValues() {
      @Override
      public long get(int docID) {
        return values[docID];
      }
    };
  }

  private NumericDocValues loadFloatField(FieldInfo field, IndexInput input) throws IOException {
    CodecUtil.checkHeader(input, Lucene40DocValuesFormat.FLOATS_CODEC_NAME,
                                 Lucene40DocValuesFormat.FLOATS_VERSION_START,
                                 Lucene40DocValuesFormat.FLOATS_VERSION_CURRENT);
    checkValueSize(input.readInt(), 4, input);
    int maxDoc = maxDoc();
    final int values[] = new int[maxDoc];
    for (int i = 0; i < values.length; i++) {
      values[i] = input.readInt();
    }
    ramBytesUsed.addAndGet(RamUsageEstimator.sizeOf(values));
    return new NumericDocValues() {
      @Override
      public long get(int docID) {
        return values[docID];
      }
    };
  }

  private NumericDocValues loadDoubleField(FieldInfo field, IndexInput input) throws IOException {
    CodecUtil.checkHeader(input, Lucene40DocValuesFormat.FLOATS_CODEC_NAME,
                                 Lucene40DocValuesFormat.FLOATS_VERSION_START,
                                 Lucene40DocValuesFormat.FLOATS_VERSION_CURRENT);
    checkValueSize(input.readInt(), 8, input);
    int maxDoc = maxDoc();
    final long values[] = new long[maxDoc];
    for (int i = 0; i < values.length; i++) {
      values[i] = input.readLong();
    }
    ramBytesUsed.addAndGet(RamUsageEstimator.sizeOf(values));
    return new NumericDocValues() {
      @Override
      public long get(int docID) {
        return values[docID];
      }
    };
  }

  @Override
  public BinaryDocValues getBinary(FieldInfo field) throws IOException {
    BinaryDocValues instance = binaryInstances.get(field.number);
    if (instance == null) {
      synchronized (this) {
        instance = binaryInstances.get(field.number);
        if (instance == null) {
          switch (typeOf(field, LegacyDocValuesType.Family.BINARY)) {
            case BYTES_FIXED_STRAIGHT:
              instance = loadBytesFixedStraight(field);
              break;
            case BYTES_VAR_STRAIGHT:
              instance = loadBytesVarStraight(field);
              break;
            case BYTES_FIXED_DEREF:
              instance = loadBytesFixedDeref(field);
              break;
            case BYTES_VAR_DEREF:
              instance = loadBytesVarDeref(field);
              break;
            default:
              throw new AssertionError();
          }
          binaryInstances.put(field.number, instance);
        }
      }
    }
    return instance;
  }

  private BinaryDocValues loadBytesFixedStraight(FieldInfo field) throws IOException {
    IndexInput input = dir.openInput(dataName(field));
    boolean success = false;
    try {
      CodecUtil.checkHeader(input, Lucene40DocValuesFormat.BYTES_FIXED_STRAIGHT_CODEC_NAME,
                                   Lucene40DocValuesFormat.BYTES_FIXED_STRAIGHT_VERSION_START,
                                   Lucene40DocValuesFormat.BYTES_FIXED_STRAIGHT_VERSION_CURRENT);
      final int fixedLength = input.readInt();
      checkFixedLength(fixedLength, input);
      PagedBytes bytes = new PagedBytes(16);
      bytes.copy(input, fixedLength * (long)maxDoc());
      final PagedBytes.Reader bytesReader = bytes.freeze(true);
      CodecUtil.checkEOF(input);
      success = true;
      ramBytesUsed.addAndGet(bytes.ramBytesUsed());
      return new BinaryDocValues() {
        @Override
        public void get(int docID, BytesRef result) {
          bytesReader.fillSlice(result, fixedLength * (long)docID, fixedLength);
        }
      };
    } finally {
      if (success) {
        IOUtils.close(input);
      } else {
        IOUtils.closeWhileHandlingException(input);
      }
    }
  }

  private static void checkFixedLength(int fixedLength, IndexInput input) throws CorruptIndexException {
    if (fixedLength < 0 || fixedLength > Lucene40DocValuesFormat.MAX_BINARY_FIELD_LENGTH) {
      throw new CorruptIndexException("invalid fixed value length: " + fixedLength + " (resource=" + input + ")");
    }
  }

  private BinaryDocValues loadBytesVarStraight(FieldInfo field) throws IOException {
    IndexInput data = null;
    IndexInput index = null;
    boolean success = false;
    try {
      data = dir.openInput(dataName(field));
      CodecUtil.checkHeader(data, Lucene40DocValuesFormat.BYTES_VAR_STRAIGHT_CODEC_NAME_DAT,
                                  Lucene40DocValuesFormat.BYTES_VAR_STRAIGHT_VERSION_START,
                                  Lucene40DocValuesFormat.BYTES_VAR_STRAIGHT_VERSION_CURRENT);
      index = dir.openInput(indexName(field));
      CodecUtil.checkHeader(index, Lucene40DocValuesFormat.BYTES_VAR_STRAIGHT_CODEC_NAME_IDX,
                                   Lucene40DocValuesFormat.BYTES_VAR_STRAIGHT_VERSION_START,
                                   Lucene40DocValuesFormat.BYTES_VAR_STRAIGHT_VERSION_CURRENT);
      long totalBytes = index.readVLong();
      PagedBytes bytes = new PagedBytes(16);
      bytes.copy(data, totalBytes);
      final PagedBytes.Reader bytesReader = bytes.freeze(true);
      final PackedInts.Reader reader = PackedInts.getReader(index);
      checkValueCount(reader, maxDoc() + 1, index);
      CodecUtil.checkEOF(data);
      CodecUtil.checkEOF(index);
      success = true;
      ramBytesUsed.addAndGet(bytes.ramBytesUsed() + reader.ramBytesUsed());
      return new BinaryDocValues() {
        @Override
        public void get(int docID, BytesRef result) {
          long startAddress = reader.get(docID);
          long endAddress = reader.get(docID+1);
          bytesReader.fillSlice(result, startAddress, (int)(endAddress - startAddress));
        }
      };
    } finally {
      if (success) {
        IOUtils.close(data, index);
      } else {
        IOUtils.closeWhileHandlingException(data, index);
      }
    }
  }

  private BinaryDocValues loadBytesFixedDeref(FieldInfo field) throws IOException {
    IndexInput data = null;
    IndexInput index = null;
    boolean success = false;
    try {
      data = dir.openInput(dataName(field));
      CodecUtil.checkHeader(data, Lucene40DocValuesFormat.BYTES_FIXED_DEREF_CODEC_NAME_DAT,
                                  Lucene40DocValuesFormat.BYTES_FIXED_DEREF_VERSION_START,
                                  Lucene40DocValuesFormat.BYTES_FIXED_DEREF_VERSION_CURRENT);
      index = dir.openInput(indexName(field));
      CodecUtil.checkHeader(index, Lucene40DocValuesFormat.BYTES_FIXED_DEREF_CODEC_NAME_IDX,
                                   Lucene40DocValuesFormat.BYTES_FIXED_DEREF_VERSION_START,
                                   Lucene40DocValuesFormat.BYTES_FIXED_DEREF_VERSION_CURRENT);

      final int fixedLength = data.readInt();
      checkFixedLength(fixedLength, data);
      final int valueCount = index.readInt();
      if (valueCount < 0) {
        throw new CorruptIndexException("invalid valueCount: " + valueCount + " (resource=" + index + ")");
      }
      PagedBytes bytes = new PagedBytes(16);
      bytes.copy(data, fixedLength * (long) valueCount);
      final PagedBytes.Reader bytesReader = bytes.freeze(true);
      final PackedInts.Reader reader = PackedInts.getReader(index);
      checkValueCount(reader, maxDoc(), index);
      CodecUtil.checkEOF(data);
      CodecUtil.checkEOF(index);
      ramBytesUsed.addAndGet(bytes.ramBytesUsed() + reader.ramBytesUsed());
      success = true;
      return new BinaryDocValues() {
        @Override
        public void get(int docID, BytesRef result) {
          final long offset = fixedLength * reader.get(docID);
          bytesReader.fillSlice(result, offset, fixedLength);
        }
      };
    } finally {
      if (success) {
        IOUtils.close(data, index);
      } else {
        IOUtils.closeWhileHandlingException(data, index);
      }
    }
  }

  private BinaryDocValues loadBytesVarDeref(FieldInfo field) throws IOException {
    IndexInput data = null;
    IndexInput index = null;
    boolean success = false;
    try {
      data = dir.openInput(dataName(field));
      CodecUtil.checkHeader(data, Lucene40DocValuesFormat.BYTES_VAR_DEREF_CODEC_NAME_DAT,
                                  Lucene40DocValuesFormat.BYTES_VAR_DEREF_VERSION_START,
                                  Lucene40DocValuesFormat.BYTES_VAR_DEREF_VERSION_CURRENT);
      index = dir.openInput(indexName(field));
      CodecUtil.checkHeader(index, Lucene40DocValuesFormat.BYTES_VAR_DEREF_CODEC_NAME_IDX,
                                   Lucene40DocValuesFormat.BYTES_VAR_DEREF_VERSION_START,
                                   Lucene40DocValuesFormat.BYTES_VAR_DEREF_VERSION_CURRENT);

      final long totalBytes = index.readLong();
      final PagedBytes bytes = new PagedBytes(16);
      bytes.copy(data, totalBytes);
      final PagedBytes.Reader bytesReader = bytes.freeze(true);
      final PackedInts.Reader reader = PackedInts.getReader(index);
      checkValueCount(reader, maxDoc(), index);
      CodecUtil.checkEOF(data);
      CodecUtil.checkEOF(index);
      ramBytesUsed.addAndGet(bytes.ramBytesUsed() + reader.ramBytesUsed());
      success = true;
      return new BinaryDocValues() {
        @Override
        public void get(int docID, BytesRef result) {
          long startAddress = reader.get(docID);
          BytesRef lengthBytes = new BytesRef();
          bytesReader.fillSlice(lengthBytes, startAddress, 1);
          byte code = lengthBytes.bytes[lengthBytes.offset];
          if ((code & 128) == 0) {
            // length is 1 byte
            bytesReader.fillSlice(result, startAddress + 1, (int) code);
          } else {
            bytesReader.fillSlice(lengthBytes, startAddress + 1, 1);
            int length = ((code & 0x7f) << 8) | (lengthBytes.bytes[lengthBytes.offset] & 0xff);
            bytesReader.fillSlice(result, startAddress + 2, length);
          }
        }
      };
    } finally {
      if (success) {
        IOUtils.close(data, index);
      } else {
        IOUtils.closeWhileHandlingException(data, index);
      }
    }
  }

  @Override
  public SortedDocValues getSorted(FieldInfo field) throws IOException {
    SortedDocValues instance = sortedInstances.get(field.number);
    if (instance == null) {
      synchronized (this) {
        instance = sortedInstances.get(field.number);
        if (instance == null) {
          instance = loadSorted(field);
          sortedInstances.put(field.number, instance);
        }
      }
    }
    return instance;
  }

  private SortedDocValues loadSorted(FieldInfo field) throws IOException {
    final LegacyDocValuesType type = typeOf(field, LegacyDocValuesType.Family.SORTED);
    IndexInput data = null;
    IndexInput index = null;
    boolean success = false;
    try {
      data = dir.openInput(dataName(field));
      index = dir.openInput(indexName(field));
      final SortedDocValues instance;
      switch (type) {
        case BYTES_FIXED_SORTED:
          instance = loadBytesFixedSorted(field, data, index);
          break;
        case BYTES_VAR_SORTED:
          instance = loadBytesVarSorted(field, data, index);
          break;
        default:
          throw new AssertionError();
      }
      CodecUtil.checkEOF(data);
      CodecUtil.checkEOF(index);
      success = true;
      return instance;
    } finally {
      if (success) {
        IOUtils.close(data, index);
      } else {
        IOUtils.closeWhileHandlingException(data, index);
      }
    }
  }

  private SortedDocValues loadBytesFixedSorted(FieldInfo field, IndexInput data, IndexInput index) throws IOException {
    CodecUtil.checkHeader(data, Lucene40DocValuesFormat.BYTES_FIXED_SORTED_CODEC_NAME_DAT,
                                Lucene40DocValuesFormat.BYTES_FIXED_SORTED_VERSION_START,
                                Lucene40DocValuesFormat.BYTES_FIXED_SORTED_VERSION_CURRENT);
    CodecUtil.checkHeader(index, Lucene40DocValuesFormat.BYTES_FIXED_SORTED_CODEC_NAME_IDX,
                                 Lucene40DocValuesFormat.BYTES_FIXED_SORTED_VERSION_START,
                                 Lucene40DocValuesFormat.BYTES_FIXED_SORTED_VERSION_CURRENT);

    final int fixedLength = data.readInt();
    checkFixedLength(fixedLength, data);
    final int valueCount = index.readInt();
    if (valueCount < 0) {
      throw new CorruptIndexException("invalid valueCount: " + valueCount + " (resource=" + index + ")");
    }

    PagedBytes bytes = new PagedBytes(16);
    bytes.copy(data, fixedLength * (long) valueCount);
    final PagedBytes.Reader bytesReader = bytes.freeze(true);
    final PackedInts.Reader reader = PackedInts.getReader(index);
    checkValueCount(reader, maxDoc(), index);
    ramBytesUsed.addAndGet(bytes.ramBytesUsed() + reader.ramBytesUsed());

    return correctBuggyOrds(field, new SortedDocValues() {
      @Override
      public int getOrd(int docID) {
        return (int) reader.get(docID);
      }

      @Override
      public void lookupOrd(int ord, BytesRef result) {
        bytesReader.fillSlice(result, fixedLength * (long) ord, fixedLength);
      }

      @Override
      public int getValueCount() {
        return valueCount;
      }
    });
  }

  private SortedDocValues loadBytesVarSorted(FieldInfo field, IndexInput data, IndexInput index) throws IOException {
    CodecUtil.checkHeader(data, Lucene40DocValuesFormat.BYTES_VAR_SORTED_CODEC_NAME_DAT,
                                Lucene40DocValuesFormat.BYTES_VAR_SORTED_VERSION_START,
                                Lucene40DocValuesFormat.BYTES_VAR_SORTED_VERSION_CURRENT);
    CodecUtil.checkHeader(index, Lucene40DocValuesFormat.BYTES_VAR_SORTED_CODEC_NAME_IDX,
                                 Lucene40DocValuesFormat.BYTES_VAR_SORTED_VERSION_START,
                                 Lucene40DocValuesFormat.BYTES_VAR_SORTED_VERSION_CURRENT);

    long maxAddress = index.readLong();
    PagedBytes bytes = new PagedBytes(16);
    bytes.copy(data, maxAddress);
    final PagedBytes.Reader bytesReader = bytes.freeze(true);
    final PackedInts.Reader addressReader = PackedInts.getReader(index);
    final PackedInts.Reader ordsReader = PackedInts.getReader(index);
    checkValueCount(ordsReader, maxDoc(), index);

    final int valueCount = addressReader.size() - 1;
    if (valueCount < 0) {
      throw new CorruptIndexException("address table is empty (resource=" + index + ")");
    }
    ramBytesUsed.addAndGet(bytes.ramBytesUsed() + addressReader.ramBytesUsed() + ordsReader.ramBytesUsed());

    return correctBuggyOrds(field, new SortedDocValues() {
      @Override
      public int getOrd(int docID) {
        return (int) ordsReader.get(docID);
      }

      @Override
      public void lookupOrd(int ord, BytesRef result) {
        long startAddress = addressReader.get(ord);
        long endAddress = addressReader.get(ord+1);
        bytesReader.fillSlice(result, startAddress, (int)(endAddress - startAddress));
      }

      @Override
      public int getValueCount() {
        return valueCount;
      }
    });
  }

  // detects and corrects the reserved-ord-0 bug of old indexes: when no document
  // uses ord 0, ords are shifted down by one
  private SortedDocValues correctBuggyOrds(FieldInfo field, final SortedDocValues in) {
    final int maxDoc = maxDoc();
    if (in.getValueCount() == 0) {
      return in;
    }
    for (int i = 0; i < maxDoc; i++) {
      if (in.getOrd(i) == 0) {
        return in; // ok
      }
    }

    if (infoStream.isEnabled(INFO_COMPONENT)) {
      infoStream.message(INFO_COMPONENT, "field=\"" + field.name + "\": no document uses ord 0; shifting "
          + in.getValueCount() + " ords down by one");
    }

    // we had ord holes, return an ord-shifting-impl that corrects the bug
    return new SortedDocValues() {
      @Override
      public int getOrd(int docID) {
        return in.getOrd(docID) - 1;
      }

      @Override
      public void lookupOrd(int ord, BytesRef result) {
        in.lookupOrd(ord+1, result);
      }

      @Override
      public int getValueCount() {
        return in.getValueCount() - 1;
      }
    };
  }

  @Override
  public SortedSetDocValues getSortedSet(FieldInfo field) throws IOException {
    throw new IllegalStateException("Lucene 4.0 does not support SortedSet: how did you pull this off?");
  }

  @Override
  public Bits getDocsWithField(FieldInfo field) throws IOException {
    return new Bits.MatchAllBits(maxDoc());
  }

  @Override
  public void close() throws IOException {
    dir.close();
  }

  @Override
  public long ramBytesUsed() {
    return ramBytesUsed.get();
  }

  @Override
  public void checkIntegrity() throws IOException {
  }
}
