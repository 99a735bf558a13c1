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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import org.legacycodec.codecs.Codec;
import org.legacycodec.codecs.CodecUtil;
import org.legacycodec.codecs.DocValuesProducer;
import org.legacycodec.index.BinaryDocValues;
import org.legacycodec.index.CorruptIndexException;
import org.legacycodec.index.FieldInfo;
import org.legacycodec.index.FieldInfo.IndexOptions;
import org.legacycodec.index.FieldInfos;
import org.legacycodec.index.NumericDocValues;
import org.legacycodec.index.SegmentInfo;
import org.legacycodec.index.SegmentReadState;
import org.legacycodec.index.SegmentWriteState;
import org.legacycodec.index.SortedDocValues;
import org.legacycodec.store.CompoundFileWriter;
import org.legacycodec.store.IndexOutput;
import org.legacycodec.store.MockDirectoryWrapper;
import org.legacycodec.util.Bits;
import org.legacycodec.util.BytesRef;
import org.legacycodec.util.CodecTestCase;
import org.legacycodec.util.RecordingInfoStream;
import org.legacycodec.util.packed.PackedInts;

public class TestLucene40DocValuesReader extends CodecTestCase {

  private static FieldInfo field(String name, int number) {
    return new FieldInfo(name, number, IndexOptions.DOCS_ONLY, false);
  }

  private static DocValuesProducer openDocValues(MockDirectoryWrapper dir, SegmentInfo info, FieldInfo... fields) throws IOException {
    return new Lucene40DocValuesFormat().fieldsProducer(new SegmentReadState(dir, info, new FieldInfos(fields)));
  }

  private static Lucene40DocValuesWriter newWriter(MockDirectoryWrapper dir, SegmentInfo info, FieldInfo... fields) {
    return Lucene40DocValuesWriter.forDocValues(new SegmentWriteState(dir, info, new FieldInfos(fields)));
  }

  private static String typeOf(FieldInfo field) {
    return field.getAttribute(LegacyDocValuesType.LEGACY_DV_TYPE_KEY);
  }

  private static BytesRef randomBytes(Random random, int length) {
    byte[] bytes = new byte[length];
    random.nextBytes(bytes);
    return new BytesRef(bytes);
  }

  private static void assertNumeric(List<? extends Number> expected, NumericDocValues values) {
    for (int doc = 0; doc < expected.size(); doc++) {
      final Number n = expected.get(doc);
      assertEquals("doc=" + doc, n == null ? 0 : n.longValue(), values.get(doc));
    }
  }

  private static void assertBinary(List<BytesRef> expected, BinaryDocValues values) {
    BytesRef scratch = new BytesRef();
    for (int doc = 0; doc < expected.size(); doc++) {
      final BytesRef b = expected.get(doc);
      values.get(doc, scratch);
      assertEquals("doc=" + doc, b == null ? new BytesRef() : b, scratch);
    }
  }

  public void testNumericLayoutSelection() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    final Random random = random();
    final int maxDoc = nextInt(random, 10, 500);
    SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
    FieldInfo bytes = field("bytes", 0);
    FieldInfo shorts = field("shorts", 1);
    FieldInfo ints = field("ints", 2);
    FieldInfo small = field("small", 3);
    FieldInfo wide = field("wide", 4);

    final long[][] ranges = new long[][] {
      {-100, 100}, {-1000, 1000}, {-100000, 100000}, {0, 10}, {-(1L << 40), 1L << 40}
    };
    final FieldInfo[] fields = new FieldInfo[] {bytes, shorts, ints, small, wide};
    final List<List<Long>> expected = new ArrayList<List<Long>>();
    Lucene40DocValuesWriter writer = newWriter(dir, info, fields);
    for (int f = 0; f < fields.length; f++) {
      List<Long> values = new ArrayList<Long>();
      for (int doc = 0; doc < maxDoc; doc++) {
        final long min = ranges[f][0];
        final long max = ranges[f][1];
        // both ends of the range appear so the writer sees the full span
        final long v = doc == 0 ? min : doc == 1 ? max : min + (long) (random.nextDouble() * (max - min));
        values.add(v);
      }
      expected.add(values);
      writer.addNumericField(fields[f], new ArrayList<Number>(values));
    }
    writer.close();

    assertEquals("FIXED_INTS_8", typeOf(bytes));
    assertEquals("FIXED_INTS_16", typeOf(shorts));
    assertEquals("FIXED_INTS_32", typeOf(ints));
    assertEquals("VAR_INTS", typeOf(small));
    assertEquals("VAR_INTS", typeOf(wide));

    DocValuesProducer producer = openDocValues(dir, info, fields);
    for (int f = 0; f < fields.length; f++) {
      assertNumeric(expected.get(f), producer.getNumeric(fields[f]));
    }
    producer.close();
    dir.close();
  }

  public void testFixedIntsAndFloats() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    final Random random = random();
    final int maxDoc = nextInt(random, 1, 300);
    SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
    FieldInfo longs = field("longs", 0);
    FieldInfo floats = field("floats", 1);
    FieldInfo doubles = field("doubles", 2);
    FieldInfo fixed64 = field("fixed64", 3);

    List<Number> longValues = new ArrayList<Number>();
    List<Number> floatValues = new ArrayList<Number>();
    List<Number> doubleValues = new ArrayList<Number>();
    List<Number> fixed64Values = new ArrayList<Number>();
    for (int doc = 0; doc < maxDoc; doc++) {
      longValues.add(random.nextLong());
      floatValues.add(random.nextFloat() * 1000 - 500);
      doubleValues.add(random.nextDouble() * 1e10 - 5e9);
      fixed64Values.add(doc % 2 == 0 ? Long.MIN_VALUE : Long.MAX_VALUE);
    }
    Lucene40DocValuesWriter writer = newWriter(dir, info, longs, floats, doubles, fixed64);
    writer.writeFixedInts(longs, longValues, 8);
    writer.writeFloats(floats, floatValues, false);
    writer.writeFloats(doubles, doubleValues, true);
    writer.writeVarIntsFixed64(fixed64, fixed64Values);
    writer.close();
    assertEquals("FIXED_INTS_64", typeOf(longs));
    assertEquals("FLOAT_32", typeOf(floats));
    assertEquals("FLOAT_64", typeOf(doubles));
    assertEquals("VAR_INTS", typeOf(fixed64));

    DocValuesProducer producer = openDocValues(dir, info, longs, floats, doubles, fixed64);
    assertNumeric(longValues, producer.getNumeric(longs));
    assertNumeric(fixed64Values, producer.getNumeric(fixed64));
    NumericDocValues floatDV = producer.getNumeric(floats);
    NumericDocValues doubleDV = producer.getNumeric(doubles);
    for (int doc = 0; doc < maxDoc; doc++) {
      // floats come back as their raw bits
      final int floatBits = Float.floatToRawIntBits(floatValues.get(doc).floatValue());
      assertEquals(floatBits, floatDV.get(doc));
      assertEquals(floatValues.get(doc).floatValue(), Float.intBitsToFloat((int) floatDV.get(doc)), 0f);
      assertEquals(Double.doubleToRawLongBits(doubleValues.get(doc).doubleValue()), doubleDV.get(doc));
    }
    producer.close();
    dir.close();
  }

  public void testVarIntsMissingValuesReadAsZero() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    SegmentInfo info = new SegmentInfo(dir, "_0", 6);
    FieldInfo field = field("f", 0);
    List<Number> values = Arrays.<Number>asList(17L, null, -3L, 40L, null, 5L);
    Lucene40DocValuesWriter writer = newWriter(dir, info, field);
    writer.writeVarInts(field, values);
    writer.close();

    DocValuesProducer producer = openDocValues(dir, info, field);
    NumericDocValues dv = producer.getNumeric(field);
    assertEquals(17, dv.get(0));
    assertEquals(0, dv.get(1));
    assertEquals(-3, dv.get(2));
    assertEquals(40, dv.get(3));
    assertEquals(0, dv.get(4));
    assertEquals(5, dv.get(5));
    producer.close();
    dir.close();
  }

  public void testBinaryLayouts() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    final Random random = random();
    final int maxDoc = nextInt(random, 1, 400);
    SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
    final LegacyDocValuesType[] types = new LegacyDocValuesType[] {
      LegacyDocValuesType.BYTES_FIXED_STRAIGHT, LegacyDocValuesType.BYTES_VAR_STRAIGHT,
      LegacyDocValuesType.BYTES_FIXED_DEREF, LegacyDocValuesType.BYTES_VAR_DEREF
    };
    FieldInfo[] fields = new FieldInfo[types.length];
    List<List<BytesRef>> expected = new ArrayList<List<BytesRef>>();
    for (int f = 0; f < types.length; f++) {
      fields[f] = field(types[f].name(), f);
      final boolean fixed = types[f] == LegacyDocValuesType.BYTES_FIXED_STRAIGHT || types[f] == LegacyDocValuesType.BYTES_FIXED_DEREF;
      final int fixedLength = random.nextInt(10);
      // a small pool of values so dereferenced layouts share them
      List<BytesRef> pool = new ArrayList<BytesRef>();
      final int poolSize = nextInt(random, 1, 20);
      for (int i = 0; i < poolSize; i++) {
        // var length values include some needing a two byte length prefix
        final int length = fixed ? fixedLength : random.nextInt(5) == 0 ? nextInt(random, 128, 400) : random.nextInt(20);
        pool.add(randomBytes(random, length));
      }
      List<BytesRef> values = new ArrayList<BytesRef>();
      for (int doc = 0; doc < maxDoc; doc++) {
        values.add(!fixed && random.nextInt(10) == 0 ? null : pool.get(random.nextInt(poolSize)));
      }
      expected.add(values);
    }
    Lucene40DocValuesWriter writer = newWriter(dir, info, fields);
    for (int f = 0; f < types.length; f++) {
      writer.writeBinary(fields[f], expected.get(f), types[f]);
    }
    writer.close();

    DocValuesProducer producer = openDocValues(dir, info, fields);
    for (int f = 0; f < types.length; f++) {
      assertEquals(types[f].name(), typeOf(fields[f]));
      assertBinary(expected.get(f), producer.getBinary(fields[f]));
    }
    producer.close();
    dir.close();
  }

  public void testBinaryLayoutSelection() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    final int maxDoc = 100;
    SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
    FieldInfo fixedShared = field("fixedShared", 0);
    FieldInfo varShared = field("varShared", 1);
    FieldInfo fixedUnique = field("fixedUnique", 2);
    FieldInfo varUnique = field("varUnique", 3);

    List<BytesRef> fixedSharedValues = new ArrayList<BytesRef>();
    List<BytesRef> varSharedValues = new ArrayList<BytesRef>();
    List<BytesRef> fixedUniqueValues = new ArrayList<BytesRef>();
    List<BytesRef> varUniqueValues = new ArrayList<BytesRef>();
    for (int doc = 0; doc < maxDoc; doc++) {
      fixedSharedValues.add(new BytesRef(doc % 2 == 0 ? "even" : "odd!"));
      varSharedValues.add(new BytesRef(doc % 3 == 0 ? "fizz" : "no"));
      fixedUniqueValues.add(new BytesRef(String.format("%05d", doc)));
      varUniqueValues.add(new BytesRef(Integer.toString(doc)));
    }
    Lucene40DocValuesWriter writer = newWriter(dir, info, fixedShared, varShared, fixedUnique, varUnique);
    writer.addBinaryField(fixedShared, fixedSharedValues);
    writer.addBinaryField(varShared, varSharedValues);
    writer.addBinaryField(fixedUnique, fixedUniqueValues);
    writer.addBinaryField(varUnique, varUniqueValues);
    writer.close();
    assertEquals("BYTES_FIXED_DEREF", typeOf(fixedShared));
    assertEquals("BYTES_VAR_DEREF", typeOf(varShared));
    assertEquals("BYTES_FIXED_STRAIGHT", typeOf(fixedUnique));
    assertEquals("BYTES_VAR_STRAIGHT", typeOf(varUnique));

    DocValuesProducer producer = openDocValues(dir, info, fixedShared, varShared, fixedUnique, varUnique);
    assertBinary(fixedSharedValues, producer.getBinary(fixedShared));
    assertBinary(varSharedValues, producer.getBinary(varShared));
    assertBinary(fixedUniqueValues, producer.getBinary(fixedUnique));
    assertBinary(varUniqueValues, producer.getBinary(varUnique));
    producer.close();
    dir.close();
  }

  private static List<BytesRef> sortedValues(Random random, int count, boolean fixed) {
    TreeSet<BytesRef> set = new TreeSet<BytesRef>();
    final int fixedLength = nextInt(random, 1, 8);
    if (!fixed) {
      // two lengths, otherwise the writer picks the fixed layout
      set.add(randomBytes(random, 1));
      set.add(randomBytes(random, 2));
    }
    while (set.size() < count) {
      set.add(randomBytes(random, fixed ? fixedLength : nextInt(random, 1, 30)));
    }
    return new ArrayList<BytesRef>(set);
  }

  private static void assertSorted(List<BytesRef> values, List<Number> docToOrd, SortedDocValues dv) {
    assertEquals(values.size(), dv.getValueCount());
    BytesRef scratch = new BytesRef();
    for (int ord = 0; ord < values.size(); ord++) {
      dv.lookupOrd(ord, scratch);
      assertEquals(values.get(ord), scratch);
    }
    for (int doc = 0; doc < docToOrd.size(); doc++) {
      final int ord = docToOrd.get(doc).intValue();
      assertEquals("doc=" + doc, ord, dv.getOrd(doc));
      dv.get(doc, scratch);
      assertEquals(values.get(ord), scratch);
    }
  }

  public void testSortedLayouts() throws Exception {
    final Random random = random();
    for (boolean fixed : new boolean[] {true, false}) {
      MockDirectoryWrapper dir = newDirectory();
      final int maxDoc = nextInt(random, 1, 300);
      SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
      FieldInfo field = field("sorted", 0);
      List<BytesRef> values = sortedValues(random, nextInt(random, 1, 50), fixed);
      List<Number> docToOrd = new ArrayList<Number>();
      for (int doc = 0; doc < maxDoc; doc++) {
        docToOrd.add(doc == 0 ? 0 : random.nextInt(values.size()));
      }
      RecordingInfoStream infoStream = new RecordingInfoStream();
      Lucene40DocValuesWriter writer = newWriter(dir, info, field);
      writer.addSortedField(field, values, docToOrd);
      writer.close();
      assertEquals(fixed ? "BYTES_FIXED_SORTED" : "BYTES_VAR_SORTED", typeOf(field));

      DocValuesProducer producer = new Lucene40DocValuesFormat().fieldsProducer(
          new SegmentReadState(dir, info, new FieldInfos(field), "", infoStream));
      assertSorted(values, docToOrd, producer.getSorted(field));
      producer.close();
      // ord 0 is in use, so nothing was corrected
      for (String message : infoStream.getMessages(Lucene40DocValuesReader.INFO_COMPONENT)) {
        assertFalse(message, message.contains("shifting"));
      }
      dir.close();
    }
  }

  public void testReservedOrdZeroIsShiftedAway() throws Exception {
    final Random random = random();
    for (boolean fixed : new boolean[] {true, false}) {
      MockDirectoryWrapper dir = newDirectory();
      final int maxDoc = nextInt(random, 1, 300);
      SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
      FieldInfo field = field("sorted", 0);
      List<BytesRef> values = sortedValues(random, nextInt(random, 1, 50), fixed);
      List<Number> docToOrd = new ArrayList<Number>();
      for (int doc = 0; doc < maxDoc; doc++) {
        docToOrd.add(random.nextInt(values.size()));
      }
      Lucene40DocValuesWriter writer = newWriter(dir, info, field);
      writer.writeSorted(field, values, docToOrd, true);
      writer.close();

      RecordingInfoStream infoStream = new RecordingInfoStream();
      DocValuesProducer producer = new Lucene40DocValuesFormat().fieldsProducer(
          new SegmentReadState(dir, info, new FieldInfos(field), "", infoStream));
      assertSorted(values, docToOrd, producer.getSorted(field));
      producer.close();

      List<String> messages = infoStream.getMessages(Lucene40DocValuesReader.INFO_COMPONENT);
      assertTrue(messages.toString(), messages.contains(
          "field=\"sorted\": no document uses ord 0; shifting " + (values.size() + 1) + " ords down by one"));
      dir.close();
    }
  }

  public void testSortedOnEmptySegment() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    SegmentInfo info = new SegmentInfo(dir, "_0", 0);
    FieldInfo empty = field("empty", 0);
    FieldInfo reserved = field("reserved", 1);
    FieldInfo plain = field("plain", 2);
    Lucene40DocValuesWriter writer = newWriter(dir, info, empty, reserved, plain);
    writer.addSortedField(empty, new ArrayList<BytesRef>(), new ArrayList<Number>());
    writer.writeSorted(reserved, Arrays.asList(new BytesRef("a")), new ArrayList<Number>(), true);
    writer.addSortedField(plain, Arrays.asList(new BytesRef("a"), new BytesRef("b")), new ArrayList<Number>());
    writer.close();

    RecordingInfoStream infoStream = new RecordingInfoStream();
    DocValuesProducer producer = new Lucene40DocValuesFormat().fieldsProducer(
        new SegmentReadState(dir, info, new FieldInfos(empty, reserved, plain), "", infoStream));
    assertEquals(0, producer.getSorted(empty).getValueCount());

    // no document uses ord 0, so the reserved value is dropped
    BytesRef scratch = new BytesRef();
    SortedDocValues dv = producer.getSorted(reserved);
    assertEquals(1, dv.getValueCount());
    dv.lookupOrd(0, scratch);
    assertEquals(new BytesRef("a"), scratch);

    // without documents a table with a real ord 0 cannot be told apart, it is shifted too
    dv = producer.getSorted(plain);
    assertEquals(1, dv.getValueCount());
    dv.lookupOrd(0, scratch);
    assertEquals(new BytesRef("b"), scratch);
    producer.close();

    List<String> messages = infoStream.getMessages(Lucene40DocValuesReader.INFO_COMPONENT);
    assertTrue(messages.toString(), messages.contains(
        "field=\"reserved\": no document uses ord 0; shifting 2 ords down by one"));
    assertTrue(messages.toString(), messages.contains(
        "field=\"plain\": no document uses ord 0; shifting 2 ords down by one"));
    dir.close();
  }

  public void testNorms() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    final Random random = random();
    final int maxDoc = nextInt(random, 1, 200);
    SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
    FieldInfo field = field("body", 0);
    List<Number> norms = new ArrayList<Number>();
    for (int doc = 0; doc < maxDoc; doc++) {
      norms.add((long) (byte) random.nextInt(256));
    }
    Lucene40DocValuesWriter writer = Lucene40DocValuesWriter.forNorms(new SegmentWriteState(dir, info, new FieldInfos(field)));
    writer.writeFixedInts(field, norms, 1);
    writer.close();
    assertTrue(dir.fileExists("_0_nrm.cfs"));
    assertTrue(dir.fileExists("_0_nrm.cfe"));
    assertFalse(dir.fileExists("_0_dv.cfs"));
    assertEquals("FIXED_INTS_8", field.getAttribute(LegacyDocValuesType.LEGACY_NORM_TYPE_KEY));
    assertNull(typeOf(field));

    DocValuesProducer producer = new Lucene40NormsFormat().normsProducer(new SegmentReadState(dir, info, new FieldInfos(field)));
    assertNumeric(norms, producer.getNumeric(field));
    producer.close();

    try {
      new Lucene40NormsFormat().normsConsumer(new SegmentWriteState(dir, info, new FieldInfos(field)));
      fail("norms are read-only");
    } catch (UnsupportedOperationException expected) {
      // expected
    }
    dir.close();
  }

  public void testWrongFamily() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    SegmentInfo info = new SegmentInfo(dir, "_0", 3);
    FieldInfo numeric = field("numeric", 0);
    FieldInfo binary = field("binary", 1);
    FieldInfo sorted = field("sorted", 2);
    Lucene40DocValuesWriter writer = newWriter(dir, info, numeric, binary, sorted);
    writer.addNumericField(numeric, Arrays.<Number>asList(1L, 2L, 3L));
    writer.addBinaryField(binary, Arrays.asList(new BytesRef("a"), new BytesRef("b"), new BytesRef("c")));
    writer.addSortedField(sorted, Arrays.asList(new BytesRef("a"), new BytesRef("b")), Arrays.<Number>asList(0, 1, 0));
    writer.close();

    DocValuesProducer producer = openDocValues(dir, info, numeric, binary, sorted);
    try {
      producer.getBinary(numeric);
      fail("numeric field read as binary");
    } catch (IllegalStateException expected) {
      // expected
    }
    try {
      producer.getSorted(binary);
      fail("binary field read as sorted");
    } catch (IllegalStateException expected) {
      // expected
    }
    try {
      producer.getNumeric(sorted);
      fail("sorted field read as numeric");
    } catch (IllegalStateException expected) {
      // expected
    }
    try {
      producer.getBinary(sorted);
      fail("sorted field read as binary");
    } catch (IllegalStateException expected) {
      // expected
    }
    try {
      producer.getSortedSet(sorted);
      fail("4.0 has no sorted set doc values");
    } catch (IllegalStateException expected) {
      // expected
    }
    // the right accessor still works after the failures
    assertEquals(2, producer.getNumeric(numeric).get(1));
    producer.close();
    dir.close();
  }

  public void testMissingOrUnknownType() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    SegmentInfo info = new SegmentInfo(dir, "_0", 1);
    FieldInfo typed = field("typed", 0);
    Lucene40DocValuesWriter writer = newWriter(dir, info, typed);
    writer.addNumericField(typed, Arrays.<Number>asList(1L));
    writer.close();

    FieldInfo untyped = field("untyped", 1);
    FieldInfo bogus = field("bogus", 2);
    bogus.putAttribute(LegacyDocValuesType.LEGACY_DV_TYPE_KEY, "BYTES_FANCY");
    FieldInfo none = field("none", 3);
    none.putAttribute(LegacyDocValuesType.LEGACY_DV_TYPE_KEY, "NONE");
    DocValuesProducer producer = openDocValues(dir, info, typed, untyped, bogus, none);
    try {
      producer.getNumeric(untyped);
      fail("field without a type was read");
    } catch (CorruptIndexException expected) {
      // expected
    }
    try {
      producer.getNumeric(bogus);
      fail("field with an unknown type was read");
    } catch (CorruptIndexException expected) {
      // expected
    }
    try {
      producer.getNumeric(none);
      fail("field without doc values was read");
    } catch (IllegalStateException expected) {
      // expected
    }
    producer.close();
    dir.close();
  }

  /** Writes a compound docvalues file holding a single hand-made data file for field 0. */
  private static IndexOutput[] startCorruptField(CompoundFileWriter cfs, boolean withIndex) {
    IndexOutput data = cfs.createOutput("_0_0_dv.dat");
    IndexOutput index = withIndex ? cfs.createOutput("_0_0_dv.idx") : null;
    return new IndexOutput[] {data, index};
  }

  private void assertCorrupt(MockDirectoryWrapper dir, int maxDoc, LegacyDocValuesType type) throws IOException {
    SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
    FieldInfo field = field("f", 0);
    field.putAttribute(LegacyDocValuesType.LEGACY_DV_TYPE_KEY, type.name());
    DocValuesProducer producer = openDocValues(dir, info, field);
    try {
      switch (type.family) {
        case NUMERIC:
          producer.getNumeric(field);
          break;
        case BINARY:
          producer.getBinary(field);
          break;
        default:
          producer.getSorted(field);
          break;
      }
      fail("corrupt " + type + " was loaded");
    } catch (CorruptIndexException expected) {
      // expected
    }
    producer.close();
    assertEquals(dir.getOpenInputNames().toString(), 0, dir.getOpenInputCount());
    dir.close();
  }

  public void testWrongValueSize() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    CompoundFileWriter cfs = new CompoundFileWriter(dir, "_0_dv.cfs");
    IndexOutput data = startCorruptField(cfs, false)[0];
    CodecUtil.writeHeader(data, Lucene40DocValuesFormat.INTS_CODEC_NAME, Lucene40DocValuesFormat.INTS_VERSION_CURRENT);
    data.writeInt(2);
    data.writeInt(0);
    data.writeInt(0);
    cfs.close();
    assertCorrupt(dir, 2, LegacyDocValuesType.FIXED_INTS_32);
  }

  public void testTrailingBytes() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    CompoundFileWriter cfs = new CompoundFileWriter(dir, "_0_dv.cfs");
    IndexOutput data = startCorruptField(cfs, false)[0];
    CodecUtil.writeHeader(data, Lucene40DocValuesFormat.INTS_CODEC_NAME, Lucene40DocValuesFormat.INTS_VERSION_CURRENT);
    data.writeInt(1);
    data.writeByte((byte) 1);
    data.writeByte((byte) 2);
    data.writeByte((byte) 3); // one byte too many for maxDoc=2
    cfs.close();
    assertCorrupt(dir, 2, LegacyDocValuesType.FIXED_INTS_8);
  }

  public void testInvalidVarIntsHeader() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    CompoundFileWriter cfs = new CompoundFileWriter(dir, "_0_dv.cfs");
    IndexOutput data = startCorruptField(cfs, false)[0];
    CodecUtil.writeHeader(data, Lucene40DocValuesFormat.VAR_INTS_CODEC_NAME, Lucene40DocValuesFormat.VAR_INTS_VERSION_CURRENT);
    data.writeByte((byte) 5);
    data.writeLong(0);
    cfs.close();
    assertCorrupt(dir, 1, LegacyDocValuesType.VAR_INTS);
  }

  public void testTooFewPackedValues() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    CompoundFileWriter cfs = new CompoundFileWriter(dir, "_0_dv.cfs");
    IndexOutput data = startCorruptField(cfs, false)[0];
    CodecUtil.writeHeader(data, Lucene40DocValuesFormat.VAR_INTS_CODEC_NAME, Lucene40DocValuesFormat.VAR_INTS_VERSION_CURRENT);
    data.writeByte(Lucene40DocValuesFormat.VAR_INTS_PACKED);
    data.writeLong(0);
    data.writeLong(8);
    PackedInts.Writer packed = PackedInts.getWriter(data, 4, 4);
    for (int i = 0; i < 4; i++) {
      packed.add(i);
    }
    packed.finish();
    cfs.close();
    assertCorrupt(dir, 5, LegacyDocValuesType.VAR_INTS);
  }

  public void testNegativeValueCount() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    CompoundFileWriter cfs = new CompoundFileWriter(dir, "_0_dv.cfs");
    IndexOutput[] files = startCorruptField(cfs, true);
    CodecUtil.writeHeader(files[0], Lucene40DocValuesFormat.BYTES_FIXED_DEREF_CODEC_NAME_DAT,
                          Lucene40DocValuesFormat.BYTES_FIXED_DEREF_VERSION_CURRENT);
    CodecUtil.writeHeader(files[1], Lucene40DocValuesFormat.BYTES_FIXED_DEREF_CODEC_NAME_IDX,
                          Lucene40DocValuesFormat.BYTES_FIXED_DEREF_VERSION_CURRENT);
    files[0].writeInt(4);
    files[1].writeInt(-1);
    cfs.close();
    assertCorrupt(dir, 1, LegacyDocValuesType.BYTES_FIXED_DEREF);
  }

  public void testInvalidFixedLength() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    CompoundFileWriter cfs = new CompoundFileWriter(dir, "_0_dv.cfs");
    IndexOutput data = startCorruptField(cfs, false)[0];
    CodecUtil.writeHeader(data, Lucene40DocValuesFormat.BYTES_FIXED_STRAIGHT_CODEC_NAME,
                          Lucene40DocValuesFormat.BYTES_FIXED_STRAIGHT_VERSION_CURRENT);
    data.writeInt(Lucene40DocValuesFormat.MAX_BINARY_FIELD_LENGTH + 1);
    cfs.close();
    assertCorrupt(dir, 1, LegacyDocValuesType.BYTES_FIXED_STRAIGHT);
  }

  public void testWrongCodecHeader() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    CompoundFileWriter cfs = new CompoundFileWriter(dir, "_0_dv.cfs");
    IndexOutput[] files = startCorruptField(cfs, true);
    // a var-straight idx where the sorted reader expects its own codec
    CodecUtil.writeHeader(files[0], Lucene40DocValuesFormat.BYTES_FIXED_SORTED_CODEC_NAME_DAT,
                          Lucene40DocValuesFormat.BYTES_FIXED_SORTED_VERSION_CURRENT);
    CodecUtil.writeHeader(files[1], Lucene40DocValuesFormat.BYTES_VAR_STRAIGHT_CODEC_NAME_IDX,
                          Lucene40DocValuesFormat.BYTES_VAR_STRAIGHT_VERSION_CURRENT);
    cfs.close();
    assertCorrupt(dir, 1, LegacyDocValuesType.BYTES_FIXED_SORTED);
  }

  public void testInstancesAreCached() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    final int maxDoc = 50;
    SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
    FieldInfo numeric = field("numeric", 0);
    FieldInfo binary = field("binary", 1);
    List<Number> numbers = new ArrayList<Number>();
    List<BytesRef> bytes = new ArrayList<BytesRef>();
    for (int doc = 0; doc < maxDoc; doc++) {
      numbers.add((long) doc * 1000);
      bytes.add(new BytesRef("doc" + doc));
    }
    Lucene40DocValuesWriter writer = newWriter(dir, info, numeric, binary);
    writer.addNumericField(numeric, numbers);
    writer.addBinaryField(binary, bytes);
    writer.close();

    DocValuesProducer producer = openDocValues(dir, info, numeric, binary);
    final long initialRam = producer.ramBytesUsed();
    assertTrue(initialRam > 0);
    NumericDocValues first = producer.getNumeric(numeric);
    final long afterNumeric = producer.ramBytesUsed();
    assertTrue(afterNumeric > initialRam);
    assertSame(first, producer.getNumeric(numeric));
    assertEquals(afterNumeric, producer.ramBytesUsed());
    producer.getBinary(binary);
    assertTrue(producer.ramBytesUsed() > afterNumeric);

    Bits docsWithField = producer.getDocsWithField(numeric);
    assertEquals(maxDoc, docsWithField.length());
    for (int doc = 0; doc < maxDoc; doc++) {
      assertTrue(docsWithField.get(doc));
    }
    producer.close();
    dir.close();
  }

  public void testConcurrentFirstAccess() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    final int maxDoc = 500;
    SegmentInfo info = new SegmentInfo(dir, "_0", maxDoc);
    final FieldInfo field = field("sorted", 0);
    List<BytesRef> values = sortedValues(random(), 30, false);
    List<Number> docToOrd = new ArrayList<Number>();
    for (int doc = 0; doc < maxDoc; doc++) {
      docToOrd.add(doc % values.size());
    }
    Lucene40DocValuesWriter writer = newWriter(dir, info, field);
    writer.addSortedField(field, values, docToOrd);
    writer.close();

    final DocValuesProducer producer = openDocValues(dir, info, field);
    final int numThreads = nextInt(random(), 2, 8);
    final SortedDocValues[] results = new SortedDocValues[numThreads];
    final CountDownLatch start = new CountDownLatch(1);
    final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
    Thread[] threads = new Thread[numThreads];
    for (int i = 0; i < numThreads; i++) {
      final int slot = i;
      threads[i] = new Thread() {
        @Override
        public void run() {
          try {
            start.await();
            results[slot] = producer.getSorted(field);
          } catch (Throwable t) {
            failure.compareAndSet(null, t);
          }
        }
      };
      threads[i].start();
    }
    start.countDown();
    for (Thread t : threads) {
      t.join();
    }
    if (failure.get() != null) {
      throw new AssertionError(failure.get());
    }
    for (int i = 1; i < numThreads; i++) {
      assertSame(results[0], results[i]);
    }
    assertSorted(values, docToOrd, results[0]);
    producer.close();
    dir.close();
  }

  public void testOpenAndCloseReleaseCompoundFile() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    SegmentInfo info = new SegmentInfo(dir, "_0", 2);
    FieldInfo field = field("f", 0);
    Lucene40DocValuesWriter writer = newWriter(dir, info, field);
    writer.addNumericField(field, Arrays.<Number>asList(3L, 4L));
    writer.close();

    RecordingInfoStream infoStream = new RecordingInfoStream();
    DocValuesProducer producer = new Lucene40DocValuesFormat().fieldsProducer(
        new SegmentReadState(dir, info, new FieldInfos(field), "", infoStream));
    assertEquals(Arrays.asList("open _0_dv.cfs key=" + LegacyDocValuesType.LEGACY_DV_TYPE_KEY + " maxDoc=2"),
                 infoStream.getMessages(Lucene40DocValuesReader.INFO_COMPONENT));
    assertEquals(4, producer.getNumeric(field).get(1));
    producer.close();
    assertEquals(0, dir.getOpenInputCount());
    dir.close();
  }

  public void testMissingCompoundFile() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    SegmentInfo info = new SegmentInfo(dir, "_0", 2);
    try {
      openDocValues(dir, info, field("f", 0));
      fail("opened docvalues without a compound file");
    } catch (IOException expected) {
      // expected
    }
    assertEquals(0, dir.getOpenInputCount());
    dir.close();
  }

  public void testFormatsFromCodec() throws Exception {
    Codec codec = Codec.forName("Lucene40");
    assertTrue(codec.docValuesFormat() instanceof Lucene40DocValuesFormat);
    assertTrue(codec.normsFormat() instanceof Lucene40NormsFormat);
    assertEquals("Lucene40", codec.docValuesFormat().getName());
    MockDirectoryWrapper dir = newDirectory();
    try {
      codec.docValuesFormat().fieldsConsumer(new SegmentWriteState(dir, new SegmentInfo(dir, "_0", 1), new FieldInfos()));
      fail("docvalues are read-only");
    } catch (UnsupportedOperationException expected) {
      // expected
    }
    dir.close();
  }
}
