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
import java.util.Collection;

import org.legacycodec.codecs.LiveDocsFormat;
import org.legacycodec.index.IndexFileNames;
import org.legacycodec.index.SegmentInfo;
import org.legacycodec.store.Directory;
import org.legacycodec.util.Bits;
import org.legacycodec.util.InfoStream;
import org.legacycodec.util.MutableBits;

/**
 * Lucene 4.0 Live Documents Format.
 * <p>
 * The .del file is optional, and only exists when a segment contains
 * deletions.
 * <p>
 * Although per-segment, this file is maintained exterior to compound segment
 * files.
 * <p>
 * Deletions (.del) --&gt; Format,Header,ByteCount,BitCount, Bits | DGaps (depending
 * on Format), Footer
 * <ul>
 *   <li>Format,ByteSize,BitCount --&gt; Uint32</li>
 *   <li>Bits --&gt; &lt;Byte&gt;<sup>ByteCount</sup></li>
 *   <li>DGaps --&gt; &lt;DGap,NonOnesByte&gt;<sup>NonzeroBytesCount</sup></li>
 *   <li>DGap --&gt; VInt</li>
 *   <li>NonOnesByte --&gt; Byte</li>
 * </ul>
 * <p>
 * Format is 1: indicates cleared DGaps.
 * <p>
 * ByteCount indicates the number of bytes in Bits. It is typically
 * (SegSize/8)+1.
 * <p>
 * BitCount indicates the number of bits that are currently set in Bits.
 * <p>
 * Bits contains one bit for each document indexed. When the bit
 * corresponding to a document number is cleared, that document is marked as
 * deleted. Bit ordering is from least to most significant. Thus, if Bits
 * contains two bytes, 0x00 and 0x02, then document 9 is marked as alive (not
 * deleted).
 * <p>
 * DGaps represents sparse bit-vectors more efficiently than Bits. It is made
 * of DGaps on indexes of nonOnes bytes in Bits, and the value of each nonOnes
 * byte. Thus, if there are 2 nonOnes bytes, at indexes 1 and 3, and their
 * values are 0x7F and 0xEF, the DGaps would be (VInt) 1, (byte) 0x7F, (VInt)
 * 2, (byte) 0xEF.
 */
public class Lucene40LiveDocsFormat extends LiveDocsFormat {

  /** Extension of deletes */
  static final String DELETES_EXTENSION = "del";

  /** Info stream component name */
  static final String INFO_COMPONENT = "LD";

  private final InfoStream infoStream;

  /** Sole constructor. */
  public Lucene40LiveDocsFormat() {
    this(InfoStream.getDefault());
  }

  /** Creates a live docs format reporting under {@code "LD"} to the given stream. */
  public Lucene40LiveDocsFormat(InfoStream infoStream) {
    this.infoStream = infoStream;
  }

  @Override
  public MutableBits newLiveDocs(int size) throws IOException {
    BitVector bitVector = new BitVector(size);
    bitVector.invertAll();
    return bitVector;
  }

  @Override
  public MutableBits newLiveDocs(Bits existing) throws IOException {
    final BitVector liveDocs = (BitVector) existing;
    return liveDocs.clone();
  }

  @Override
  public Bits readLiveDocs(Directory dir, SegmentInfo info) throws IOException {
    String filename = IndexFileNames.fileNameFromGeneration(info.name, DELETES_EXTENSION, info.getDelGen());
    final BitVector liveDocs = new BitVector(dir, filename);
    assert liveDocs.count() == info.getDocCount() - info.getDelCount():
      "liveDocs.count()=" + liveDocs.count() + " info.docCount=" + info.getDocCount() + " info.getDelCount()=" + info.getDelCount();
    assert liveDocs.length() == info.getDocCount();
    if (infoStream.isEnabled(INFO_COMPONENT)) {
      infoStream.message(INFO_COMPONENT, "read " + filename + " version=" + liveDocs.getVersion()
          + " live=" + liveDocs.count() + "/" + liveDocs.length());
    }
    return liveDocs;
  }

  @Override
  public void writeLiveDocs(MutableBits bits, Directory dir, SegmentInfo info, int newDelCount) throws IOException {
    String filename = IndexFileNames.fileNameFromGeneration(info.name, DELETES_EXTENSION, info.getNextDelGen());
    final BitVector liveDocs = (BitVector) bits;
    assert liveDocs.count() == info.getDocCount() - info.getDelCount() - newDelCount;
    assert liveDocs.length() == info.getDocCount();
    liveDocs.write(dir, filename);
    info.setDelCount(info.getDelCount() + newDelCount);
    info.advanceDelGen();
    if (infoStream.isEnabled(INFO_COMPONENT)) {
      infoStream.message(INFO_COMPONENT, "wrote " + filename + " delCount=" + info.getDelCount());
    }
  }

  @Override
  public void files(SegmentInfo info, Collection<String> files) throws IOException {
    if (info.hasDeletions()) {
      files.add(IndexFileNames.fileNameFromGeneration(info.name, DELETES_EXTENSION, info.getDelGen()));
    }
  }
}
