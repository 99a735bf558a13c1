package org.legacycodec.store;

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

import java.io.EOFException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.legacycodec.codecs.CodecUtil;
import org.legacycodec.index.CorruptIndexException;
import org.legacycodec.index.IndexFileNames;
import org.legacycodec.util.IOUtils;

/**
 * Class for accessing a compound stream.
 * This class implements a directory, but is limited to only read operations.
 * Directory methods that would normally modify data throw an exception.
 * <p>
 * A compound file is a pair of files: the data file (<code>.cfs</code>)
 * holding the concatenated sub-files, and the entry table
 * (<code>.cfe</code>) giving each sub-file's offset and length.
 * Sub-file ids are stored with the segment name stripped.
 */
public final class CompoundFileDirectory extends Directory {

  /** Offset/Length for a slice inside of a compound file */
  public static final class FileEntry {
    long offset;
    long length;
  }

  public static final String DATA_CODEC = "CompoundFileWriterData";
  public static final String ENTRY_CODEC = "CompoundFileWriterEntries";
  public static final int VERSION_START = 0;
  public static final int VERSION_CURRENT = VERSION_START;

  private final Directory directory;
  private final String fileName;
  private final Map<String,FileEntry> entries;
  private final IndexInput handle;

  /**
   * Opens the compound file <code>fileName</code> (a <code>.cfs</code>
   * name) in <code>directory</code> for reading.
   */
  public CompoundFileDirectory(Directory directory, String fileName) throws IOException {
    assert !(directory instanceof CompoundFileDirectory) : "compound file inside of compound file: " + fileName;
    this.directory = directory;
    this.fileName = fileName;
    boolean success = false;
    IndexInput in = null;
    try {
      in = directory.openInput(fileName);
      CodecUtil.checkHeader(in, DATA_CODEC, VERSION_START, VERSION_CURRENT);
      this.entries = readEntries(in, directory, fileName);
      this.handle = in;
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(in);
      }
    }
  }

  /** Helper method that reads CFS entries from the entry table. */
  private static Map<String,FileEntry> readEntries(IndexInput data, Directory dir, String name) throws IOException {
    final String entriesFileName = IndexFileNames.segmentFileName(IndexFileNames.stripExtension(name), "",
                                                                  IndexFileNames.COMPOUND_FILE_ENTRIES_EXTENSION);
    IndexInput entriesStream = null;
    boolean success = false;
    try {
      entriesStream = dir.openInput(entriesFileName);
      CodecUtil.checkHeader(entriesStream, ENTRY_CODEC, VERSION_START, VERSION_CURRENT);
      final int numEntries = entriesStream.readVInt();
      final Map<String,FileEntry> mapping = new HashMap<String,FileEntry>(numEntries);
      for (int i = 0; i < numEntries; i++) {
        final FileEntry fileEntry = new FileEntry();
        final String id = entriesStream.readString();
        FileEntry previous = mapping.put(id, fileEntry);
        if (previous != null) {
          throw new CorruptIndexException("Duplicate cfs entry id=" + id + " in CFS: " + entriesStream);
        }
        fileEntry.offset = entriesStream.readLong();
        fileEntry.length = entriesStream.readLong();
        if (fileEntry.offset < 0 || fileEntry.length < 0 || fileEntry.offset + fileEntry.length > data.length()) {
          throw new CorruptIndexException("Invalid CFS entry id=" + id + " offset=" + fileEntry.offset
                                          + " length=" + fileEntry.length + " (resource: " + entriesStream + ")");
        }
      }
      CodecUtil.checkEOF(entriesStream);
      success = true;
      return mapping;
    } finally {
      if (success) {
        IOUtils.close(entriesStream);
      } else {
        IOUtils.closeWhileHandlingException(entriesStream);
      }
    }
  }

  public Directory getDirectory() {
    return directory;
  }

  public String getName() {
    return fileName;
  }

  @Override
  public synchronized void close() throws IOException {
    if (!isOpen) {
      // allow double close
      return;
    }
    isOpen = false;
    handle.close();
  }

  @Override
  public synchronized IndexInput openInput(String name) throws IOException {
    ensureOpen();
    final String id = IndexFileNames.stripSegmentName(name);
    final FileEntry entry = entries.get(id);
    if (entry == null) {
      throw new FileNotFoundException("No sub-file with id " + id + " found (fileName=" + name + " files: " + entries.keySet() + ")");
    }
    return new SlicedIndexInput("SlicedIndexInput(" + name + " in " + handle + ")", handle, entry.offset, entry.length);
  }

  /** Returns an array of strings, one for each file in the directory. */
  @Override
  public String[] listAll() {
    ensureOpen();
    String[] res = entries.keySet().toArray(new String[entries.size()]);
    // Add the segment name
    String seg = IndexFileNames.parseSegmentName(fileName);
    for (int i = 0; i < res.length; i++) {
      res[i] = seg + res[i];
    }
    return res;
  }

  /** Returns true iff a file with the given name exists. */
  @Override
  public boolean fileExists(String name) {
    ensureOpen();
    return entries.containsKey(IndexFileNames.stripSegmentName(name));
  }

  /** Not implemented
   * @throws UnsupportedOperationException always: not supported by CFS */
  @Override
  public void deleteFile(String name) {
    throw new UnsupportedOperationException();
  }

  /** Returns the length of a file in the directory.
   * @throws IOException if the file does not exist */
  @Override
  public long fileLength(String name) throws IOException {
    ensureOpen();
    FileEntry e = entries.get(IndexFileNames.stripSegmentName(name));
    if (e == null)
      throw new FileNotFoundException(name);
    return e.length;
  }

  /** Not implemented
   * @throws UnsupportedOperationException always: compound files are read-only */
  @Override
  public IndexOutput createOutput(String name) {
    throw new UnsupportedOperationException();
  }

  @Override
  public String toString() {
    return "CompoundFileDirectory(file=\"" + fileName + "\" in dir=" + directory + ")";
  }

  /** Implementation of an IndexInput that reads from a portion of
   *  the compound file. */
  static final class SlicedIndexInput extends BufferedIndexInput {
    IndexInput base;
    long fileOffset;
    long length;

    SlicedIndexInput(final String sliceDescription, final IndexInput base, final long fileOffset, final long length) {
      super(sliceDescription);
      this.base = base.clone();
      this.fileOffset = fileOffset;
      this.length = length;
    }

    /** Expert: implements buffer refill.  Reads bytes from the current
     *  position in the input.
     * @param b the array to read bytes into
     * @param offset the offset in the array to start storing bytes
     * @param len the number of bytes to read
     */
    @Override
    protected void readInternal(byte[] b, int offset, int len) throws IOException {
      long start = getFilePointer();
      if (start + len > length)
        throw new EOFException("read past EOF (resource: " + base + ")");
      base.seek(fileOffset + start);
      base.readBytes(b, offset, len, false);
    }

    /** Expert: implements seek.  Sets current position in this file, where
     *  the next {@link #readInternal(byte[],int,int)} will occur.
     * @see #readInternal(byte[],int,int)
     */
    @Override
    protected void seekInternal(long pos) {}

    /** Closes the stream to further operations. */
    @Override
    public void close() throws IOException {
      base.close();
    }

    @Override
    public long length() {
      return length;
    }

    @Override
    public SlicedIndexInput clone() {
      SlicedIndexInput clone = (SlicedIndexInput) super.clone();
      clone.base = base.clone();
      return clone;
    }
  }
}
