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
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.zip.CRC32;

/**
 * A straightforward {@link Directory} over a filesystem folder,
 * reading through {@link RandomAccessFile} with a position-checked
 * shared descriptor. Clones share the descriptor of the input they
 * were cloned from and synchronize on it.
 */
public class FSDirectory extends Directory {

  protected final File directory;

  public FSDirectory(File path) throws IOException {
    if (path.exists() && !path.isDirectory()) {
      throw new IOException("file '" + path + "' exists but is not a directory");
    }
    this.directory = path;
  }

  public File getDirectory() {
    ensureOpen();
    return directory;
  }

  @Override
  public String[] listAll() throws IOException {
    ensureOpen();
    String[] result = directory.list();
    if (result == null) {
      throw new IOException("directory '" + directory + "' does not exist or could not be read");
    }
    return result;
  }

  @Override
  public boolean fileExists(String name) {
    ensureOpen();
    return new File(directory, name).exists();
  }

  @Override
  public void deleteFile(String name) throws IOException {
    ensureOpen();
    File file = new File(directory, name);
    if (!file.delete())
      throw new IOException("Cannot delete " + file);
  }

  @Override
  public long fileLength(String name) throws IOException {
    ensureOpen();
    File file = new File(directory, name);
    final long len = file.length();
    if (len == 0 && !file.exists()) {
      throw new FileNotFoundException(name);
    }
    return len;
  }

  @Override
  public IndexOutput createOutput(String name) throws IOException {
    ensureOpen();
    if (!directory.exists() && !directory.mkdirs()) {
      throw new IOException("Cannot create directory: " + directory);
    }
    File file = new File(directory, name);
    if (file.exists() && !file.delete()) {
      throw new IOException("Cannot overwrite: " + file);
    }
    return new FSIndexOutput(file);
  }

  @Override
  public IndexInput openInput(String name) throws IOException {
    ensureOpen();
    final File path = new File(directory, name);
    if (!path.exists()) {
      throw new FileNotFoundException(path.toString());
    }
    return new FSIndexInput("FSIndexInput(path=\"" + path + "\")", path);
  }

  @Override
  public void close() {
    isOpen = false;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "@" + directory;
  }

  static final class Descriptor extends RandomAccessFile {
    // remember if the file is open, so that we don't try to close it
    // more than once
    volatile boolean isOpen;
    long position;
    final long length;

    Descriptor(File file, String mode) throws IOException {
      super(file, mode);
      isOpen = true;
      length = length();
    }

    @Override
    public void close() throws IOException {
      if (isOpen) {
        isOpen = false;
        super.close();
      }
    }
  }

  static final class FSIndexInput extends BufferedIndexInput {

    private final Descriptor file;
    private boolean isClone;

    FSIndexInput(String resourceDesc, File path) throws IOException {
      super(resourceDesc);
      file = new Descriptor(path, "r");
    }

    @Override
    protected void readInternal(byte[] b, int offset, int len) throws IOException {
      synchronized (file) {
        long position = getFilePointer();
        if (position != file.position) {
          file.seek(position);
          file.position = position;
        }
        int total = 0;
        do {
          final int i = file.read(b, offset + total, len - total);
          if (i == -1) {
            throw new EOFException("read past EOF: " + this);
          }
          file.position += i;
          total += i;
        } while (total < len);
      }
    }

    @Override
    public void close() throws IOException {
      // only close the file if this is not a clone
      if (!isClone) file.close();
    }

    @Override
    protected void seekInternal(long position) {
    }

    @Override
    public long length() {
      return file.length;
    }

    @Override
    public FSIndexInput clone() {
      FSIndexInput clone = (FSIndexInput) super.clone();
      clone.isClone = true;
      return clone;
    }
  }

  static final class FSIndexOutput extends IndexOutput {
    private static final int BUFFER_SIZE = 16384;

    private final RandomAccessFile file;
    private final byte[] buffer = new byte[BUFFER_SIZE];
    private final CRC32 crc = new CRC32();
    private int bufferPosition;
    private long bufferStart;
    private volatile boolean isOpen;

    FSIndexOutput(File path) throws IOException {
      file = new RandomAccessFile(path, "rw");
      isOpen = true;
    }

    @Override
    public void writeByte(byte b) throws IOException {
      if (bufferPosition >= BUFFER_SIZE)
        flushBuffer();
      crc.update(b);
      buffer[bufferPosition++] = b;
    }

    @Override
    public void writeBytes(byte[] b, int offset, int length) throws IOException {
      crc.update(b, offset, length);
      while (length > 0) {
        if (bufferPosition >= BUFFER_SIZE)
          flushBuffer();
        final int chunk = Math.min(length, BUFFER_SIZE - bufferPosition);
        System.arraycopy(b, offset, buffer, bufferPosition, chunk);
        bufferPosition += chunk;
        offset += chunk;
        length -= chunk;
      }
    }

    private void flushBuffer() throws IOException {
      file.write(buffer, 0, bufferPosition);
      bufferStart += bufferPosition;
      bufferPosition = 0;
    }

    @Override
    public long getFilePointer() {
      return bufferStart + bufferPosition;
    }

    @Override
    public long getChecksum() {
      return crc.getValue();
    }

    @Override
    public void close() throws IOException {
      // only close the file if it has not been closed yet
      if (isOpen) {
        isOpen = false;
        try {
          flushBuffer();
        } finally {
          file.close();
        }
      }
    }
  }
}
