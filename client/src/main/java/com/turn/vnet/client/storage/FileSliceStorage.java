/**
 * Copyright (C) 2011-2012 Turn, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.turn.vnet.client.storage;

import com.turn.vnet.common.VnetLoggerFactory;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Slice stored in a file of its own.
 *
 * <p>
 * A slice being downloaded lives in a partial file next to its target,
 * moved into place by {@link #finish()}. Opening a storage whose target
 * already exists serves that file read-only.
 * </p>
 */
public class FileSliceStorage implements SliceStorage {

  private static final String PARTIAL_FILE_NAME_SUFFIX = ".part";

  private static final Logger logger = VnetLoggerFactory.getLogger(FileSliceStorage.class);

  private final File myTarget;
  private final File myPartial;
  private final long mySize;

  private RandomAccessFile myFile;
  private FileChannel myChannel;
  private File myCurrent;
  private boolean myIsOpen = false;

  private final ReadWriteLock myLock = new ReentrantReadWriteLock();

  public FileSliceStorage(File target, long size) {
    if (size < 0) {
      throw new IllegalArgumentException("Negative slice size " + size);
    }
    myTarget = target;
    myPartial = new File(target.getAbsolutePath() + PARTIAL_FILE_NAME_SUFFIX);
    mySize = size;
  }

  /**
   * Opens the target file if it exists, the partial file otherwise.
   */
  public void open() throws IOException {
    myLock.writeLock().lock();
    try {
      if (myIsOpen) return;
      if (myTarget.exists()) {
        if (myTarget.length() != mySize) {
          throw new IOException("Slice file " + myTarget.getAbsolutePath() + " has " + myTarget.length()
                  + " bytes, expected " + mySize);
        }
        myCurrent = myTarget;
        myFile = new RandomAccessFile(myCurrent, "r");
      } else {
        if (myPartial.exists()) {
          logger.debug("Partial slice found at {}. Continuing...", myPartial.getAbsolutePath());
        } else {
          FileUtils.forceMkdirParent(myPartial);
        }
        myCurrent = myPartial;
        myFile = new RandomAccessFile(myCurrent, "rw");
        myFile.setLength(mySize);
      }
      myChannel = myFile.getChannel();
      myIsOpen = true;
      logger.debug("Opened slice file at {} ({} bytes).", myCurrent.getAbsolutePath(), mySize);
    } finally {
      myLock.writeLock().unlock();
    }
  }

  @Override
  public long size() {
    return mySize;
  }

  @Override
  public int read(ByteBuffer buffer, long position) throws IOException {
    myLock.readLock().lock();
    try {
      checkOpen();
      int requested = buffer.remaining();
      checkRange(position, requested);
      int total = 0;
      while (total < requested) {
        int bytes = myChannel.read(buffer, position + total);
        if (bytes < 0) {
          throw new IOException("Storage underrun at " + (position + total) + " in " + myCurrent.getName());
        }
        total += bytes;
      }
      return total;
    } finally {
      myLock.readLock().unlock();
    }
  }

  @Override
  public int write(ByteBuffer buffer, long position) throws IOException {
    myLock.writeLock().lock();
    try {
      checkOpen();
      if (isFinished()) {
        throw new IOException("Slice file " + myTarget.getName() + " is complete");
      }
      int requested = buffer.remaining();
      checkRange(position, requested);
      int total = 0;
      while (buffer.hasRemaining()) {
        total += myChannel.write(buffer, position + total);
      }
      return total;
    } finally {
      myLock.writeLock().unlock();
    }
  }

  /**
   * Moves the partial file to its final location.
   */
  @Override
  public void finish() throws IOException {
    myLock.writeLock().lock();
    try {
      checkOpen();
      if (isFinished()) {
        return;
      }
      myChannel.force(true);
      myFile.close();
      FileUtils.deleteQuietly(myTarget);
      FileUtils.moveFile(myPartial, myTarget);
      myCurrent = myTarget;
      myFile = new RandomAccessFile(myCurrent, "r");
      myChannel = myFile.getChannel();
      logger.debug("Moved slice data from {} to {}.", myPartial.getName(), myTarget.getName());
    } finally {
      myLock.writeLock().unlock();
    }
  }

  @Override
  public boolean isFinished() {
    return myTarget.equals(myCurrent);
  }

  public boolean isOpen() {
    myLock.readLock().lock();
    try {
      return myIsOpen;
    } finally {
      myLock.readLock().unlock();
    }
  }

  public File getTarget() {
    return myTarget;
  }

  @Override
  public void close() throws IOException {
    myLock.writeLock().lock();
    try {
      if (!myIsOpen) return;
      if (myChannel.isOpen() && !isFinished()) {
        myChannel.force(true);
      }
      myFile.close();
      myIsOpen = false;
    } finally {
      myLock.writeLock().unlock();
    }
  }

  private void checkOpen() throws IOException {
    if (!myIsOpen) {
      throw new IOException("Slice file " + myTarget.getName() + " is not open");
    }
  }

  private void checkRange(long position, int length) {
    if (position < 0 || position + length > mySize) {
      throw new IllegalArgumentException("Invalid storage request [" + position + "+" + length + "] for "
              + mySize + " bytes");
    }
  }
}
