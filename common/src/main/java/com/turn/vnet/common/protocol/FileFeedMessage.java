/*
 * Copyright 2000-2018 JetBrains s.r.o.
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

package com.turn.vnet.common.protocol;

import com.turn.vnet.Constants;

import java.nio.ByteBuffer;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FILE_FEED protocol messages representations.
 *
 * <p>
 * This class and its <em>*Message</em> subclasses provide POJO representations
 * of the slice data exchange between two nodes, along with parsing from an
 * input ByteBuffer holding a message payload. All multi-byte integers are in
 * network byte order.
 * </p>
 *
 * <pre>
 * FILE_FEED_REQUEST:  &lt;crid&gt;&lt;slice_id&gt;&lt;offset&gt;&lt;chunk_size&gt;
 * FILE_FEED_RESPONSE: &lt;crid&gt;&lt;slice_id&gt;&lt;offset&gt;&lt;chunk_size&gt;*&lt;chunk_data&gt;*&lt;extended_info&gt;
 * </pre>
 */
public abstract class FileFeedMessage {

  /** crid, slice id (netshort), offset (netlong) and chunk size (netlong). */
  public static final int HEADER_SIZE = Constants.CONTENT_ID_LENGTH + 2 + 4 + 4;

  public enum Type {
    REQUEST(Constants.FILE_FEED_REQUEST),
    RESPONSE(Constants.FILE_FEED_RESPONSE);

    private final int id;

    Type(int id) {
      this.id = id;
    }

    public int getTypeId() {
      return this.id;
    }

    public static Type get(int id) {
      for (Type t : Type.values()) {
        if (t.id == id) {
          return t;
        }
      }
      return null;
    }
  }

  private final Type type;
  private final String contentId;
  private final int sliceId;
  private final long offset;
  private final int chunkSize;

  private FileFeedMessage(Type type, String contentId, int sliceId, long offset, int chunkSize) {
    this.type = type;
    this.contentId = contentId;
    this.sliceId = sliceId;
    this.offset = offset;
    this.chunkSize = chunkSize;
  }

  public Type getType() {
    return type;
  }

  public String getContentId() {
    return contentId;
  }

  public int getSliceId() {
    return sliceId;
  }

  public long getOffset() {
    return offset;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  /**
   * Returns a buffer holding the encoded message payload, positioned at 0.
   */
  public abstract ByteBuffer getData();

  /**
   * Checks that the given string can travel as a crid: exactly
   * {@link Constants#CONTENT_ID_LENGTH} characters from '0'-'9' and 'a'-'z'.
   */
  public static boolean isValidContentId(String contentId) {
    if (contentId == null || contentId.length() != Constants.CONTENT_ID_LENGTH) {
      return false;
    }
    for (int i = 0; i < contentId.length(); i++) {
      char c = contentId.charAt(i);
      if (!(c >= '0' && c <= '9') && !(c >= 'a' && c <= 'z')) {
        return false;
      }
    }
    return true;
  }

  private static void checkHeaderFields(String contentId, int sliceId, long offset, int chunkSize) {
    if (!isValidContentId(contentId)) {
      throw new IllegalArgumentException("Invalid content id: " + contentId);
    }
    if (sliceId < 0 || sliceId > Constants.MAX_SLICE_ID) {
      throw new IllegalArgumentException("Slice id " + sliceId + " does not fit in 16 bits");
    }
    if (offset < 0 || offset > Constants.MAX_UNSIGNED_INT) {
      throw new IllegalArgumentException("Offset " + offset + " does not fit in 32 bits");
    }
    if (chunkSize < 0) {
      throw new IllegalArgumentException("Negative chunk size " + chunkSize);
    }
  }

  protected void writeHeader(ByteBuffer buffer) {
    buffer.put(contentId.getBytes(Constants.BYTE_ENCODING));
    buffer.putShort((short) sliceId);
    buffer.putInt((int) offset);
    buffer.putInt(chunkSize);
  }

  private static Header readHeader(ByteBuffer buffer) throws ParseException {
    if (buffer.remaining() < HEADER_SIZE) {
      throw new ParseException("Message is shorter than the FILE_FEED header", buffer.position());
    }
    byte[] crid = new byte[Constants.CONTENT_ID_LENGTH];
    buffer.get(crid);
    String contentId = new String(crid, Constants.BYTE_ENCODING);
    if (!isValidContentId(contentId)) {
      throw new ParseException("Invalid content id in message", 0);
    }
    int sliceId = buffer.getShort() & 0xFFFF;
    long offset = buffer.getInt() & Constants.MAX_UNSIGNED_INT;
    long chunkSize = buffer.getInt() & Constants.MAX_UNSIGNED_INT;
    if (chunkSize > Constants.MAX_PAYLOAD_SIZE) {
      throw new ParseException("Announced chunk size " + chunkSize + " exceeds the payload limit",
              buffer.position() - 4);
    }
    return new Header(contentId, sliceId, offset, (int) chunkSize);
  }

  @Override
  public String toString() {
    return getType().name() + " slice #" + sliceId + " [" + offset + "+" + chunkSize + "]";
  }

  private static final class Header {
    private final String contentId;
    private final int sliceId;
    private final long offset;
    private final int chunkSize;

    private Header(String contentId, int sliceId, long offset, int chunkSize) {
      this.contentId = contentId;
      this.sliceId = sliceId;
      this.offset = offset;
      this.chunkSize = chunkSize;
    }
  }

  /**
   * Request for a chunk of slice data.
   *
   * <code>&lt;crid&gt;&lt;slice_id&gt;&lt;offset&gt;&lt;chunk_size&gt;</code>
   */
  public static class RequestMessage extends FileFeedMessage {

    private RequestMessage(String contentId, int sliceId, long offset, int chunkSize) {
      super(Type.REQUEST, contentId, sliceId, offset, chunkSize);
    }

    public static RequestMessage parse(ByteBuffer buffer) throws ParseException {
      Header header = readHeader(buffer);
      if (buffer.hasRemaining()) {
        throw new ParseException("Trailing bytes after FILE_FEED request", buffer.position());
      }
      return new RequestMessage(header.contentId, header.sliceId, header.offset, header.chunkSize);
    }

    public static RequestMessage craft(String contentId, int sliceId, long offset, int chunkSize) {
      checkHeaderFields(contentId, sliceId, offset, chunkSize);
      return new RequestMessage(contentId, sliceId, offset, chunkSize);
    }

    @Override
    public ByteBuffer getData() {
      ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE);
      writeHeader(buffer);
      buffer.flip();
      return buffer;
    }
  }

  /**
   * Response carrying chunk data and/or extended info records.
   *
   * <code>&lt;crid&gt;&lt;slice_id&gt;&lt;offset&gt;&lt;chunk_size&gt;&lt;chunk_data&gt;&lt;extended_info&gt;*</code>
   */
  public static class ResponseMessage extends FileFeedMessage {

    private final ByteBuffer chunkData;
    private final List<ExtendedInfo> extendedInfo;

    private ResponseMessage(String contentId, int sliceId, long offset, ByteBuffer chunkData,
                            List<ExtendedInfo> extendedInfo) {
      super(Type.RESPONSE, contentId, sliceId, offset, chunkData.remaining());
      this.chunkData = chunkData;
      this.extendedInfo = Collections.unmodifiableList(extendedInfo);
    }

    /**
     * @return a read-only view of the chunk bytes, positioned at 0
     */
    public ByteBuffer getChunkData() {
      return chunkData.asReadOnlyBuffer();
    }

    public List<ExtendedInfo> getExtendedInfo() {
      return extendedInfo;
    }

    public boolean isNodeBusy() {
      for (ExtendedInfo info : extendedInfo) {
        if (info.isNodeBusy()) return true;
      }
      return false;
    }

    public boolean isNoSliceAvailable() {
      for (ExtendedInfo info : extendedInfo) {
        if (info.isNoSliceAvailable()) return true;
      }
      return false;
    }

    /**
     * Whether this response carries the full data for the given request.
     * Responses refusing the request through extended info never do.
     */
    public boolean answers(RequestMessage request) {
      return !isNodeBusy() && !isNoSliceAvailable() &&
              getContentId().equals(request.getContentId()) &&
              getSliceId() == request.getSliceId() &&
              getOffset() == request.getOffset() &&
              getChunkSize() == request.getChunkSize();
    }

    /**
     * Parses a response. A refusal may echo the requested chunk size while
     * carrying no data; it is read as a refusal with empty chunk data.
     */
    public static ResponseMessage parse(ByteBuffer buffer) throws ParseException {
      Header header = readHeader(buffer);
      if (buffer.remaining() < header.chunkSize) {
        ParseException truncated = new ParseException("Response holds " + buffer.remaining() +
                " byte(s) of data, " + header.chunkSize + " announced", buffer.position());
        List<ExtendedInfo> infos;
        try {
          infos = readExtendedInfo(buffer.duplicate());
        } catch (ParseException e) {
          truncated.initCause(e);
          throw truncated;
        }
        if (!isRefusal(infos)) {
          throw truncated;
        }
        buffer.position(buffer.limit());
        return new ResponseMessage(header.contentId, header.sliceId, header.offset, ByteBuffer.allocate(0), infos);
      }
      ByteBuffer data = ByteBuffer.allocate(header.chunkSize);
      ByteBuffer source = buffer.duplicate();
      source.limit(source.position() + header.chunkSize);
      data.put(source);
      data.flip();
      buffer.position(buffer.position() + header.chunkSize);

      List<ExtendedInfo> infos = readExtendedInfo(buffer);
      return new ResponseMessage(header.contentId, header.sliceId, header.offset, data, infos);
    }

    private static List<ExtendedInfo> readExtendedInfo(ByteBuffer buffer) throws ParseException {
      List<ExtendedInfo> infos = new ArrayList<ExtendedInfo>();
      while (buffer.hasRemaining()) {
        if (buffer.remaining() < ExtendedInfo.RECORD_HEADER_SIZE) {
          throw new ParseException("Truncated extended info record", buffer.position());
        }
        int id = buffer.get() & 0xFF;
        long size = buffer.getInt() & Constants.MAX_UNSIGNED_INT;
        if (size > buffer.remaining()) {
          throw new ParseException("Extended info #" + id + " announces " + size +
                  " byte(s), " + buffer.remaining() + " left", buffer.position());
        }
        if (id == ExtendedInfo.NODE_BUSY_ID && size != ExtendedInfo.NODE_BUSY_DATA_SIZE) {
          throw new ParseException("NODE_BUSY record must carry " +
                  ExtendedInfo.NODE_BUSY_DATA_SIZE + " bytes, got " + size, buffer.position());
        }
        ByteBuffer infoData = buffer.slice();
        infoData.limit((int) size);
        buffer.position(buffer.position() + (int) size);
        infos.add(new ExtendedInfo(id, infoData));
      }
      return infos;
    }

    private static boolean isRefusal(List<ExtendedInfo> infos) {
      for (ExtendedInfo info : infos) {
        if (info.isNodeBusy() || info.isNoSliceAvailable()) return true;
      }
      return false;
    }

    public static ResponseMessage craft(RequestMessage request, ByteBuffer chunkData) {
      return craft(request.getContentId(), request.getSliceId(), request.getOffset(),
              chunkData, Collections.<ExtendedInfo>emptyList());
    }

    /**
     * Crafts a refusal: no chunk data, only the given extended info.
     */
    public static ResponseMessage craftRefusal(RequestMessage request, ExtendedInfo info) {
      return craft(request.getContentId(), request.getSliceId(), request.getOffset(),
              ByteBuffer.allocate(0), Collections.singletonList(info));
    }

    public static ResponseMessage craft(String contentId, int sliceId, long offset,
                                        ByteBuffer chunkData, List<ExtendedInfo> extendedInfo) {
      checkHeaderFields(contentId, sliceId, offset, chunkData.remaining());
      ByteBuffer copy = ByteBuffer.allocate(chunkData.remaining());
      copy.put(chunkData.duplicate());
      copy.flip();
      return new ResponseMessage(contentId, sliceId, offset, copy, new ArrayList<ExtendedInfo>(extendedInfo));
    }

    @Override
    public ByteBuffer getData() {
      int size = HEADER_SIZE + chunkData.remaining();
      for (ExtendedInfo info : extendedInfo) {
        size += info.getEncodedSize();
      }
      ByteBuffer buffer = ByteBuffer.allocate(size);
      writeHeader(buffer);
      buffer.put(chunkData.duplicate());
      for (ExtendedInfo info : extendedInfo) {
        info.writeTo(buffer);
      }
      buffer.flip();
      return buffer;
    }

    @Override
    public String toString() {
      return extendedInfo.isEmpty() ? super.toString() : super.toString() + " " + extendedInfo;
    }
  }
}
