package com.turn.vnet.common.protocol;

import com.google.common.base.Strings;
import com.turn.vnet.Constants;
import org.testng.annotations.Test;

import java.nio.ByteBuffer;
import java.text.ParseException;
import java.util.Arrays;

import static org.testng.Assert.*;

@Test
public class FileFeedMessageTest {

  private static final String CRID = Strings.repeat("0123456789abcdefghijklmnopqrstuvwxyz", 4).substring(0, Constants.CONTENT_ID_LENGTH);

  public void testRequestLayout() {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(CRID, 0xBEEF, 0x01020304L, 51200);
    ByteBuffer data = request.getData();

    assertEquals(data.remaining(), FileFeedMessage.HEADER_SIZE);
    assertEquals(data.remaining(), 146);

    byte[] crid = new byte[Constants.CONTENT_ID_LENGTH];
    data.get(crid);
    assertEquals(new String(crid, Constants.BYTE_ENCODING), CRID);
    // network byte order
    assertEquals(data.get() & 0xFF, 0xBE);
    assertEquals(data.get() & 0xFF, 0xEF);
    assertEquals(data.get(), 1);
    assertEquals(data.get(), 2);
    assertEquals(data.get(), 3);
    assertEquals(data.get(), 4);
    assertEquals(data.getInt(), 51200);
    assertFalse(data.hasRemaining());
  }

  public void testRequestParseKeepsUnsignedFields() throws ParseException {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(CRID, 65535, 0xFFFFFF00L, 10);

    FileFeedMessage.RequestMessage parsed = FileFeedMessage.RequestMessage.parse(request.getData());

    assertEquals(parsed.getContentId(), CRID);
    assertEquals(parsed.getSliceId(), 65535);
    assertEquals(parsed.getOffset(), 0xFFFFFF00L);
    assertEquals(parsed.getChunkSize(), 10);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testCraftRejectsUpperCaseContentId() {
    FileFeedMessage.RequestMessage.craft(CRID.toUpperCase(), 1, 0, 10);
  }

  @Test(expectedExceptions = ParseException.class)
  public void testParseRejectsShortRequest() throws ParseException {
    FileFeedMessage.RequestMessage.parse(ByteBuffer.allocate(FileFeedMessage.HEADER_SIZE - 1));
  }

  public void testResponseWithDataAnswersRequest() throws ParseException {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(CRID, 3, 102400, 5);
    byte[] chunk = {1, 2, 3, 4, 5};

    ByteBuffer encoded = FileFeedMessage.ResponseMessage.craft(request, ByteBuffer.wrap(chunk)).getData();
    FileFeedMessage.ResponseMessage response = FileFeedMessage.ResponseMessage.parse(encoded);

    assertTrue(response.answers(request));
    assertFalse(response.isNodeBusy());
    assertFalse(response.isNoSliceAvailable());
    byte[] received = new byte[5];
    response.getChunkData().get(received);
    assertTrue(Arrays.equals(received, chunk));
  }

  public void testResponseWithOtherOffsetDoesNotAnswer() throws ParseException {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(CRID, 3, 0, 2);
    FileFeedMessage.RequestMessage other = FileFeedMessage.RequestMessage.craft(CRID, 3, 2, 2);

    ByteBuffer encoded = FileFeedMessage.ResponseMessage.craft(other, ByteBuffer.wrap(new byte[]{9, 9})).getData();

    assertFalse(FileFeedMessage.ResponseMessage.parse(encoded).answers(request));
  }

  public void testBusyRefusal() throws ParseException {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(CRID, 3, 0, 100);

    ByteBuffer encoded = FileFeedMessage.ResponseMessage.craftRefusal(request, ExtendedInfo.nodeBusy(250)).getData();
    assertEquals(encoded.remaining(), FileFeedMessage.HEADER_SIZE + 1 + 4 + 4);

    FileFeedMessage.ResponseMessage response = FileFeedMessage.ResponseMessage.parse(encoded);
    assertTrue(response.isNodeBusy());
    assertFalse(response.answers(request));
    assertEquals(response.getChunkSize(), 0);
    assertEquals(response.getExtendedInfo().get(0).getData().getInt(), 250);
  }

  public void testNoSliceRefusalAndUnknownRecord() throws ParseException {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(CRID, 7, 0, 100);
    ByteBuffer noSlice = FileFeedMessage.ResponseMessage.craftRefusal(request, ExtendedInfo.noSliceAvailable()).getData();

    ByteBuffer withUnknown = ByteBuffer.allocate(noSlice.remaining() + 7);
    withUnknown.put(noSlice);
    withUnknown.put((byte) 42).putInt(2).put((byte) 0).put((byte) 0);
    withUnknown.flip();

    FileFeedMessage.ResponseMessage response = FileFeedMessage.ResponseMessage.parse(withUnknown);
    assertTrue(response.isNoSliceAvailable());
    assertEquals(response.getExtendedInfo().size(), 2);
    assertEquals(response.getExtendedInfo().get(1).getId(), 42);
  }

  public void testBusyRefusalEchoingRequestedSize() throws ParseException {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(CRID, 3, 0, 51200);
    ByteBuffer header = request.getData();
    ByteBuffer encoded = ByteBuffer.allocate(header.remaining() + 9);
    encoded.put(header).put((byte) ExtendedInfo.NODE_BUSY_ID).putInt(4).putInt(3);
    encoded.flip();

    FileFeedMessage.ResponseMessage response = FileFeedMessage.ResponseMessage.parse(encoded);

    assertTrue(response.isNodeBusy());
    assertFalse(response.answers(request));
    assertEquals(response.getChunkSize(), 0);
    assertFalse(response.getChunkData().hasRemaining());
    assertEquals(response.getExtendedInfo().get(0).getData().getInt(), 3);
    assertFalse(encoded.hasRemaining());
  }

  @Test(expectedExceptions = ParseException.class)
  public void testShortDataWithoutRefusalIsRejected() throws ParseException {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(CRID, 3, 0, 51200);
    ByteBuffer header = request.getData();
    ByteBuffer encoded = ByteBuffer.allocate(header.remaining() + 7);
    encoded.put(header).put((byte) 42).putInt(2).put((byte) 0).put((byte) 0);
    encoded.flip();

    FileFeedMessage.ResponseMessage.parse(encoded);
  }

  @Test(expectedExceptions = ParseException.class)
  public void testTruncatedDataIsRejected() throws ParseException {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(CRID, 3, 0, 4);
    ByteBuffer encoded = FileFeedMessage.ResponseMessage.craft(request, ByteBuffer.wrap(new byte[]{1, 2, 3, 4})).getData();
    encoded.limit(encoded.limit() - 1);

    FileFeedMessage.ResponseMessage.parse(encoded);
  }

  @Test(expectedExceptions = ParseException.class)
  public void testBusyRecordWithWrongSizeIsRejected() throws ParseException {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(CRID, 3, 0, 0);
    ByteBuffer header = FileFeedMessage.ResponseMessage.craft(request, ByteBuffer.allocate(0)).getData();
    ByteBuffer broken = ByteBuffer.allocate(header.remaining() + 5);
    broken.put(header).put((byte) ExtendedInfo.NODE_BUSY_ID).putInt(0);
    broken.flip();

    FileFeedMessage.ResponseMessage.parse(broken);
  }
}
