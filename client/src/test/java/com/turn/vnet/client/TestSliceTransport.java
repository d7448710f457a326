package com.turn.vnet.client;

import com.turn.vnet.client.storage.MemorySliceStorage;
import com.turn.vnet.client.storage.SliceStorage;
import com.turn.vnet.client.storage.StorageSliceTransport;
import com.turn.vnet.common.NodeId;
import com.turn.vnet.common.Slice;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Transport storing one slice in memory, with fixed node lists.
 */
public class TestSliceTransport extends StorageSliceTransport {

  private final String myContentId;
  private final List<NodeId> myRegular = new ArrayList<NodeId>();
  private final List<NodeId> myFallback = new ArrayList<NodeId>();
  private MemorySliceStorage myStorage;
  private int myRegularQueries = 0;
  private int myFallbackQueries = 0;
  private int myFailingStores = 0;
  private boolean myUncheckedStoreFailures = false;
  private int myStoreCount = 0;

  public TestSliceTransport(String contentId) {
    myContentId = contentId;
  }

  public TestSliceTransport regular(String... nodes) {
    for (String node : nodes) {
      myRegular.add(new NodeId(node));
    }
    return this;
  }

  public TestSliceTransport fallback(String... nodes) {
    for (String node : nodes) {
      myFallback.add(new NodeId(node));
    }
    return this;
  }

  /**
   * The next {@code count} stores fail with an IOException.
   */
  public void failNextStores(int count) {
    myFailingStores = count;
    myUncheckedStoreFailures = false;
  }

  /**
   * The next {@code count} stores fail with an IllegalStateException.
   */
  public void failNextStoresUnchecked(int count) {
    myFailingStores = count;
    myUncheckedStoreFailures = true;
  }

  @Override
  public String getContentId() {
    return myContentId;
  }

  @Override
  public List<NodeId> getNodeList(Slice slice) {
    myRegularQueries++;
    return myRegular;
  }

  @Override
  public List<NodeId> getFallbackNodeList(Slice slice) {
    myFallbackQueries++;
    return myFallback;
  }

  @Override
  public void storeSliceData(Slice slice, ByteBuffer data, long offset, int length) throws IOException {
    if (myFailingStores > 0) {
      myFailingStores--;
      if (myUncheckedStoreFailures) {
        throw new IllegalStateException("storage closed");
      }
      throw new IOException("disk full");
    }
    myStoreCount++;
    super.storeSliceData(slice, data, offset, length);
  }

  @Override
  protected SliceStorage getStorage(Slice slice) {
    if (myStorage == null) {
      myStorage = new MemorySliceStorage((int) slice.getSliceSize());
    }
    return myStorage;
  }

  public byte[] getStoredData() {
    return myStorage == null ? new byte[0] : myStorage.getData();
  }

  public int getRegularQueries() {
    return myRegularQueries;
  }

  public int getFallbackQueries() {
    return myFallbackQueries;
  }

  public int getStoreCount() {
    return myStoreCount;
  }
}
