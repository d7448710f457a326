package com.turn.vnet.client.serve;

import com.turn.vnet.client.storage.SliceStorage;
import org.jetbrains.annotations.Nullable;

/**
 * Slices this node can serve.
 */
public interface SliceStorageProvider {

  /**
   * @return storage of the slice, null if this node does not have it
   */
  @Nullable
  SliceStorage getStorage(String contentId, int sliceId);
}
