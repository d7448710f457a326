package com.turn.vnet.client;

import com.turn.vnet.common.Slice;

public interface SliceDownloadListener {

  /**
   * invoked exactly once per download, on the event thread, when the download ends
   *
   * @param result    outcome of the download
   * @param transport transport the download was started with
   * @param slice     slice the download was started for
   */
  void downloadComplete(DownloadResult result, SliceTransport transport, Slice slice);
}
