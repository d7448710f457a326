package com.turn.vnet.client;

/**
 * Outcome of a slice download, reported once through the {@link SliceDownloadListener}.
 */
public enum DownloadResult {
  SUCCESS(0),
  /** The deadline passed before every chunk was stored. */
  DEADLINE_EXCEEDED(-1),
  /** Some chunk failed and no node of either tier could ever be asked for it. */
  NO_NODES_AVAILABLE(-2),
  /** Some chunk failed on every node of both tiers. */
  TRANSPORT_FAILURE(-3);

  private final int myCode;

  DownloadResult(int code) {
    myCode = code;
  }

  /**
   * @return 0 for success, a negative value for each failure
   */
  public int getCode() {
    return myCode;
  }

  public boolean isSuccess() {
    return this == SUCCESS;
  }
}
