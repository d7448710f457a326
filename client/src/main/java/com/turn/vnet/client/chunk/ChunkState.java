package com.turn.vnet.client.chunk;

public enum ChunkState {
  /** Waiting for a peer. */
  PENDING,
  /** Requested from a peer, answer not processed yet. */
  IN_FLIGHT,
  /** Written to slice storage. Terminal. */
  STORED,
  /** Every candidate of both tiers failed. Terminal. */
  FAILED;

  public boolean isTerminal() {
    return this == STORED || this == FAILED;
  }
}
