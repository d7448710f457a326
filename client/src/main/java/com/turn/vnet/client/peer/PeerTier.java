package com.turn.vnet.client.peer;

public enum PeerTier {
  /** Nodes the slice is normally downloaded from. */
  REGULAR,
  /** Backup nodes, only contacted once the download escalated. */
  FALLBACK
}
