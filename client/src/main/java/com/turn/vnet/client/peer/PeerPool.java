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

package com.turn.vnet.client.peer;

import com.google.common.collect.ImmutableList;
import com.turn.vnet.client.chunk.Chunk;
import com.turn.vnet.common.NodeId;
import com.turn.vnet.common.VnetLoggerFactory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The candidate nodes of one slice download, in two tiers.
 *
 * <p>
 * The regular list is fetched when the download starts, the fallback list
 * only when {@link #activateFallback()} is called. Within a tier candidates
 * are handed out round robin so consecutive chunks land on different nodes.
 * A node that failed a chunk is never offered for that chunk again, but
 * stays available for the others.
 * </p>
 */
public class PeerPool {

  private static final Logger logger = VnetLoggerFactory.getLogger(PeerPool.class);

  private final Map<PeerTier, NodeListSource> mySources = new EnumMap<PeerTier, NodeListSource>(PeerTier.class);
  private final Map<PeerTier, List<NodeId>> myNodes = new EnumMap<PeerTier, List<NodeId>>(PeerTier.class);
  private final Map<PeerTier, Integer> myCursors = new EnumMap<PeerTier, Integer>(PeerTier.class);
  private final Map<Integer, Set<NodeId>> myFailedByChunk = new HashMap<Integer, Set<NodeId>>();
  private boolean myOffered = false;

  public PeerPool(@NotNull NodeListSource regular, @NotNull NodeListSource fallback) {
    mySources.put(PeerTier.REGULAR, regular);
    mySources.put(PeerTier.FALLBACK, fallback);
  }

  /**
   * Fetches the regular node list. Does nothing if it was already fetched.
   *
   * @return the number of distinct regular nodes
   */
  public int loadRegular() {
    return load(PeerTier.REGULAR);
  }

  /**
   * Fetches the fallback node list, making the fallback tier available to
   * {@link #nextCandidate}. Does nothing if it was already fetched.
   *
   * @return the number of distinct fallback nodes
   */
  public int activateFallback() {
    return load(PeerTier.FALLBACK);
  }

  public boolean isFallbackActive() {
    return myNodes.containsKey(PeerTier.FALLBACK);
  }

  private int load(PeerTier tier) {
    List<NodeId> loaded = myNodes.get(tier);
    if (loaded != null) {
      return loaded.size();
    }
    List<NodeId> fetched = mySources.get(tier).getNodeList();
    Set<NodeId> distinct = new LinkedHashSet<NodeId>();
    if (fetched != null) {
      for (NodeId nodeId : fetched) {
        if (nodeId != null) distinct.add(nodeId);
      }
    }
    if (fetched != null && distinct.size() != fetched.size()) {
      logger.debug("{} node list had {} duplicate or null entries", tier, fetched.size() - distinct.size());
    }
    List<NodeId> nodes = ImmutableList.copyOf(distinct);
    myNodes.put(tier, nodes);
    myCursors.put(tier, 0);
    logger.debug("loaded {} {} nodes", nodes.size(), tier);
    return nodes.size();
  }

  /**
   * @return the loaded nodes of the tier, empty if the tier is not loaded yet
   */
  public List<NodeId> getNodes(PeerTier tier) {
    List<NodeId> nodes = myNodes.get(tier);
    return nodes == null ? Collections.<NodeId>emptyList() : nodes;
  }

  /**
   * Picks the next node of the tier that has not failed the chunk.
   *
   * @return the candidate, or null if the tier is not loaded or has no node left for the chunk
   */
  @Nullable
  public PeerCandidate nextCandidate(@NotNull Chunk chunk, @NotNull PeerTier tier) {
    List<NodeId> nodes = myNodes.get(tier);
    if (nodes == null || nodes.isEmpty()) {
      return null;
    }
    Set<NodeId> failed = myFailedByChunk.get(chunk.getIndex());
    int start = myCursors.get(tier);
    for (int i = 0; i < nodes.size(); i++) {
      int index = (start + i) % nodes.size();
      NodeId nodeId = nodes.get(index);
      if (failed != null && failed.contains(nodeId)) {
        continue;
      }
      myCursors.put(tier, (index + 1) % nodes.size());
      myOffered = true;
      return new PeerCandidate(nodeId, tier);
    }
    return null;
  }

  public void markFailed(@NotNull Chunk chunk, @NotNull NodeId nodeId) {
    Set<NodeId> failed = myFailedByChunk.get(chunk.getIndex());
    if (failed == null) {
      failed = new HashSet<NodeId>();
      myFailedByChunk.put(chunk.getIndex(), failed);
    }
    failed.add(nodeId);
  }

  public boolean hasFailed(@NotNull Chunk chunk, @NotNull NodeId nodeId) {
    Set<NodeId> failed = myFailedByChunk.get(chunk.getIndex());
    return failed != null && failed.contains(nodeId);
  }

  /**
   * Drops the failure history of a chunk that no longer needs candidates.
   */
  public void forget(@NotNull Chunk chunk) {
    myFailedByChunk.remove(chunk.getIndex());
  }

  /**
   * @return true if a candidate of either tier was ever handed out
   */
  public boolean hasOffered() {
    return myOffered;
  }
}
