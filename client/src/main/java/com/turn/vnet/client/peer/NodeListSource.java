package com.turn.vnet.client.peer;

import com.turn.vnet.common.NodeId;

import java.util.List;

/**
 * Where the node list of a tier comes from. Queried at most once per download.
 */
public interface NodeListSource {

  List<NodeId> getNodeList();
}
