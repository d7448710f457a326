package com.turn.vnet.network;

public enum ConnectionStatus {
  SUCCESS,
  FAILURE,
  INVALID_HANDLE,
  OUT_OF_RESOURCE
}
