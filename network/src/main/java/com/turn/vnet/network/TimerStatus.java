package com.turn.vnet.network;

public enum TimerStatus {
  SUCCESS,
  FAILURE,
  INVALID_HANDLE,
  OUT_OF_RESOURCE
}
