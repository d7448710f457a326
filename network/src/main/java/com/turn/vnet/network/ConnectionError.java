package com.turn.vnet.network;

/**
 * Reasons the connection framework gives when a message could not be answered.
 * The numeric codes are the ones used on the framework boundary.
 */
public enum ConnectionError {
  CLEAN(0),
  TIMEOUT(1),
  DESTROY(2),
  CONNECT(3),
  RESET(4),
  LOGIN(5),
  BADF(6),
  PROTOCOL(7),
  CANTCONNECT(8);

  private final int code;

  ConnectionError(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  public static ConnectionError fromCode(int code) {
    for (ConnectionError error : values()) {
      if (error.code == code) {
        return error;
      }
    }
    throw new IllegalArgumentException("Unknown connection error code " + code);
  }

  /**
   * Maps a synchronous send rejection to the error reported for the message.
   */
  public static ConnectionError fromStatus(ConnectionStatus status) {
    switch (status) {
      case INVALID_HANDLE:
        return BADF;
      case OUT_OF_RESOURCE:
        return RESET;
      case FAILURE:
        return CONNECT;
      default:
        throw new IllegalArgumentException(status + " is not a failure");
    }
  }
}
