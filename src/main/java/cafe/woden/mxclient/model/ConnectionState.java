package cafe.woden.mxclient.model;

public enum ConnectionState {
  /** No session on disk or in memory. */
  ABSENT,
  CONNECTING,
  LIVE,
  /** A session exists but the connection was dropped or explicitly disconnected. */
  DISCONNECTED
}
