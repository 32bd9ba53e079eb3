package cafe.woden.mxclient.model;

public enum VerificationState {
  REQUESTED,
  WAITING,
  EMOJI_COMPARISON,
  DONE,
  CANCELLED;

  public boolean isTerminal() {
    return this == DONE || this == CANCELLED;
  }
}
