package cafe.woden.mxclient.model;

/** Login, registration, session restore or an authenticated call failed at the session level. */
public class ConnectionException extends MatrixException {

  public enum Reason {
    /** No persisted session exists to restore. */
    NO_SESSION,
    /** The persisted session file exists but cannot be read. */
    SESSION_UNREADABLE,
    /** The homeserver rejected the credentials or the stored access token. */
    CREDENTIALS_REJECTED,
    /** An operation needed a live connection and there is none. */
    NOT_CONNECTED,
    /** The homeserver could not be reached. */
    NETWORK,
    /** Registration needs interactive steps this client cannot perform. */
    REGISTRATION_UNSUPPORTED,
    /** Any other remote refusal. */
    REMOTE
  }

  private final Reason reason;

  public ConnectionException(Reason reason, String message) {
    this(reason, "", message, null);
  }

  public ConnectionException(Reason reason, String errcode, String message) {
    this(reason, errcode, message, null);
  }

  public ConnectionException(Reason reason, String errcode, String message, Throwable cause) {
    super(errcode, message, cause);
    this.reason = reason == null ? Reason.REMOTE : reason;
  }

  public Reason reason() {
    return reason;
  }
}
