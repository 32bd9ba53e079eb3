package cafe.woden.mxclient.model;

/**
 * A failure that may succeed when retried: I/O errors, timeouts, rate limiting and server-side
 * errors.
 */
public class TransientException extends MatrixException {

  public TransientException(String message) {
    super(message);
  }

  public TransientException(String errcode, String message) {
    super(errcode, message);
  }

  public TransientException(String message, Throwable cause) {
    super("", message, cause);
  }
}
