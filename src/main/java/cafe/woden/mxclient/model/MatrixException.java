package cafe.woden.mxclient.model;

/**
 * Base of every failure the client reports to its callers.
 *
 * <p>Carries the Matrix {@code errcode} (for example {@code M_FORBIDDEN}) when the homeserver
 * supplied one, otherwise an empty string.
 */
public class MatrixException extends RuntimeException {

  private final String errcode;

  public MatrixException(String message) {
    this("", message, null);
  }

  public MatrixException(String errcode, String message) {
    this(errcode, message, null);
  }

  public MatrixException(String errcode, String message, Throwable cause) {
    super(message, cause);
    this.errcode = errcode == null ? "" : errcode;
  }

  public String errcode() {
    return errcode;
  }
}
