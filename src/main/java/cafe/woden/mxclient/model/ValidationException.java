package cafe.woden.mxclient.model;

/** Input rejected before (or by) the homeserver: blank body, malformed id, invalid transition. */
public class ValidationException extends MatrixException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String errcode, String message) {
    super(errcode, message);
  }
}
