package cafe.woden.mxclient.model;

/** The local account may not perform the requested action. */
public class PermissionException extends MatrixException {

  public PermissionException(String message) {
    super("M_FORBIDDEN", message);
  }

  public PermissionException(String errcode, String message) {
    super(errcode, message);
  }
}
