package cafe.woden.mxclient.model;

/** The room, message, alias or media item does not exist (or is not known locally). */
public class NotFoundException extends MatrixException {

  public NotFoundException(String message) {
    super("M_NOT_FOUND", message);
  }

  public NotFoundException(String errcode, String message) {
    super(errcode, message);
  }
}
