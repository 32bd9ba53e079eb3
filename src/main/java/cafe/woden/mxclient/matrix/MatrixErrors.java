package cafe.woden.mxclient.matrix;

import cafe.woden.mxclient.model.ConnectionException;
import cafe.woden.mxclient.model.MatrixException;
import cafe.woden.mxclient.model.NotFoundException;
import cafe.woden.mxclient.model.PermissionException;
import cafe.woden.mxclient.model.TransientException;
import cafe.woden.mxclient.model.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;

/** Maps a homeserver error response onto the client's exception taxonomy. */
public final class MatrixErrors {

  private MatrixErrors() {}

  public static MatrixException fromResponse(int status, JsonNode body, String what) {
    String errcode = body == null ? "" : body.path("errcode").asText("");
    String error = body == null ? "" : body.path("error").asText("");
    String message = what + " failed: " + (error.isBlank() ? "HTTP " + status : error);

    if (status == 401
        || "M_UNKNOWN_TOKEN".equals(errcode)
        || "M_MISSING_TOKEN".equals(errcode)) {
      return new ConnectionException(
          ConnectionException.Reason.CREDENTIALS_REJECTED, errcode, message);
    }
    if (status == 429 || "M_LIMIT_EXCEEDED".equals(errcode) || status >= 500) {
      return new TransientException(errcode, message);
    }
    if (status == 404 || "M_NOT_FOUND".equals(errcode)) {
      return new NotFoundException(errcode.isBlank() ? "M_NOT_FOUND" : errcode, message);
    }
    if (status == 403) {
      return new PermissionException(errcode.isBlank() ? "M_FORBIDDEN" : errcode, message);
    }
    if (status == 400) {
      return new ValidationException(errcode, message);
    }
    return new ConnectionException(ConnectionException.Reason.REMOTE, errcode, message);
  }
}
