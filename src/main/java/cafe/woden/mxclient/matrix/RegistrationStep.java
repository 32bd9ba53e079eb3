package cafe.woden.mxclient.matrix;

import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Outcome of one {@code /register} POST: either the account was created, or the server asked for
 * user-interactive authentication and listed the stage flows it accepts.
 */
@ValueObject
public record RegistrationStep(LoginResult result, String session, List<List<String>> flows) {

  public RegistrationStep {
    flows = flows == null ? List.of() : flows.stream().map(List::copyOf).toList();
  }

  public static RegistrationStep completed(LoginResult result) {
    return new RegistrationStep(result, null, List.of());
  }

  public static RegistrationStep authRequired(String session, List<List<String>> flows) {
    return new RegistrationStep(null, session, flows);
  }

  public boolean isCompleted() {
    return result != null;
  }

  /** True when some flow consists of exactly one stage: the given auth type. */
  public boolean offersSingleStage(String authType) {
    return flows.stream().anyMatch(f -> f.size() == 1 && f.get(0).equals(authType));
  }
}
