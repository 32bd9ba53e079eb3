package cafe.woden.mxclient.model;

import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A page of history in chronological order. {@code nextToken} continues further back, {@code null}
 * once the start of the room is reached.
 */
@ValueObject
public record MessagesPage(List<Message> messages, String nextToken) {
  public MessagesPage {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }
}
