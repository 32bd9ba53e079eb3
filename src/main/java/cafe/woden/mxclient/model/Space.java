package cafe.woden.mxclient.model;

import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record Space(String roomId, String name, String topic, List<String> childRoomIds) {
  public Space {
    if (name == null || name.isBlank()) name = roomId;
    if (topic == null) topic = "";
    childRoomIds = childRoomIds == null ? List.of() : List.copyOf(childRoomIds);
  }
}
