package guraa.wiringdoc.model;

import lombok.Value;

import java.util.List;

/**
 * A room of the pack and the zones whose data pages it groups.
 */
@Value
public class RoomSpec {
    String name;
    List<String> zones;

    public RoomSpec(String name, List<String> zones) {
        this.name = name;
        this.zones = List.copyOf(zones);
    }
}
