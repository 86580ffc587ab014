package taskhub.coordinator.model;

import java.util.List;
import java.util.Objects;

/**
 * Point-in-time snapshot of a collaboration and its member nodes.
 * Membership is managed elsewhere; this core only reads it.
 */
public record Collaboration(long id, String name, List<Node> nodes) {

    public Collaboration {
        name = Objects.requireNonNullElse(name, "");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public List<Long> nodeIds() {
        return nodes.stream().map(Node::id).toList();
    }

    /** Broadcast room that nodes of this collaboration listen on */
    public String room() {
        return roomFor(id);
    }

    public static String roomFor(long collaborationId) {
        return "collaboration_" + collaborationId;
    }
}
