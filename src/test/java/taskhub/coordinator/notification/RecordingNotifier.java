package taskhub.coordinator.notification;

import java.util.ArrayList;
import java.util.List;

/**
 * Notifier that remembers every emit, and can be told to fail.
 */
public class RecordingNotifier implements Notifier {

    public record Emission(String event, Object payload, String room) {
    }

    private final List<Emission> emissions = new ArrayList<>();
    private volatile boolean failing;

    @Override
    public synchronized void emit(String event, Object payload, String room) {
        emissions.add(new Emission(event, payload, room));
        if (failing) {
            throw new NotificationException("broadcast channel down", null);
        }
    }

    public synchronized List<Emission> emissions() {
        return List.copyOf(emissions);
    }

    public synchronized void reset() {
        emissions.clear();
        failing = false;
    }

    public void failing(boolean failing) {
        this.failing = failing;
    }
}
