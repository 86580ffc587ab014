package taskhub.coordinator.service;

/**
 * A required field is absent from a request payload.
 */
public class MissingFieldException extends IllegalArgumentException {

    private final String field;

    public MissingFieldException(String field) {
        super("JSON should contain '" + field + "'");
        this.field = field;
    }

    public String field() {
        return field;
    }
}
