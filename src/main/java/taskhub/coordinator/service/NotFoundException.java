package taskhub.coordinator.service;

/**
 * A requested task or collaboration does not exist.
 * Mapped to 404 by the HTTP layer.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
