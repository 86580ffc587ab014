package taskhub.coordinator.repository;

/**
 * A repository operation could not complete. Any transaction it opened has
 * been rolled back before this is thrown.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
