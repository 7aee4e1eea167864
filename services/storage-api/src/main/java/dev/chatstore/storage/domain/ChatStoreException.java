package dev.chatstore.storage.domain;

/**
 * Base type for business-rule violations raised by the service layer.
 *
 * <p>Absence of an entity on lookup is not an error; services report it with {@code Optional} or
 * {@code boolean} results. Data access failures are not wrapped and reach the caller unchanged.</p>
 */
public abstract class ChatStoreException extends RuntimeException {

    protected ChatStoreException(String message) {
        super(message);
    }

    /**
     * Stable machine-readable code used in error responses.
     */
    public abstract String code();
}
