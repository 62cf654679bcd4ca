// file: src/main/java/io/txtlite/core/error/PersistenceException.java
package io.txtlite.core.error;

/**
 * Storage I/O failure: opening, flushing, decoding or evicting.
 * <p>
 * Fatal when raised while opening the store; logged and retried on the next
 * cycle when raised by the background compactor.
 */
public class PersistenceException extends TxtLiteException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
