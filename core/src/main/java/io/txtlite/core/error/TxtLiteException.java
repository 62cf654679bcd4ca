// file: src/main/java/io/txtlite/core/error/TxtLiteException.java
package io.txtlite.core.error;

/**
 * Root of the error taxonomy.
 * <p>
 * Unchecked: services throw, the HTTP
 * adapter and the live-sync endpoint translate to wire responses.
 */
public abstract class TxtLiteException extends RuntimeException {
    protected TxtLiteException(String message) {
        super(message);
    }

    protected TxtLiteException(String message, Throwable cause) {
        super(message, cause);
    }
}
