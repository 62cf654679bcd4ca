// file: src/main/java/io/txtlite/core/error/NotFoundException.java
package io.txtlite.core.error;

/** Unknown domain, document, blob or key. */
public class NotFoundException extends TxtLiteException {
    public NotFoundException(String message) {
        super(message);
    }
}
