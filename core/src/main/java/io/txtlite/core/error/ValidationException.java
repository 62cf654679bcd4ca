// file: src/main/java/io/txtlite/core/error/ValidationException.java
package io.txtlite.core.error;

/** A required field is empty or malformed. */
public class ValidationException extends TxtLiteException {
    public ValidationException(String message) {
        super(message);
    }
}
