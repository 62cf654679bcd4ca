// file: src/main/java/io/txtlite/core/error/ConflictException.java
package io.txtlite.core.error;

/** A name or id that must be unique is already taken. */
public class ConflictException extends TxtLiteException {
    public ConflictException(String message) {
        super(message);
    }
}
