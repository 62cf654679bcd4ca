// file: src/main/java/io/txtlite/core/error/AuthException.java
package io.txtlite.core.error;

/** Bad password, or a key that does not resolve to the expected domain. */
public class AuthException extends TxtLiteException {
    public AuthException(String message) {
        super(message);
    }
}
