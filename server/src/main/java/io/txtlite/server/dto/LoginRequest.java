// file: server/src/main/java/io/txtlite/server/dto/LoginRequest.java
package io.txtlite.server.dto;

/**
 * JSON body for POST /login.
 * Example:
 *   { "domain": "acme", "password": "s3cr3t" }
 */
public class LoginRequest {
    public String domain;
    public String password;
}
