// file: server/src/main/java/io/txtlite/server/dto/LoginResponse.java
package io.txtlite.server.dto;

public class LoginResponse {
    public String domain;
    public String key;   // raw bearer key; only returned once

    public LoginResponse() {
    }

    public LoginResponse(String domain, String key) {
        this.domain = domain;
        this.key = key;
    }
}
