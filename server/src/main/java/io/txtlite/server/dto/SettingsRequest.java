// file: server/src/main/java/io/txtlite/server/dto/SettingsRequest.java
package io.txtlite.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body for POST /update.
 * Example:
 *   { "domain": "acme", "domain_key": "q1w2...", "password": "", "ispublic": true }
 * A blank password leaves the current one in place.
 */
public class SettingsRequest {
    public String domain;
    @JsonProperty("domain_key")
    public String domainKey;
    public String password;
    @JsonProperty("ispublic")
    public boolean isPublic;
}
