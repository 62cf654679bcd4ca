// file: server/src/main/java/io/txtlite/server/dto/SyncMessage.java
package io.txtlite.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Client -> server live-sync frame.
 * Example:
 *   {
 *     "id": "5b0c...",
 *     "domain_key": "q1w2...",
 *     "domain": "acme",
 *     "data": "# notes\n...",
 *     "slug": "notes"
 *   }
 * domain/domain_key are only looked at on the first frame of a connection.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncMessage {
    public String id;          // document id; required to trigger a save
    @JsonProperty("domain_key")
    public String domainKey;   // bearer key for a non-public domain
    public String domain;      // blank means "public"
    public String data;        // full document body
    public String slug;
}
