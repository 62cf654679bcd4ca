// file: server/src/main/java/io/txtlite/server/dto/SyncReply.java
package io.txtlite.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Server -> client live-sync acknowledgment.
 * <p>
 *  - message "unique_slug": the frame was saved; success tells whether the
 *    (domain, slug) pair still resolves to fewer than 2 documents.
 *  - message "not saving": nothing was written.
 */
public class SyncReply {
    public static final String UNIQUE_SLUG = "unique_slug";
    public static final String NOT_SAVING = "not saving";

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public String id;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public String slug;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public String message;
    public boolean success;

    public static SyncReply saved(String id, String slug, boolean slugIsUnique) {
        SyncReply r = new SyncReply();
        r.id = id;
        r.slug = slug;
        r.message = UNIQUE_SLUG;
        r.success = slugIsUnique;
        return r;
    }

    public static SyncReply notSaving() {
        SyncReply r = new SyncReply();
        r.message = NOT_SAVING;
        r.success = false;
        return r;
    }
}
