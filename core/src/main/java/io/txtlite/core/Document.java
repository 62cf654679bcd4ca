// file: src/main/java/io/txtlite/core/Document.java
package io.txtlite.core;

import java.util.List;
import java.util.Objects;

/**
 * Immutable document record.
 * <p>
 * Fields:
 *  - id:             opaque, globally unique; never changes or gets reused.
 *  - domain:         owning domain name (normalized, lower-case).
 *  - slug:           human-facing path segment; NOT unique within a domain.
 *  - content:        full body text (saves replace it wholesale).
 *  - createdMillis:  creation time, kept across saves.
 *  - modifiedMillis: time of the last save.
 *  - views:          view counter.
 *  - similarIds:     cached ranked ids of similar documents in the same domain.
 * <p>
 * Invariants:
 *  - similarIds never contains this document's own id.
 */
public record Document(
        String id,
        String domain,
        String slug,
        String content,
        long createdMillis,
        long modifiedMillis,
        long views,
        List<String> similarIds
) {
    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(domain, "domain");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        slug = slug == null ? "" : slug;
        content = content == null ? "" : content;
        if (views < 0) throw new IllegalArgumentException("views must be >= 0");
        similarIds = similarIds == null ? List.of() : List.copyOf(similarIds);
        if (similarIds.contains(id)) {
            throw new IllegalArgumentException("document cannot be similar to itself: " + id);
        }
    }

    /** A new, empty document as created on first access of a slug. */
    public static Document empty(String id, String domain, String slug, long nowMillis) {
        return new Document(id, domain, slug, "", nowMillis, nowMillis, 0L, List.of());
    }

    public Document withViews(long newViews) {
        return new Document(id, domain, slug, content, createdMillis, modifiedMillis, newViews, similarIds);
    }

    public Document withSimilarIds(List<String> ids) {
        return new Document(id, domain, slug, content, createdMillis, modifiedMillis, views, ids);
    }

    /** Copy used by list views that do not ship document bodies. */
    public Document withoutContent() {
        return new Document(id, domain, slug, "", createdMillis, modifiedMillis, views, similarIds);
    }
}
