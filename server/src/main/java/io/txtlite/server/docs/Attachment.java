// file: server/src/main/java/io/txtlite/server/docs/Attachment.java
package io.txtlite.server.docs;

/** Decompressed attachment as handed back to callers. */
public record Attachment(String filename, byte[] bytes) {}
