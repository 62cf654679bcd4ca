// file: server/src/main/java/io/txtlite/server/auth/DomainInfo.java
package io.txtlite.server.auth;

/** Public view of a domain; never carries the password hash. */
public record DomainInfo(String name, boolean isPublic, long createdMillis) {}
