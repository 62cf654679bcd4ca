// file: server/src/main/java/io/txtlite/server/WebServer.java
package io.txtlite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.txtlite.core.Blob;
import io.txtlite.core.Document;
import io.txtlite.core.DomainRecord;
import io.txtlite.core.error.AuthException;
import io.txtlite.core.error.ConflictException;
import io.txtlite.core.error.NotFoundException;
import io.txtlite.core.error.ValidationException;
import io.txtlite.server.auth.DomainService;
import io.txtlite.server.docs.BlobService;
import io.txtlite.server.docs.DocumentService;
import io.txtlite.server.dto.LoginRequest;
import io.txtlite.server.dto.LoginResponse;
import io.txtlite.server.dto.SettingsRequest;
import io.txtlite.server.sync.LiveSyncEndpoint;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin HTTP adapter over the domain, document and blob services, plus the
 * live-sync WebSocket endpoint.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map service exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET  /admin/health                 Basic health check
 *   - POST /login                        {domain, password} -> {domain, key}; registers free names
 *   - POST /update                       {domain, domain_key, password, ispublic}
 *   - GET  /api/{domain}                 Overview: recent + popular documents
 *   - GET  /api/{domain}?q=...           Token search
 *   - GET  /api/{domain}/list            All documents, content blanked
 *   - GET  /api/{domain}/{slug}          View; creates an empty document on first access
 *   - POST /upload?domain=&filename=     Raw body -> blob id
 *   - GET  /uploads/{id}                 Blob, served gzip-encoded
 *   - GET  /ws                           Live-sync WebSocket
 *
 * Keys travel in the X-Domain-Key header.
 */
public final class WebServer {
    public static final String KEY_HEADER = "X-Domain-Key";

    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final int OVERVIEW_LIMIT = 10;

    private final Undertow server;
    private final ObjectMapper json;
    private final DomainService domains;
    private final DocumentService documents;
    private final BlobService blobs;

    public WebServer(int port,
                     ObjectMapper json,
                     DomainService domains,
                     DocumentService documents,
                     BlobService blobs,
                     LiveSyncEndpoint liveSync) {
        this.json = json.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.domains = domains;
        this.documents = documents;
        this.blobs = blobs;

        HttpHandler api = exchange -> {
            // bcrypt and body reads must not run on the IO thread
            if (exchange.isInIoThread()) {
                exchange.dispatch(this::route);
                return;
            }
            route(exchange);
        };

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(Handlers.path(api).addExactPath("/ws", Handlers.websocket(liveSync)))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();

        if ("/admin/health".equals(path)) {
            execute(ex, () -> new Reply(200, Map.of("status", "ok")));
        } else if ("/login".equals(path) && "POST".equals(method)) {
            withBody(ex, this::handleLogin);
        } else if ("/update".equals(path) && "POST".equals(method)) {
            withBody(ex, this::handleUpdate);
        } else if ("/upload".equals(path) && "POST".equals(method)) {
            withBody(ex, this::handleUpload);
        } else if (path.startsWith("/uploads/") && "GET".equals(method)) {
            handleDownload(ex, path.substring("/uploads/".length()));
        } else if (path.startsWith("/api/") && "GET".equals(method)) {
            String rest = path.substring("/api/".length());
            int slash = rest.indexOf('/');
            String domain = DomainRecord.normalizeName(slash < 0 ? rest : rest.substring(0, slash));
            String slug = slash < 0 ? "" : rest.substring(slash + 1);
            if (domain.isEmpty()) {
                execute(ex, () -> new Reply(400, Map.of("error", "domain must not be empty")));
            } else if (slug.isEmpty()) {
                String q = firstOrNull(ex.getQueryParameters().get("q"));
                execute(ex, () -> q == null ? handleOverview(ex, domain) : handleSearch(ex, domain, q));
            } else if ("list".equals(slug)) {
                execute(ex, () -> handleList(ex, domain));
            } else {
                execute(ex, () -> handleView(ex, domain, slug));
            }
        } else {
            execute(ex, () -> new Reply(404, Map.of("error", "not found")));
        }
    }

    // ---------- handlers ----------

    /** POST /login */
    private Reply handleLogin(HttpServerExchange ex, byte[] body) throws IOException {
        var req = json.readValue(body, LoginRequest.class);
        String key = domains.signIn(req.domain, req.password);
        return new Reply(200, new LoginResponse(DomainRecord.normalizeName(req.domain), key));
    }

    /** POST /update */
    private Reply handleUpdate(HttpServerExchange ex, byte[] body) throws IOException {
        var req = json.readValue(body, SettingsRequest.class);
        String key = req.domainKey != null ? req.domainKey : keyOf(ex);
        boolean passwordChanged = domains.updateSettings(req.domain, key, req.password, req.isPublic);
        return new Reply(200, Map.of(
                "message", passwordChanged ? "password updated" : "settings updated",
                "ispublic", req.isPublic));
    }

    /** POST /upload?domain=&filename= */
    private Reply handleUpload(HttpServerExchange ex, byte[] body) {
        var params = ex.getQueryParameters();
        String domain = DomainRecord.normalizeName(firstOrNull(params.get("domain")));
        String filename = Optional.ofNullable(firstOrNull(params.get("filename"))).orElse("upload");
        if (domain.isEmpty() || DomainRecord.isPublicName(domain) || !domains.holdsKey(domain, keyOf(ex))) {
            throw new AuthException("need to be logged in to upload");
        }
        if (body.length == 0) {
            throw new ValidationException("upload must not be empty");
        }
        String id = blobs.store(filename, body);
        return new Reply(200, Map.of("id", id, "location", "/uploads/" + id));
    }

    /** GET /api/{domain} */
    private Reply handleOverview(HttpServerExchange ex, String domain) {
        requireRead(ex, domain, "domain is not public, sign in first");
        Optional<DomainRecord> record = domains.lookup(domain);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("domain", domain);
        body.put("exists", record.isPresent());
        body.put("ispublic", record.map(DomainRecord::isPublic).orElse(false));
        body.put("signedIn", domains.holdsKey(domain, keyOf(ex)));
        body.put("recent", documents.mostRecentlyModified(domain, OVERVIEW_LIMIT));
        body.put("popular", documents.mostViewed(domain, OVERVIEW_LIMIT));
        return new Reply(200, body);
    }

    /** GET /api/{domain}?q= */
    private Reply handleSearch(HttpServerExchange ex, String domain, String query) {
        requireRead(ex, domain, "need to log in to search");
        return new Reply(200, Map.of("query", query, "results", documents.search(query, domain)));
    }

    /** GET /api/{domain}/list */
    private Reply handleList(HttpServerExchange ex, String domain) {
        requireRead(ex, domain, "need to log in to list");
        List<Document> all = documents.getAll(domain).stream().map(Document::withoutContent).toList();
        return new Reply(200, Map.of("documents", all));
    }

    /**
     * GET /api/{domain}/{slug}
     *   - no document: create an empty one -> 201
     *   - several documents share the slug -> 300 with the candidates
     *   - otherwise the document and its similar documents -> 200
     */
    private Reply handleView(HttpServerExchange ex, String domain, String slug) {
        requireRead(ex, domain, "domain is not public, sign in first");

        List<Document> found = documents.get(slug, domain);
        if (found.isEmpty()) {
            Document created = documents.createEmpty(domain, slug);
            return new Reply(201, Map.of("document", created, "similar", List.of()));
        }
        if (found.size() > 1) {
            List<Document> candidates = found.stream().map(Document::withoutContent).toList();
            return new Reply(300, Map.of("slug", slug, "documents", candidates));
        }

        Document doc = found.get(0);
        List<Document> similar = documents.similar(doc.id()).stream()
                .map(Document::withoutContent)
                .toList();
        documents.incrementView(doc.id());
        return new Reply(200, Map.of("document", doc, "similar", similar));
    }

    /** GET /uploads/{id} */
    private void handleDownload(HttpServerExchange ex, String id) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            Blob blob = blobs.getCompressed(id);
            var headers = ex.getResponseHeaders();
            headers.put(Headers.CONTENT_TYPE, "application/octet-stream");
            headers.put(Headers.CONTENT_ENCODING, "gzip");
            headers.put(Headers.CONTENT_DISPOSITION,
                    "attachment; filename=\"" + blob.filename().replace("\"", "") + "\"");
            headers.put(Headers.CACHE_CONTROL, "public, max-age=7776000");
            ex.setStatusCode(status);
            ex.getResponseSender().send(ByteBuffer.wrap(blob.compressed()));
        } catch (Exception e) {
            status = statusFor(e);
            error = e;
            sendError(ex, status, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, error);
        }
    }

    // ---------- plumbing ----------

    /** Handler result: status + JSON body. */
    private record Reply(int status, Object body) {}

    @FunctionalInterface
    private interface Action {
        Reply run() throws Exception;
    }

    @FunctionalInterface
    private interface BodyAction {
        Reply run(HttpServerExchange ex, byte[] body) throws Exception;
    }

    private void execute(HttpServerExchange ex, Action action) {
        long start = System.nanoTime();
        int status;
        Throwable error = null;
        try {
            Reply reply = action.run();
            status = reply.status();
            send(ex, status, reply.body());
        } catch (Exception e) {
            status = statusFor(e);
            error = e;
            sendError(ex, status, e);
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), status, totalMs, error);
    }

    private void withBody(HttpServerExchange ex, BodyAction action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> execute(exchange, () -> {
                    if (data.length > MAX_BODY_BYTES) {
                        return new Reply(413, Map.of("error", "request body too large"));
                    }
                    return action.run(exchange, data);
                }),
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(exchange.getRequestMethod().toString(),
                            exchange.getRequestPath(), 400, 0, ioEx);
                }
        );
    }

    private void requireRead(HttpServerExchange ex, String domain, String message) {
        if (!domains.canRead(domain, keyOf(ex))) {
            throw new AuthException(message);
        }
    }

    private static String keyOf(HttpServerExchange ex) {
        return ex.getRequestHeaders().getFirst(KEY_HEADER);
    }

    static int statusFor(Throwable e) {
        if (e instanceof ValidationException || e instanceof IllegalArgumentException
                || e instanceof JsonProcessingException) {
            return 400;
        } else if (e instanceof AuthException) {
            return 403;
        } else if (e instanceof NotFoundException) {
            return 404;
        } else if (e instanceof ConflictException) {
            return 409;
        }
        return 500;
    }

    private void sendError(HttpServerExchange ex, int status, Exception e) {
        if (status == 500) {
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } else if (e instanceof JsonProcessingException) {
            send(ex, status, Map.of("error", "invalid JSON"));
        } else {
            send(ex, status, Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
