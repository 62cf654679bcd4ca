// file: client/src/main/java/io/txtlite/client/Cli.java
package io.txtlite.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Simple CLI for interacting with a running txt-lite server.
 *
 * Usage:
 *   txt-lite-cli [--base-url http://host:port] login <domain> <password>
 *   txt-lite-cli [--base-url http://host:port] push [--domain d] [--key k] [--id id] <slug> <file>
 *   txt-lite-cli [--base-url http://host:port] get [--key k] <domain> <slug>
 *   txt-lite-cli [--base-url http://host:port] upload --domain d --key k <file>
 *
 * Examples:
 *   txt-lite-cli login acme s3cr3t
 *   txt-lite-cli push --domain acme --key q1w2... notes ./notes.md
 *   txt-lite-cli get public hello
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8152";
    private static final String KEY_HEADER = "X-Domain-Key";

    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Options opts = Options.parse(rest, 1);
            Cli cli = new Cli(parsed.getKey());

            switch (cmd) {
                case "login" -> {
                    opts.requirePositional(2, "login requires <domain> <password>");
                    cli.login(opts.positional(0), opts.positional(1));
                }
                case "push" -> {
                    opts.requirePositional(2, "push requires <slug> <file>");
                    cli.push(opts.flag("domain", ""), opts.flag("key", ""),
                            opts.flag("id", UUID.randomUUID().toString()),
                            opts.positional(0), Path.of(opts.positional(1)));
                }
                case "get" -> {
                    opts.requirePositional(2, "get requires <domain> <slug>");
                    cli.get(opts.positional(0), opts.positional(1), opts.flag("key", null));
                }
                case "upload" -> {
                    opts.requirePositional(1, "upload requires <file>");
                    cli.upload(opts.flag("domain", ""), opts.flag("key", ""), Path.of(opts.positional(0)));
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 2 && "--base-url".equals(args[0])) {
            if (args.length < 3) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    // ---------- commands ----------

    private void login(String domain, String password) throws Exception {
        String body = json.writeValueAsString(Map.of("domain", domain, "password", password));
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/login"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("login failed (" + resp.statusCode() + "): " + errorOf(resp.body()));
        }
        System.out.println(json.readTree(resp.body()).path("key").asText());
    }

    /** One live-sync save: connect, send a single frame, print the reply, close. */
    private void push(String domain, String key, String id, String slug, Path file) throws Exception {
        Map<String, String> frame = new LinkedHashMap<>();
        frame.put("id", id);
        frame.put("domain", domain);
        frame.put("domain_key", key);
        frame.put("slug", slug);
        frame.put("data", Files.readString(file, StandardCharsets.UTF_8));

        CompletableFuture<String> reply = new CompletableFuture<>();
        String wsUrl = baseUrl.replaceFirst("^http", "ws") + "/ws";
        WebSocket ws = http.newWebSocketBuilder()
                .buildAsync(URI.create(wsUrl), new WebSocket.Listener() {
                    private final StringBuilder buf = new StringBuilder();

                    @Override
                    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                        buf.append(data);
                        if (last) {
                            reply.complete(buf.toString());
                        }
                        webSocket.request(1);
                        return null;
                    }

                    @Override
                    public void onError(WebSocket webSocket, Throwable error) {
                        reply.completeExceptionally(error);
                    }
                })
                .get(10, TimeUnit.SECONDS);
        try {
            ws.sendText(json.writeValueAsString(frame), true).get(10, TimeUnit.SECONDS);
            JsonNode ack = json.readTree(reply.get(10, TimeUnit.SECONDS));
            if (!"unique_slug".equals(ack.path("message").asText())) {
                throw new CliException("server is not saving (check --domain and --key)");
            }
            System.out.println(id + (ack.path("success").asBoolean() ? "" : " (slug '" + slug + "' is shared)"));
        } finally {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").get(10, TimeUnit.SECONDS);
        }
    }

    private void get(String domain, String slug, String key) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/" + encode(domain) + "/" + encode(slug)))
                .GET();
        if (key != null) {
            b.header(KEY_HEADER, key);
        }

        HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString());
        JsonNode body = json.readTree(resp.body());
        switch (resp.statusCode()) {
            case 200, 201 -> System.out.println(body.path("document").path("content").asText());
            case 300 -> {
                System.out.println("(ambiguous slug; candidates)");
                for (JsonNode d : body.path("documents")) {
                    System.out.println(d.path("id").asText());
                }
            }
            default -> throw new CliException("GET failed (" + resp.statusCode() + "): " + errorOf(resp.body()));
        }
    }

    private void upload(String domain, String key, Path file) throws Exception {
        String query = "domain=" + encode(domain) + "&filename=" + encode(file.getFileName().toString());
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/upload?" + query))
                .header(KEY_HEADER, key)
                .header("Content-Type", "application/octet-stream")
                .POST(HttpRequest.BodyPublishers.ofFile(file))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("upload failed (" + resp.statusCode() + "): " + errorOf(resp.body()));
        }
        System.out.println(baseUrl + json.readTree(resp.body()).path("location").asText());
    }

    // ---------- helpers ----------

    private String errorOf(String body) {
        try {
            return json.readTree(body).path("error").asText(body);
        } catch (Exception e) {
            return body;
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  txt-lite-cli [--base-url http://host:port] login <domain> <password>
                  txt-lite-cli [--base-url http://host:port] push [--domain d] [--key k] [--id id] <slug> <file>
                  txt-lite-cli [--base-url http://host:port] get [--key k] <domain> <slug>
                  txt-lite-cli [--base-url http://host:port] upload --domain d --key k <file>
                """);
        System.exit(1);
    }

    /** "--name value" flags plus positional arguments, in any order. */
    record Options(Map<String, String> flags, List<String> positionals) {

        static Options parse(String[] args, int from) {
            Map<String, String> flags = new HashMap<>();
            List<String> positionals = new ArrayList<>();
            for (int i = from; i < args.length; i++) {
                String a = args[i];
                if (a.startsWith("--")) {
                    if (i + 1 >= args.length) {
                        throw new CliException("missing value for " + a);
                    }
                    flags.put(a.substring(2), args[++i]);
                } else {
                    positionals.add(a);
                }
            }
            return new Options(Map.copyOf(flags), List.copyOf(positionals));
        }

        String flag(String name, String fallback) {
            return flags.getOrDefault(name, fallback);
        }

        String positional(int index) {
            return positionals.get(index);
        }

        void requirePositional(int count, String message) {
            if (positionals.size() != count) {
                throw new CliException(message);
            }
        }
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
