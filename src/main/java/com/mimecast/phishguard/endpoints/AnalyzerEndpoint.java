package com.mimecast.phishguard.endpoints;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.mimecast.phishguard.analysis.AnalysisResponse;
import com.mimecast.phishguard.analysis.EmailAnalyzer;
import com.mimecast.phishguard.config.EndpointConfig;
import com.mimecast.phishguard.mime.MalformedMessageException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Analyzer HTTP endpoint.
 *
 * <p>Endpoints:
 * <ul>
 *   <li><b>POST /api/analyze/text</b>: JSON body {@code {"subject": ..., "body": ..., "headers": ...}}.
 *       The body is required and must not be empty. Responds 200 with the analysis.</li>
 *   <li><b>POST /api/analyze/file</b>: raw RFC 822 bytes with a {@code message/rfc822}, {@code text/plain}
 *       or {@code application/octet-stream} content type. Responds 201 with the analysis.</li>
 *   <li><b>GET /health</b>: liveness check returning {@code {"status":"ok"}}.</li>
 * </ul>
 *
 * <p>Errors are returned as {@code {"error": "..."}} with status 400 (empty, unparsable or malformed input),
 * 405 (wrong method), 413 (upload too large), 415 (unsupported content type) or 422 (missing body field).
 */
public class AnalyzerEndpoint extends HttpEndpoint {
    private static final Logger log = LogManager.getLogger(AnalyzerEndpoint.class);

    /**
     * Accepted upload content types.
     */
    static final Set<String> ACCEPTED_CONTENT_TYPES = Set.of(
            "message/rfc822",
            "text/plain",
            "application/octet-stream"
    );

    private final EmailAnalyzer analyzer;

    /**
     * Response serializer. Null fields are written out.
     */
    private final Gson gson = new GsonBuilder().serializeNulls().create();

    private ExecutorService executor;
    private long maxUploadBytes = EndpointConfig.DEFAULT_MAX_UPLOAD_BYTES;

    /**
     * Constructs a new AnalyzerEndpoint instance.
     *
     * @param analyzer Shared analyzer.
     */
    public AnalyzerEndpoint(EmailAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public void start(EndpointConfig config) throws IOException {
        this.maxUploadBytes = config.getMaxUploadBytes();

        server = HttpServer.create(new InetSocketAddress(config.getBind(), config.getPort()), 10);
        executor = Executors.newFixedThreadPool(config.getThreads());
        server.setExecutor(executor);

        server.createContext("/api/analyze/text", this::handleText);
        server.createContext("/api/analyze/file", this::handleFile);
        server.createContext("/health", this::handleHealth);

        server.start();
        log.info("Analyzer endpoint listening on {}:{} with {} threads", config.getBind(), getPort(), config.getThreads());
    }

    @Override
    public void stop() {
        super.stop();
        if (executor != null) {
            executor.shutdown();
            executor = null;
        }
    }

    /**
     * Handles <b>GET /health</b>.
     *
     * @param exchange HTTP exchange.
     * @throws IOException If an I/O error occurs.
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        sendJson(exchange, 200, "{\"status\":\"ok\"}");
    }

    /**
     * Handles <b>POST /api/analyze/text</b>.
     *
     * @param exchange HTTP exchange.
     * @throws IOException If an I/O error occurs.
     */
    private void handleText(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }

        log.info("POST /api/analyze/text from {}", exchange.getRemoteAddress());
        try {
            byte[] bytes = readBody(exchange.getRequestBody(), maxUploadBytes);
            if (bytes == null) {
                sendError(exchange, 413, "Request exceeds the maximum allowed size.");
                return;
            }

            TextRequest request;
            try {
                request = gson.fromJson(new String(bytes, StandardCharsets.UTF_8), TextRequest.class);
            } catch (JsonParseException e) {
                log.warn("Invalid JSON body: {}", e.getMessage());
                sendError(exchange, 400, "Invalid JSON body.");
                return;
            }

            if (request == null || request.body == null || request.body.isEmpty()) {
                sendError(exchange, 422, "Field 'body' is required and must not be empty.");
                return;
            }

            AnalysisResponse response = analyzer.analyzeText(request.body, request.subject, request.headers);
            sendJson(exchange, 200, gson.toJson(response));

        } catch (Exception e) {
            log.error("Error processing /api/analyze/text: {}", e.getMessage(), e);
            sendError(exchange, 500, "Internal Server Error");
        }
    }

    /**
     * Handles <b>POST /api/analyze/file</b>.
     *
     * @param exchange HTTP exchange.
     * @throws IOException If an I/O error occurs.
     */
    private void handleFile(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }

        String contentType = baseContentType(exchange.getRequestHeaders().getFirst("Content-Type"));
        log.info("POST /api/analyze/file from {} with {}", exchange.getRemoteAddress(), contentType);

        if (!ACCEPTED_CONTENT_TYPES.contains(contentType)) {
            sendError(exchange, 415, "Unsupported content type: " + contentType);
            return;
        }

        try {
            byte[] bytes = readBody(exchange.getRequestBody(), maxUploadBytes);
            if (bytes == null) {
                sendError(exchange, 413, "File exceeds the maximum allowed size of " + (maxUploadBytes / (1024 * 1024)) + " MB.");
                return;
            }
            if (bytes.length == 0) {
                sendError(exchange, 400, "Uploaded file is empty.");
                return;
            }

            AnalysisResponse response = analyzer.analyzeEml(bytes);
            sendJson(exchange, 201, gson.toJson(response));

        } catch (MalformedMessageException e) {
            log.warn("Rejecting malformed message: {}", e.getMessage());
            sendError(exchange, 400, "Failed to parse email message: " + e.getMessage());

        } catch (Exception e) {
            log.error("Error processing /api/analyze/file: {}", e.getMessage(), e);
            sendError(exchange, 500, "Internal Server Error");
        }
    }

    /**
     * Strips parameters from a content type header.
     *
     * @param header Header value or null.
     * @return Lower-cased type/subtype, empty if missing.
     */
    static String baseContentType(String header) {
        if (header == null) {
            return "";
        }
        int semicolon = header.indexOf(';');
        String type = semicolon >= 0 ? header.substring(0, semicolon) : header;
        return type.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Text analysis request body.
     */
    static class TextRequest {
        String subject;
        String body;
        String headers;
    }
}
