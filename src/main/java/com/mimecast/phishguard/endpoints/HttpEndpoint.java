package com.mimecast.phishguard.endpoints;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.mimecast.phishguard.config.EndpointConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Abstract base class for embedded HTTP endpoints.
 *
 * <p>Provides common functionality including:
 * <ul>
 *   <li>Server lifecycle with configurable port</li>
 *   <li>JSON response and error helpers</li>
 *   <li>Bounded request body reading</li>
 * </ul>
 */
public abstract class HttpEndpoint {
    private static final Logger log = LogManager.getLogger(HttpEndpoint.class);

    /**
     * Plain Gson instance for error bodies.
     */
    private static final Gson ERROR_GSON = new Gson();

    /**
     * Embedded HTTP server instance.
     */
    protected HttpServer server;

    /**
     * Starts the HTTP endpoint with the given configuration.
     *
     * @param config EndpointConfig containing port and thread settings.
     * @throws IOException If an I/O error occurs during server startup.
     */
    public abstract void start(EndpointConfig config) throws IOException;

    /**
     * Stops the HTTP endpoint if running.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            log.info("Endpoint stopped");
        }
    }

    /**
     * Gets the bound port.
     *
     * @return Port number or -1 if not running.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    /**
     * Checks the request method and replies 405 when it does not match.
     *
     * @param exchange HTTP exchange.
     * @param method   Expected method.
     * @return True if the method matches.
     * @throws IOException If an I/O error occurs.
     */
    protected boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        log.debug("Rejecting {} request to {}", exchange.getRequestMethod(), exchange.getRequestURI());
        exchange.getResponseHeaders().set("Allow", method);
        sendError(exchange, 405, "Method Not Allowed");
        return false;
    }

    /**
     * Sends a JSON response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param json     JSON payload.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendJson(HttpExchange exchange, int code, String json) throws IOException {
        sendResponse(exchange, code, "application/json; charset=utf-8", json);
        log.debug("Sent JSON response: status={}", code);
    }

    /**
     * Sends a JSON error body of the form {@code {"error": "..."}}.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP error code.
     * @param message  Error message.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendError(HttpExchange exchange, int code, String message) throws IOException {
        JsonObject error = new JsonObject();
        error.addProperty("error", message);
        sendResponse(exchange, code, "application/json; charset=utf-8", ERROR_GSON.toJson(error));
        log.debug("Sent error response: status={}, message={}", code, message);
    }

    /**
     * Sends a response with the specified HTTP status code, content type, and payload.
     *
     * @param exchange    HTTP exchange.
     * @param code        HTTP status code.
     * @param contentType Content-Type header value.
     * @param response    Response payload.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendResponse(HttpExchange exchange, int code, String contentType, String response) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        log.trace("Sent response: status={}, contentType={}, bytes={}", code, contentType, bytes.length);
    }

    /**
     * Reads the request body up to a limit.
     *
     * @param is    Request body stream.
     * @param limit Maximum bytes accepted.
     * @return Body bytes, or null if the body exceeds the limit.
     * @throws IOException If an I/O error occurs while reading.
     */
    protected byte[] readBody(InputStream is, long limit) throws IOException {
        try (is) {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            long total = 0;
            int read;
            while ((read = is.read(buffer)) != -1) {
                total += read;
                if (total > limit) {
                    log.debug("Request body exceeds limit of {} bytes", limit);
                    return null;
                }
                baos.write(buffer, 0, read);
            }
            log.debug("Read request body ({} bytes)", total);
            return baos.toByteArray();
        }
    }
}
