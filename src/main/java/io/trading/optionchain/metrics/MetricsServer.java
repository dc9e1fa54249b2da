package io.trading.optionchain.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * HTTP server for exposing Prometheus metrics and the recorder status.
 * Serves metrics, health and status endpoints.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final CollectorRegistry registry;
    private final Supplier<RecorderStatus> statusSupplier;
    private final ObjectMapper objectMapper;
    private HttpServer server;

    public MetricsServer(int port, RecorderMetrics metrics, Supplier<RecorderStatus> statusSupplier) {
        this.port = port;
        this.registry = metrics.getRegistry();
        this.statusSupplier = statusSupplier;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.createContext("/api/status", handleStatus());

        server.setExecutor(null);
        server.start();

        LOGGER.info("HTTP server started on port {}", getPort());
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", getPort());
        LOGGER.info("  Health:     http://localhost:{}/health", getPort());
        LOGGER.info("  API Status: http://localhost:{}/api/status", getPort());
    }

    /**
     * Bound port; differs from the configured one when 0 was requested.
     */
    public int getPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                sendResponse(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                RecorderStatus status = statusSupplier.get();
                boolean healthy = status != null && status.healthy();
                sendResponse(exchange, healthy ? 200 : 503, "text/plain", healthy ? "OK" : "DEGRADED");
            } catch (Exception e) {
                LOGGER.error("Error serving health", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                String response = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(statusSupplier.get());
                sendResponse(exchange, 200, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                sendResponse(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String contentType, String response) throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            server = null;
            LOGGER.info("HTTP server stopped");
        }
    }
}
