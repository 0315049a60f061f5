package com.agentdeploy.orchestrator.runtime;

import com.agentdeploy.orchestrator.runtime.dto.BuildRequest;
import com.agentdeploy.orchestrator.runtime.dto.BuildStatus;
import com.agentdeploy.orchestrator.runtime.dto.HealthCheck;
import com.agentdeploy.orchestrator.runtime.dto.ServiceRequest;
import com.agentdeploy.orchestrator.runtime.dto.ServiceStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP client for the managed container runtime.
 *
 * Covers the calls the pipeline needs: submit and poll an image build, deploy
 * and poll a service, delete a service, and probe a deployed service's health
 * endpoint. Uses java.net.http.HttpClient so every header and status code is
 * explicit.
 *
 * Called from processor worker threads; blocking I/O is fine here.
 */
@Component
public class RuntimeClient {

    private static final Logger log = LoggerFactory.getLogger(RuntimeClient.class);

    private static final Duration CALL_TIMEOUT   = Duration.ofSeconds(30);
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(10);
    private static final int      MAX_DETAIL     = 500;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public RuntimeClient(
            @Value("${deployer.runtime.base-url}") String baseUrl,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    // ------------------------------------------------------------------
    // Image builds
    // ------------------------------------------------------------------

    /**
     * Start building {@code source} into {@code image}.
     *
     * @throws RuntimeClientException if the runtime rejects the build or is unreachable
     */
    public BuildStatus submitBuild(String source, String image) {
        log.info("Submitting image build for {} from {}", image, source);
        String body = send(post("/builds", toJson(new BuildRequest(source, image))), "submitBuild " + image);
        return parse(body, BuildStatus.class, "submitBuild");
    }

    public BuildStatus getBuild(String buildId) {
        String body = send(get("/builds/" + encode(buildId)), "getBuild " + buildId);
        return parse(body, BuildStatus.class, "getBuild");
    }

    // ------------------------------------------------------------------
    // Services
    // ------------------------------------------------------------------

    public ServiceStatus deployService(ServiceRequest request) {
        log.info("Deploying service {} with image {} in {}", request.name(), request.image(), request.region());
        String body = send(post("/services", toJson(request)), "deployService " + request.name());
        return parse(body, ServiceStatus.class, "deployService");
    }

    public ServiceStatus getService(String name) {
        String body = send(get("/services/" + encode(name)), "getService " + name);
        return parse(body, ServiceStatus.class, "getService");
    }

    /** Delete a service. A 404 counts as already deleted. */
    public void deleteService(String name) {
        log.info("Deleting service {}", name);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/services/" + encode(name)))
                .timeout(CALL_TIMEOUT)
                .header("Accept", "application/json")
                .DELETE()
                .build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() == 404) {
                log.info("Service {} was already gone", name);
                return;
            }
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new RuntimeClientException("deleteService " + name + " failed: HTTP "
                        + resp.statusCode() + ": " + truncate(resp.body()), resp.statusCode());
            }
        } catch (IOException e) {
            throw new RuntimeClientException("deleteService " + name + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeClientException("deleteService " + name + " interrupted", e);
        }
    }

    // ------------------------------------------------------------------
    // Health
    // ------------------------------------------------------------------

    /**
     * GET {@code serviceUrl + path}. Never throws for HTTP or connection errors;
     * the caller decides what "not healthy" means.
     */
    public HealthCheck checkHealth(String serviceUrl, String path) {
        String url = (serviceUrl.endsWith("/") ? serviceUrl.substring(0, serviceUrl.length() - 1) : serviceUrl) + path;
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(HEALTH_TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            return new HealthCheck(resp.statusCode(), truncate(resp.body()));
        } catch (IOException e) {
            return HealthCheck.unreachable(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthCheck.unreachable("interrupted");
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest post(String path, String jsonBody) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(CALL_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(CALL_TIMEOUT)
                .header("Accept", "application/json")
                .GET()
                .build();
    }

    /** Send and return the body; non-2xx becomes RuntimeClientException. */
    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new RuntimeClientException(opName + " failed: HTTP " + resp.statusCode()
                        + ": " + truncate(resp.body()), resp.statusCode());
            }
            return resp.body();
        } catch (IOException e) {
            throw new RuntimeClientException(opName + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeClientException(opName + " interrupted", e);
        }
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeClientException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new RuntimeClientException("JSON serialization failed", e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() <= MAX_DETAIL ? s : s.substring(0, MAX_DETAIL) + "…";
    }
}
