package io.github.goodees.seedlog.automation.fetch;

/*-
 * #%L
 * seedlog
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.databind.JsonNode;
import io.github.goodees.seedlog.ValidationException;
import io.github.goodees.seedlog.automation.AutomationTool;
import io.github.goodees.seedlog.automation.ImmutableToolParameter;
import io.github.goodees.seedlog.automation.ParameterType;
import io.github.goodees.seedlog.automation.ToolFailure;
import io.github.goodees.seedlog.automation.ToolParameter;
import io.github.goodees.seedlog.automation.ToolResult;
import io.github.goodees.seedlog.config.SeedlogConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Downloads the body of an http(s) resource as text. The timeout bounds the whole call including followed redirects.
 * The tool never retries.
 */
public class FetchTool implements AutomationTool {
    private static final Logger logger = LoggerFactory.getLogger(FetchTool.class);

    public static final String NAME = "wget";

    private final HttpClient client;
    private final long defaultTimeoutMs;
    private final long maxTimeoutMs;
    private final int maxRedirects;

    public FetchTool() {
        this(SeedlogConfiguration.DEFAULTS);
    }

    public FetchTool(SeedlogConfiguration configuration) {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build(), configuration);
    }

    /**
     * @param client client used for requests; it should not follow redirects by itself, since that would escape the
     *               redirect limit
     */
    public FetchTool(HttpClient client, SeedlogConfiguration configuration) {
        this.client = client;
        this.defaultTimeoutMs = configuration.fetchDefaultTimeoutMs();
        this.maxTimeoutMs = configuration.fetchMaxTimeoutMs();
        this.maxRedirects = configuration.fetchMaxRedirects();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String signature() {
        return "wget(string uri, number timeoutMs): string";
    }

    @Override
    public String description() {
        return "Download data from a URI with a timeout. The URI must start with http:// or https://. "
                + "Timeout is in milliseconds, default " + defaultTimeoutMs + ", max " + maxTimeoutMs
                + ". Returns the content as a string.";
    }

    @Override
    public List<ToolParameter> parameters() {
        return Arrays.asList(
                ImmutableToolParameter.builder()
                        .name("uri")
                        .type(ParameterType.STRING)
                        .description("The URI to download from")
                        .build(),
                ImmutableToolParameter.builder()
                        .name("timeoutMs")
                        .type(ParameterType.NUMBER)
                        .description("Timeout in milliseconds (default: " + defaultTimeoutMs + ", max: "
                                + maxTimeoutMs + ")")
                        .required(false)
                        .build());
    }

    @Override
    public ToolResult execute(List<JsonNode> args) throws ValidationException {
        String uri = validateUri(args.isEmpty() ? null : args.get(0));
        long timeoutMs = validateTimeout(args.size() < 2 ? null : args.get(1));
        return fetch(uri, timeoutMs == 0 ? maxTimeoutMs : timeoutMs);
    }

    private String validateUri(JsonNode arg) throws ValidationException {
        if (arg == null || !arg.isTextual()) {
            throw new ValidationException("URI must be a string");
        }
        String uri = arg.textValue();
        if (!uri.startsWith("http://") && !uri.startsWith("https://")) {
            throw new ValidationException("URI must start with http:// or https://");
        }
        return uri;
    }

    private long validateTimeout(JsonNode arg) throws ValidationException {
        if (arg == null || arg.isNull()) {
            return defaultTimeoutMs;
        }
        if (!arg.isNumber()) {
            throw new ValidationException("timeoutMs must be a number");
        }
        double timeout = arg.doubleValue();
        if (Double.isNaN(timeout) || timeout < 0 || timeout > maxTimeoutMs) {
            throw new ValidationException("timeoutMs must be between 0 and " + maxTimeoutMs);
        }
        return (long) Math.ceil(timeout);
    }

    ToolResult fetch(String uri, long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        URI current;
        try {
            current = URI.create(uri);
        } catch (IllegalArgumentException e) {
            return failure(ToolFailure.Kind.GENERIC_ERROR, "Invalid URI " + uri + ": " + e.getMessage());
        }
        for (int redirects = 0; ; redirects++) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return timedOut(timeoutMs);
            }
            HttpResponse<String> response;
            CompletableFuture<HttpResponse<String>> future = null;
            try {
                logger.debug("GET {} ({} ms left)", current, TimeUnit.NANOSECONDS.toMillis(remaining));
                HttpRequest request = HttpRequest.newBuilder(current)
                        .timeout(Duration.ofNanos(remaining))
                        .GET()
                        .build();
                future = client.sendAsync(request, HttpResponse.BodyHandlers.ofString());
                response = future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                return timedOut(timeoutMs);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return failure(ToolFailure.Kind.GENERIC_ERROR, "Interrupted while fetching " + current);
            } catch (ExecutionException e) {
                return failed(current, e.getCause(), timeoutMs);
            } catch (IllegalArgumentException e) {
                return failure(ToolFailure.Kind.GENERIC_ERROR, e.getMessage());
            }

            int status = response.statusCode();
            if (isFollowedRedirect(status)) {
                Optional<String> location = response.headers().firstValue("Location");
                if (location.isPresent()) {
                    if (redirects >= maxRedirects) {
                        return failure(ToolFailure.Kind.GENERIC_ERROR, "Maximum number of redirects exceeded");
                    }
                    Optional<URI> next = resolve(current, location.get());
                    if (!next.isPresent()) {
                        return failure(ToolFailure.Kind.GENERIC_ERROR,
                                "Unsupported redirect location " + location.get());
                    }
                    current = next.get();
                    continue;
                }
            }
            if (status >= 400) {
                return ToolResult.failure(NAME, ToolFailure.httpError(status, reasonPhrase(status)));
            }
            return ToolResult.success(NAME, response.body());
        }
    }

    private ToolResult failed(URI uri, Throwable cause, long timeoutMs) {
        if (cause instanceof HttpTimeoutException) {
            return timedOut(timeoutMs);
        } else if (cause instanceof IOException) {
            logger.debug("No response from {}", uri, cause);
            return failure(ToolFailure.Kind.NETWORK_ERROR, "No response from server - " + cause.getMessage());
        } else {
            logger.warn("Fetching {} failed", uri, cause);
            return failure(ToolFailure.Kind.GENERIC_ERROR, String.valueOf(cause.getMessage()));
        }
    }

    private ToolResult timedOut(long timeoutMs) {
        return failure(ToolFailure.Kind.TIMEOUT, "Request timed out after " + timeoutMs + "ms");
    }

    private static ToolResult failure(ToolFailure.Kind kind, String message) {
        return ToolResult.failure(NAME, kind, message);
    }

    static boolean isFollowedRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    static Optional<URI> resolve(URI base, String location) {
        try {
            URI next = base.resolve(location);
            String scheme = next.getScheme();
            if ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) {
                return Optional.of(next);
            }
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            logger.debug("Cannot resolve redirect {} against {}", location, base, e);
            return Optional.empty();
        }
    }

    static String reasonPhrase(int status) {
        switch (status) {
            case 400:
                return "Bad Request";
            case 401:
                return "Unauthorized";
            case 403:
                return "Forbidden";
            case 404:
                return "Not Found";
            case 405:
                return "Method Not Allowed";
            case 408:
                return "Request Timeout";
            case 410:
                return "Gone";
            case 429:
                return "Too Many Requests";
            case 500:
                return "Internal Server Error";
            case 501:
                return "Not Implemented";
            case 502:
                return "Bad Gateway";
            case 503:
                return "Service Unavailable";
            case 504:
                return "Gateway Timeout";
            default:
                return status < 500 ? "Client Error" : "Server Error";
        }
    }
}
