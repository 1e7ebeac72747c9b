package com.bbthechange.rehearsalsync.client;

import com.bbthechange.rehearsalsync.dto.SlotUpdate;
import com.bbthechange.rehearsalsync.exception.AvailabilityApiException;
import com.bbthechange.rehearsalsync.model.AvailabilitySlot;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for the backend availability API.
 * Retries requests the backend rate limits, fails fast on everything else.
 */
@Component
public class AvailabilityApiClient {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityApiClient.class);

    private static final String USER_AGENT = "RehearsalCalendarSync/1.0";
    private static final int MAX_ATTEMPTS = 3;
    private static final long[] DEFAULT_RETRY_DELAYS_MS = {1000, 2000};
    private static final TypeReference<List<AvailabilitySlot>> SLOT_LIST = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String authToken;
    private final Duration requestTimeout;
    private final long[] retryDelaysMs;

    @Autowired
    public AvailabilityApiClient(
            ObjectMapper objectMapper,
            @Value("${backend.base-url}") String baseUrl,
            @Value("${backend.auth-token:}") String authToken,
            @Value("${backend.request-timeout-seconds:30}") long requestTimeoutSeconds) {
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.authToken = authToken;
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
        this.retryDelaysMs = DEFAULT_RETRY_DELAYS_MS;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Constructor for testing with custom HttpClient. Rate-limit retries happen without delay.
     */
    AvailabilityApiClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String authToken) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.authToken = authToken;
        this.requestTimeout = Duration.ofSeconds(30);
        this.retryDelaysMs = new long[]{0, 0};
    }

    /**
     * Fetch every availability slot of the current user.
     * Accepts both {"availability":[...]} and a bare array.
     */
    public List<AvailabilitySlot> getAllAvailabilitySlots() {
        HttpResponse<String> response = send("getAllAvailabilitySlots",
                request("/availability").GET());
        List<AvailabilitySlot> slots = readSlots("getAllAvailabilitySlots", response.body());
        logger.debug("Fetched {} availability slots", slots.size());
        return slots;
    }

    /**
     * Create slots in one request.
     *
     * @return the created slots with backend IDs, or the submitted slots when the
     * backend does not echo them
     */
    public List<AvailabilitySlot> bulkCreateSlots(List<AvailabilitySlot> slots) {
        HttpResponse<String> response = send("bulkCreateSlots",
                request("/availability/bulk").POST(jsonBody(Map.of("entries", slots))));

        String body = response.body();
        if (body == null || body.isBlank()) {
            return slots;
        }
        List<AvailabilitySlot> created = readSlots("bulkCreateSlots", body);
        return created.isEmpty() ? slots : created;
    }

    public void bulkUpdateSlots(List<SlotUpdate> updates) {
        send("bulkUpdateSlots",
                request("/availability/imported/batch").PUT(jsonBody(Map.of("updates", updates))));
    }

    public void bulkDeleteSlotsByExternalId(List<String> externalEventIds) {
        send("bulkDeleteSlotsByExternalId",
                request("/availability/imported/batch-delete")
                        .POST(jsonBody(Map.of("externalEventIds", externalEventIds))));
    }

    /**
     * Delete every slot the backend holds from calendar imports.
     *
     * @return the number of deleted slots, or -1 when the backend does not report it
     */
    public int deleteAllImportedSlots() {
        HttpResponse<String> response = send("deleteAllImportedSlots",
                request("/availability/imported").DELETE());

        String body = response.body();
        if (body == null || body.isBlank()) {
            return -1;
        }
        try {
            JsonNode deleted = objectMapper.readTree(body).path("deleted");
            return deleted.isNumber() ? deleted.asInt() : -1;
        } catch (IOException e) {
            logger.warn("Unreadable deleteAllImportedSlots response: {}", e.getMessage());
            return -1;
        }
    }

    private List<AvailabilitySlot> readSlots(String operation, String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode slots = root.isArray() ? root : root.path("availability");
            if (!slots.isArray()) {
                return List.of();
            }
            return objectMapper.convertValue(slots, SLOT_LIST);
        } catch (IOException | IllegalArgumentException e) {
            throw AvailabilityApiException.unavailable(operation, e);
        }
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .timeout(requestTimeout);
        if (authToken != null && !authToken.isBlank()) {
            builder.header("Authorization", "Bearer " + authToken);
        }
        return builder;
    }

    private HttpRequest.BodyPublisher jsonBody(Object payload) {
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload));
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to serialize request body", e);
        }
    }

    /**
     * Send a request, retrying on HTTP 429.
     */
    private HttpResponse<String> send(String operation, HttpRequest.Builder builder) {
        HttpRequest request = builder.build();

        for (int attempt = 1; ; attempt++) {
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                throw AvailabilityApiException.unavailable(operation, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw AvailabilityApiException.unavailable(operation, e);
            }

            int statusCode = response.statusCode();
            logger.debug("Availability API {} {} -> {}", request.method(), request.uri(), statusCode);

            if (statusCode == 429 && attempt < MAX_ATTEMPTS) {
                long delayMs = retryDelaysMs[attempt - 1];
                logger.warn("Rate limited by availability API (attempt {}/{}). Retrying in {}ms",
                        attempt, MAX_ATTEMPTS, delayMs);
                sleep(delayMs);
                continue;
            }

            if (statusCode < 200 || statusCode >= 300) {
                throw AvailabilityApiException.forStatus(operation, statusCode);
            }
            return response;
        }
    }

    private void sleep(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
