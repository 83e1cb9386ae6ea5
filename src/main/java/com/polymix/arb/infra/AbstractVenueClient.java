package com.polymix.arb.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymix.arb.config.TradingProperties;
import com.polymix.arb.core.VenueClient;
import com.polymix.arb.core.VenueClientException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Shared REST plumbing for live venue clients: rate limiting, retry on 429 and transient
 * network errors, JSON decoding.
 */
@Slf4j
abstract class AbstractVenueClient implements VenueClient {

    protected static final MediaType JSON = MediaType.get("application/json");
    protected static final String USER_AGENT = "PolyMix-Arb/0.1";

    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper;
    private final PermitBucket permits;
    private final int maxAttempts;
    private final long backoffMillis;

    protected AbstractVenueClient(OkHttpClient httpClient, ObjectMapper objectMapper, TradingProperties.Http http) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.permits = new PermitBucket(http.getRequestsPerSecond(), http.getBurst(), System::nanoTime);
        this.maxAttempts = http.getMaxAttempts();
        this.backoffMillis = http.getRetryBackoff().toMillis();
    }

    protected RequestBody jsonBody(String json) {
        return RequestBody.create(json, JSON);
    }

    protected String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new VenueClientException("Could not encode request body", e);
        }
    }

    /**
     * @return the decoded body, or an empty object node for an empty 2xx response
     * @throws VenueClientException on a non-2xx status or when retries are exhausted
     */
    protected JsonNode execute(Request request) {
        for (int attempt = 1; ; attempt++) {
            throttle(request);
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                String text = body != null ? body.string() : "";
                if (response.isSuccessful()) {
                    return text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
                }
                if (response.code() == 429 && attempt < maxAttempts) {
                    log.warn("[{}] 429 from {} {}, backing off (attempt {}/{})", venue().getDisplayName(),
                            request.method(), request.url().encodedPath(), attempt, maxAttempts);
                    backoff(attempt);
                    continue;
                }
                throw new VenueClientException(String.format("%s %s failed: %d %s", request.method(),
                        request.url().encodedPath(), response.code(), text));
            } catch (IOException e) {
                if (attempt >= maxAttempts) {
                    throw new VenueClientException(String.format("%s %s failed after %d attempts",
                            request.method(), request.url().encodedPath(), attempt), e);
                }
                log.debug("[{}] Transient error on {}: {}", venue().getDisplayName(), request.url(), e.getMessage());
                backoff(attempt);
            }
        }
    }

    private void throttle(Request request) {
        long waitNanos = permits.reserve();
        if (waitNanos <= 0) {
            return;
        }
        log.debug("[{}] Throttling {} {} for {}ms", venue().getDisplayName(), request.method(),
                request.url().encodedPath(), TimeUnit.NANOSECONDS.toMillis(waitNanos));
        try {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueClientException("Interrupted while waiting for a request permit", e);
        }
    }

    private void backoff(int attempt) {
        try {
            TimeUnit.MILLISECONDS.sleep(backoffMillis * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueClientException("Interrupted during retry backoff", e);
        }
    }

    /**
     * Per-venue request budget. Starts full with {@code burst} permits and refills at
     * {@code permitsPerSecond}. A caller that finds the bucket empty reserves the next permit
     * ahead of time, so concurrent callers queue up instead of all waking at once.
     */
    static final class PermitBucket {
        private static final double NANOS_PER_SECOND = 1_000_000_000.0;

        private final double permitsPerSecond;
        private final int burst;
        private final LongSupplier ticker;
        private double available;
        private long lastRefill;

        PermitBucket(double permitsPerSecond, int burst, LongSupplier ticker) {
            if (permitsPerSecond <= 0 || burst < 1) {
                throw new IllegalArgumentException("Request budget needs a positive rate and burst");
            }
            this.permitsPerSecond = permitsPerSecond;
            this.burst = burst;
            this.ticker = ticker;
            this.available = burst;
            this.lastRefill = ticker.getAsLong();
        }

        /**
         * Takes one permit.
         *
         * @return nanoseconds the caller must wait before sending, 0 when a permit was on hand
         */
        synchronized long reserve() {
            long now = ticker.getAsLong();
            available = Math.min(burst, available + (now - lastRefill) / NANOS_PER_SECOND * permitsPerSecond);
            lastRefill = now;
            available -= 1.0;
            if (available >= 0) {
                return 0;
            }
            return (long) Math.ceil(-available / permitsPerSecond * NANOS_PER_SECOND);
        }
    }
}
