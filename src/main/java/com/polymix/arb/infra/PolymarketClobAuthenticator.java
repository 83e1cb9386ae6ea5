package com.polymix.arb.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymix.arb.core.VenueClientException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.web3j.crypto.Credentials;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Two-level CLOB authentication. Level 1 proves wallet ownership with a signed
 * {@code ClobAuth} message and yields API credentials; level 2 signs each request with an
 * HMAC of {@code timestamp + METHOD + path (+ body)} under the API secret.
 */
@Slf4j
public class PolymarketClobAuthenticator {

    private final Credentials wallet;
    private final PolymarketSigner signer;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Clock clock;

    private volatile ApiCredentials apiCredentials;

    @Value
    public static class ApiCredentials {
        String key;
        String secret;
        String passphrase;
    }

    public PolymarketClobAuthenticator(String privateKey, PolymarketSigner signer, OkHttpClient httpClient,
            ObjectMapper objectMapper, String baseUrl, Clock clock) {
        this.wallet = Credentials.create(normalizePrivateKey(privateKey));
        this.signer = signer;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.clock = clock;
    }

    public String address() {
        return wallet.getAddress();
    }

    Credentials wallet() {
        return wallet;
    }

    Map<String, String> l1Headers(long nonce) {
        long ts = clock.instant().getEpochSecond();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("POLY_ADDRESS", wallet.getAddress());
        headers.put("POLY_SIGNATURE", signer.signClobAuth(wallet, ts, nonce));
        headers.put("POLY_TIMESTAMP", String.valueOf(ts));
        headers.put("POLY_NONCE", String.valueOf(nonce));
        return headers;
    }

    /**
     * @param body compact JSON exactly as it will be sent, or null
     */
    public Map<String, String> l2Headers(String method, String path, String body) {
        ApiCredentials creds = ensureCredentials();
        long ts = clock.instant().getEpochSecond();
        String message = ts + method.toUpperCase(Locale.ROOT) + path + (body != null ? body : "");
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("POLY_ADDRESS", wallet.getAddress());
        headers.put("POLY_SIGNATURE", hmac(creds.getSecret(), message));
        headers.put("POLY_TIMESTAMP", String.valueOf(ts));
        headers.put("POLY_API_KEY", creds.getKey());
        headers.put("POLY_PASSPHRASE", creds.getPassphrase());
        return headers;
    }

    /**
     * Creates an API key for the wallet, falling back to deriving the existing one.
     */
    public ApiCredentials ensureCredentials() {
        ApiCredentials current = apiCredentials;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (apiCredentials == null) {
                ApiCredentials creds;
                try {
                    creds = requestCredentials("POST", "/auth/api-key");
                } catch (VenueClientException e) {
                    log.info("[POLYMARKET] API key creation failed ({}), deriving existing key", e.getMessage());
                    creds = requestCredentials("GET", "/auth/derive-api-key");
                }
                apiCredentials = creds;
                log.info("[POLYMARKET] CLOB credentials ready for {}", wallet.getAddress());
            }
            return apiCredentials;
        }
    }

    private ApiCredentials requestCredentials(String method, String path) {
        Request.Builder builder = new Request.Builder().url(baseUrl + path);
        l1Headers(0).forEach(builder::header);
        builder.method(method, "POST".equals(method) ? RequestBody.create(new byte[0]) : null);

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new VenueClientException(method + " " + path + " failed: " + response.code() + " " + text);
            }
            JsonNode node = objectMapper.readTree(text);
            if (!node.hasNonNull("apiKey") || !node.hasNonNull("secret") || !node.hasNonNull("passphrase")) {
                throw new VenueClientException(path + " returned no API credentials");
            }
            return new ApiCredentials(node.get("apiKey").asText(), node.get("secret").asText(),
                    node.get("passphrase").asText());
        } catch (IOException e) {
            throw new VenueClientException(method + " " + path + " failed", e);
        }
    }

    // Secrets are url-safe base64; the signature goes back out the same way
    static String hmac(String secret, String message) {
        try {
            byte[] key = Base64.getUrlDecoder().decode(secret.replace('+', '-').replace('/', '_'));
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key, "HmacSHA256"));
            byte[] digest = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().encodeToString(digest);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new VenueClientException("Could not sign CLOB request", e);
        }
    }

    private static String normalizePrivateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Polymarket private key is required for CLOB authentication");
        }
        String trimmed = key.trim();
        return trimmed.startsWith("0x") ? trimmed : "0x" + trimmed;
    }
}
