package com.polymix.arb.infra;

import com.polymix.arb.core.VenueClientException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.PSSParameterSpec;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Signs Kalshi API requests: RSA-PSS over SHA-256 of
 * {@code timestampMillis + METHOD + /trade-api/v2 + path}.
 */
public class KalshiRequestSigner {

    static final String SIGNING_PREFIX = "/trade-api/v2";

    // AlgorithmIdentifier for rsaEncryption, used to wrap a PKCS#1 key into PKCS#8
    private static final byte[] RSA_ALGORITHM_ID = {
            0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private final String apiKeyId;
    private final PrivateKey privateKey;
    private final Clock clock;

    public KalshiRequestSigner(String apiKeyId, PrivateKey privateKey, Clock clock) {
        this.apiKeyId = apiKeyId;
        this.privateKey = privateKey;
        this.clock = clock;
    }

    /**
     * @param path request path below the API root, e.g. {@code /portfolio/orders}, no query
     */
    public Map<String, String> headers(String method, String path) {
        String timestamp = String.valueOf(clock.millis());
        String payload = timestamp + method.toUpperCase(Locale.ROOT) + SIGNING_PREFIX + path;
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("KALSHI-ACCESS-KEY", apiKeyId);
        headers.put("KALSHI-ACCESS-TIMESTAMP", timestamp);
        headers.put("KALSHI-ACCESS-SIGNATURE", sign(payload));
        return headers;
    }

    String sign(String payload) {
        try {
            Signature signature = newSignature();
            signature.initSign(privateKey);
            signature.update(payload.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new VenueClientException("Could not sign Kalshi request", e);
        }
    }

    static Signature newSignature() throws GeneralSecurityException {
        Signature signature = Signature.getInstance("RSASSA-PSS");
        signature.setParameter(new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, 32, 1));
        return signature;
    }

    /**
     * Loads the key from inline PEM text (literal {@code \n} sequences allowed) or, if that is
     * blank, from a PEM file.
     */
    public static PrivateKey loadPrivateKey(String pem, String path) {
        try {
            String text;
            if (pem != null && !pem.isBlank()) {
                text = pem.replace("\\n", "\n");
            } else if (path != null && !path.isBlank()) {
                text = Files.readString(Path.of(path), StandardCharsets.US_ASCII);
            } else {
                throw new IllegalArgumentException("Kalshi private key is not configured");
            }
            return parsePem(text);
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalArgumentException("Could not load Kalshi private key", e);
        }
    }

    static PrivateKey parsePem(String pem) throws GeneralSecurityException {
        boolean pkcs1 = pem.contains("BEGIN RSA PRIVATE KEY");
        String base64 = pem.replaceAll("-----(BEGIN|END) [A-Z ]+-----", "").replaceAll("\\s", "");
        byte[] der = Base64.getDecoder().decode(base64);
        byte[] pkcs8 = pkcs1 ? wrapPkcs1(der) : der;
        return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
    }

    // PrivateKeyInfo ::= SEQUENCE { version 0, AlgorithmIdentifier, OCTET STRING pkcs1 }
    private static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream inner = new ByteArrayOutputStream();
        inner.writeBytes(new byte[] {0x02, 0x01, 0x00});
        inner.writeBytes(RSA_ALGORITHM_ID);
        inner.write(0x04);
        inner.writeBytes(derLength(pkcs1.length));
        inner.writeBytes(pkcs1);

        byte[] content = inner.toByteArray();
        ByteArrayOutputStream outer = new ByteArrayOutputStream();
        outer.write(0x30);
        outer.writeBytes(derLength(content.length));
        outer.writeBytes(content);
        return outer.toByteArray();
    }

    private static byte[] derLength(int length) {
        if (length < 0x80) {
            return new byte[] {(byte) length};
        }
        if (length <= 0xff) {
            return new byte[] {(byte) 0x81, (byte) length};
        }
        if (length <= 0xffff) {
            return new byte[] {(byte) 0x82, (byte) (length >> 8), (byte) length};
        }
        return new byte[] {(byte) 0x83, (byte) (length >> 16), (byte) (length >> 8), (byte) length};
    }
}
