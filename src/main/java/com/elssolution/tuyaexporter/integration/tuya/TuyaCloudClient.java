package com.elssolution.tuyaexporter.integration.tuya;

import com.elssolution.tuyaexporter.domain.FetchException;
import com.elssolution.tuyaexporter.domain.FetchException.Kind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * HTTP client for the Tuya Cloud OpenAPI: token handling, request signing and
 * translation of HTTP/API failures into {@link FetchException} kinds.
 * Returns the raw {@code result} node; no device semantics here.
 */
@Slf4j
@Service
public class TuyaCloudClient {

    // ----- API constants -----
    static final String PATH_TOKEN = "/v1.0/token?grant_type=1";
    static final String PATH_DEVICE = "/v1.0/devices/%s";
    static final String PATH_SPECIFICATIONS = "/v1.0/devices/%s/specifications";
    private static final String SIGN_METHOD = "HMAC-SHA256";

    /** API codes meaning credentials/signature are wrong. */
    private static final Set<Integer> AUTH_CODES = Set.of(1004, 1010, 1011, 1012, 1013, 1106);
    /** Subset of AUTH_CODES after which a fresh token is worth one more try. */
    private static final Set<Integer> TOKEN_INVALID_CODES = Set.of(1010, 1011);

    /** Refresh the token this long before Tuya says it expires. */
    private static final long TOKEN_EXPIRY_MARGIN_MS = 60_000;
    /** Floor for the cached token lifetime when expire_time is missing or tiny. */
    static final long MIN_TOKEN_LIFETIME_MS = 60_000;

    // ----- Config -----
    private final String baseUri;
    private final String apiKey;
    private final String apiSecret;
    private final Duration requestTimeout;
    private final Clock clock;

    // ----- HTTP + JSON -----
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    // ----- Token state -----
    private final Object tokenLock = new Object();
    private String accessToken;        // guarded by tokenLock
    private long tokenExpiresAtMs = 0; // guarded by tokenLock

    public TuyaCloudClient(@Value("${tuya.api.region:}") String region,
                           @Value("${tuya.api.uri:}") String baseUriOverride,
                           @Value("${tuya.api.key:}") String apiKey,
                           @Value("${tuya.api.secret:}") String apiSecret,
                           @Value("${tuya.http.requestTimeoutMs:6000}") int requestTimeoutMs,
                           Clock clock) {
        if (isBlank(apiKey)) throw new IllegalStateException("Tuya API key missing (set TUYA_API_KEY)");
        if (isBlank(apiSecret)) throw new IllegalStateException("Tuya API secret missing (set TUYA_API_SECRET)");
        if (isBlank(baseUriOverride) && isBlank(region)) {
            throw new IllegalStateException("Tuya region missing (set TUYA_REGION)");
        }
        this.baseUri = isBlank(baseUriOverride) ? TuyaRegion.fromCode(region).baseUri() : baseUriOverride.trim();
        this.apiKey = apiKey.trim();
        this.apiSecret = apiSecret.trim();
        this.requestTimeout = Duration.ofMillis(Math.max(1000, requestTimeoutMs));
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(4))
                .build();
        log.info("Tuya client: endpoint={} timeout={}ms", this.baseUri, this.requestTimeout.toMillis());
    }

    /** Current device details: name, update_time, status[] of {code, value}. */
    public JsonNode getDevice(String deviceId) throws FetchException {
        return getResult(deviceId, String.format(PATH_DEVICE, deviceId));
    }

    /** Data-point specification: status[] of {code, type, values(json string)}. */
    public JsonNode getSpecification(String deviceId) throws FetchException {
        return getResult(deviceId, String.format(PATH_SPECIFICATIONS, deviceId));
    }

    // ===== Request flow =====

    private JsonNode getResult(String deviceId, String path) throws FetchException {
        try {
            return signedGet(deviceId, path);
        } catch (TokenRejected first) {
            log.info("tuya_token_rejected code={} → refreshing token", first.code);
            invalidateToken(first.token);
            try {
                return signedGet(deviceId, path);
            } catch (TokenRejected second) {
                throw new FetchException(deviceId, Kind.AUTH,
                        "Token rejected twice: code=" + second.code + " msg=" + second.getMessage());
            }
        }
    }

    private JsonNode signedGet(String deviceId, String path) throws FetchException, TokenRejected {
        String token = accessToken(deviceId);
        JsonNode root = send(deviceId, path, token);
        if (!root.path("success").asBoolean(false)) {
            int code = root.path("code").asInt(-1);
            String msg = root.path("msg").asText("");
            if (TOKEN_INVALID_CODES.contains(code)) throw new TokenRejected(token, code, msg);
            throw apiFailure(deviceId, code, msg);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new FetchException(deviceId, Kind.MALFORMED_RESPONSE, "Response has no 'result' for " + path);
        }
        return result;
    }

    /** Returns a cached token, fetching a new one when absent or about to expire. */
    private String accessToken(String deviceId) throws FetchException {
        synchronized (tokenLock) {
            long now = clock.millis();
            if (accessToken != null && now < tokenExpiresAtMs) return accessToken;

            JsonNode root = send(deviceId, PATH_TOKEN, null);
            if (!root.path("success").asBoolean(false)) {
                int code = root.path("code").asInt(-1);
                FetchException e = apiFailure(deviceId, code, root.path("msg").asText(""));
                // any token failure that isn't network/rate related means our credentials are bad
                if (e.getKind() == Kind.RATE_LIMITED || e.getKind() == Kind.NETWORK) throw e;
                throw new FetchException(deviceId, Kind.AUTH, "Token request failed: " + e.getMessage());
            }
            JsonNode result = root.path("result");
            String token = result.path("access_token").asText("");
            long expireSec = result.path("expire_time").asLong(0);
            if (token.isEmpty()) {
                throw new FetchException(deviceId, Kind.MALFORMED_RESPONSE, "Token response without access_token");
            }
            accessToken = token;
            tokenExpiresAtMs = now + Math.max(MIN_TOKEN_LIFETIME_MS, expireSec * 1000 - TOKEN_EXPIRY_MARGIN_MS);
            log.debug("tuya_token_refreshed expiresInSec={}", expireSec);
            return accessToken;
        }
    }

    /** Drops the cached token, unless another thread already replaced the rejected one. */
    void invalidateToken(String rejected) {
        synchronized (tokenLock) {
            if (accessToken == null || !accessToken.equals(rejected)) return;
            accessToken = null;
            tokenExpiresAtMs = 0;
        }
    }

    /** One signed GET. Classifies HTTP-level failures; API-level ones are left to the caller. */
    private JsonNode send(String deviceId, String path, String token) throws FetchException {
        String t = Long.toString(clock.millis());
        String nonce = UUID.randomUUID().toString();
        String sign = sign(deviceId, token, t, nonce, "GET", path);

        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(safeJoin(baseUri, path)))
                .header("Accept", "application/json")
                .header("client_id", apiKey)
                .header("t", t)
                .header("nonce", nonce)
                .header("sign_method", SIGN_METHOD)
                .header("sign", sign)
                .header("User-Agent", "TuyaExporter/1.0")
                .timeout(requestTimeout)
                .GET();
        if (token != null) b.header("access_token", token);

        HttpResponse<String> resp;
        try {
            resp = httpClient.send(b.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new FetchException(deviceId, Kind.NETWORK, "HTTP timeout: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FetchException(deviceId, Kind.NETWORK, "I/O error: " + e, e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FetchException(deviceId, Kind.NETWORK, "Interrupted", ie);
        }

        int sc = resp.statusCode();
        if (sc != 200) {
            Kind kind;
            if (sc == 401 || sc == 403) kind = Kind.AUTH;
            else if (sc == 404) kind = Kind.NOT_FOUND;
            else if (sc == 429) kind = Kind.RATE_LIMITED;
            else if (sc >= 500 && sc < 600) kind = Kind.NETWORK;
            else kind = Kind.MALFORMED_RESPONSE;
            throw new FetchException(deviceId, kind, "HTTP " + sc + " — " + truncate(resp.body(), 240));
        }

        try {
            JsonNode root = objectMapper.readTree(resp.body() == null ? "" : resp.body());
            if (root == null || !root.isObject()) {
                throw new FetchException(deviceId, Kind.MALFORMED_RESPONSE, "Response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new FetchException(deviceId, Kind.MALFORMED_RESPONSE, "Unparsable JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Maps a {@code success:false} envelope to a failure kind. */
    static FetchException apiFailure(String deviceId, int code, String msg) {
        String m = msg == null ? "" : msg.toLowerCase(Locale.ROOT);
        Kind kind;
        if (AUTH_CODES.contains(code)) kind = Kind.AUTH;
        else if (m.contains("not exist") || m.contains("not found")) kind = Kind.NOT_FOUND;
        else if (m.contains("frequency") || m.contains("too many") || m.contains("rate limit")) kind = Kind.RATE_LIMITED;
        else kind = Kind.MALFORMED_RESPONSE;
        return new FetchException(deviceId, kind, "API code " + code + " msg=" + msg);
    }

    // ===== Signing =====

    /**
     * Tuya "new" signature: HMAC-SHA256 over
     * {@code client_id [+ access_token] + t + nonce + METHOD\nSHA256(body)\n\nURL}, upper-case hex.
     */
    private String sign(String deviceId, String token, String t, String nonce, String method, String path)
            throws FetchException {
        try {
            String stringToSign = String.join("\n", method, sha256Hex(""), "", path);
            String payload = apiKey + (token == null ? "" : token) + t + nonce + stringToSign;
            return hmacSha256Hex(payload, apiSecret);
        } catch (GeneralSecurityException e) {
            throw new FetchException(deviceId, Kind.AUTH, "Cannot sign request: " + e.getMessage(), e);
        }
    }

    static String hmacSha256Hex(String data, String key) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().withUpperCase().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
    }

    static String sha256Hex(String s) throws GeneralSecurityException {
        MessageDigest md = MessageDigest.getInstance("SHA-256");
        return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
    }

    // ===== Helpers =====

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String truncate(String s, int limit) {
        if (s == null) return "";
        return s.length() <= limit ? s : s.substring(0, Math.max(0, limit)) + "…";
    }

    private static String safeJoin(String base, String path) {
        if (base.endsWith("/") && path.startsWith("/")) return base.substring(0, base.length() - 1) + path;
        if (!base.endsWith("/") && !path.startsWith("/")) return base + "/" + path;
        return base + path;
    }

    /** Token expired/invalid: handled inside this class by one refresh-and-retry. */
    private static final class TokenRejected extends Exception {
        final String token;
        final int code;

        TokenRejected(String token, int code, String msg) {
            super(msg);
            this.token = token;
            this.code = code;
        }
    }
}
