package com.scout.executor.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.common.infra.ErrorUtils;
import com.scout.executor.ApprovalMode;
import com.scout.executor.ExecutorException;
import com.scout.executor.SessionExecutor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for a local control-plane server that hosts agent sessions.
 * <p>
 * The server's ownership model is folded into the three session states:
 * no owner or an idle owner means done, an owner waiting for input means
 * running with a pending approval.
 */
@Slf4j
public class ControlPlaneExecutor implements SessionExecutor {

    static final String MARKER_HEADER = "X-Yep-Anywhere";
    private static final MediaType JSON = MediaType.parse("application/json");

    private final String baseUrl;
    private final String sessionsUrl;
    private final ApprovalMode defaultMode;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ControlPlaneExecutor(String baseUrl, String projectId, ApprovalMode defaultMode) {
        this(baseUrl, projectId, defaultMode, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .writeTimeout(Duration.ofSeconds(30))
                .build());
    }

    public ControlPlaneExecutor(String baseUrl, String projectId, ApprovalMode defaultMode,
            OkHttpClient httpClient) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.sessionsUrl = this.baseUrl + "/api/projects/" + projectId + "/sessions";
        this.defaultMode = defaultMode != null ? defaultMode : ApprovalMode.BYPASS;
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return "remote";
    }

    @Override
    public StartResult start(String message, SessionOptions options) throws ExecutorException {
        Request request = post(sessionsUrl, sessionPayload(message, options));
        try (Response response = httpClient.newCall(request).execute()) {
            String body = bodyOf(response);
            switch (response.code()) {
                case 200 -> {
                    String sessionId = objectMapper.readTree(body).path("sessionId").asText(null);
                    if (sessionId == null) {
                        throw new ExecutorException("Start response carried no sessionId: " + body);
                    }
                    log.info("Started remote session {}", sessionId);
                    return new StartResult(sessionId, StartStatus.STARTED);
                }
                case 202 -> {
                    JsonNode data = objectMapper.readTree(body);
                    String queueId = data.path("queueId").asText(null);
                    log.info("Remote start queued as {} (position {})", queueId, data.path("position").asInt());
                    return new StartResult(queueId, StartStatus.QUEUED);
                }
                default -> throw new ExecutorException(
                        "Start failed (" + response.code() + "): " + body);
            }
        } catch (IOException e) {
            throw new ExecutorException("Start failed: " + ErrorUtils.formatErrorMessage(e), e);
        }
    }

    @Override
    public boolean resume(String sessionId, String message, SessionOptions options) {
        Request request = post(sessionsUrl + "/" + sessionId + "/resume", sessionPayload(message, options));
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() != 200) {
                log.warn("Resume of {} refused: HTTP {}", sessionId, response.code());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("Resume of {} failed: {}", sessionId, ErrorUtils.formatErrorMessage(e));
            return false;
        }
    }

    @Override
    public PollResult poll(String sessionId) {
        JsonNode data;
        try {
            data = fetchMetadata(sessionId);
        } catch (IOException e) {
            return PollResult.error(ErrorUtils.formatErrorMessage(e));
        }
        if (data == null) {
            return PollResult.error("metadata unavailable");
        }

        JsonNode ownership = data.path("ownership");
        String owner = ownership.path("owner").asText("");
        String state = ownership.path("state").asText("");
        JsonNode percentage = data.path("session").path("contextUsage").path("percentage");
        Double usage = percentage.isNumber() ? percentage.asDouble() : null;

        if ("none".equals(owner) || "idle".equals(state)) {
            return PollResult.builder().status(SessionStatus.DONE).contextPercentage(usage).build();
        }
        PollResult.PollResultBuilder result = PollResult.builder()
                .status(SessionStatus.RUNNING)
                .contextPercentage(usage);
        JsonNode pending = data.path("pendingInputRequest");
        if ("waiting-input".equals(state) && pending.isObject()) {
            result.pendingInput(PendingInput.builder()
                    .type(pending.path("type").asText(null))
                    .toolName(pending.path("toolName").asText(null))
                    .requestId(pending.path("id").asText(null))
                    .prompt(pending.path("prompt").asText(null))
                    .build());
        }
        return result.build();
    }

    @Override
    public boolean supportsInputResponse() {
        return true;
    }

    @Override
    public boolean respondToInput(String sessionId, String requestId, InputResponse response, String feedback) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", requestId);
        payload.put("response", response.wireName());
        if (feedback != null) {
            payload.put("feedback", feedback);
        }
        Request request = post(baseUrl + "/api/sessions/" + sessionId + "/input", payload);
        try (Response res = httpClient.newCall(request).execute()) {
            if (!res.isSuccessful()) {
                return false;
            }
            return objectMapper.readTree(bodyOf(res)).path("accepted").asBoolean(false);
        } catch (IOException e) {
            log.warn("Input response for {} failed: {}", sessionId, ErrorUtils.formatErrorMessage(e));
            return false;
        }
    }

    @Override
    public void cleanup(String sessionId) {
        try {
            JsonNode data = fetchMetadata(sessionId);
            if (data == null) {
                return;
            }
            JsonNode ownership = data.path("ownership");
            String processId = ownership.path("processId").asText(null);
            if ("self".equals(ownership.path("owner").asText()) && processId != null) {
                Request abort = post(baseUrl + "/api/processes/" + processId + "/abort", Map.of());
                try (Response ignored = httpClient.newCall(abort).execute()) {
                    log.info("Aborted remote session {} (process {})", sessionId, processId);
                }
            }
        } catch (IOException e) {
            log.warn("Cleanup of {} failed: {}", sessionId, ErrorUtils.formatErrorMessage(e));
        }
    }

    private JsonNode fetchMetadata(String sessionId) throws IOException {
        Request request = new Request.Builder()
                .url(sessionsUrl + "/" + sessionId + "/metadata")
                .header(MARKER_HEADER, "true")
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.debug("Metadata for {} returned HTTP {}", sessionId, response.code());
                return null;
            }
            return objectMapper.readTree(bodyOf(response));
        }
    }

    private Map<String, Object> sessionPayload(String message, SessionOptions options) {
        ApprovalMode mode = options != null && options.getMode() != null ? options.getMode() : defaultMode;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("mode", mode.wireName());
        if (options != null && options.getRules() != null) {
            payload.put("permissions", options.getRules());
        }
        return payload;
    }

    private Request post(String url, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable payload", e);
        }
        return new Request.Builder()
                .url(url)
                .header(MARKER_HEADER, "true")
                .post(RequestBody.create(json, JSON))
                .build();
    }

    private static String bodyOf(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
