package com.scout.channel.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal Telegram Bot API client over {@link HttpClient}.
 * <p>
 * Every method is a JSON POST to {@code <base>/bot<token>/<method>}; replies
 * are unwrapped from the {@code {ok, result, description}} envelope.
 */
@Slf4j
public class TelegramApi {

    public static final String DEFAULT_API_BASE = "https://api.telegram.org";
    public static final int MAX_MESSAGE_LENGTH = 4096;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;
    private final String token;
    private final String apiBase;

    public TelegramApi(String token) {
        this(token, DEFAULT_API_BASE);
    }

    public TelegramApi(String token, String apiBase) {
        this.token = token;
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(30))
                .build();
    }

    /**
     * Call a Bot API method.
     *
     * @return the {@code result} node of the reply
     * @throws TelegramApiException if the call fails or Telegram answers {@code ok: false}
     */
    public JsonNode call(String method, Map<String, Object> params) throws TelegramApiException {
        String body;
        try {
            body = MAPPER.writeValueAsString(params != null ? params : Map.of());
        } catch (JsonProcessingException e) {
            throw new TelegramApiException("Unserializable parameters for " + method, e);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/bot" + token + "/" + method))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(), method);
        JsonNode root;
        try {
            root = MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new TelegramApiException("Telegram: " + method + " returned HTTP " + response.statusCode(), e);
        }
        if (!root.path("ok").asBoolean(false)) {
            throw new TelegramApiException("Telegram: " + root.path("description").asText("unknown error"));
        }
        return root.path("result");
    }

    /**
     * Fetch pending updates without waiting.
     */
    public List<JsonNode> getUpdates(Long offset, int limit) throws TelegramApiException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("timeout", 0);
        params.put("limit", limit);
        if (offset != null) {
            params.put("offset", offset);
        }
        List<JsonNode> updates = new ArrayList<>();
        call("getUpdates", params).forEach(updates::add);
        return updates;
    }

    /**
     * @param replyMarkup inline keyboard or null
     * @return id of the sent message
     */
    public long sendMessage(String chatId, String text, Map<String, Object> replyMarkup) throws TelegramApiException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("chat_id", chatId);
        params.put("text", text);
        if (replyMarkup != null) {
            params.put("reply_markup", replyMarkup);
        }
        return call("sendMessage", params).path("message_id").asLong();
    }

    public void editMessageText(String chatId, long messageId, String text) throws TelegramApiException {
        call("editMessageText", Map.of("chat_id", chatId, "message_id", messageId, "text", text));
    }

    public void sendChatAction(String chatId, String action) throws TelegramApiException {
        call("sendChatAction", Map.of("chat_id", chatId, "action", action));
    }

    public void answerCallbackQuery(String callbackQueryId) throws TelegramApiException {
        call("answerCallbackQuery", Map.of("callback_query_id", callbackQueryId));
    }

    /**
     * Resolve a file id and save the file to {@code dest}, creating parent
     * directories as needed.
     */
    public void downloadFile(String fileId, Path dest) throws IOException {
        String filePath = call("getFile", Map.of("file_id", fileId)).path("file_path").asText(null);
        if (filePath == null) {
            throw new TelegramApiException("getFile returned no file_path for " + fileId);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/file/bot" + token + "/" + filePath))
                .timeout(Duration.ofSeconds(60))
                .GET()
                .build();
        HttpResponse<byte[]> response = send(request, HttpResponse.BodyHandlers.ofByteArray(), "download");
        if (response.statusCode() != 200) {
            throw new TelegramApiException("Failed to download file: " + response.statusCode());
        }
        Files.createDirectories(dest.toAbsolutePath().getParent());
        Files.write(dest, response.body());
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler, String method)
            throws TelegramApiException {
        try {
            HttpResponse<T> response = httpClient.send(request, handler);
            if (response.statusCode() != 200) {
                log.debug("Telegram API {} -> HTTP {}", method, response.statusCode());
            }
            return response;
        } catch (IOException e) {
            throw new TelegramApiException("Telegram API call failed: " + method + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TelegramApiException("Interrupted during " + method, e);
        }
    }
}
