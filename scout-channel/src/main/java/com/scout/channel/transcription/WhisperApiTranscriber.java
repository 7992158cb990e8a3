package com.scout.channel.transcription;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

/**
 * Transcription through an OpenAI-compatible {@code audio/transcriptions}
 * endpoint (multipart upload of the file plus a model name).
 */
@Slf4j
public class WhisperApiTranscriber implements Transcriber {

    public static final String GROQ_URL = "https://api.groq.com/openai/v1/audio/transcriptions";
    public static final String OPENAI_URL = "https://api.openai.com/v1/audio/transcriptions";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HttpClient HTTP_CLIENT = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(30))
            .build();

    private final String name;
    private final String url;
    private final String model;
    private final String apiKey;

    public WhisperApiTranscriber(String name, String url, String model, String apiKey) {
        this.name = name;
        this.url = url;
        this.model = model;
        this.apiKey = apiKey;
    }

    public static WhisperApiTranscriber groq(String apiKey) {
        return new WhisperApiTranscriber("groq", GROQ_URL, "whisper-large-v3", apiKey);
    }

    public static WhisperApiTranscriber openai(String apiKey) {
        return new WhisperApiTranscriber("openai", OPENAI_URL, "whisper-1", apiKey);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String transcribe(Path audioFile) throws IOException {
        String boundary = "----ScoutBoundary" + UUID.randomUUID().toString().replace("-", "");
        byte[] body = multipartBody(boundary, Files.readAllBytes(audioFile));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(60))
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        HttpResponse<String> response;
        try {
            response = HTTP_CLIENT.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while transcribing", e);
        }
        if (response.statusCode() != 200) {
            throw new IOException(name + " API " + response.statusCode() + ": " + response.body());
        }
        JsonNode root = MAPPER.readTree(response.body());
        String text = root.path("text").asText("");
        return text.isEmpty() ? "(inaudible)" : text;
    }

    private byte[] multipartBody(String boundary, byte[] audio) throws IOException {
        var out = new ByteArrayOutputStream();
        out.write(("--" + boundary + "\r\n").getBytes(StandardCharsets.UTF_8));
        out.write("Content-Disposition: form-data; name=\"model\"\r\n\r\n".getBytes(StandardCharsets.UTF_8));
        out.write(model.getBytes(StandardCharsets.UTF_8));
        out.write("\r\n".getBytes(StandardCharsets.UTF_8));

        out.write(("--" + boundary + "\r\n").getBytes(StandardCharsets.UTF_8));
        out.write("Content-Disposition: form-data; name=\"file\"; filename=\"audio.ogg\"\r\n"
                .getBytes(StandardCharsets.UTF_8));
        out.write("Content-Type: application/octet-stream\r\n\r\n".getBytes(StandardCharsets.UTF_8));
        out.write(audio);
        out.write("\r\n".getBytes(StandardCharsets.UTF_8));

        out.write(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }
}
