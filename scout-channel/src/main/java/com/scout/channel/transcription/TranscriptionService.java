package com.scout.channel.transcription;

import com.scout.common.config.ScoutConfig.TranscriptionSettings;
import com.scout.common.infra.DotEnv;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Picks transcription backends from configuration and never fails: a
 * placeholder text is returned when no backend produced a transcript.
 */
@Slf4j
public class TranscriptionService {

    static final String AUTO = "auto";
    static final String FAILED = "(transcription failed)";
    static final String NO_BACKEND = "(transcription failed — no backend available)";

    private final String backend;
    private final List<Transcriber> transcribers;

    public TranscriptionService(String backend, List<Transcriber> transcribers) {
        this.backend = backend != null ? backend.toLowerCase(Locale.ROOT) : AUTO;
        this.transcribers = List.copyOf(transcribers);
    }

    /**
     * Backends in priority order (groq, then openai), keeping only those with
     * an API key and matching the configured backend. Keys from config win
     * over {@code GROQ_API_KEY} / {@code OPENAI_API_KEY}.
     */
    public static TranscriptionService fromSettings(TranscriptionSettings settings, DotEnv env) {
        TranscriptionSettings s = settings != null ? settings : new TranscriptionSettings();
        String backend = s.getBackend() != null ? s.getBackend().toLowerCase(Locale.ROOT) : AUTO;

        List<Transcriber> transcribers = new ArrayList<>();
        String groqKey = firstNonBlank(s.getGroqApiKey(), env.get("GROQ_API_KEY"));
        if (groqKey != null && (backend.equals("groq") || backend.equals(AUTO))) {
            transcribers.add(WhisperApiTranscriber.groq(groqKey));
        }
        String openaiKey = firstNonBlank(s.getOpenaiApiKey(), env.get("OPENAI_API_KEY"));
        if (openaiKey != null && (backend.equals("openai") || backend.equals(AUTO))) {
            transcribers.add(WhisperApiTranscriber.openai(openaiKey));
        }
        return new TranscriptionService(backend, transcribers);
    }

    public List<Transcriber> transcribers() {
        return transcribers;
    }

    /**
     * Transcribe one audio file. An explicitly chosen backend is tried once;
     * "auto" tries each backend until one succeeds.
     */
    public String transcribe(Path audioFile) {
        if (!AUTO.equals(backend) && transcribers.size() == 1) {
            Transcriber only = transcribers.get(0);
            try {
                return only.transcribe(audioFile);
            } catch (IOException e) {
                log.warn("Transcription ({}) failed: {}", only.name(), e.getMessage());
                return FAILED;
            }
        }
        for (Transcriber t : transcribers) {
            try {
                String text = t.transcribe(audioFile);
                log.info("Transcribed via {}", t.name());
                return text;
            } catch (IOException e) {
                log.warn("Transcription ({}) failed: {}", t.name(), e.getMessage());
            }
        }
        return NO_BACKEND;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a;
        }
        return b != null && !b.isBlank() ? b : null;
    }
}
