package com.scout.channel.transcription;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Speech-to-text backend.
 */
public interface Transcriber {

    /** Backend name for logs ("groq", "openai"). */
    String name();

    /**
     * @return the transcript, "(inaudible)" when the backend heard nothing
     * @throws IOException if the backend could not be reached or refused the file
     */
    String transcribe(Path audioFile) throws IOException;
}
