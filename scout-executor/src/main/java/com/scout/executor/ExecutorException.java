package com.scout.executor;

/**
 * The backend refused to start a session.
 */
public class ExecutorException extends Exception {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
