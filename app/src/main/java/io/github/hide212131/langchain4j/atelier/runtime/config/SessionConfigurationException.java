package io.github.hide212131.langchain4j.atelier.runtime.config;

/** A session file could not be read or does not describe a valid session. */
public class SessionConfigurationException extends RuntimeException {

    public SessionConfigurationException(String message) {
        super(message);
    }

    public SessionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
