package org.learningjava.hpes.domain.model.language;

/** The language profile table is inconsistent; raised while the application starts. */
public class ProfileConfigurationException extends RuntimeException {

    public ProfileConfigurationException(String message) {
        super(message);
    }

    public ProfileConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
