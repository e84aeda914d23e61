package fr.lapetina.thesis.client.domain.exception;

import fr.lapetina.thesis.client.domain.model.ErrorType;

/**
 * Fatal configuration problem: missing credentials, no usable backend, unreadable config file.
 * Never retried.
 */
public final class ConfigurationException extends AiClientException {

    public ConfigurationException(String message) {
        super(ErrorType.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorType.CONFIGURATION, message, cause);
    }
}
