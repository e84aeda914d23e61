package fr.lapetina.thesis.client.pool;

import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.infrastructure.config.ClientEnvironment;

import java.util.Optional;

/**
 * One step of backend detection. Returns empty when the rule does not apply.
 */
@FunctionalInterface
public interface DetectionRule {

    Optional<BackendKind> match(ClientConfig config, ClientEnvironment environment);
}
