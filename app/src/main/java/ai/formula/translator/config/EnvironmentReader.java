package ai.formula.translator.config;

import java.util.Optional;

/**
 * Source of configuration variables, injectable so tests can supply a fixed environment.
 */
@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);
}
