package ai.formula.translator.config;

import java.util.Optional;

/**
 * Reads variables from the process environment, treating blank values as absent.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key)).filter(value -> !value.isBlank());
    }
}
