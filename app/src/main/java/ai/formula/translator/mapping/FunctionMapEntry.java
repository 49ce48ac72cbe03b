package ai.formula.translator.mapping;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Localized names of a single canonical function, keyed by locale tag.
 */
public record FunctionMapEntry(String canonicalName, Map<String, String> localizedNames) {

    public FunctionMapEntry {
        Objects.requireNonNull(canonicalName, "canonicalName");
        if (canonicalName.isBlank()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
        canonicalName = canonicalName.trim().toUpperCase(Locale.ROOT);
        Objects.requireNonNull(localizedNames, "localizedNames");
        Map<String, String> normalized = new TreeMap<>();
        for (Map.Entry<String, String> entry : localizedNames.entrySet()) {
            String value = entry.getValue();
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Function " + canonicalName + " has no name for locale " + entry.getKey());
            }
            normalized.put(entry.getKey().trim(), value.trim().toUpperCase(Locale.ROOT));
        }
        localizedNames = Map.copyOf(normalized);
    }

    public Optional<String> nameFor(String localeTag) {
        return Optional.ofNullable(localizedNames.get(localeTag));
    }
}
