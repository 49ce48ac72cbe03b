package ai.formula.translator.mapping;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Bidirectional lookup between localized function names.
 *
 * <p>Any localized name of a function (including its canonical name) maps to the name of the same
 * function in every other locale of the table. Lookups are case-insensitive.</p>
 */
public final class FunctionMapTable {

    private final List<FunctionMapEntry> entries;
    private final Map<String, FunctionMapEntry> byAnyName;
    private final Set<String> locales;

    private FunctionMapTable(List<FunctionMapEntry> entries) {
        this.entries = List.copyOf(entries);
        Map<String, FunctionMapEntry> index = new HashMap<>();
        Set<String> tags = new TreeSet<>();
        for (FunctionMapEntry entry : this.entries) {
            register(index, entry.canonicalName(), entry);
            for (Map.Entry<String, String> localized : entry.localizedNames().entrySet()) {
                tags.add(localized.getKey());
                register(index, localized.getValue(), entry);
            }
        }
        this.byAnyName = Map.copyOf(index);
        this.locales = Set.copyOf(tags);
    }

    public static FunctionMapTable of(Collection<FunctionMapEntry> entries) {
        return new FunctionMapTable(List.copyOf(entries));
    }

    private static void register(Map<String, FunctionMapEntry> index, String name, FunctionMapEntry entry) {
        FunctionMapEntry existing = index.putIfAbsent(name, entry);
        if (existing != null && existing != entry) {
            throw new IllegalArgumentException("Function name " + name + " is used by both "
                    + existing.canonicalName() + " and " + entry.canonicalName());
        }
    }

    public List<FunctionMapEntry> entries() {
        return entries;
    }

    public Set<String> locales() {
        return locales;
    }

    public Optional<FunctionMapEntry> entryFor(String anyName) {
        if (anyName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byAnyName.get(anyName.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * Target-locale name for a function known under any of its localized names.
     */
    public Optional<String> lookup(String anyName, String targetLocaleTag) {
        return entryFor(anyName).flatMap(entry -> entry.nameFor(targetLocaleTag));
    }

    public boolean supports(String anyName, String localeTag) {
        return lookup(anyName, localeTag).isPresent();
    }

    public int size() {
        return entries.size();
    }
}
