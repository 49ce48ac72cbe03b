package ai.formula.translator.translate.cache;

import ai.formula.translator.translate.TranslationResult;
import java.util.Optional;

/**
 * Concurrent store of completed translations.
 */
public interface TranslationCache {

    Optional<TranslationResult> get(CacheKey key);

    /**
     * Stores {@code result} unless a value is already present; returns whichever value the cache now holds.
     */
    TranslationResult putIfAbsent(CacheKey key, TranslationResult result);

    int size();

    void clear();

    byte[] exportCache();

    /**
     * Adds the entries of a previous {@link #exportCache()} without replacing existing entries.
     *
     * @throws IllegalArgumentException when the data cannot be read
     */
    void importCache(byte[] data);
}
