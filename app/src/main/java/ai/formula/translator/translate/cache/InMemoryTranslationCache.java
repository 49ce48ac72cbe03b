package ai.formula.translator.translate.cache;

import ai.formula.translator.translate.TranslationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConcurrentHashMap}-backed cache with a JSON export format.
 */
public class InMemoryTranslationCache implements TranslationCache {

    static final int FORMAT_VERSION = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTranslationCache.class);

    private final ConcurrentMap<CacheKey, TranslationResult> entries = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemoryTranslationCache() {
        this(new ObjectMapper());
    }

    public InMemoryTranslationCache(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public Optional<TranslationResult> get(CacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public TranslationResult putIfAbsent(CacheKey key, TranslationResult result) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(result, "result");
        TranslationResult existing = entries.putIfAbsent(key, result);
        return existing == null ? result : existing;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public byte[] exportCache() {
        List<CacheEntry> snapshot = new ArrayList<>();
        for (Map.Entry<CacheKey, TranslationResult> entry : entries.entrySet()) {
            snapshot.add(new CacheEntry(entry.getKey(), entry.getValue()));
        }
        snapshot.sort(Comparator.comparing((CacheEntry entry) -> entry.key().normalizedSource())
                .thenComparing(entry -> entry.key().sourceLocale())
                .thenComparing(entry -> entry.key().targetLocale())
                .thenComparing(entry -> entry.key().context()));
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(new CacheDocument(FORMAT_VERSION, snapshot));
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to serialize translation cache", ex);
        }
    }

    @Override
    public void importCache(byte[] data) {
        Objects.requireNonNull(data, "data");
        CacheDocument document;
        try {
            document = objectMapper.readValue(data, CacheDocument.class);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Malformed translation cache data", ex);
        }
        if (document == null || document.version() != FORMAT_VERSION) {
            throw new IllegalArgumentException("Unsupported translation cache format version: "
                    + (document == null ? "none" : document.version()));
        }
        int imported = 0;
        for (CacheEntry entry : document.entries() == null ? List.<CacheEntry>of() : document.entries()) {
            if (entry.key() == null || entry.result() == null) {
                throw new IllegalArgumentException("Translation cache entry is missing its key or result");
            }
            if (entries.putIfAbsent(entry.key(), entry.result()) == null) {
                imported++;
            }
        }
        LOGGER.debug("Imported {} cache entries", imported);
    }

    record CacheDocument(int version, List<CacheEntry> entries) {
    }

    record CacheEntry(CacheKey key, TranslationResult result) {
    }
}
