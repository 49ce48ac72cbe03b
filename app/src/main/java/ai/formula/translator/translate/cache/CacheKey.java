package ai.formula.translator.translate.cache;

import java.util.Objects;

/**
 * Identity of a translation: normalized source text, locale direction and any position-dependent context.
 *
 * @param context empty for formulas whose translation does not depend on where they live
 */
public record CacheKey(String normalizedSource, String sourceLocale, String targetLocale, String context) {

    public CacheKey {
        Objects.requireNonNull(normalizedSource, "normalizedSource");
        Objects.requireNonNull(sourceLocale, "sourceLocale");
        Objects.requireNonNull(targetLocale, "targetLocale");
        context = context == null ? "" : context;
    }
}
