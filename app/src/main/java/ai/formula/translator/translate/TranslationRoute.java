package ai.formula.translator.translate;

/**
 * Path a job took through the orchestrator.
 */
public enum TranslationRoute {
    CACHE_HIT,
    DETERMINISTIC,
    DETERMINISTIC_WITH_FALLBACK,
    FAILED
}
