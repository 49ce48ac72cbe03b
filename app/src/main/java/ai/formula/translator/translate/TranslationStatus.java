package ai.formula.translator.translate;

public enum TranslationStatus {
    TRANSLATED,
    TRANSLATED_WITH_FALLBACK,
    UNSUPPORTED
}
