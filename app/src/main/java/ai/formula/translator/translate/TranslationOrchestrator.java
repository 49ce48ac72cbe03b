package ai.formula.translator.translate;

import ai.formula.translator.formula.FormulaTokenizer;
import ai.formula.translator.formula.LexException;
import ai.formula.translator.formula.TokenStream;
import ai.formula.translator.formula.TranslationException;
import ai.formula.translator.locale.FormulaLocale;
import ai.formula.translator.locale.LocalePair;
import ai.formula.translator.locale.NormalizationResult;
import ai.formula.translator.locale.SeparatorNormalizer;
import ai.formula.translator.mapping.FunctionNameMapper;
import ai.formula.translator.mapping.MappingResult;
import ai.formula.translator.rewrite.IncompatibilityRewriter;
import ai.formula.translator.rewrite.IncompatibilityRule;
import ai.formula.translator.rewrite.RewriteContext;
import ai.formula.translator.rewrite.RewriteLimitExceededException;
import ai.formula.translator.rewrite.RewriteResult;
import ai.formula.translator.rules.RuleSet;
import ai.formula.translator.structured.ResolveException;
import ai.formula.translator.structured.StructuredReferenceResolver;
import ai.formula.translator.translate.cache.CacheKey;
import ai.formula.translator.translate.cache.TranslationCache;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs formulas through tokenize, normalize, map, resolve and rewrite, with caching and an optional LLM fallback.
 *
 * <p>Lexing failures and runaway rewrites are final: the job is reported unsupported without asking the LLM.
 * Unresolvable structured references and unmapped function names escalate to the LLM when one is
 * configured. Only translated results are cached.</p>
 */
public class TranslationOrchestrator implements AutoCloseable {

    static final String MDC_CELL = "cell";

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationOrchestrator.class);

    private final RuleSet ruleSet;
    private final TranslationCache cache;
    private final FormulaLlmClient llmClient;
    private final TranslationSettings settings;
    private final SeparatorNormalizer normalizer = new SeparatorNormalizer();
    private final FunctionNameMapper mapper;
    private final StructuredReferenceResolver resolver;
    private final Map<Character, FormulaTokenizer> tokenizers = new ConcurrentHashMap<>();
    private final Map<String, IncompatibilityRewriter> rewriters = new ConcurrentHashMap<>();
    private final Set<Future<String>> inFlightLlmCalls = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean aborted = new AtomicBoolean();
    private final ExecutorService llmExecutor;

    public TranslationOrchestrator(RuleSet ruleSet, TranslationCache cache, TranslationSettings settings) {
        this(ruleSet, cache, null, settings);
    }

    public TranslationOrchestrator(RuleSet ruleSet, TranslationCache cache, FormulaLlmClient llmClient,
                                   TranslationSettings settings) {
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.llmClient = llmClient;
        this.mapper = new FunctionNameMapper(ruleSet.functions());
        this.resolver = new StructuredReferenceResolver(settings.addressingMode());
        this.llmExecutor = llmClient == null ? null : Executors.newCachedThreadPool(daemonThreads("formula-llm"));
    }

    public TranslationResult translate(FormulaJob job) {
        return translateJob(job).result();
    }

    /**
     * Translates one job and reports the route it took. Never throws for a malformed formula.
     */
    public JobOutcome translateJob(FormulaJob job) {
        Objects.requireNonNull(job, "job");
        MDC.put(MDC_CELL, job.cellAddress().toString());
        try {
            return runPipeline(job);
        } finally {
            MDC.remove(MDC_CELL);
        }
    }

    /**
     * Translates every job on a pool of at most {@code maxConcurrency} workers. Outcomes keep input order.
     */
    public BatchResult translateAll(List<FormulaJob> jobs) {
        Objects.requireNonNull(jobs, "jobs");
        if (jobs.isEmpty()) {
            return BatchResult.of(List.of());
        }
        int workers = Math.min(settings.maxConcurrency(), jobs.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, daemonThreads("formula-worker"));
        try {
            List<Future<JobOutcome>> futures = new ArrayList<>(jobs.size());
            for (FormulaJob job : jobs) {
                futures.add(pool.submit(() -> translateJob(job)));
            }
            List<JobOutcome> outcomes = new ArrayList<>(jobs.size());
            for (int index = 0; index < jobs.size(); index++) {
                outcomes.add(await(futures.get(index), jobs.get(index)));
            }
            BatchResult result = BatchResult.of(outcomes);
            BatchSummary summary = result.summary();
            LOGGER.info("Translated {} formulas: {} translated, {} with fallback, {} unsupported, {} cache hits",
                    summary.total(), summary.translated(), summary.translatedWithFallback(),
                    summary.unsupported(), summary.cacheHits());
            if (!summary.unmappedFunctions().isEmpty()) {
                LOGGER.info("Unmapped functions: {}", String.join(", ", summary.unmappedFunctions()));
            }
            return result;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Cancels in-flight LLM calls and suppresses further ones. Affected jobs keep their deterministic result.
     */
    public void abort() {
        if (aborted.compareAndSet(false, true)) {
            LOGGER.warn("Translation aborted; cancelling {} in-flight LLM calls", inFlightLlmCalls.size());
        }
        inFlightLlmCalls.forEach(call -> call.cancel(true));
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * Upper-cased function names used by a formula written with {@code .} as decimal separator.
     *
     * @throws LexException when the formula cannot be tokenized
     */
    public Set<String> functionNames(String formula) {
        return tokenizer('.').tokenize(stripEquals(formula)).functionNames();
    }

    /**
     * True when the formula lexes and every function it calls has a name in {@code target}.
     */
    public boolean isSupported(String formula, FormulaLocale target) {
        try {
            return functionNames(formula).stream()
                    .allMatch(name -> ruleSet.functions().supports(name, target.tag()));
        } catch (LexException ex) {
            return false;
        }
    }

    @Override
    public void close() {
        if (llmExecutor != null) {
            llmExecutor.shutdownNow();
        }
    }

    private JobOutcome runPipeline(FormulaJob job) {
        CacheKey key = cacheKey(job);
        Optional<TranslationResult> cached = cache.get(key);
        if (cached.isPresent()) {
            LOGGER.debug("Cache hit for {}", key.normalizedSource());
            return new JobOutcome(job.cellAddress(), TranslationRoute.CACHE_HIT, cached.get());
        }

        String source = job.normalizedSourceText();
        LocalePair localePair = job.localePair();
        FormulaLocale target = localePair.target();
        List<String> notes = new ArrayList<>();

        TokenStream tokens;
        try {
            tokens = tokenizer(localePair.source().decimalSeparator()).tokenize(source);
        } catch (LexException ex) {
            LOGGER.warn("Cannot tokenize formula: {}", ex.getMessage());
            notes.add("Formula could not be tokenized: " + ex.getMessage());
            return failed(job, source, notes, Set.of());
        }

        NormalizationResult normalized = normalizer.normalize(tokens, localePair);
        notes.addAll(normalized.notes());
        MappingResult mapped = mapper.map(normalized.tokens(), target);
        Set<String> unmapped = mapped.unmappedFunctions();

        TokenStream resolved;
        try {
            resolved = resolver.resolve(mapped.tokens(), job.tables(), job.cellAddress());
        } catch (ResolveException ex) {
            LOGGER.info("Structured reference not resolved: {}", ex.getMessage());
            notes.add("Structured reference could not be resolved: " + ex.getMessage());
            return escalate(job, key, source, notes, unmapped, hints(unmapped, ex.getMessage(), target), false);
        }

        RewriteResult rewritten;
        try {
            RewriteContext context = new RewriteContext(job.sheetContext().sheetMapping(),
                    target.argumentSeparator(), tokenizer(target.decimalSeparator()));
            rewritten = rewriter(target).rewrite(resolved, context);
        } catch (RewriteLimitExceededException ex) {
            LOGGER.warn("{}", ex.getMessage());
            notes.add(ex.getMessage());
            return failed(job, source, notes, unmapped);
        }
        notes.addAll(rewritten.notes());
        String translated = rewritten.tokens().text();

        if (mapped.isComplete()) {
            return complete(job, key, TranslationRoute.DETERMINISTIC,
                    TranslationResult.of(translated, TranslationStatus.TRANSLATED, notes, unmapped));
        }
        notes.add("No " + target.tag() + " name for: " + String.join(", ", unmapped));
        return escalate(job, key, translated, notes, unmapped, hints(unmapped, null, target), true);
    }

    private JobOutcome escalate(FormulaJob job, CacheKey key, String deterministicText, List<String> notes,
                                Set<String> unmapped, List<String> hints, boolean deterministicUsable) {
        if (llmClient == null) {
            if (deterministicUsable) {
                return complete(job, key, TranslationRoute.DETERMINISTIC,
                        TranslationResult.of(deterministicText, TranslationStatus.TRANSLATED, notes, unmapped));
            }
            notes.add("No LLM fallback configured");
            return failed(job, deterministicText, notes, unmapped);
        }
        if (aborted.get()) {
            notes.add("LLM fallback skipped: translation run aborted");
            return failed(job, deterministicText, notes, unmapped);
        }
        LlmTranslationRequest request = new LlmTranslationRequest(job.normalizedSourceText(), job.localePair(), hints);
        Optional<String> candidate = askLlm(request, job.localePair().target(), notes);
        if (candidate.isEmpty()) {
            return failed(job, deterministicText, notes, unmapped);
        }
        notes.add("Translated by LLM fallback");
        return complete(job, key, TranslationRoute.DETERMINISTIC_WITH_FALLBACK,
                TranslationResult.of(candidate.get(), TranslationStatus.TRANSLATED_WITH_FALLBACK, notes, unmapped));
    }

    private Optional<String> askLlm(LlmTranslationRequest request, FormulaLocale target, List<String> notes) {
        Future<String> call;
        try {
            call = llmExecutor.submit(() -> llmClient.translate(request, settings.llmTimeout()));
        } catch (RejectedExecutionException ex) {
            notes.add("LLM fallback unavailable: orchestrator closed");
            return Optional.empty();
        }
        inFlightLlmCalls.add(call);
        try {
            if (aborted.get()) {
                call.cancel(true);
            }
            String raw = call.get(settings.llmTimeout().toMillis(), TimeUnit.MILLISECONDS);
            Optional<String> accepted = acceptLlmOutput(raw, target);
            if (accepted.isEmpty()) {
                LOGGER.warn("Discarding LLM output that is not a valid formula: {}", raw);
                notes.add("LLM output rejected: not a valid formula");
            }
            return accepted;
        } catch (TimeoutException ex) {
            call.cancel(true);
            LOGGER.warn("LLM call timed out after {} ms", settings.llmTimeout().toMillis());
            notes.add("LLM call timed out after " + settings.llmTimeout().toMillis() + " ms");
        } catch (CancellationException ex) {
            LOGGER.info("LLM call cancelled");
            notes.add("LLM call cancelled");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            LOGGER.warn("LLM call failed: {}", cause.getMessage());
            notes.add("LLM call failed: " + cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            notes.add("LLM call interrupted");
        } finally {
            inFlightLlmCalls.remove(call);
        }
        return Optional.empty();
    }

    private Optional<String> acceptLlmOutput(String raw, FormulaLocale target) {
        String cleaned = cleanLlmOutput(raw);
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            tokenizer(target.decimalSeparator()).tokenize(cleaned);
            return Optional.of(cleaned);
        } catch (LexException ex) {
            return Optional.empty();
        }
    }

    /**
     * Drops code fences and commentary lines, keeping the first formula-looking line without its {@code =}.
     */
    static String cleanLlmOutput(String raw) {
        if (raw == null) {
            return "";
        }
        for (String line : raw.strip().split("\\R")) {
            String candidate = line.strip();
            if (candidate.isEmpty() || candidate.startsWith("```")) {
                continue;
            }
            if (candidate.startsWith("`") && candidate.endsWith("`") && candidate.length() > 1) {
                candidate = candidate.substring(1, candidate.length() - 1).strip();
            }
            return stripEquals(candidate);
        }
        return "";
    }

    private JobOutcome complete(FormulaJob job, CacheKey key, TranslationRoute route, TranslationResult result) {
        TranslationResult stored = cache.putIfAbsent(key, result);
        LOGGER.debug("{} -> {} ({})", key.normalizedSource(), stored.targetFormulaText(), route);
        return new JobOutcome(job.cellAddress(), route, stored);
    }

    private JobOutcome failed(FormulaJob job, String text, List<String> notes, Set<String> unmapped) {
        LOGGER.info("Formula left unsupported: {}", text);
        return new JobOutcome(job.cellAddress(), TranslationRoute.FAILED,
                TranslationResult.of(text, TranslationStatus.UNSUPPORTED, notes, unmapped));
    }

    private JobOutcome await(Future<JobOutcome> future, FormulaJob job) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abort();
            throw new TranslationException("Batch translation interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            LOGGER.error("Unexpected failure translating {}", job.cellAddress(), cause);
            return new JobOutcome(job.cellAddress(), TranslationRoute.FAILED,
                    TranslationResult.of(job.normalizedSourceText(), TranslationStatus.UNSUPPORTED,
                            List.of("Unexpected failure: " + cause), Set.of()));
        }
    }

    private List<String> hints(Set<String> unmapped, String resolveError, FormulaLocale target) {
        List<String> hints = new ArrayList<>();
        if (!unmapped.isEmpty()) {
            hints.add("Functions without a known " + target.tag() + " name: " + String.join(", ", unmapped));
        }
        if (resolveError != null) {
            hints.add("Structured reference could not be resolved: " + resolveError);
        }
        for (IncompatibilityRule rule : rewriter(target).rules()) {
            if (!rule.description().isEmpty()) {
                hints.add("Known incompatibility: " + rule.description());
            }
        }
        hints.add("Separate arguments with '" + target.argumentSeparator() + "' and use '"
                + target.decimalSeparator() + "' as decimal separator; inside array constants separate columns with '"
                + target.arrayColumnSeparator() + "' and rows with '" + target.arrayRowSeparator() + "'");
        return hints;
    }

    private CacheKey cacheKey(FormulaJob job) {
        String source = job.normalizedSourceText();
        boolean positional = source.indexOf('[') >= 0;
        Map<String, String> sheetMapping = job.sheetContext().sheetMapping();
        StringBuilder context = new StringBuilder();
        if (positional) {
            context.append(job.cellAddress())
                    .append('|').append(settings.addressingMode().value())
                    .append('|').append(job.tables());
        }
        if (!sheetMapping.isEmpty()) {
            context.append('|').append(new TreeMap<>(sheetMapping));
        }
        return new CacheKey(source, job.localePair().source().tag(), job.localePair().target().tag(), context.toString());
    }

    private FormulaTokenizer tokenizer(char decimalSeparator) {
        return tokenizers.computeIfAbsent(decimalSeparator, FormulaTokenizer::new);
    }

    private IncompatibilityRewriter rewriter(FormulaLocale target) {
        return rewriters.computeIfAbsent(target.tag(),
                tag -> new IncompatibilityRewriter(ruleSet.rulesFor(target), settings.maxRewriteIterations()));
    }

    private static String stripEquals(String formula) {
        String trimmed = Objects.requireNonNull(formula, "formula").strip();
        return trimmed.startsWith("=") ? trimmed.substring(1).strip() : trimmed;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
