package ai.formula.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.formula.translator.formula.CellAddress;
import ai.formula.translator.locale.FormulaLocale;
import ai.formula.translator.locale.LocalePair;
import ai.formula.translator.rules.RuleSet;
import ai.formula.translator.rules.RuleSetLoader;
import ai.formula.translator.structured.AddressingMode;
import ai.formula.translator.structured.TableGeometry;
import ai.formula.translator.translate.cache.InMemoryTranslationCache;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TranslationOrchestratorTest {

    private static final LocalePair EN_TO_DE = LocalePair.of(FormulaLocale.EN_US, FormulaLocale.DE_DE);
    private static final SheetContext SHEET1 = SheetContext.of("Sheet1");
    private static final TableGeometry SALES = new TableGeometry("Sales", "Sheet1", 2, 1, 2, 10,
            List.of("Amount", "Date", "Total"));

    private static RuleSet ruleSet;

    @BeforeAll
    static void loadRules() {
        ruleSet = new RuleSetLoader().loadDefault();
    }

    @Test
    void translatesFunctionNamesAndSeparators() {
        try (TranslationOrchestrator orchestrator = orchestrator(null, settings())) {
            JobOutcome outcome = orchestrator.translateJob(job("A1", "SUM(A1,A2)"));

            assertThat(outcome.route()).isEqualTo(TranslationRoute.DETERMINISTIC);
            assertThat(outcome.result().targetFormulaText()).isEqualTo("SUMME(A1;A2)");
            assertThat(outcome.result().status()).isEqualTo(TranslationStatus.TRANSLATED);
            assertThat(outcome.result().unmappedFunctions()).isEmpty();
        }
    }

    @Test
    void keepsStringLiteralsAndRewritesDecimals() {
        try (TranslationOrchestrator orchestrator = orchestrator(null, settings())) {
            assertThat(orchestrator.translate(job("B2", "=IF(A1>10,\"Yes\",\"No\")")).targetFormulaText())
                    .isEqualTo("WENN(A1>10;\"Yes\";\"No\")");
            assertThat(orchestrator.translate(job("B3", "ROUND(A1*1.5,2)")).targetFormulaText())
                    .isEqualTo("RUNDEN(A1*1,5;2)");
        }
    }

    @Test
    void keepsArrayItemsApartWhenDecimalCommaIsIntroduced() {
        try (TranslationOrchestrator orchestrator = orchestrator(null, settings())) {
            TranslationResult result = orchestrator.translate(job("B4", "SUM({1.5,2})"));

            assertThat(result.targetFormulaText()).isEqualTo("SUMME({1,5.2})");
            assertThat(result.status()).isEqualTo(TranslationStatus.TRANSLATED);
        }
    }

    @Test
    @DisplayName("ADDRESS with a sheet argument inside INDIRECT is rewritten")
    void rewritesAddressSheetArgument() {
        try (TranslationOrchestrator orchestrator = orchestrator(null, settings())) {
            FormulaJob sameDialect = FormulaJob.of("C1", "INDIRECT(ADDRESS(10,5,1,1,\"Sheet1\"))",
                    LocalePair.of(FormulaLocale.EN_US, FormulaLocale.EN_US), SHEET1);

            TranslationResult identity = orchestrator.translate(sameDialect);
            TranslationResult german = orchestrator.translate(job("C1", "INDIRECT(ADDRESS(10,5,1,1,\"Sheet1\"))"));

            assertThat(identity.targetFormulaText()).isEqualTo("INDIRECT(\"Sheet1.\" & ADDRESS(10,5,1,1))");
            assertThat(identity.notes()).anySatisfy(note -> assertThat(note).contains("address-sheet-argument"));
            assertThat(german.targetFormulaText()).isEqualTo("INDIREKT(\"Sheet1.\" & ADRESSE(10;5;1;1))");
        }
    }

    @Test
    void resolvesStructuredReferencesAgainstTheJobCell() {
        TranslationSettings relative = settings().withAddressingMode(AddressingMode.RELATIVE);
        try (TranslationOrchestrator orchestrator = orchestrator(null, relative)) {
            FormulaJob d5 = job("D5", "[@Amount]*2").withTables(List.of(SALES));
            FormulaJob d6 = job("D6", "[@Amount]*2").withTables(List.of(SALES));

            assertThat(orchestrator.translate(d5).targetFormulaText()).isEqualTo("B5*2");
            assertThat(orchestrator.translateJob(d6).route()).isEqualTo(TranslationRoute.DETERMINISTIC);
            assertThat(orchestrator.translate(d6).targetFormulaText()).isEqualTo("B6*2");
        }
    }

    @Test
    void tablesWithCollidingHashCodesDoNotShareCacheEntries() {
        TableGeometry onAa = new TableGeometry("Sales", "Aa", 2, 1, 2, 10, List.of("Amount"));
        TableGeometry onBb = new TableGeometry("Sales", "BB", 2, 1, 2, 10, List.of("Amount"));
        assertThat(List.of(onAa).toString().hashCode()).isEqualTo(List.of(onBb).toString().hashCode());

        try (TranslationOrchestrator orchestrator = orchestrator(null, settings())) {
            TranslationResult first = orchestrator.translate(
                    job("Sheet1!F2", "SUM(Sales[Amount])").withTables(List.of(onAa)));
            JobOutcome second = orchestrator.translateJob(
                    job("Sheet1!F2", "SUM(Sales[Amount])").withTables(List.of(onBb)));

            assertThat(first.targetFormulaText()).isEqualTo("SUMME(Aa.$B2:$B10)");
            assertThat(second.route()).isEqualTo(TranslationRoute.DETERMINISTIC);
            assertThat(second.result().targetFormulaText()).isEqualTo("SUMME(BB.$B2:$B10)");
        }
    }

    @Test
    void unresolvableReferenceWithoutLlmIsUnsupported() {
        try (TranslationOrchestrator orchestrator = orchestrator(null, settings())) {
            JobOutcome outcome = orchestrator.translateJob(job("D5", "SUM(Orders[Amount])"));

            assertThat(outcome.route()).isEqualTo(TranslationRoute.FAILED);
            assertThat(outcome.result().status()).isEqualTo(TranslationStatus.UNSUPPORTED);
            assertThat(outcome.result().notes())
                    .anySatisfy(note -> assertThat(note).contains("Orders"))
                    .contains("No LLM fallback configured");
        }
    }

    @Test
    void malformedFormulaIsUnsupportedAndNotCached() {
        AtomicInteger llmCalls = new AtomicInteger();
        FormulaLlmClient llm = (request, timeout) -> {
            llmCalls.incrementAndGet();
            return "WENN(A1>10;\"Yes\")";
        };
        InMemoryTranslationCache cache = new InMemoryTranslationCache();
        try (TranslationOrchestrator orchestrator = new TranslationOrchestrator(ruleSet, cache, llm, settings())) {
            TranslationResult result = orchestrator.translate(job("A1", "IF(A1>10,\"Yes"));

            assertThat(result.status()).isEqualTo(TranslationStatus.UNSUPPORTED);
            assertThat(result.targetFormulaText()).isEqualTo("IF(A1>10,\"Yes");
            assertThat(result.notes()).anySatisfy(note -> assertThat(note).contains("UNTERMINATED_LITERAL"));
            assertThat(llmCalls).hasValue(0);
            assertThat(cache.size()).isZero();
        }
    }

    @Test
    void repeatedFormulaIsServedFromCache() {
        try (TranslationOrchestrator orchestrator = orchestrator(null, settings())) {
            JobOutcome first = orchestrator.translateJob(job("A1", "SUM(A1,A2)"));
            JobOutcome second = orchestrator.translateJob(job("B7", " = SUM(A1,A2)"));

            assertThat(second.route()).isEqualTo(TranslationRoute.CACHE_HIT);
            assertThat(second.result()).isEqualTo(first.result());
            assertThat(second.result().targetFormulaText()).isEqualTo(first.result().targetFormulaText());
        }
    }

    @Test
    void unmappedFunctionWithoutLlmKeepsItsName() {
        try (TranslationOrchestrator orchestrator = orchestrator(null, settings())) {
            TranslationResult result = orchestrator.translate(job("A1", "IF(FOO(A1),1,0)"));

            assertThat(result.status()).isEqualTo(TranslationStatus.TRANSLATED);
            assertThat(result.targetFormulaText()).isEqualTo("WENN(FOO(A1);1;0)");
            assertThat(result.unmappedFunctions()).containsExactly("FOO");
            assertThat(result.notes()).contains("No de-DE name for: FOO");
        }
    }

    @Test
    void unmappedFunctionEscalatesToLlmOnce() {
        AtomicInteger llmCalls = new AtomicInteger();
        AtomicReference<LlmTranslationRequest> seen = new AtomicReference<>();
        FormulaLlmClient llm = (request, timeout) -> {
            llmCalls.incrementAndGet();
            seen.set(request);
            return "```\n=WENN(FOO2(A1);1;0)\n```";
        };
        try (TranslationOrchestrator orchestrator = orchestrator(llm, settings())) {
            JobOutcome first = orchestrator.translateJob(job("A1", "IF(FOO(A1),1,0)"));
            JobOutcome second = orchestrator.translateJob(job("A2", "IF(FOO(A1),1,0)"));

            assertThat(first.route()).isEqualTo(TranslationRoute.DETERMINISTIC_WITH_FALLBACK);
            assertThat(first.result().status()).isEqualTo(TranslationStatus.TRANSLATED_WITH_FALLBACK);
            assertThat(first.result().targetFormulaText()).isEqualTo("WENN(FOO2(A1);1;0)");
            assertThat(second.route()).isEqualTo(TranslationRoute.CACHE_HIT);
            assertThat(llmCalls).hasValue(1);
            assertThat(seen.get().sourceFormulaText()).isEqualTo("IF(FOO(A1),1,0)");
            assertThat(seen.get().hints()).anySatisfy(hint -> assertThat(hint).contains("FOO"));
        }
    }

    @Test
    void llmTimeoutFallsBackToDeterministicText() {
        FormulaLlmClient slow = (request, timeout) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new LlmCallException(LlmCallException.Reason.CANCELLED, "interrupted", ex);
            }
            return "never";
        };
        InMemoryTranslationCache cache = new InMemoryTranslationCache();
        TranslationSettings quick = settings().withLlmTimeout(Duration.ofMillis(100));
        try (TranslationOrchestrator orchestrator = new TranslationOrchestrator(ruleSet, cache, slow, quick)) {
            TranslationResult result = orchestrator.translate(job("A1", "IF(FOO(A1),1,0)"));

            assertThat(result.status()).isEqualTo(TranslationStatus.UNSUPPORTED);
            assertThat(result.targetFormulaText()).isEqualTo("WENN(FOO(A1);1;0)");
            assertThat(result.notes()).anySatisfy(note -> assertThat(note).contains("timed out"));
            assertThat(cache.size()).isZero();
        }
    }

    @Test
    void failingLlmCallIsRecovered() {
        FormulaLlmClient broken = (request, timeout) -> {
            throw new LlmCallException(LlmCallException.Reason.MODEL_UNAVAILABLE, "model missing");
        };
        try (TranslationOrchestrator orchestrator = orchestrator(broken, settings())) {
            TranslationResult result = orchestrator.translate(job("A1", "IF(FOO(A1),1,0)"));

            assertThat(result.status()).isEqualTo(TranslationStatus.UNSUPPORTED);
            assertThat(result.notes()).contains("LLM call failed: model missing");
        }
    }

    @Test
    void invalidLlmOutputIsRejected() {
        FormulaLlmClient sloppy = (request, timeout) -> "WENN(FOO(A1);\"unterminated";
        try (TranslationOrchestrator orchestrator = orchestrator(sloppy, settings())) {
            TranslationResult result = orchestrator.translate(job("A1", "IF(FOO(A1),1,0)"));

            assertThat(result.status()).isEqualTo(TranslationStatus.UNSUPPORTED);
            assertThat(result.targetFormulaText()).isEqualTo("WENN(FOO(A1);1;0)");
            assertThat(result.notes()).contains("LLM output rejected: not a valid formula");
        }
    }

    @Test
    void abortCancelsInFlightLlmCall() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        FormulaLlmClient blocking = (request, timeout) -> {
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new LlmCallException(LlmCallException.Reason.CANCELLED, "cancelled", ex);
            }
            return "never";
        };
        try (TranslationOrchestrator orchestrator = orchestrator(blocking, settings())) {
            CompletableFuture<TranslationResult> pending =
                    CompletableFuture.supplyAsync(() -> orchestrator.translate(job("A1", "IF(FOO(A1),1,0)")));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            orchestrator.abort();
            TranslationResult result = pending.get(5, TimeUnit.SECONDS);

            assertThat(orchestrator.isAborted()).isTrue();
            assertThat(result.status()).isEqualTo(TranslationStatus.UNSUPPORTED);
            assertThat(result.targetFormulaText()).isEqualTo("WENN(FOO(A1);1;0)");
            assertThat(result.notes()).contains("LLM call cancelled");

            TranslationResult afterAbort = orchestrator.translate(job("A2", "IF(BAR(A1),1,0)"));
            assertThat(afterAbort.notes()).contains("LLM fallback skipped: translation run aborted");
        }
    }

    @Test
    void batchKeepsInputOrderAndCountsOutcomes() {
        List<FormulaJob> jobs = new ArrayList<>();
        for (int row = 1; row <= 40; row++) {
            jobs.add(job("E" + row, "SUM(A" + row + ",1.5)"));
        }
        jobs.add(job("F1", "SUM(A1,1.5)"));
        jobs.add(job("F2", "IF(A1,\"x"));
        jobs.add(job("F3", "FOO(A1)"));

        BatchResult batch;
        try (TranslationOrchestrator orchestrator = orchestrator(null, settings().withMaxConcurrency(4))) {
            batch = orchestrator.translateAll(jobs);
        }

        assertThat(batch.outcomes()).extracting(outcome -> outcome.cellAddress().toString())
                .containsExactlyElementsOf(jobs.stream().map(job -> job.cellAddress().toString()).toList());
        assertThat(batch.outcomes().get(6).result().targetFormulaText()).isEqualTo("SUMME(A7;1,5)");
        assertThat(batch.summary().total()).isEqualTo(43);
        assertThat(batch.summary().translated()).isEqualTo(42);
        assertThat(batch.summary().unsupported()).isEqualTo(1);
        assertThat(batch.summary().unmappedFunctions()).containsExactly("FOO");
        assertThat(batch.resultsByCell()).containsKey("Sheet1!F2");
    }

    @Test
    void emptyBatchIsEmpty() {
        try (TranslationOrchestrator orchestrator = orchestrator(null, settings())) {
            assertThat(orchestrator.translateAll(List.of()).summary().total()).isZero();
        }
    }

    @Test
    void reportsSupportedFormulas() {
        try (TranslationOrchestrator orchestrator = orchestrator(null, settings())) {
            assertThat(orchestrator.functionNames("=SUM(A1, if(B1,1,0))")).containsExactlyInAnyOrder("SUM", "IF");
            assertThat(orchestrator.isSupported("SUM(A1)", FormulaLocale.DE_DE)).isTrue();
            assertThat(orchestrator.isSupported("FOO(A1)", FormulaLocale.DE_DE)).isFalse();
            assertThat(orchestrator.isSupported("SUM(\"x", FormulaLocale.DE_DE)).isFalse();
        }
    }

    @Test
    void cleansLlmOutput() {
        assertThat(TranslationOrchestrator.cleanLlmOutput("```excel\n=SUMME(A1;A2)\n```")).isEqualTo("SUMME(A1;A2)");
        assertThat(TranslationOrchestrator.cleanLlmOutput("`=WENN(A1;1;0)`")).isEqualTo("WENN(A1;1;0)");
        assertThat(TranslationOrchestrator.cleanLlmOutput("  \n")).isEmpty();
        assertThat(TranslationOrchestrator.cleanLlmOutput(null)).isEmpty();
    }

    private static TranslationSettings settings() {
        return new TranslationSettings(2, Duration.ofSeconds(10), 32, AddressingMode.ABSOLUTE_COLUMN);
    }

    private static TranslationOrchestrator orchestrator(FormulaLlmClient llm, TranslationSettings settings) {
        return new TranslationOrchestrator(ruleSet, new InMemoryTranslationCache(), llm, settings);
    }

    private static FormulaJob job(String cell, String formula) {
        return new FormulaJob(CellAddress.parse(cell), formula, EN_TO_DE, List.of(), SHEET1);
    }
}
