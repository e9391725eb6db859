package com.dcruver.filetaxonomy.analysis;

import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.inspect.ContentSignal;
import com.dcruver.filetaxonomy.inspect.InspectionException;
import com.dcruver.filetaxonomy.inspect.Inspector;
import com.dcruver.filetaxonomy.nlp.LlmException;
import com.dcruver.filetaxonomy.nlp.MalformedLlmResponseException;
import com.dcruver.filetaxonomy.nlp.ScriptedLlmProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DeepAnalyzerTest {

    private static final String ANSWER = """
        Here is the categorization:
        {"categoryPath": ["Magic", "Card Tricks"], "confidence": 0.92,
         "rationale": "Describes a card routine", "contentSummary": "A card trick tutorial",
         "suggestedTags": ["cards", "magic"]}
        """;

    private final Inspector textInspector = file -> ContentSignal.builder()
        .textCue("Shuffle the deck and force the queen of hearts.")
        .kind("document")
        .build();

    private DeepAnalyzer analyzer(Inspector inspector, ScriptedLlmProvider llm, int maxConcurrent) {
        DeepAnalysisProperties properties = new DeepAnalysisProperties();
        properties.setMaxConcurrent(maxConcurrent);
        return new DeepAnalyzer(inspector, llm, new ObjectMapper(), properties);
    }

    @Test
    void testParsesCategoryFromResponse() throws Exception {
        ScriptedLlmProvider llm = new ScriptedLlmProvider(prompt -> ANSWER);
        ScannedFile file = ScannedFile.named("card_trick.pdf");

        DeepAnalysisResult result = analyzer(textInspector, llm, 2).analyze(file, List.of("Magic", "Cooking"));

        assertEquals(file.getId(), result.getFileId());
        assertEquals(List.of("Magic", "Card Tricks"), result.getCategoryPath());
        assertEquals(0.92, result.getConfidence());
        assertEquals(List.of("cards", "magic"), result.getSuggestedTags());
        assertEquals("scripted", result.getProvider());
        assertNotNull(result.getProcessingTime());

        String prompt = llm.getPrompts().get(0);
        assertTrue(prompt.contains("FILE: card_trick.pdf"));
        assertTrue(prompt.contains("queen of hearts"));
        assertTrue(prompt.contains("- Cooking"));
    }

    @Test
    void testConfidenceIsClamped() throws Exception {
        ScriptedLlmProvider llm = new ScriptedLlmProvider(prompt -> "{\"categoryPath\": [\"Magic\"], \"confidence\": 1.7}");
        DeepAnalysisResult result = analyzer(textInspector, llm, 1).analyze(ScannedFile.named("a.txt"), List.of());
        assertEquals(1.0, result.getConfidence());
    }

    @Test
    void testIncompleteAnswerFails() {
        ScriptedLlmProvider llm = new ScriptedLlmProvider(prompt -> "{\"categoryPath\": [], \"confidence\": 0.5}");
        DeepAnalyzer analyzer = analyzer(textInspector, llm, 1);

        assertThrows(DeepAnalysisException.class, () -> analyzer.analyze(ScannedFile.named("a.txt"), List.of()));
        assertEquals(1, analyzer.availablePermits());
    }

    @Test
    void testProviderFailureIsWrapped() {
        ScriptedLlmProvider llm = new ScriptedLlmProvider(prompt -> {
            throw new LlmException("connection refused");
        });

        DeepAnalysisException e = assertThrows(DeepAnalysisException.class,
            () -> analyzer(textInspector, llm, 1).analyze(ScannedFile.named("a.txt"), List.of()));
        assertTrue(e.getMessage().contains("connection refused"));
    }

    @Test
    void testMalformedResponsePropagates() {
        ScriptedLlmProvider llm = new ScriptedLlmProvider(prompt -> {
            throw new MalformedLlmResponseException("bad bytes");
        });
        DeepAnalyzer analyzer = analyzer(textInspector, llm, 1);

        assertThrows(MalformedLlmResponseException.class, () -> analyzer.analyze(ScannedFile.named("a.txt"), List.of()));
        assertEquals(1, analyzer.availablePermits());
    }

    @Test
    void testInspectionFailureFallsBackToName() throws Exception {
        ScriptedLlmProvider llm = new ScriptedLlmProvider(prompt -> ANSWER);
        Inspector broken = file -> {
            throw new InspectionException("unreadable");
        };

        DeepAnalysisResult result = analyzer(broken, llm, 1).analyze(ScannedFile.named("card_trick.pdf"), List.of());

        assertEquals(List.of("Magic", "Card Tricks"), result.getCategoryPath());
        assertFalse(llm.getPrompts().get(0).contains("EXTRACTED TEXT"));
    }

    @Test
    void testConcurrentCallsAreLimited() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        ScriptedLlmProvider llm = new ScriptedLlmProvider(prompt -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LlmException("interrupted");
            } finally {
                inFlight.decrementAndGet();
            }
            return ANSWER;
        });
        DeepAnalyzer analyzer = analyzer(textInspector, llm, 2);

        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<DeepAnalysisResult>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                ScannedFile file = ScannedFile.named("file_" + i + ".txt");
                futures.add(pool.submit(() -> analyzer.analyze(file, List.of())));
            }
            for (Future<DeepAnalysisResult> future : futures) {
                assertNotNull(future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(maxInFlight.get() <= 2);
        assertEquals(2, analyzer.availablePermits());
    }

    @Test
    void testWaitingForSlotTimesOut() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ScriptedLlmProvider llm = new ScriptedLlmProvider(prompt -> {
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LlmException("interrupted");
            }
            return ANSWER;
        });
        DeepAnalysisProperties properties = new DeepAnalysisProperties();
        properties.setMaxConcurrent(1);
        properties.setPermitTimeout(Duration.ofMillis(100));
        DeepAnalyzer analyzer = new DeepAnalyzer(textInspector, llm, new ObjectMapper(), properties);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<DeepAnalysisResult> first = pool.submit(() -> analyzer.analyze(ScannedFile.named("a.txt"), List.of()));
            assertTrue(started.await(10, TimeUnit.SECONDS));

            DeepAnalysisException e = assertThrows(DeepAnalysisException.class,
                () -> analyzer.analyze(ScannedFile.named("b.txt"), List.of()));
            assertTrue(e.getMessage().contains("Timed out waiting"));

            release.countDown();
            assertNotNull(first.get(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, analyzer.availablePermits());
    }

    @Test
    void testBatchSkipsFailures() {
        ScriptedLlmProvider llm = new ScriptedLlmProvider(prompt -> prompt.contains("broken") ? "nonsense" : ANSWER);
        List<int[]> progress = new ArrayList<>();

        List<DeepAnalysisResult> results = analyzer(textInspector, llm, 1).analyzeFiles(
            List.of(ScannedFile.named("good.txt"), ScannedFile.named("broken.txt")), List.of(),
            (done, total) -> progress.add(new int[]{done, total}));

        assertEquals(1, results.size());
        assertEquals(2, progress.size());
        assertArrayEquals(new int[]{2, 2}, progress.get(1));
    }
}
