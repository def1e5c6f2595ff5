package com.autosort.resolve;

import com.autosort.models.GuardrailSettings;
import com.autosort.models.OracleKind;
import com.autosort.models.PromptContext;
import com.autosort.models.ResolutionOutcome;
import com.autosort.models.ResolutionStatus;
import com.autosort.models.FileSignature;
import com.autosort.models.SuggestionRecord;
import com.autosort.oracle.Oracle;
import com.autosort.storage.ScanJournal;
import com.autosort.storage.SuggestionCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionOrchestratorTest {

    @TempDir
    Path tempDir;

    private Path root;
    private SuggestionCache cache;
    private ScriptedOracle oracle;
    private ResolutionOrchestrator orchestrator;

    /**
     * Replays canned answers; an {@link IOException} entry is thrown instead of returned.
     * When {@code blockOnCall} is set, that suggest call waits on {@code release}.
     */
    static class ScriptedOracle implements Oracle {
        final Deque<Object> suggestions = new ArrayDeque<>();
        final Deque<Object> refinements = new ArrayDeque<>();
        final AtomicInteger suggestCalls = new AtomicInteger();
        final AtomicInteger refineCalls = new AtomicInteger();
        final List<String> candidates = Collections.synchronizedList(new ArrayList<>());
        Object defaultSuggestion = "Documents";
        int blockOnCall;
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public OracleKind getKind() {
            return OracleKind.LOCAL;
        }

        @Override
        public String suggest(PromptContext context) throws IOException, InterruptedException {
            int call = suggestCalls.incrementAndGet();
            if (call == blockOnCall) {
                entered.countDown();
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IOException("never released");
                }
            }
            return answer(next(suggestions, defaultSuggestion));
        }

        @Override
        public String refine(PromptContext context, String candidate) throws IOException {
            refineCalls.incrementAndGet();
            candidates.add(candidate);
            return answer(next(refinements, candidate));
        }

        private synchronized Object next(Deque<Object> queue, Object fallback) {
            return queue.isEmpty() ? fallback : queue.poll();
        }

        private String answer(Object value) throws IOException {
            if (value instanceof IOException) {
                throw (IOException) value;
            }
            return (String) value;
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("scan").resolve("Root"));
        Files.createDirectories(root.resolve("Documents").resolve("Reports"));
        Files.createDirectories(root.resolve("Photos"));
        Files.createDirectories(root.resolve("inbox"));
        cache = new SuggestionCache(tempDir.resolve("data").resolve("suggestion-cache.json"));
        oracle = new ScriptedOracle();
        orchestrator = new ResolutionOrchestrator(oracle, new ObjectMapper(), 2);
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private Path file(String name) throws IOException {
        return Files.writeString(root.resolve("inbox").resolve(name), "content of " + name);
    }

    private ResolutionSession session(boolean refine) {
        return ResolutionSession.builder(root, cache).refine(refine).open();
    }

    @Test
    void snapsFirstPassOntoExistingFolders() throws IOException {
        oracle.suggestions.add("Docments/Reports");
        ResolutionOutcome outcome = orchestrator.resolve(session(false), file("q2.pdf"));

        assertEquals("Root/Documents/Reports", outcome.getPath());
        assertEquals(ResolutionStatus.RESOLVED, outcome.getStatus());
        assertEquals(0, oracle.refineCalls.get());
    }

    @Test
    void refinePassReceivesFirstPassAndMayChangeIt() throws IOException {
        oracle.suggestions.add("Documents");
        oracle.refinements.add("Finance/Invoices");
        ResolutionOutcome outcome = orchestrator.resolve(session(true), file("invoice.pdf"));

        assertEquals(List.of("Root/Documents"), oracle.candidates);
        assertEquals("Root/Finance/Invoices", outcome.getPath());
        assertEquals(ResolutionStatus.REFINED, outcome.getStatus());
    }

    @Test
    void refineDifferingOnlyInCaseKeepsFirstPass() throws IOException {
        oracle.suggestions.add("Projects/Alpha");
        oracle.refinements.add("root/projects/alpha");
        ResolutionOutcome outcome = orchestrator.resolve(session(true), file("plan.txt"));

        assertEquals("Root/Projects/Alpha", outcome.getPath());
        assertEquals(ResolutionStatus.REFINED, outcome.getStatus());
    }

    @Test
    void unusableRefineKeepsFirstPass() throws IOException {
        oracle.suggestions.add("Documents/Reports");
        oracle.refinements.add("```\n\n```");
        ResolutionOutcome outcome = orchestrator.resolve(session(true), file("summary.pdf"));
        assertEquals("Root/Documents/Reports", outcome.getPath());
    }

    @Test
    void refineFailureKeepsFirstPassAsResolved() throws IOException {
        oracle.suggestions.add("Photos");
        oracle.refinements.add(new IOException("Oracle request failed (500): boom"));
        ResolutionOutcome outcome = orchestrator.resolve(session(true), file("IMG_0001.jpg"));

        assertEquals("Root/Photos", outcome.getPath());
        assertEquals(ResolutionStatus.RESOLVED, outcome.getStatus());
    }

    @Test
    void pinnedFilesSkipOracle() throws IOException {
        ResolutionOutcome outcome = orchestrator.resolve(session(true), file("main.tf"));
        ResolutionOutcome lock = orchestrator.resolve(session(true), file(".terraform.lock.hcl"));

        assertEquals("Root/infrastructure/terraform", outcome.getPath());
        assertEquals(ResolutionStatus.PINNED, outcome.getStatus());
        assertEquals("Root/infrastructure/terraform", lock.getPath());
        assertEquals(0, oracle.suggestCalls.get());
        assertEquals(0, oracle.refineCalls.get());
    }

    @Test
    void oracleFailureFallsBackAndIsCached() throws IOException {
        oracle.suggestions.add(new IOException("Oracle request failed (401): unauthorized"));
        Path file = file("notes.txt");
        ResolutionOutcome outcome = orchestrator.resolve(session(true), file);

        assertEquals("Root/Uncategorized", outcome.getPath());
        assertEquals(ResolutionStatus.FAILED, outcome.getStatus());
        assertTrue(outcome.getDetail().contains("401"));
        assertEquals("Root/Uncategorized", cache.lookup(FileSignature.of(file)).get().getResolvedPath());
    }

    @Test
    void errorMarkerCountsAsFailure() throws IOException {
        oracle.suggestions.add("Error: model 'llama3.1' not found");
        ResolutionOutcome outcome = orchestrator.resolve(session(true), file("notes.txt"));

        assertEquals(ResolutionStatus.FAILED, outcome.getStatus());
        assertEquals("Root/Uncategorized", outcome.getPath());
        assertEquals(0, oracle.refineCalls.get());
    }

    @Test
    void cacheHitSkipsOracle() throws IOException {
        Path file = file("q2.pdf");
        oracle.suggestions.add("Documents/Reports");
        orchestrator.resolve(session(false), file);

        ResolutionOutcome again = orchestrator.resolve(session(true), file);
        assertEquals(ResolutionStatus.CACHED, again.getStatus());
        assertEquals("Root/Documents/Reports", again.getPath());
        assertEquals(1, oracle.suggestCalls.get());
    }

    @Test
    void cachedPathOutsideRootIsResolvedAgain() throws IOException {
        Path file = file("q3.pdf");
        FileSignature signature = FileSignature.of(file);
        cache.store(signature, new SuggestionRecord(signature.value(), "Elsewhere/Docs", file.toString(),
            System.currentTimeMillis(), Map.of()));

        ResolutionOutcome outcome = orchestrator.resolve(session(false), file);

        assertNotEquals(ResolutionStatus.CACHED, outcome.getStatus());
        assertTrue(outcome.getPath().startsWith("Root/"));
        assertEquals(1, oracle.suggestCalls.get());
        assertEquals("Root/Documents", cache.lookup(signature).get().getResolvedPath());
    }

    @Test
    void pinRuleWinsOverCachedPath() throws IOException {
        Path file = file("main.tf");
        FileSignature signature = FileSignature.of(file);
        cache.store(signature, new SuggestionRecord(signature.value(), "Root/Misc", file.toString(),
            System.currentTimeMillis(), Map.of()));

        ResolutionOutcome outcome = orchestrator.resolve(session(true), file);

        assertEquals(ResolutionStatus.PINNED, outcome.getStatus());
        assertEquals("Root/infrastructure/terraform", outcome.getPath());
        assertEquals(0, oracle.suggestCalls.get());
    }

    @Test
    void freshScanBypassesLookupButStillWrites() throws IOException {
        Path file = file("q2.pdf");
        oracle.suggestions.add("Documents");
        orchestrator.resolve(session(false), file);

        oracle.suggestions.add("Photos");
        ResolutionSession fresh = ResolutionSession.builder(root, cache).refine(false).ignoreCache(true).open();
        ResolutionOutcome outcome = orchestrator.resolve(fresh, file);

        assertEquals("Root/Photos", outcome.getPath());
        assertEquals(2, oracle.suggestCalls.get());
        assertEquals("Root/Photos", cache.lookup(FileSignature.of(file)).get().getResolvedPath());
    }

    @Test
    void modifiedFileIsResolvedAgain() throws IOException {
        Path file = file("q2.pdf");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
        orchestrator.resolve(session(false), file);

        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-02-01T00:00:00Z")));
        ResolutionOutcome outcome = orchestrator.resolve(session(false), file);
        assertNotEquals(ResolutionStatus.CACHED, outcome.getStatus());
        assertEquals(2, oracle.suggestCalls.get());
    }

    @Test
    void cancelledSessionMakesNoCallsAndWritesNothing() throws IOException {
        ResolutionSession session = session(true);
        session.cancel();
        ResolutionOutcome outcome = orchestrator.resolve(session, file("q2.pdf"));

        assertTrue(outcome.isCancelled());
        assertEquals(0, oracle.suggestCalls.get());
        assertEquals(0, cache.size());
    }

    @Test
    void resolveAllReportsProgress() throws IOException {
        List<Path> files = List.of(file("a.pdf"), file("b.pdf"), file("c.pdf"));
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        ScanJournal journal = ScanJournal.forScan(tempDir.resolve("data"), new ObjectMapper());
        ResolutionSession session = ResolutionSession.builder(root, cache).refine(false).journal(journal).open();

        List<ResolutionOutcome> results = orchestrator.resolveAll(session, files,
            (outcome, completed, total) -> {
                assertEquals(3, total);
                seen.add(completed);
            });

        assertEquals(3, results.size());
        assertEquals(3, session.getCompleted());
        assertEquals(3, session.getTotal());
        assertEquals(3, orchestrator.getCompleted());
        assertEquals(3, orchestrator.getTotal());
        assertFalse(orchestrator.isRunning());
        assertEquals(3, seen.size());
        assertTrue(seen.contains(3));
        for (ResolutionOutcome outcome : results) {
            assertEquals("Root/Documents", outcome.getPath());
        }
        assertEquals(3, Files.readAllLines(journal.getJournalFile(), StandardCharsets.UTF_8).size());
    }

    @Test
    void sessionsKeepTheirOwnProgress() throws IOException {
        ResolutionSession first = session(false);
        ResolutionSession second = session(false);

        orchestrator.resolveAll(first, List.of(file("a.pdf"), file("b.pdf")), null);
        orchestrator.resolveAll(second, List.of(file("c.pdf")), null);

        assertEquals(2, first.getCompleted());
        assertEquals(2, first.getTotal());
        assertEquals(1, second.getCompleted());
        assertEquals(1, second.getTotal());
        assertEquals(1, orchestrator.getTotal());
    }

    @Test
    void cancelBeforeScanRegistersIsNotLost() throws IOException {
        long epoch = orchestrator.cancelEpoch();
        ResolutionSession session = session(true);
        orchestrator.cancelAll();

        List<ResolutionOutcome> results = orchestrator.resolveAll(session, List.of(file("a.pdf"), file("b.pdf")), null, epoch);

        assertTrue(session.isCancelled());
        assertEquals(2, results.size());
        for (ResolutionOutcome outcome : results) {
            assertTrue(outcome.isCancelled());
        }
        assertEquals(0, oracle.suggestCalls.get());
        assertEquals(0, cache.size());
    }

    @Test
    void cancelMidScanStopsRemainingWork() throws Exception {
        orchestrator.shutdown();
        orchestrator = new ResolutionOrchestrator(oracle, new ObjectMapper(), 1);
        oracle.blockOnCall = 2;
        Path a = file("a.pdf");
        Path b = file("b.pdf");
        Path c = file("c.pdf");
        ResolutionSession session = session(true);

        CompletableFuture<List<ResolutionOutcome>> scan = CompletableFuture.supplyAsync(
            () -> orchestrator.resolveAll(session, List.of(a, b, c), null));
        assertTrue(oracle.entered.await(5, TimeUnit.SECONDS));
        orchestrator.cancelAll();
        oracle.release.countDown();
        List<ResolutionOutcome> results = scan.get(5, TimeUnit.SECONDS);

        assertEquals(3, results.size());
        for (ResolutionOutcome outcome : results) {
            if (outcome.getFile().equals(a)) {
                assertEquals(ResolutionStatus.REFINED, outcome.getStatus());
            } else {
                assertTrue(outcome.isCancelled(), outcome.toString());
            }
        }
        assertEquals(2, oracle.suggestCalls.get());
        assertEquals(1, oracle.refineCalls.get());
        assertTrue(cache.lookup(FileSignature.of(a)).isPresent());
        assertFalse(cache.lookup(FileSignature.of(b)).isPresent());
        assertFalse(cache.lookup(FileSignature.of(c)).isPresent());
        assertFalse(orchestrator.isRunning());
    }

    @Test
    void stayUnderRootOffLeavesPathUnrooted() throws IOException {
        GuardrailSettings settings = new GuardrailSettings();
        settings.setStayUnderRoot(false);
        ResolutionSession session = ResolutionSession.builder(root, cache).settings(settings).refine(false).open();
        oracle.suggestions.add("Photos/2024");

        assertEquals("Photos/2024", orchestrator.resolve(session, file("IMG_0002.jpg")).getPath());
    }

    @Test
    void rejectsMissingOracle() {
        assertThrows(IllegalArgumentException.class, () -> new ResolutionOrchestrator(null, new ObjectMapper()));
    }
}
