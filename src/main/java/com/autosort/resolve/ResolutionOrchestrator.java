package com.autosort.resolve;

import com.autosort.AppLogger;
import com.autosort.models.FileSignature;
import com.autosort.models.PromptContext;
import com.autosort.models.ResolutionOutcome;
import com.autosort.models.ResolutionStatus;
import com.autosort.models.SuggestionRecord;
import com.autosort.oracle.Oracle;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the suggest-then-refine protocol for each file on a fixed worker pool.
 *
 * <p>Per file: cache lookup, pin rules (which skip the oracle), first oracle pass, parse, sanitize,
 * guardrails, snapping, then an optional refine pass through the same chain. Cancellation is observed at the start of a file,
 * before each oracle call and between passes. Every non-cancelled result is written to the cache.
 * Cached paths go back through the guardrails; one that now falls outside the root counts as a miss.
 * {@link #resolve} never throws; failures come back as a sentinel path with a status tag.
 */
public class ResolutionOrchestrator {

    /**
     * Called on a worker thread as each file finishes.
     */
    public interface ProgressListener {
        void onResult(ResolutionOutcome outcome, int completed, int total);
    }

    private final Oracle oracle;
    private final ResponseParser parser;
    private final PathSanitizer sanitizer;
    private final GuardrailPolicy policy;
    private final PromptContextBuilder contextBuilder;
    private final ExecutorService executor;
    private final int workerCount;
    private final Set<ResolutionSession> activeSessions = ConcurrentHashMap.newKeySet();
    private final AtomicLong cancelEpoch = new AtomicLong();
    private volatile ResolutionSession lastSession;
    private final AppLogger logger = AppLogger.get();

    public ResolutionOrchestrator(Oracle oracle, ObjectMapper mapper) {
        this(oracle, mapper, defaultWorkerCount());
    }

    public ResolutionOrchestrator(Oracle oracle, ObjectMapper mapper, int workerCount) {
        if (oracle == null) {
            throw new IllegalArgumentException("oracle is required");
        }
        this.oracle = oracle;
        this.parser = new ResponseParser(mapper);
        this.sanitizer = new PathSanitizer();
        this.policy = new GuardrailPolicy(sanitizer);
        this.contextBuilder = new PromptContextBuilder();
        this.workerCount = workerCount > 0 ? workerCount : defaultWorkerCount();
        this.executor = Executors.newFixedThreadPool(this.workerCount, workerThreadFactory());
    }

    public static int defaultWorkerCount() {
        return Math.max(4, Runtime.getRuntime().availableProcessors());
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public Oracle getOracle() {
        return oracle;
    }

    public ResolutionOutcome resolve(ResolutionSession session, Path file) {
        try {
            return resolveInternal(session, file);
        } catch (RuntimeException e) {
            logWarning("Unexpected failure for " + file + ": " + e);
            return ResolutionOutcome.failed(file, session.fallbackPath(), e.toString());
        }
    }

    public CompletableFuture<ResolutionOutcome> submit(ResolutionSession session, Path file) {
        return CompletableFuture.supplyAsync(() -> resolve(session, file), executor);
    }

    /**
     * Resolves every file in parallel and waits for all of them. Results are returned in
     * completion order.
     */
    public List<ResolutionOutcome> resolveAll(ResolutionSession session, List<Path> files, ProgressListener listener) {
        return resolveAll(session, files, listener, cancelEpoch.get());
    }

    /**
     * Same as {@link #resolveAll(ResolutionSession, List, ProgressListener)}, but the scan starts
     * cancelled when {@link #cancelAll()} ran after {@code startedAtEpoch} was read.
     */
    public List<ResolutionOutcome> resolveAll(ResolutionSession session, List<Path> files,
                                              ProgressListener listener, long startedAtEpoch) {
        List<ResolutionOutcome> results = Collections.synchronizedList(new ArrayList<>());
        session.startProgress(files.size());
        lastSession = session;
        activeSessions.add(session);
        if (cancelEpoch.get() != startedAtEpoch) {
            session.cancel();
        }
        log("Scan started: " + files.size() + " files under " + session.getRoot());
        try {
            List<CompletableFuture<ResolutionOutcome>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(submit(session, file).whenComplete((outcome, error) -> {
                    int done = session.markCompleted();
                    if (outcome != null) {
                        results.add(outcome);
                        if (listener != null) {
                            listener.onResult(outcome, done, session.getTotal());
                        }
                    }
                }));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            activeSessions.remove(session);
        }
        log((session.isCancelled() ? "Scan cancelled" : "Scan complete") + ": "
            + session.getCompleted() + "/" + session.getTotal());
        synchronized (results) {
            return new ArrayList<>(results);
        }
    }

    /**
     * Stops new work in every running scan. Calls already in flight finish normally.
     */
    public void cancelAll() {
        cancelEpoch.incrementAndGet();
        for (ResolutionSession session : activeSessions) {
            session.cancel();
        }
        log("Cancel requested for " + activeSessions.size() + " active scan(s)");
    }

    /**
     * Read before opening a session and pass to {@link #resolveAll(ResolutionSession, List, ProgressListener, long)}
     * so a cancel issued in between is not lost.
     */
    public long cancelEpoch() {
        return cancelEpoch.get();
    }

    /**
     * Files finished across running scans, or in the last scan when none is running.
     */
    public int getCompleted() {
        if (activeSessions.isEmpty()) {
            ResolutionSession last = lastSession;
            return last != null ? last.getCompleted() : 0;
        }
        int sum = 0;
        for (ResolutionSession session : activeSessions) {
            sum += session.getCompleted();
        }
        return sum;
    }

    public int getTotal() {
        if (activeSessions.isEmpty()) {
            ResolutionSession last = lastSession;
            return last != null ? last.getTotal() : 0;
        }
        int sum = 0;
        for (ResolutionSession session : activeSessions) {
            sum += session.getTotal();
        }
        return sum;
    }

    public boolean isRunning() {
        return !activeSessions.isEmpty();
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ResolutionOutcome resolveInternal(ResolutionSession session, Path file) {
        if (session.isCancelled()) {
            return ResolutionOutcome.cancelled(file);
        }
        FileSignature signature = FileSignature.of(file);
        if (!session.isIgnoreCache()) {
            Optional<SuggestionRecord> cached = session.getCache().lookup(signature);
            String cachedPath = cached.isPresent() ? guardCachedPath(session, file, cached.get()) : null;
            if (cachedPath != null) {
                ResolutionOutcome outcome = ResolutionOutcome.cacheHit(file, cachedPath);
                log(outcome.toString());
                return outcome;
            }
        }

        PromptContext context = contextBuilder.build(session, file);
        String fileName = context.getFileName();

        if (session.getGuardrails().findPin(fileName) != null) {
            String pinnedPath = finish(session, fileName, "").getPath();
            return complete(session, file, signature, context, pinnedPath, pinnedPath, ResolutionStatus.PINNED, null);
        }

        if (session.isCancelled()) {
            return ResolutionOutcome.cancelled(file);
        }
        String raw;
        String failure = null;
        try {
            raw = oracle.suggest(context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResolutionOutcome.cancelled(file);
        } catch (IOException e) {
            raw = null;
            failure = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logWarning(oracle.getKind().getProviderName() + " failed for " + fileName + ": " + failure);
        }
        if (failure == null && ResponseParser.isErrorResponse(raw)) {
            failure = raw.trim();
        }

        String firstPath = finish(session, fileName, parser.parse(raw)).getPath();

        if (failure != null) {
            ResolutionOutcome outcome = ResolutionOutcome.failed(file, firstPath, failure);
            store(session, file, signature, context, firstPath);
            journal(session, file, context, firstPath, firstPath, ResolutionStatus.FAILED, null);
            log(outcome.toString());
            return outcome;
        }
        if (!session.isRefine()) {
            return complete(session, file, signature, context, firstPath, firstPath, ResolutionStatus.RESOLVED, raw);
        }

        if (session.isCancelled()) {
            return ResolutionOutcome.cancelled(file);
        }
        String refinedRaw;
        try {
            refinedRaw = oracle.refine(context, firstPath);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResolutionOutcome.cancelled(file);
        } catch (IOException e) {
            logWarning("Refine failed for " + fileName + ", keeping first pass: " + e.getMessage());
            return complete(session, file, signature, context, firstPath, firstPath, ResolutionStatus.RESOLVED, raw);
        }

        String finalPath = firstPath;
        String parsed = parser.parse(refinedRaw);
        if (!parsed.isEmpty() && !sanitizer.isSentinel(sanitizer.sanitize(parsed))) {
            String refined = finish(session, fileName, parsed).getPath();
            if (!refined.equalsIgnoreCase(firstPath)) {
                finalPath = refined;
            }
        }
        return complete(session, file, signature, context, firstPath, finalPath, ResolutionStatus.REFINED, refinedRaw);
    }

    /**
     * Re-applies the current guardrails to a cached path. Returns null when the record should be
     * treated as a miss: a pin now covers the file, or the path leaves the root while containment is on.
     */
    private String guardCachedPath(ResolutionSession session, Path file, SuggestionRecord record) {
        Path name = file.getFileName();
        String fileName = name != null ? name.toString() : file.toString();
        if (session.getGuardrails().findPin(fileName) != null) {
            log("Cached path for " + fileName + " ignored, pin rule applies");
            return null;
        }
        String sanitized = sanitizer.sanitize(record.getResolvedPath());
        String firstSegment = sanitized.split("/")[0];
        if (session.getGuardrails().isStayUnderRoot() && !firstSegment.equalsIgnoreCase(session.getRootName())) {
            log("Cached path " + sanitized + " for " + fileName + " is outside " + session.getRootName()
                + ", resolving again");
            return null;
        }
        return finish(session, fileName, sanitized).getPath();
    }

    /**
     * Sanitize, guard and snap one parsed suggestion. Pinned destinations are not snapped.
     */
    private GuardrailDecision finish(ResolutionSession session, String fileName, String parsed) {
        String sanitized = sanitizer.sanitize(parsed);
        GuardrailDecision decision = policy.apply(fileName, sanitized, session.getGuardrails(), session.getSnapshot());
        if (decision.isPinned()) {
            return decision;
        }
        String snapped = session.getSnapper().snap(decision.getPath(), session.getRootName(), session.getSnapshot());
        return GuardrailDecision.guarded(snapped);
    }

    private ResolutionOutcome complete(ResolutionSession session, Path file, FileSignature signature,
                                       PromptContext context, String firstPath, String finalPath,
                                       ResolutionStatus status, String raw) {
        store(session, file, signature, context, finalPath);
        journal(session, file, context, firstPath, finalPath, status, raw);
        ResolutionOutcome outcome = ResolutionOutcome.resolved(file, finalPath, status);
        log(outcome.toString());
        return outcome;
    }

    private void store(ResolutionSession session, Path file, FileSignature signature,
                       PromptContext context, String path) {
        SuggestionRecord record = new SuggestionRecord(signature.value(), path, file.toString(),
            System.currentTimeMillis(), context.toSnapshot());
        session.getCache().store(signature, record);
    }

    private void journal(ResolutionSession session, Path file, PromptContext context, String firstPath,
                         String finalPath, ResolutionStatus status, String raw) {
        if (session.getJournal() != null) {
            session.getJournal().append(file, context.getFileHint(), firstPath, finalPath, status, raw);
        }
    }

    private ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "resolver-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[ResolutionOrchestrator] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[ResolutionOrchestrator] " + message);
        }
    }
}
