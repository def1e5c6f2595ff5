package com.autosort.controllers;

import com.autosort.AppLogger;
import com.autosort.models.GuardrailSettings;
import com.autosort.models.ResolutionOutcome;
import com.autosort.oracle.OracleStatus;
import com.autosort.resolve.ResolutionOrchestrator;
import com.autosort.resolve.ResolutionSession;
import com.autosort.storage.GuardrailConfigStore;
import com.autosort.storage.ScanJournal;
import com.autosort.storage.SuggestionCache;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * REST controller for path resolution.
 *
 * Endpoints:
 *   POST   /api/resolve           Resolve files under a root (blocks until done or cancelled)
 *   POST   /api/resolve/cancel    Cancel running scans
 *   GET    /api/resolve/progress  Completed/total counters
 *   DELETE /api/cache             Drop every cached suggestion
 *   GET    /api/oracle/status     Check the configured oracle
 */
public class ResolutionController implements Controller {

    private final ResolutionOrchestrator orchestrator;
    private final SuggestionCache cache;
    private final ObjectMapper objectMapper;
    private final Path dataDirectory;
    private final boolean defaultRefine;
    private final boolean defaultFresh;
    private final AppLogger logger = AppLogger.get();

    public ResolutionController(ResolutionOrchestrator orchestrator, SuggestionCache cache, ObjectMapper objectMapper,
                                Path dataDirectory, boolean defaultRefine, boolean defaultFresh) {
        this.orchestrator = orchestrator;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.dataDirectory = dataDirectory;
        this.defaultRefine = defaultRefine;
        this.defaultFresh = defaultFresh;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/resolve", this::resolve);
        app.post("/api/resolve/cancel", this::cancel);
        app.get("/api/resolve/progress", this::progress);
        app.delete("/api/cache", this::clearCache);
        app.get("/api/oracle/status", this::oracleStatus);
    }

    /**
     * POST /api/resolve
     * Body: { "root": "...", "files": ["..."], "fresh": false, "refine": true }
     */
    private void resolve(Context ctx) {
        long epoch = orchestrator.cancelEpoch();
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            String rootArg = body.path("root").asText(null);
            if (rootArg == null || rootArg.isBlank()) {
                ctx.status(400).json(Map.of("error", "root is required"));
                return;
            }
            Path root = Paths.get(rootArg).toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                ctx.status(400).json(Map.of("error", "root is not a directory: " + root));
                return;
            }

            List<Path> files = new ArrayList<>();
            JsonNode filesNode = body.path("files");
            if (filesNode.isArray() && filesNode.size() > 0) {
                for (JsonNode f : filesNode) {
                    files.add(resolveUnderRoot(root, f.asText()));
                }
            } else {
                files.addAll(collectFiles(root));
            }

            GuardrailSettings settings = new GuardrailConfigStore(root, objectMapper).loadOrDefault();
            ResolutionSession session = ResolutionSession.builder(root, cache)
                .settings(settings)
                .ignoreCache(body.path("fresh").asBoolean(defaultFresh))
                .refine(body.path("refine").asBoolean(defaultRefine))
                .journal(ScanJournal.forScan(dataDirectory, objectMapper))
                .open();

            List<ResolutionOutcome> outcomes = orchestrator.resolveAll(session, files, null, epoch);
            List<Map<String, Object>> results = outcomes.stream()
                .map(this::toJson)
                .collect(Collectors.toList());

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("results", results);
            response.put("completed", session.getCompleted());
            response.put("total", session.getTotal());
            response.put("cancelled", session.isCancelled());
            ctx.json(response);
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logWarning("Resolve failed: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void cancel(Context ctx) {
        orchestrator.cancelAll();
        ctx.json(Map.of("cancelled", true));
    }

    private void progress(Context ctx) {
        ctx.json(Map.of(
            "completed", orchestrator.getCompleted(),
            "total", orchestrator.getTotal(),
            "running", orchestrator.isRunning()
        ));
    }

    private void clearCache(Context ctx) {
        int count = cache.size();
        cache.invalidateAll();
        ctx.json(Map.of("cleared", count));
    }

    private void oracleStatus(Context ctx) {
        OracleStatus status = OracleStatus.check(orchestrator.getOracle());
        ctx.json(Map.of(
            "provider", orchestrator.getOracle().getKind().getProviderName(),
            "available", status.isAvailable(),
            "message", status.getMessage()
        ));
    }

    private Map<String, Object> toJson(ResolutionOutcome outcome) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("file", outcome.getFile().toString());
        item.put("path", outcome.getPath());
        item.put("status", outcome.getStatus().getLabel());
        if (outcome.getDetail() != null) {
            item.put("detail", outcome.getDetail());
        }
        return item;
    }

    static Path resolveUnderRoot(Path root, String file) {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("file entries must not be blank");
        }
        Path resolved = root.resolve(file).toAbsolutePath().normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("file is outside root: " + file);
        }
        return resolved;
    }

    /**
     * Every regular file under root, skipping hidden entries and the .autosort folder.
     */
    static List<Path> collectFiles(Path root) throws IOException {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> !isHidden(root.relativize(p)))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[ResolutionController] " + message);
        }
    }
}
