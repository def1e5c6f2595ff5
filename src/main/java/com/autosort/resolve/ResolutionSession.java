package com.autosort.resolve;

import com.autosort.AppLogger;
import com.autosort.models.GuardrailContext;
import com.autosort.models.GuardrailSettings;
import com.autosort.models.NamingConvention;
import com.autosort.models.ResolutionOutcome;
import com.autosort.storage.ScanJournal;
import com.autosort.storage.SuggestionCache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * State shared by every worker during one scan: the cache, the guardrail context, the
 * taxonomy snapshot, the cancel signal and the progress counters. Passed explicitly to each resolution.
 */
public class ResolutionSession {

    private final Path root;
    private final SuggestionCache cache;
    private final GuardrailContext guardrails;
    private final TaxonomySnapshot snapshot;
    private final TaxonomySnapper snapper;
    private final DirectoryTree tree;
    private final String projectType;
    private final boolean ignoreCache;
    private final boolean refine;
    private final ScanJournal journal;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger total = new AtomicInteger();

    private ResolutionSession(Builder b, TaxonomySnapshot snapshot, GuardrailContext guardrails, String projectType) {
        this.root = snapshot.getRoot();
        this.cache = b.cache;
        this.tree = b.tree;
        this.snapshot = snapshot;
        this.guardrails = guardrails;
        this.snapper = new TaxonomySnapper(b.settings.getSnapCutoff());
        this.projectType = projectType;
        this.ignoreCache = b.ignoreCache;
        this.refine = b.refine;
        this.journal = b.journal;
    }

    public static Builder builder(Path root, SuggestionCache cache) {
        return new Builder(root, cache);
    }

    public Path getRoot() {
        return root;
    }

    public String getRootName() {
        return guardrails.getRootName();
    }

    public SuggestionCache getCache() {
        return cache;
    }

    public GuardrailContext getGuardrails() {
        return guardrails;
    }

    public TaxonomySnapshot getSnapshot() {
        return snapshot;
    }

    public TaxonomySnapper getSnapper() {
        return snapper;
    }

    public DirectoryTree getTree() {
        return tree;
    }

    public String getProjectType() {
        return projectType;
    }

    public boolean isIgnoreCache() {
        return ignoreCache;
    }

    public boolean isRefine() {
        return refine;
    }

    public ScanJournal getJournal() {
        return journal;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void startProgress(int fileCount) {
        completed.set(0);
        total.set(fileCount);
    }

    int markCompleted() {
        return completed.incrementAndGet();
    }

    public int getCompleted() {
        return completed.get();
    }

    public int getTotal() {
        return total.get();
    }

    /**
     * Destination used when nothing usable came back.
     */
    public String fallbackPath() {
        return guardrails.isStayUnderRoot()
            ? guardrails.getRootName() + "/" + ResolutionOutcome.SENTINEL
            : ResolutionOutcome.SENTINEL;
    }

    public static class Builder {
        private final Path root;
        private final SuggestionCache cache;
        private GuardrailSettings settings = new GuardrailSettings();
        private DirectoryTree tree = new FileSystemDirectoryTree();
        private boolean ignoreCache;
        private boolean refine = true;
        private ScanJournal journal;

        private Builder(Path root, SuggestionCache cache) {
            this.root = Objects.requireNonNull(root, "root");
            this.cache = Objects.requireNonNull(cache, "cache");
        }

        public Builder settings(GuardrailSettings settings) {
            if (settings != null) {
                this.settings = settings;
            }
            return this;
        }

        public Builder tree(DirectoryTree tree) {
            if (tree != null) {
                this.tree = tree;
            }
            return this;
        }

        public Builder ignoreCache(boolean ignoreCache) {
            this.ignoreCache = ignoreCache;
            return this;
        }

        public Builder refine(boolean refine) {
            this.refine = refine;
            return this;
        }

        public Builder journal(ScanJournal journal) {
            this.journal = journal;
            return this;
        }

        /**
         * Reads the taxonomy snapshot and detects the folder naming style and project type.
         */
        public ResolutionSession open() {
            TaxonomySnapshot snapshot = new TaxonomySnapshot(root, tree);
            NamingConvention detected = NamingConventionDetector.detect(snapshot.directoryNames(2));
            GuardrailContext guardrails = GuardrailContext.from(snapshot.getRootName(), settings, detected);
            String projectType = FileCategories.detectProjectType(rootEntries(snapshot.getRoot()));
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.info("[ResolutionSession] Opened " + snapshot.getRoot() + " (project=" + projectType
                    + ", naming=" + guardrails.getNamingConvention() + ", refine=" + refine
                    + ", fresh=" + ignoreCache + ")");
            }
            return new ResolutionSession(this, snapshot, guardrails, projectType);
        }

        private static List<String> rootEntries(Path root) {
            List<String> names = new ArrayList<>();
            try (Stream<Path> stream = Files.list(root)) {
                stream.map(p -> p.getFileName().toString()).forEach(names::add);
            } catch (IOException e) {
                AppLogger logger = AppLogger.get();
                if (logger != null) {
                    logger.warn("[ResolutionSession] Could not list " + root + ": " + e.getMessage());
                }
            }
            return names;
        }
    }
}
