package com.autosort.resolve;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.io.InputStreamReader;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extension-based file categories, one-line file hints and project type detection used to
 * describe a file to the oracle.
 */
public final class FileCategories {

    static final Map<String, Set<String>> CATEGORIES = buildCategories();

    private static final Set<String> IMAGE = Set.of(".jpg", ".jpeg", ".png", ".heic", ".webp", ".tif", ".tiff");
    private static final Set<String> AUDIO = Set.of(".mp3", ".m4a", ".flac", ".wav", ".aac", ".ogg");
    private static final Set<String> VIDEO = Set.of(".mp4", ".mov", ".mkv", ".avi", ".webm");
    private static final Set<String> DOC = Set.of(".pdf", ".doc", ".docx", ".ppt", ".pptx", ".xls", ".xlsx",
        ".md", ".txt", ".rtf");

    private FileCategories() {
    }

    public static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".lock.hcl")) {
            return ".lock.hcl";
        }
        int dot = lower.lastIndexOf('.');
        return dot > 0 ? lower.substring(dot) : "";
    }

    /**
     * Category by extension or exact name; falls back to sniffing the first line for
     * scripts, XML and JSON. Returns "unknown" when nothing matches.
     */
    public static String categorize(Path file) {
        String name = file.getFileName() != null ? file.getFileName().toString() : "";
        String ext = extension(name);
        String lowerName = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Set<String>> entry : CATEGORIES.entrySet()) {
            Set<String> members = entry.getValue();
            if ((!ext.isEmpty() && members.contains(ext)) || members.contains(name) || members.contains(lowerName)) {
                return entry.getKey();
            }
        }
        String firstLine = readFirstLine(file);
        if (firstLine.startsWith("#!")) {
            return "scripts";
        }
        if (firstLine.startsWith("<?xml")) {
            return "xml";
        }
        if (firstLine.startsWith("{") || firstLine.startsWith("[")) {
            return "json";
        }
        return "unknown";
    }

    /**
     * One-line description such as {@code Type=Image; SizeBytes=2048; Name=a.png; Parent=Camera; Ancestors=Photos/Camera}.
     */
    public static String hint(String name, long sizeBytes, String parent, String ancestors) {
        String ext = extension(name);
        if (IMAGE.contains(ext)) {
            return "Type=Image; SizeBytes=" + sizeBytes + "; Name=" + name + "; Parent=" + parent + "; Ancestors=" + ancestors;
        }
        if (AUDIO.contains(ext)) {
            return "Type=Audio; SizeBytes=" + sizeBytes + "; Name=" + name + "; Parent=" + parent + "; Ancestors=" + ancestors;
        }
        if (VIDEO.contains(ext)) {
            return "Type=Video; SizeBytes=" + sizeBytes + "; Name=" + name + "; Parent=" + parent + "; Ancestors=" + ancestors;
        }
        if (DOC.contains(ext)) {
            return "Type=Doc; Name=" + name + "; Parent=" + parent + "; Ancestors=" + ancestors;
        }
        if (CATEGORIES.get("terraform").contains(ext)) {
            return "Type=Terraform; Name=" + name + "; Parent=" + parent + "; Ancestors=" + ancestors;
        }
        return "Filename=" + name + "; Parent=" + parent + "; Ancestors=" + ancestors
            + "; Ext=" + (ext.isEmpty() ? "(none)" : ext);
    }

    /**
     * Project type from the names found directly under the scan root.
     */
    public static String detectProjectType(Collection<String> rootEntries) {
        if (rootEntries == null) {
            return "unknown";
        }
        boolean hasTerraform = rootEntries.stream().anyMatch(n -> n.endsWith(".tf"));
        if (rootEntries.contains(".git")) {
            if (rootEntries.contains("package.json")) return "nodejs";
            if (rootEntries.contains("pyproject.toml") || rootEntries.contains("requirements.txt")) return "python";
            if (rootEntries.contains("go.mod")) return "golang";
            if (rootEntries.contains("Cargo.toml")) return "rust";
            if (rootEntries.contains("pom.xml")) return "java_maven";
            if (rootEntries.contains("build.gradle")) return "java_gradle";
            if (hasTerraform) return "terraform";
            return "git_repo";
        }
        if (rootEntries.contains("Dockerfile")) {
            return "docker";
        }
        if (hasTerraform) {
            return "terraform";
        }
        return "general";
    }

    private static String readFirstLine(Path file) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file),
            StandardCharsets.UTF_8.newDecoder().onMalformedInput(CodingErrorAction.IGNORE)))) {
            String line = reader.readLine();
            return line != null ? line.trim() : "";
        } catch (IOException e) {
            return "";
        }
    }

    private static Map<String, Set<String>> buildCategories() {
        Map<String, Set<String>> map = new LinkedHashMap<>();
        map.put("code", Set.of(".py", ".js", ".ts", ".java", ".cpp", ".c", ".h", ".hpp", ".cs", ".php", ".rb",
            ".go", ".rs", ".swift", ".kt"));
        map.put("config", Set.of(".json", ".yaml", ".yml", ".toml", ".ini", ".cfg", ".conf", ".env", ".properties"));
        map.put("docs", Set.of(".md", ".txt", ".rst", ".adoc", ".tex", ".doc", ".docx", ".pdf", ".rtf"));
        map.put("images", Set.of(".jpg", ".jpeg", ".png", ".gif", ".bmp", ".tiff", ".webp", ".svg", ".ico"));
        map.put("audio", Set.of(".mp3", ".wav", ".flac", ".aac", ".ogg", ".m4a", ".wma"));
        map.put("video", Set.of(".mp4", ".avi", ".mov", ".mkv", ".wmv", ".flv", ".webm", ".m4v"));
        map.put("archives", Set.of(".zip", ".rar", ".7z", ".tar", ".gz", ".bz2", ".xz"));
        map.put("data", Set.of(".csv", ".xlsx", ".xls", ".db", ".sqlite", ".xml"));
        map.put("terraform", Set.of(".tf", ".tfvars", ".tfstate", ".lock.hcl"));
        map.put("docker", Set.of("Dockerfile", "docker-compose.yml", "docker-compose.yaml", ".dockerignore"));
        map.put("git", Set.of(".gitignore", ".gitattributes", ".gitmodules"));
        map.put("logs", Set.of(".log", ".out", ".err", ".trace"));
        return Collections.unmodifiableMap(map);
    }
}
