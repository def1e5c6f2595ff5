package com.autosort.oracle;

import com.autosort.models.NamingConvention;
import com.autosort.models.OracleKind;
import com.autosort.models.PromptContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds oracle prompts. {@link #baseRequest} and {@link #refineRequest} describe the task once;
 * {@link #shape} wraps that text in the phrasing each provider kind responds to best.
 * All methods are pure.
 */
public final class PromptShaper {

    private static final Set<String> CODE_PROJECTS = Set.of(
        "python", "nodejs", "golang", "rust", "java_maven", "java_gradle");

    private PromptShaper() {
    }

    public static String baseRequest(PromptContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Return ONLY a relative folder path (1-3 levels) to organize the file. ")
            .append("Prefer EXISTING folders from the taxonomy below. If a close synonym exists, use the existing ")
            .append("folder name (do not invent new top-level names).\n");
        sb.append("Root: ").append(context.getRootName()).append("\n\n");
        sb.append("Existing taxonomy (samples):\n").append(taxonomy(context)).append("\n\n");
        sb.append("File: ").append(context.getFileName()).append("\n");
        sb.append(context.getFileHint()).append("\n\n");
        sb.append("Neighbor context:\n").append(neighbors(context)).append("\n");
        if (context.getNamingConvention() != NamingConvention.UNKNOWN) {
            sb.append("Folder naming style: ").append(styleName(context.getNamingConvention())).append("\n");
        }
        List<String> guidelines = guidelines(context.getProjectType());
        if (!guidelines.isEmpty()) {
            sb.append("\nProject guidelines:\n");
            for (String line : guidelines) {
                sb.append("- ").append(line).append("\n");
            }
        }
        sb.append("\nRules:\n")
            .append("- Output ONLY the path on one line\n")
            .append("- Use forward slashes\n")
            .append("- Max depth 3\n")
            .append("- If uncertain, reply 'Uncategorized'\n");
        return sb.toString();
    }

    public static String refineRequest(PromptContext context, String candidate) {
        return "Given a candidate folder path, improve it ONLY if it conflicts with the existing taxonomy; "
            + "otherwise return it unchanged.\n"
            + "Output ONLY the path. Max depth 3. Prefer existing folder names from the taxonomy.\n"
            + "Root: " + context.getRootName() + "\n\n"
            + "Existing taxonomy (samples):\n" + taxonomy(context) + "\n\n"
            + "Filename: " + context.getFileName() + "\n"
            + context.getFileHint() + "\n"
            + "Candidate: " + candidate + "\n";
    }

    /**
     * Provider-specific framing of a request. The local runner gets the request nearly as-is,
     * OpenAI a structured rule list, Grok an explicit "only the path" instruction.
     */
    public static String shape(OracleKind kind, String request, String projectType) {
        boolean knownProject = projectType != null && !projectType.isBlank() && !"unknown".equals(projectType);
        switch (kind) {
            case LOCAL: {
                String out = request + "\n\nRespond with only the folder path:";
                if (knownProject) {
                    out += "\n\nProject type: " + projectType;
                }
                return out;
            }
            case OPENAI: {
                String out = "As a file organization expert, determine the best folder structure for this file.\n\n"
                    + request + "\n"
                    + "Rules:\n"
                    + "- Respond with ONLY the folder path\n"
                    + "- Use forward slashes (/)\n"
                    + "- Be specific but concise\n"
                    + "- If uncertain, use \"Uncategorized\"\n\n"
                    + "Folder path:";
                if (knownProject) {
                    out += "\n\nProject context: " + projectType;
                }
                return out;
            }
            case GROK: {
                String out = "File organization task:\n\n"
                    + request + "\n"
                    + "Important: Respond with ONLY the folder path where this file should go. Nothing else.\n\n"
                    + "Folder path:";
                if (knownProject) {
                    out += "\n\nProject context: " + projectType;
                }
                return out;
            }
            default:
                return request;
        }
    }

    /**
     * System role text for chat-style hosted APIs; null for the local runner.
     */
    public static String systemMessage(OracleKind kind) {
        switch (kind) {
            case OPENAI:
                return "You are a file organization expert. Respond only with folder paths for organizing files.";
            case GROK:
                return "You are a file organization assistant. Provide only folder paths for file organization.";
            default:
                return null;
        }
    }

    static List<String> guidelines(String projectType) {
        List<String> lines = new ArrayList<>();
        if (projectType == null) {
            return lines;
        }
        if (CODE_PROJECTS.contains(projectType)) {
            lines.add("Keep source code in 'src/' or similar");
            lines.add("Separate tests in 'tests/' or 'test/'");
            lines.add("Configuration files in 'config/' or root");
            lines.add("Documentation in 'docs/' or 'doc/'");
            lines.add("Assets in 'assets/', 'static/', or 'public/'");
        } else if ("terraform".equals(projectType)) {
            lines.add("Terraform files in 'terraform/' or 'infrastructure/'");
            lines.add("Separate environments (dev, staging, prod)");
            lines.add("Keep modules in 'modules/'");
        }
        return lines;
    }

    private static String taxonomy(PromptContext context) {
        Map<String, List<String>> sample = context.getTaxonomySample();
        if (sample.isEmpty()) {
            return "(none)";
        }
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : sample.entrySet()) {
            if (entry.getValue().isEmpty()) {
                lines.add("- " + entry.getKey());
            } else {
                lines.add("- " + entry.getKey() + ": " + String.join(", ", entry.getValue()));
            }
        }
        return String.join("\n", lines);
    }

    private static String neighbors(PromptContext context) {
        List<String> lines = new ArrayList<>();
        lines.add("Parent: " + (context.getParentDir().isEmpty() ? "(root)" : context.getParentDir()));
        if (!context.getSiblingDirs().isEmpty()) {
            lines.add("Sibling folders: " + String.join(", ", context.getSiblingDirs()));
        }
        if (!context.getSiblingFiles().isEmpty()) {
            lines.add("Sibling files: " + String.join(", ", context.getSiblingFiles()));
        }
        return String.join("\n", lines);
    }

    private static String styleName(NamingConvention convention) {
        switch (convention) {
            case KEBAB_CASE:
                return "kebab-case";
            case SNAKE_CASE:
                return "snake_case";
            case PASCAL_CASE:
                return "PascalCase";
            default:
                return "unknown";
        }
    }
}
