package com.autosort.models;

import java.util.List;
import java.util.Objects;

/**
 * Immutable guardrail inputs for one run.
 */
public final class GuardrailContext {

    private final String rootName;
    private final List<PinRule> pinnedRules;
    private final boolean stayUnderRoot;
    private final boolean preferFolderMove;
    private final NamingConvention namingConvention;
    private final boolean substituteAliases;

    public GuardrailContext(String rootName, List<PinRule> pinnedRules, boolean stayUnderRoot,
                            boolean preferFolderMove, NamingConvention namingConvention,
                            boolean substituteAliases) {
        if (rootName == null || rootName.isBlank()) {
            throw new IllegalArgumentException("rootName is required");
        }
        this.rootName = rootName;
        this.pinnedRules = pinnedRules != null ? List.copyOf(pinnedRules) : List.of();
        this.stayUnderRoot = stayUnderRoot;
        this.preferFolderMove = preferFolderMove;
        this.namingConvention = namingConvention != null ? namingConvention : NamingConvention.UNKNOWN;
        this.substituteAliases = substituteAliases;
    }

    /**
     * Build the run context from stored settings. The naming convention is only carried
     * when the settings ask for adaptation.
     */
    public static GuardrailContext from(String rootName, GuardrailSettings settings, NamingConvention detected) {
        GuardrailSettings s = settings != null ? settings : new GuardrailSettings();
        NamingConvention convention = s.isAdaptNamingConvention() ? detected : NamingConvention.UNKNOWN;
        return new GuardrailContext(rootName, s.getPinnedRules(), s.isStayUnderRoot(),
            s.isPreferFolderMove(), convention, s.isSubstituteAliases());
    }

    public PinRule findPin(String fileName) {
        for (PinRule rule : pinnedRules) {
            if (rule != null && rule.matches(fileName)) {
                return rule;
            }
        }
        return null;
    }

    public String getRootName() {
        return rootName;
    }

    public List<PinRule> getPinnedRules() {
        return pinnedRules;
    }

    public boolean isStayUnderRoot() {
        return stayUnderRoot;
    }

    public boolean isPreferFolderMove() {
        return preferFolderMove;
    }

    public NamingConvention getNamingConvention() {
        return namingConvention;
    }

    public boolean isSubstituteAliases() {
        return substituteAliases;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GuardrailContext)) return false;
        GuardrailContext that = (GuardrailContext) o;
        return stayUnderRoot == that.stayUnderRoot
            && preferFolderMove == that.preferFolderMove
            && substituteAliases == that.substituteAliases
            && rootName.equals(that.rootName)
            && namingConvention == that.namingConvention;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootName, stayUnderRoot, preferFolderMove, namingConvention, substituteAliases);
    }
}
