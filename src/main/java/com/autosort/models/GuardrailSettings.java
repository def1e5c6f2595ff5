package com.autosort.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted guardrail switches for one scan root ({@code .autosort/guardrails.json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GuardrailSettings {

    private boolean stayUnderRoot = true;
    private boolean preferFolderMove = true;
    private boolean adaptNamingConvention = true;
    private boolean substituteAliases = true;
    private double snapCutoff = 0.8;
    private List<PinRule> pinnedRules = new ArrayList<>(List.of(PinRule.terraform()));

    public boolean isStayUnderRoot() {
        return stayUnderRoot;
    }

    public void setStayUnderRoot(boolean stayUnderRoot) {
        this.stayUnderRoot = stayUnderRoot;
    }

    public boolean isPreferFolderMove() {
        return preferFolderMove;
    }

    public void setPreferFolderMove(boolean preferFolderMove) {
        this.preferFolderMove = preferFolderMove;
    }

    public boolean isAdaptNamingConvention() {
        return adaptNamingConvention;
    }

    public void setAdaptNamingConvention(boolean adaptNamingConvention) {
        this.adaptNamingConvention = adaptNamingConvention;
    }

    public boolean isSubstituteAliases() {
        return substituteAliases;
    }

    public void setSubstituteAliases(boolean substituteAliases) {
        this.substituteAliases = substituteAliases;
    }

    public double getSnapCutoff() {
        return snapCutoff;
    }

    public void setSnapCutoff(double snapCutoff) {
        this.snapCutoff = snapCutoff;
    }

    public List<PinRule> getPinnedRules() {
        return pinnedRules;
    }

    public void setPinnedRules(List<PinRule> pinnedRules) {
        this.pinnedRules = pinnedRules;
    }
}
