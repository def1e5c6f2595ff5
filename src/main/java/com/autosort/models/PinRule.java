package com.autosort.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Forces a fixed destination for a recognized class of files, for example
 * infrastructure-as-code sources.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PinRule {

    private String name;
    private List<String> suffixes = new ArrayList<>();
    private String subpath;

    public PinRule() {
    }

    public PinRule(String name, List<String> suffixes, String subpath) {
        this.name = name;
        this.suffixes = suffixes != null ? new ArrayList<>(suffixes) : new ArrayList<>();
        this.subpath = subpath;
    }

    public static PinRule terraform() {
        return new PinRule("terraform", List.of(".tf", ".tfvars", ".tfstate", ".lock.hcl"),
            "infrastructure/terraform");
    }

    /**
     * Suffixes compare case-insensitively against the whole file name, so both
     * extensions (".tf") and compound names (".lock.hcl", "Dockerfile") work.
     */
    public boolean matches(String fileName) {
        if (fileName == null || suffixes == null) {
            return false;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String suffix : suffixes) {
            if (suffix != null && !suffix.isBlank() && lower.endsWith(suffix.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getSuffixes() {
        return suffixes;
    }

    public void setSuffixes(List<String> suffixes) {
        this.suffixes = suffixes;
    }

    public String getSubpath() {
        return subpath;
    }

    public void setSubpath(String subpath) {
        this.subpath = subpath;
    }
}
