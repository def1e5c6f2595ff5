package com.autosort.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SuggestionRecord {

    private String signature;
    private String resolvedPath;
    private String sourceFilePath;
    private long timestamp;
    private Map<String, Object> contextSnapshot = new LinkedHashMap<>();

    public SuggestionRecord() {
    }

    public SuggestionRecord(String signature, String resolvedPath, String sourceFilePath,
                            long timestamp, Map<String, Object> contextSnapshot) {
        this.signature = signature;
        this.resolvedPath = resolvedPath;
        this.sourceFilePath = sourceFilePath;
        this.timestamp = timestamp;
        this.contextSnapshot = contextSnapshot != null ? new LinkedHashMap<>(contextSnapshot) : new LinkedHashMap<>();
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }

    public String getResolvedPath() {
        return resolvedPath;
    }

    public void setResolvedPath(String resolvedPath) {
        this.resolvedPath = resolvedPath;
    }

    public String getSourceFilePath() {
        return sourceFilePath;
    }

    public void setSourceFilePath(String sourceFilePath) {
        this.sourceFilePath = sourceFilePath;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public Map<String, Object> getContextSnapshot() {
        return contextSnapshot;
    }

    public void setContextSnapshot(Map<String, Object> contextSnapshot) {
        this.contextSnapshot = contextSnapshot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SuggestionRecord)) return false;
        SuggestionRecord that = (SuggestionRecord) o;
        return timestamp == that.timestamp
            && Objects.equals(signature, that.signature)
            && Objects.equals(resolvedPath, that.resolvedPath)
            && Objects.equals(sourceFilePath, that.sourceFilePath)
            && Objects.equals(contextSnapshot, that.contextSnapshot);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature, resolvedPath, sourceFilePath, timestamp, contextSnapshot);
    }
}
