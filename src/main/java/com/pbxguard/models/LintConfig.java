package com.pbxguard.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Integrity-check policy, read from {@code .pbxguard.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LintConfig {
    private boolean orphansBlocking = false;
    private boolean checkSections = true;
    private List<String> externalReferenceFields = new ArrayList<>(List.of("remoteGlobalIDString"));
    private List<String> orphanExemptIsas = new ArrayList<>();

    public static LintConfig defaults() {
        return new LintConfig();
    }

    public boolean isOrphansBlocking() {
        return orphansBlocking;
    }

    public void setOrphansBlocking(boolean orphansBlocking) {
        this.orphansBlocking = orphansBlocking;
    }

    public boolean isCheckSections() {
        return checkSections;
    }

    public void setCheckSections(boolean checkSections) {
        this.checkSections = checkSections;
    }

    public List<String> getExternalReferenceFields() {
        return externalReferenceFields;
    }

    public void setExternalReferenceFields(List<String> externalReferenceFields) {
        this.externalReferenceFields = externalReferenceFields != null ? externalReferenceFields : new ArrayList<>();
    }

    public List<String> getOrphanExemptIsas() {
        return orphanExemptIsas;
    }

    public void setOrphanExemptIsas(List<String> orphanExemptIsas) {
        this.orphanExemptIsas = orphanExemptIsas != null ? orphanExemptIsas : new ArrayList<>();
    }
}
