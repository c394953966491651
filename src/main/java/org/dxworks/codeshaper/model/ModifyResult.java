package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public class ModifyResult {
    public final List<String> appliedModifications;
    public final String backupPath;
    @JsonIgnore
    public final String backupContent;
    @JsonIgnore
    public final String modifiedContent;

    public ModifyResult(List<String> appliedModifications, String backupPath,
                        String backupContent, String modifiedContent) {
        this.appliedModifications = List.copyOf(appliedModifications);
        this.backupPath = backupPath;
        this.backupContent = backupContent;
        this.modifiedContent = modifiedContent;
    }
}
