package com.libragraph.atomizer.formats.api;

import java.util.List;

/**
 * @param totalAtoms  number of atom emissions, duplicates included
 * @param uniqueAtoms number of distinct content hashes
 * @param warnings    soft failures; empty when there were none
 */
public record ProcessingInfo(
        int totalAtoms,
        int uniqueAtoms,
        long durationMs,
        String atomizerType,
        String detectedFormat,
        List<String> warnings
) {
    public ProcessingInfo {
        warnings = List.copyOf(warnings);
    }
}
