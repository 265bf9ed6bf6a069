package org.satisfier.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record memorizzato: nome, testo grezzo, modello trovato e commento facoltativo.
 */
public record FormulaRecord(String name, String rawText, Map<String, Boolean> assignment, String comment) {

    public FormulaRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome formula null o vuoto");
        }
        if (rawText == null) {
            throw new IllegalArgumentException("Testo formula null per " + name);
        }
        assignment = assignment == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
