package org.satisfier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Richiesta di risoluzione.
 *
 * @param name nome con cui memorizzare la formula se soddisfacibile, null per un controllo anonimo
 * @param formulaText testo della formula in CNF
 * @param preAssignments valori imposti prima della ricerca, per nome di variabile, in ordine di applicazione
 * @param comment commento da memorizzare con la formula (può essere null)
 */
public record SolveRequest(String name, String formulaText, Map<String, Boolean> preAssignments, String comment) {

    public SolveRequest {
        if (formulaText == null) {
            throw new IllegalArgumentException("Testo della formula null");
        }
        preAssignments = preAssignments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(preAssignments));
    }

    public static SolveRequest of(String name, String formulaText) {
        return new SolveRequest(name, formulaText, Map.of(), null);
    }

    public static SolveRequest anonymous(String formulaText) {
        return of(null, formulaText);
    }

    /**
     * @return true se l'esito soddisfacibile va memorizzato nel repository
     */
    public boolean isNamed() {
        return name != null && !name.isBlank();
    }
}
