package org.satisfier.dpll;

import org.satisfier.support.Assignment;

/**
 * Esito grezzo della ricerca DPLL, espresso sugli ID delle variabili.
 *
 * @param satisfiable verdetto
 * @param assignment modello completo se soddisfacibile, altrimenti assegnamento
 *                   parziale dell'ultimo ramo in conflitto (non è un testimone)
 * @param statistics metriche raccolte durante la ricerca
 */
public record SearchOutcome(boolean satisfiable, Assignment assignment, SATStatistics statistics) {

    public SearchOutcome {
        if (assignment == null || statistics == null) {
            throw new IllegalArgumentException("Esito di ricerca incompleto");
        }
    }
}
