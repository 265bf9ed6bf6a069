package org.satisfier.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REPOSITORY DELLE FORMULE - Contratto di ricerca e memorizzazione consumato dal solutore
 *
 * Il parser consulta {@link #lookup(String)} per decidere se un nome è una variabile nuova
 * o il riferimento a una formula già memorizzata. Dopo una risoluzione soddisfacibile il
 * chiamante salva testo e modello con {@link #store}.
 *
 * Tutte le operazioni possono fallire con {@link RepositoryException}.
 */
public interface FormulaRepository {

    /**
     * @param name nome della formula
     * @return testo grezzo della formula memorizzata, vuoto se il nome non esiste
     */
    Optional<String> lookup(String name);

    /**
     * Crea o sovrascrive il record della formula.
     *
     * @param name nome della formula
     * @param rawText testo originale così come inserito
     * @param namedAssignment modello nome variabile → valore
     * @param comment commento facoltativo (può essere null)
     */
    void store(String name, String rawText, Map<String, Boolean> namedAssignment, String comment);

    /**
     * @return tutti i record memorizzati nell'ordine di inserimento
     */
    List<FormulaRecord> enumerate();
}
