package org.satisfier.repository;

import java.util.*;

/**
 * Repository volatile in memoria, ordinato per inserimento. Usato nei test e nelle
 * sessioni interattive senza file di archivio.
 */
public class InMemoryFormulaRepository implements FormulaRepository {

    private final Map<String, FormulaRecord> records = new LinkedHashMap<>();

    /**
     * Registra una formula senza modello, utile per predisporre riferimenti.
     */
    public InMemoryFormulaRepository define(String name, String rawText) {
        records.put(name, new FormulaRecord(name, rawText, Map.of(), null));
        return this;
    }

    @Override
    public Optional<String> lookup(String name) {
        FormulaRecord record = records.get(name);
        return record != null ? Optional.of(record.rawText()) : Optional.empty();
    }

    @Override
    public void store(String name, String rawText, Map<String, Boolean> namedAssignment, String comment) {
        records.put(name, new FormulaRecord(name, rawText, namedAssignment, comment));
    }

    @Override
    public List<FormulaRecord> enumerate() {
        return List.copyOf(records.values());
    }
}
