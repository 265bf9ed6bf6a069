package org.satisfier.dpll;

import java.util.*;

/**
 * RISULTATO SAT - Contenitore immutabile per l'esito di una risoluzione
 *
 * COMPONENTI:
 * • Esito: SAT (soddisfacibile) vs UNSAT (insoddisfacibile)
 * • Assegnamento nominale: modello completo per SAT, parziale e non significativo per UNSAT
 * • Avvisi non bloccanti raccolti durante la risoluzione (es. variabili sconosciute)
 * • Dimensioni della formula espansa e statistiche della ricerca
 */
public class SATResult {

    //region ATTRIBUTI CORE

    private final boolean satisfiable;

    /**
     * Nome variabile → valore, in ordine di assegnamento.
     * Per UNSAT è l'assegnamento dell'ultimo ramo in conflitto: non è un testimone.
     */
    private final Map<String, Boolean> assignment;

    private final List<String> warnings;

    /** Clausole della formula espansa, prima dei pre-assegnamenti */
    private final int clauseCount;

    /** Variabili del registro, comprese quelle introdotte dall'espansione */
    private final int variableCount;

    private final SATStatistics statistics;

    //endregion

    //region COSTRUZIONE

    public SATResult(boolean satisfiable, Map<String, Boolean> assignment, List<String> warnings,
                     int clauseCount, int variableCount, SATStatistics statistics) {
        if (clauseCount < 0 || variableCount < 0) {
            throw new IllegalArgumentException("Dimensioni della formula negative");
        }
        this.satisfiable = satisfiable;
        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment != null ? assignment : Map.of()));
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
        this.clauseCount = clauseCount;
        this.variableCount = variableCount;
        this.statistics = statistics != null ? statistics : new SATStatistics();
    }

    /**
     * Crea risultato SAT con modello completo.
     */
    public static SATResult satisfiable(Map<String, Boolean> model, List<String> warnings,
                                        int clauseCount, int variableCount, SATStatistics statistics) {
        if (model == null) {
            throw new IllegalArgumentException("Modello SAT null");
        }
        return new SATResult(true, model, warnings, clauseCount, variableCount, statistics);
    }

    /**
     * Crea risultato UNSAT con l'assegnamento parziale dell'ultimo conflitto.
     */
    public static SATResult unsatisfiable(Map<String, Boolean> partial, List<String> warnings,
                                          int clauseCount, int variableCount, SATStatistics statistics) {
        return new SATResult(false, partial, warnings, clauseCount, variableCount, statistics);
    }

    //endregion

    //region ACCESSORS E QUERY

    public boolean isSatisfiable() {
        return satisfiable;
    }

    public boolean isUnsatisfiable() {
        return !satisfiable;
    }

    /**
     * @return modello per SAT, assegnamento parziale per UNSAT (mai null)
     */
    public Map<String, Boolean> getAssignment() {
        return assignment;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getClauseCount() {
        return clauseCount;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public SATStatistics getStatistics() {
        return statistics;
    }

    public int getModelSize() {
        return satisfiable ? assignment.size() : 0;
    }

    //endregion

    //region OUTPUT E RAPPRESENTAZIONE

    /**
     * SAT seguito dal modello ordinato per nome, oppure UNSAT.
     */
    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        if (satisfiable) {
            output.append("SAT\n");
            output.append("Modello:\n");
            assignment.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(entry -> output.append(entry.getKey())
                            .append(" → ").append(entry.getValue()).append("\n"));
        } else {
            output.append("UNSAT\n");
        }
        return output.toString();
    }

    public String toCompactString() {
        return String.format("SATResult{%s, vars=%d, clauses=%d, time=%dms}",
                satisfiable ? "SAT" : "UNSAT",
                variableCount,
                clauseCount,
                statistics.getExecutionTimeMs());
    }

    public String getExecutionSummary() {
        return String.format("Esito: %s | Decisioni: %d | Propagazioni: %d | Conflitti: %d | Tempo: %dms",
                satisfiable ? "SAT" : "UNSAT",
                statistics.getDecisions(),
                statistics.getPropagations(),
                statistics.getConflicts(),
                statistics.getExecutionTimeMs());
    }

    //endregion

    //region UGUAGLIANZA

    /**
     * Uguaglianza su esito e assegnamento, le statistiche sono ignorate.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SATResult other = (SATResult) obj;
        return satisfiable == other.satisfiable &&
                Objects.equals(assignment, other.assignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(satisfiable, assignment);
    }

    //endregion
}
