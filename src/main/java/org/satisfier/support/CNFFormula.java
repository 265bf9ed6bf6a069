package org.satisfier.support;

import java.util.*;
import java.util.stream.Collectors;

/**
 * FORMULA CNF IMMUTABILE - Congiunzione ordinata di clausole numeriche
 *
 * Ogni clausola è una List<Integer> di letterali in formato DIMACS:
 * - Valori positivi: variabile non negata
 * - Valori negativi: variabile negata
 * - Il letterale 0 non è mai ammesso
 *
 * SEMANTICA:
 * - Formula senza clausole: soddisfatta
 * - Clausola senza letterali: contraddizione
 * - L'ordine delle clausole e dei letterali influenza solo la scelta della variabile
 *   di branching, mai la soddisfacibilità
 *
 * IMMUTABILITÀ:
 * Clausole e lista esterna sono copie non modificabili. Le semplificazioni producono
 * sempre una nuova istanza, così i rami indipendenti della ricerca possono partire
 * dalla stessa formula senza osservare le eliminazioni l'uno dell'altro.
 */
public final class CNFFormula {

    /** Formula senza clausole, banalmente soddisfatta */
    public static final CNFFormula EMPTY = new CNFFormula(List.of());

    private final List<List<Integer>> clauses;

    //region COSTRUZIONE

    /**
     * Costruisce la formula copiando le clausole in liste non modificabili.
     *
     * @param clauses clausole in formato numerico (non null)
     * @throws IllegalArgumentException se una clausola o un letterale è null oppure un letterale vale 0
     */
    public CNFFormula(List<? extends List<Integer>> clauses) {
        if (clauses == null) {
            throw new IllegalArgumentException("Lista clausole null");
        }

        List<List<Integer>> copy = new ArrayList<>(clauses.size());
        for (int clauseIndex = 0; clauseIndex < clauses.size(); clauseIndex++) {
            List<Integer> clause = clauses.get(clauseIndex);
            if (clause == null) {
                throw new IllegalArgumentException("Clausola null in posizione " + clauseIndex);
            }
            for (Integer literal : clause) {
                if (literal == null || literal == 0) {
                    throw new IllegalArgumentException("Letterale non valido in clausola " + clauseIndex + ": " + literal);
                }
            }
            copy.add(List.copyOf(clause));
        }
        this.clauses = Collections.unmodifiableList(copy);
    }

    /**
     * Costruzione rapida da array di letterali, comoda per test e formule costanti.
     */
    public static CNFFormula of(int[]... clauses) {
        List<List<Integer>> converted = new ArrayList<>(clauses.length);
        for (int[] clause : clauses) {
            List<Integer> literals = new ArrayList<>(clause.length);
            for (int literal : clause) {
                literals.add(literal);
            }
            converted.add(literals);
        }
        return new CNFFormula(converted);
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @return vista non modificabile delle clausole
     */
    public List<List<Integer>> getClauses() {
        return clauses;
    }

    public int getClausesCount() {
        return clauses.size();
    }

    /**
     * @return true se la formula non contiene clausole (soddisfatta)
     */
    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /**
     * @return true se almeno una clausola è vuota (contraddizione)
     */
    public boolean hasEmptyClause() {
        for (List<Integer> clause : clauses) {
            if (clause.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return insieme delle variabili (ID senza segno) menzionate, in ordine di apparizione
     */
    public Set<Integer> getVariables() {
        Set<Integer> variables = new LinkedHashSet<>();
        for (List<Integer> clause : clauses) {
            for (Integer literal : clause) {
                variables.add(Math.abs(literal));
            }
        }
        return variables;
    }

    /**
     * Valuta la formula rispetto a un assegnamento: ogni clausola deve avere almeno
     * un letterale vero. Le variabili non assegnate non rendono vero alcun letterale.
     *
     * @param assignment assegnamento da verificare
     * @return true se tutte le clausole sono soddisfatte
     */
    public boolean isSatisfiedBy(Assignment assignment) {
        for (List<Integer> clause : clauses) {
            boolean satisfied = false;
            for (Integer literal : clause) {
                Boolean value = assignment.valueOf(Math.abs(literal));
                if (value != null && value == (literal > 0)) {
                    satisfied = true;
                    break;
                }
            }
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    //endregion

    //region RAPPRESENTAZIONE

    /**
     * Rappresentazione con i nomi originali delle variabili, es. (a ∨ ¬b) ∧ (c).
     */
    public String toReadableString(VariableRegistry registry) {
        if (clauses.isEmpty()) {
            return "⊤";
        }
        return clauses.stream()
                .map(clause -> clause.stream()
                        .map(literal -> (literal < 0 ? "¬" : "") + registry.nameOf(Math.abs(literal)))
                        .collect(Collectors.joining(" ∨ ", "(", ")")))
                .collect(Collectors.joining(" ∧ "));
    }

    @Override
    public String toString() {
        return clauses.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return clauses.equals(((CNFFormula) obj).clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    //endregion
}
