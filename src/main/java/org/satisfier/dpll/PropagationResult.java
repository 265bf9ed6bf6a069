package org.satisfier.dpll;

import org.satisfier.support.CNFFormula;

/**
 * Esito della propagazione unitaria: formula semplificata oppure conflitto.
 * Il conflitto è un valore di ritorno, mai un'eccezione.
 */
public final class PropagationResult {

    private final CNFFormula formula;
    private final boolean conflict;

    private PropagationResult(CNFFormula formula, boolean conflict) {
        this.formula = formula;
        this.conflict = conflict;
    }

    public static PropagationResult success(CNFFormula formula) {
        return new PropagationResult(formula, false);
    }

    public static PropagationResult conflict(CNFFormula formula) {
        return new PropagationResult(formula, true);
    }

    public boolean hasConflict() {
        return conflict;
    }

    /**
     * @return formula al punto fisso, oppure quella contenente la clausola vuota in caso di conflitto
     */
    public CNFFormula getFormula() {
        return formula;
    }

    @Override
    public String toString() {
        return conflict ? "PropagationResult{CONFLICT}" : "PropagationResult{OK, clausole=" + formula.getClausesCount() + "}";
    }
}
