package org.satisfier.dpll;

import org.satisfier.support.AssignedLiteral;
import org.satisfier.support.Assignment;
import org.satisfier.support.CNFFormula;

import java.util.*;
import java.util.logging.Logger;

/**
 * SIMPLIFIER - Regole di semplificazione della procedura DPLL
 *
 * OPERAZIONI:
 * • assign: applica un valore a una variabile producendo una nuova formula
 * • Propagazione unitaria fino al punto fisso o al primo conflitto
 * • Eliminazione dei letterali puri in un unico passaggio
 *
 * Le formule in ingresso non vengono mai modificate; l'assegnamento passato ai
 * metodi di istanza viene esteso con le variabili fissate, ciascuna con la propria
 * motivazione.
 */
public class Simplifier {

    private static final Logger LOGGER = Logger.getLogger(Simplifier.class.getName());

    private final SATStatistics statistics;

    public Simplifier(SATStatistics statistics) {
        this.statistics = statistics;
    }

    //region ASSEGNAMENTO

    /**
     * Applica variable := value alla formula.
     * Le clausole soddisfatte vengono rimosse, il letterale falsificato viene tolto
     * dalle altre. Le clausole che non menzionano la variabile restano invariate.
     *
     * @param formula formula di partenza (non modificata)
     * @param variable ID variabile (> 0)
     * @param value valore assegnato
     * @return nuova formula semplificata
     */
    public static CNFFormula assign(CNFFormula formula, int variable, boolean value) {
        if (variable <= 0) {
            throw new IllegalArgumentException("ID variabile non valido: " + variable);
        }
        int satisfiedLiteral = value ? variable : -variable;
        int falsifiedLiteral = -satisfiedLiteral;

        List<List<Integer>> result = new ArrayList<>(formula.getClausesCount());
        for (List<Integer> clause : formula.getClauses()) {
            if (clause.contains(satisfiedLiteral)) {
                continue;
            }
            if (clause.contains(falsifiedLiteral)) {
                List<Integer> reduced = new ArrayList<>(clause.size() - 1);
                for (Integer literal : clause) {
                    if (literal != falsifiedLiteral) {
                        reduced.add(literal);
                    }
                }
                result.add(reduced);
            } else {
                result.add(clause);
            }
        }
        return new CNFFormula(result);
    }

    //endregion

    //region PROPAGAZIONE UNITARIA

    /**
     * Propaga ripetutamente la prima clausola unitaria della formula.
     * Si ferma al primo conflitto: una formula che contiene già la clausola vuota
     * è immediatamente in conflitto.
     *
     * @param formula formula da semplificare
     * @param assignment assegnamento del ramo, esteso con le variabili propagate
     * @return formula al punto fisso oppure conflitto
     */
    public PropagationResult unitPropagate(CNFFormula formula, Assignment assignment) {
        CNFFormula current = formula;

        while (true) {
            if (current.hasEmptyClause()) {
                LOGGER.finer("Conflitto durante la propagazione unitaria");
                return PropagationResult.conflict(current);
            }

            Integer unit = findFirstUnit(current);
            if (unit == null) {
                return PropagationResult.success(current);
            }

            int variable = Math.abs(unit);
            boolean value = unit > 0;
            assignment.record(variable, value, AssignedLiteral.Reason.UNIT);
            statistics.incrementPropagations();
            current = assign(current, variable, value);
        }
    }

    private static Integer findFirstUnit(CNFFormula formula) {
        for (List<Integer> clause : formula.getClauses()) {
            if (clause.size() == 1) {
                return clause.get(0);
            }
        }
        return null;
    }

    //endregion

    //region LETTERALI PURI

    /**
     * Assegna i letterali che compaiono con una sola polarità, nell'ordine
     * della loro prima occorrenza. Un solo passaggio di conteggio.
     *
     * @param formula formula priva di conflitti
     * @param assignment assegnamento del ramo, esteso con i letterali puri
     * @return formula senza le clausole soddisfatte dai letterali puri
     */
    public CNFFormula eliminatePureLiterals(CNFFormula formula, Assignment assignment) {
        Map<Integer, Integer> occurrences = new LinkedHashMap<>();
        for (List<Integer> clause : formula.getClauses()) {
            for (Integer literal : clause) {
                occurrences.merge(literal, 1, Integer::sum);
            }
        }

        CNFFormula current = formula;
        for (Integer literal : occurrences.keySet()) {
            if (occurrences.containsKey(-literal)) {
                continue;
            }
            int variable = Math.abs(literal);
            boolean value = literal > 0;
            assignment.record(variable, value, AssignedLiteral.Reason.PURE);
            statistics.incrementPureLiterals();
            current = assign(current, variable, value);
        }
        return current;
    }

    //endregion
}
