package org.satisfier.dpll;

import org.satisfier.support.AssignedLiteral;
import org.satisfier.support.Assignment;
import org.satisfier.support.CNFFormula;
import org.satisfier.support.SearchStack;
import org.satisfier.support.SearchStack.Frame;

import java.util.logging.Logger;

/**
 * SOLUTORE DPLL - Ricerca con backtracking cronologico
 *
 * Per ogni nodo della ricerca:
 * 1. Propagazione unitaria (conflitto → ramo chiuso)
 * 2. Eliminazione dei letterali puri
 * 3. Formula vuota → soddisfacibile
 * 4. Branching sulla prima variabile della prima clausola, prima true poi false
 *
 * STRATEGIE DI CONTROLLO:
 * • {@link SearchStrategy#STACK}: pila esplicita di frame indipendenti
 * • {@link SearchStrategy#RECURSIVE}: visita ricorsiva
 *
 * Entrambe esplorano i nodi nello stesso ordine, quindi verdetto, modello e statistiche
 * coincidono. Ogni ramo lavora su uno snapshot dell'assegnamento: il ramo false non
 * eredita mai valori fissati nel ramo true.
 *
 * INTERRUZIONE:
 * Il solutore non gestisce timeout. Controlla il flag di interruzione del thread a
 * ogni nodo e può essere limitato con un budget massimo di decisioni.
 */
public class DPLLSolver {

    private static final Logger LOGGER = Logger.getLogger(DPLLSolver.class.getName());

    /** Budget di decisioni, 0 = illimitato */
    public static final int UNLIMITED = 0;

    private final SearchStrategy strategy;

    private final int maxDecisions;

    /** Flag per interruzione controllata da un altro thread */
    private volatile boolean interrupted = false;

    //region STATO DELLA SINGOLA RISOLUZIONE

    private SATStatistics statistics;

    private Simplifier simplifier;

    /** Assegnamento dell'ultimo ramo chiuso da un conflitto */
    private Assignment lastConflict;

    //endregion

    public DPLLSolver() {
        this(SearchStrategy.STACK, UNLIMITED);
    }

    /**
     * @param strategy strategia di controllo della ricerca
     * @param maxDecisions numero massimo di rami esplorabili, {@link #UNLIMITED} per nessun limite
     */
    public DPLLSolver(SearchStrategy strategy, int maxDecisions) {
        if (strategy == null) {
            throw new IllegalArgumentException("Strategia di ricerca null");
        }
        if (maxDecisions < 0) {
            throw new IllegalArgumentException("Limite di decisioni negativo: " + maxDecisions);
        }
        this.strategy = strategy;
        this.maxDecisions = maxDecisions;
    }

    //region RISOLUZIONE

    /**
     * Decide la soddisfacibilità della formula.
     *
     * @param formula formula già semplificata dagli eventuali pre-assegnamenti
     * @param initial pre-assegnamenti (non modificati)
     * @param variableCount numero di variabili del registro, usato per completare il modello
     * @return esito con modello completo oppure assegnamento parziale dell'ultimo conflitto
     * @throws SearchInterruptedException se il thread viene interrotto
     * @throws SearchLimitExceededException se il budget di decisioni viene superato
     */
    public SearchOutcome solve(CNFFormula formula, Assignment initial, int variableCount) {
        this.statistics = new SATStatistics();
        this.simplifier = new Simplifier(statistics);
        this.lastConflict = initial.snapshot();
        this.interrupted = false;

        LOGGER.fine(() -> String.format("Avvio ricerca DPLL (%s): %d clausole, %d variabili",
                strategy, formula.getClausesCount(), variableCount));

        try {
            Assignment model = strategy == SearchStrategy.STACK
                    ? searchWithStack(formula, initial.snapshot())
                    : searchRecursively(formula, initial.snapshot(), 0);

            if (model != null) {
                completeModel(model, variableCount);
                LOGGER.fine(() -> "Formula soddisfacibile - " + statistics);
                return new SearchOutcome(true, model, statistics);
            }
            LOGGER.fine(() -> "Formula insoddisfacibile - " + statistics);
            return new SearchOutcome(false, lastConflict, statistics);
        } finally {
            statistics.stopTimer();
        }
    }

    /**
     * Richiede l'interruzione della ricerca in corso.
     */
    public void interrupt() {
        this.interrupted = true;
    }

    /**
     * Statistiche dell'ultima risoluzione, anche se interrotta; null prima della prima chiamata a solve.
     */
    public SATStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region STRATEGIA A PILA ESPLICITA

    private Assignment searchWithStack(CNFFormula formula, Assignment initial) {
        SearchStack stack = new SearchStack();
        stack.push(new Frame(formula, initial, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.depth() > 0) {
                enterBranch(frame.depth());
            }

            Assignment assignment = frame.assignment();
            CNFFormula residual = simplify(frame.formula(), assignment);
            if (residual == null) {
                continue;
            }
            if (residual.isEmpty()) {
                return assignment;
            }

            int variable = chooseVariable(residual);
            int nextDepth = frame.depth() + 1;

            // false prima di true: l'estrazione LIFO esplora per primo il ramo true
            stack.push(branch(residual, assignment, variable, false, nextDepth));
            stack.push(branch(residual, assignment, variable, true, nextDepth));
        }
        return null;
    }

    //endregion

    //region STRATEGIA RICORSIVA

    private Assignment searchRecursively(CNFFormula formula, Assignment assignment, int depth) {
        if (depth > 0) {
            enterBranch(depth);
        }

        CNFFormula residual = simplify(formula, assignment);
        if (residual == null) {
            return null;
        }
        if (residual.isEmpty()) {
            return assignment;
        }

        int variable = chooseVariable(residual);
        for (boolean value : new boolean[]{true, false}) {
            Frame child = branch(residual, assignment, variable, value, depth + 1);
            Assignment model = searchRecursively(child.formula(), child.assignment(), child.depth());
            if (model != null) {
                return model;
            }
        }
        return null;
    }

    //endregion

    //region PASSI COMUNI

    /**
     * Applica le regole di semplificazione al nodo corrente.
     *
     * @return formula residua, null se il ramo termina in conflitto
     */
    private CNFFormula simplify(CNFFormula formula, Assignment assignment) {
        checkInterruption();

        PropagationResult propagation = simplifier.unitPropagate(formula, assignment);
        if (propagation.hasConflict()) {
            statistics.incrementConflicts();
            lastConflict = assignment;
            LOGGER.finer(() -> "Conflitto con assegnamento " + assignment);
            return null;
        }
        return simplifier.eliminatePureLiterals(propagation.getFormula(), assignment);
    }

    private static int chooseVariable(CNFFormula formula) {
        return Math.abs(formula.getClauses().get(0).get(0));
    }

    private static Frame branch(CNFFormula formula, Assignment assignment, int variable, boolean value, int depth) {
        Assignment branchAssignment = assignment.snapshot();
        branchAssignment.record(variable, value, AssignedLiteral.Reason.DECISION);
        return new Frame(Simplifier.assign(formula, variable, value), branchAssignment, depth);
    }

    private void enterBranch(int depth) {
        statistics.incrementDecisions();
        statistics.recordDepth(depth);
        if (maxDecisions != UNLIMITED && statistics.getDecisions() > maxDecisions) {
            LOGGER.warning("Budget di decisioni esaurito (" + maxDecisions + ")");
            throw new SearchLimitExceededException(maxDecisions);
        }
    }

    private void checkInterruption() {
        if (interrupted || Thread.currentThread().isInterrupted()) {
            throw new SearchInterruptedException("Ricerca DPLL interrotta dopo "
                    + statistics.getDecisions() + " decisioni");
        }
    }

    /**
     * Le variabili eliminate senza essere fissate ricevono false.
     */
    private static void completeModel(Assignment model, int variableCount) {
        for (int variable = 1; variable <= variableCount; variable++) {
            if (!model.contains(variable)) {
                model.record(variable, false, AssignedLiteral.Reason.DEFAULT);
            }
        }
    }

    //endregion
}
