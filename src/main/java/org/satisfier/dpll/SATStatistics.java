package org.satisfier.dpll;

/**
 * STATISTICHE SAT - Metriche di esecuzione della ricerca DPLL
 *
 * Raccoglie contatori e tempi durante la risoluzione. Le due strategie di controllo
 * della ricerca visitano i nodi nello stesso ordine e producono contatori identici.
 */
public class SATStatistics {

    //region CONTATORI METRICHE CORE

    /**
     * Rami esplorati dopo una scelta di branching.
     */
    private int decisions = 0;

    /**
     * Variabili fissate da clausole unitarie.
     */
    private int propagations = 0;

    /**
     * Variabili fissate dall'eliminazione dei letterali puri.
     */
    private int pureLiterals = 0;

    /**
     * Rami chiusi da una clausola vuota.
     */
    private int conflicts = 0;

    /**
     * Profondità massima di decisione raggiunta.
     */
    private int maxDepth = 0;

    //endregion

    //region TIMING

    private long executionTimeMs = 0;

    private final long startTime;

    private boolean timerStopped = false;

    //endregion

    /**
     * Inizializza le statistiche avviando il timer.
     */
    public SATStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region OPERAZIONI DI INCREMENTO CONTATORI

    public synchronized void incrementDecisions() {
        decisions++;
    }

    public synchronized void incrementPropagations() {
        propagations++;
    }

    public synchronized void incrementPureLiterals() {
        pureLiterals++;
    }

    public synchronized void incrementConflicts() {
        conflicts++;
    }

    public synchronized void recordDepth(int depth) {
        if (depth > maxDepth) {
            maxDepth = depth;
        }
    }

    //endregion

    //region GESTIONE TIMING

    /**
     * Ferma il timer. Operazione idempotente.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo di esecuzione in ms (parziale se il timer è ancora attivo)
     */
    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    //endregion

    //region ACCESSORS

    public synchronized int getDecisions() {
        return decisions;
    }

    public synchronized int getPropagations() {
        return propagations;
    }

    public synchronized int getPureLiterals() {
        return pureLiterals;
    }

    public synchronized int getConflicts() {
        return conflicts;
    }

    public synchronized int getMaxDepth() {
        return maxDepth;
    }

    //endregion

    /**
     * @return riepilogo compatto per log e console
     */
    @Override
    public String toString() {
        return String.format("Decisioni: %d | Propagazioni: %d | Letterali puri: %d | Conflitti: %d | Profondità max: %d | Tempo: %dms",
                getDecisions(), getPropagations(), getPureLiterals(), getConflicts(), getMaxDepth(), getExecutionTimeMs());
    }
}
