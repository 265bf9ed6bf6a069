package org.satisfier.support;

import java.util.Stack;
import java.util.logging.Logger;

/**
 * SEARCH STACK - Pila esplicita di frame indipendenti per la ricerca DPLL
 *
 * Sostituisce la ricorsione della procedura DPLL con frame posseduti singolarmente:
 * ogni frame contiene la formula già semplificata per il proprio ramo e uno snapshot
 * dell'assegnamento che nessun altro frame condivide.
 *
 * ORDINE DI ESPLORAZIONE:
 * • Estrazione LIFO
 * • Il chiamante inserisce il ramo false prima del ramo true, così il ramo true
 *   viene esplorato per primo e l'ordine coincide con la visita ricorsiva
 *
 * La memoria occupata cresce con il numero di frame in attesa, non con la profondità
 * dello stack di chiamate Java.
 */
public class SearchStack {

    private static final Logger LOGGER = Logger.getLogger(SearchStack.class.getName());

    /**
     * Frame della ricerca: formula residua, assegnamento del ramo e profondità di decisione.
     */
    public record Frame(CNFFormula formula, Assignment assignment, int depth) {
        public Frame {
            if (formula == null || assignment == null) {
                throw new IllegalArgumentException("Frame con formula o assegnamento null");
            }
            if (depth < 0) {
                throw new IllegalArgumentException("Profondità negativa: " + depth);
            }
        }
    }

    private final Stack<Frame> frames;

    /** Numero massimo di frame contemporaneamente in attesa */
    private int peakSize;

    public SearchStack() {
        this.frames = new Stack<>();
        this.peakSize = 0;
    }

    public void push(Frame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("Frame null");
        }
        frames.push(frame);
        peakSize = Math.max(peakSize, frames.size());

        LOGGER.finest(() -> String.format("Frame inserito: profondità=%d, clausole=%d, altezza_stack=%d",
                frame.depth(), frame.formula().getClausesCount(), frames.size()));
    }

    /**
     * @return frame in cima alla pila
     * @throws IllegalStateException se la pila è vuota
     */
    public Frame pop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Stack vuoto - nessun frame da estrarre");
        }
        return frames.pop();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int size() {
        return frames.size();
    }

    public int getPeakSize() {
        return peakSize;
    }
}
