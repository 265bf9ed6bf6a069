package org.satisfier.support;

import java.util.Objects;

/**
 * LETTERALE ASSEGNATO - Variabile fissata durante semplificazione o ricerca, con la sua origine
 *
 * INFORMAZIONI MEMORIZZATE:
 * • Identificazione variabile e valore assegnato
 * • Motivo dell'assegnamento (pre-assegnamento, propagazione, letterale puro, decisione, default)
 *
 * L'istanza è immutabile e può essere condivisa tra snapshot diversi dello stesso assegnamento.
 */
public final class AssignedLiteral {

    /**
     * Origine dell'assegnamento, utile per tracciamento e statistiche.
     */
    public enum Reason {
        /** Valore fornito dall'utente prima della ricerca */
        PRE_ASSIGNED,
        /** Implicazione da clausola unitaria */
        UNIT,
        /** Variabile presente con una sola polarità */
        PURE,
        /** Scelta di branching del DPLL */
        DECISION,
        /** Completamento del modello per variabili eliminate senza essere fissate */
        DEFAULT
    }

    private final int variable;
    private final boolean value;
    private final Reason reason;

    /**
     * @param variable ID numerico variabile (> 0)
     * @param value valore booleano assegnato
     * @param reason origine dell'assegnamento (non null)
     * @throws IllegalArgumentException se parametri non validi
     */
    public AssignedLiteral(int variable, boolean value, Reason reason) {
        if (variable <= 0) {
            throw new IllegalArgumentException("Variable ID deve essere > 0, ricevuto: " + variable);
        }
        if (reason == null) {
            throw new IllegalArgumentException("Reason non può essere null");
        }
        this.variable = variable;
        this.value = value;
        this.reason = reason;
    }

    public int getVariable() {
        return variable;
    }

    public boolean getValue() {
        return value;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Converte assegnamento in letterale DIMACS standard.
     * @return ID positivo se variabile true, negativo se false
     */
    public int toDIMACSLiteral() {
        return value ? variable : -variable;
    }

    @Override
    public String toString() {
        return "AssignedLiteral{var=" + variable + ", val=" + value + ", reason=" + reason + '}';
    }

    /**
     * Uguaglianza basata su variabile e valore (ignora il motivo).
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        AssignedLiteral other = (AssignedLiteral) obj;
        return variable == other.variable && value == other.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, value);
    }
}
