package org.satisfier.cnf;

import org.satisfier.SatisfierException;

/**
 * Formula malformata: parentesi sbilanciate, operatori mancanti, token non riconosciuti
 * o nomi vuoti. Riporta la posizione del primo errore incontrato.
 */
public class FormulaSyntaxException extends SatisfierException {

    private final int line;
    private final int column;

    public FormulaSyntaxException(String message, int line, int column) {
        super("Errore di sintassi alla riga " + line + ", colonna " + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
