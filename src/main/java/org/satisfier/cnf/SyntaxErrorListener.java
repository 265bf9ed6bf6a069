package org.satisfier.cnf;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Trasforma il primo errore di lexer o parser ANTLR in {@link FormulaSyntaxException},
 * invece di stamparlo su stderr e proseguire con il recupero.
 */
class SyntaxErrorListener extends BaseErrorListener {

    static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        throw new FormulaSyntaxException(msg, line, charPositionInLine + 1);
    }
}
