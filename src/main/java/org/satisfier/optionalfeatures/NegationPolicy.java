package org.satisfier.optionalfeatures;

/**
 * Trattamento di un riferimento negato a una formula memorizzata.
 */
public enum NegationPolicy {

    /**
     * Inverte il segno di ogni letterale di ogni clausola referenziata.
     * Coincide con la vera negazione solo per formule di una clausola con un letterale;
     * per formule con più clausole non è logicamente equivalente (De Morgan).
     */
    LITERAL_FLIP,

    /**
     * Negazione corretta tramite variabili ausiliarie in stile Tseitin, equisoddisfacibile.
     */
    TSEITIN
}
