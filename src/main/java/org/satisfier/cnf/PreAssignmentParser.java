package org.satisfier.cnf;

import java.util.*;
import java.util.logging.Logger;

/**
 * Legge i pre-assegnamenti nel formato testuale {@code R := true, S := false}.
 *
 * Le voci malformate (separatore mancante, nome vuoto, valore diverso da true/false)
 * vengono scartate con un avviso. Se lo stesso nome compare più volte vale l'ultima voce.
 * Gli avvisi dell'ultima lettura restano disponibili tramite {@link #getWarnings()}.
 */
public class PreAssignmentParser {

    private static final Logger LOGGER = Logger.getLogger(PreAssignmentParser.class.getName());

    private static final String ITEM_SEPARATOR = ",";
    private static final String VALUE_SEPARATOR = ":=";

    private final List<String> warnings = new ArrayList<>();

    /**
     * @param input testo dei pre-assegnamenti, null o vuoto per nessun pre-assegnamento
     * @return mappa ordinata nome → valore
     */
    public Map<String, Boolean> parse(String input) {
        warnings.clear();
        Map<String, Boolean> assignments = new LinkedHashMap<>();

        if (input == null || input.isBlank()) {
            return assignments;
        }

        for (String item : input.split(ITEM_SEPARATOR)) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            String[] parts = trimmed.split(VALUE_SEPARATOR, -1);
            if (parts.length != 2) {
                warn("Formato di assegnamento non valido: '" + trimmed + "'. Atteso 'Var := valore'");
                continue;
            }

            String name = stripQuotes(parts[0].trim());
            String valueText = parts[1].trim();

            if (name.isEmpty()) {
                warn("Nome di variabile mancante in: '" + trimmed + "'");
                continue;
            }

            Boolean value = parseBoolean(valueText);
            if (value == null) {
                warn("Valore non valido per " + name + ": '" + valueText + "'. Ammessi true o false");
                continue;
            }

            Boolean previous = assignments.remove(name);
            if (previous != null) {
                warn("Variabile " + name + " assegnata più volte, vale l'ultimo valore (" + value + ")");
            }
            assignments.put(name, value);
        }

        LOGGER.fine("Pre-assegnamenti letti: " + assignments);
        return assignments;
    }

    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    private void warn(String message) {
        warnings.add(message);
        LOGGER.warning(message);
    }

    private static Boolean parseBoolean(String text) {
        if ("true".equalsIgnoreCase(text)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(text)) return Boolean.FALSE;
        return null;
    }

    /**
     * Accetta anche nomi scritti tra virgolette come nella formula.
     */
    private static String stripQuotes(String name) {
        if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
            return name.substring(1, name.length() - 1);
        }
        return name;
    }
}
