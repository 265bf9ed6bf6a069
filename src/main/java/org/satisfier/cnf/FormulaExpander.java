package org.satisfier.cnf;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.satisfier.antlr.CnfFormulaBaseVisitor;
import org.satisfier.antlr.CnfFormulaLexer;
import org.satisfier.antlr.CnfFormulaParser;
import org.satisfier.antlr.CnfFormulaParser.BareNameContext;
import org.satisfier.antlr.CnfFormulaParser.ClauseContext;
import org.satisfier.antlr.CnfFormulaParser.FormulaContext;
import org.satisfier.antlr.CnfFormulaParser.LiteralContext;
import org.satisfier.antlr.CnfFormulaParser.NameContext;
import org.satisfier.antlr.CnfFormulaParser.QuotedNameContext;
import org.satisfier.optionalfeatures.NegationPolicy;
import org.satisfier.optionalfeatures.TseitinNegation;
import org.satisfier.support.CNFFormula;
import org.satisfier.support.VariableRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER ED ESPANSORE DI SOSTITUZIONI - Da testo CNF a clausole numeriche
 *
 * Visita l'albero sintattico prodotto dalla grammatica CnfFormula e costruisce le clausole
 * numeriche, internando i nomi nel registro condiviso e sostituendo i riferimenti a formule
 * memorizzate con le loro clausole.
 *
 * SINTASSI:
 * - Formula: clausole parentesizzate unite da AND (oppure /\)
 * - Clausola: letterali uniti da OR (oppure \/), una clausola vuota () viene scartata
 * - Letterale: NOT (oppure !) facoltativo seguito da un nome tra virgolette o identificatore
 *
 * SOSTITUZIONE:
 * Ogni nome viene prima cercato nel repository. Se esiste una formula con quel nome, il suo
 * testo viene espanso ricorsivamente con lo stesso {@link ExpansionContext}; il riferimento
 * è una disgiunzione con gli altri letterali della clausola e viene distribuito:
 *   ("R" OR "j") con R = (A) AND (B)  →  (A ∨ j) ∧ (B ∨ j)
 * Un riferimento da solo nella clausola contribuisce quindi esattamente le clausole di R.
 * Un riferimento negato segue la {@link NegationPolicy} del contesto.
 *
 * VALUTAZIONE:
 * Ogni visita restituisce una lista di alternative (liste di letterali): il letterale
 * semplice produce una sola alternativa, il riferimento una per clausola referenziata.
 */
public class FormulaExpander extends CnfFormulaBaseVisitor<List<List<Integer>>> {

    private static final Logger LOGGER = Logger.getLogger(FormulaExpander.class.getName());

    private final ExpansionContext context;

    private final TseitinNegation tseitinNegation = new TseitinNegation();

    public FormulaExpander(ExpansionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("ExpansionContext null");
        }
        this.context = context;
    }

    //region PUNTO DI INGRESSO

    /**
     * METODO PRINCIPALE - Espande una formula di primo livello
     *
     * PIPELINE:
     * 1. Lexing e parsing ANTLR con errori convertiti in eccezioni
     * 2. Visita dell'albero con sostituzione ricorsiva dei riferimenti
     * 3. Accodamento delle eventuali definizioni ausiliarie (negazione Tseitin)
     * 4. Costruzione della formula immutabile
     *
     * @param text testo grezzo della formula
     * @param context contesto di espansione della risoluzione corrente
     * @return formula espansa con il registro delle variabili
     * @throws FormulaSyntaxException se il testo, o quello di una formula referenziata, è malformato
     * @throws CyclicReferenceException se i riferimenti formano un ciclo
     */
    public static ParsedFormula expand(String text, ExpansionContext context) {
        LOGGER.fine("Inizio espansione formula: " + text);

        List<List<Integer>> clauses = new ArrayList<>(new FormulaExpander(context).expandText(text));
        clauses.addAll(context.drainDefinitions());

        CNFFormula formula = new CNFFormula(clauses);
        VariableRegistry registry = context.getRegistry();

        LOGGER.info(String.format("Formula espansa: %d clausole, %d variabili, %d formule referenziate",
                formula.getClausesCount(), registry.size(), context.getReferencedFormulas().size()));
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Clausole: " + formula.toReadableString(registry));
        }

        return new ParsedFormula(formula, registry, context.getReferencedFormulas());
    }

    /**
     * Esegue lexing, parsing e visita di un testo senza accodare le definizioni ausiliarie.
     */
    List<List<Integer>> expandText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo formula null");
        }

        CharStream input = CharStreams.fromString(text);
        CnfFormulaLexer lexer = new CnfFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        CnfFormulaParser parser = new CnfFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        return visit(tree);
    }

    //endregion

    //region FORMULA E CLAUSOLE

    @Override
    public List<List<Integer>> visitFormula(FormulaContext ctx) {
        List<List<Integer>> clauses = new ArrayList<>();
        for (ClauseContext clauseCtx : ctx.clause()) {
            clauses.addAll(visit(clauseCtx));
        }
        return clauses;
    }

    /**
     * Costruisce una clausola distribuendo le alternative di ogni letterale.
     * Le clausole rimaste senza letterali vengono scartate.
     */
    @Override
    public List<List<Integer>> visitClause(ClauseContext ctx) {
        List<List<Integer>> partials = new ArrayList<>();
        partials.add(new ArrayList<>());

        // Tutti i letterali vengono visitati anche a clausola già soddisfatta,
        // così registro e controllo dei cicli vedono l'intera formula
        for (LiteralContext literalCtx : ctx.literal()) {
            partials = distribute(partials, visit(literalCtx));
        }

        List<List<Integer>> clauses = new ArrayList<>(partials.size());
        for (List<Integer> partial : partials) {
            if (partial.isEmpty()) {
                LOGGER.finest("Clausola vuota scartata");
            } else {
                clauses.add(partial);
            }
        }
        return clauses;
    }

    private static List<List<Integer>> distribute(List<List<Integer>> partials, List<List<Integer>> alternatives) {
        List<List<Integer>> combined = new ArrayList<>(partials.size() * Math.max(1, alternatives.size()));
        for (List<Integer> partial : partials) {
            for (List<Integer> alternative : alternatives) {
                List<Integer> clause = new ArrayList<>(partial.size() + alternative.size());
                clause.addAll(partial);
                clause.addAll(alternative);
                combined.add(clause);
            }
        }
        return combined;
    }

    //endregion

    //region LETTERALI E RIFERIMENTI

    @Override
    public List<List<Integer>> visitLiteral(LiteralContext ctx) {
        boolean negated = ctx.NOT() != null;
        String name = extractName(ctx.name());

        Optional<String> storedText = context.getRepository().lookup(name);
        if (storedText.isPresent()) {
            return expandReference(name, storedText.get(), negated);
        }

        int variable = context.getRegistry().intern(name);
        List<List<Integer>> alternatives = new ArrayList<>(1);
        alternatives.add(List.of(negated ? -variable : variable));
        return alternatives;
    }

    /**
     * Espande ricorsivamente una formula memorizzata con lo stesso contesto.
     */
    private List<List<Integer>> expandReference(String name, String storedText, boolean negated) {
        LOGGER.fine("Espansione riferimento " + (negated ? "negato " : "") + "a formula memorizzata: " + name);

        List<List<Integer>> referenced;
        context.enter(name);
        try {
            referenced = new FormulaExpander(context).expandText(storedText);
        } catch (FormulaSyntaxException e) {
            LOGGER.warning("Formula memorizzata " + name + " non valida: " + e.getMessage());
            throw e;
        } finally {
            context.exit(name);
        }

        if (!negated) {
            return referenced;
        }

        return switch (context.getNegationPolicy()) {
            case LITERAL_FLIP -> flipLiterals(name, referenced);
            case TSEITIN -> tseitinNegation.negate(name, referenced, context);
        };
    }

    /**
     * Negazione per inversione dei segni: ogni clausola invertita diventa un'alternativa.
     */
    private List<List<Integer>> flipLiterals(String name, List<List<Integer>> referenced) {
        if (referenced.isEmpty()) {
            // Negazione di una formula vera: nessun letterale
            List<List<Integer>> none = new ArrayList<>(1);
            none.add(List.of());
            return none;
        }
        if (referenced.size() > 1) {
            LOGGER.fine("Negazione per inversione dei letterali di " + name + " con " + referenced.size()
                    + " clausole: risultato non equivalente alla negazione logica");
        }

        List<List<Integer>> flipped = new ArrayList<>(referenced.size());
        for (List<Integer> clause : referenced) {
            List<Integer> inverted = new ArrayList<>(clause.size());
            for (Integer literal : clause) {
                inverted.add(-literal);
            }
            flipped.add(inverted);
        }
        return flipped;
    }

    /**
     * Estrae il nome del letterale, rimuovendo le virgolette.
     *
     * @throws FormulaSyntaxException se il nome tra virgolette è vuoto
     */
    private static String extractName(NameContext nameCtx) {
        if (nameCtx instanceof QuotedNameContext quoted) {
            String text = quoted.QUOTED().getText();
            String name = text.substring(1, text.length() - 1);
            if (name.isEmpty()) {
                Token token = quoted.getStart();
                throw new FormulaSyntaxException("nome di variabile vuoto", token.getLine(),
                        token.getCharPositionInLine() + 1);
            }
            return name;
        }
        return ((BareNameContext) nameCtx).IDENTIFIER().getText();
    }

    //endregion
}
