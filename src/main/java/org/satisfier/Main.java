package org.satisfier;

import org.satisfier.cnf.PreAssignmentParser;
import org.satisfier.dpll.SATResult;
import org.satisfier.dpll.SearchStrategy;
import org.satisfier.optionalfeatures.NegationPolicy;
import org.satisfier.repository.FormulaRecord;
import org.satisfier.repository.FormulaRepository;
import org.satisfier.repository.JsonFormulaRepository;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * SATISFIER - Verifica di soddisfacibilità di formule in Forma Normale Congiuntiva
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula da file (-f), da linea di comando (-e) o da sessione interattiva (-i)
 * 2. ESPANSIONE: i nomi di formule memorizzate vengono sostituiti con le loro clausole
 * 3. PRE-ASSEGNAMENTI: valori imposti dall'utente prima della ricerca (-a)
 * 4. RISOLUZIONE: algoritmo DPLL con propagazione unitaria e letterali puri
 * 5. MEMORIZZAZIONE: le formule soddisfacibili con nome vengono salvate nello store JSON (-s)
 *
 * OPZIONI FACOLTATIVE (-opt=):
 * - tseitin: negazione logicamente corretta dei riferimenti negati
 * - recursive: ricerca ricorsiva al posto della pila esplicita
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String NAME_PARAM = "-n";
    private static final String ASSIGN_PARAM = "-a";
    private static final String COMMENT_PARAM = "-c";
    private static final String STORE_PARAM = "-s";
    private static final String LIST_PARAM = "-l";
    private static final String INTERACTIVE_PARAM = "-i";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String OPT_PARAM = "-opt=";

    /**
     * Flag opzioni disponibili
     * */
    private static final String OPT_TSEITIN = "tseitin";
    private static final String OPT_RECURSIVE = "recursive";

    private static final String DEFAULT_STORE_FILE = "formulas.json";
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    private static final String LOGGING_CONFIG = "/logging.properties";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * FLUSSO ESECUZIONE:
     * 1. Configurazione del logging
     * 2. Parsing e validazione parametri linea di comando
     * 3. Esecuzione della modalità richiesta (elenco, interattiva, formula singola)
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO SATISFIER <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            SatisfierConfiguration config = parseAndValidateArguments(args);
            if (config == null) return;

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE SATISFIER <---");
        }
    }

    private static void executeMainPipeline(SatisfierConfiguration config) {
        FormulaRepository repository = new JsonFormulaRepository(Path.of(config.storePath));
        Satisfier satisfier = new Satisfier(repository, config.negationPolicy, config.searchStrategy);

        if (config.isListMode) {
            System.out.println("[I] Modalità: Elenco formule memorizzate");
            printStoredFormulas(repository);
        } else if (config.isInteractiveMode) {
            System.out.println("[I] Modalità: Sessione interattiva");
            runInteractiveSession(satisfier, config);
        } else {
            System.out.println("[I] Modalità: Formula singola");
            SolveRequest request = new SolveRequest(config.formulaName, config.formulaText,
                    parsePreAssignments(config.preAssignmentText), config.comment);
            processRequest(satisfier, request, config.timeoutSeconds);
        }
    }

    /**
     * Registra l'errore critico e termina con codice di errore.
     */
    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    /**
     * Carica logging.properties dal classpath. In sua assenza resta la configurazione della JVM.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione del logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static SatisfierConfiguration parseAndValidateArguments(String[] args) {
        try {
            ArgumentParser parser = new ArgumentParser();
            return parser.parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(SatisfierConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE SATISFIER <<--");
        System.out.println("Store: " + config.storePath);

        if (!config.isListMode) {
            if (!config.isInteractiveMode) {
                System.out.println("Formula: " + (config.formulaName != null ? config.formulaName : "(anonima)"));
            }
            System.out.println("Timeout: " + config.timeoutSeconds + " secondi");

            List<String> activeOpts = buildActiveOptionsList(config);
            System.out.println("Opzioni aggiuntive: " + (activeOpts.isEmpty() ? "Nessuna" : String.join(", ", activeOpts)));
        }
        System.out.println("====================================\n");
    }

    private static List<String> buildActiveOptionsList(SatisfierConfiguration config) {
        List<String> activeOpts = new ArrayList<>();
        if (config.negationPolicy == NegationPolicy.TSEITIN) activeOpts.add("Negazione Tseitin");
        if (config.searchStrategy == SearchStrategy.RECURSIVE) activeOpts.add("Ricerca ricorsiva");
        return activeOpts;
    }

    //endregion

    //region RISOLUZIONE

    /**
     * Risolve una richiesta e stampa l'esito. Gli errori della formula vengono riportati
     * senza interrompere il chiamante.
     */
    private static void processRequest(Satisfier satisfier, SolveRequest request, int timeoutSeconds) {
        String label = request.isNamed() ? request.name() : "La formula";
        try {
            SATResult result = executeWithTimeout(satisfier, request, timeoutSeconds);
            if (result == null) {
                return;
            }

            for (String warning : result.getWarnings()) {
                System.out.println("[W] " + warning);
            }

            if (result.isSatisfiable()) {
                System.out.println("[I] " + label + " è SODDISFACIBILE");
                System.out.print(result);
                if (request.isNamed()) {
                    System.out.println("[I] Formula " + request.name() + " memorizzata");
                }
            } else {
                System.out.println("[I] " + label + " è INSODDISFACIBILE");
            }
            System.out.println(result.getExecutionSummary());

        } catch (SatisfierException e) {
            System.out.println("[E] " + e.getMessage());
        }
    }

    /**
     * Esegue la risoluzione su un thread dedicato, interrompendolo allo scadere del timeout.
     *
     * @return esito oppure null se il timeout è scaduto
     */
    private static SATResult executeWithTimeout(Satisfier satisfier, SolveRequest request, int timeoutSeconds) {
        System.out.println("Risoluzione DPLL (timeout: " + timeoutSeconds + "s)...");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<SATResult> future = executor.submit(() -> satisfier.solve(request));

        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            System.out.println("[W] Timeout raggiunto dopo " + timeoutSeconds + " secondi");
            return null;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof SatisfierException satisfierException) {
                throw satisfierException;
            }
            throw new IllegalStateException("Errore nella risoluzione SAT", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Risoluzione interrotta", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static Map<String, Boolean> parsePreAssignments(String text) {
        PreAssignmentParser parser = new PreAssignmentParser();
        Map<String, Boolean> preAssignments = parser.parse(text);
        for (String warning : parser.getWarnings()) {
            System.out.println("[W] " + warning);
        }
        return preAssignments;
    }

    //endregion

    //region ELENCO E SESSIONE INTERATTIVA

    private static void printStoredFormulas(FormulaRepository repository) {
        System.out.println("Formule memorizzate:");
        List<FormulaRecord> records = repository.enumerate();
        if (records.isEmpty()) {
            System.out.println("Nessuna formula memorizzata.");
            return;
        }
        for (FormulaRecord record : records) {
            System.out.println(record.name() + " := " + record.rawText());
            if (record.hasComment()) {
                System.out.println("  # " + record.comment());
            }
            record.assignment().forEach((variable, value) ->
                    System.out.println("  " + variable + " := " + value));
        }
    }

    /**
     * Menu 1 (nuova formula), 2 (elenco), 3 (uscita). Termina anche a fine input.
     */
    private static void runInteractiveSession(Satisfier satisfier, SatisfierConfiguration config) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.out.println("Satisfier verifica la soddisfacibilità di una formula in Forma Normale Congiuntiva (CNF).");

        try {
            while (true) {
                String option = prompt(reader,
                        "Inserisci 1 per verificare una nuova formula, 2 per le formule memorizzate, 3 per uscire: ");
                if (option == null) {
                    return;
                }

                switch (option) {
                    case "1" -> {
                        SolveRequest request = readRequest(reader);
                        if (request == null) {
                            return;
                        }
                        processRequest(satisfier, request, config.timeoutSeconds);
                    }
                    case "2" -> printStoredFormulas(satisfier.getRepository());
                    case "3" -> {
                        System.out.println("Uscita.");
                        return;
                    }
                    default -> System.out.println("[W] Opzione non valida.");
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Lettura dallo standard input fallita", e);
        }
    }

    /**
     * @return richiesta letta dall'utente, null se l'input termina prima
     */
    private static SolveRequest readRequest(BufferedReader reader) throws IOException {
        String name = prompt(reader, "Nome della formula: ");
        if (name == null) return null;

        String text = prompt(reader, "CNF di " + name + ", es. (\"R\" OR \"S\") AND (\"C\" OR NOT \"H\"):\n");
        if (text == null) return null;

        String preAssignments = prompt(reader, "Assegnamenti iniziali (es. R := true, S := false) o vuoto: ");
        if (preAssignments == null) return null;

        String comment = prompt(reader, "Commento (facoltativo): ");

        return new SolveRequest(name.isEmpty() ? null : name, text,
                parsePreAssignments(preAssignments), comment == null || comment.isEmpty() ? null : comment);
    }

    private static String prompt(BufferedReader reader, String message) throws IOException {
        System.out.print(message);
        String line = reader.readLine();
        return line != null ? line.trim() : null;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> SATISFIER <<::");
        System.out.println("Verifica di soddisfacibilità per formule CNF con riferimenti a formule memorizzate\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar satisfier.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  1. FORMULA SINGOLA:");
        System.out.println("     -f <file>       Legge la formula da file");
        System.out.println("     -e <formula>    Formula passata sulla linea di comando");
        System.out.println("     -n <nome>       Nome con cui memorizzare la formula se soddisfacibile");
        System.out.println("     -a <assegn.>    Pre-assegnamenti, es. \"R := true, S := false\"");
        System.out.println("     -c <commento>   Commento memorizzato con la formula");
        System.out.println();
        System.out.println("  2. ELENCO:");
        System.out.println("     -l              Mostra le formule memorizzate");
        System.out.println();
        System.out.println("  3. SESSIONE INTERATTIVA:");
        System.out.println("     -i              Menu 1 (verifica) / 2 (elenco) / 3 (uscita)");
        System.out.println();
        System.out.println("  OPZIONI COMUNI:");
        System.out.println("     -s <file.json>  Store delle formule (default: " + DEFAULT_STORE_FILE + ")");
        System.out.println("     -t <secondi>    Timeout per formula (min: " + MIN_TIMEOUT_SECONDS + ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("     -opt=<flags>    Opzioni separate da virgola (tseitin, recursive)");
        System.out.println("     -h              Mostra questa guida\n");

        System.out.println("SINTASSI:");
        System.out.println("  (\"a\" OR NOT \"b\") AND (\"c\")");
        System.out.println("  Operatori alternativi: /\\ per AND, \\/ per OR, ! per NOT");
        System.out.println("  Un nome già memorizzato viene sostituito con le clausole della sua formula\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar satisfier.jar -n R -e '(NOT \"j\" OR NOT \"y\")'");
        System.out.println("  java -jar satisfier.jar -n F -e '(\"R\" OR \"j\") AND (\"j\" OR \"y\")' -a \"j := false\"");
        System.out.println("  java -jar satisfier.jar -l -s ./store.json");
        System.out.println("  java -jar satisfier.jar -i -opt=tseitin,recursive\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class SatisfierConfiguration {
        final String formulaText;
        final String formulaName;
        final String preAssignmentText;
        final String comment;
        final String storePath;
        final int timeoutSeconds;
        final boolean isListMode;
        final boolean isInteractiveMode;
        final NegationPolicy negationPolicy;
        final SearchStrategy searchStrategy;

        SatisfierConfiguration(String formulaText, String formulaName, String preAssignmentText, String comment,
                               String storePath, int timeoutSeconds, boolean isListMode, boolean isInteractiveMode,
                               NegationPolicy negationPolicy, SearchStrategy searchStrategy) {
            this.formulaText = formulaText;
            this.formulaName = formulaName;
            this.preAssignmentText = preAssignmentText;
            this.comment = comment;
            this.storePath = storePath;
            this.timeoutSeconds = timeoutSeconds;
            this.isListMode = isListMode;
            this.isInteractiveMode = isInteractiveMode;
            this.negationPolicy = negationPolicy;
            this.searchStrategy = searchStrategy;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        public SatisfierConfiguration parse(String[] args) {
            String formulaText = null;
            String formulaName = null;
            String preAssignmentText = null;
            String comment = null;
            String storePath = DEFAULT_STORE_FILE;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            boolean isListMode = false;
            boolean isInteractiveMode = false;
            OptionFlags flags = new OptionFlags(false, false);

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateSingleFormulaSource(formulaText);
                        formulaText = readFormulaFile(getNextArgument(args, ++i, "file"));
                    }
                    case EXPRESSION_PARAM -> {
                        validateSingleFormulaSource(formulaText);
                        formulaText = getNextArgument(args, ++i, "formula");
                    }
                    case NAME_PARAM -> formulaName = getNextArgument(args, ++i, "nome");
                    case ASSIGN_PARAM -> preAssignmentText = getNextArgument(args, ++i, "pre-assegnamenti");
                    case COMMENT_PARAM -> comment = getNextArgument(args, ++i, "commento");
                    case STORE_PARAM -> storePath = getNextArgument(args, ++i, "file store");
                    case LIST_PARAM -> isListMode = true;
                    case INTERACTIVE_PARAM -> isInteractiveMode = true;
                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);
                    default -> {
                        if (args[i].startsWith(OPT_PARAM)) {
                            flags = parseOptionalFlags(args[i].substring(OPT_PARAM.length()), flags);
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (isListMode && isInteractiveMode) {
                throw new IllegalArgumentException("Le modalità -l e -i sono mutualmente esclusive");
            }
            if (!isListMode && !isInteractiveMode && formulaText == null) {
                throw new IllegalArgumentException("Specificare la formula con -f o -e, oppure usare -l o -i");
            }
            if ((isListMode || isInteractiveMode) && formulaText != null) {
                throw new IllegalArgumentException("-f ed -e non si combinano con -l o -i");
            }

            return new SatisfierConfiguration(formulaText, formulaName, preAssignmentText, comment, storePath,
                    timeoutSeconds, isListMode, isInteractiveMode,
                    flags.tseitin() ? NegationPolicy.TSEITIN : NegationPolicy.LITERAL_FLIP,
                    flags.recursive() ? SearchStrategy.RECURSIVE : SearchStrategy.STACK);
        }

        private void validateSingleFormulaSource(String current) {
            if (current != null) {
                throw new IllegalArgumentException("Specificare la formula una sola volta (-f oppure -e)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");

            try {
                int timeout = Integer.parseInt(timeoutStr);
                if (timeout < MIN_TIMEOUT_SECONDS) {
                    throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                }
                return timeout;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
        }

        private OptionFlags parseOptionalFlags(String flagsStr, OptionFlags current) {
            if (flagsStr == null || flagsStr.trim().isEmpty()) {
                throw new IllegalArgumentException("Valore -opt vuoto");
            }

            boolean tseitin = current.tseitin();
            boolean recursive = current.recursive();
            for (String flag : flagsStr.split(",")) {
                switch (flag.trim()) {
                    case OPT_TSEITIN -> tseitin = true;
                    case OPT_RECURSIVE -> recursive = true;
                    default -> throw new IllegalArgumentException("Opzione sconosciuta: " + flag.trim());
                }
            }
            return new OptionFlags(tseitin, recursive);
        }

        private String readFormulaFile(String filePath) {
            File file = new File(filePath);
            if (!file.isFile() || !file.canRead()) {
                throw new IllegalArgumentException("File non esistente o non leggibile: " + filePath);
            }
            try {
                return Files.readString(file.toPath()).trim();
            } catch (IOException e) {
                throw new IllegalArgumentException("Lettura del file fallita: " + filePath);
            }
        }
    }

    /**
     * Opzioni -opt lette dalla linea di comando.
     */
    private record OptionFlags(boolean tseitin, boolean recursive) {}

    //endregion
}
