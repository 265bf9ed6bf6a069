package org.satisfier.repository;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * REPOSITORY JSON - Archivio persistente delle formule su file
 *
 * FORMATO DEL FILE:
 * {
 *   "formulas":    { "R": "(NOT \"j\" OR NOT \"y\")" },
 *   "assignments": { "R": { "j": false, "y": true } },
 *   "comments":    { "R": "vincolo di esclusione" }
 * }
 *
 * COMPORTAMENTO:
 * - File assente: archivio vuoto, creato alla prima memorizzazione
 * - Ogni store riscrive l'intero documento su file temporaneo e lo sposta sul definitivo
 * - Errori di I/O e JSON malformato diventano {@link RepositoryException}
 */
public class JsonFormulaRepository implements FormulaRepository {

    private static final Logger LOGGER = Logger.getLogger(JsonFormulaRepository.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    /**
     * Documento serializzato, struttura identica al file su disco.
     */
    private static final class StoreDocument {
        LinkedHashMap<String, String> formulas = new LinkedHashMap<>();
        LinkedHashMap<String, LinkedHashMap<String, Boolean>> assignments = new LinkedHashMap<>();
        LinkedHashMap<String, String> comments = new LinkedHashMap<>();

        void normalize() {
            if (formulas == null) formulas = new LinkedHashMap<>();
            if (assignments == null) assignments = new LinkedHashMap<>();
            if (comments == null) comments = new LinkedHashMap<>();
        }

        StoreDocument copy() {
            StoreDocument copy = new StoreDocument();
            copy.formulas.putAll(formulas);
            assignments.forEach((name, values) -> copy.assignments.put(name,
                    values != null ? new LinkedHashMap<>(values) : new LinkedHashMap<>()));
            copy.comments.putAll(comments);
            return copy;
        }
    }

    private final Path storeFile;
    private StoreDocument document;

    /**
     * Apre l'archivio, caricandolo dal file se esiste.
     *
     * @param storeFile percorso del file JSON
     * @throws RepositoryException se il file esiste ma non è leggibile o non è JSON valido
     */
    public JsonFormulaRepository(Path storeFile) {
        if (storeFile == null) {
            throw new IllegalArgumentException("Percorso archivio null");
        }
        this.storeFile = storeFile;
        this.document = load(storeFile);
        LOGGER.fine("Archivio formule caricato da " + storeFile + ": " + document.formulas.size() + " formule");
    }

    //region CARICAMENTO E SALVATAGGIO

    private static StoreDocument load(Path storeFile) {
        if (!Files.exists(storeFile)) {
            LOGGER.info("Archivio " + storeFile + " non presente, si parte da archivio vuoto");
            return new StoreDocument();
        }

        try (Reader reader = Files.newBufferedReader(storeFile, StandardCharsets.UTF_8)) {
            StoreDocument loaded = GSON.fromJson(reader, StoreDocument.class);
            if (loaded == null) {
                return new StoreDocument(); // File vuoto
            }
            loaded.normalize();
            return loaded;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore durante lettura archivio " + storeFile, e);
            throw new RepositoryException("Impossibile leggere l'archivio " + storeFile, e);
        } catch (JsonParseException e) {
            LOGGER.log(Level.SEVERE, "Archivio JSON malformato " + storeFile, e);
            throw new RepositoryException("Archivio JSON malformato: " + storeFile, e);
        }
    }

    /**
     * Scrive il documento su file temporaneo e lo sposta sul definitivo.
     * In caso di errore il file temporaneo viene rimosso e il file definitivo resta invariato.
     */
    private void save(StoreDocument candidate) {
        Path directory = storeFile.toAbsolutePath().getParent();
        Path temporary = null;
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            temporary = Files.createTempFile(directory, storeFile.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8)) {
                GSON.toJson(candidate, writer);
            }
            try {
                Files.move(temporary, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temporary, storeFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            discard(temporary, e);
            LOGGER.log(Level.SEVERE, "Errore durante salvataggio archivio " + storeFile, e);
            throw new RepositoryException("Impossibile salvare l'archivio " + storeFile, e);
        }
    }

    private static void discard(Path temporary, IOException failure) {
        if (temporary == null) {
            return;
        }
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    //endregion

    //region CONTRATTO REPOSITORY

    @Override
    public Optional<String> lookup(String name) {
        return Optional.ofNullable(document.formulas.get(name));
    }

    @Override
    public void store(String name, String rawText, Map<String, Boolean> namedAssignment, String comment) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome formula null o vuoto");
        }
        if (rawText == null) {
            throw new IllegalArgumentException("Testo formula null per " + name);
        }

        // Le modifiche diventano visibili solo dopo un salvataggio riuscito
        StoreDocument updated = document.copy();
        updated.formulas.put(name, rawText);
        updated.assignments.put(name, namedAssignment != null
                ? new LinkedHashMap<>(namedAssignment)
                : new LinkedHashMap<>());
        if (comment != null && !comment.isBlank()) {
            updated.comments.put(name, comment);
        } else {
            updated.comments.remove(name);
        }

        save(updated);
        document = updated;
        LOGGER.info("Formula " + name + " memorizzata in " + storeFile);
    }

    @Override
    public List<FormulaRecord> enumerate() {
        List<FormulaRecord> records = new ArrayList<>(document.formulas.size());
        for (Map.Entry<String, String> entry : document.formulas.entrySet()) {
            String name = entry.getKey();
            records.add(new FormulaRecord(name, entry.getValue(),
                    document.assignments.get(name), document.comments.get(name)));
        }
        return records;
    }

    //endregion

    public Path getStoreFile() {
        return storeFile;
    }
}
