package org.satisfier.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class JsonFormulaRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileIsAnEmptyStore() {
        JsonFormulaRepository repository = new JsonFormulaRepository(tempDir.resolve("formulas.json"));

        assertTrue(repository.enumerate().isEmpty());
        assertEquals(Optional.empty(), repository.lookup("R"));
        assertFalse(Files.exists(repository.getStoreFile()), "Nothing is written before the first store");
    }

    @Test
    void storedFormulasSurviveReopening() {
        Path file = tempDir.resolve("formulas.json");
        Map<String, Boolean> model = new LinkedHashMap<>();
        model.put("j", true);
        model.put("y", false);

        new JsonFormulaRepository(file).store("R", "(NOT \"j\" OR NOT \"y\")", model, "esclusione");

        JsonFormulaRepository reopened = new JsonFormulaRepository(file);
        assertEquals(Optional.of("(NOT \"j\" OR NOT \"y\")"), reopened.lookup("R"));
        List<FormulaRecord> records = reopened.enumerate();
        assertEquals(1, records.size());
        assertEquals(List.copyOf(model.entrySet()), List.copyOf(records.get(0).assignment().entrySet()));
        assertEquals("esclusione", records.get(0).comment());
    }

    @Test
    void writesTheOriginalLayout() throws IOException {
        Path file = tempDir.resolve("formulas.json");
        new JsonFormulaRepository(file).store("F", "(\"a\")", Map.of("a", true), null);

        JsonObject root = JsonParser.parseString(Files.readString(file, StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals("(\"a\")", root.getAsJsonObject("formulas").get("F").getAsString());
        assertTrue(root.getAsJsonObject("assignments").getAsJsonObject("F").get("a").getAsBoolean());
        assertFalse(root.getAsJsonObject("comments").has("F"));

        try (Stream<Path> listing = Files.list(tempDir)) {
            assertEquals(1, listing.count(), "No temporary file is left behind");
        }
    }

    @Test
    void readsStoresWrittenWithoutComments() throws IOException {
        Path file = tempDir.resolve("legacy.json");
        Files.writeString(file,
                "{\"formulas\":{\"R\":\"(\\\"a\\\")\"},\"assignments\":{\"R\":{\"a\":true}}}",
                StandardCharsets.UTF_8);

        JsonFormulaRepository repository = new JsonFormulaRepository(file);

        FormulaRecord record = repository.enumerate().get(0);
        assertEquals("R", record.name());
        assertEquals("(\"a\")", record.rawText());
        assertEquals(Map.of("a", true), record.assignment());
        assertNull(record.comment());
    }

    @Test
    void overwritingReplacesTheRecordAndClearsTheComment() {
        Path file = tempDir.resolve("formulas.json");
        JsonFormulaRepository repository = new JsonFormulaRepository(file);
        repository.store("R", "(\"a\")", Map.of("a", true), "primo");
        repository.store("R", "(NOT \"a\")", Map.of("a", false), "");

        FormulaRecord record = new JsonFormulaRepository(file).enumerate().get(0);
        assertEquals("(NOT \"a\")", record.rawText());
        assertEquals(Map.of("a", false), record.assignment());
        assertFalse(record.hasComment());
    }

    @Test
    void malformedFileIsARepositoryError() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"formulas\": [", StandardCharsets.UTF_8);

        assertThrows(RepositoryException.class, () -> new JsonFormulaRepository(file));
    }

    @Test
    void failedSaveLeavesTheStoreUnchanged() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory", StandardCharsets.UTF_8);
        JsonFormulaRepository repository = new JsonFormulaRepository(blocker.resolve("formulas.json"));

        assertThrows(RepositoryException.class,
                () -> repository.store("F", "(\"a\")", Map.of("a", true), null));

        assertEquals(Optional.empty(), repository.lookup("F"));
        assertTrue(repository.enumerate().isEmpty());
    }

    @Test
    void failedMoveRemovesTheTemporaryFileAndKeepsPreviousRecords() throws IOException {
        Path file = tempDir.resolve("formulas.json");
        JsonFormulaRepository repository = new JsonFormulaRepository(file);
        repository.store("E", "(\"e\")", Map.of("e", true), null);
        Files.delete(file);
        Files.createDirectory(file);
        Files.writeString(file.resolve("occupied"), "x", StandardCharsets.UTF_8);

        assertThrows(RepositoryException.class,
                () -> repository.store("F", "(\"a\")", Map.of("a", true), null));

        assertEquals(Optional.empty(), repository.lookup("F"));
        assertEquals(Optional.of("(\"e\")"), repository.lookup("E"));
        assertEquals(1, repository.enumerate().size());
        try (Stream<Path> listing = Files.list(tempDir)) {
            assertEquals(List.of(file), listing.toList(), "No temporary file is left behind");
        }
    }
}
