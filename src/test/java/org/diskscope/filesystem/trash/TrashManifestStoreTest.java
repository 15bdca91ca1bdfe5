package org.diskscope.filesystem.trash;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.diskscope.filesystem.dto.TrashEntry;
import org.diskscope.filesystem.dto.TrashManifest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class TrashManifestStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @TempDir
    Path trashRoot;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TrashManifestStore store() {
        return new TrashManifestStore(trashRoot, objectMapper, CLOCK);
    }

    @Test
    void load_missingManifestIsEmpty() throws IOException {
        assertThat(store().load()).isEqualTo(TrashManifest.empty());
    }

    @Test
    void load_emptyFileIsEmpty() throws IOException {
        Files.writeString(trashRoot.resolve(TrashManifestStore.MANIFEST_FILE_NAME), "");

        assertThat(store().load().entries()).isEmpty();
    }

    @Test
    void saveThenLoad_returnsSameEntries() throws IOException {
        TrashManifestStore store = store();
        TrashManifest manifest = TrashManifest.empty()
                .with(new TrashEntry("a", "report.pdf", "/home/u/report.pdf", "a_report.pdf", 10L, 300L, false))
                .with(new TrashEntry("b", "photos", "/home/u/photos", "b_photos", 20L, 9000L, true));

        store.save(manifest);

        assertThat(store.load()).isEqualTo(manifest);
        try (Stream<Path> files = Files.list(trashRoot)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly(TrashManifestStore.MANIFEST_FILE_NAME);
        }
    }

    @Test
    void save_writesVersionedDocumentWithIsDirectoryField() throws IOException {
        store().save(TrashManifest.empty().with(new TrashEntry("a", "d", "/x/d", "a_d", 1L, 2L, true)));

        JsonNode root = objectMapper.readTree(trashRoot.resolve(TrashManifestStore.MANIFEST_FILE_NAME).toFile());

        assertThat(root.path("version").asInt()).isEqualTo(TrashManifest.CURRENT_VERSION);
        JsonNode entry = root.path("entries").get(0);
        assertThat(entry.path("isDirectory").asBoolean()).isTrue();
        assertThat(entry.path("storedName").asText()).isEqualTo("a_d");
        assertThat(entry.path("originalPath").asText()).isEqualTo("/x/d");
    }

    @Test
    void load_readsLegacyTopLevelArray() throws IOException {
        Files.writeString(trashRoot.resolve(TrashManifestStore.MANIFEST_FILE_NAME), """
                [{"id":"a","name":"n.txt","originalPath":"/tmp/n.txt","storedName":"a_n.txt",
                  "trashedAt":5,"size":7,"isDirectory":false,"extra":"ignored"}]
                """);

        TrashManifest manifest = store().load();

        assertThat(manifest.version()).isEqualTo(TrashManifest.CURRENT_VERSION);
        assertThat(manifest.entries()).containsExactly(new TrashEntry("a", "n.txt", "/tmp/n.txt", "a_n.txt", 5L, 7L, false));
    }

    @Test
    void load_corruptManifestIsBackedUpAndTreatedAsEmpty() throws IOException {
        Path manifestFile = trashRoot.resolve(TrashManifestStore.MANIFEST_FILE_NAME);
        Files.writeString(manifestFile, "{\"version\":1,\"entries\":[{\"id\":");

        TrashManifest manifest = store().load();

        assertThat(manifest.entries()).isEmpty();
        assertThat(manifestFile).doesNotExist();
        Path backup = trashRoot.resolve(TrashManifestStore.MANIFEST_FILE_NAME + ".corrupt-" + CLOCK.millis());
        assertThat(backup).hasContent("{\"version\":1,\"entries\":[{\"id\":");
    }

    @Test
    void load_entryWithoutStoredNameCountsAsCorrupt() throws IOException {
        Files.writeString(trashRoot.resolve(TrashManifestStore.MANIFEST_FILE_NAME),
                "{\"version\":1,\"entries\":[{\"id\":\"a\",\"originalPath\":\"/x\"}]}");

        assertThat(store().load().entries()).isEmpty();
        assertThat(trashRoot.resolve(TrashManifestStore.MANIFEST_FILE_NAME + ".corrupt-" + CLOCK.millis())).exists();
    }

    @Test
    void load_newerVersionIsNotSilentlyReinterpreted() throws IOException {
        Files.writeString(trashRoot.resolve(TrashManifestStore.MANIFEST_FILE_NAME), "{\"version\":2,\"entries\":[]}");

        assertThat(store().load().entries()).isEmpty();
        assertThat(trashRoot.resolve(TrashManifestStore.MANIFEST_FILE_NAME + ".corrupt-" + CLOCK.millis())).exists();
    }
}
