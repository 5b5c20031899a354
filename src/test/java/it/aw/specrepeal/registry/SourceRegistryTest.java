package it.aw.specrepeal.registry;

import it.aw.specrepeal.model.SourceRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class SourceRegistryTest {

    @TempDir
    Path dir;

    @Test
    void upsertFindAndRemove() {
        try (SourceRegistry registry = SourceRegistry.open(dir)) {
            LocalDateTime t = LocalDateTime.of(2024, 5, 1, 10, 0);
            registry.upsert(new SourceRecord("h1", "a.pdf", t, 2, false));
            registry.upsert(new SourceRecord("h1", "a.pdf", t.plusMinutes(1), 6, true));
            registry.upsert(new SourceRecord("h2", "b.pdf", t.plusMinutes(2), 3, true));

            assertThat(registry.findByHash("h1")).hasValueSatisfying(r -> {
                assertThat(r.chunkCount()).isEqualTo(6);
                assertThat(r.complete()).isTrue();
            });
            assertThat(registry.findBySourceName("b.pdf")).map(SourceRecord::contentHash).hasValue("h2");
            assertThat(registry.totalSources()).isEqualTo(2);

            assertThat(registry.removeBySourceName("a.pdf")).isEqualTo(1);
            assertThat(registry.findAll()).extracting(SourceRecord::sourceName).containsExactly("b.pdf");

            registry.clear();
            assertThat(registry.totalSources()).isZero();
        }
    }

    @Test
    void recordsSurviveReopen() {
        try (SourceRegistry registry = SourceRegistry.open(dir)) {
            registry.upsert(new SourceRecord("h1", "a.pdf", LocalDateTime.now(), 4, true));
        }
        try (SourceRegistry registry = SourceRegistry.open(dir)) {
            assertThat(registry.findByHash("h1")).isPresent();
        }
    }

    @Test
    void obsoleteSchemaIsRecreated() throws Exception {
        String url = "jdbc:duckdb:" + dir.resolve(SourceRegistry.FILE_NAME).toAbsolutePath();
        try (Connection conn = DriverManager.getConnection(url);
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE sources (source_name VARCHAR, chunk_count INTEGER)");
            stmt.execute("INSERT INTO sources VALUES ('old.pdf', 3)");
        }

        try (SourceRegistry registry = SourceRegistry.open(dir)) {
            assertThat(registry.findAll()).isEmpty();
            registry.upsert(new SourceRecord("h1", "new.pdf", LocalDateTime.now(), 1, true));
            assertThat(registry.totalSources()).isEqualTo(1);
        }
    }
}
