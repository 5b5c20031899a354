package it.aw.specrepeal.registry;

import it.aw.specrepeal.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registro delle specifiche indicizzate, persistito nella tabella {@code sources}
 * di un file DuckDB nella directory del corpus.
 * <p>
 * La chiave e' l'hash SHA-256 del contenuto: due caricamenti dello stesso file
 * con nomi diversi vengono riconosciuti come duplicati.
 * <p>
 * Un'unica connessione JDBC e' condivisa da tutte le operazioni; l'accesso
 * e' sincronizzato (DuckDBConnection non e' thread-safe).
 * <p>
 * Migrazione schema: se la tabella esiste ma manca una colonna richiesta o la
 * chiave primaria su {@code content_hash}, viene ricreata con lo schema corrente.
 * Le sorgenti esistenti vanno re-indicizzate.
 */
public class SourceRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    public static final String FILE_NAME = "registry.duckdb";

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS sources (
                content_hash  VARCHAR   PRIMARY KEY,
                source_name   VARCHAR   NOT NULL,
                ingested_at   TIMESTAMP NOT NULL,
                chunk_count   INTEGER   NOT NULL,
                complete      BOOLEAN   NOT NULL
            )
            """;

    private static final Set<String> REQUIRED_COLUMNS =
            Set.of("content_hash", "source_name", "ingested_at", "chunk_count", "complete");

    private final Path dbFile;
    private final Connection conn;

    private SourceRegistry(Path dbFile, Connection conn) {
        this.dbFile = dbFile;
        this.conn = conn;
    }

    /** Apre (o crea) il registro nella directory indicata. */
    public static SourceRegistry open(Path storeDir) {
        Path dbFile = storeDir.resolve(FILE_NAME).toAbsolutePath();
        try {
            Files.createDirectories(dbFile.getParent());
            Connection conn = DriverManager.getConnection("jdbc:duckdb:" + dbFile);
            SourceRegistry registry = new SourceRegistry(dbFile, conn);
            registry.migrateIfNeeded();
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(CREATE_TABLE);
            }
            log.info("SourceRegistry: tabella 'sources' pronta su {}", dbFile);
            return registry;
        } catch (IOException e) {
            throw new UncheckedIOException("Impossibile creare la directory del registro " + dbFile, e);
        } catch (SQLException e) {
            throw new IllegalStateException("Impossibile aprire il registro DuckDB " + dbFile, e);
        }
    }

    /** Rileva schema obsoleto e ricrea la tabella se necessario. */
    private void migrateIfNeeded() throws SQLException {
        Set<String> existing = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT column_name FROM information_schema.columns WHERE table_name = 'sources'")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) existing.add(rs.getString(1));
            }
        }
        boolean needsDrop = !existing.isEmpty() && !existing.containsAll(REQUIRED_COLUMNS);
        if (!needsDrop && !existing.isEmpty()) {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(
                         "SELECT COUNT(*) FROM duckdb_constraints() " +
                         "WHERE table_name = 'sources' AND constraint_type = 'PRIMARY KEY' " +
                         "AND list_contains(constraint_column_names, 'content_hash')")) {
                if (rs.next() && rs.getInt(1) == 0) needsDrop = true;
            }
        }
        if (needsDrop) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS sources");
            }
            log.warn("SourceRegistry: schema obsoleto rilevato, tabella 'sources' ricreata. " +
                     "Re-indicizzare le specifiche esistenti.");
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (!conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB registry {}: {}", dbFile, e.getMessage());
        }
    }

    public synchronized void upsert(SourceRecord record) {
        String sql = """
                INSERT INTO sources (content_hash, source_name, ingested_at, chunk_count, complete)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (content_hash) DO UPDATE SET
                    source_name = EXCLUDED.source_name,
                    ingested_at = EXCLUDED.ingested_at,
                    chunk_count = EXCLUDED.chunk_count,
                    complete    = EXCLUDED.complete
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.contentHash());
            ps.setString(2, record.sourceName());
            ps.setTimestamp(3, Timestamp.valueOf(record.ingestedAt()));
            ps.setInt(4, record.chunkCount());
            ps.setBoolean(5, record.complete());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Errore salvataggio sorgente nel registro", e);
        }
    }

    public synchronized Optional<SourceRecord> findByHash(String contentHash) {
        return findOne("SELECT * FROM sources WHERE content_hash = ?", contentHash);
    }

    public synchronized Optional<SourceRecord> findBySourceName(String sourceName) {
        return findOne("SELECT * FROM sources WHERE source_name = ? ORDER BY ingested_at DESC LIMIT 1", sourceName);
    }

    public synchronized List<SourceRecord> findAll() {
        List<SourceRecord> result = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT * FROM sources ORDER BY ingested_at, source_name")) {
            while (rs.next()) result.add(toRecord(rs));
        } catch (SQLException e) {
            throw new IllegalStateException("Errore lettura registro", e);
        }
        return result;
    }

    /** Rimuove tutte le righe con il nome indicato; ritorna il numero di righe eliminate. */
    public synchronized int removeBySourceName(String sourceName) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM sources WHERE source_name = ?")) {
            ps.setString(1, sourceName);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Errore rimozione sorgente dal registro", e);
        }
    }

    public synchronized boolean removeByHash(String contentHash) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM sources WHERE content_hash = ?")) {
            ps.setString(1, contentHash);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Errore rimozione hash dal registro", e);
        }
    }

    public synchronized void clear() {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("DELETE FROM sources");
        } catch (SQLException e) {
            throw new IllegalStateException("Errore svuotamento registro", e);
        }
    }

    public synchronized int totalSources() {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM sources")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Errore conteggio sorgenti", e);
        }
    }

    private Optional<SourceRecord> findOne(String sql, String param) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toRecord(rs));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Errore lettura sorgente dal registro", e);
        }
        return Optional.empty();
    }

    private static SourceRecord toRecord(ResultSet rs) throws SQLException {
        return new SourceRecord(
                rs.getString("content_hash"),
                rs.getString("source_name"),
                rs.getTimestamp("ingested_at").toLocalDateTime(),
                rs.getInt("chunk_count"),
                rs.getBoolean("complete")
        );
    }
}
