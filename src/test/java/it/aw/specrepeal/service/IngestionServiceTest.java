package it.aw.specrepeal.service;

import it.aw.specrepeal.error.EmptyDocumentException;
import it.aw.specrepeal.model.IngestResult;
import it.aw.specrepeal.model.SectionType;
import it.aw.specrepeal.model.SourceRecord;
import it.aw.specrepeal.model.SpecChunk;
import it.aw.specrepeal.support.Fixtures;
import it.aw.specrepeal.support.TestEmbeddingModel;
import it.aw.specrepeal.support.TestEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestionServiceTest {

    @TempDir
    Path dir;

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TestEngine(dir, new TestEmbeddingModel());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("una specifica di due pagine produce un chunk per pagina")
    void ingestTwoPageSpec() {
        IngestResult result = engine.ingestion.ingestDocument(Fixtures.twoPageSpec(), "spec.pdf");

        assertThat(result.chunksAdded()).isEqualTo(2);
        assertThat(result.totalChunks()).isEqualTo(2);
        assertThat(result.skipped()).isFalse();
        assertThat(result.complete()).isTrue();

        List<SpecChunk> chunks = engine.corpus.snapshot().chunks();
        assertThat(chunks).extracting(SpecChunk::sectionType)
                .containsExactly(SectionType.TABLE, SectionType.TABLE);
        assertThat(chunks).extracting(SpecChunk::page).containsExactly(1, 2);
        assertThat(chunks.get(0).text()).contains("minimum 18 feet");
        assertThat(chunks).allSatisfy(c -> assertThat(c.source()).isEqualTo("spec.pdf"));
    }

    @Test
    @DisplayName("lo stesso contenuto non viene indicizzato due volte")
    void duplicateIsSkipped() {
        byte[] raw = "%PDF-fake-content".getBytes(StandardCharsets.UTF_8);
        engine.ingestion.ingestDocument(Fixtures.twoPageSpec(), "spec.pdf", raw);
        int calls = engine.model.calls();

        IngestResult second = engine.ingestion.ingestDocument(Fixtures.twoPageSpec(), "copy-of-spec.pdf", raw);

        assertThat(second.skipped()).isTrue();
        assertThat(second.chunksAdded()).isZero();
        assertThat(engine.model.calls()).isEqualTo(calls);
        assertThat(engine.ingestion.stats().totalChunks()).isEqualTo(2);
        assertThat(engine.ingestion.listSources()).extracting(SourceRecord::sourceName).containsExactly("spec.pdf");
    }

    @Test
    @DisplayName("senza byte originali la deduplica usa il testo delle pagine")
    void textFingerprintDedup() {
        engine.ingestion.ingestDocument(Fixtures.twoPageSpec(), "spec.pdf");

        assertThat(engine.ingestion.ingestDocument(Fixtures.twoPageSpec(), "spec.pdf").skipped()).isTrue();
        assertThat(engine.ingestion.ingestDocument(Fixtures.pages(Fixtures.PROSE_PAGE), "prose.pdf").skipped())
                .isFalse();
    }

    @Test
    @DisplayName("un documento senza testo e' rifiutato senza modificare il corpus")
    void emptyDocumentRejected() {
        engine.ingestion.ingestDocument(Fixtures.twoPageSpec(), "spec.pdf");

        assertThatThrownBy(() -> engine.ingestion.ingestDocument(Fixtures.pages("", "   "), "scan.pdf"))
                .isInstanceOf(EmptyDocumentException.class);
        assertThat(engine.ingestion.stats().totalChunks()).isEqualTo(2);
        assertThat(engine.ingestion.listSources()).hasSize(1);
    }

    @Test
    @DisplayName("la re-ingestione sostituisce la versione precedente")
    void reingestReplaces() {
        engine.ingestion.ingestDocument(Fixtures.twoPageSpec(), "spec.pdf");

        IngestResult result = engine.ingestion.reingestDocument(Fixtures.pages(Fixtures.PROSE_PAGE), "spec.pdf");

        assertThat(result.chunksAdded()).isEqualTo(1);
        assertThat(engine.corpus.snapshot().chunks()).singleElement()
                .satisfies(c -> assertThat(c.text()).contains("wood poles"));
        assertThat(engine.ingestion.listSources()).singleElement()
                .satisfies(r -> assertThat(r.chunkCount()).isEqualTo(1));
    }

    @Test
    @DisplayName("la re-ingestione di un documento vuoto lascia intatta la versione precedente")
    void reingestEmptyKeepsOldVersion() {
        engine.ingestion.ingestDocument(Fixtures.twoPageSpec(), "spec.pdf");

        assertThatThrownBy(() -> engine.ingestion.reingestDocument(Fixtures.pages(""), "spec.pdf"))
                .isInstanceOf(EmptyDocumentException.class);
        assertThat(engine.ingestion.stats().totalChunks()).isEqualTo(2);
    }

    @Test
    void removeAndReset() {
        engine.ingestion.ingestDocument(Fixtures.twoPageSpec(), "a.pdf");
        engine.ingestion.ingestDocument(Fixtures.pages(Fixtures.PROSE_PAGE + "\nAppendix B applies."), "b.pdf");

        assertThat(engine.ingestion.removeSource("a.pdf")).isEqualTo(2);
        assertThat(engine.ingestion.removeSource("missing.pdf")).isZero();
        assertThat(engine.ingestion.stats().totalSources()).isEqualTo(1);

        engine.ingestion.reset();

        assertThat(engine.ingestion.stats().totalChunks()).isZero();
        assertThat(engine.ingestion.listSources()).isEmpty();
        assertThat(engine.corpus.isReady()).isFalse();
    }

    @Test
    void sha256IsHexEncoded() {
        assertThat(IngestionService.sha256("abc".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
