package it.aw.specrepeal.model;

import java.util.Objects;

/**
 * Porzione di testo di una specifica con i metadati strutturali.
 * <p>
 * Immutabile; le istanze sono possedute dal {@code CorpusIndexManager}.
 * documentNumber e revision sono null quando non rilevati.
 */
public record SpecChunk(
        String      text,
        String      source,          // identificativo del documento (nome file)
        int         page,            // pagina stimata, 1-based
        SectionType sectionType,
        String      documentNumber,  // es. "022178", null se assente
        String      revision         // es. "13"    , null se assente
) {
    public SpecChunk {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sectionType, "sectionType");
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text non puo' essere vuoto");
        }
        if (page < 1) {
            throw new IllegalArgumentException("page deve essere >= 1 (ricevuto: " + page + ")");
        }
    }

    /** Riferimento leggibile usato nelle motivazioni: "file.pdf (Doc 022178 Rev 13) p.4". */
    public String sourceReference() {
        StringBuilder sb = new StringBuilder(source);
        if (documentNumber != null) {
            sb.append(" (Doc ").append(documentNumber);
            if (revision != null) sb.append(" Rev ").append(revision);
            sb.append(')');
        }
        return sb.append(" p.").append(page).toString();
    }
}
