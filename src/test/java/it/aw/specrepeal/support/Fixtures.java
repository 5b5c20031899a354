package it.aw.specrepeal.support;

import it.aw.specrepeal.model.PageText;
import it.aw.specrepeal.model.SectionType;
import it.aw.specrepeal.model.SpecChunk;

import java.util.ArrayList;
import java.util.List;

/** Dati di prova condivisi. */
public final class Fixtures {

    public static final String TABLE_PAGE = """
            Table 1: Clearance requirements for overhead conductors
            Conductor type      Location          minimum 18 feet above roadway surface
            Service drop        Residential       minimum 12 feet above finished grade
            """;

    public static final String PROSE_PAGE = """
            Installation practices for wood poles shall follow the construction standard.
            Each pole shall be set in undisturbed soil and backfilled in layers that are
            thoroughly tamped so the pole remains plumb after the conductors are sagged.
            """;

    private Fixtures() {}

    /** Specifica di due pagine: tabella di clearance a pagina 1, prosa a pagina 2. */
    public static List<PageText> twoPageSpec() {
        return List.of(new PageText(TABLE_PAGE, 1), new PageText(PROSE_PAGE, 2));
    }

    public static List<PageText> pages(String... texts) {
        List<PageText> pages = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) pages.add(new PageText(texts[i], i + 1));
        return pages;
    }

    public static SpecChunk chunk(String text, String source) {
        return new SpecChunk(text, source, 1, SectionType.GENERAL, null, null);
    }

    /** n chunk distinti della stessa sorgente. */
    public static List<SpecChunk> chunks(String source, int n) {
        List<SpecChunk> chunks = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            chunks.add(new SpecChunk("Requirement number " + i + " for " + source + " ground rod item" + i,
                    source, 1 + i / 3, SectionType.GENERAL, null, null));
        }
        return chunks;
    }

    /** Parole "w0 w1 ... w(n-1)". */
    public static String words(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            if (i > 0) sb.append(' ');
            sb.append("word").append(i);
        }
        return sb.toString();
    }
}
