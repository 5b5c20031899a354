package it.aw.specrepeal.service;

import it.aw.specrepeal.model.PageText;

import java.util.ArrayList;
import java.util.List;

/**
 * Testo completo del documento con mappa pagina → offset nel testo concatenato.
 * <p>
 * Le pagine vuote sono escluse. Ogni pagina termina con '\n', cosi' che una riga
 * non si estenda mai su due pagine.
 *
 * @param fullText    testo di tutte le pagine concatenato
 * @param pageOffsets lista di {@code int[]{pageNumber, startOffset, endOffset}}
 *                    (pageNumber e' 1-based, endOffset esclusivo)
 */
public record PagedText(String fullText, List<int[]> pageOffsets) {

    public static PagedText of(List<PageText> pages) {
        StringBuilder sb = new StringBuilder();
        List<int[]> offsets = new ArrayList<>(pages.size());
        for (PageText page : pages) {
            if (page.isBlank()) continue;
            int start = sb.length();
            sb.append(page.text().replace("\r\n", "\n").replace('\r', '\n'));
            if (sb.charAt(sb.length() - 1) != '\n') sb.append('\n');
            offsets.add(new int[]{Math.max(1, page.pageNumber()), start, sb.length()});
        }
        return new PagedText(sb.toString(), offsets);
    }

    public boolean isEmpty() {
        return pageOffsets.isEmpty();
    }

    /** Testo di una singola pagina (indice nella lista degli offset). */
    public String pageText(int pageIndex) {
        int[] po = pageOffsets.get(pageIndex);
        return fullText.substring(po[1], po[2]);
    }

    public int pageStart(int pageIndex) {
        return pageOffsets.get(pageIndex)[1];
    }

    /**
     * Pagina stimata per un offset nel testo concatenato: la pagina che lo contiene,
     * oppure l'ultima pagina per offset oltre la fine.
     */
    public int pageAt(int offset) {
        int page = 1;
        for (int[] po : pageOffsets) {
            page = po[0];
            if (offset < po[2]) break;
        }
        return page;
    }
}
