package it.aw.specrepeal.service;

import it.aw.specrepeal.model.PageText;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Estrattore PDF pagina per pagina via PDFBox: il collaboratore a monte che
 * produce le coppie (testo, pagina) consumate dall'ingestione e dall'analisi.
 * Le pagine senza testo (scansioni) vengono restituite vuote, non scartate.
 */
public class PdfPageParser {

    private static final Logger log = LoggerFactory.getLogger(PdfPageParser.class);

    private PdfPageParser() {}

    /**
     * Esegue il parsing del PDF dall'input stream.
     * L'input stream NON viene chiuso dal metodo: la responsabilita' e' del chiamante.
     */
    public static List<PageText> parse(InputStream inputStream) throws IOException {
        try (PDDocument doc = PDDocument.load(inputStream)) {
            return pages(doc);
        }
    }

    public static List<PageText> parse(byte[] bytes) throws IOException {
        try (PDDocument doc = PDDocument.load(bytes)) {
            return pages(doc);
        }
    }

    public static List<PageText> parse(Path file) throws IOException {
        return parse(Files.readAllBytes(file));
    }

    /** Testo completo, pagine separate da una riga vuota. */
    public static String fullText(List<PageText> pages) {
        StringBuilder sb = new StringBuilder();
        for (PageText p : pages) {
            if (p.isBlank()) continue;
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(p.text());
        }
        return sb.toString();
    }

    private static List<PageText> pages(PDDocument doc) throws IOException {
        int totalPages = doc.getNumberOfPages();
        log.debug("PdfPageParser: {} pagine trovate", totalPages);

        PDFTextStripper stripper = new PDFTextStripper();
        List<PageText> pages = new ArrayList<>(totalPages);
        for (int p = 1; p <= totalPages; p++) {
            stripper.setStartPage(p);
            stripper.setEndPage(p);
            pages.add(new PageText(stripper.getText(doc), p));
        }
        return pages;
    }
}
