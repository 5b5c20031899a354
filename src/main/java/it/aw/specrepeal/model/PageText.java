package it.aw.specrepeal.model;

/**
 * Testo estratto di una singola pagina, fornito dal collaboratore a monte
 * (parser PDF, OCR). pageNumber e' 1-based.
 */
public record PageText(String text, int pageNumber) {

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
