package it.aw.specrepeal.infraction;

import java.util.regex.Pattern;

/**
 * Pulizia del testo di audit prima dell'estrazione: fine riga uniformi,
 * niente caratteri di controllo, spazi orizzontali collassati.
 * Le righe vuote restano: delimitano i blocchi strutturati.
 */
public final class AuditTextCleaner {

    private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\n\t]]");
    private static final Pattern HORIZONTAL_WS = Pattern.compile("[\\t\\x0B\\f\\u00A0 ]+");

    private AuditTextCleaner() {}

    public static String clean(String text) {
        if (text == null) return "";
        String s = text.replace("\r\n", "\n").replace('\r', '\n');
        s = CONTROL.matcher(s).replaceAll("");
        s = HORIZONTAL_WS.matcher(s).replaceAll(" ");
        return s;
    }
}
