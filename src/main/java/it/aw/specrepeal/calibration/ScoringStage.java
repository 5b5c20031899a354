package it.aw.specrepeal.calibration;

/**
 * Stadio della pipeline di calibrazione: riceve il punteggio corrente e restituisce
 * quello aggiornato. Il risultato viene riportato in [0, 100] dal calibratore.
 */
public interface ScoringStage {

    String name();

    double apply(double score, CalibrationInput input);
}
