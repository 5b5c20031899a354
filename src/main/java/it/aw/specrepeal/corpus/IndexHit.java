package it.aw.specrepeal.corpus;

/** Risultato grezzo di una ricerca sull'indice: posizione del chunk e punteggio nella scala dell'indice. */
public record IndexHit(int chunkIndex, double score, ScoreKind kind) {}
