package it.aw.specrepeal.model;

/** Punteggio dopo uno stadio della pipeline di calibrazione. */
public record StageScore(String stage, double score) {}
