package it.aw.specrepeal.model;

public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
