package com.example.manifestextract.service;

public enum CellKind {
    TEXT,
    NUMBER,
    DATE,
    EMPTY
}
