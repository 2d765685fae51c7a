package com.example.manifestextract.service;

public enum FieldType {
    STRING,
    INTEGER,
    DECIMAL,
    DATE
}
