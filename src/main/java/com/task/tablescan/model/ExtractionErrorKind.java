package com.task.tablescan.model;

public enum ExtractionErrorKind {
    NO_TOKENS_PRODUCED,
    NO_TABLE_STRUCTURE_DETECTED,
    RECONSTRUCTION_FAILURE
}
