package com.example.ContextRetriever.model;

/**
 * Linear stages of one retrieval call. No stage is revisited.
 */
public enum RetrievalStage {
    START,
    MEMORY_READ,
    CLASSIFY,
    DISPATCH,
    MERGE,
    MEMORY_WRITE,
    DONE,
    ERROR
}
