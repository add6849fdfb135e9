package com.example.ContextRetriever.model;

public enum DocumentOrigin {
    LOCAL,
    WEB
}
