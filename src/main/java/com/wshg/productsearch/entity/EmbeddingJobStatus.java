package com.wshg.productsearch.entity;

public enum EmbeddingJobStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED
}
