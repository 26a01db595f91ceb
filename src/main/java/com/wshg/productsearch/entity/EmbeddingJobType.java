package com.wshg.productsearch.entity;

/**
 * 向量流水线的后台任务类型，对应 ProductEmbeddingWorker 的各个入口。
 */
public enum EmbeddingJobType {
    GENERATE,
    DEACTIVATE,
    DELETE,
    ACTIVATE
}
