package com.wshg.productsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * 商品语义检索配置：Ollama 向量模型、向量库、分块、检索与后台任务队列。
 * 更换向量模型时需同步递增 embeddingModelVersion，配合「重建过期向量」接口分批重建。
 */
@ConfigurationProperties(prefix = "product-search")
public class ProductSearchProperties {

    // ---------- 总开关 ----------
    /** 关闭后事件分发与向量生成均直接跳过（Ollama 不可用或测试时使用） */
    private boolean enableEmbeddingGeneration = true;

    // ---------- 向量库 ----------
    /** mysql / memory / file */
    private String vectorStoreType = "mysql";
    /** 向量库文件路径（仅 vector-store-type=file 时生效） */
    private String vectorStorePath = "data/product-embeddings.json";

    // ---------- Ollama 向量模型 ----------
    private String ollamaBaseUrl = "http://localhost:11434";
    private String embeddingModel = "embeddinggemma";
    /** 运维在更换模型时手动递增 */
    private int embeddingModelVersion = 1;
    private int embeddingDimensions = 768;
    /** 维度不一致时是否直接失败；默认仅告警并照常返回 */
    private boolean failOnDimensionMismatch = false;
    private int connectTimeoutMs = 10_000;
    private int readTimeoutMs = 60_000;

    // ---------- 分块 ----------
    private int maxTokensPerChunk = 512;

    // ---------- 检索 ----------
    private int defaultTopK = 10;
    /** 首次召回条数 = topK * candidateMultiplier，为按商品去重预留余量 */
    private int candidateMultiplier = 2;
    /** 去重后不足 topK 时最多扩大召回的轮数（含首轮） */
    private int maxFetchRounds = 3;
    private int snippetLength = 200;

    // ---------- 后台任务 ----------
    private int jobWorkerThreads = 2;
    private int jobQueueCapacity = 100;
    private long jobPollIntervalMs = 2_000;
    private int jobPollBatchSize = 20;
    private int jobMaxAttempts = 5;
    private long jobRetryBackoffSeconds = 10;
    /** RUNNING 超过该时长未更新视为执行实例已退出，任务回收为 PENDING */
    private long jobRunningLeaseMinutes = 15;
    /** DONE / FAILED 任务保留时长，<= 0 时不清理 */
    private long jobRetentionHours = 168;
    /** 回收与清理的执行间隔 */
    private long jobMaintenanceIntervalMs = 300_000;

    public boolean isEnableEmbeddingGeneration() { return enableEmbeddingGeneration; }
    public void setEnableEmbeddingGeneration(boolean enableEmbeddingGeneration) { this.enableEmbeddingGeneration = enableEmbeddingGeneration; }
    public String getVectorStoreType() { return vectorStoreType; }
    public void setVectorStoreType(String vectorStoreType) { this.vectorStoreType = vectorStoreType; }
    public String getVectorStorePath() { return vectorStorePath; }
    public void setVectorStorePath(String vectorStorePath) { this.vectorStorePath = vectorStorePath; }

    public String getOllamaBaseUrl() { return ollamaBaseUrl; }
    public void setOllamaBaseUrl(String ollamaBaseUrl) { this.ollamaBaseUrl = ollamaBaseUrl; }
    public String getEmbeddingModel() { return embeddingModel; }
    public void setEmbeddingModel(String embeddingModel) { this.embeddingModel = embeddingModel; }
    public int getEmbeddingModelVersion() { return embeddingModelVersion; }
    public void setEmbeddingModelVersion(int embeddingModelVersion) { this.embeddingModelVersion = embeddingModelVersion; }
    public int getEmbeddingDimensions() { return embeddingDimensions; }
    public void setEmbeddingDimensions(int embeddingDimensions) { this.embeddingDimensions = embeddingDimensions; }
    public boolean isFailOnDimensionMismatch() { return failOnDimensionMismatch; }
    public void setFailOnDimensionMismatch(boolean failOnDimensionMismatch) { this.failOnDimensionMismatch = failOnDimensionMismatch; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    public int getReadTimeoutMs() { return readTimeoutMs; }
    public void setReadTimeoutMs(int readTimeoutMs) { this.readTimeoutMs = readTimeoutMs; }

    public int getMaxTokensPerChunk() { return maxTokensPerChunk; }
    public void setMaxTokensPerChunk(int maxTokensPerChunk) { this.maxTokensPerChunk = maxTokensPerChunk; }

    public int getDefaultTopK() { return defaultTopK; }
    public void setDefaultTopK(int defaultTopK) { this.defaultTopK = defaultTopK; }
    public int getCandidateMultiplier() { return candidateMultiplier; }
    public void setCandidateMultiplier(int candidateMultiplier) { this.candidateMultiplier = candidateMultiplier; }
    public int getMaxFetchRounds() { return maxFetchRounds; }
    public void setMaxFetchRounds(int maxFetchRounds) { this.maxFetchRounds = maxFetchRounds; }
    public int getSnippetLength() { return snippetLength; }
    public void setSnippetLength(int snippetLength) { this.snippetLength = snippetLength; }

    public int getJobWorkerThreads() { return jobWorkerThreads; }
    public void setJobWorkerThreads(int jobWorkerThreads) { this.jobWorkerThreads = jobWorkerThreads; }
    public int getJobQueueCapacity() { return jobQueueCapacity; }
    public void setJobQueueCapacity(int jobQueueCapacity) { this.jobQueueCapacity = jobQueueCapacity; }
    public long getJobPollIntervalMs() { return jobPollIntervalMs; }
    public void setJobPollIntervalMs(long jobPollIntervalMs) { this.jobPollIntervalMs = jobPollIntervalMs; }
    public int getJobPollBatchSize() { return jobPollBatchSize; }
    public void setJobPollBatchSize(int jobPollBatchSize) { this.jobPollBatchSize = jobPollBatchSize; }
    public int getJobMaxAttempts() { return jobMaxAttempts; }
    public void setJobMaxAttempts(int jobMaxAttempts) { this.jobMaxAttempts = jobMaxAttempts; }
    public long getJobRetryBackoffSeconds() { return jobRetryBackoffSeconds; }
    public void setJobRetryBackoffSeconds(long jobRetryBackoffSeconds) { this.jobRetryBackoffSeconds = jobRetryBackoffSeconds; }
    public long getJobRunningLeaseMinutes() { return jobRunningLeaseMinutes; }
    public void setJobRunningLeaseMinutes(long jobRunningLeaseMinutes) { this.jobRunningLeaseMinutes = jobRunningLeaseMinutes; }
    public long getJobRetentionHours() { return jobRetentionHours; }
    public void setJobRetentionHours(long jobRetentionHours) { this.jobRetentionHours = jobRetentionHours; }
    public long getJobMaintenanceIntervalMs() { return jobMaintenanceIntervalMs; }
    public void setJobMaintenanceIntervalMs(long jobMaintenanceIntervalMs) { this.jobMaintenanceIntervalMs = jobMaintenanceIntervalMs; }

    public Path getVectorStoreFilePath() { return Path.of(vectorStorePath).toAbsolutePath(); }
}
