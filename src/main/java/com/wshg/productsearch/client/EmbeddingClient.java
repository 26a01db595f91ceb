package com.wshg.productsearch.client;

import java.util.List;

/**
 * 文本向量化客户端。
 */
public interface EmbeddingClient {

    /**
     * 单条文本生成向量。
     *
     * @throws com.wshg.productsearch.common.convention.exception.InvalidInputException 文本为空
     * @throws com.wshg.productsearch.common.convention.exception.UpstreamException     后端不可达或响应异常
     * @throws java.util.concurrent.CancellationException                               调用线程被中断
     */
    float[] generateEmbedding(String text);

    /**
     * 批量生成向量，结果与输入按位置对应；输入为空时不调用后端，直接返回空列表。
     */
    List<float[]> generateEmbeddings(List<String> texts);

    /** 后端可用且已加载配置的模型时返回 true，任何异常都返回 false */
    boolean testConnection();

    String getModelName();

    /** 运维在更换模型时递增 */
    int getModelVersion();

    int getDimension();
}
