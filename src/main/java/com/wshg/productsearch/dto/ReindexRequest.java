package com.wshg.productsearch.dto;

import lombok.Data;

import java.util.UUID;

/**
 * POST /api/embeddings/reindex 请求体，两个字段都可为空（全平台重建）。
 */
@Data
public class ReindexRequest {
    private UUID tenantId;
    private UUID shopId;
}
