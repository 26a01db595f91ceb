package com.wshg.productsearch.dto;

import lombok.Data;

import java.util.UUID;

/**
 * POST /api/search 请求体。
 */
@Data
public class SearchRequest {
    private String query;
    private Integer topK;
    private UUID tenantId;
    private UUID shopId;
}
