package com.wshg.productsearch.document;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 向量化分块，index 从 0 开始，0 号块信息最密集。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentChunk {
    private int index;
    private String text;
}
