package com.wshg.productsearch.document;

import com.wshg.productsearch.entity.AttributeDataType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 规范文档中的单个属性：值、类型、语义标签与向量化优先级（越大越靠前）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalAttribute {
    private AttributeValue value;
    private AttributeDataType dataType;
    private String semanticLabel;
    private int priority;
}
