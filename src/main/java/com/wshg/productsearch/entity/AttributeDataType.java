package com.wshg.productsearch.entity;

/**
 * 商品属性定义的数据类型。
 */
public enum AttributeDataType {
    TEXT,
    NUMBER,
    BOOLEAN,
    DATE
}
