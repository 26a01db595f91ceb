package com.wshg.productsearch.event;

public enum ProductChangeType {
    CREATED,
    UPDATED,
    DELETED,
    PUBLISHED,
    UNPUBLISHED,
    BULK_REINDEX
}
