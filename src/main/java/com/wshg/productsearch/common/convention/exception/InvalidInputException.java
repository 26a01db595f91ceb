package com.wshg.productsearch.common.convention.exception;

import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;

/**
 * 向量化输入非法（空文本等），在调用 Ollama 之前抛出。
 */
public class InvalidInputException extends ClientException {

    public InvalidInputException(String message) {
        super(message, ProductSearchErrorCode.TEXT_EMPTY);
    }
}
