package com.wshg.productsearch.common.convention.exception;

import com.wshg.productsearch.common.convention.errorcode.IErrorCode;
import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;

import java.util.Optional;

/**
 * 客户端异常：由请求参数引起，对应 HTTP 4xx。
 */
public class ClientException extends AbstractException {

    public ClientException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ClientException(String message) {
        this(message, null, ProductSearchErrorCode.CLIENT_ERROR);
    }

    public ClientException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    public ClientException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
