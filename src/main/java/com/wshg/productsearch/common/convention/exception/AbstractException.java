package com.wshg.productsearch.common.convention.exception;

import com.wshg.productsearch.common.convention.errorcode.IErrorCode;
import lombok.Getter;

import java.util.Optional;

/**
 * 业务异常基类，携带错误码。
 */
@Getter
public abstract class AbstractException extends RuntimeException {

    private final String errorCode;

    private final String errorMessage;

    protected AbstractException(String message, Throwable throwable, IErrorCode errorCode) {
        super(message, throwable);
        this.errorCode = errorCode.code();
        this.errorMessage = Optional.ofNullable(message).orElse(errorCode.message());
    }
}
