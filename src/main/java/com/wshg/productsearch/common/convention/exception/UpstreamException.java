package com.wshg.productsearch.common.convention.exception;

import com.wshg.productsearch.common.convention.errorcode.IErrorCode;
import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;

/**
 * 向量化后端异常：不可达、返回空向量、数量不一致或响应格式错误。
 * 不在内部重试，重试由后台任务队列负责。
 */
public class UpstreamException extends ServiceException {

    public UpstreamException(String message) {
        super(message, null, ProductSearchErrorCode.EMBEDDING_API_ERROR);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause, ProductSearchErrorCode.EMBEDDING_API_ERROR);
    }

    public UpstreamException(String message, IErrorCode errorCode) {
        super(message, null, errorCode);
    }
}
