package com.wshg.productsearch.common.convention.exception;

import com.wshg.productsearch.common.convention.errorcode.IErrorCode;
import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;

import java.util.Optional;

/**
 * 服务端异常：向量库读写、任务入队、展示元数据序列化等失败。
 * GlobalExceptionHandler 按 HTTP 500 返回，子类 {@link UpstreamException}（Ollama 故障）按 502 返回。
 * 在后台任务中抛出时由 EmbeddingJobRunner 记录 lastError 并按退避重试。
 */
public class ServiceException extends AbstractException {

    public ServiceException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    /** 错误码默认为 B0001 */
    public ServiceException(String message) {
        this(message, null, ProductSearchErrorCode.SERVICE_ERROR);
    }

    public ServiceException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    /**
     * @param message 为 null 时使用错误码自带的提示
     * @param cause   底层异常，例如 DataAccessException、JsonProcessingException
     */
    public ServiceException(String message, Throwable cause, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), cause, errorCode);
    }
}
