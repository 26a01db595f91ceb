package com.wshg.productsearch.common.web;

import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;
import com.wshg.productsearch.common.convention.exception.AbstractException;
import com.wshg.productsearch.common.convention.exception.ClientException;
import com.wshg.productsearch.common.convention.exception.UpstreamException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * 全局异常处理：业务异常转为 {code, message}，未知异常统一按服务端错误返回。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                                  HttpServletRequest request) {
        log.warn("[{}] {} - 参数格式错误: {}", request.getMethod(), getFullRequestUrl(request), ex.getName());
        return body(HttpStatus.BAD_REQUEST, ProductSearchErrorCode.PARAM_INVALID.code(),
                "参数格式错误: " + ex.getName());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParam(MissingServletRequestParameterException ex,
                                                                  HttpServletRequest request) {
        log.warn("[{}] {} - 缺少参数: {}", request.getMethod(), getFullRequestUrl(request), ex.getParameterName());
        return body(HttpStatus.BAD_REQUEST, ProductSearchErrorCode.PARAM_INVALID.code(),
                "缺少参数: " + ex.getParameterName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                                    HttpServletRequest request) {
        log.warn("[{}] {} - 请求体无法解析", request.getMethod(), getFullRequestUrl(request));
        return body(HttpStatus.BAD_REQUEST, ProductSearchErrorCode.PARAM_INVALID.code(), "请求体格式错误");
    }

    @ExceptionHandler(AbstractException.class)
    public ResponseEntity<Map<String, Object>> handleAbstractException(AbstractException ex, HttpServletRequest request) {
        HttpStatus status;
        if (ProductSearchErrorCode.JOB_NOT_FOUND.code().equals(ex.getErrorCode())) {
            status = HttpStatus.NOT_FOUND;
        } else if (ex instanceof ClientException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (ex instanceof UpstreamException) {
            status = HttpStatus.BAD_GATEWAY;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (ex.getCause() != null) {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(), getFullRequestUrl(request), ex.getErrorMessage(), ex.getErrorCode(), ex);
        } else {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(), getFullRequestUrl(request), ex.getErrorMessage(), ex.getErrorCode());
        }
        return body(status, ex.getErrorCode(), ex.getErrorMessage());
    }

    @ExceptionHandler(Throwable.class)
    public ResponseEntity<Map<String, Object>> handleThrowable(Throwable throwable, HttpServletRequest request) {
        log.error("[{}] {} - 系统异常", request.getMethod(), getFullRequestUrl(request), throwable);
        return body(HttpStatus.INTERNAL_SERVER_ERROR,
                ProductSearchErrorCode.SERVICE_ERROR.code(), ProductSearchErrorCode.SERVICE_ERROR.message());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of("code", code, "message", message));
    }

    private String getFullRequestUrl(HttpServletRequest request) {
        String queryString = request.getQueryString();
        return request.getRequestURI() + (queryString != null ? "?" + queryString : "");
    }
}
