package com.wshg.productsearch.common.convention.exception;

import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ServiceExceptionTest {

    @Test
    void messageOnly_defaultsToServiceErrorCode() {
        ServiceException e = new ServiceException("store write failed");

        assertEquals("B0001", e.getErrorCode());
        assertEquals("store write failed", e.getErrorMessage());
    }

    @Test
    void nullMessage_fallsBackToErrorCodeText() {
        IOException cause = new IOException("disk full");
        ServiceException e = new ServiceException(null, cause, ProductSearchErrorCode.JOB_ENQUEUE_FAILED);

        assertEquals("B0102", e.getErrorCode());
        assertEquals("任务入队失败", e.getMessage());
        assertSame(cause, e.getCause());
    }

    @Test
    void upstreamFailure_isAServiceException() {
        assertInstanceOf(ServiceException.class,
                new UpstreamException("ollama down", ProductSearchErrorCode.EMBEDDING_API_ERROR));
    }
}
