package com.wshg.productsearch.common.convention.errorcode;

/**
 * 商品检索错误码。
 *
 * 错误码规范：
 * - A0xxx: 客户端错误（参数校验等）
 * - B0xxx: 服务端错误（业务逻辑、数据库等）
 * - C0xxx: 外部依赖错误（Ollama 等）
 */
public enum ProductSearchErrorCode implements IErrorCode {

    CLIENT_ERROR("A0001", "客户端请求错误"),

    SERVICE_ERROR("B0001", "服务端执行错误"),

    // ==================== 参数校验错误 (A01xx) ====================
    PARAM_INVALID("A0101", "参数格式错误"),

    /** 待向量化文本为空 */
    TEXT_EMPTY("A0102", "待向量化文本不能为空"),

    // ==================== 业务逻辑错误 (A04xx) ====================
    JOB_NOT_FOUND("A0401", "任务不存在"),

    // ==================== 服务端错误 (B01xx) ====================
    EMBEDDING_STORE_ERROR("B0101", "向量库操作异常"),

    JOB_ENQUEUE_FAILED("B0102", "任务入队失败"),

    // ==================== 外部依赖错误 (C01xx) ====================
    /** Ollama 不可达、返回空向量或数量不一致 */
    EMBEDDING_API_ERROR("C0101", "向量化服务异常"),

    EMBEDDING_DIMENSION_MISMATCH("C0102", "向量维度与配置不一致");

    private final String code;
    private final String message;

    ProductSearchErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return this.code;
    }

    @Override
    public String message() {
        return this.message;
    }
}
