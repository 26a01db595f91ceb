package com.wshg.productsearch.common.convention.errorcode;

/**
 * 错误码接口，所有错误码枚举需实现此接口。
 */
public interface IErrorCode {

    String code();

    String message();
}
