package com.omr.common.exception;

/**
 * 系统基础异常，所有识别异常的父类。
 * <p>
 * 抛出即代表当前这张答题卡无法给出结果，调用方不应重试同一张图片。
 */
public class OmrException extends RuntimeException {

    private final String errorCode;

    public OmrException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OmrException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
