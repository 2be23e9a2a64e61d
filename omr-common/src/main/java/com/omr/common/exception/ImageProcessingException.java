package com.omr.common.exception;

/**
 * 图像处理异常（解码失败、编码失败等）。
 */
public class ImageProcessingException extends OmrException {

    public ImageProcessingException(String message) {
        super("IMG_ERROR", message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super("IMG_ERROR", message, cause);
    }
}
