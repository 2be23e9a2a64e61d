package com.omr.common.exception;

/**
 * 四角点共线或透视变换矩阵不可逆，无法矫正。
 */
public class DegenerateQuadrilateralException extends OmrException {

    public DegenerateQuadrilateralException(String message) {
        super("DEGENERATE_QUAD", message);
    }

    public DegenerateQuadrilateralException(String message, Throwable cause) {
        super("DEGENERATE_QUAD", message, cause);
    }
}
