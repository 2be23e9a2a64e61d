package com.omr.common.exception;

/**
 * 可用的定位标记少于 2 个，无法重建纸张四角。
 */
public class InsufficientMarkersException extends OmrException {

    private final int observed;

    public InsufficientMarkersException(int observed) {
        super("INSUFFICIENT_MARKERS", "定位标记不足: 检测到 " + observed + " 个，至少需要 2 个");
        this.observed = observed;
    }

    public int getObserved() {
        return observed;
    }
}
