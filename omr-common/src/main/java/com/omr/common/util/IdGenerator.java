package com.omr.common.util;

import java.util.UUID;

/**
 * ID 生成器工具类。
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    /**
     * 生成带前缀的短 ID，如 "scan-xxxx"，用于在日志中串联同一张答题卡的处理过程。
     */
    public static String withPrefix(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
