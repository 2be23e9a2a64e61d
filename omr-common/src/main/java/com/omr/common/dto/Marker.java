package com.omr.common.dto;

import lombok.Value;

import java.util.List;

/**
 * 定位标记检测结果：标记 ID 及其四个角点（检测器原始顺序）。
 */
@Value
public class Marker {

    int id;

    List<SheetPoint> cornerQuad;

    public Marker(int id, List<SheetPoint> cornerQuad) {
        if (cornerQuad == null || cornerQuad.size() != 4) {
            throw new IllegalArgumentException("标记 " + id + " 必须有 4 个角点");
        }
        this.id = id;
        this.cornerQuad = List.copyOf(cornerQuad);
    }
}
