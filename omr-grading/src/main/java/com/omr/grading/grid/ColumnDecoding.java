package com.omr.grading.grid;

import com.omr.common.dto.ColumnRegion;
import com.omr.common.dto.ScanAdvisory;
import com.omr.common.dto.SlotAssignment;
import lombok.Value;

import java.util.List;

/**
 * 单列网格解码结果。
 */
@Value
public class ColumnDecoding {

    ColumnRegion column;

    List<SlotAssignment> assignments;

    /** 识别出的行数 */
    int rowCount;

    List<ScanAdvisory> advisories;
}
