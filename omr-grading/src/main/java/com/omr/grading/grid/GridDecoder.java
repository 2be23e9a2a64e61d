package com.omr.grading.grid;

import com.omr.common.dto.AdvisoryCode;
import com.omr.common.dto.AnswerOption;
import com.omr.common.dto.Blob;
import com.omr.common.dto.ColumnRegion;
import com.omr.common.dto.ScanAdvisory;
import com.omr.common.dto.Slot;
import com.omr.common.dto.SlotAssignment;
import com.omr.grading.config.GradingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 答题网格解码：把一列中无序的气泡按空间位置分配到 (题号, 选项)。
 * <p>
 * 题号由行在本列中的纵向位置决定：相邻两个识别行之间的 Y 距离按行距换算成跨过的行数，
 * 所以某一行气泡缺失、多检乃至整行漏检都不会改变其他行的题号。
 * 行距取相邻行间距的中位数（只统计接近名义行距 列高/题数 的间距），没有可用间距时取名义行距。
 * 列首若有整行漏检则无从判断，第一个识别行总是记为本列第 1 题。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GridDecoder {

    private static final int OPTIONS_PER_ROW = AnswerOption.values().length;

    private final GradingProperties properties;

    public ColumnDecoding decode(ColumnRegion column, List<Blob> blobs) {
        List<ScanAdvisory> advisories = new ArrayList<>();
        if (blobs == null || blobs.isEmpty()) {
            advisories.add(advisory(AdvisoryCode.NO_BLOBS_IN_COLUMN, column, -1,
                    "第 " + column.getIndex() + " 列未识别到任何气泡"));
            log.warn("第 {} 列未识别到任何气泡", column.getIndex());
            return new ColumnDecoding(column, List.of(), 0, advisories);
        }

        List<List<Blob>> rows = groupRows(blobs);
        double pitch = estimatePitch(column, rows);

        List<SlotAssignment> assignments = new ArrayList<>();
        int rowIndex = 0;
        double previousY = 0;
        for (int i = 0; i < rows.size(); i++) {
            List<Blob> row = rows.get(i);
            row.sort(Comparator.comparingDouble(Blob::getX));

            double rowY = meanY(row);
            if (i > 0) {
                int step = Math.max(1, (int) Math.round((rowY - previousY) / pitch));
                if (step > 1) {
                    advisories.add(advisory(AdvisoryCode.MISSING_ROW, column, rowIndex + 1,
                            "第 " + (column.questionBase() + rowIndex + 2) + " 题起有 " + (step - 1) + " 行未识别到气泡"));
                }
                rowIndex += step;
            }
            previousY = rowY;

            int questionNumber = column.questionBase() + rowIndex + 1;
            int usable = Math.min(OPTIONS_PER_ROW, row.size());
            for (int k = 0; k < usable; k++) {
                assignments.add(new SlotAssignment(Slot.of(questionNumber, AnswerOption.ofIndex(k)), row.get(k)));
            }

            if (row.size() > OPTIONS_PER_ROW) {
                log.debug("第 {} 列第 {} 行检出 {} 个气泡，第 5 个起忽略", column.getIndex(), rowIndex, row.size());
            }
            if (row.size() < properties.getMinBlobsPerRow()) {
                advisories.add(advisory(AdvisoryCode.SHORT_ROW, column, rowIndex,
                        "第 " + questionNumber + " 题仅识别到 " + row.size() + " 个气泡"));
            }
        }

        int expectedRows = column.getQuestionsPerColumn();
        if (rows.size() < expectedRows * properties.getMinRowDetectionRatio()) {
            advisories.add(advisory(AdvisoryCode.LOW_ROW_DETECTION, column, -1,
                    "第 " + column.getIndex() + " 列仅识别到 " + rows.size() + "/" + expectedRows + " 行"));
        }
        if (rowIndex + 1 > expectedRows) {
            log.debug("第 {} 列行位置排到第 {} 行，多于每列题数 {}", column.getIndex(), rowIndex + 1, expectedRows);
        }

        for (ScanAdvisory advisory : advisories) {
            log.warn("扫描质量提示 [{}]: {}", advisory.getCode(), advisory.getMessage());
        }
        log.debug("第 {} 列: {} 个气泡, {} 行, 行距 {}, {} 个槽位", column.getIndex(), blobs.size(), rows.size(),
                pitch, assignments.size());
        return new ColumnDecoding(column, assignments, rows.size(), advisories);
    }

    /**
     * 按 Y 排序后贪心分行：与上一个气泡的 Y 差超过容差即开始新行。
     * 行的顺序即 Y 升序，无需再排。
     */
    List<List<Blob>> groupRows(List<Blob> blobs) {
        List<Blob> sorted = new ArrayList<>(blobs);
        sorted.sort(Comparator.comparingDouble(Blob::getY));

        double tolerance = properties.getRowTolerance();
        List<List<Blob>> rows = new ArrayList<>();
        List<Blob> currentRow = new ArrayList<>();
        currentRow.add(sorted.get(0));

        for (int i = 1; i < sorted.size(); i++) {
            Blob curr = sorted.get(i);
            Blob previous = currentRow.get(currentRow.size() - 1);
            if (curr.getY() - previous.getY() > tolerance) {
                rows.add(currentRow);
                currentRow = new ArrayList<>();
            }
            currentRow.add(curr);
        }
        rows.add(currentRow);
        return rows;
    }

    /**
     * 行距估计：相邻行中心 Y 差落在名义行距 0.5~1.5 倍之间的取中位数，否则用名义行距。
     */
    double estimatePitch(ColumnRegion column, List<List<Blob>> rows) {
        double nominal = (double) column.getHeight() / column.getQuestionsPerColumn();
        List<Double> gaps = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            double gap = meanY(rows.get(i)) - meanY(rows.get(i - 1));
            if (gap > nominal * 0.5 && gap < nominal * 1.5) {
                gaps.add(gap);
            }
        }
        if (gaps.isEmpty()) {
            return nominal;
        }
        Collections.sort(gaps);
        int mid = gaps.size() / 2;
        return gaps.size() % 2 == 1 ? gaps.get(mid) : (gaps.get(mid - 1) + gaps.get(mid)) / 2;
    }

    private static double meanY(List<Blob> row) {
        double sum = 0;
        for (Blob blob : row) {
            sum += blob.getY();
        }
        return sum / row.size();
    }

    private ScanAdvisory advisory(AdvisoryCode code, ColumnRegion column, int row, String message) {
        return ScanAdvisory.builder()
                .code(code)
                .column(column.getIndex())
                .row(row)
                .message(message)
                .build();
    }
}
