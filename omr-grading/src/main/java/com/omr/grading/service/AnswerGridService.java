package com.omr.grading.service;

import com.omr.common.dto.AdvisoryCode;
import com.omr.common.dto.Blob;
import com.omr.common.dto.ColumnRegion;
import com.omr.common.dto.DecodeResult;
import com.omr.common.dto.FillState;
import com.omr.common.dto.LayoutSpec;
import com.omr.common.dto.QuestionVerdict;
import com.omr.common.dto.ScanAdvisory;
import com.omr.common.util.GrayscaleRaster;
import com.omr.grading.answer.AnswerAggregator;
import com.omr.grading.answer.AnswerKey;
import com.omr.grading.fill.FillClassifier;
import com.omr.grading.grid.ColumnDecoding;
import com.omr.grading.grid.GridDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 矫正之后的解码流水线：网格解码 → 填涂判定 → 判分汇总。
 * <p>
 * 各列互相独立，结果按题号合并，与列的处理顺序无关。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerGridService {

    private final GridDecoder gridDecoder;
    private final FillClassifier fillClassifier;
    private final AnswerAggregator answerAggregator;

    /**
     * @param context       本张答题卡的上下文
     * @param canonical     黑白标准图
     * @param blobsByColumn 列序号 → 该列检出的气泡（列内局部坐标）；缺省视为无气泡
     * @param key           标准答案
     */
    public DecodeResult decode(DecodeContext context, GrayscaleRaster canonical,
                               Map<Integer, List<Blob>> blobsByColumn, AnswerKey key) {
        LayoutSpec layout = context.getLayout();
        if (key.size() > layout.totalPrintedQuestions()) {
            log.warn("标准答案有 {} 题，多于答题卡印刷的 {} 题，超出部分将判为未作答",
                    key.size(), layout.totalPrintedQuestions());
        }

        List<ScanAdvisory> advisories = new ArrayList<>();
        if (context.isReconstructed()) {
            advisories.add(ScanAdvisory.builder()
                    .code(AdvisoryCode.MARKERS_RECONSTRUCTED)
                    .column(0)
                    .message("仅检测到 " + context.getObservedMarkers() + "/4 个定位标记，纸张四角由推算得到")
                    .build());
        }

        List<FillState> states = new ArrayList<>();
        for (ColumnRegion column : layout.getColumns()) {
            List<Blob> blobs = blobsByColumn.getOrDefault(column.getIndex(), List.of());
            ColumnDecoding decoding = gridDecoder.decode(column, blobs);
            advisories.addAll(decoding.getAdvisories());
            states.addAll(fillClassifier.classify(canonical, column, decoding.getAssignments(),
                    layout.getFillThreshold()));
        }

        List<QuestionVerdict> verdicts = answerAggregator.aggregate(states, key);
        log.info("[{}] 解码完成: {} 个气泡, {} 条质量提示", context.getScanId(), states.size(), advisories.size());
        return new DecodeResult(verdicts, advisories);
    }
}
