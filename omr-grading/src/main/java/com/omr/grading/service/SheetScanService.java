package com.omr.grading.service;

import com.omr.common.dto.Blob;
import com.omr.common.dto.ColumnRegion;
import com.omr.common.dto.CornerObservation;
import com.omr.common.dto.CornerPosition;
import com.omr.common.dto.DecodeResult;
import com.omr.common.dto.LayoutSpec;
import com.omr.common.dto.Marker;
import com.omr.common.dto.Quad;
import com.omr.common.dto.ScanReport;
import com.omr.common.util.IdGenerator;
import com.omr.grading.answer.AnswerKey;
import com.omr.grading.geometry.GeometryReconstructor;
import com.omr.grading.geometry.MarkerCornerSelector;
import com.omr.grading.layout.MarkerResolver;
import com.omr.image.config.OpenCvProperties;
import com.omr.image.detector.BlobDetector;
import com.omr.image.detector.MarkerDetector;
import com.omr.image.detector.QrCodeReader;
import com.omr.image.raster.MatRaster;
import com.omr.image.service.ImagePreprocessor;
import com.omr.image.service.SheetRectifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 答题卡扫描入口：从一张照片得到完整判分结果。
 * <p>
 * 流程：解码图片 → 读取二维码 → 检测定位标记 → 识别版式 → 重建四角 → 透视矫正
 * → 黑白化 → 逐列检测气泡 → 网格解码、填涂判定、判分汇总。
 * 任何一步抛出的 {@link com.omr.common.exception.OmrException} 都意味着这张卡没有结果。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SheetScanService {

    private final ImagePreprocessor preprocessor;
    private final SheetRectifier rectifier;
    private final MarkerDetector markerDetector;
    private final BlobDetector blobDetector;
    private final QrCodeReader qrCodeReader;
    private final OpenCvProperties imageProperties;
    private final MarkerResolver markerResolver;
    private final MarkerCornerSelector cornerSelector;
    private final GeometryReconstructor reconstructor;
    private final AnswerGridService answerGridService;

    public ScanReport scan(byte[] imageBytes, List<Integer> answerKey) {
        return scan(imageBytes, AnswerKey.of(answerKey));
    }

    public ScanReport scan(byte[] imageBytes, AnswerKey key) {
        long startTime = System.currentTimeMillis();
        String scanId = IdGenerator.withPrefix("scan");
        log.info("[{}] 开始扫描答题卡, 大小: {} bytes, 标准答案 {} 题", scanId,
                imageBytes == null ? 0 : imageBytes.length, key.size());

        Mat source = preprocessor.readImage(imageBytes);
        Mat canonical = null;
        Mat twoTone = null;
        try {
            String qrCodeData = imageProperties.isQrEnabled()
                    ? qrCodeReader.read(source).orElse(null)
                    : null;

            // === 第1步：定位标记 → 版式 ===
            List<Marker> markers = markerDetector.detect(source);
            Set<Integer> observedIds = new LinkedHashSet<>();
            markers.forEach(m -> observedIds.add(m.getId()));
            LayoutSpec layout = markerResolver.resolve(observedIds);

            // === 第2步：重建纸张四角并矫正 ===
            Map<CornerPosition, CornerObservation> corners = cornerSelector.select(layout, markers);
            int observed = (int) corners.values().stream().filter(CornerObservation::isKnown).count();
            Quad quad = reconstructor.reconstruct(corners, layout.expectedRatio());
            canonical = rectifier.rectify(source, quad, layout.getCanonicalWidth(), layout.getCanonicalHeight());
            twoTone = preprocessor.toTwoTone(canonical);

            // === 第3步：逐列检测气泡 ===
            Map<Integer, List<Blob>> blobsByColumn = new TreeMap<>();
            for (ColumnRegion column : layout.getColumns()) {
                Mat region = preprocessor.crop(twoTone, column);
                try {
                    blobsByColumn.put(column.getIndex(),
                            blobDetector.detect(region, layout.getBlobMinRadius(), layout.getBlobMaxRadius()));
                } finally {
                    region.release();
                }
            }

            // === 第4步：解码判分 ===
            DecodeContext context = DecodeContext.builder()
                    .scanId(scanId)
                    .layout(layout)
                    .quad(quad)
                    .observedMarkers(observed)
                    .build();
            DecodeResult result;
            try (MatRaster raster = new MatRaster(twoTone)) {
                result = answerGridService.decode(context, raster, blobsByColumn, key);
            }

            long elapsed = System.currentTimeMillis() - startTime;
            log.info("[{}] 扫描完成: 版式 {}, 对 {} / 错 {} / 多选 {} / 未答 {}, 耗时 {}ms", scanId,
                    layout.getSizeClass(), result.rightAnswers().size(), result.wrongAnswers().size(),
                    result.multipleAnswers().size(), result.unanswered().size(), elapsed);

            return ScanReport.builder()
                    .scanId(scanId)
                    .qrCodeData(qrCodeData)
                    .sizeClass(layout.getSizeClass())
                    .observedMarkerCount(observed)
                    .result(result)
                    .processingTimeMs(elapsed)
                    .build();
        } finally {
            source.release();
            if (canonical != null) canonical.release();
            if (twoTone != null) twoTone.release();
        }
    }
}
