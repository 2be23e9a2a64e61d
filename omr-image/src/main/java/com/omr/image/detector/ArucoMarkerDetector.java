package com.omr.image.detector;

import com.omr.common.dto.Marker;
import com.omr.common.dto.SheetPoint;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_objdetect.ArucoDetector;
import org.bytedeco.opencv.opencv_objdetect.DetectorParameters;
import org.bytedeco.opencv.opencv_objdetect.Dictionary;
import org.bytedeco.opencv.opencv_objdetect.RefineParameters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2GRAY;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;
import static org.bytedeco.opencv.global.opencv_objdetect.DICT_6X6_250;
import static org.bytedeco.opencv.global.opencv_objdetect.getPredefinedDictionary;

/**
 * 基于 OpenCV ArUco 的定位标记检测器。
 * <p>
 * 每个标记的角点按 ArUco 原始顺序输出：标记自身的左上、右上、右下、左下。
 * 同一 ID 被重复检出时只保留第一个。
 */
@Slf4j
public class ArucoMarkerDetector implements MarkerDetector {

    private final int dictionaryId;

    public ArucoMarkerDetector() {
        this(DICT_6X6_250);
    }

    public ArucoMarkerDetector(int dictionaryId) {
        this.dictionaryId = dictionaryId;
    }

    @Override
    public List<Marker> detect(Mat image) {
        Mat gray = image;
        if (image.channels() != 1) {
            gray = new Mat();
            cvtColor(image, gray, COLOR_BGR2GRAY);
        }

        Dictionary dictionary = getPredefinedDictionary(dictionaryId);
        ArucoDetector detector = new ArucoDetector(dictionary, new DetectorParameters(), new RefineParameters());
        MatVector corners = new MatVector();
        Mat ids = new Mat();
        try {
            detector.detectMarkers(gray, corners, ids);
            if (ids.empty()) {
                log.info("未检测到任何定位标记");
                return List.of();
            }

            Map<Integer, Marker> markers = new LinkedHashMap<>();
            // ids 为 CV_32S 的连续矩阵，按线性下标读取
            IntPointer idPtr = new IntPointer(ids.data());
            for (int i = 0; i < (int) corners.size(); i++) {
                int id = idPtr.get(i);
                if (markers.containsKey(id)) {
                    log.debug("标记 {} 被重复检出，忽略", id);
                    continue;
                }
                markers.put(id, new Marker(id, readQuad(corners.get(i))));
            }
            log.info("检测到定位标记: {}", markers.keySet());
            return new ArrayList<>(markers.values());
        } finally {
            ids.release();
            corners.close();
            detector.close();
            if (gray != image) {
                gray.release();
            }
        }
    }

    /**
     * ArUco 角点为 1x4 的 CV_32FC2 矩阵。
     */
    private List<SheetPoint> readQuad(Mat cornerMat) {
        List<SheetPoint> quad = new ArrayList<>(4);
        try (FloatIndexer indexer = cornerMat.createIndexer()) {
            for (int j = 0; j < 4; j++) {
                quad.add(SheetPoint.of(indexer.get(0, j, 0), indexer.get(0, j, 1)));
            }
        }
        return quad;
    }
}
