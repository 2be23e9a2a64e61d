package com.omr.image.detector;

import com.omr.common.dto.Blob;
import com.omr.image.config.OpenCvProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 基于霍夫变换的气泡检测：高斯模糊后用 HOUGH_GRADIENT 找圆。
 * <p>
 * 圆心和半径取整，与下游按整数像素采样保持一致。
 */
@Slf4j
@RequiredArgsConstructor
public class HoughBlobDetector implements BlobDetector {

    private final OpenCvProperties properties;

    @Override
    public List<Blob> detect(Mat region, int minRadius, int maxRadius) {
        Mat blurred = new Mat();
        Mat circles = new Mat();
        try {
            int k = properties.getBlobBlurKernelSize();
            GaussianBlur(region, blurred, new Size(k, k), properties.getBlobBlurSigma());
            HoughCircles(blurred, circles, HOUGH_GRADIENT,
                    properties.getHoughDp(), properties.getHoughMinDist(),
                    properties.getHoughParam1(), properties.getHoughParam2(),
                    minRadius, maxRadius);

            if (circles.empty()) {
                return List.of();
            }

            // 输出为 1xN 的 CV_32FC3：(x, y, r)
            List<Blob> blobs = new ArrayList<>(circles.cols());
            try (FloatIndexer indexer = circles.createIndexer()) {
                for (int i = 0; i < circles.cols(); i++) {
                    blobs.add(Blob.of(
                            Math.round(indexer.get(0, i, 0)),
                            Math.round(indexer.get(0, i, 1)),
                            Math.round(indexer.get(0, i, 2))));
                }
            }
            log.debug("检测到 {} 个候选气泡 (半径 {}~{})", blobs.size(), minRadius, maxRadius);
            return blobs;
        } finally {
            blurred.release();
            circles.release();
        }
    }
}
