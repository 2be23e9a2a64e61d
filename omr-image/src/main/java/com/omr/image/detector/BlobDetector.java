package com.omr.image.detector;

import com.omr.common.dto.Blob;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;

/**
 * 气泡（圆形）检测器。可能多检或漏检，调用方需容忍。
 */
public interface BlobDetector {

    /**
     * @param region    单列答题区域（黑白图）
     * @param minRadius 最小半径
     * @param maxRadius 最大半径
     * @return 以 region 左上角为原点的候选气泡，无固定顺序
     */
    List<Blob> detect(Mat region, int minRadius, int maxRadius);
}
