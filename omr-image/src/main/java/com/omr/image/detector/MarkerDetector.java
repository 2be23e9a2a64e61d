package com.omr.image.detector;

import com.omr.common.dto.Marker;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;

/**
 * 定位标记检测器。
 * <p>
 * 不保证能找到所有标记；找不到时返回空列表而不是抛异常。
 */
public interface MarkerDetector {

    /**
     * @param image 原图（彩色或灰度）
     * @return 检测到的标记，ID 互不相同
     */
    List<Marker> detect(Mat image);
}
