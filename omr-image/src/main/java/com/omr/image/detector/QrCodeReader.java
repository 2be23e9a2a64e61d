package com.omr.image.detector;

import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Optional;

/**
 * 二维码读取器。读不到时返回空，不抛异常。
 */
public interface QrCodeReader {

    Optional<String> read(Mat image);
}
