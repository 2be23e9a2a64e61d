package com.omr.image.service;

import com.omr.common.dto.ColumnRegion;
import com.omr.common.exception.ImageProcessingException;
import com.omr.image.config.OpenCvProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.springframework.stereotype.Service;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 图像预处理服务：解码、灰度化、黑白化、按列裁切。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImagePreprocessor {

    private final OpenCvProperties properties;

    /**
     * 从字节数组读取图片为 OpenCV Mat。
     */
    public Mat readImage(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageProcessingException("图片内容为空");
        }
        try {
            Mat raw = opencv_imgcodecs.imdecode(new Mat(imageBytes), opencv_imgcodecs.IMREAD_COLOR);
            if (raw.empty()) {
                throw new ImageProcessingException("无法解码图片，请确认图片格式正确");
            }
            log.info("图片读取成功: {}x{}", raw.cols(), raw.rows());
            return raw;
        } catch (ImageProcessingException e) {
            throw e;
        } catch (Exception e) {
            throw new ImageProcessingException("读取图片失败", e);
        }
    }

    /**
     * 灰度化处理，已是单通道时直接复制。
     */
    public Mat toGrayscale(Mat src) {
        if (src.channels() == 1) {
            return src.clone();
        }
        Mat gray = new Mat();
        cvtColor(src, gray, COLOR_BGR2GRAY);
        return gray;
    }

    /**
     * 固定阈值黑白化（使用配置的阈值）。
     */
    public Mat toTwoTone(Mat src) {
        return toTwoTone(src, properties.getTwoToneThreshold());
    }

    /**
     * 固定阈值黑白化：灰度高于 threshold 的为 255，其余为 0。
     */
    public Mat toTwoTone(Mat src, int threshold) {
        Mat gray = toGrayscale(src);
        Mat binary = new Mat();
        threshold(gray, binary, threshold, 255, THRESH_BINARY);
        gray.release();
        return binary;
    }

    /**
     * 从标准图中截取一列答题区域（共享像素，不复制）。越界部分会被裁掉。
     */
    public Mat crop(Mat canonical, ColumnRegion column) {
        int x = Math.max(0, column.getX());
        int y = Math.max(0, column.getY());
        int w = Math.min(canonical.cols() - x, column.getWidth());
        int h = Math.min(canonical.rows() - y, column.getHeight());
        if (w <= 0 || h <= 0) {
            throw new ImageProcessingException("第 " + column.getIndex() + " 列区域超出标准图范围");
        }
        return new Mat(canonical, new Rect(x, y, w, h));
    }

    /**
     * Mat 转字节数组（PNG 格式）。
     * 使用 JavaCPP 的 BytePointer 重载完成编码。
     */
    public byte[] matToBytes(Mat mat) {
        BytePointer buf = new BytePointer();
        try {
            boolean ok = opencv_imgcodecs.imencode(".png", mat, buf);
            if (!ok || buf.limit() == 0) {
                throw new ImageProcessingException("图片编码为 PNG 失败");
            }
            byte[] result = new byte[(int) buf.limit()];
            buf.get(result);
            return result;
        } finally {
            buf.deallocate();
        }
    }
}
