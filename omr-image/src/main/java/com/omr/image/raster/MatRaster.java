package com.omr.image.raster;

import com.omr.common.util.GrayscaleRaster;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_8U;

/**
 * 以单通道 8 位 Mat 为底的灰度视图。用完需关闭以释放索引器。
 */
public class MatRaster implements GrayscaleRaster, AutoCloseable {

    private final Mat mat;
    private final UByteIndexer indexer;

    public MatRaster(Mat mat) {
        if (mat.channels() != 1 || mat.depth() != CV_8U) {
            throw new IllegalArgumentException("只支持单通道 8 位图像");
        }
        this.mat = mat;
        this.indexer = mat.createIndexer();
    }

    @Override
    public int width() {
        return mat.cols();
    }

    @Override
    public int height() {
        return mat.rows();
    }

    @Override
    public int intensityAt(int x, int y) {
        return indexer.get(y, x);
    }

    @Override
    public void close() {
        indexer.close();
    }
}
