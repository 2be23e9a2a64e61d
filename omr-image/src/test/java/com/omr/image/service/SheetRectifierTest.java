package com.omr.image.service;

import com.omr.common.dto.Quad;
import com.omr.common.dto.SheetPoint;
import com.omr.common.exception.DegenerateQuadrilateralException;
import com.omr.common.exception.ImageProcessingException;
import com.omr.image.config.OpenCvProperties;
import com.omr.image.raster.MatRaster;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.Test;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.junit.jupiter.api.Assertions.*;

class SheetRectifierTest {

    private final SheetRectifier rectifier = new SheetRectifier(new OpenCvProperties());

    private static Quad quad(double x1, double y1, double x2, double y2, double x3, double y3, double x4, double y4) {
        return Quad.builder()
                .topLeft(SheetPoint.of(x1, y1))
                .topRight(SheetPoint.of(x2, y2))
                .bottomLeft(SheetPoint.of(x3, y3))
                .bottomRight(SheetPoint.of(x4, y4))
                .build();
    }

    @Test
    void rectify_outputHasLayoutSize() {
        Mat source = new Mat(480, 640, CV_8UC1, new Scalar(255));
        Mat out = rectifier.rectify(source, quad(30, 20, 600, 40, 10, 460, 620, 450), 236, 338);

        assertEquals(236, out.cols());
        assertEquals(338, out.rows());
        source.release();
        out.release();
    }

    @Test
    void rectify_mapsQuadOntoCanonicalFrame() {
        Mat source = new Mat(400, 600, CV_8UC1, new Scalar(255));
        Mat block = new Mat(source, new Rect(100, 50, 100, 100));
        block.put(new Scalar(0));
        block.release();

        // 以 (100, 50) 为左上角的 200x200 区域，平移到原点
        Mat out = rectifier.rectify(source, quad(100, 50, 299, 50, 100, 249, 299, 249), 200, 200);

        try (MatRaster raster = new MatRaster(out)) {
            assertEquals(0, raster.intensityAt(50, 50));
            assertEquals(255, raster.intensityAt(150, 150));
            assertEquals(255, raster.intensityAt(150, 50));
        }
        source.release();
        out.release();
    }

    @Test
    void rectify_collinearCornersRejected() {
        Mat source = new Mat(100, 100, CV_8UC1, new Scalar(255));

        assertThrows(DegenerateQuadrilateralException.class,
                () -> rectifier.rectify(source, quad(0, 0, 30, 30, 60, 60, 90, 90), 50, 50));
        source.release();
    }

    @Test
    void rectify_coincidentCornersRejected() {
        Mat source = new Mat(100, 100, CV_8UC1, new Scalar(255));

        assertThrows(DegenerateQuadrilateralException.class,
                () -> rectifier.rectify(source, quad(10, 10, 10, 10, 10, 90, 90, 90), 50, 50));
        source.release();
    }

    @Test
    void rectify_emptySource_wrappedAsImageError() {
        Mat empty = new Mat();

        ImageProcessingException e = assertThrows(ImageProcessingException.class,
                () -> rectifier.rectify(empty, quad(10, 10, 90, 10, 10, 90, 90, 90), 50, 50));
        assertNotNull(e.getCause());
    }
}
