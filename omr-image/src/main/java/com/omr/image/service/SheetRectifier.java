package com.omr.image.service;

import com.omr.common.dto.Quad;
import com.omr.common.dto.SheetPoint;
import com.omr.common.exception.DegenerateQuadrilateralException;
import com.omr.common.exception.ImageProcessingException;
import com.omr.image.config.OpenCvProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Service;

import java.util.List;

import static org.bytedeco.opencv.global.opencv_imgproc.getPerspectiveTransform;
import static org.bytedeco.opencv.global.opencv_imgproc.warpPerspective;

/**
 * 透视矫正：把照片中的纸张四边形映射为固定尺寸的标准俯视图。
 * <p>
 * 输出尺寸只由版式决定，与原图分辨率、方向无关。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SheetRectifier {

    private static final double MIN_DETERMINANT = 1e-12;

    private final OpenCvProperties properties;

    /**
     * @param source 原图
     * @param quad   纸张四角（左上、右上、左下、右下）
     * @param width  标准图宽度
     * @param height 标准图高度
     * @return width x height 的矫正图
     */
    public Mat rectify(Mat source, Quad quad, int width, int height) {
        if (quad.isDegenerate(properties.getMinQuadArea())) {
            throw new DegenerateQuadrilateralException("四角点共线或面积过小，无法矫正: " + quad);
        }

        Point2f srcPts = toPoint2f(quad);
        Point2f dstPts = new Point2f(4);
        dstPts.put(new float[]{
                0, 0,
                width - 1, 0,
                0, height - 1,
                width - 1, height - 1
        });

        Mat transform;
        try {
            transform = getPerspectiveTransform(srcPts, dstPts);
        } catch (RuntimeException e) {
            throw new DegenerateQuadrilateralException("透视变换矩阵计算失败", e);
        }

        Mat warped = new Mat();
        try {
            double det = transform.empty() ? 0 : opencv_core.determinant(transform);
            if (!Double.isFinite(det) || Math.abs(det) < MIN_DETERMINANT) {
                throw new DegenerateQuadrilateralException("透视变换矩阵不可逆 (det=" + det + ")");
            }
            warpPerspective(source, warped, transform, new Size(width, height));
        } catch (RuntimeException e) {
            warped.release();
            if (e instanceof DegenerateQuadrilateralException) {
                throw e;
            }
            throw new ImageProcessingException("透视矫正失败", e);
        } finally {
            transform.release();
        }
        log.info("透视矫正完成: {}x{} -> {}x{}", source.cols(), source.rows(), width, height);
        return warped;
    }

    private Point2f toPoint2f(Quad quad) {
        List<SheetPoint> pts = quad.toList();
        float[] data = new float[8];
        for (int i = 0; i < 4; i++) {
            data[i * 2] = (float) pts.get(i).getX();
            data[i * 2 + 1] = (float) pts.get(i).getY();
        }
        Point2f result = new Point2f(4);
        result.put(data);
        return result;
    }
}
