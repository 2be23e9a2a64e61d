package com.omr.grading.geometry;

import com.omr.common.dto.CornerObservation;
import com.omr.common.dto.CornerPosition;
import com.omr.common.dto.Quad;
import com.omr.common.dto.SheetPoint;
import com.omr.common.exception.InsufficientMarkersException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

import static com.omr.common.dto.CornerPosition.*;

/**
 * 纸张四角重建：由 2~4 个已观测角点和纸张宽高比推算完整四边形。
 * <p>
 * 推算按矩形（仿射）近似进行，透视倾斜越大误差越大，但这里不检测也不报告该误差。
 * <ul>
 *   <li>4 个：原样返回</li>
 *   <li>3 个：平行四边形补第四角</li>
 *   <li>2 个相邻：沿已知边的垂直方向按宽高比平移</li>
 *   <li>2 个对角：按宽高比把对角线分解为宽、高，再按对角线方向旋转</li>
 * </ul>
 */
@Slf4j
@Component
public class GeometryReconstructor {

    private static final double HALF_PI = Math.PI / 2;

    /**
     * @param corners       四个角的观测结果，缺省的角视为未知
     * @param expectedRatio 标准图宽高比 width / height
     */
    public Quad reconstruct(Map<CornerPosition, CornerObservation> corners, double expectedRatio) {
        if (!(expectedRatio > 0) || Double.isInfinite(expectedRatio)) {
            throw new IllegalArgumentException("宽高比必须为正数: " + expectedRatio);
        }

        Map<CornerPosition, SheetPoint> known = new EnumMap<>(CornerPosition.class);
        corners.forEach((position, observation) -> {
            if (observation != null && observation.isKnown()) {
                known.put(position, observation.point());
            }
        });

        switch (known.size()) {
            case 4:
                return quadOf(known);
            case 3:
                return completeParallelogram(known);
            case 2:
                return fromTwoCorners(known, expectedRatio);
            default:
                throw new InsufficientMarkersException(known.size());
        }
    }

    private Quad completeParallelogram(Map<CornerPosition, SheetPoint> known) {
        Map<CornerPosition, SheetPoint> full = new EnumMap<>(known);
        if (!known.containsKey(TOP_LEFT)) {
            full.put(TOP_LEFT, known.get(TOP_RIGHT).plus(known.get(BOTTOM_LEFT).minus(known.get(BOTTOM_RIGHT))));
        } else if (!known.containsKey(TOP_RIGHT)) {
            full.put(TOP_RIGHT, known.get(TOP_LEFT).plus(known.get(BOTTOM_RIGHT).minus(known.get(BOTTOM_LEFT))));
        } else if (!known.containsKey(BOTTOM_LEFT)) {
            full.put(BOTTOM_LEFT, known.get(TOP_LEFT).plus(known.get(BOTTOM_RIGHT).minus(known.get(TOP_RIGHT))));
        } else {
            full.put(BOTTOM_RIGHT, known.get(TOP_RIGHT).plus(known.get(BOTTOM_LEFT).minus(known.get(TOP_LEFT))));
        }
        log.info("缺 1 个角点，按平行四边形补齐");
        return quadOf(full);
    }

    private Quad fromTwoCorners(Map<CornerPosition, SheetPoint> known, double ratio) {
        Map<CornerPosition, SheetPoint> full = new EnumMap<>(known);

        if (known.containsKey(TOP_LEFT) && known.containsKey(BOTTOM_RIGHT)) {
            SheetPoint tl = known.get(TOP_LEFT);
            SheetPoint br = known.get(BOTTOM_RIGHT);
            double[] wh = splitDiagonal(tl.distanceTo(br), ratio);
            // 纸张 X 轴方向 = 对角线方向 - 对角线在纸面内的倾角
            double axis = tl.angleTo(br) - Math.atan2(wh[1], wh[0]);
            full.put(TOP_RIGHT, tl.plus(SheetPoint.polar(wh[0], axis)));
            full.put(BOTTOM_LEFT, tl.plus(SheetPoint.polar(wh[1], axis + HALF_PI)));
            log.info("仅有左上、右下两个角点，按对角线推算");

        } else if (known.containsKey(TOP_RIGHT) && known.containsKey(BOTTOM_LEFT)) {
            SheetPoint tr = known.get(TOP_RIGHT);
            SheetPoint bl = known.get(BOTTOM_LEFT);
            double[] wh = splitDiagonal(tr.distanceTo(bl), ratio);
            double axis = tr.angleTo(bl) - Math.atan2(wh[1], -wh[0]);
            full.put(TOP_LEFT, tr.minus(SheetPoint.polar(wh[0], axis)));
            full.put(BOTTOM_RIGHT, tr.plus(SheetPoint.polar(wh[1], axis + HALF_PI)));
            log.info("仅有右上、左下两个角点，按对角线推算");

        } else if (known.containsKey(TOP_LEFT) && known.containsKey(TOP_RIGHT)) {
            SheetPoint tl = known.get(TOP_LEFT);
            SheetPoint tr = known.get(TOP_RIGHT);
            SheetPoint offset = SheetPoint.polar(tl.distanceTo(tr) / ratio, tl.angleTo(tr) + HALF_PI);
            full.put(BOTTOM_LEFT, tl.plus(offset));
            full.put(BOTTOM_RIGHT, tr.plus(offset));
            log.info("仅有上边两个角点，向下推算");

        } else if (known.containsKey(BOTTOM_LEFT) && known.containsKey(BOTTOM_RIGHT)) {
            SheetPoint bl = known.get(BOTTOM_LEFT);
            SheetPoint br = known.get(BOTTOM_RIGHT);
            SheetPoint offset = SheetPoint.polar(bl.distanceTo(br) / ratio, bl.angleTo(br) - HALF_PI);
            full.put(TOP_LEFT, bl.plus(offset));
            full.put(TOP_RIGHT, br.plus(offset));
            log.info("仅有下边两个角点，向上推算");

        } else if (known.containsKey(TOP_LEFT) && known.containsKey(BOTTOM_LEFT)) {
            SheetPoint tl = known.get(TOP_LEFT);
            SheetPoint bl = known.get(BOTTOM_LEFT);
            SheetPoint offset = SheetPoint.polar(tl.distanceTo(bl) * ratio, tl.angleTo(bl) - HALF_PI);
            full.put(TOP_RIGHT, tl.plus(offset));
            full.put(BOTTOM_RIGHT, bl.plus(offset));
            log.info("仅有左边两个角点，向右推算");

        } else {
            SheetPoint tr = known.get(TOP_RIGHT);
            SheetPoint br = known.get(BOTTOM_RIGHT);
            SheetPoint offset = SheetPoint.polar(tr.distanceTo(br) * ratio, tr.angleTo(br) + HALF_PI);
            full.put(TOP_LEFT, tr.plus(offset));
            full.put(BOTTOM_LEFT, br.plus(offset));
            log.info("仅有右边两个角点，向左推算");
        }
        return quadOf(full);
    }

    /**
     * 对角线长度 d 按宽高比分解：width = d·r/√(1+r²)，height = d/√(1+r²)。
     */
    private double[] splitDiagonal(double diagonal, double ratio) {
        double norm = Math.sqrt(1 + ratio * ratio);
        return new double[]{diagonal * ratio / norm, diagonal / norm};
    }

    private Quad quadOf(Map<CornerPosition, SheetPoint> full) {
        return Quad.builder()
                .topLeft(full.get(TOP_LEFT))
                .topRight(full.get(TOP_RIGHT))
                .bottomLeft(full.get(BOTTOM_LEFT))
                .bottomRight(full.get(BOTTOM_RIGHT))
                .build();
    }
}
