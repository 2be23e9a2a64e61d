package com.omr.grading.fill;

import com.omr.common.dto.Blob;
import com.omr.common.dto.ColumnRegion;
import com.omr.common.dto.FillState;
import com.omr.common.dto.SlotAssignment;
import com.omr.common.util.GrayscaleRaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 填涂判定：在黑白标准图上对气泡做稀疏采样，超过半数采样点发黑即视为已涂。
 * <p>
 * 落在图外的采样点既不计入分子也不计入分母；5 点全部有效时需要至少 3 点发黑。
 * 这是一种粗粒度的快速判定，不做形状或轮廓分析。
 */
@Slf4j
@Component
public class FillClassifier {

    private final SamplePattern pattern;

    public FillClassifier() {
        this(SamplePattern.cross());
    }

    public FillClassifier(SamplePattern pattern) {
        this.pattern = pattern;
    }

    /**
     * @param image     黑白标准图
     * @param cx        圆心 X（标准图坐标）
     * @param cy        圆心 Y（标准图坐标）
     * @param radius    半径
     * @param threshold 灰度阈值，严格小于它的采样点计为发黑
     */
    public boolean isFilled(GrayscaleRaster image, double cx, double cy, double radius, int threshold) {
        int x = (int) Math.round(cx);
        int y = (int) Math.round(cy);
        int valid = 0;
        int dark = 0;
        for (int[] offset : pattern.offsets(radius)) {
            int px = x + offset[0];
            int py = y + offset[1];
            if (!image.contains(px, py)) {
                continue;
            }
            valid++;
            if (image.intensityAt(px, py) < threshold) {
                dark++;
            }
        }
        return valid > 0 && dark * 2 >= valid;
    }

    /**
     * 判定一列中所有已分配槽位的气泡。气泡坐标为列内局部坐标，这里按列原点换算到标准图。
     */
    public List<FillState> classify(GrayscaleRaster image, ColumnRegion column,
                                    List<SlotAssignment> assignments, int threshold) {
        List<FillState> states = new ArrayList<>(assignments.size());
        int filled = 0;
        for (SlotAssignment assignment : assignments) {
            Blob blob = assignment.getBlob();
            boolean isFilled = isFilled(image,
                    column.getX() + blob.getX(), column.getY() + blob.getY(), blob.getR(), threshold);
            if (isFilled) {
                filled++;
            }
            states.add(new FillState(assignment.getSlot(), isFilled));
        }
        log.debug("第 {} 列: {}/{} 个气泡判定为已涂", column.getIndex(), filled, assignments.size());
        return states;
    }
}
