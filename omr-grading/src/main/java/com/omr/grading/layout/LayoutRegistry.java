package com.omr.grading.layout;

import com.omr.common.dto.ColumnRegion;
import com.omr.common.dto.LayoutSpec;
import com.omr.grading.config.GradingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 已知版式登记表：启动时把配置转换成不可变的 {@link LayoutSpec} 并校验。
 * <p>
 * 校验规则：每个版式 4 个互不相同的标记 ID；不同版式之间不共用 ID；
 * 同一版式的各列在标准图中互不重叠。配置不合法时启动失败。
 */
@Slf4j
@Component
public class LayoutRegistry {

    private final List<LayoutSpec> layouts;

    public LayoutRegistry(GradingProperties properties) {
        List<LayoutSpec> built = new ArrayList<>();
        for (GradingProperties.Layout layout : properties.getLayouts()) {
            built.add(toSpec(layout));
        }
        validate(built);
        this.layouts = List.copyOf(built);
        log.info("已加载 {} 个答题卡版式", layouts.size());
    }

    public List<LayoutSpec> layouts() {
        return layouts;
    }

    private LayoutSpec toSpec(GradingProperties.Layout layout) {
        LayoutSpec.LayoutSpecBuilder builder = LayoutSpec.builder()
                .sizeClass(layout.getSizeClass())
                .markerIdsByCorner(LayoutSpec.corners(
                        layout.getTopLeftId(), layout.getTopRightId(),
                        layout.getBottomLeftId(), layout.getBottomRightId()))
                .canonicalWidth(layout.getCanonicalWidth())
                .canonicalHeight(layout.getCanonicalHeight())
                .fillThreshold(layout.getFillThreshold())
                .blobMinRadius(layout.getBlobMinRadius())
                .blobMaxRadius(layout.getBlobMaxRadius());

        List<GradingProperties.Column> columns = layout.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            GradingProperties.Column c = columns.get(i);
            builder.column(ColumnRegion.builder()
                    .index(i + 1)
                    .x(c.getX1())
                    .y(c.getY1())
                    .width(c.getX2() - c.getX1())
                    .height(c.getY2() - c.getY1())
                    .questionsPerColumn(layout.getQuestionsPerColumn())
                    .build());
        }
        return builder.build();
    }

    private void validate(List<LayoutSpec> specs) {
        Map<Integer, Object> owners = new HashMap<>();
        for (LayoutSpec layout : specs) {
            Set<Integer> ids = new HashSet<>(layout.getMarkerIdsByCorner().values());
            if (ids.size() != 4) {
                throw new IllegalStateException("版式 " + layout.getSizeClass() + " 必须有 4 个不同的标记 ID");
            }
            for (Integer id : ids) {
                Object previous = owners.putIfAbsent(id, layout.getSizeClass());
                if (previous != null) {
                    throw new IllegalStateException("标记 ID " + id + " 同时属于版式 "
                            + previous + " 和 " + layout.getSizeClass());
                }
            }
            if (layout.getCanonicalWidth() <= 0 || layout.getCanonicalHeight() <= 0) {
                throw new IllegalStateException("版式 " + layout.getSizeClass() + " 的标准图尺寸不合法");
            }
            List<ColumnRegion> columns = layout.getColumns();
            if (columns.isEmpty()) {
                throw new IllegalStateException("版式 " + layout.getSizeClass() + " 没有配置答题列");
            }
            for (int i = 0; i < columns.size(); i++) {
                ColumnRegion a = columns.get(i);
                if (a.getWidth() <= 0 || a.getHeight() <= 0 || a.getQuestionsPerColumn() <= 0) {
                    throw new IllegalStateException("版式 " + layout.getSizeClass() + " 第 " + a.getIndex() + " 列配置不合法");
                }
                for (int j = i + 1; j < columns.size(); j++) {
                    if (a.overlaps(columns.get(j))) {
                        throw new IllegalStateException("版式 " + layout.getSizeClass() + " 第 "
                                + a.getIndex() + " 列与第 " + columns.get(j).getIndex() + " 列重叠");
                    }
                }
            }
        }
    }
}
