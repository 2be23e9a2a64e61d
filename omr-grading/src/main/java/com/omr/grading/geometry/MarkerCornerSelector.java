package com.omr.grading.geometry;

import com.omr.common.dto.CornerObservation;
import com.omr.common.dto.CornerPosition;
import com.omr.common.dto.LayoutSpec;
import com.omr.common.dto.Marker;
import com.omr.grading.config.GradingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 从检测到的标记中为纸张每个角取一个参考点。
 * <p>
 * 每个角取其标记四个角点中的哪一个由配置决定；不属于当前版式的标记被忽略。
 */
@Component
@RequiredArgsConstructor
public class MarkerCornerSelector {

    private final GradingProperties properties;

    public Map<CornerPosition, CornerObservation> select(LayoutSpec layout, List<Marker> markers) {
        Map<CornerPosition, CornerObservation> corners = new EnumMap<>(CornerPosition.class);
        for (CornerPosition position : CornerPosition.values()) {
            corners.put(position, CornerObservation.unknown());
        }
        for (Marker marker : markers) {
            Optional<CornerPosition> position = layout.cornerOf(marker.getId());
            position.ifPresent(p -> corners.put(p,
                    CornerObservation.known(marker.getCornerQuad().get(cornerIndex(p)))));
        }
        return corners;
    }

    private int cornerIndex(CornerPosition position) {
        GradingProperties.MarkerCorners mc = properties.getMarkerCorners();
        switch (position) {
            case TOP_LEFT:
                return mc.getTopLeft();
            case TOP_RIGHT:
                return mc.getTopRight();
            case BOTTOM_LEFT:
                return mc.getBottomLeft();
            default:
                return mc.getBottomRight();
        }
    }
}
