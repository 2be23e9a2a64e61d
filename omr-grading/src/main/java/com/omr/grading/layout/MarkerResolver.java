package com.omr.grading.layout;

import com.omr.common.dto.LayoutSpec;
import com.omr.common.exception.InsufficientMarkersException;
import com.omr.common.exception.LayoutUnresolvedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * 根据检测到的标记 ID 判断答题卡版式。
 * <p>
 * 各版式的标记 ID 互不重叠，所以命中哪个版式的 ID 就是哪个版式；
 * 四个 ID 全部命中最理想，命中 2~3 个时仍可由几何重建补齐四角。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarkerResolver {

    private final LayoutRegistry registry;

    /**
     * @param observedIds 本图检测到的标记 ID
     * @return 匹配的版式
     * @throws LayoutUnresolvedException   没有任何版式的 ID 被命中，或至少 2 个命中的版式并列无法区分
     * @throws InsufficientMarkersException 命中最多的版式也少于 2 个标记
     */
    public LayoutSpec resolve(Set<Integer> observedIds) {
        if (observedIds == null || observedIds.isEmpty()) {
            throw new LayoutUnresolvedException(Set.of(), "未检测到任何定位标记，无法判断答题卡版式");
        }

        LayoutSpec best = null;
        int bestHits = 0;
        boolean tie = false;
        for (LayoutSpec layout : registry.layouts()) {
            int hits = countHits(layout, observedIds);
            if (hits > bestHits) {
                best = layout;
                bestHits = hits;
                tie = false;
            } else if (hits > 0 && hits == bestHits) {
                tie = true;
            }
        }

        if (best == null) {
            throw new LayoutUnresolvedException(observedIds, "标记 " + observedIds + " 不属于任何已知版式");
        }
        if (bestHits < 2) {
            throw new InsufficientMarkersException(bestHits);
        }
        if (tie) {
            throw new LayoutUnresolvedException(observedIds, "标记 " + observedIds + " 同时命中多个版式，无法判断");
        }

        log.info("版式识别: {} (命中标记 {}/4)", best.getSizeClass(), bestHits);
        return best;
    }

    private int countHits(LayoutSpec layout, Set<Integer> observedIds) {
        int hits = 0;
        for (Integer id : layout.markerIds()) {
            if (observedIds.contains(id)) {
                hits++;
            }
        }
        return hits;
    }
}
