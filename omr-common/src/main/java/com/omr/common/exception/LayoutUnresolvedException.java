package com.omr.common.exception;

import java.util.Set;

/**
 * 识别到的标记 ID 无法对应任何已知答题卡版式。
 */
public class LayoutUnresolvedException extends OmrException {

    private final Set<Integer> observedIds;

    public LayoutUnresolvedException(Set<Integer> observedIds, String message) {
        super("LAYOUT_UNRESOLVED", message);
        this.observedIds = Set.copyOf(observedIds);
    }

    public Set<Integer> getObservedIds() {
        return observedIds;
    }
}
