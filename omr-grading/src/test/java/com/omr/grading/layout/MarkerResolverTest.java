package com.omr.grading.layout;

import com.omr.common.dto.SizeClass;
import com.omr.common.exception.InsufficientMarkersException;
import com.omr.common.exception.LayoutUnresolvedException;
import com.omr.grading.config.GradingProperties;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MarkerResolverTest {

    private final MarkerResolver resolver = new MarkerResolver(new LayoutRegistry(new GradingProperties()));

    @Test
    void allFourIds_resolvesLayout() {
        assertEquals(SizeClass.A4, resolver.resolve(Set.of(1, 2, 3, 4)).getSizeClass());
        assertEquals(SizeClass.A5, resolver.resolve(Set.of(5, 6, 7, 8)).getSizeClass());
    }

    @Test
    void supersetWithForeignIds_stillResolves() {
        assertEquals(SizeClass.A4, resolver.resolve(Set.of(1, 2, 3, 4, 42, 99)).getSizeClass());
    }

    @Test
    void twoOrThreeIds_resolvesForReconstruction() {
        assertEquals(SizeClass.A5, resolver.resolve(Set.of(5, 8)).getSizeClass());
        assertEquals(SizeClass.A4, resolver.resolve(Set.of(1, 2, 4)).getSizeClass());
    }

    @Test
    void singleId_insufficientMarkers() {
        InsufficientMarkersException e = assertThrows(InsufficientMarkersException.class,
                () -> resolver.resolve(Set.of(3)));
        assertEquals(1, e.getObserved());
        assertEquals("INSUFFICIENT_MARKERS", e.getErrorCode());
    }

    @Test
    void unknownIds_unresolved() {
        LayoutUnresolvedException e = assertThrows(LayoutUnresolvedException.class,
                () -> resolver.resolve(Set.of(17, 23)));
        assertEquals(Set.of(17, 23), e.getObservedIds());
        assertEquals("LAYOUT_UNRESOLVED", e.getErrorCode());
    }

    @Test
    void noIds_unresolved() {
        assertThrows(LayoutUnresolvedException.class, () -> resolver.resolve(Set.of()));
    }

    @Test
    void equalHitsOnTwoLayouts_unresolved() {
        assertThrows(LayoutUnresolvedException.class, () -> resolver.resolve(Set.of(1, 2, 5, 6)));
    }

    @Test
    void oneHitOnEachLayout_insufficientRatherThanTie() {
        InsufficientMarkersException e = assertThrows(InsufficientMarkersException.class,
                () -> resolver.resolve(Set.of(3, 5)));
        assertEquals(1, e.getObserved());
    }

    @Test
    void moreHitsWins() {
        assertEquals(SizeClass.A4, resolver.resolve(Set.of(1, 2, 3, 5)).getSizeClass());
    }
}
