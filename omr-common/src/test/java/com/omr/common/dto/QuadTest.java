package com.omr.common.dto;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuadTest {

    private static Quad quad(double... xy) {
        return Quad.builder()
                .topLeft(SheetPoint.of(xy[0], xy[1]))
                .topRight(SheetPoint.of(xy[2], xy[3]))
                .bottomLeft(SheetPoint.of(xy[4], xy[5]))
                .bottomRight(SheetPoint.of(xy[6], xy[7]))
                .build();
    }

    @Test
    void area_rectangle() {
        assertEquals(200 * 300, quad(0, 0, 200, 0, 0, 300, 200, 300).area(), 1e-9);
    }

    @Test
    void toList_fixedCornerOrder() {
        Quad q = quad(1, 2, 3, 4, 5, 6, 7, 8);
        assertEquals(List.of(SheetPoint.of(1, 2), SheetPoint.of(3, 4), SheetPoint.of(5, 6), SheetPoint.of(7, 8)),
                q.toList());
        assertEquals(SheetPoint.of(5, 6), q.get(CornerPosition.BOTTOM_LEFT));
    }

    @Test
    void rectangle_notDegenerate() {
        assertFalse(quad(0, 0, 200, 0, 0, 300, 200, 300).isDegenerate(1.0));
    }

    @Test
    void collinearPoints_degenerate() {
        assertTrue(quad(0, 0, 100, 0, 200, 0, 300, 0).isDegenerate(1.0));
    }

    @Test
    void threeCollinear_degenerate() {
        // 右上角落在左上与右下的连线上
        assertTrue(quad(0, 0, 100, 100, 0, 300, 200, 200).isDegenerate(1.0));
    }

    @Test
    void coincidentCorners_degenerate() {
        assertTrue(quad(10, 10, 10, 10, 0, 300, 200, 300).isDegenerate(1.0));
    }

    @Test
    void nonFinite_degenerate() {
        assertTrue(quad(Double.NaN, 0, 200, 0, 0, 300, 200, 300).isDegenerate(1.0));
        assertTrue(quad(0, 0, Double.POSITIVE_INFINITY, 0, 0, 300, 200, 300).isDegenerate(1.0));
    }
}
