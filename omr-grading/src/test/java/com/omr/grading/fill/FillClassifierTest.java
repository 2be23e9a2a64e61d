package com.omr.grading.fill;

import com.omr.common.dto.AnswerOption;
import com.omr.common.dto.Blob;
import com.omr.common.dto.ColumnRegion;
import com.omr.common.dto.FillState;
import com.omr.common.dto.Slot;
import com.omr.common.dto.SlotAssignment;
import com.omr.grading.support.ArrayRaster;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FillClassifierTest {

    private static final int THRESHOLD = 120;

    private final FillClassifier classifier = new FillClassifier();

    /** 半径 20 时采样点为圆心及上下左右偏移 10 像素处 */
    private static ArrayRaster withDarkSamples(int... sampleIndexes) {
        int[][] offsets = SamplePattern.cross().offsets(20);
        ArrayRaster raster = ArrayRaster.white(100, 100);
        for (int i : sampleIndexes) {
            raster.set(50 + offsets[i][0], 50 + offsets[i][1], 0);
        }
        return raster;
    }

    @Test
    void crossPattern_offsetsHalfRadius() {
        int[][] offsets = SamplePattern.cross().offsets(20.4);
        assertEquals(5, offsets.length);
        assertArrayEquals(new int[]{0, 0}, offsets[0]);
        assertArrayEquals(new int[]{-10, 0}, offsets[1]);
        assertArrayEquals(new int[]{0, 10}, offsets[4]);
    }

    @Test
    void allSamplesDark_filled() {
        assertTrue(classifier.isFilled(withDarkSamples(0, 1, 2, 3, 4), 50, 50, 20, THRESHOLD));
    }

    @Test
    void noSamplesDark_notFilled() {
        assertFalse(classifier.isFilled(withDarkSamples(), 50, 50, 20, THRESHOLD));
    }

    @Test
    void twoOfFiveDark_notFilled() {
        assertFalse(classifier.isFilled(withDarkSamples(0, 3), 50, 50, 20, THRESHOLD));
    }

    @Test
    void threeOfFiveDark_filled() {
        assertTrue(classifier.isFilled(withDarkSamples(1, 2, 4), 50, 50, 20, THRESHOLD));
    }

    @Test
    void intensityEqualToThreshold_notDark() {
        ArrayRaster raster = ArrayRaster.white(100, 100).paintSquare(50, 50, 15, THRESHOLD);
        assertFalse(classifier.isFilled(raster, 50, 50, 20, THRESHOLD));
        raster.paintSquare(50, 50, 15, THRESHOLD - 1);
        assertTrue(classifier.isFilled(raster, 50, 50, 20, THRESHOLD));
    }

    @Test
    void outOfBoundsSamples_excludedFromBothCounts() {
        // 圆心在左上角：左、上两个采样点落在图外，只剩 3 个有效点
        ArrayRaster raster = ArrayRaster.white(50, 50).set(0, 0, 0).set(10, 0, 0);
        assertTrue(classifier.isFilled(raster, 0, 0, 20, THRESHOLD));

        ArrayRaster oneDark = ArrayRaster.white(50, 50).set(0, 0, 0);
        assertFalse(classifier.isFilled(oneDark, 0, 0, 20, THRESHOLD));
    }

    @Test
    void allSamplesOutside_notFilled() {
        assertFalse(classifier.isFilled(ArrayRaster.white(10, 10), -100, -100, 20, THRESHOLD));
    }

    @Test
    void classify_translatesColumnLocalCoordinates() {
        ColumnRegion column = ColumnRegion.builder()
                .index(1).x(200).y(300).width(400).height(600).questionsPerColumn(30)
                .build();
        ArrayRaster raster = ArrayRaster.white(800, 1000).paintSquare(260, 340, 12, 0);
        List<SlotAssignment> assignments = List.of(
                new SlotAssignment(Slot.of(1, AnswerOption.A), Blob.of(60, 40, 20)),
                new SlotAssignment(Slot.of(1, AnswerOption.B), Blob.of(140, 40, 20)));

        List<FillState> states = classifier.classify(raster, column, assignments, THRESHOLD);

        assertEquals(2, states.size());
        assertTrue(states.get(0).isFilled());
        assertFalse(states.get(1).isFilled());
        assertEquals(Slot.of(1, AnswerOption.B), states.get(1).getSlot());
    }
}
