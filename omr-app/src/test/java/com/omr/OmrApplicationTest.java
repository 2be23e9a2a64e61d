package com.omr;

import com.omr.common.dto.SizeClass;
import com.omr.grading.layout.LayoutRegistry;
import com.omr.grading.service.SheetScanService;
import com.omr.image.detector.ArucoMarkerDetector;
import com.omr.image.detector.MarkerDetector;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class OmrApplicationTest {

    @Autowired
    private LayoutRegistry layoutRegistry;

    @Autowired
    private MarkerDetector markerDetector;

    @Autowired
    private SheetScanService sheetScanService;

    @Test
    void contextLoads_withConfiguredLayouts() {
        assertNotNull(sheetScanService);
        assertInstanceOf(ArucoMarkerDetector.class, markerDetector);
        assertEquals(2, layoutRegistry.layouts().size());
        assertEquals(SizeClass.A4, layoutRegistry.layouts().get(0).getSizeClass());
        assertEquals(4, layoutRegistry.layouts().get(0).getColumns().size());
        assertEquals(60, layoutRegistry.layouts().get(1).getFillThreshold());
    }
}
