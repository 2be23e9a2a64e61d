package com.omr.grading.service;

import com.omr.common.dto.AdvisoryCode;
import com.omr.common.dto.Blob;
import com.omr.common.dto.ColumnRegion;
import com.omr.common.dto.LayoutSpec;
import com.omr.common.dto.Marker;
import com.omr.common.dto.ScanReport;
import com.omr.common.dto.SheetPoint;
import com.omr.common.dto.SizeClass;
import com.omr.common.exception.DegenerateQuadrilateralException;
import com.omr.common.exception.ImageProcessingException;
import com.omr.common.exception.InsufficientMarkersException;
import com.omr.common.exception.LayoutUnresolvedException;
import com.omr.grading.answer.AnswerAggregator;
import com.omr.grading.config.GradingProperties;
import com.omr.grading.fill.FillClassifier;
import com.omr.grading.geometry.GeometryReconstructor;
import com.omr.grading.geometry.MarkerCornerSelector;
import com.omr.grading.grid.GridDecoder;
import com.omr.grading.layout.LayoutRegistry;
import com.omr.grading.layout.MarkerResolver;
import com.omr.image.config.OpenCvProperties;
import com.omr.image.detector.BlobDetector;
import com.omr.image.detector.MarkerDetector;
import com.omr.image.detector.QrCodeReader;
import com.omr.image.service.ImagePreprocessor;
import com.omr.image.service.SheetRectifier;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * 用合成图片走完整扫描流程。检测器替换为桩，其余环节（解码、矫正、黑白化、判定）均为真实实现。
 */
class SheetScanServiceTest {

    private static final List<Blob> ONE_ROW = List.of(
            Blob.of(60, 40, 20), Blob.of(140, 40, 20), Blob.of(220, 40, 20), Blob.of(300, 40, 20));

    private final OpenCvProperties imageProperties = new OpenCvProperties();
    private final GradingProperties gradingProperties = new GradingProperties();
    private final LayoutSpec a4 = new LayoutRegistry(gradingProperties).layouts().get(0);
    private final ImagePreprocessor preprocessor = new ImagePreprocessor(imageProperties);

    private MarkerDetector markerDetector;
    private BlobDetector blobDetector;
    private QrCodeReader qrCodeReader;
    private SheetScanService service;

    @BeforeEach
    void setUp() {
        markerDetector = mock(MarkerDetector.class);
        blobDetector = mock(BlobDetector.class);
        qrCodeReader = mock(QrCodeReader.class);
        when(qrCodeReader.read(any())).thenReturn(Optional.of("S-1001"));

        LayoutRegistry registry = new LayoutRegistry(gradingProperties);
        service = new SheetScanService(
                preprocessor,
                new SheetRectifier(imageProperties),
                markerDetector,
                blobDetector,
                qrCodeReader,
                imageProperties,
                new MarkerResolver(registry),
                new MarkerCornerSelector(gradingProperties),
                new GeometryReconstructor(),
                new AnswerGridService(new GridDecoder(gradingProperties), new FillClassifier(), new AnswerAggregator()));
    }

    /** 四个角点都取同一个点，不依赖配置的角点序号 */
    private static Marker marker(int id, double x, double y) {
        return new Marker(id, Collections.nCopies(4, SheetPoint.of(x, y)));
    }

    private List<Marker> sheetCorners() {
        int w = a4.getCanonicalWidth() - 1;
        int h = a4.getCanonicalHeight() - 1;
        return List.of(marker(1, 0, 0), marker(2, w, 0), marker(3, 0, h), marker(4, w, h));
    }

    /**
     * 与标准图同尺寸的白纸，在每列第一行的 A 选项位置涂黑。
     */
    private byte[] sheetWithFirstRowMarked() {
        Mat image = new Mat(a4.getCanonicalHeight(), a4.getCanonicalWidth(), CV_8UC3, new Scalar(255, 255, 255, 0));
        try {
            for (ColumnRegion column : a4.getColumns()) {
                Mat roi = new Mat(image, new Rect(column.getX() + 60 - 12, column.getY() + 40 - 12, 25, 25));
                roi.put(new Scalar(0, 0, 0, 0));
                roi.release();
            }
            return preprocessor.matToBytes(image);
        } finally {
            image.release();
        }
    }

    private static List<Integer> allA(int size) {
        return IntStream.range(0, size).mapToObj(i -> 1).collect(Collectors.toList());
    }

    @Test
    void scan_allMarkersVisible() {
        when(markerDetector.detect(any())).thenReturn(sheetCorners());
        when(blobDetector.detect(any(), anyInt(), anyInt())).thenReturn(ONE_ROW);

        ScanReport report = service.scan(sheetWithFirstRowMarked(), allA(120));

        assertEquals(SizeClass.A4, report.getSizeClass());
        assertEquals("S-1001", report.getQrCodeData());
        assertEquals(4, report.getObservedMarkerCount());
        assertTrue(report.getScanId().startsWith("scan"));
        assertEquals(List.of(1, 31, 61, 91), report.getResult().rightAnswers());
        assertEquals(116, report.getResult().unanswered().size());
        verify(blobDetector, times(4)).detect(any(), eq(a4.getBlobMinRadius()), eq(a4.getBlobMaxRadius()));
    }

    @Test
    void scan_oneMarkerHidden_reconstructsCorner() {
        when(markerDetector.detect(any())).thenReturn(sheetCorners().subList(0, 3));
        when(blobDetector.detect(any(), anyInt(), anyInt())).thenReturn(ONE_ROW);

        ScanReport report = service.scan(sheetWithFirstRowMarked(), allA(120));

        assertEquals(3, report.getObservedMarkerCount());
        assertEquals(4, report.getResult().score());
        assertTrue(report.getResult().getAdvisories().stream()
                .anyMatch(a -> a.getCode() == AdvisoryCode.MARKERS_RECONSTRUCTED));
    }

    @Test
    void scan_qrDisabled() {
        imageProperties.setQrEnabled(false);
        when(markerDetector.detect(any())).thenReturn(sheetCorners());
        when(blobDetector.detect(any(), anyInt(), anyInt())).thenReturn(ONE_ROW);

        ScanReport report = service.scan(sheetWithFirstRowMarked(), allA(120));

        assertNull(report.getQrCodeData());
        verifyNoInteractions(qrCodeReader);
    }

    @Test
    void scan_noMarkers_layoutUnresolved() {
        when(markerDetector.detect(any())).thenReturn(List.of());

        assertThrows(LayoutUnresolvedException.class, () -> service.scan(sheetWithFirstRowMarked(), allA(120)));
        verifyNoInteractions(blobDetector);
    }

    @Test
    void scan_singleMarker_insufficient() {
        when(markerDetector.detect(any())).thenReturn(List.of(marker(2, 100, 100)));

        assertThrows(InsufficientMarkersException.class, () -> service.scan(sheetWithFirstRowMarked(), allA(120)));
        verifyNoInteractions(blobDetector);
    }

    @Test
    void scan_collinearMarkers_degenerate() {
        when(markerDetector.detect(any())).thenReturn(List.of(
                marker(1, 0, 500), marker(2, 1000, 500), marker(3, 2000, 500)));

        assertThrows(DegenerateQuadrilateralException.class, () -> service.scan(sheetWithFirstRowMarked(), allA(120)));
        verifyNoInteractions(blobDetector);
    }

    @Test
    void scan_undecodableBytes() {
        assertThrows(ImageProcessingException.class, () -> service.scan(new byte[]{1, 2, 3}, allA(10)));
        assertThrows(ImageProcessingException.class, () -> service.scan(new byte[0], allA(10)));
        verifyNoInteractions(markerDetector);
    }
}
