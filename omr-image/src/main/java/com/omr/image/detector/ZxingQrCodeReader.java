package com.omr.image.detector;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.omr.image.service.ImagePreprocessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 ZXing 的二维码读取：灰度图编码为 PNG 后交给 ZXing 解码。
 * 读取失败（含图片转换出错）只记 WARN 并返回空，不影响答题卡本身的识别。
 */
@Slf4j
@RequiredArgsConstructor
public class ZxingQrCodeReader implements QrCodeReader {

    private final ImagePreprocessor preprocessor;

    @Override
    public Optional<String> read(Mat image) {
        Mat gray = null;
        try {
            gray = preprocessor.toGrayscale(image);
            BufferedImage bufferedImage = ImageIO.read(new ByteArrayInputStream(preprocessor.matToBytes(gray)));
            if (bufferedImage == null) {
                log.warn("二维码读取：无法转换图片");
                return Optional.empty();
            }
            LuminanceSource source = new BufferedImageLuminanceSource(bufferedImage);
            BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(source));

            Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);
            hints.put(DecodeHintType.POSSIBLE_FORMATS, List.of(BarcodeFormat.QR_CODE));
            hints.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);

            Result result = new MultiFormatReader().decode(bitmap, hints);
            log.info("二维码读取成功: {}", result.getText());
            return Optional.of(result.getText());
        } catch (NotFoundException e) {
            log.warn("未找到二维码");
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.warn("二维码解码失败: {}", e.getMessage());
            return Optional.empty();
        } finally {
            if (gray != null) {
                gray.release();
            }
        }
    }
}
