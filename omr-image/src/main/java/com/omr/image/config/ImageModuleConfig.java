package com.omr.image.config;

import com.omr.image.detector.ArucoMarkerDetector;
import com.omr.image.detector.BlobDetector;
import com.omr.image.detector.HoughBlobDetector;
import com.omr.image.detector.MarkerDetector;
import com.omr.image.detector.QrCodeReader;
import com.omr.image.detector.ZxingQrCodeReader;
import com.omr.image.service.ImagePreprocessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 图像模块自动配置。
 * <p>
 * 三类检测器均以接口注入，默认使用 OpenCV / ZXing 实现；
 * 上层模块声明同类型 Bean 即可替换。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.omr.image")
@EnableConfigurationProperties(OpenCvProperties.class)
public class ImageModuleConfig {

    @Bean
    @ConditionalOnMissingBean
    public MarkerDetector markerDetector() {
        log.info("使用 ArUco 定位标记检测器 (DICT_6X6_250)");
        return new ArucoMarkerDetector();
    }

    @Bean
    @ConditionalOnMissingBean
    public BlobDetector blobDetector(OpenCvProperties properties) {
        log.info("使用霍夫圆气泡检测器");
        return new HoughBlobDetector(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public QrCodeReader qrCodeReader(ImagePreprocessor preprocessor) {
        return new ZxingQrCodeReader(preprocessor);
    }
}
