package com.omr.image.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenCV 图像处理相关配置。
 */
@Data
@ConfigurationProperties(prefix = "omr.image")
public class OpenCvProperties {

    /** 黑白化阈值 (0-255)，高于此值为白 */
    private int twoToneThreshold = 140;

    /** 圆形检测前高斯模糊核大小（必须为奇数） */
    private int blobBlurKernelSize = 9;

    /** 圆形检测前高斯模糊的 sigma */
    private double blobBlurSigma = 5;

    /** 霍夫圆检测：累加器分辨率倒数 */
    private double houghDp = 1.2;

    /** 霍夫圆检测：圆心最小间距（像素） */
    private double houghMinDist = 40;

    /** 霍夫圆检测：Canny 高阈值 */
    private double houghParam1 = 50;

    /** 霍夫圆检测：累加器阈值，越小检出越多 */
    private double houghParam2 = 30;

    /** 判定四边形退化的最小面积（平方像素） */
    private double minQuadArea = 1.0;

    /** 是否读取二维码 */
    private boolean qrEnabled = true;
}
