package com.omr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 答题卡识别系统 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.omr")
public class OmrApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmrApplication.class, args);
    }
}
