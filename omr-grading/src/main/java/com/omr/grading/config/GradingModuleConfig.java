package com.omr.grading.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 解码判分模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.omr.grading")
@EnableConfigurationProperties(GradingProperties.class)
public class GradingModuleConfig {
}
