package com.omr.config;

import com.omr.common.dto.ColumnRegion;
import com.omr.common.dto.LayoutSpec;
import com.omr.grading.layout.LayoutRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 应用启动时打印已加载的答题卡版式，便于核对配置。
 * <p>
 * 配置方式（在 application.yml 中）：
 * omr.grading.layouts[0].size-class=A4
 * omr.grading.layouts[0].top-left-id=1 ...
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LayoutReportInitializer implements CommandLineRunner {

    private final LayoutRegistry registry;

    @Override
    public void run(String... args) {
        if (registry.layouts().isEmpty()) {
            log.warn("==============================================");
            log.warn("  未配置任何答题卡版式！");
            log.warn("  请在 application.yml 中设置 omr.grading.layouts");
            log.warn("==============================================");
            return;
        }

        for (LayoutSpec layout : registry.layouts()) {
            log.info("版式 {}: 标记 {}, 标准图 {}x{}, {} 列共 {} 题, 填涂阈值 {}",
                    layout.getSizeClass(), layout.getMarkerIdsByCorner(),
                    layout.getCanonicalWidth(), layout.getCanonicalHeight(),
                    layout.getColumns().size(), layout.totalPrintedQuestions(), layout.getFillThreshold());
            for (ColumnRegion column : layout.getColumns()) {
                log.debug("  第 {} 列: ({},{}) {}x{}, 题号 {}~{}", column.getIndex(),
                        column.getX(), column.getY(), column.getWidth(), column.getHeight(),
                        column.firstQuestion(), column.lastQuestion());
            }
        }
    }
}
