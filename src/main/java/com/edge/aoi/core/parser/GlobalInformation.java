package com.edge.aoi.core.parser;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * GlobalInformation 段的解析结果
 */
@Data
@Builder
public class GlobalInformation {
    private String program;
    // 非维修日志为空字符串
    private String operator;
    // 缺失或无法解析时为 null
    private LocalDateTime inspectionTime;
    private LocalDateTime repairTime;
    private DocumentKind kind;

    public boolean isRepair() {
        return kind == DocumentKind.REPAIR;
    }
}
