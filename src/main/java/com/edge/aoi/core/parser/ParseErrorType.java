package com.edge.aoi.core.parser;

/**
 * 日志解析失败原因
 * <p>
 * 所有原因都只影响当前文档：调用方跳过该文档，继续处理下一个。
 */
public enum ParseErrorType {
    /**
     * 文档无法读取或不是格式良好的 XML
     */
    MALFORMED_DOCUMENT,

    /**
     * 缺少必需的段（如 GlobalInformation）
     */
    MISSING_MANDATORY_SECTION,

    /**
     * 段存在但必需字段为空（程序名、条码、结果、窗口字段等）
     */
    MISSING_MANDATORY_FIELD,

    /**
     * 检测/维修时间缺失、无法解析或早于 2000 年
     */
    INVALID_TIMESTAMP_COMBINATION,

    /**
     * PCBNumber 不是非负整数
     */
    UNPARSABLE_NUMERIC_REFERENCE,

    /**
     * AOI/AXI 窗口引用了不存在的板号
     */
    OUT_OF_RANGE_BOARD_REFERENCE,

    /**
     * 板卡槽位数量与 SinglePCB 条目不一致，存在未填充的板
     */
    INCONSISTENT_BOARD_RECORD
}
