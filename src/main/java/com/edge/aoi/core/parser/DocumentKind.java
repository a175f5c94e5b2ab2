package com.edge.aoi.core.parser;

/**
 * 日志来源的站点类型
 * <p>
 * 在解析 GlobalInformation 时确定一次，之后用于选择缺陷窗口的解析方式。
 */
public enum DocumentKind {
    /**
     * 自动光学 / X 光检测站
     */
    AOI_AXI("AOI_AXI"),

    /**
     * 人工维修站，GlobalInformation 中带 Repair 元素
     */
    REPAIR("HARAN");

    private final String stationSuffix;

    DocumentKind(String stationSuffix) {
        this.stationSuffix = stationSuffix;
    }

    /**
     * 由产线名生成站点名，如 LINE1_AOI_AXI
     */
    public String stationName(String line) {
        return line + "_" + stationSuffix;
    }
}
