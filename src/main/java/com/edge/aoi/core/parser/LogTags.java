package com.edge.aoi.core.parser;

/**
 * 检测日志中使用的元素名与固定取值
 */
public final class LogTags {
    public static final String GLOBAL_INFORMATION = "GlobalInformation";
    public static final String PROGRAM = "Program";
    public static final String INSPECTION_PLAN_NAME = "InspectionPlanName";
    public static final String INSPECTION = "Inspection";
    public static final String REPAIR = "Repair";
    public static final String OPERATOR_NAME = "OperatorName";
    public static final String DATE = "Date";
    public static final String TIME = "Time";
    public static final String END = "End";

    public static final String PCB_INFORMATION = "PCBInformation";
    public static final String SINGLE_PCB = "SinglePCB";
    public static final String BARCODE = "Barcode";
    public static final String RESULT = "Result";

    public static final String COMPONENT_INFORMATION = "ComponentInformation";
    public static final String WIN_ID = "WinID";
    public static final String PCB_NUMBER = "PCBNumber";
    public static final String ERROR_DESCRIPTION = "ErrorDescription";
    public static final String ANALYSIS = "Analysis";

    // 板卡检测结果
    public static final String RESULT_PASS = "PASS";
    // AOI/AXI 窗口结果为 0 表示没有缺陷
    public static final String WINDOW_RESULT_OK = "0";
    // 维修站的伪缺陷描述
    public static final String PSEUDO_DEFECT = "Pszeudohiba";

    private LogTags() {
    }
}
