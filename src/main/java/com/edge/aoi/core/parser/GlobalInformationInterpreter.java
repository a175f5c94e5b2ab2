package com.edge.aoi.core.parser;

import com.edge.aoi.core.xml.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * 解析 GlobalInformation 段：程序名、检测时间、维修信息
 * <p>
 * 结构：
 * <pre>
 * &lt;GlobalInformation&gt;
 *   &lt;Program&gt;&lt;InspectionPlanName&gt;..&lt;/InspectionPlanName&gt;&lt;/Program&gt;
 *   &lt;Inspection&gt;&lt;Date&gt;&lt;End&gt;yyyyMMdd&lt;/End&gt;&lt;/Date&gt;&lt;Time&gt;&lt;End&gt;HHmmss&lt;/End&gt;&lt;/Time&gt;&lt;/Inspection&gt;
 *   &lt;Repair&gt;&lt;OperatorName&gt;..&lt;/OperatorName&gt;&lt;Date&gt;..&lt;/Date&gt;&lt;Time&gt;..&lt;/Time&gt;&lt;/Repair&gt;  (仅维修站)
 * &lt;/GlobalInformation&gt;
 * </pre>
 */
public class GlobalInformationInterpreter {
    private static final Logger logger = LoggerFactory.getLogger(GlobalInformationInterpreter.class);

    private static final int MIN_VALID_YEAR = 2000;

    /**
     * 读取 GlobalInformation 段
     *
     * @param root 文档根元素
     * @throws LogParseException 段不存在
     */
    public GlobalInformation interpret(XmlNode root) throws LogParseException {
        XmlNode global = root.findChild(LogTags.GLOBAL_INFORMATION)
                .orElseThrow(() -> new LogParseException(ParseErrorType.MISSING_MANDATORY_SECTION,
                        LogTags.GLOBAL_INFORMATION, null, "Could not find <GlobalInformation>"));

        String program = global.findChild(LogTags.PROGRAM)
                .map(p -> FieldExtractors.childText(p, LogTags.INSPECTION_PLAN_NAME))
                .orElse("");
        logger.debug("Program: {}", program);

        LocalDateTime inspectionTime = global.findChild(LogTags.INSPECTION)
                .flatMap(FieldExtractors::nestedDateTime)
                .orElse(null);
        logger.debug("Inspection time: {}", inspectionTime);

        GlobalInformation.GlobalInformationBuilder builder = GlobalInformation.builder()
                .program(program)
                .operator("")
                .inspectionTime(inspectionTime)
                .kind(DocumentKind.AOI_AXI);

        Optional<XmlNode> repair = global.findChild(LogTags.REPAIR);
        if (repair.isPresent()) {
            String operator = FieldExtractors.childText(repair.get(), LogTags.OPERATOR_NAME)
                    .toUpperCase(Locale.ROOT);
            LocalDateTime repairTime = FieldExtractors.nestedDateTime(repair.get()).orElse(null);
            logger.debug("Operator: {}, repair time: {}", operator, repairTime);

            builder.kind(DocumentKind.REPAIR)
                    .operator(operator)
                    .repairTime(repairTime);
        }

        return builder.build();
    }

    /**
     * 校验必需字段：程序名非空；检测时间有效；维修日志的维修时间有效
     */
    public void validate(GlobalInformation info) throws LogParseException {
        if (info.getProgram() == null || info.getProgram().isEmpty()) {
            throw new LogParseException(ParseErrorType.MISSING_MANDATORY_FIELD,
                    LogTags.GLOBAL_INFORMATION, LogTags.INSPECTION_PLAN_NAME,
                    "Missing mandatory <GlobalInformation> element: program name");
        }
        if (!isValidTimestamp(info.getInspectionTime())) {
            throw new LogParseException(ParseErrorType.INVALID_TIMESTAMP_COMBINATION,
                    LogTags.GLOBAL_INFORMATION, LogTags.INSPECTION,
                    "Missing or invalid inspection date/time: " + info.getInspectionTime());
        }
        if (info.isRepair() && !isValidTimestamp(info.getRepairTime())) {
            throw new LogParseException(ParseErrorType.INVALID_TIMESTAMP_COMBINATION,
                    LogTags.GLOBAL_INFORMATION, LogTags.REPAIR,
                    "Missing or invalid repair date/time: " + info.getRepairTime());
        }
    }

    private static boolean isValidTimestamp(LocalDateTime time) {
        return time != null && time.getYear() >= MIN_VALID_YEAR;
    }
}
