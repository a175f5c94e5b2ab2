package com.edge.aoi.core.parser.window;

import com.edge.aoi.core.parser.FieldExtractors;
import com.edge.aoi.core.parser.LogParseException;
import com.edge.aoi.core.parser.LogTags;
import com.edge.aoi.core.parser.ParseErrorType;
import com.edge.aoi.core.xml.XmlNode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ComponentInformation 中单个窗口的解析模板
 * <p>
 * 每个窗口必须有 WinID、PCBNumber 和结果码，三者缺一即整份日志失败。
 * 结果码的位置和板号的含义由子类决定。
 */
public abstract class DefectWindowStrategy {
    private static final Pattern BOARD_NUMBER = Pattern.compile("\\+?(\\d+)");
    // 不超过 18 位的数字一定在 long 范围内
    private static final int MAX_LONG_DIGITS = 18;

    /**
     * 解析一个窗口
     *
     * @param window     窗口元素
     * @param boardCount 已解析的板卡数量
     * @return 不需要记录的窗口返回空
     */
    public Optional<DefectWindow> interpret(XmlNode window, int boardCount) throws LogParseException {
        String winId = FieldExtractors.childText(window, LogTags.WIN_ID);
        String pcbNumber = FieldExtractors.childText(window, LogTags.PCB_NUMBER);
        String result = readResult(window);

        if (winId.isEmpty() || pcbNumber.isEmpty() || result.isEmpty()) {
            String field = winId.isEmpty() ? LogTags.WIN_ID
                    : pcbNumber.isEmpty() ? LogTags.PCB_NUMBER : LogTags.RESULT;
            throw new LogParseException(ParseErrorType.MISSING_MANDATORY_FIELD,
                    LogTags.COMPONENT_INFORMATION, field,
                    "Window interpreting error! WinID: " + winId + ", PCBNumber: " + pcbNumber + ", Result: " + result);
        }

        return resolve(FieldExtractors.stripWindowSuffix(winId), pcbNumber, result, boardCount);
    }

    /**
     * 读取窗口的结果码
     */
    protected abstract String readResult(XmlNode window);

    /**
     * 根据结果码和板号决定窗口归属
     */
    protected abstract Optional<DefectWindow> resolve(String winId, String pcbNumber, String result, int boardCount)
            throws LogParseException;

    /**
     * 解析非负整数板号，允许前导 '+'
     * <p>
     * 超出 long 范围的数字串返回 {@link Long#MAX_VALUE}，由子类按越界处理。
     */
    protected static long parseBoardNumber(String pcbNumber) throws LogParseException {
        Matcher matcher = BOARD_NUMBER.matcher(pcbNumber);
        if (!matcher.matches()) {
            throw new LogParseException(ParseErrorType.UNPARSABLE_NUMERIC_REFERENCE,
                    LogTags.COMPONENT_INFORMATION, LogTags.PCB_NUMBER, "Could not parse PCBNumber: " + pcbNumber);
        }
        String digits = stripLeadingZeros(matcher.group(1));
        if (digits.length() > MAX_LONG_DIGITS) {
            return Long.MAX_VALUE;
        }
        return Long.parseLong(digits);
    }

    private static String stripLeadingZeros(String digits) {
        int start = 0;
        while (start < digits.length() - 1 && digits.charAt(start) == '0') {
            start++;
        }
        return digits.substring(start);
    }
}
