package com.edge.aoi.core.parser;

import com.edge.aoi.core.xml.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * 从元素树中提取单个字段
 * <p>
 * 提取器从不失败：元素缺失或内容非法时返回空值，是否报错由各段解释器决定。
 */
public final class FieldExtractors {
    private static final Logger logger = LoggerFactory.getLogger(FieldExtractors.class);

    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd HHmmss")
            .withResolverStyle(ResolverStyle.STRICT);

    private FieldExtractors() {
    }

    /**
     * 子元素的文本，缺失时返回空字符串
     */
    public static String childText(XmlNode node, String name) {
        return node.findChild(name)
                .map(XmlNode::getText)
                .orElse("");
    }

    /**
     * 两层嵌套元素的文本，如 {@code <Result><ErrorDescription>..}
     */
    public static String nestedText(XmlNode node, String outer, String inner) {
        return node.findChild(outer)
                .map(child -> childText(child, inner))
                .orElse("");
    }

    /**
     * 读取 {@code <Date><End>} 与 {@code <Time><End>}，按 yyyyMMdd HHmmss 解析
     *
     * @param section Inspection 或 Repair 元素
     * @return 日期或时间缺失、无法解析时返回空
     */
    public static Optional<LocalDateTime> nestedDateTime(XmlNode section) {
        String date = nestedText(section, LogTags.DATE, LogTags.END);
        String time = nestedText(section, LogTags.TIME, LogTags.END);
        if (date.isEmpty() || time.isEmpty()) {
            return Optional.empty();
        }

        String raw = date + " " + time;
        logger.debug("Raw time string: {}", raw);
        try {
            return Optional.of(LocalDateTime.parse(raw, DATE_TIME_FORMAT));
        } catch (DateTimeParseException e) {
            logger.warn("Unparsable date/time in <{}>: '{}'", section.getName(), raw);
            return Optional.empty();
        }
    }

    /**
     * 去掉窗口 ID 最后一个 '-' 之后的子序号，如 U5-2 -> U5
     */
    public static String stripWindowSuffix(String winId) {
        int idx = winId.lastIndexOf('-');
        return idx >= 0 ? winId.substring(0, idx) : winId;
    }
}
