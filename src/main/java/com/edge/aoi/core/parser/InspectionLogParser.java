package com.edge.aoi.core.parser;

import com.edge.aoi.core.xml.XmlDocumentReader;
import com.edge.aoi.core.xml.XmlNode;
import com.edge.aoi.model.Panel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 检测日志解析入口
 * <p>
 * 将一份 AOI / AXI / 维修站日志转换为 {@link Panel}。
 * 纯同步计算，不持有可变状态，可被多个线程同时调用。
 */
public class InspectionLogParser {
    private static final Logger logger = LoggerFactory.getLogger(InspectionLogParser.class);

    private final PanelBuilder panelBuilder = new PanelBuilder();

    /**
     * 读取并解析日志文件
     *
     * @param path 日志文件
     * @param line 产线名，用于生成站点名
     */
    public Panel parse(Path path, String line) throws LogParseException {
        logger.info("Processing XML: {}", path);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new LogParseException(ParseErrorType.MALFORMED_DOCUMENT, path.toString(), null, null,
                    "Could not read log file: " + e.getMessage(), e);
        }
        return parse(bytes, path.toString(), line);
    }

    /**
     * 解析内存中的日志内容
     *
     * @param bytes  日志字节
     * @param source 来源标识（文件名），用于错误信息
     * @param line   产线名
     */
    public Panel parse(byte[] bytes, String source, String line) throws LogParseException {
        XmlNode root;
        try {
            root = XmlDocumentReader.read(bytes);
        } catch (SAXException | IOException e) {
            throw new LogParseException(ParseErrorType.MALFORMED_DOCUMENT, source, null, null,
                    "Not a well-formed XML document: " + e.getMessage(), e);
        }
        return parse(root, source, line);
    }

    /**
     * 解析已构建的元素树
     */
    public Panel parse(XmlNode root, String source, String line) throws LogParseException {
        try {
            Panel panel = panelBuilder.build(root, line);
            logger.info("Processing OK: {} ({} boards, station {})", source, panel.getBoards().size(),
                    panel.getStation());
            return panel;
        } catch (LogParseException e) {
            throw e.withSource(source);
        }
    }
}
