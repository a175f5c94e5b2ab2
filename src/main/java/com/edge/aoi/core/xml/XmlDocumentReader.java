package com.edge.aoi.core.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * 将日志字节解析为 {@link XmlNode} 树
 * <p>
 * 禁止 DOCTYPE 声明，避免外部实体被解析。
 */
public final class XmlDocumentReader {
    private static final Logger logger = LoggerFactory.getLogger(XmlDocumentReader.class);

    // 默认的 ErrorHandler 会把错误直接打印到 stderr
    private static final ErrorHandler ERROR_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            logger.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private XmlDocumentReader() {
    }

    /**
     * 解析完整文档，返回根元素
     *
     * @param bytes 文档字节（编码由 XML 声明决定）
     * @return 根元素
     * @throws SAXException 文档不是格式良好的 XML
     */
    public static XmlNode read(byte[] bytes) throws IOException, SAXException {
        DocumentBuilder builder;
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setNamespaceAware(true);
            dbf.setExpandEntityReferences(false);
            builder = dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
        builder.setErrorHandler(ERROR_HANDLER);

        Document dom = builder.parse(new ByteArrayInputStream(bytes));
        dom.getDocumentElement().normalize();
        return new DomXmlNode(dom.getDocumentElement());
    }
}
