package com.edge.aoi.core.xml;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基于 W3C DOM 的 {@link XmlNode} 实现
 */
public class DomXmlNode implements XmlNode {
    private final Element element;
    private List<XmlNode> children;

    public DomXmlNode(Element element) {
        this.element = element;
    }

    @Override
    public String getName() {
        String localName = element.getLocalName();
        return localName != null ? localName : element.getTagName();
    }

    @Override
    public String getText() {
        StringBuilder text = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(node.getNodeValue());
            }
        }
        return text.toString();
    }

    @Override
    public List<XmlNode> getChildren() {
        if (children == null) {
            List<XmlNode> list = new ArrayList<>();
            NodeList nodes = element.getChildNodes();
            for (int i = 0; i < nodes.getLength(); i++) {
                Node node = nodes.item(i);
                if (node.getNodeType() == Node.ELEMENT_NODE) {
                    list.add(new DomXmlNode((Element) node));
                }
            }
            children = Collections.unmodifiableList(list);
        }
        return children;
    }

    @Override
    public String toString() {
        return "<" + getName() + ">";
    }
}
