package com.edge.aoi.core.xml;

import java.util.List;
import java.util.Optional;

/**
 * 只读的 XML 元素树视图
 * <p>
 * 解析逻辑只依赖元素名、子元素和文本内容：
 * - 元素名按本地名匹配，忽略命名空间
 * - 属性不参与解析
 * - 同名子元素按文档顺序取第一个
 */
public interface XmlNode {

    /**
     * 元素本地名
     */
    String getName();

    /**
     * 元素的直接文本内容，没有文本时返回空字符串
     */
    String getText();

    /**
     * 所有子元素（文档顺序，不含文本节点）
     */
    List<XmlNode> getChildren();

    /**
     * 第一个名为 name 的子元素
     */
    default Optional<XmlNode> findChild(String name) {
        return getChildren().stream()
                .filter(child -> child.getName().equals(name))
                .findFirst();
    }

    /**
     * 所有名为 name 的子元素
     */
    default List<XmlNode> getChildren(String name) {
        return getChildren().stream()
                .filter(child -> child.getName().equals(name))
                .toList();
    }

    default boolean hasChild(String name) {
        return findChild(name).isPresent();
    }
}
