package com.edge.aoi.core.parser;

import com.edge.aoi.core.parser.window.AoiAxiWindowStrategy;
import com.edge.aoi.core.parser.window.DefectWindow;
import com.edge.aoi.core.parser.window.DefectWindowStrategy;
import com.edge.aoi.core.parser.window.RepairWindowStrategy;
import com.edge.aoi.core.xml.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 解析 ComponentInformation 段中的缺陷窗口
 * <p>
 * - 维修日志：总是解析
 * - AOI/AXI 日志：只有存在非 PASS 的板卡时才解析，否则整段跳过
 */
public class ComponentInformationInterpreter {
    private static final Logger logger = LoggerFactory.getLogger(ComponentInformationInterpreter.class);

    private final Map<DocumentKind, DefectWindowStrategy> strategies = new EnumMap<>(DocumentKind.class);

    public ComponentInformationInterpreter() {
        strategies.put(DocumentKind.REPAIR, new RepairWindowStrategy());
        strategies.put(DocumentKind.AOI_AXI, new AoiAxiWindowStrategy());
    }

    /**
     * @param root   文档根元素
     * @param kind   日志类型
     * @param boards 已解析的板卡段
     * @return 需要记录到板卡上的缺陷窗口，按文档顺序
     */
    public List<DefectWindow> interpret(XmlNode root, DocumentKind kind, BoardSection boards)
            throws LogParseException {
        if (kind == DocumentKind.AOI_AXI && !boards.isAnyFailed()) {
            logger.debug("All boards passed, skipping <ComponentInformation>");
            return Collections.emptyList();
        }

        Optional<XmlNode> componentInfo = root.findChild(LogTags.COMPONENT_INFORMATION);
        if (componentInfo.isEmpty()) {
            return Collections.emptyList();
        }
        logger.debug("Searching {} windows in <ComponentInformation>", kind);

        DefectWindowStrategy strategy = strategies.get(kind);
        List<DefectWindow> windows = new ArrayList<>();
        for (XmlNode window : componentInfo.get().getChildren()) {
            strategy.interpret(window, boards.size()).ifPresent(windows::add);
        }
        return windows;
    }
}
