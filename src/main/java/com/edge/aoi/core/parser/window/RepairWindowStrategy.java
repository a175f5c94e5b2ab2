package com.edge.aoi.core.parser.window;

import com.edge.aoi.core.parser.FieldExtractors;
import com.edge.aoi.core.parser.LogParseException;
import com.edge.aoi.core.parser.LogTags;
import com.edge.aoi.core.xml.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 维修站窗口
 * <p>
 * - 结果码在 {@code <Result><ErrorDescription>} 中
 * - PCBNumber 为 0 基槽位，不存在的槽位直接忽略
 * - ErrorDescription 为 Pszeudohiba 时记为伪缺陷，否则为真实缺陷
 */
public class RepairWindowStrategy extends DefectWindowStrategy {
    private static final Logger logger = LoggerFactory.getLogger(RepairWindowStrategy.class);

    @Override
    protected String readResult(XmlNode window) {
        return FieldExtractors.nestedText(window, LogTags.RESULT, LogTags.ERROR_DESCRIPTION);
    }

    @Override
    protected Optional<DefectWindow> resolve(String winId, String pcbNumber, String result, int boardCount)
            throws LogParseException {
        logger.debug("Window found! WinID: {}, PCBNumber: {}, Result: {}", winId, pcbNumber, result);

        long index = parseBoardNumber(pcbNumber);
        if (index >= boardCount) {
            logger.debug("Repair window {} refers to unknown board slot {}, ignored", winId, pcbNumber);
            return Optional.empty();
        }
        return Optional.of(new DefectWindow(winId, (int) index, LogTags.PSEUDO_DEFECT.equals(result)));
    }
}
