package com.edge.aoi.core.parser.window;

import com.edge.aoi.core.parser.FieldExtractors;
import com.edge.aoi.core.parser.LogParseException;
import com.edge.aoi.core.parser.LogTags;
import com.edge.aoi.core.parser.ParseErrorType;
import com.edge.aoi.core.xml.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * AOI/AXI 检测站窗口
 * <p>
 * - 结果码在 {@code <Analysis><Result>} 中，"0" 表示该窗口没有缺陷
 * - PCBNumber 为 1 基板号，0 或不存在的板号都是错误
 * - 只有真实缺陷，没有伪缺陷
 */
public class AoiAxiWindowStrategy extends DefectWindowStrategy {
    private static final Logger logger = LoggerFactory.getLogger(AoiAxiWindowStrategy.class);

    @Override
    protected String readResult(XmlNode window) {
        return FieldExtractors.nestedText(window, LogTags.ANALYSIS, LogTags.RESULT);
    }

    @Override
    protected Optional<DefectWindow> resolve(String winId, String pcbNumber, String result, int boardCount)
            throws LogParseException {
        if (LogTags.WINDOW_RESULT_OK.equals(result)) {
            return Optional.empty();
        }
        logger.debug("Window found! WinID: {}, PCBNumber: {}, Result: {}", winId, pcbNumber, result);

        long boardNumber = parseBoardNumber(pcbNumber);
        if (boardNumber == 0) {
            throw new LogParseException(ParseErrorType.OUT_OF_RANGE_BOARD_REFERENCE,
                    LogTags.COMPONENT_INFORMATION, LogTags.PCB_NUMBER,
                    "BoardNumber is 0. Was expecting 1+");
        }
        if (boardNumber > boardCount) {
            throw new LogParseException(ParseErrorType.OUT_OF_RANGE_BOARD_REFERENCE,
                    LogTags.COMPONENT_INFORMATION, LogTags.PCB_NUMBER,
                    "Could not find board number " + pcbNumber + " (panel has " + boardCount + ")");
        }
        return Optional.of(new DefectWindow(winId, (int) boardNumber - 1, false));
    }
}
