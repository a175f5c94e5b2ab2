package com.edge.aoi.core.parser;

import com.edge.aoi.core.xml.XmlNode;
import com.edge.aoi.model.Board;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 解析 PCBInformation 段
 * <p>
 * 板卡槽位数量取该段的子元素个数（不论标签），只有 SinglePCB 会按出现顺序填入槽位。
 * 两者不一致时会留下空槽位，解析失败。
 */
public class BoardSectionInterpreter {
    private static final Logger logger = LoggerFactory.getLogger(BoardSectionInterpreter.class);

    /**
     * @param root 文档根元素
     * @return 段不存在时返回空板列表
     */
    public BoardSection interpret(XmlNode root) throws LogParseException {
        Optional<XmlNode> pcbInfo = root.findChild(LogTags.PCB_INFORMATION);
        if (pcbInfo.isEmpty()) {
            logger.debug("No <PCBInformation>, panel has no boards");
            return BoardSection.empty();
        }

        List<XmlNode> entries = pcbInfo.get().getChildren();
        int count = entries.size();
        logger.debug("PCB count: {}", count);

        List<Board> slots = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            slots.add(new Board());
        }

        boolean anyFailed = false;
        int index = 0;
        for (XmlNode pcb : pcbInfo.get().getChildren(LogTags.SINGLE_PCB)) {
            String serial = FieldExtractors.childText(pcb, LogTags.BARCODE);
            String result = FieldExtractors.childText(pcb, LogTags.RESULT);
            logger.debug("{}: serial: {}, result: {}", index, serial, result);

            if (serial.isEmpty() || result.isEmpty()) {
                throw new LogParseException(ParseErrorType.MISSING_MANDATORY_FIELD,
                        LogTags.PCB_INFORMATION, serial.isEmpty() ? LogTags.BARCODE : LogTags.RESULT,
                        "SinglePCB #" + index + " sub-fields missing (serial='" + serial + "', result='" + result + "')");
            }
            if (!LogTags.RESULT_PASS.equals(result)) {
                anyFailed = true;
            }
            assign(slots, index, new Board(serial, result));
            index++;
        }

        for (int i = 0; i < slots.size(); i++) {
            if (!slots.get(i).isPopulated()) {
                throw new LogParseException(ParseErrorType.INCONSISTENT_BOARD_RECORD,
                        LogTags.PCB_INFORMATION, null,
                        "Board serial or result is missing for slot " + i + " of " + slots.size());
            }
        }

        return new BoardSection(slots, anyFailed);
    }

    private static void assign(List<Board> slots, int index, Board board) throws LogParseException {
        if (index < 0 || index >= slots.size()) {
            throw new LogParseException(ParseErrorType.INCONSISTENT_BOARD_RECORD,
                    LogTags.PCB_INFORMATION, LogTags.SINGLE_PCB,
                    "SinglePCB #" + index + " has no slot, declared count is " + slots.size());
        }
        slots.set(index, board);
    }
}
