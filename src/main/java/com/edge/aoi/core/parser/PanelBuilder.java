package com.edge.aoi.core.parser;

import com.edge.aoi.core.parser.window.DefectWindow;
import com.edge.aoi.core.xml.XmlNode;
import com.edge.aoi.model.Board;
import com.edge.aoi.model.Panel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 按固定顺序调用各段解释器并组装 {@link Panel}
 * <p>
 * 顺序：GlobalInformation -> PCBInformation -> ComponentInformation。
 * 任何一段失败都直接抛出，不返回部分结果。
 * <p>
 * 全部成功后：
 * 1. 按序列号升序重排板卡
 * 2. 按排序后的位置重新编号（1 基）
 * 3. 由产线名和日志类型生成站点名
 * <p>
 * 实例无状态，可在多个线程中共享。
 */
public class PanelBuilder {
    private final GlobalInformationInterpreter globalInterpreter = new GlobalInformationInterpreter();
    private final BoardSectionInterpreter boardInterpreter = new BoardSectionInterpreter();
    private final ComponentInformationInterpreter componentInterpreter = new ComponentInformationInterpreter();

    public Panel build(XmlNode root, String line) throws LogParseException {
        GlobalInformation global = globalInterpreter.interpret(root);
        globalInterpreter.validate(global);

        BoardSection boardSection = boardInterpreter.interpret(root);
        List<DefectWindow> windows = componentInterpreter.interpret(root, global.getKind(), boardSection);

        List<Board> boards = new ArrayList<>(boardSection.getBoards());
        for (DefectWindow window : windows) {
            Board board = boards.get(window.getBoardIndex());
            if (window.isPseudo()) {
                board.addPseudoFailure(window.getWinId());
            } else {
                board.addFailure(window.getWinId());
            }
        }

        boards.sort(Comparator.comparing(Board::getSerial));
        for (int i = 0; i < boards.size(); i++) {
            boards.get(i).setPosition(i + 1);
        }

        Panel panel = new Panel();
        panel.setProgram(global.getProgram());
        panel.setOperator(global.getOperator());
        panel.setInspectionTime(global.getInspectionTime());
        panel.setRepairTime(global.getRepairTime());
        panel.setStation(global.getKind().stationName(line));
        panel.setBoards(boards);
        return panel;
    }
}
