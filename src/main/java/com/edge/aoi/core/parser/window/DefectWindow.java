package com.edge.aoi.core.parser.window;

/**
 * 一个需要记录到板卡上的缺陷窗口
 */
public class DefectWindow {
    private final String winId;
    // 0 基板卡槽位
    private final int boardIndex;
    private final boolean pseudo;

    public DefectWindow(String winId, int boardIndex, boolean pseudo) {
        this.winId = winId;
        this.boardIndex = boardIndex;
        this.pseudo = pseudo;
    }

    public String getWinId() {
        return winId;
    }

    public int getBoardIndex() {
        return boardIndex;
    }

    public boolean isPseudo() {
        return pseudo;
    }

    @Override
    public String toString() {
        return "DefectWindow{winId='" + winId + "', board=" + boardIndex + ", pseudo=" + pseudo + '}';
    }
}
