package com.edge.aoi.core.parser;

import com.edge.aoi.model.Board;

import java.util.Collections;
import java.util.List;

/**
 * PCBInformation 段的解析结果
 */
public class BoardSection {
    private final List<Board> boards;
    // 至少一块板的结果不是 PASS
    private final boolean anyFailed;

    public BoardSection(List<Board> boards, boolean anyFailed) {
        this.boards = boards;
        this.anyFailed = anyFailed;
    }

    public static BoardSection empty() {
        return new BoardSection(Collections.emptyList(), false);
    }

    public List<Board> getBoards() {
        return boards;
    }

    public boolean isAnyFailed() {
        return anyFailed;
    }

    public int size() {
        return boards.size();
    }
}
