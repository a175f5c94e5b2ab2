package com.edge.aoi.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 面板中的单块 PCB
 */
@Data
@NoArgsConstructor
public class Board {
    private String serial = "";
    // 排序后重新分配的 1 基序号，不信任日志中的位置
    private int position;
    private String result = "";

    // 真实缺陷的窗口 ID（保持插入顺序，去重）
    private Set<String> failures = new LinkedHashSet<>();
    // 维修站判定为伪缺陷的窗口 ID
    @JsonProperty("pseudo_failures")
    private Set<String> pseudoFailures = new LinkedHashSet<>();

    public Board(String serial, String result) {
        this.serial = serial;
        this.result = result;
    }

    /**
     * 记录真实缺陷
     *
     * @return 是否为新的窗口 ID
     */
    public boolean addFailure(String winId) {
        return failures.add(winId);
    }

    /**
     * 记录伪缺陷
     *
     * @return 是否为新的窗口 ID
     */
    public boolean addPseudoFailure(String winId) {
        return pseudoFailures.add(winId);
    }

    @JsonIgnore
    public boolean isPopulated() {
        return !serial.isEmpty() && !result.isEmpty();
    }
}
