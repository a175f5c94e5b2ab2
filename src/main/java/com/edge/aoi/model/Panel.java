package com.edge.aoi.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 一个检测日志对应的面板（拼板）记录
 */
@Data
public class Panel {
    private String program = "";
    private String station = "";
    // 仅维修站日志有操作员
    private String operator = "";
    @JsonProperty("inspection_time")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime inspectionTime;
    @JsonProperty("repair_time")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime repairTime;

    private List<Board> boards = new ArrayList<>();

    /**
     * 上传时使用的时间：维修日志取维修时间，否则取检测时间
     */
    @JsonProperty("record_time")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    public LocalDateTime getRecordTime() {
        return operator.isEmpty() ? inspectionTime : repairTime;
    }
}
