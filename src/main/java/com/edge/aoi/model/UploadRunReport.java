package com.edge.aoi.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 一次上传运行的统计
 */
@Data
@Builder
public class UploadRunReport {
    @JsonProperty("started_at")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime startedAt;
    @JsonProperty("finished_at")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime finishedAt;
    // 本次扫描的起点（上次时间点减去 delta-t）
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime since;

    @JsonProperty("files_found")
    private int filesFound;
    @JsonProperty("files_parsed")
    private int filesParsed;
    @JsonProperty("files_failed")
    private int filesFailed;
    @JsonProperty("rows_uploaded")
    private int rowsUploaded;
    @JsonProperty("chunks_failed")
    private int chunksFailed;

    private boolean success;
    private String message;
}
