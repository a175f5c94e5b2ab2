package com.edge.aoi.controller;

import com.edge.aoi.config.YamlConfig;
import com.edge.aoi.core.parser.InspectionLogParser;
import com.edge.aoi.core.parser.LogParseException;
import com.edge.aoi.model.Panel;
import com.edge.aoi.service.AoiUploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 上传服务状态与日志校验
 */
@Tag(name = "上传状态", description = "上传服务状态查询和单个日志解析校验")
@RestController
@RequestMapping("/api")
public class StatusController {

    private static final Logger logger = LoggerFactory.getLogger(StatusController.class);

    private final AoiUploadService uploadService;
    private final InspectionLogParser parser;
    private final YamlConfig yamlConfig;

    public StatusController(AoiUploadService uploadService, InspectionLogParser parser, YamlConfig yamlConfig) {
        this.uploadService = uploadService;
        this.parser = parser;
        this.yamlConfig = yamlConfig;
    }

    /**
     * 当前状态和最近一次运行结果
     */
    @Operation(summary = "获取上传状态", description = "GREY: 尚未运行, GREEN: 最近一次全部成功, RED: 数据库不可用或上传失败")
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", uploadService.getStatus().toString());
        data.put("line", yamlConfig.getLogs().getLine());
        data.put("last_run", uploadService.getLastReport());

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", data);
        return ResponseEntity.ok(response);
    }

    /**
     * 解析单个日志，不写入数据库
     */
    @Operation(summary = "校验检测日志", description = "上传一份 XML 日志，返回解析出的面板或失败原因")
    @PostMapping(value = "/logs/parse", consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE,
            MediaType.APPLICATION_OCTET_STREAM_VALUE})
    public ResponseEntity<Map<String, Object>> parseLog(@RequestBody byte[] body,
                                                        @RequestParam(required = false) String line,
                                                        @RequestParam(defaultValue = "upload") String name) {
        Map<String, Object> response = new HashMap<>();
        String lineName = line != null ? line : yamlConfig.getLogs().getLine();
        try {
            Panel panel = parser.parse(body, name, lineName);
            response.put("status", "success");
            response.put("data", panel);
            return ResponseEntity.ok(response);
        } catch (LogParseException e) {
            logger.warn("Log check failed for {}: {}", name, e.toString());
            response.put("status", "error");
            response.put("reason", e.getType().toString());
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
        }
    }
}
