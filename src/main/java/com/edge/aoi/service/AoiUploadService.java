package com.edge.aoi.service;

import com.edge.aoi.config.YamlConfig;
import com.edge.aoi.core.parser.InspectionLogParser;
import com.edge.aoi.core.parser.LogParseException;
import com.edge.aoi.model.Panel;
import com.edge.aoi.model.UploadRunReport;
import com.edge.aoi.model.UploaderStatus;
import com.edge.aoi.repository.AoiResultRepository;
import com.edge.aoi.repository.CheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 检测日志上传流程
 * <p>
 * 单次运行：
 * 1. 检查数据库连接
 * 2. 读取上次时间点，回退 delta-t 后扫描日志
 * 3. 逐个解析，失败的日志记录后跳过
 * 4. 分批写入数据库
 * 5. 全部批次成功才推进时间点
 */
@Service
public class AoiUploadService {
    private static final Logger logger = LoggerFactory.getLogger(AoiUploadService.class);

    private final YamlConfig config;
    private final InspectionLogParser parser;
    private final LogFileScanner scanner;
    private final CheckpointRepository checkpointRepository;
    private final AoiResultRepository resultRepository;

    private volatile UploaderStatus status = UploaderStatus.GREY;
    private volatile UploadRunReport lastReport;

    public AoiUploadService(YamlConfig config,
                            InspectionLogParser parser,
                            LogFileScanner scanner,
                            CheckpointRepository checkpointRepository,
                            AoiResultRepository resultRepository) {
        if (!StringUtils.hasText(config.getLogs().getLine())) {
            throw new IllegalStateException("Missing configuration: aoi-uploader.logs.line");
        }
        this.config = config;
        this.parser = parser;
        this.scanner = scanner;
        this.checkpointRepository = checkpointRepository;
        this.resultRepository = resultRepository;
    }

    /**
     * 执行一次完整的扫描-解析-上传
     */
    public synchronized UploadRunReport runOnce() {
        LocalDateTime startedAt = LocalDateTime.now();
        UploadRunReport.UploadRunReportBuilder report = UploadRunReport.builder().startedAt(startedAt);
        logger.debug("AOI auto update started");

        if (!resultRepository.isAvailable()) {
            logger.error("Failed to connect to the SQL server, skipping this run");
            status = UploaderStatus.RED;
            return finish(report.success(false).message("Database not available"));
        }

        LocalDateTime since;
        try {
            since = checkpointRepository.read().minusSeconds(config.getLogs().getDeltaT());
        } catch (IOException e) {
            logger.error("Failed to read last_date from {}", checkpointRepository.getFile(), e);
            return finish(report.success(false).message("Checkpoint not readable: " + e.getMessage()));
        }
        report.since(since);

        List<Path> logs;
        try {
            logs = scanner.scan(since);
        } catch (IOException e) {
            logger.error("Failed to gather logs since {}", since, e);
            return finish(report.success(false).message("Log scan failed: " + e.getMessage()));
        }
        report.filesFound(logs.size());

        List<Panel> panels = new ArrayList<>();
        int failed = 0;
        for (Path log : logs) {
            try {
                panels.add(parser.parse(log, config.getLogs().getLine()));
            } catch (LogParseException e) {
                failed++;
                logger.error("Failed to process log {}: [{}] {}", log, e.getType(), e.getMessage());
            }
        }
        report.filesParsed(panels.size()).filesFailed(failed);

        int chunkSize = Math.max(1, config.getUpload().getChunkSize());
        int rows = 0;
        int chunksFailed = 0;
        for (int from = 0; from < panels.size(); from += chunkSize) {
            List<Panel> chunk = panels.subList(from, Math.min(from + chunkSize, panels.size()));
            try {
                rows += resultRepository.insert(chunk);
                logger.debug("Upload successful: panels {}..{}", from, from + chunk.size() - 1);
            } catch (DataAccessException | TransactionException e) {
                chunksFailed++;
                logger.error("Upload failed for panels {}..{}", from, from + chunk.size() - 1, e);
            }
        }
        report.rowsUploaded(rows).chunksFailed(chunksFailed);

        if (chunksFailed > 0) {
            status = UploaderStatus.RED;
            logger.error("Upload failed - not setting new last_date");
            return finish(report.success(false).message(chunksFailed + " upload chunk(s) failed"));
        }

        status = UploaderStatus.GREEN;
        try {
            checkpointRepository.write(startedAt);
        } catch (IOException e) {
            logger.error("Failed to write last_date to {}", checkpointRepository.getFile(), e);
            return finish(report.success(false).message("Checkpoint not writable: " + e.getMessage()));
        }

        logger.info("Upload run finished: {} files, {} parsed, {} failed, {} rows",
                logs.size(), panels.size(), failed, rows);
        return finish(report.success(true));
    }

    private UploadRunReport finish(UploadRunReport.UploadRunReportBuilder report) {
        UploadRunReport result = report.finishedAt(LocalDateTime.now()).build();
        lastReport = result;
        return result;
    }

    public UploaderStatus getStatus() {
        return status;
    }

    public UploadRunReport getLastReport() {
        return lastReport;
    }
}
