package com.edge.aoi.service;

import com.edge.aoi.config.YamlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 查找需要处理的检测日志
 * <p>
 * 目录结构: {dir}/2024_01_15/*.xml
 * <p>
 * 规则：
 * - 从起始日期到今天的每个日期目录（不存在的跳过）
 * - 扩展名为 xml 或 XML 的普通文件
 * - 修改时间不早于起始时间
 * - 排除文件名以 _AOI / _AXI 结尾的检测站临时文件
 */
@Service
public class LogFileScanner {
    private static final Logger logger = LoggerFactory.getLogger(LogFileScanner.class);

    private static final DateTimeFormatter DAY_DIR_FORMAT = DateTimeFormatter.ofPattern("yyyy_MM_dd");

    private final Path logDir;
    private final Clock clock;

    @Autowired
    public LogFileScanner(YamlConfig config) {
        this(resolveLogDir(config), Clock.systemDefaultZone());
    }

    LogFileScanner(Path logDir, Clock clock) {
        this.logDir = logDir;
        this.clock = clock;
    }

    private static Path resolveLogDir(YamlConfig config) {
        String dir = config.getLogs().getDir();
        if (!StringUtils.hasText(dir)) {
            throw new IllegalStateException("Missing configuration: aoi-uploader.logs.dir");
        }
        return Paths.get(dir);
    }

    /**
     * 查找 since 之后修改过的日志
     *
     * @throws IOException 日期目录无法读取
     */
    public List<Path> scan(LocalDateTime since) throws IOException {
        List<Path> logs = new ArrayList<>();
        for (Path dir : dayDirectories(since.toLocalDate(), LocalDate.now(clock))) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
                for (Path file : files) {
                    if (isCandidate(file) && modifiedSince(file, since)) {
                        logs.add(file);
                    }
                }
            }
        }
        logs.sort(null);
        logger.debug("Found {} log files since {}", logs.size(), since);
        return logs;
    }

    /**
     * 起止日期之间（含）实际存在的日期目录
     */
    List<Path> dayDirectories(LocalDate from, LocalDate to) {
        List<Path> dirs = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            Path dir = logDir.resolve(day.format(DAY_DIR_FORMAT));
            if (Files.isDirectory(dir)) {
                logger.debug("subdir exists: {}", dir);
                dirs.add(dir);
            }
        }
        return dirs;
    }

    static boolean isCandidate(Path file) {
        if (!Files.isRegularFile(file)) {
            return false;
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        String extension = name.substring(dot + 1);
        if (!extension.equals("xml") && !extension.equals("XML")) {
            return false;
        }
        String stem = name.substring(0, dot);
        return !(stem.endsWith("_AOI") || stem.endsWith("_AXI"));
    }

    /**
     * 列出目录后被删除或移走的文件按未修改处理
     */
    boolean modifiedSince(Path file, LocalDateTime since) throws IOException {
        FileTime lastModified;
        try {
            lastModified = Files.getLastModifiedTime(file);
        } catch (NoSuchFileException e) {
            logger.warn("Log file disappeared while scanning, skipped: {}", file);
            return false;
        }
        LocalDateTime modified = LocalDateTime.ofInstant(lastModified.toInstant(), clock.getZone());
        return !modified.isBefore(since);
    }
}
