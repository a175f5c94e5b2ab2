package com.edge.aoi.repository;

import com.edge.aoi.config.YamlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * 上次成功上传时间点
 * <p>
 * 以 yyyy-MM-dd HH:mm:ss（本地时间）保存在单独的文本文件中。
 */
@Repository
public class CheckpointRepository {
    private static final Logger logger = LoggerFactory.getLogger(CheckpointRepository.class);

    static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;

    @Autowired
    public CheckpointRepository(YamlConfig config) {
        this(Paths.get(config.getCheckpoint().getFile()));
    }

    CheckpointRepository(Path file) {
        this.file = file;
    }

    /**
     * 读取时间点
     *
     * @throws IOException 文件不存在或内容无法解析
     */
    public LocalDateTime read() throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8).trim();
        logger.debug("Last date: {}", content);
        try {
            return LocalDateTime.parse(content, FORMAT);
        } catch (DateTimeParseException e) {
            throw new IOException("Invalid checkpoint '" + content + "' in " + file, e);
        }
    }

    /**
     * 覆盖写入时间点
     */
    public void write(LocalDateTime time) throws IOException {
        Files.writeString(file, time.format(FORMAT), StandardCharsets.UTF_8);
        logger.debug("Checkpoint updated to {}", time.format(FORMAT));
    }

    public Path getFile() {
        return file;
    }
}
