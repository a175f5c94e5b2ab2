package com.edge.aoi.service;

import com.edge.aoi.config.YamlConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogFileScannerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 16, 12, 0, 0);

    @TempDir
    Path root;

    private LogFileScanner scanner;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        scanner = new LogFileScanner(root, clock);
    }

    private Path log(String day, String name, LocalDateTime modified) throws IOException {
        Path dir = Files.createDirectories(root.resolve(day));
        Path file = Files.writeString(dir.resolve(name), "<Root/>");
        Files.setLastModifiedTime(file, FileTime.from(modified.toInstant(ZoneOffset.UTC)));
        return file;
    }

    @Test
    @DisplayName("扫描起始日期到今天的所有日期目录")
    void scansEveryDayUntilToday() throws IOException {
        Path first = log("2024_01_15", "panel_1.xml", LocalDateTime.of(2024, 1, 15, 10, 0));
        Path second = log("2024_01_16", "panel_2.XML", LocalDateTime.of(2024, 1, 16, 9, 0));
        log("2024_01_14", "old.xml", LocalDateTime.of(2024, 1, 14, 23, 0));

        assertThat(scanner.scan(LocalDateTime.of(2024, 1, 15, 8, 0))).containsExactly(first, second);
    }

    @Test
    @DisplayName("修改时间早于起始时间的日志被跳过")
    void skipsOlderFiles() throws IOException {
        log("2024_01_16", "early.xml", LocalDateTime.of(2024, 1, 16, 7, 59, 59));
        Path exact = log("2024_01_16", "exact.xml", LocalDateTime.of(2024, 1, 16, 8, 0));
        Path late = log("2024_01_16", "late.xml", LocalDateTime.of(2024, 1, 16, 11, 0));

        assertThat(scanner.scan(LocalDateTime.of(2024, 1, 16, 8, 0))).containsExactly(exact, late);
    }

    @Test
    @DisplayName("跳过 _AOI / _AXI 临时文件和其他扩展名")
    void skipsStationTempFilesAndOtherExtensions() throws IOException {
        LocalDateTime modified = LocalDateTime.of(2024, 1, 16, 10, 0);
        Path kept = log("2024_01_16", "panel_REPAIR.xml", modified);
        log("2024_01_16", "panel_AOI.xml", modified);
        log("2024_01_16", "panel_AXI.XML", modified);
        log("2024_01_16", "panel.txt", modified);
        log("2024_01_16", "panel.Xml", modified);
        Files.createDirectories(root.resolve("2024_01_16").resolve("nested.xml"));

        assertThat(scanner.scan(LocalDateTime.of(2024, 1, 16, 0, 0))).containsExactly(kept);
    }

    @Test
    @DisplayName("不存在的日期目录被跳过")
    void missingDayDirectories() throws IOException {
        Files.createDirectories(root.resolve("2024_01_13"));
        Files.createDirectories(root.resolve("2024_01_16"));

        assertThat(scanner.dayDirectories(LocalDate.of(2024, 1, 12), LocalDate.of(2024, 1, 16)))
                .containsExactly(root.resolve("2024_01_13"), root.resolve("2024_01_16"));
        assertThat(scanner.scan(LocalDateTime.of(2024, 1, 10, 0, 0))).isEmpty();
    }

    @Test
    @DisplayName("起始时间晚于今天时没有结果")
    void sinceInFuture() throws IOException {
        log("2024_01_16", "panel.xml", LocalDateTime.of(2024, 1, 16, 10, 0));

        assertThat(scanner.scan(LocalDateTime.of(2024, 1, 17, 0, 0))).isEmpty();
    }

    @Test
    @DisplayName("列出目录后消失的文件被跳过")
    void vanishedFileSkipped() throws IOException {
        Path file = log("2024_01_16", "panel.xml", LocalDateTime.of(2024, 1, 16, 10, 0));
        LocalDateTime since = LocalDateTime.of(2024, 1, 16, 0, 0);
        assertThat(scanner.modifiedSince(file, since)).isTrue();

        Files.delete(file);

        assertThat(scanner.modifiedSince(file, since)).isFalse();
    }

    @Test
    @DisplayName("未配置日志目录")
    void missingDirConfiguration() {
        YamlConfig config = new YamlConfig();

        assertThatThrownBy(() -> new LogFileScanner(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("aoi-uploader.logs.dir");
    }
}
