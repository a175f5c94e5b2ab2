package com.edge.aoi.service;

import com.edge.aoi.config.YamlConfig;
import com.edge.aoi.core.parser.InspectionLogParser;
import com.edge.aoi.core.parser.LogParseException;
import com.edge.aoi.core.parser.ParseErrorType;
import com.edge.aoi.model.Panel;
import com.edge.aoi.model.UploadRunReport;
import com.edge.aoi.model.UploaderStatus;
import com.edge.aoi.repository.AoiResultRepository;
import com.edge.aoi.repository.CheckpointRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AoiUploadServiceTest {

    private static final LocalDateTime LAST = LocalDateTime.of(2024, 1, 15, 10, 0, 0);

    @Mock
    private InspectionLogParser parser;
    @Mock
    private LogFileScanner scanner;
    @Mock
    private CheckpointRepository checkpointRepository;
    @Mock
    private AoiResultRepository resultRepository;

    private YamlConfig config;
    private AoiUploadService service;

    @BeforeEach
    void setUp() {
        config = new YamlConfig();
        config.getLogs().setLine("SMT1");
        config.getLogs().setDeltaT(60);
        config.getUpload().setChunkSize(2);
        service = new AoiUploadService(config, parser, scanner, checkpointRepository, resultRepository);
    }

    @Test
    @DisplayName("初始状态为 GREY")
    void initialStatus() {
        assertThat(service.getStatus()).isEqualTo(UploaderStatus.GREY);
        assertThat(service.getLastReport()).isNull();
    }

    @Test
    @DisplayName("数据库不可用时直接结束，状态 RED")
    void databaseUnavailable() {
        when(resultRepository.isAvailable()).thenReturn(false);

        UploadRunReport report = service.runOnce();

        assertThat(report.isSuccess()).isFalse();
        assertThat(service.getStatus()).isEqualTo(UploaderStatus.RED);
        assertThat(service.getLastReport()).isSameAs(report);
        verifyNoInteractions(scanner, parser, checkpointRepository);
    }

    @Test
    @DisplayName("解析失败的日志被跳过，其余分批上传并推进时间点")
    void successfulRun() throws Exception {
        Path a = Path.of("a.xml");
        Path b = Path.of("b.xml");
        Path bad = Path.of("bad.xml");
        Path c = Path.of("c.xml");
        when(resultRepository.isAvailable()).thenReturn(true);
        when(checkpointRepository.read()).thenReturn(LAST);
        when(scanner.scan(LAST.minusSeconds(60))).thenReturn(List.of(a, b, bad, c));
        when(parser.parse(a, "SMT1")).thenReturn(new Panel());
        when(parser.parse(b, "SMT1")).thenReturn(new Panel());
        when(parser.parse(bad, "SMT1")).thenThrow(new LogParseException(
                ParseErrorType.MISSING_MANDATORY_SECTION, "GlobalInformation", null, "GlobalInformation not found"));
        when(parser.parse(c, "SMT1")).thenReturn(new Panel());
        when(resultRepository.insert(anyList())).thenReturn(2, 1);

        UploadRunReport report = service.runOnce();

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getSince()).isEqualTo(LAST.minusSeconds(60));
        assertThat(report.getFilesFound()).isEqualTo(4);
        assertThat(report.getFilesParsed()).isEqualTo(3);
        assertThat(report.getFilesFailed()).isEqualTo(1);
        assertThat(report.getRowsUploaded()).isEqualTo(3);
        assertThat(report.getChunksFailed()).isZero();
        assertThat(service.getStatus()).isEqualTo(UploaderStatus.GREEN);

        verify(resultRepository, times(2)).insert(anyList());
        verify(checkpointRepository).write(report.getStartedAt());
    }

    @Test
    @DisplayName("任一批次失败时状态 RED，不推进时间点")
    void chunkFailure() throws Exception {
        Path a = Path.of("a.xml");
        when(resultRepository.isAvailable()).thenReturn(true);
        when(checkpointRepository.read()).thenReturn(LAST);
        when(scanner.scan(any())).thenReturn(List.of(a));
        when(parser.parse(a, "SMT1")).thenReturn(new Panel());
        when(resultRepository.insert(anyList())).thenThrow(new DataIntegrityViolationException("truncated"));

        UploadRunReport report = service.runOnce();

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getChunksFailed()).isEqualTo(1);
        assertThat(service.getStatus()).isEqualTo(UploaderStatus.RED);
        verify(checkpointRepository, never()).write(any());
    }

    @Test
    @DisplayName("没有新日志时也推进时间点")
    void noLogs() throws Exception {
        when(resultRepository.isAvailable()).thenReturn(true);
        when(checkpointRepository.read()).thenReturn(LAST);
        when(scanner.scan(any())).thenReturn(List.of());

        UploadRunReport report = service.runOnce();

        assertThat(report.isSuccess()).isTrue();
        assertThat(service.getStatus()).isEqualTo(UploaderStatus.GREEN);
        verify(resultRepository, never()).insert(anyList());
        verify(checkpointRepository).write(report.getStartedAt());
    }

    @Test
    @DisplayName("时间点文件无法读取时不扫描")
    void checkpointUnreadable() throws Exception {
        when(resultRepository.isAvailable()).thenReturn(true);
        when(checkpointRepository.read()).thenThrow(new IOException("no such file"));

        UploadRunReport report = service.runOnce();

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getMessage()).contains("no such file");
        assertThat(service.getStatus()).isEqualTo(UploaderStatus.GREY);
        verifyNoInteractions(scanner, parser);
    }

    @Test
    @DisplayName("未配置产线名")
    void missingLine() {
        YamlConfig empty = new YamlConfig();

        assertThatThrownBy(() -> new AoiUploadService(empty, parser, scanner, checkpointRepository, resultRepository))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("aoi-uploader.logs.line");
    }
}
