package com.edge.aoi.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "aoi-uploader")
public class YamlConfig {
    private LogsConfig logs = new LogsConfig();
    private UploadConfig upload = new UploadConfig();
    private CheckpointConfig checkpoint = new CheckpointConfig();
    private ScheduleConfig schedule = new ScheduleConfig();

    @Data
    public static class LogsConfig {
        private String dir;            // 按日期分目录的日志根目录: <dir>/2024_01_15/
        private String line;           // 产线名，站点名前缀
        private long deltaT = 0;       // 扫描起点相对上次时间点回退的秒数
    }

    @Data
    public static class UploadConfig {
        private int chunkSize = 10;    // 每批上传的面板数
        private String table = "[dbo].[SMT_AOI_RESULTS]";
    }

    @Data
    public static class CheckpointConfig {
        private String file = "last_date.txt";
    }

    @Data
    public static class ScheduleConfig {
        private boolean enabled = true;
        private long interval = 300000; // 毫秒
    }
}
