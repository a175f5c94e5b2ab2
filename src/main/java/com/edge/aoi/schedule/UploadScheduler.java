package com.edge.aoi.schedule;

import com.edge.aoi.model.UploadRunReport;
import com.edge.aoi.service.AoiUploadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时上传任务
 * 上一次运行结束后间隔 aoi-uploader.schedule.interval 毫秒再次执行
 */
@Component
@ConditionalOnProperty(name = "aoi-uploader.schedule.enabled", havingValue = "true", matchIfMissing = true)
public class UploadScheduler {

    private static final Logger logger = LoggerFactory.getLogger(UploadScheduler.class);

    private final AoiUploadService uploadService;

    public UploadScheduler(AoiUploadService uploadService) {
        this.uploadService = uploadService;
    }

    @Scheduled(initialDelay = 5000, fixedDelayString = "${aoi-uploader.schedule.interval:300000}")
    public void upload() {
        logger.info("Starting scheduled upload run");
        UploadRunReport report = uploadService.runOnce();
        if (!report.isSuccess()) {
            logger.warn("Scheduled upload run did not complete: {}", report.getMessage());
        }
    }
}
