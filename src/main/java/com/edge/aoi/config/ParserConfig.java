package com.edge.aoi.config;

import com.edge.aoi.core.parser.InspectionLogParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 日志解析器配置
 * <p>
 * 解析核心不依赖 Spring，这里只负责注册为单例 Bean
 */
@Configuration
public class ParserConfig {

    @Bean
    public InspectionLogParser inspectionLogParser() {
        return new InspectionLogParser();
    }
}
