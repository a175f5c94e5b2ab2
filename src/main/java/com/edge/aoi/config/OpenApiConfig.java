package com.edge.aoi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI aoiUploaderOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("AOI Log Uploader API")
                        .description("""
                                AOI / AXI / 维修站检测日志上传服务

                                ### 核心功能
                                - **定时上传**：扫描按日期分目录的检测日志，解析后批量写入 SMT_AOI_RESULTS
                                - **状态查询**：查看上传服务状态和最近一次运行结果
                                - **日志校验**：上传单个日志，只解析不入库

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0"));
    }
}
