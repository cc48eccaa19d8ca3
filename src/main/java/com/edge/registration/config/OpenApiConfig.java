package com.edge.registration.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

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
    public OpenAPI edgeRegistrationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge Registration API")
                        .description("""
                                多算法图像配准服务 API 文档

                                ## 功能概述

                                按配置顺序依次尝试多个特征配准算法（SIFT / ORB / AKAZE），
                                对每个候选结果进行质量门限评估，返回接受、降级或失败的决策。

                                ### 决策状态
                                | 状态 | 说明 |
                                |------|------|
                                | `accepted` | 某算法结果同时满足 minScore 和 minInlierRatio |
                                | `fallback` | 都未过关，返回得分最高的候选（置信度不足） |
                                | `failed` | 没有可用结果，或降级已禁用 |

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Edge Vision Team")
                                .email("support@edge-vision.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为 POST 接口添加统一的响应示例
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> {
            if (openApi.getPaths() == null) {
                return;
            }
            openApi.getPaths().forEach((path, pathItem) -> {
                if (pathItem.getPost() != null) {
                    pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
                }
            });
        };
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("请求参数错误")
        ));

        return new ApiResponse()
                .description("请求错误")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
