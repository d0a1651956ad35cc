package com.example.fulfillment.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fulfillmentOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Order Fulfillment Ledger API")
                        .description("""
                                訂單履約與會員點數帳本 API

                                ## 功能特色

                                - **訂單狀態機**: 受控的狀態轉換，每次變更皆寫入歷程
                                - **庫存保留**: 原子化的條件式扣減，不會超賣
                                - **點數帳本**: 只新增不修改的點數交易，餘額由加總計算
                                - **非同步任務**: 點數發放與回沖透過 Outbox 佇列與 Retry 執行
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Fulfillment Team")
                                .email("fulfillment@example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
