package com.heureca.wppsessions.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

        @Bean
        public OpenAPI wppSessionGatewayOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("WPP Session Gateway API")
                                                .description("""
                                                                Multiplexes many long-lived WhatsApp sessions behind one gateway.

                                                                • Session creation with QR handshake
                                                                • Readiness checks and automatic reconnect
                                                                • Session metadata persisted across restarts
                                                                """)
                                                .version("v1"));
        }
}
