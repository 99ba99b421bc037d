package com.exitdebt.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.media.StringSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    public static final String OWNER_HEADER = "X-Owner-Id";

    @Bean
    public OpenAPI exitDebtOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Exit Debt API")
                        .description("Cronograma de parcelas e conciliação de pagamentos de dívidas.")
                        .version("v1")
                )
                // Identificação do dono da dívida, emitida pelo gateway de autenticação
                .components(new Components()
                        .addParameters(OWNER_HEADER, new HeaderParameter()
                                .name(OWNER_HEADER)
                                .required(true)
                                .description("UUID do usuário dono das dívidas")
                                .schema(new StringSchema().format("uuid"))
                        )
                );
    }
}
