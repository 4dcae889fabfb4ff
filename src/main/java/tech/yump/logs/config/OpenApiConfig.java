package tech.yump.logs.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.logs.auth.ApiKeyAuthFilter;

@Configuration
public class OpenApiConfig {

    public static final String SECURITY_SCHEME_NAME = "ApiKeyAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme apiKeyScheme = new SecurityScheme()
                .name(ApiKeyAuthFilter.API_KEY_HEADER)
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .description("Shared API key ('" + ApiKeyAuthFilter.API_KEY_HEADER + "') required for uploads and re-sanitize when key checks are enabled. Reads are public.");

        return new OpenAPI()
                .info(new Info()
                        .title("LiteLogs API")
                        .description("Log ingestion with redacted copies and live tailing.")
                        .version("0.1.0"))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME, apiKeyScheme))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME));
    }
}
