package predict.market.trading.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation for the prediction market API
 */
@Configuration
public class SwaggerConfig {

    static final String CALLER_HEADER = "X-User-Id";

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI openAPI() {
        // the caller header is declared as an API key so Swagger UI can send it on every request
        SecurityScheme callerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name(CALLER_HEADER)
                .description("Id of the calling user");

        return new OpenAPI()
                .info(new Info()
                        .title("Prediction Market API")
                        .description("Limit and market orders on market outcomes, immediate trades at the "
                                + "current probability, market resolution and portfolio queries")
                        .version("1.0.0"))
                .components(new Components().addSecuritySchemes(CALLER_HEADER, callerScheme))
                .addSecurityItem(new SecurityRequirement().addList(CALLER_HEADER))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local Development Server")));
    }
}
