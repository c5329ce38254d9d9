package com.mylist.infrastructure.config;

import com.mylist.infrastructure.filter.AuthFilter;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.IntegerSchema;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String DEMO_USER_ID = "demo-user-1";

    @Bean
    public OpenAPI myListOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("My List API")
                        .version("1.0")
                        .description("Saved movies and TV shows per user, newest first, with opaque cursor pagination. "
                                + "The caller is identified by the " + AuthFilter.USER_ID_HEADER + " header."));
    }

    /**
     * Pre-fills the user header in Swagger UI and documents the retryable 503 every list operation can return.
     */
    @Bean
    public OperationCustomizer myListOperationCustomizer() {
        return (operation, handlerMethod) -> {
            if (operation.getParameters() == null) {
                return operation;
            }
            boolean identifiesUser = false;
            for (Parameter parameter : operation.getParameters()) {
                if (AuthFilter.USER_ID_HEADER.equalsIgnoreCase(parameter.getName())) {
                    parameter.setSchema(new StringSchema()._default(DEMO_USER_ID).pattern("[A-Za-z0-9_-]{1,64}"));
                    parameter.setExample(DEMO_USER_ID);
                    identifiesUser = true;
                }
            }
            if (identifiesUser && operation.getResponses() != null) {
                operation.getResponses().addApiResponse("503", new ApiResponse()
                        .description("List store unavailable, retry after the indicated delay")
                        .addHeaderObject("Retry-After", new Header().schema(new IntegerSchema())));
            }
            return operation;
        };
    }
}
