package org.muralis.maps.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.muralis.maps.tool.MapsTools;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Publishes every {@code @Tool} method of {@link MapsTools} to the MCP server.
     * Duplicate tool names are rejected when the provider is built.
     */
    @Bean
    public ToolCallbackProvider mapsToolCallbackProvider(MapsTools mapsTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(mapsTools)
                .build();
    }
}
