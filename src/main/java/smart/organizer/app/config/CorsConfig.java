package smart.organizer.app.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets the browser-extension client call the API from its own origin.
 * Origins come from organizer.cors.allowed-origins (env ALLOWED_ORIGINS, comma separated).
 */
@Slf4j
@Configuration
public class CorsConfig implements WebMvcConfigurer {
    private final OrganizerProperties properties;

    public CorsConfig(OrganizerProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = properties.getCors().getAllowedOrigins().stream()
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toArray(String[]::new);
        log.info("CORS enabled for origins {}", String.join(",", origins));

        // patterns rather than plain origins: "*" is rejected together with credentials
        registry.addMapping("/**")
                .allowedOriginPatterns(origins)
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
