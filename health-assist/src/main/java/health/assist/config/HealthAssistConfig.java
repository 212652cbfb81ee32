package health.assist.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;
import java.util.Arrays;

@Configuration
public class HealthAssistConfig implements WebMvcConfigurer {
    private final String allowedOrigins;

    public HealthAssistConfig(@Value("${health.assist.cors.allowed-origins:*}") String allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(corsOrigins(allowedOrigins))
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }

    static String[] corsOrigins(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty() || value.equals("*")) {
            return new String[] {"*"};
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toArray(String[]::new);
    }
}
