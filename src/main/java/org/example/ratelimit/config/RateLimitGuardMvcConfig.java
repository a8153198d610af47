package org.example.ratelimit.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@ConditionalOnProperty(name = "rate-limit.guard.enabled", havingValue = "true", matchIfMissing = true)
public class RateLimitGuardMvcConfig implements WebMvcConfigurer {

    private final RateLimitGuardInterceptor rateLimitGuardInterceptor;
    private final String[] pathPatterns;

    public RateLimitGuardMvcConfig(
            RateLimitGuardInterceptor rateLimitGuardInterceptor,
            @Value("${rate-limit.guard.path-patterns:/api/**}") String[] pathPatterns) {
        this.rateLimitGuardInterceptor = rateLimitGuardInterceptor;
        this.pathPatterns = pathPatterns;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(rateLimitGuardInterceptor)
                .addPathPatterns(pathPatterns);
    }
}
