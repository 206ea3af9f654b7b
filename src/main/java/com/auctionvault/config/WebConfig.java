package com.auctionvault.config;

import com.auctionvault.auth.JwtAuthFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Browser access and the bearer-token filter for the engine API.
 *
 * <p>Callers authenticate with an {@code Authorization: Bearer} header, never a cookie,
 * so cross-origin requests carry no credentials and only the two headers the API reads
 * are allowed.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${auctionvault.cors.allowed-origin}")
    private String allowedOrigin;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(allowedOrigin)
                .allowedMethods("GET", "POST", "PUT", "DELETE")
                .allowedHeaders("Authorization", "Content-Type")
                .exposedHeaders(ApiResponseAdvice.ACTOR_HEADER);
    }

    /** Every /api route except token issuance needs a bearer token; the filter itself skips the exempt path. */
    @Bean
    public FilterRegistrationBean<JwtAuthFilter> jwtAuthFilterRegistration(JwtAuthFilter jwtAuthFilter) {
        FilterRegistrationBean<JwtAuthFilter> registration = new FilterRegistrationBean<>(jwtAuthFilter);
        registration.addUrlPatterns("/api/*");
        registration.setOrder(1);
        return registration;
    }
}
