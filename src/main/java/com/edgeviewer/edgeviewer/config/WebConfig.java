package com.edgeviewer.edgeviewer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${logging.request.enabled:false}")
    private boolean requestLoggingEnabled;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // the viewer page may be served from anywhere
        registry.addMapping("/viewer/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RequestLoggingInterceptor(requestLoggingEnabled))
                .addPathPatterns("/viewer/**");
    }
}
