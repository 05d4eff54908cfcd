package com.stakeduel.web;

import com.stakeduel.config.StakeduelProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class AdminTokenConfig implements WebMvcConfigurer {

    private final StakeduelProperties stakeduelProperties;

    public AdminTokenConfig(StakeduelProperties stakeduelProperties) {
        this.stakeduelProperties = stakeduelProperties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AdminTokenInterceptor(stakeduelProperties))
                .addPathPatterns("/api/admin/**");
    }
}
