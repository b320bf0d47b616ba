package com.vet.clinic.config;

import com.vet.clinic.auth.AccessContextResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AccessContextResolver accessContextResolver;

    public WebConfig(AccessContextResolver accessContextResolver) {
        this.accessContextResolver = accessContextResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(accessContextResolver);
    }
}
