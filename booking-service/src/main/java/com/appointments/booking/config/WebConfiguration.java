package com.appointments.booking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves the public pages and assets. Only the listed prefixes are exposed; the admin
 * page is served by its controller after the session check.
 */
@Configuration
public class WebConfiguration implements WebMvcConfigurer {

    private final String staticLocation;

    public WebConfiguration(@Value("${booking.static-location:classpath:/static/}") String staticLocation) {
        this.staticLocation = staticLocation.endsWith("/") ? staticLocation : staticLocation + "/";
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/index.html").addResourceLocations(staticLocation);
        registry.addResourceHandler("/css/**").addResourceLocations(staticLocation + "css/");
        registry.addResourceHandler("/js/**").addResourceLocations(staticLocation + "js/");
        registry.addResourceHandler("/public/**").addResourceLocations(staticLocation + "public/");
    }

    @Override
    public void addViewControllers(ViewControllerRegistry registry) {
        registry.addViewController("/").setViewName("forward:/index.html");
    }
}
