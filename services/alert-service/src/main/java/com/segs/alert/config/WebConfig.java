package com.segs.alert.config;

import com.segs.alert.entity.AlertStatus;
import com.segs.alert.entity.Severity;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Accepts lowercase enum values in query parameters, matching the JSON form.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, AlertStatus.class, (Converter<String, AlertStatus>) AlertStatus::fromValue);
        registry.addConverter(String.class, Severity.class, (Converter<String, Severity>) Severity::fromValue);
    }
}
