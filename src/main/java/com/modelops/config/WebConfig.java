package com.modelops.config;

import com.modelops.entity.ModelStage;
import com.modelops.monitoring.ReportFormat;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Accepts stage labels ("Production") and report formats in any case on path and query parameters. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, ModelStage.class, ModelStage::fromLabel);
        registry.addConverter(String.class, ReportFormat.class, ReportFormat::parse);
    }
}
