package io.landadvisor.reportservice.config;

import io.landadvisor.reportservice.application.service.render.FontRegistry;
import io.landadvisor.reportservice.domain.model.layout.PageGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class ReportConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ReportConfiguration.class);

    @Bean
    public FontRegistry fontRegistry(ReportProperties properties, ResourceLoader resourceLoader) {
        return FontRegistry.load(properties.fonts().locations(), resourceLoader);
    }

    @Bean
    public PageGeometry pageGeometry(ReportProperties properties) {
        PageGeometry geometry = properties.page().toGeometry();
        logger.info("Page {}x{}pt, content width {}pt, columns {}", geometry.getPageWidth(),
                geometry.getPageHeight(), geometry.contentWidth(), geometry.getColumnWidthPolicy());
        return geometry;
    }
}
