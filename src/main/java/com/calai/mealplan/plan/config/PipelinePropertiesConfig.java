package com.calai.mealplan.plan.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelinePropertiesConfig {

    /** 啟動時轉一次，之後唯讀 */
    @Bean
    public PipelineConfig pipelineConfig(PipelineProperties props) {
        return props.toConfig();
    }
}
