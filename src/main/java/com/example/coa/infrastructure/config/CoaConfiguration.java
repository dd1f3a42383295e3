package com.example.coa.infrastructure.config;

import com.example.coa.domain.schema.ColumnSchema;
import com.example.coa.domain.schema.DefaultColumnSchema;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(CoaProperties.class)
public class CoaConfiguration {

    @Bean
    public ColumnSchema columnSchema() {
        return DefaultColumnSchema.create();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
