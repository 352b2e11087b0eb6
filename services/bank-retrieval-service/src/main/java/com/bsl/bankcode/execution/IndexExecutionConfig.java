package com.bsl.bankcode.execution;

import com.bsl.bankcode.index.IndexProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IndexProperties.class)
public class IndexExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService indexRebuildExecutor(IndexProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getRebuildPoolSize()));
    }
}
