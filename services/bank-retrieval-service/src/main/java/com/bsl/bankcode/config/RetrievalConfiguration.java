package com.bsl.bankcode.config;

import com.bsl.bankcode.resilience.RetrievalResilienceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({RetrievalProperties.class, RetrievalResilienceProperties.class})
public class RetrievalConfiguration {}
