package com.eainde.augury.config;

import com.eainde.augury.analysis.ExecutionSettings;
import com.eainde.augury.thread.MdcAwareExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutionConfig {

    /** Runs theory calculations; sized by {@code augury.execution.pool-size}. */
    @Bean(name = "theoryPool", destroyMethod = "shutdown")
    public MdcAwareExecutor theoryPool(ExecutionSettings executionSettings) {
        return new MdcAwareExecutor("theory", executionSettings.poolSize());
    }

    @Bean(name = "extractionPool", destroyMethod = "shutdown")
    public MdcAwareExecutor extractionPool(@Value("${augury.extraction.pool-size:4}") int poolSize) {
        return new MdcAwareExecutor("extraction", poolSize);
    }
}
