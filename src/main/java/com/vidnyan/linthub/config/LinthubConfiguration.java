package com.vidnyan.linthub.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.linthub.LinthubProperties;
import com.vidnyan.linthub.application.port.out.LinterAdapter;
import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.config.Option;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for linthub components.
 */
@Slf4j
@Configuration
public class LinthubConfiguration {

    /**
     * ObjectMapper for linter output and the override table.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Pool running lint units; its size bounds the number of concurrent linter processes.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService lintExecutor(LinthubProperties properties) {
        int size = Math.max(1, properties.getMaxParallelUnits());
        AtomicInteger counter = new AtomicInteger();
        log.info("Lint units run on {} worker(s)", size);
        return Executors.newFixedThreadPool(size, runnable -> {
            Thread thread = new Thread(runnable, "lint-unit-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Option set built from {@code linthub.options}.
     */
    @Bean
    public LintConfig defaultLintConfig(LinthubProperties properties) {
        LintConfig.Builder builder = LintConfig.builder();
        properties.getOptions().forEach((id, raw) -> {
            Option option = Option.fromId(id)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown option: " + id));
            builder.parse(option, raw);
        });
        LintConfig config = builder.build();
        log.info("Default lint config: {}", config);
        return config;
    }

    /**
     * Log available linter adapters on startup.
     */
    @Bean
    public String logLinterAdapters(List<LinterAdapter> adapters) {
        log.info("Registered {} linter adapters:", adapters.size());
        adapters.forEach(a -> log.info("  - {}", a.linter()));
        return "linter-adapters-logged";
    }
}
