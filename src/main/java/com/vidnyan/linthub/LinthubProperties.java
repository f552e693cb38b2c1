package com.vidnyan.linthub;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for linthub.
 * Can be configured via application.yml or command line properties.
 */
@Data
@Component
@ConfigurationProperties(prefix = "linthub")
public class LinthubProperties {

    /**
     * Interpreter used to launch linters as {@code <interpreter> -m <linter>}.
     */
    private String interpreter = "python3";

    /**
     * Time a single linter process may run before it is killed.
     */
    private Duration timeout = Duration.ofSeconds(1000);

    /**
     * Number of lint units processed concurrently.
     */
    private int maxParallelUnits = Runtime.getRuntime().availableProcessors();

    /**
     * Location of the override table.
     */
    private String overridesLocation = "classpath:overrides/overrides.json";

    /**
     * Files linted by the command line runner when none are passed as arguments.
     */
    private List<String> files = new ArrayList<>();

    /**
     * Option values keyed by option id, e.g. {@code no-flake8: true}.
     */
    private Map<String, String> options = new LinkedHashMap<>();
}
