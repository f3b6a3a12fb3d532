package com.db.vf2pp.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Data
public class AppConfig {
    @Value("${graph1Path:}")
    private String graph1Path;

    @Value("${graph2Path:}")
    private String graph2Path;

    // JSON array of {"id", "graph1", "graph2", "mode", "maxMappings"}; takes precedence over the single pair
    @Value("${batchPath:}")
    private String batchPath;

    @Value("${mode:isomorphism}")
    private String mode;

    @Value("${maxMappings:1}")
    private int maxMappings;

    @Value("${resultPath:}")
    private String resultPath;

    @Value("${workerThreads:4}")
    private int workerThreads;
}
