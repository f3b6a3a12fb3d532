package com.db.vf2pp.process;

import com.db.vf2pp.config.AppConfig;
import com.db.vf2pp.domain.DataGraph;
import com.db.vf2pp.domain.MatchJob;
import com.db.vf2pp.domain.MatchResult;
import com.db.vf2pp.matching.MatchMode;
import com.db.vf2pp.service.AsyncService;
import com.db.vf2pp.service.GraphService;
import com.db.vf2pp.utils.FileUtil;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

@Service
public class MatchProcess {
    private static final Logger logger = LoggerFactory.getLogger(MatchProcess.class);
    private final AppConfig config;
    private final GraphService graphService;
    private final AsyncService asyncService;

    @Autowired
    public MatchProcess(AppConfig config, GraphService graphService, AsyncService asyncService) {
        this.config = config;
        this.graphService = graphService;
        this.asyncService = asyncService;
    }

    public List<MatchResult> start() {
        long startTime = System.currentTimeMillis();
        List<MatchResult> results = new ArrayList<>();
        List<MatchJob> jobs = loadJobs(results);
        logger.info("Loaded {} match jobs at {}", jobs.size(), LocalDateTime.now());

        results.addAll(runAll(jobs));
        for (MatchResult result : results) {
            if (result.isFailed()) {
                logger.info("Job {} failed: {}", result.getJobId(), result.getError());
            } else {
                logger.info("Job {} ({}): pre-check {}, {} mapping(s), {} ms", result.getJobId(), result.getMode(),
                        result.isPrecheckPassed() ? "passed" : "rejected", result.getMappings().size(), result.getElapsedMillis());
            }
        }

        if (!config.getResultPath().isBlank()) {
            FileUtil.writeJson(toJson(results), config.getResultPath());
            logger.info("Results written to {}", config.getResultPath());
        }
        logger.info("Matching finished in {} ms", System.currentTimeMillis() - startTime);
        return results;
    }

    public List<MatchResult> runAll(List<MatchJob> jobs) {
        List<CompletableFuture<MatchResult>> futures = jobs.stream()
                .map(asyncService::matchAsync)
                .collect(Collectors.toList());
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    /**
     * Jobs from the batch manifest when one is configured, otherwise the single configured pair.
     * Jobs whose graphs cannot be loaded are reported as failed results.
     */
    List<MatchJob> loadJobs(List<MatchResult> failures) {
        List<MatchJob> jobs = new ArrayList<>();
        if (!config.getBatchPath().isBlank()) {
            JSONArray manifest = FileUtil.readJsonArray(config.getBatchPath());
            for (int i = 0; i < manifest.length(); i++) {
                JSONObject entry = manifest.getJSONObject(i);
                String id = entry.optString("id", "job-" + i);
                String first = FileUtil.resolveSibling(config.getBatchPath(), entry.getString("graph1"));
                String second = FileUtil.resolveSibling(config.getBatchPath(), entry.getString("graph2"));
                addJob(jobs, failures, id, first, second, entry.optString("mode", config.getMode()), entry.optInt("maxMappings", config.getMaxMappings()));
            }
        } else if (!config.getGraph1Path().isBlank() && !config.getGraph2Path().isBlank()) {
            addJob(jobs, failures, "pair", config.getGraph1Path(), config.getGraph2Path(),
                    config.getMode(), config.getMaxMappings());
        } else {
            logger.warn("Neither batchPath nor graph1Path/graph2Path is configured, nothing to match");
        }
        return jobs;
    }

    private void addJob(List<MatchJob> jobs, List<MatchResult> failures, String id, String first, String second,
                        String modeName, int maxMappings) {
        MatchMode mode = null;
        try {
            mode = MatchMode.fromName(modeName);
            DataGraph graph1 = graphService.loadGraph(first);
            DataGraph graph2 = graphService.loadGraph(second);
            jobs.add(new MatchJob(id, graph1, graph2, mode, maxMappings));
        } catch (RuntimeException e) {
            logger.error("Error while loading graphs for job " + id, e);
            MatchResult failed = new MatchResult(id, mode);
            failed.setError(e.getMessage());
            failures.add(failed);
        }
    }

    public JSONArray toJson(List<MatchResult> results) {
        JSONArray array = new JSONArray();
        for (MatchResult result : results) {
            JSONObject object = new JSONObject();
            object.put("id", result.getJobId());
            if (result.getMode() != null) {
                object.put("mode", result.getMode().name());
            }
            object.put("precheckPassed", result.isPrecheckPassed());
            object.put("matched", result.isMatched());
            object.put("elapsedMillis", result.getElapsedMillis());
            if (result.isFailed()) {
                object.put("error", result.getError());
            }
            JSONArray mappings = new JSONArray();
            for (Map<String, String> mapping : result.getMappings()) {
                mappings.put(new JSONObject(mapping));
            }
            object.put("mappings", mappings);
            array.put(object);
        }
        return array;
    }
}
