package com.db.vf2pp.service;

import com.db.vf2pp.domain.MatchJob;
import com.db.vf2pp.domain.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Service
@EnableAsync
public class AsyncService {

    private static final Logger logger = LoggerFactory.getLogger(AsyncService.class);
    private final IsomorphismService isomorphismService;

    @Autowired
    public AsyncService(IsomorphismService isomorphismService) {
        this.isomorphismService = isomorphismService;
    }

    /**
     * Runs one job on the match executor. Every job builds its own search state, so jobs never share
     * mutable data. Failures are reported in the result instead of failing the future.
     */
    @Async("matchExecutor")
    public CompletableFuture<MatchResult> matchAsync(MatchJob job) {
        long startTime = System.currentTimeMillis();
        MatchResult result;
        try {
            result = isomorphismService.match(job);
        } catch (RuntimeException e) {
            logger.error("Error while matching job " + job.getId(), e);
            result = new MatchResult(job.getId(), job.getMode());
            result.setError(e.getMessage());
        }
        long endTime = System.currentTimeMillis();
        logger.info("Async task for job {} completed in {} ms, mappings: {}", job.getId(), (endTime - startTime), result.getMappings().size());
        return CompletableFuture.completedFuture(result);
    }
}
