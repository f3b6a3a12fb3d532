package com.db.vf2pp.service;

import com.db.vf2pp.domain.*;
import com.db.vf2pp.matching.MatchMode;
import com.db.vf2pp.matching.VF2ppGraphMapping;
import com.db.vf2pp.matching.VF2ppIsomorphismInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class IsomorphismService {
    private static final Logger logger = LoggerFactory.getLogger(IsomorphismService.class);
    private static final long SLOW_SEARCH_MILLIS = 10000;

    private final GraphService graphService;

    @Autowired
    public IsomorphismService(GraphService graphService) {
        this.graphService = graphService;
    }

    public VF2ppIsomorphismInspector<Vertex, RelationshipEdge, String> checkIsomorphism(DataGraph first, DataGraph second, MatchMode mode) {
        return new VF2ppIsomorphismInspector<>(first.getGraph(), second.getGraph(),
                graphService.labelsOf(first), graphService.labelsOf(second), RelationshipEdge::getLabel, mode);
    }

    public boolean precheck(DataGraph first, DataGraph second, MatchMode mode) {
        return checkIsomorphism(first, second, mode).precheck();
    }

    public boolean isIsomorphic(DataGraph first, DataGraph second) {
        return checkIsomorphism(first, second, MatchMode.ISOMORPHISM).isomorphismExists();
    }

    public Optional<Map<String, String>> findMapping(DataGraph first, DataGraph second, MatchMode mode) {
        return checkIsomorphism(first, second, mode).findMapping().map(this::toUriMapping);
    }

    /**
     * Up to {@code limit} mappings in search order; {@code limit <= 0} collects all of them.
     */
    public List<Map<String, String>> findMappings(DataGraph first, DataGraph second, MatchMode mode, int limit) {
        return collect(checkIsomorphism(first, second, mode), limit);
    }

    private List<Map<String, String>> collect(VF2ppIsomorphismInspector<Vertex, RelationshipEdge, String> inspector, int limit) {
        List<Map<String, String>> result = new ArrayList<>();
        VF2ppIsomorphismInspector<Vertex, RelationshipEdge, String>.VF2ppMappingIterator mappings = inspector.getMappings();
        while ((limit <= 0 || result.size() < limit) && mappings.hasNext()) {
            result.add(toUriMapping(mappings.next()));
        }
        mappings.halt();
        return result;
    }

    public MatchResult match(MatchJob job) {
        MatchResult result = new MatchResult(job.getId(), job.getMode());
        long startTime = System.currentTimeMillis();

        VF2ppIsomorphismInspector<Vertex, RelationshipEdge, String> inspector = checkIsomorphism(job.getFirst(), job.getSecond(), job.getMode());
        result.setPrecheckPassed(inspector.precheck());
        if (result.isPrecheckPassed()) {
            result.setMappings(collect(inspector, job.getMaxMappings()));
        }

        long duration = System.currentTimeMillis() - startTime;
        result.setElapsedMillis(duration);
        if (duration > SLOW_SEARCH_MILLIS) {
            logger.info("Matching for job {} took {} ms", job.getId(), duration);
        }
        return result;
    }

    private Map<String, String> toUriMapping(VF2ppGraphMapping<Vertex, RelationshipEdge> mapping) {
        Map<String, String> uris = new LinkedHashMap<>();
        mapping.getForwardMapping().forEach((v1, v2) -> uris.put(v1.getUri(), v2.getUri()));
        return uris;
    }
}
