package com.db.vf2pp.domain;

import com.db.vf2pp.matching.MatchMode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
public class MatchResult implements Serializable {
    private String jobId;
    private MatchMode mode;
    private boolean precheckPassed;
    // uri of a first graph vertex -> uri of its image
    private List<Map<String, String>> mappings = new ArrayList<>();
    private long elapsedMillis;
    private String error;

    public MatchResult(String jobId, MatchMode mode) {
        this.jobId = jobId;
        this.mode = mode;
    }

    public boolean isMatched() {
        return !mappings.isEmpty();
    }

    public boolean isFailed() {
        return error != null;
    }
}
