package com.db.vf2pp.domain;

import com.db.vf2pp.matching.MatchMode;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class MatchJob {
    private String id;
    private DataGraph first;
    private DataGraph second;
    private MatchMode mode;
    private int maxMappings;
}
