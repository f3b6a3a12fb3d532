package com.db.vf2pp.matching;

public enum SearchStatus {
    SEARCHING,
    /**
     * The last step completed a mapping; the search resumes from it on the next request.
     */
    MATCH_FOUND,
    EXHAUSTED,
    /**
     * The caller halted the search before it was exhausted.
     */
    DONE
}
