package com.db.vf2pp.domain;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * A graph vertex identified by its uri. The type is the vertex label used for matching.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Vertex implements Serializable {
    @EqualsAndHashCode.Include
    private String uri;
    private String type;

    public Vertex(String uri, String type) {
        this.uri = uri;
        this.type = type;
    }

    @Override
    public String toString() {
        return "Vertex{" +
                "uri='" + uri + '\'' +
                ", type='" + type + '\'' +
                '}';
    }
}
