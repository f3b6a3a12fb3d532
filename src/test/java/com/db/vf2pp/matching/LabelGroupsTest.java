package com.db.vf2pp.matching;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LabelGroupsTest {

    @Test
    void groupsAndCountsByLabel() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("a", "red");
        labels.put("b", "blue");
        labels.put("c", "red");

        assertThat(LabelGroups.groupByLabel(labels)).containsOnlyKeys("red", "blue");
        assertThat(LabelGroups.groupByLabel(labels).get("red")).containsExactly("a", "c");
        assertThat(LabelGroups.countByLabel(labels)).containsEntry("red", 2).containsEntry("blue", 1);
        assertThat(LabelGroups.countByLabel(new LinkedHashMap<String, String>())).isEmpty();
    }

    @Test
    void groupsByLabelIdInNodeOrder() {
        int[] labelOf = {1, 0, 1, 2, 1};

        int[][] groups = LabelGroups.groupByLabelId(labelOf, 4);

        assertThat(groups[0]).containsExactly(1);
        assertThat(groups[1]).containsExactly(0, 2, 4);
        assertThat(groups[2]).containsExactly(3);
        assertThat(groups[3]).isEmpty();
        assertThat(LabelGroups.countByLabelId(labelOf, 4)).containsExactly(1, 3, 1, 0);
    }
}
