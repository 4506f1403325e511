package com.salesagent.leads.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.salesagent.leads.model.Lead;
import java.util.List;
import org.junit.jupiter.api.Test;

class LeadDeduplicatorTest {

    private final LeadDeduplicator deduplicator = new LeadDeduplicator();

    @Test
    void mostCompleteVariantWinsAndGapsAreFilled() {
        Lead sparse = lead("k1", "map_search").email("a@example.com").build();
        Lead rich = lead("k1", "cluster_search").phone("555").website("a.example").build();

        LeadDeduplicator.Result result = deduplicator.deduplicate(List.of(sparse, rich));

        assertThat(result.duplicatesCollapsed()).isEqualTo(1);
        assertThat(result.leads()).hasSize(1);
        Lead merged = result.leads().get(0);
        assertThat(merged.getSourceProvider()).isEqualTo("cluster_search");
        assertThat(merged.getPhone()).isEqualTo("555");
        assertThat(merged.getEmail()).isEqualTo("a@example.com");
    }

    @Test
    void tieGoesToFirstSeen() {
        Lead first = lead("k1", "map_search").phone("111").build();
        Lead second = lead("k1", "cluster_search").phone("222").build();

        Lead merged = deduplicator.deduplicate(List.of(first, second)).leads().get(0);

        assertThat(merged.getPhone()).isEqualTo("111");
        assertThat(merged.getSourceProvider()).isEqualTo("map_search");
    }

    @Test
    void distinctKeysKeepFirstOccurrenceOrder() {
        LeadDeduplicator.Result result = deduplicator.deduplicate(List.of(
            lead("b", "x").build(), lead("a", "x").build(), lead("b", "x").build()));

        assertThat(result.leads()).extracting(Lead::getIdentityKey).containsExactly("b", "a");
        assertThat(result.duplicatesCollapsed()).isEqualTo(1);
    }

    private Lead.LeadBuilder lead(String key, String provider) {
        return Lead.builder().identityKey(key).name("N").address("A").sourceProvider(provider);
    }
}
