package com.whereq.poolstat.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StateRecordTest {

    @Test
    void attributeNamesAreCaseInsensitive() {
        StateRecord job = StateRecord.of(Map.of("RequestCpus", 2L));

        assertThat(job.has("requestcpus")).isTrue();
        assertThat(job.number("REQUESTCPUS")).contains(2.0);
    }

    @Test
    void nullValuesAreDropped() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("Owner", null);
        attributes.put("JobStatus", 1L);

        StateRecord job = StateRecord.of(attributes);

        assertThat(job.has("Owner")).isFalse();
        assertThat(job.string("Owner", "nobody")).isEqualTo("nobody");
        assertThat(job.integer("JobStatus")).contains(1L);
    }

    @Test
    void expressionsEvaluateToTheirValue() {
        StateRecord job = StateRecord.of(Map.of(
            "RequestMemory", new Expression("ifThenElse(MemoryUsage > 2000, MemoryUsage, 2000)", 4000L),
            "RequestGpus", Expression.unevaluated("TARGET.Gpus")));

        assertThat(job.number("RequestMemory")).contains(4000.0);
        assertThat(job.get("RequestMemory")).get().isInstanceOf(Expression.class);
        assertThat(job.has("RequestGpus")).isTrue();
        assertThat(job.number("RequestGpus")).isEmpty();
        assertThat(job.evaluate("RequestGpus")).isEmpty();
    }

    @Test
    void numericStringsAreNumbersButWordsAreNot() {
        StateRecord job = StateRecord.of(Map.of(
            "RequestDisk", " 2048 ",
            "Owner", "alice",
            "IS_GLIDEIN", true));

        assertThat(job.number("RequestDisk")).contains(2048.0);
        assertThat(job.number("Owner")).isEmpty();
        assertThat(job.number("IS_GLIDEIN")).isEmpty();
        assertThat(job.number("Missing", 7)).isEqualTo(7);
    }

    @Test
    void nonFiniteValuesAreNotNumbers() {
        StateRecord job = StateRecord.of(Map.of(
            "RequestCpus", "NaN",
            "RequestMemory", "-Infinity",
            "RequestDisk", Double.POSITIVE_INFINITY,
            "RequestGpus", Double.NaN));

        assertThat(job.number("RequestCpus")).isEmpty();
        assertThat(job.number("RequestMemory")).isEmpty();
        assertThat(job.number("RequestDisk")).isEmpty();
        assertThat(job.number("RequestGpus", 1)).isEqualTo(1);
    }

    @Test
    void booleansAcceptNonZeroNumbers() {
        StateRecord slot = StateRecord.of(Map.of("IS_GLIDEIN", 1L, "Dynamic", false, "Name", "slot1"));

        assertThat(slot.bool("IS_GLIDEIN")).contains(true);
        assertThat(slot.bool("Dynamic")).contains(false);
        assertThat(slot.bool("Name")).isEmpty();
    }

    @Test
    void recordsWithSameAttributesAreEqual() {
        assertThat(StateRecord.of(Map.of("Owner", "alice")))
            .isEqualTo(StateRecord.of(Map.of("Owner", "alice")))
            .isNotEqualTo(StateRecord.empty());
    }
}
