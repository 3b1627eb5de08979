package com.eventaudit.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class NullRateSeries {

    List<NullRateSample> samples;

    @JsonCreator
    public NullRateSeries(@JsonProperty("samples") List<NullRateSample> samples) {
        this.samples = samples == null ? List.of() : List.copyOf(samples);
    }
}
