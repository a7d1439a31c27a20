package com.tracelens.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NPlusOneFinding.class, name = "n_plus_one"),
        @JsonSubTypes.Type(value = SerialChainFinding.class, name = "serial_chain"),
        @JsonSubTypes.Type(value = RetryStormFinding.class, name = "retry_storm"),
        @JsonSubTypes.Type(value = CascadingTimeoutFinding.class, name = "cascading_timeout"),
        @JsonSubTypes.Type(value = ConnectionPoolFinding.class, name = "connection_pool")
})
public sealed interface AntiPatternFinding
        permits NPlusOneFinding, SerialChainFinding, RetryStormFinding, CascadingTimeoutFinding, ConnectionPoolFinding {

    List<String> getSpanNames();

    int getCount();

    double getTotalDurationMs();

    Impact getImpact();

    String getRecommendation();
}
