package com.tariffmonitor.monitor.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MonitoredSource(
    @JsonAlias({"utilityName", "utility_name"}) String sourceName,
    @JsonAlias({"sourceReference", "source_reference", "url"}) String sourceUrl
) {}
