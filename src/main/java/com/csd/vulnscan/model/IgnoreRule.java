package com.csd.vulnscan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IgnoreRule {
    private String id;              // advisory id, CVE alias, or package@version
    @JsonProperty("package")
    private String packageName;
    private String packageVersion;
    private String expires;         // ISO date or date-time; rule is inert afterwards
    private String reason;
}
