package com.clawrelay.agent.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A stored credential for one provider.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthProfile {
    /** "api_key", "oauth" or "token". */
    private String type;
    private String provider;
    @ToString.Exclude
    private String key;
}
