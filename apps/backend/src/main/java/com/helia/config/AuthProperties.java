package com.helia.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller identification. Tokens are issued elsewhere; this table only maps an accepted
 * bearer token to its owner id.
 */
@Data
@ConfigurationProperties(prefix = "helia.auth")
public class AuthProperties {

    /** Header set by a trusted gateway after it authenticated the caller. */
    private String userHeader = "X-User-Id";

    private boolean trustUserHeader = true;

    private Map<String, String> tokens = new LinkedHashMap<>();
}
