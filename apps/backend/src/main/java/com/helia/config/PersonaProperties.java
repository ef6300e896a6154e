package com.helia.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persona table bound from {@code helia.personas.*}. Read once by
 * {@link com.helia.service.PersonaRegistry}; never consulted afterwards.
 */
@Data
@ConfigurationProperties(prefix = "helia")
public class PersonaProperties {

    private Map<String, Definition> personas = new LinkedHashMap<>();

    @Data
    public static class Definition {
        private String displayName;
        private String systemPrompt;
        private String safetyRole = "assist you with parenting in a positive and ethical way";
        private String safetySuggestion =
                "For example, I can provide tips on creating a safe and supportive environment for your family.";
    }
}
