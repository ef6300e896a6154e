package com.helia.domain;

/**
 * Behavioural configuration of one persona.
 *
 * <p>{@code safetyRole} and {@code safetySuggestion} feed the refusal text used when the
 * model provider blocks a request on content-policy grounds.</p>
 */
public record PersonaConfig(
        String personaId,
        String displayName,
        String systemPrompt,
        String safetyRole,
        String safetySuggestion
) { }
