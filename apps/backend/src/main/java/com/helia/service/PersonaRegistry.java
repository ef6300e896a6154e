package com.helia.service;

import com.helia.config.PersonaProperties;
import com.helia.domain.PersonaConfig;
import com.helia.error.ChatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable persona lookup built once from configuration. Safe for concurrent reads.
 */
@Slf4j
@Component
public class PersonaRegistry {

    private final Map<String, PersonaConfig> personas;

    public PersonaRegistry(PersonaProperties properties) {
        Map<String, PersonaConfig> loaded = new LinkedHashMap<>();
        properties.getPersonas().forEach((id, def) -> loaded.put(id, toConfig(id, def)));
        if (loaded.isEmpty()) {
            throw new IllegalStateException("No personas configured under helia.personas");
        }
        this.personas = Map.copyOf(loaded);
        log.info("Persona registry loaded personas={}", loaded.keySet());
    }

    public PersonaConfig resolve(String personaId) {
        return find(personaId).orElseThrow(() -> ChatException.invalidPersona(personaId));
    }

    public Optional<PersonaConfig> find(String personaId) {
        if (!StringUtils.hasText(personaId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(personas.get(personaId));
    }

    public List<PersonaConfig> all() {
        return personas.values().stream()
                .sorted((a, b) -> a.personaId().compareTo(b.personaId()))
                .toList();
    }

    private static PersonaConfig toConfig(String id, PersonaProperties.Definition def) {
        if (def == null || !StringUtils.hasText(def.getSystemPrompt())) {
            throw new IllegalStateException("Persona " + id + " has no system prompt");
        }
        String displayName = StringUtils.hasText(def.getDisplayName()) ? def.getDisplayName() : id;
        return new PersonaConfig(id, displayName, def.getSystemPrompt().trim(),
                def.getSafetyRole(), def.getSafetySuggestion());
    }
}
