package com.helia.api.dto;

import com.helia.domain.PersonaConfig;

/** Public face of a persona; the system prompt stays server side. */
public record PersonaView(String id, String displayName) {

    public static PersonaView of(PersonaConfig persona) {
        return new PersonaView(persona.personaId(), persona.displayName());
    }
}
