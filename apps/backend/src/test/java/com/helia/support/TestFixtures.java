package com.helia.support;

import com.helia.config.ChatProperties;
import com.helia.config.PersonaProperties;
import com.helia.service.PersonaRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

public final class TestFixtures {

    public static final String PARENT = "supportive-parent";
    public static final String SUN_SHIELD = "sun-shield";

    private TestFixtures() {
    }

    public static PersonaRegistry personaRegistry() {
        PersonaProperties properties = new PersonaProperties();
        PersonaProperties.Definition parent = new PersonaProperties.Definition();
        parent.setDisplayName("Supportive Parent");
        parent.setSystemPrompt("You are a helpful parenting assistant.");
        properties.getPersonas().put(PARENT, parent);

        PersonaProperties.Definition sunShield = new PersonaProperties.Definition();
        sunShield.setDisplayName("Helia Sun Shield");
        sunShield.setSystemPrompt("You are Helia Sun Shield, a guide for online safety.");
        sunShield.setSafetyRole("help you keep your family safe online");
        sunShield.setSafetySuggestion("For example, I can help you set up secure online activities.");
        properties.getPersonas().put(SUN_SHIELD, sunShield);
        return new PersonaRegistry(properties);
    }

    public static ChatProperties chatProperties() {
        ChatProperties properties = new ChatProperties();
        properties.setContextWindow(4);
        properties.setTurnTimeout(Duration.ofSeconds(5));
        return properties;
    }

    /** Clock that moves one millisecond forward on every read, so successive timestamps differ. */
    public static final class TickingClock extends Clock {

        private Instant current;

        public TickingClock(Instant start) {
            this.current = start;
        }

        public TickingClock() {
            this(Instant.parse("2026-01-01T00:00:00Z"));
        }

        @Override
        public synchronized Instant instant() {
            current = current.plusMillis(1);
            return current;
        }

        public synchronized void advance(Duration duration) {
            current = current.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
