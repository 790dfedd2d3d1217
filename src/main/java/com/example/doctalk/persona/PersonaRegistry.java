package com.example.doctalk.persona;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps a workspace mode id to its persona. Lookup never fails: anything unrecognized is
 * {@link Persona#GENERAL}.
 */
@Component
public class PersonaRegistry {

    public static final Persona DEFAULT_PERSONA = Persona.GENERAL;

    private final Map<String, Persona> personasById = Arrays.stream(Persona.values())
            .collect(Collectors.toUnmodifiableMap(Persona::id, Function.identity()));

    /**
     * System-prompt fragment for a mode id.
     */
    public String resolve(String modeId) {
        return resolvePersona(modeId).promptFragment();
    }

    public Persona resolvePersona(String modeId) {
        return find(modeId).orElse(DEFAULT_PERSONA);
    }

    /**
     * Accepts "legal", "LEGAL", " Legal " and the like.
     */
    public Optional<Persona> find(String modeId) {
        if (modeId == null || modeId.isBlank()) {
            return Optional.empty();
        }
        String normalized = modeId.trim()
                .replace('_', '-')
                .toLowerCase(Locale.ROOT);
        return Optional.ofNullable(personasById.get(normalized));
    }

    public Collection<Persona> all() {
        return personasById.values();
    }
}
