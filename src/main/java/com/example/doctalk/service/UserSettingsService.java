package com.example.doctalk.service;

import com.example.doctalk.exception.InvalidRequestException;
import com.example.doctalk.model.UserSettings;
import com.example.doctalk.persona.Persona;
import com.example.doctalk.persona.PersonaRegistry;
import com.example.doctalk.repository.UserSettingsRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class UserSettingsService {

    private static final Logger log = LoggerFactory.getLogger(UserSettingsService.class);

    private final UserSettingsRepository userSettingsRepository;
    private final PersonaRegistry personaRegistry;

    /**
     * The user's workspace mode; "general" when none was chosen or the store is unavailable.
     */
    @Transactional(readOnly = true)
    public String getActiveMode(String userId) {
        try {
            return userSettingsRepository.findById(userId)
                    .map(UserSettings::getActiveMode)
                    .flatMap(personaRegistry::find)
                    .map(Persona::id)
                    .orElse(PersonaRegistry.DEFAULT_PERSONA.id());
        } catch (DataAccessException e) {
            log.error("Error fetching settings for user {}, using default mode", userId, e);
            return PersonaRegistry.DEFAULT_PERSONA.id();
        }
    }

    @Transactional
    public String updateActiveMode(String userId, String mode) {
        Persona persona = personaRegistry.find(mode)
                .orElseThrow(() -> new InvalidRequestException("Unknown mode: " + mode));

        UserSettings settings = userSettingsRepository.findById(userId).orElseGet(() -> {
            UserSettings created = new UserSettings();
            created.setUserId(userId);
            return created;
        });
        settings.setActiveMode(persona.id());
        userSettingsRepository.save(settings);

        log.info("User {} switched to mode {}", userId, persona.id());
        return persona.id();
    }
}
