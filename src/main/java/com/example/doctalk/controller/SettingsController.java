package com.example.doctalk.controller;

import com.example.doctalk.model.ModeUpdateRequest;
import com.example.doctalk.service.UserSettingsService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Tag(name = "settings")
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final UserSettingsService userSettingsService;

    @GetMapping
    public Map<String, String> getSettings(
            @RequestHeader(value = CurrentUser.HEADER, required = false) String userHeader) {
        String userId = CurrentUser.require(userHeader);
        return Map.of("activeMode", userSettingsService.getActiveMode(userId));
    }

    @PutMapping("/mode")
    public Map<String, String> updateMode(
            @RequestHeader(value = CurrentUser.HEADER, required = false) String userHeader,
            @Valid @RequestBody ModeUpdateRequest request) {
        String userId = CurrentUser.require(userHeader);
        return Map.of("activeMode", userSettingsService.updateActiveMode(userId, request.mode()));
    }
}
