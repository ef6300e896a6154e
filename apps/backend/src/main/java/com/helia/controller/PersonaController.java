package com.helia.controller;

import com.helia.api.dto.PersonaView;
import com.helia.service.PersonaRegistry;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/personas")
@RequiredArgsConstructor
public class PersonaController {

    private final PersonaRegistry personaRegistry;

    @Operation(summary = "Personas a session can be created with")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<PersonaView> list() {
        return personaRegistry.all().stream().map(PersonaView::of).toList();
    }
}
