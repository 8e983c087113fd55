package com.acme.corna.themes;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/themes")
public class ThemeController {
    private final ThemeService themeService;

    public ThemeController(ThemeService themeService) {
        this.themeService = themeService;
    }

    @PostMapping
    public ResponseEntity<Void> add(@RequestBody @Valid ThemeDtos.AddRequest request) {
        themeService.add(request);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @PutMapping("/status")
    public ResponseEntity<Void> updateStatus(@RequestBody @Valid ThemeDtos.StatusRequest request) {
        themeService.updateStatus(request);
        return ResponseEntity.ok().build();
    }

    @GetMapping
    public ThemeDtos.ThemeList list() {
        return themeService.list();
    }
}
