package com.acme.corna.themes;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public class ThemeDtos {
    public record AddRequest(@NotBlank String creator, @NotBlank String name, String description, String path, String thumbnail) {}
    public record StatusRequest(@NotBlank String creator, @NotBlank String name, String path, @NotBlank String status) {}
    public record ThemeView(String name, String description, String thumbnail, String creator, String id) {}
    public record ThemeList(List<ThemeView> themes) {}
}
