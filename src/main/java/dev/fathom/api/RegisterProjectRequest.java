package dev.fathom.api;

import jakarta.validation.constraints.NotBlank;

/** JSON body of {@code POST /projects}. */
public record RegisterProjectRequest(@NotBlank String name, @NotBlank String path) {}
