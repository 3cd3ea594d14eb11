package com.spantagger.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ParseRequest(
        @NotNull(message = "Tags are required")
        @Size(max = 10000, message = "At most 10000 tags per request")
        List<String> tags,

        String scheme,

        String policy
) {}
