package com.spantagger.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ConvertRequest(
        @NotNull(message = "Tags are required")
        @Size(max = 10000, message = "At most 10000 tags per request")
        List<String> tags,

        @NotBlank(message = "Source scheme is required")
        String source,

        @NotBlank(message = "Target scheme is required")
        String target,

        String policy
) {}
