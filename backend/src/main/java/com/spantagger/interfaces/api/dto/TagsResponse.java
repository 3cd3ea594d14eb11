package com.spantagger.interfaces.api.dto;

import java.util.List;

public record TagsResponse(List<String> tags) {}
