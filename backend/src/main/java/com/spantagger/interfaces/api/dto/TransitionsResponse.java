package com.spantagger.interfaces.api.dto;

import com.spantagger.domain.tagging.model.Transition;

import java.util.List;

public record TransitionsResponse(List<Transition> transitions) {}
