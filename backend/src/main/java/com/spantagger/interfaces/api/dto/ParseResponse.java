package com.spantagger.interfaces.api.dto;

import com.spantagger.domain.tagging.model.ParseResult;
import com.spantagger.domain.tagging.model.Repair;
import com.spantagger.domain.tagging.model.Span;

import java.util.List;

public record ParseResponse(List<Span> spans, List<Repair> repairs) {

    public static ParseResponse from(ParseResult result) {
        return new ParseResponse(result.spans(), result.repairs());
    }
}
