package com.spantagger.interfaces.api.tagging;

import com.spantagger.application.tagging.TaggingAppService;
import com.spantagger.interfaces.api.dto.ConvertRequest;
import com.spantagger.interfaces.api.dto.EncodeRequest;
import com.spantagger.interfaces.api.dto.ParseRequest;
import com.spantagger.interfaces.api.dto.ParseResponse;
import com.spantagger.interfaces.api.dto.TagsResponse;
import com.spantagger.interfaces.api.dto.TransitionsResponse;
import com.spantagger.interfaces.api.dto.ValidateRequest;
import com.spantagger.interfaces.api.dto.ValidationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tags")
@RequiredArgsConstructor
public class TaggingController {

    private final TaggingAppService taggingAppService;

    @PostMapping("/parse")
    public ResponseEntity<ParseResponse> parse(@Valid @RequestBody ParseRequest request) {
        return ResponseEntity.ok(ParseResponse.from(
                taggingAppService.parse(request.tags(), request.scheme(), request.policy())));
    }

    @PostMapping("/encode")
    public ResponseEntity<TagsResponse> encode(@Valid @RequestBody EncodeRequest request) {
        return ResponseEntity.ok(new TagsResponse(
                taggingAppService.encode(request.toSpans(), request.length(), request.scheme())));
    }

    @PostMapping("/convert")
    public ResponseEntity<TagsResponse> convert(@Valid @RequestBody ConvertRequest request) {
        return ResponseEntity.ok(new TagsResponse(
                taggingAppService.convert(request.tags(), request.source(), request.target(), request.policy())));
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@Valid @RequestBody ValidateRequest request) {
        return ResponseEntity.ok(ValidationResponse.from(
                taggingAppService.validate(request.tags(), request.scheme())));
    }

    @GetMapping("/transitions")
    public ResponseEntity<TransitionsResponse> transitions(@RequestParam(required = false) String scheme,
                                                           @RequestParam List<String> types) {
        return ResponseEntity.ok(new TransitionsResponse(taggingAppService.transitions(scheme, types)));
    }
}
