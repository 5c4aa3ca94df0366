package com.openforge.fleetcore.pipeline.dto;

import com.openforge.fleetcore.search.Source;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ValidateCitationsRequest(

        @NotNull(message = "content must not be null")
        String content,

        List<Source> sources
) {

    public List<Source> sourcesOrEmpty() {
        return sources == null ? List.of() : sources;
    }
}
