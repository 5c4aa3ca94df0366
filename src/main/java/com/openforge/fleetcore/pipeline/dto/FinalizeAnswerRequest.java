package com.openforge.fleetcore.pipeline.dto;

import com.openforge.fleetcore.search.Source;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request body for POST /api/assistant/answers.
 *
 * @param sources the sources the answer was generated from, in citation order (index 1 first)
 */
public record FinalizeAnswerRequest(

        @NotBlank(message = "sessionId must not be blank")
        String sessionId,

        @NotBlank(message = "userQuery must not be blank")
        String userQuery,

        @NotNull(message = "answer must not be null")
        String answer,

        List<Source> sources,

        boolean technicalDepth
) {

    public List<Source> sourcesOrEmpty() {
        return sources == null ? List.of() : sources;
    }
}
