package com.linlay.reasoningrelay.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ModelListResponse(
        String object,
        List<ModelEntry> data
) {

    public static ModelListResponse of(List<ModelEntry> models) {
        return new ModelListResponse("list", models == null ? List.of() : List.copyOf(models));
    }

    public record ModelEntry(
            String id,
            String object,
            long created,
            @JsonProperty("owned_by")
            String ownedBy
    ) {
    }
}
