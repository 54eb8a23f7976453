package com.llmbridge.api.dto.response;

import com.llmbridge.core.query.model.ProviderStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ProviderResponse {
    private String name;
    private String slug;
    private String defaultModel;
    private boolean available;

    public static ProviderResponse from(ProviderStatus status) {
        return ProviderResponse.builder()
            .name(status.getName())
            .slug(status.getSlug())
            .defaultModel(status.getProvider().getDefaultModel())
            .available(status.isAvailable())
            .build();
    }
}
