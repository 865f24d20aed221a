package com.kmg.classifier.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateWorkItemRequest(
        @Size(max = 128) @Pattern(regexp = "[A-Za-z0-9._:-]*") String id,
        @NotBlank @Size(max = 256) String ownerRef,
        @NotBlank @Size(max = 1024) String payloadRef
) {
}
