package dev.llumos.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record StartBatchRequest(@NotNull UUID orgId, boolean replace, @Size(max = 100) String triggerSource) {
}
