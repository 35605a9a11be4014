package dev.llumos.dto.request;

import jakarta.validation.constraints.Size;

public record DailyRunRequest(boolean force, @Size(max = 100) String triggerSource) {
}
