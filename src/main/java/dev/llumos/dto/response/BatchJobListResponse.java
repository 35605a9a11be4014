package dev.llumos.dto.response;

import java.util.List;
import java.util.UUID;

public record BatchJobListResponse(boolean success, UUID orgId, int count, List<BatchRunResponse> jobs) {
}
