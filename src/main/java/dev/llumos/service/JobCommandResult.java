package dev.llumos.service;

import dev.llumos.batch.store.JobSnapshot;
import dev.llumos.domain.enums.JobAction;

/** What a start or cancel request did, and the job it applied to. */
public record JobCommandResult(JobAction action, JobSnapshot job, String message) {
}
