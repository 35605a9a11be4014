package dev.llumos.domain.entity;

import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.enums.ResponseStatus;
import dev.llumos.domain.valueobject.ProviderAnswer;
import dev.llumos.domain.valueobject.VisibilityAnalysis;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persisted outcome of one provider call for one prompt within one job.
 * Immutable after insert; the (job, prompt, provider) unique constraint keeps a resumed
 * run from writing a second record for the same combination.
 */
@Entity
@Table(name = "prompt_provider_responses",
        uniqueConstraints = @UniqueConstraint(name = "uq_ppr_job_prompt_provider",
                columnNames = {"batch_job_id", "prompt_id", "provider"}),
        indexes = {
                @Index(name = "idx_ppr_org_run_at", columnList = "org_id, run_at"),
                @Index(name = "idx_ppr_prompt_provider", columnList = "prompt_id, provider, run_at")
        })
public class ResponseRecord {

    private static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "org_id", nullable = false, columnDefinition = "uuid")
    private UUID orgId;

    @Column(name = "batch_job_id", nullable = false, columnDefinition = "uuid")
    private UUID batchJobId;

    @Column(name = "prompt_id", nullable = false, columnDefinition = "uuid")
    private UUID promptId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private LlmProvider provider;

    @Column(length = 100)
    private String model;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ResponseStatus status;

    @Column(nullable = false)
    private double score;

    @Column(name = "org_brand_present", nullable = false)
    private boolean orgBrandPresent;

    @Column(name = "org_brand_prominence")
    private Integer orgBrandProminence;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "brands_json", columnDefinition = "jsonb", nullable = false)
    private List<String> brands = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "competitors_json", columnDefinition = "jsonb", nullable = false)
    private List<String> competitors = new ArrayList<>();

    @Column(name = "competitors_count", nullable = false)
    private int competitorsCount;

    @Column(name = "raw_ai_response", columnDefinition = "text")
    private String rawResponse;

    @Column(name = "token_in", nullable = false)
    private int tokensIn;

    @Column(name = "token_out", nullable = false)
    private int tokensOut;

    @Column(name = "error", length = MAX_ERROR_LENGTH)
    private String error;

    @Column(name = "run_at", nullable = false, updatable = false)
    private Instant runAt;

    protected ResponseRecord() {
    }

    public static ResponseRecord success(UUID orgId, UUID jobId, UUID promptId, LlmProvider provider,
                                         ProviderAnswer answer, VisibilityAnalysis analysis, Instant runAt) {
        ResponseRecord r = base(orgId, jobId, promptId, provider, runAt);
        r.status = ResponseStatus.SUCCESS;
        r.model = answer.model();
        r.rawResponse = answer.text();
        r.tokensIn = answer.tokensIn();
        r.tokensOut = answer.tokensOut();
        r.score = analysis.score();
        r.orgBrandPresent = analysis.orgBrandPresent();
        r.orgBrandProminence = analysis.prominence();
        r.brands = new ArrayList<>(analysis.brands());
        r.competitors = new ArrayList<>(analysis.competitors());
        r.competitorsCount = analysis.competitors().size();
        return r;
    }

    public static ResponseRecord error(UUID orgId, UUID jobId, UUID promptId, LlmProvider provider,
                                       String error, Instant runAt) {
        ResponseRecord r = base(orgId, jobId, promptId, provider, runAt);
        r.status = ResponseStatus.ERROR;
        r.error = truncate(error);
        return r;
    }

    private static ResponseRecord base(UUID orgId, UUID jobId, UUID promptId, LlmProvider provider, Instant runAt) {
        ResponseRecord r = new ResponseRecord();
        r.id = UUID.randomUUID();
        r.orgId = orgId;
        r.batchJobId = jobId;
        r.promptId = promptId;
        r.provider = provider;
        r.runAt = runAt;
        return r;
    }

    private static String truncate(String error) {
        if (error == null) return "unknown error";
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }

    public UUID getId() {
        return id;
    }

    public UUID getOrgId() {
        return orgId;
    }

    public UUID getBatchJobId() {
        return batchJobId;
    }

    public UUID getPromptId() {
        return promptId;
    }

    public LlmProvider getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public ResponseStatus getStatus() {
        return status;
    }

    public double getScore() {
        return score;
    }

    public boolean isOrgBrandPresent() {
        return orgBrandPresent;
    }

    public Integer getOrgBrandProminence() {
        return orgBrandProminence;
    }

    public List<String> getBrands() {
        return List.copyOf(brands);
    }

    public List<String> getCompetitors() {
        return List.copyOf(competitors);
    }

    public int getCompetitorsCount() {
        return competitorsCount;
    }

    public String getRawResponse() {
        return rawResponse;
    }

    public int getTokensIn() {
        return tokensIn;
    }

    public int getTokensOut() {
        return tokensOut;
    }

    public String getError() {
        return error;
    }

    public Instant getRunAt() {
        return runAt;
    }
}
