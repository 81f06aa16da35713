package com.dealflow.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One submitted deck analysis and everything known about its run.
 *
 * Progress and the final report are stored as JSON text; the service is the
 * only writer for a given job.
 *
 * DB table: analysis_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "analysis_jobs")
public class AnalysisJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AnalysisState state = AnalysisState.QUEUED;

    @Column(name = "company_name_hint")
    private String companyNameHint;

    @Column(name = "current_phase")
    private String currentPhase;

    @Column(name = "progress_percentage", nullable = false)
    private double progressPercentage = 0.0;

    // Latest ProgressSnapshot, JSON-encoded.
    @Column(name = "progress_json", columnDefinition = "TEXT")
    private String progressJson;

    // CompositeReport, JSON-encoded. Set only when state = COMPLETED.
    @Column(name = "report_json", columnDefinition = "TEXT")
    private String reportJson;

    // PIPELINE_TIMEOUT | PIPELINE_ABORTED | UNEXPECTED
    @Column(name = "error_code")
    private String errorCode;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected AnalysisJob() {}   // required by JPA

    public AnalysisJob(String companyNameHint) {
        this.companyNameHint = companyNameHint;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()                 { return id; }
    public AnalysisState getState()              { return state; }
    public String        getCompanyNameHint()    { return companyNameHint; }
    public String        getCurrentPhase()       { return currentPhase; }
    public double        getProgressPercentage() { return progressPercentage; }
    public String        getProgressJson()       { return progressJson; }
    public String        getReportJson()         { return reportJson; }
    public String        getErrorCode()          { return errorCode; }
    public String        getErrorMessage()       { return errorMessage; }
    public Instant       getCreatedAt()          { return createdAt; }
    public Instant       getUpdatedAt()          { return updatedAt; }

    public void setState(AnalysisState state)          { this.state = state; }
    public void setCurrentPhase(String v)              { this.currentPhase = v; }
    public void setProgressPercentage(double v)        { this.progressPercentage = v; }
    public void setProgressJson(String v)              { this.progressJson = v; }
    public void setReportJson(String v)                { this.reportJson = v; }
    public void setErrorCode(String v)                 { this.errorCode = v; }
    public void setErrorMessage(String v)              { this.errorMessage = v; }
}
