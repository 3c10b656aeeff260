package com.carelink.backend.modules.verification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.carelink.backend.global.jpa.AbstractTimestampedEntity;
import com.carelink.backend.modules.profile.domain.WorkerProfile;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * A single compliance document supplied by a worker, for example a police check.
 */
@Entity
@Table(
        name = "verification_requirement",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_verification_requirement_type",
                columnNames = {"worker_profile_id", "requirement_type"}
        )
)
public class VerificationRequirement extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "worker_profile_id", nullable = false)
    private WorkerProfile workerProfile;

    @Column(name = "requirement_type", nullable = false, length = 64)
    private String requirementType;

    @Column(name = "requirement_name", nullable = false, length = 255)
    private String requirementName;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_category", length = 32)
    private DocumentCategory documentCategory;

    @Column(name = "is_required", nullable = false)
    private boolean required;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private RequirementStatus status = RequirementStatus.PENDING;

    @Column(name = "document_url", length = 2048)
    private String documentUrl;

    @Column(name = "document_uploaded_at")
    private OffsetDateTime documentUploadedAt;

    @Column(name = "submitted_at")
    private OffsetDateTime submittedAt;

    @Column(name = "reviewed_at")
    private OffsetDateTime reviewedAt;

    @Column(name = "reviewed_by", length = 64)
    private String reviewedBy;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Column(name = "rejected_at")
    private OffsetDateTime rejectedAt;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Column(name = "rejection_reason", columnDefinition = "text")
    private String rejectionReason;

    public UUID getId() {
        return id;
    }

    public WorkerProfile getWorkerProfile() {
        return workerProfile;
    }

    public void setWorkerProfile(WorkerProfile workerProfile) {
        this.workerProfile = workerProfile;
    }

    public String getRequirementType() {
        return requirementType;
    }

    public void setRequirementType(String requirementType) {
        this.requirementType = requirementType;
    }

    public String getRequirementName() {
        return requirementName;
    }

    public void setRequirementName(String requirementName) {
        this.requirementName = requirementName;
    }

    public DocumentCategory getDocumentCategory() {
        return documentCategory;
    }

    public void setDocumentCategory(DocumentCategory documentCategory) {
        this.documentCategory = documentCategory;
    }

    public boolean isRequired() {
        return required;
    }

    public void setRequired(boolean required) {
        this.required = required;
    }

    public RequirementStatus getStatus() {
        return status;
    }

    public String getDocumentUrl() {
        return documentUrl;
    }

    public OffsetDateTime getDocumentUploadedAt() {
        return documentUploadedAt;
    }

    public OffsetDateTime getSubmittedAt() {
        return submittedAt;
    }

    public OffsetDateTime getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewedBy() {
        return reviewedBy;
    }

    public OffsetDateTime getApprovedAt() {
        return approvedAt;
    }

    public OffsetDateTime getRejectedAt() {
        return rejectedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public String getNotes() {
        return notes;
    }

    public String getRejectionReason() {
        return rejectionReason;
    }

    /**
     * Replaces the document and sends it back to the review queue, dropping any earlier decision.
     */
    public void submitDocument(String documentUrl, OffsetDateTime now, OffsetDateTime expiresAt) {
        this.documentUrl = documentUrl;
        this.documentUploadedAt = now;
        this.submittedAt = now;
        this.expiresAt = expiresAt;
        this.status = RequirementStatus.SUBMITTED;
        this.reviewedAt = null;
        this.reviewedBy = null;
        this.approvedAt = null;
        this.rejectedAt = null;
        this.rejectionReason = null;
    }

    public void approve(String reviewer, OffsetDateTime now) {
        this.status = RequirementStatus.APPROVED;
        this.approvedAt = now;
        this.reviewedAt = now;
        this.reviewedBy = reviewer;
        this.rejectedAt = null;
        this.rejectionReason = null;
    }

    public void reject(String reviewer, String reason, OffsetDateTime now) {
        this.status = RequirementStatus.REJECTED;
        this.rejectedAt = now;
        this.reviewedAt = now;
        this.reviewedBy = reviewer;
        this.rejectionReason = reason;
        this.approvedAt = null;
    }

    public void resetToReview(String note) {
        this.status = RequirementStatus.SUBMITTED;
        this.approvedAt = null;
        this.rejectedAt = null;
        this.reviewedAt = null;
        this.reviewedBy = null;
        this.rejectionReason = null;
        appendNote(note);
    }

    public void appendNote(String note) {
        if (note == null || note.isBlank()) {
            return;
        }
        this.notes = (notes == null || notes.isBlank()) ? note : notes + "\n" + note;
    }
}
