package com.carelink.backend.modules.profile.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.carelink.backend.global.jpa.AbstractTimestampedEntity;
import com.carelink.backend.modules.user.domain.User;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Public facing profile of a support worker plus its compliance review state.
 * Compliance documents hang off this profile as {@code VerificationRequirement} rows.
 */
@Entity
@Table(name = "worker_profile")
public class WorkerProfile extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, unique = true)
    private User user;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(name = "mobile", length = 20)
    private String mobile;

    @Column(name = "location", length = 255)
    private String location;

    @Column(name = "city", length = 100)
    private String city;

    @Column(name = "state", length = 50)
    private String state;

    @Column(name = "postal_code", length = 10)
    private String postalCode;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "age")
    private Integer age;

    @Column(name = "gender", length = 32)
    private String gender;

    @Column(name = "gender_identity", length = 64)
    private String genderIdentity;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "languages", columnDefinition = "text[]")
    private List<String> languages = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "services", columnDefinition = "text[]")
    private List<String> services = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "support_worker_categories", columnDefinition = "text[]")
    private List<String> supportWorkerCategories = new ArrayList<>();

    @Column(name = "experience", columnDefinition = "text")
    private String experience;

    @Column(name = "introduction", columnDefinition = "text")
    private String introduction;

    @Column(name = "qualifications", columnDefinition = "text")
    private String qualifications;

    @Column(name = "has_vehicle")
    private Boolean hasVehicle;

    @Column(name = "fun_fact", columnDefinition = "text")
    private String funFact;

    @Column(name = "hobbies", columnDefinition = "text")
    private String hobbies;

    @Column(name = "unique_service", columnDefinition = "text")
    private String uniqueService;

    @Column(name = "why_enjoy_work", columnDefinition = "text")
    private String whyEnjoyWork;

    @Column(name = "additional_info", columnDefinition = "text")
    private String additionalInfo;

    @Column(name = "abn", length = 11)
    private String abn;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "photos", columnDefinition = "jsonb")
    private List<String> photos = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "verification_checklist", columnDefinition = "jsonb")
    private Map<String, Object> verificationChecklist;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "submitted_documents", columnDefinition = "jsonb")
    private Map<String, Object> submittedDocuments;

    @Column(name = "consent_profile_share", nullable = false)
    private boolean consentProfileShare;

    @Column(name = "consent_marketing", nullable = false)
    private boolean consentMarketing;

    @Column(name = "profile_completed", nullable = false)
    private boolean profileCompleted;

    @Column(name = "is_published", nullable = false)
    private boolean published;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false, length = 32)
    private VerificationStatus verificationStatus = VerificationStatus.NOT_STARTED;

    @Column(name = "verification_submitted_at")
    private OffsetDateTime verificationSubmittedAt;

    @Column(name = "verification_reviewed_at")
    private OffsetDateTime verificationReviewedAt;

    @Column(name = "verification_approved_at")
    private OffsetDateTime verificationApprovedAt;

    @Column(name = "verification_rejected_at")
    private OffsetDateTime verificationRejectedAt;

    @Column(name = "verification_notes", columnDefinition = "text")
    private String verificationNotes;

    public UUID getId() {
        return id;
    }

    public User getUser() {
        return user;
    }

    public void setUser(User user) {
        this.user = user;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getMobile() {
        return mobile;
    }

    public void setMobile(String mobile) {
        this.mobile = mobile;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getPostalCode() {
        return postalCode;
    }

    public void setPostalCode(String postalCode) {
        this.postalCode = postalCode;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public Integer getAge() {
        return age;
    }

    public void setAge(Integer age) {
        this.age = age;
    }

    public String getGender() {
        return gender;
    }

    public void setGender(String gender) {
        this.gender = gender;
    }

    public String getGenderIdentity() {
        return genderIdentity;
    }

    public void setGenderIdentity(String genderIdentity) {
        this.genderIdentity = genderIdentity;
    }

    public List<String> getLanguages() {
        return languages;
    }

    public void setLanguages(List<String> languages) {
        this.languages = languages;
    }

    public List<String> getServices() {
        return services;
    }

    public void setServices(List<String> services) {
        this.services = services;
    }

    public List<String> getSupportWorkerCategories() {
        return supportWorkerCategories;
    }

    public void setSupportWorkerCategories(List<String> supportWorkerCategories) {
        this.supportWorkerCategories = supportWorkerCategories;
    }

    public String getExperience() {
        return experience;
    }

    public void setExperience(String experience) {
        this.experience = experience;
    }

    public String getIntroduction() {
        return introduction;
    }

    public void setIntroduction(String introduction) {
        this.introduction = introduction;
    }

    public String getQualifications() {
        return qualifications;
    }

    public void setQualifications(String qualifications) {
        this.qualifications = qualifications;
    }

    public Boolean getHasVehicle() {
        return hasVehicle;
    }

    public void setHasVehicle(Boolean hasVehicle) {
        this.hasVehicle = hasVehicle;
    }

    public String getFunFact() {
        return funFact;
    }

    public void setFunFact(String funFact) {
        this.funFact = funFact;
    }

    public String getHobbies() {
        return hobbies;
    }

    public void setHobbies(String hobbies) {
        this.hobbies = hobbies;
    }

    public String getUniqueService() {
        return uniqueService;
    }

    public void setUniqueService(String uniqueService) {
        this.uniqueService = uniqueService;
    }

    public String getWhyEnjoyWork() {
        return whyEnjoyWork;
    }

    public void setWhyEnjoyWork(String whyEnjoyWork) {
        this.whyEnjoyWork = whyEnjoyWork;
    }

    public String getAdditionalInfo() {
        return additionalInfo;
    }

    public void setAdditionalInfo(String additionalInfo) {
        this.additionalInfo = additionalInfo;
    }

    public String getAbn() {
        return abn;
    }

    public void setAbn(String abn) {
        this.abn = abn;
    }

    public List<String> getPhotos() {
        return photos;
    }

    public void setPhotos(List<String> photos) {
        this.photos = photos;
    }

    public Map<String, Object> getVerificationChecklist() {
        return verificationChecklist;
    }

    public void setVerificationChecklist(Map<String, Object> verificationChecklist) {
        this.verificationChecklist = verificationChecklist;
    }

    public Map<String, Object> getSubmittedDocuments() {
        return submittedDocuments;
    }

    public void setSubmittedDocuments(Map<String, Object> submittedDocuments) {
        this.submittedDocuments = submittedDocuments;
    }

    public boolean isConsentProfileShare() {
        return consentProfileShare;
    }

    public void setConsentProfileShare(boolean consentProfileShare) {
        this.consentProfileShare = consentProfileShare;
    }

    public boolean isConsentMarketing() {
        return consentMarketing;
    }

    public void setConsentMarketing(boolean consentMarketing) {
        this.consentMarketing = consentMarketing;
    }

    public boolean isProfileCompleted() {
        return profileCompleted;
    }

    public void setProfileCompleted(boolean profileCompleted) {
        this.profileCompleted = profileCompleted;
    }

    public boolean isPublished() {
        return published;
    }

    public void setPublished(boolean published) {
        this.published = published;
    }

    public VerificationStatus getVerificationStatus() {
        return verificationStatus;
    }

    public void setVerificationStatus(VerificationStatus verificationStatus) {
        this.verificationStatus = verificationStatus;
    }

    public OffsetDateTime getVerificationSubmittedAt() {
        return verificationSubmittedAt;
    }

    public void setVerificationSubmittedAt(OffsetDateTime verificationSubmittedAt) {
        this.verificationSubmittedAt = verificationSubmittedAt;
    }

    public OffsetDateTime getVerificationReviewedAt() {
        return verificationReviewedAt;
    }

    public void setVerificationReviewedAt(OffsetDateTime verificationReviewedAt) {
        this.verificationReviewedAt = verificationReviewedAt;
    }

    public OffsetDateTime getVerificationApprovedAt() {
        return verificationApprovedAt;
    }

    public void setVerificationApprovedAt(OffsetDateTime verificationApprovedAt) {
        this.verificationApprovedAt = verificationApprovedAt;
    }

    public OffsetDateTime getVerificationRejectedAt() {
        return verificationRejectedAt;
    }

    public void setVerificationRejectedAt(OffsetDateTime verificationRejectedAt) {
        this.verificationRejectedAt = verificationRejectedAt;
    }

    public String getVerificationNotes() {
        return verificationNotes;
    }

    public void setVerificationNotes(String verificationNotes) {
        this.verificationNotes = verificationNotes;
    }

    public String getDisplayName() {
        return (firstName + " " + lastName).trim();
    }
}
