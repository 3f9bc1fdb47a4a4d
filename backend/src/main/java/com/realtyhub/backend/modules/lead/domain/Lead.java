package com.realtyhub.backend.modules.lead.domain;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.realtyhub.backend.global.jpa.AbstractTimestampedEntity;
import com.realtyhub.backend.modules.auth.domain.AppUser;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.UuidGenerator;

/**
 * 문의 리드. Leads are never deleted; they end in CONVERTED or CLOSED.
 */
@Entity
@Table(name = "lead")
public class Lead extends AbstractTimestampedEntity {

    public static final int SCORE_MIN = 0;
    public static final int SCORE_MAX = 100;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", length = 100)
    private String name;

    @Column(name = "phone_number", nullable = false, length = 20)
    private String phoneNumber;

    @Column(name = "email", length = 255)
    private String email;

    @Column(name = "message", length = 1000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 20)
    private LeadSource source = LeadSource.LANDING_PAGE;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private LeadStatus status = LeadStatus.NEW;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private LeadPriority priority = LeadPriority.MEDIUM;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assignee_id")
    private AppUser assignee;

    @Column(name = "assignee_id", insertable = false, updatable = false)
    private UUID assigneeId;

    @Column(name = "assigned_by")
    private UUID assignedBy;

    @Column(name = "assigned_at")
    private OffsetDateTime assignedAt;

    @Column(name = "last_contacted_at")
    private OffsetDateTime lastContactedAt;

    @Column(name = "notes", length = 2000)
    private String notes;

    @ElementCollection
    @CollectionTable(name = "lead_tag", joinColumns = @JoinColumn(name = "lead_id"))
    @Column(name = "tag", nullable = false, length = 50)
    @OrderColumn(name = "position")
    @BatchSize(size = 50)
    private List<String> tags = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "lead_property_interest", joinColumns = @JoinColumn(name = "lead_id"))
    @Column(name = "listing_id", nullable = false)
    @OrderColumn(name = "position")
    @BatchSize(size = 50)
    private List<UUID> propertyInterests = new ArrayList<>();

    @Embedded
    private BudgetRange budget;

    @Embedded
    private PreferredLocation preferredLocation;

    @Column(name = "lead_score", nullable = false)
    private int leadScore;

    @Column(name = "conversion_probability", nullable = false)
    private int conversionProbability;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public void setPhoneNumber(String phoneNumber) {
        this.phoneNumber = phoneNumber;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email == null || email.isBlank() ? null : email.trim().toLowerCase();
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public LeadSource getSource() {
        return source;
    }

    public void setSource(LeadSource source) {
        this.source = source;
    }

    public LeadStatus getStatus() {
        return status;
    }

    /**
     * Moving to CONTACTED always refreshes {@code lastContactedAt}, even when the lead was already contacted.
     */
    public void changeStatus(LeadStatus status, OffsetDateTime now) {
        this.status = status;
        if (status == LeadStatus.CONTACTED) {
            this.lastContactedAt = now;
        }
    }

    public LeadPriority getPriority() {
        return priority;
    }

    public void setPriority(LeadPriority priority) {
        this.priority = priority;
    }

    public AppUser getAssignee() {
        return assignee;
    }

    public UUID getAssigneeId() {
        return assignee != null ? assignee.getId() : assigneeId;
    }

    public UUID getAssignedBy() {
        return assignedBy;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }

    public void assignTo(AppUser assignee, UUID assignedBy, OffsetDateTime now) {
        this.assignee = assignee;
        this.assigneeId = assignee.getId();
        this.assignedBy = assignedBy;
        this.assignedAt = now;
    }

    public void unassign() {
        this.assignee = null;
        this.assigneeId = null;
        this.assignedBy = null;
        this.assignedAt = null;
    }

    public OffsetDateTime getLastContactedAt() {
        return lastContactedAt;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public List<String> getTags() {
        return tags;
    }

    public void replaceTags(Collection<String> newTags) {
        tags.clear();
        for (String tag : newTags) {
            tags.add(tag.trim());
        }
    }

    public List<UUID> getPropertyInterests() {
        return propertyInterests;
    }

    public void replacePropertyInterests(Collection<UUID> listingIds) {
        propertyInterests.clear();
        propertyInterests.addAll(listingIds);
    }

    public BudgetRange getBudget() {
        return budget;
    }

    public void setBudget(BudgetRange budget) {
        this.budget = budget;
    }

    public PreferredLocation getPreferredLocation() {
        return preferredLocation;
    }

    public void setPreferredLocation(PreferredLocation preferredLocation) {
        this.preferredLocation = preferredLocation;
    }

    public int getLeadScore() {
        return leadScore;
    }

    public void setLeadScore(int leadScore) {
        this.leadScore = clamp(leadScore);
    }

    public int getConversionProbability() {
        return conversionProbability;
    }

    public void setConversionProbability(int conversionProbability) {
        this.conversionProbability = clamp(conversionProbability);
    }

    static int clamp(int value) {
        return Math.max(SCORE_MIN, Math.min(SCORE_MAX, value));
    }
}
