package com.realtyhub.backend.modules.listing.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.realtyhub.backend.global.jpa.AbstractTimestampedEntity;
import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

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
 * 매물. Approval status (review workflow) and market status are tracked separately.
 */
@Entity
@Table(name = "listing")
public class Listing extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", nullable = false, length = 2000)
    private String description;

    @Column(name = "price", nullable = false, precision = 15, scale = 2)
    private BigDecimal price;

    @Column(name = "location", nullable = false, length = 200)
    private String location;

    @Enumerated(EnumType.STRING)
    @Column(name = "property_type", nullable = false, length = 20)
    private PropertyType propertyType;

    @Enumerated(EnumType.STRING)
    @Column(name = "purpose", nullable = false, length = 10)
    private ListingPurpose purpose;

    @Column(name = "bedrooms", nullable = false)
    private int bedrooms;

    @Column(name = "bathrooms", nullable = false)
    private int bathrooms;

    @Column(name = "area_sq_ft", nullable = false, precision = 12, scale = 2)
    private BigDecimal area;

    @ElementCollection
    @CollectionTable(name = "listing_image", joinColumns = @JoinColumn(name = "listing_id"))
    @OrderColumn(name = "position")
    @Column(name = "url", nullable = false, length = 500)
    @BatchSize(size = 50)
    private List<String> images = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "listing_amenity", joinColumns = @JoinColumn(name = "listing_id"))
    @Column(name = "amenity", nullable = false, length = 100)
    @BatchSize(size = 50)
    private Set<String> amenities = new LinkedHashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "market_status", nullable = false, length = 20)
    private MarketStatus marketStatus = MarketStatus.AVAILABLE;

    @Embedded
    private OwnerContact ownerContact;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "agent_id", nullable = false)
    private AppUser agent;

    @Column(name = "agent_id", insertable = false, updatable = false)
    private UUID agentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", nullable = false, length = 20)
    private ReviewStatus approvalStatus = ReviewStatus.PENDING;

    @Column(name = "approved_by")
    private UUID approvedBy;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Column(name = "rejection_reason", length = 500)
    private String rejectionReason;

    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public PropertyType getPropertyType() {
        return propertyType;
    }

    public void setPropertyType(PropertyType propertyType) {
        this.propertyType = propertyType;
    }

    public ListingPurpose getPurpose() {
        return purpose;
    }

    public void setPurpose(ListingPurpose purpose) {
        this.purpose = purpose;
    }

    public int getBedrooms() {
        return bedrooms;
    }

    public void setBedrooms(int bedrooms) {
        this.bedrooms = bedrooms;
    }

    public int getBathrooms() {
        return bathrooms;
    }

    public void setBathrooms(int bathrooms) {
        this.bathrooms = bathrooms;
    }

    public BigDecimal getArea() {
        return area;
    }

    public void setArea(BigDecimal area) {
        this.area = area;
    }

    public List<String> getImages() {
        return images;
    }

    public void replaceImages(List<String> urls) {
        images.clear();
        images.addAll(urls);
    }

    public Set<String> getAmenities() {
        return amenities;
    }

    public void replaceAmenities(Iterable<String> values) {
        amenities.clear();
        values.forEach(amenities::add);
    }

    public MarketStatus getMarketStatus() {
        return marketStatus;
    }

    public void setMarketStatus(MarketStatus marketStatus) {
        this.marketStatus = marketStatus;
    }

    public OwnerContact getOwnerContact() {
        return ownerContact;
    }

    public void setOwnerContact(OwnerContact ownerContact) {
        this.ownerContact = ownerContact;
    }

    public AppUser getAgent() {
        return agent;
    }

    public void setAgent(AppUser agent) {
        this.agent = agent;
    }

    public UUID getAgentId() {
        if (agentId != null) {
            return agentId;
        }
        return agent != null ? agent.getId() : null;
    }

    public ReviewStatus getApprovalStatus() {
        return approvalStatus;
    }

    public void setApprovalStatus(ReviewStatus approvalStatus) {
        this.approvalStatus = approvalStatus;
    }

    public UUID getApprovedBy() {
        return approvedBy;
    }

    public void setApprovedBy(UUID approvedBy) {
        this.approvedBy = approvedBy;
    }

    public OffsetDateTime getApprovedAt() {
        return approvedAt;
    }

    public void setApprovedAt(OffsetDateTime approvedAt) {
        this.approvedAt = approvedAt;
    }

    public String getRejectionReason() {
        return rejectionReason;
    }

    public void setRejectionReason(String rejectionReason) {
        this.rejectionReason = rejectionReason;
    }

    /**
     * Price per square foot rounded to a whole number; 0 when the area is 0.
     */
    public long getPricePerSqFt() {
        if (area == null || price == null || area.signum() == 0) {
            return 0L;
        }
        return price.divide(area, 0, RoundingMode.HALF_UP).longValue();
    }
}
