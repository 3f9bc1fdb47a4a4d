package com.realtyhub.backend.modules.listing.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.listing.domain.MarketStatus;
import com.realtyhub.backend.modules.listing.infrastructure.persistence.ListingRepository;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingCreateRequest;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingResponse;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingUpdateRequest;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ListingService {

    private static final Logger log = LoggerFactory.getLogger(ListingService.class);

    private final ListingRepository listingRepository;
    private final AppUserRepository appUserRepository;
    private final AuditLogService auditLogService;
    private final RealtyhubProperties properties;
    private final Clock clock;

    public ListingService(
            ListingRepository listingRepository,
            AppUserRepository appUserRepository,
            AuditLogService auditLogService,
            RealtyhubProperties properties,
            Clock clock
    ) {
        this.listingRepository = listingRepository;
        this.appUserRepository = appUserRepository;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * The caller becomes the agent. Listings created by a super admin skip the approval queue.
     */
    public ListingResponse create(ListingCreateRequest request, Actor actor) {
        AppUser agent = appUserRepository.findById(actor.userId())
                .orElseThrow(() -> ProblemException.notFound("listing.agent_not_found", "등록 담당자를 찾을 수 없습니다."));
        List<String> images = request.images() == null ? List.of() : request.images();
        checkImageCount(images.size());

        Listing listing = new Listing();
        listing.setTitle(request.title().trim());
        listing.setDescription(request.description());
        listing.setPrice(request.price());
        listing.setLocation(request.location().trim());
        listing.setPropertyType(request.propertyType());
        listing.setPurpose(request.purpose());
        listing.setBedrooms(request.bedrooms());
        listing.setBathrooms(request.bathrooms());
        listing.setArea(request.area());
        listing.replaceImages(images);
        if (request.amenities() != null) {
            listing.replaceAmenities(request.amenities());
        }
        listing.setMarketStatus(request.status() != null ? request.status() : MarketStatus.AVAILABLE);
        if (request.ownerContact() != null) {
            listing.setOwnerContact(request.ownerContact().toOwnerContact());
        }
        listing.setAgent(agent);

        if (agent.getRole() == UserRole.SUPER_ADMIN) {
            listing.setApprovalStatus(ReviewStatus.APPROVED);
            listing.setApprovedBy(agent.getId());
            listing.setApprovedAt(OffsetDateTime.now(clock));
        } else {
            listing.setApprovalStatus(ReviewStatus.PENDING);
        }

        Listing saved = listingRepository.save(listing);
        auditLogService.record(AuditLogCommand.of("LISTING_CREATE", "LISTING", saved.getId(), actor.userId(),
                Map.of("approvalStatus", saved.getApprovalStatus().name())));
        log.info("Listing created: listingId={}, agent={}, approvalStatus={}",
                saved.getId(), agent.getId(), saved.getApprovalStatus());
        return ListingResponse.from(saved, true);
    }

    public ListingResponse update(UUID listingId, ListingUpdateRequest request, Actor actor) {
        Listing listing = findListing(listingId);
        if (!ListingAccessPolicy.canEdit(listing, actor)) {
            log.warn("Listing update denied: listingId={}, actor={}", listingId, actor.userId());
            throw ListingAccessPolicy.forbidden();
        }

        Map<String, Object> changed = new LinkedHashMap<>();
        if (request.title() != null) {
            listing.setTitle(request.title().trim());
            changed.put("title", listing.getTitle());
        }
        if (request.description() != null) {
            listing.setDescription(request.description());
            changed.put("description", true);
        }
        if (request.price() != null) {
            listing.setPrice(request.price());
            changed.put("price", request.price());
        }
        if (request.location() != null) {
            listing.setLocation(request.location().trim());
            changed.put("location", listing.getLocation());
        }
        if (request.propertyType() != null) {
            listing.setPropertyType(request.propertyType());
            changed.put("propertyType", request.propertyType().name());
        }
        if (request.purpose() != null) {
            listing.setPurpose(request.purpose());
            changed.put("purpose", request.purpose().name());
        }
        if (request.bedrooms() != null) {
            listing.setBedrooms(request.bedrooms());
            changed.put("bedrooms", request.bedrooms());
        }
        if (request.bathrooms() != null) {
            listing.setBathrooms(request.bathrooms());
            changed.put("bathrooms", request.bathrooms());
        }
        if (request.area() != null) {
            listing.setArea(request.area());
            changed.put("area", request.area());
        }
        if (request.amenities() != null) {
            listing.replaceAmenities(request.amenities());
            changed.put("amenities", request.amenities().size());
        }
        if (request.status() != null) {
            listing.setMarketStatus(request.status());
            changed.put("status", request.status().name());
        }
        if (request.ownerContact() != null) {
            listing.setOwnerContact(request.ownerContact().toOwnerContact());
            changed.put("ownerContact", true);
        }

        Listing saved = listingRepository.save(listing);
        auditLogService.record(AuditLogCommand.of("LISTING_UPDATE", "LISTING", listingId, actor.userId(), changed));
        log.info("Listing updated: listingId={}, actor={}, fields={}", listingId, actor.userId(), changed.keySet());
        return ListingResponse.from(saved, ListingAccessPolicy.canSeeOwnerContact(saved, actor));
    }

    /**
     * Removes the record only; stored images stay in the object store.
     */
    public void delete(UUID listingId, Actor actor) {
        Listing listing = findListing(listingId);
        if (!ListingAccessPolicy.canDelete(listing, actor)) {
            log.warn("Listing delete denied: listingId={}, actor={}", listingId, actor.userId());
            throw ListingAccessPolicy.forbidden();
        }
        int imageCount = listing.getImages().size();
        listingRepository.delete(listing);
        auditLogService.record(AuditLogCommand.of("LISTING_DELETE", "LISTING", listingId, actor.userId(),
                Map.of("title", listing.getTitle(), "imageCount", imageCount)));
        log.info("Listing deleted: listingId={}, actor={}, images left in storage={}", listingId, actor.userId(), imageCount);
    }

    private void checkImageCount(int count) {
        int max = properties.listing().maxImages();
        if (count > max) {
            throw ProblemException.badRequest("listing.too_many_images", "이미지는 최대 " + max + "장까지 등록할 수 있습니다.");
        }
    }

    private Listing findListing(UUID listingId) {
        return listingRepository.findById(listingId).orElseThrow(ListingAccessPolicy::notFound);
    }
}
