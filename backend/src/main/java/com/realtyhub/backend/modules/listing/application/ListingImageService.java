package com.realtyhub.backend.modules.listing.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.listing.infrastructure.persistence.ListingRepository;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingResponse;
import com.realtyhub.backend.modules.storage.application.BlobStorage;
import com.realtyhub.backend.modules.storage.application.UploadPolicy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Listing image management. Upload and removal go through the blob store; the listing keeps the URLs in order.
 */
@Service
@Transactional
public class ListingImageService {

    private static final Logger log = LoggerFactory.getLogger(ListingImageService.class);

    private final ListingRepository listingRepository;
    private final BlobStorage blobStorage;
    private final UploadPolicy uploadPolicy;
    private final AuditLogService auditLogService;
    private final RealtyhubProperties properties;

    public ListingImageService(
            ListingRepository listingRepository,
            BlobStorage blobStorage,
            UploadPolicy uploadPolicy,
            AuditLogService auditLogService,
            RealtyhubProperties properties
    ) {
        this.listingRepository = listingRepository;
        this.blobStorage = blobStorage;
        this.uploadPolicy = uploadPolicy;
        this.auditLogService = auditLogService;
        this.properties = properties;
    }

    /**
     * Every file is checked before the first upload, so a rejected batch stores nothing.
     */
    public ListingResponse attachImages(UUID listingId, List<ImageUpload> files, Actor actor) {
        Listing listing = findListing(listingId);
        if (!ListingAccessPolicy.canManageImages(listing, actor)) {
            log.warn("Image upload denied: listingId={}, actor={}", listingId, actor.userId());
            throw ListingAccessPolicy.forbidden();
        }
        if (files == null || files.isEmpty()) {
            throw ProblemException.badRequest("listing.no_images", "업로드할 이미지가 없습니다.");
        }
        int max = properties.listing().maxImages();
        if (listing.getImages().size() + files.size() > max) {
            throw ProblemException.badRequest("listing.too_many_images", "이미지는 최대 " + max + "장까지 등록할 수 있습니다.");
        }
        for (ImageUpload file : files) {
            uploadPolicy.check(file.fileName(), file.contentType(), file.content() == null ? 0 : file.content().length);
        }

        List<String> uploaded = new ArrayList<>();
        deleteOnRollback(listingId, uploaded);
        for (ImageUpload file : files) {
            uploaded.add(blobStorage.upload(file.content(), file.fileName(), properties.listing().imageFolder(), file.contentType()));
        }
        List<String> images = new ArrayList<>(listing.getImages());
        images.addAll(uploaded);
        listing.replaceImages(images);
        Listing saved = listingRepository.save(listing);

        auditLogService.record(AuditLogCommand.of("LISTING_IMAGES_ADD", "LISTING", listingId, actor.userId(),
                Map.of("urls", uploaded)));
        log.info("Images attached: listingId={}, actor={}, count={}", listingId, actor.userId(), uploaded.size());
        return ListingResponse.from(saved, ListingAccessPolicy.canSeeOwnerContact(saved, actor));
    }

    public ListingResponse removeImage(UUID listingId, String imageUrl, Actor actor) {
        Listing listing = findListing(listingId);
        if (!ListingAccessPolicy.canManageImages(listing, actor)) {
            log.warn("Image removal denied: listingId={}, actor={}", listingId, actor.userId());
            throw ListingAccessPolicy.forbidden();
        }
        if (imageUrl == null || !listing.getImages().contains(imageUrl)) {
            throw ProblemException.notFound("listing.image_not_found", "매물에 해당 이미지가 없습니다.");
        }

        blobStorage.delete(imageUrl);
        List<String> images = new ArrayList<>(listing.getImages());
        images.remove(imageUrl);
        listing.replaceImages(images);
        Listing saved = listingRepository.save(listing);

        auditLogService.record(AuditLogCommand.of("LISTING_IMAGE_REMOVE", "LISTING", listingId, actor.userId(),
                Map.of("url", imageUrl)));
        log.info("Image removed: listingId={}, actor={}", listingId, actor.userId());
        return ListingResponse.from(saved, ListingAccessPolicy.canSeeOwnerContact(saved, actor));
    }

    /**
     * Objects already written to the blob store are not covered by the database transaction; when it
     * rolls back, every URL collected so far is deleted again.
     */
    private void deleteOnRollback(UUID listingId, List<String> uploaded) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_ROLLED_BACK || uploaded.isEmpty()) {
                    return;
                }
                log.warn("Image upload rolled back, deleting blobs: listingId={}, count={}", listingId, uploaded.size());
                for (String url : uploaded) {
                    try {
                        blobStorage.delete(url);
                    } catch (ProblemException ex) {
                        log.error("Orphaned image blob left in storage: listingId={}, url={}, code={}",
                                listingId, url, ex.getCode(), ex);
                    }
                }
            }
        });
    }

    private Listing findListing(UUID listingId) {
        return listingRepository.findById(listingId).orElseThrow(ListingAccessPolicy::notFound);
    }
}
