package com.realtyhub.backend.modules.listing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.listing.application.ImageUpload;
import com.realtyhub.backend.modules.listing.application.ListingImageService;
import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.listing.infrastructure.persistence.ListingRepository;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingResponse;
import com.realtyhub.backend.modules.storage.application.BlobStorage;
import com.realtyhub.backend.modules.storage.application.UploadPolicy;
import com.realtyhub.backend.modules.workflow.ReviewStatus;
import com.realtyhub.backend.support.TestEntities;
import com.realtyhub.backend.support.TestProperties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@ExtendWith(MockitoExtension.class)
class ListingImageServiceTest {

    private static final UUID AGENT_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");

    @Mock
    private ListingRepository listingRepository;

    @Mock
    private BlobStorage blobStorage;

    @Mock
    private AuditLogService auditLogService;

    private ListingImageService listingImageService;
    private Listing listing;
    private final Actor agent = Actor.of(AGENT_ID, UserRole.USER);

    @BeforeEach
    void setUp() {
        RealtyhubProperties properties = TestProperties.defaults();
        listingImageService = new ListingImageService(listingRepository, blobStorage, new UploadPolicy(properties),
                auditLogService, properties);
        listing = TestEntities.listing(UUID.randomUUID(), TestEntities.user(AGENT_ID, UserRole.USER), ReviewStatus.APPROVED);
        when(listingRepository.findById(listing.getId())).thenReturn(Optional.of(listing));
        lenient().when(listingRepository.save(any(Listing.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("업로드한 이미지 URL이 기존 이미지 뒤에 순서대로 추가된다")
    void attachAppendsUploadedUrls() {
        listing.replaceImages(List.of("https://cdn.example.com/properties/existing.jpg"));
        when(blobStorage.upload(any(), eq("a.jpg"), eq("properties"), eq("image/jpeg")))
                .thenReturn("https://cdn.example.com/properties/1-a.jpg");
        when(blobStorage.upload(any(), eq("b.png"), eq("properties"), eq("image/png")))
                .thenReturn("https://cdn.example.com/properties/2-b.png");

        ListingResponse response = listingImageService.attachImages(listing.getId(), List.of(
                new ImageUpload("a.jpg", "image/jpeg", new byte[]{1, 2}),
                new ImageUpload("b.png", "image/png", new byte[]{3})
        ), agent);

        assertThat(response.images()).containsExactly(
                "https://cdn.example.com/properties/existing.jpg",
                "https://cdn.example.com/properties/1-a.jpg",
                "https://cdn.example.com/properties/2-b.png"
        );
    }

    @AfterEach
    void clearTransactionSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("저장이 실패해 트랜잭션이 롤백되면 이미 올린 이미지를 삭제한다")
    void rollbackDeletesUploadedBlobs() {
        TransactionSynchronizationManager.initSynchronization();
        when(blobStorage.upload(any(), eq("a.jpg"), eq("properties"), eq("image/jpeg")))
                .thenReturn("https://cdn.example.com/properties/1-a.jpg");
        when(blobStorage.upload(any(), eq("b.png"), eq("properties"), eq("image/png")))
                .thenReturn("https://cdn.example.com/properties/2-b.png");
        when(listingRepository.save(any(Listing.class))).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> listingImageService.attachImages(listing.getId(), List.of(
                new ImageUpload("a.jpg", "image/jpeg", new byte[]{1}),
                new ImageUpload("b.png", "image/png", new byte[]{2})
        ), agent)).isInstanceOf(IllegalStateException.class);
        verify(blobStorage, never()).delete(anyString());

        completeTransaction(TransactionSynchronization.STATUS_ROLLED_BACK);

        verify(blobStorage).delete("https://cdn.example.com/properties/1-a.jpg");
        verify(blobStorage).delete("https://cdn.example.com/properties/2-b.png");
    }

    @Test
    @DisplayName("중간 업로드가 실패해도 앞서 올린 이미지는 롤백 시 삭제된다")
    void failedUploadCleansEarlierBlobs() {
        TransactionSynchronizationManager.initSynchronization();
        when(blobStorage.upload(any(), eq("a.jpg"), eq("properties"), eq("image/jpeg")))
                .thenReturn("https://cdn.example.com/properties/1-a.jpg");
        when(blobStorage.upload(any(), eq("b.png"), eq("properties"), eq("image/png")))
                .thenThrow(new ProblemException(HttpStatus.BAD_GATEWAY, "storage.unavailable", "S3 down"));

        assertThatThrownBy(() -> listingImageService.attachImages(listing.getId(), List.of(
                new ImageUpload("a.jpg", "image/jpeg", new byte[]{1}),
                new ImageUpload("b.png", "image/png", new byte[]{2})
        ), agent)).isInstanceOfSatisfying(ProblemException.class,
                ex -> assertThat(ex.getCode()).isEqualTo("storage.unavailable"));

        completeTransaction(TransactionSynchronization.STATUS_ROLLED_BACK);

        verify(blobStorage).delete("https://cdn.example.com/properties/1-a.jpg");
    }

    @Test
    @DisplayName("커밋되면 업로드한 이미지를 그대로 둔다")
    void commitKeepsUploadedBlobs() {
        TransactionSynchronizationManager.initSynchronization();
        when(blobStorage.upload(any(), eq("a.jpg"), eq("properties"), eq("image/jpeg")))
                .thenReturn("https://cdn.example.com/properties/1-a.jpg");

        listingImageService.attachImages(listing.getId(),
                List.of(new ImageUpload("a.jpg", "image/jpeg", new byte[]{1})), agent);
        completeTransaction(TransactionSynchronization.STATUS_COMMITTED);

        verify(blobStorage, never()).delete(anyString());
    }

    private static void completeTransaction(int status) {
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCompletion(status);
        }
    }

    @Test
    @DisplayName("허용되지 않은 형식이 하나라도 있으면 아무것도 업로드하지 않는다")
    void unsupportedTypeUploadsNothing() {
        List<ImageUpload> files = List.of(
                new ImageUpload("a.jpg", "image/jpeg", new byte[]{1}),
                new ImageUpload("doc.pdf", "application/pdf", new byte[]{1})
        );

        assertThatThrownBy(() -> listingImageService.attachImages(listing.getId(), files, agent))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("storage.unsupported_type"));
        verify(blobStorage, never()).upload(any(), anyString(), anyString(), anyString());
        assertThat(listing.getImages()).isEmpty();
    }

    @Test
    @DisplayName("기존 이미지와 합쳐 최대 개수를 넘으면 거절한다")
    void rejectsWhenTotalExceedsLimit() {
        listing.replaceImages(new ArrayList<>(Collections.nCopies(9, "https://cdn.example.com/properties/x.jpg")));
        List<ImageUpload> files = List.of(
                new ImageUpload("a.jpg", "image/jpeg", new byte[]{1}),
                new ImageUpload("b.jpg", "image/jpeg", new byte[]{1})
        );

        assertThatThrownBy(() -> listingImageService.attachImages(listing.getId(), files, agent))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("listing.too_many_images"));
        verify(blobStorage, never()).upload(any(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("이미지를 제거하면 저장소에서도 삭제한다")
    void removeDeletesFromStorage() {
        String url = "https://cdn.example.com/properties/1-a.jpg";
        listing.replaceImages(List.of(url, "https://cdn.example.com/properties/2-b.jpg"));

        ListingResponse response = listingImageService.removeImage(listing.getId(), url, agent);

        verify(blobStorage).delete(url);
        assertThat(response.images()).containsExactly("https://cdn.example.com/properties/2-b.jpg");
    }

    @Test
    @DisplayName("매물에 없는 이미지는 제거할 수 없다")
    void removeUnknownImage() {
        assertThatThrownBy(() -> listingImageService.removeImage(listing.getId(), "https://cdn.example.com/other.jpg", agent))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("listing.image_not_found");
                });
        verify(blobStorage, never()).delete(anyString());
    }

    @Test
    @DisplayName("다른 사용자는 이미지를 관리할 수 없다")
    void strangerCannotManageImages() {
        Actor stranger = Actor.of(UUID.randomUUID(), UserRole.USER);

        assertThatThrownBy(() -> listingImageService.attachImages(listing.getId(),
                List.of(new ImageUpload("a.jpg", "image/jpeg", new byte[]{1})), stranger))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("listing.forbidden"));
    }
}
