package com.realtyhub.backend.support;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.util.UUID;

import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.listing.domain.ListingPurpose;
import com.realtyhub.backend.modules.listing.domain.OwnerContact;
import com.realtyhub.backend.modules.listing.domain.PropertyType;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

/**
 * Builders for detached entities used by unit tests. Generated columns are set by reflection.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, UUID id) {
        setField(entity, "id", id);
        return entity;
    }

    public static void setField(Object target, String name, Object value) {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField(name);
                field.setAccessible(true);
                field.set(target, value);
                return;
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (IllegalAccessException ex) {
                throw new IllegalStateException(ex);
            }
        }
        throw new IllegalArgumentException("No field " + name + " on " + target.getClass());
    }

    public static AppUser user(UUID id, UserRole role) {
        AppUser user = new AppUser();
        user.setEmail("user-" + id.toString().substring(0, 8) + "@example.com");
        user.setPasswordHash("hash");
        user.setFirstName("Test");
        user.setLastName("User");
        user.setRole(role);
        user.setActive(true);
        user.setVerified(role != UserRole.SUPER_ADMIN);
        user.setVerificationStatus(ReviewStatus.APPROVED);
        return withId(user, id);
    }

    public static Listing listing(UUID id, AppUser agent, ReviewStatus approvalStatus) {
        Listing listing = new Listing();
        listing.setTitle("Sunny two-bedroom");
        listing.setDescription("Corner unit close to the park");
        listing.setPrice(new BigDecimal("250000"));
        listing.setLocation("Austin, TX");
        listing.setPropertyType(PropertyType.APARTMENT);
        listing.setPurpose(ListingPurpose.SALE);
        listing.setBedrooms(2);
        listing.setBathrooms(1);
        listing.setArea(new BigDecimal("1000"));
        listing.setOwnerContact(new OwnerContact("Owner", "owner@example.com", "5550000000", "1 Main St"));
        listing.setAgent(agent);
        listing.setApprovalStatus(approvalStatus);
        return withId(listing, id);
    }
}
