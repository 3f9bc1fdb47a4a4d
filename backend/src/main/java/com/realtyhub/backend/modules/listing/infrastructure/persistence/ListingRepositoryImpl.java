package com.realtyhub.backend.modules.listing.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.realtyhub.backend.modules.listing.domain.Listing;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class ListingRepositoryImpl implements ListingRepositoryCustom {

    private static final Set<String> SORTABLE = Set.of("createdAt", "price", "title");

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<Listing> search(ListingSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        ListingVisibility.Predicate visibility =
                ListingVisibility.predicateFor(condition.viewer(), condition.approvalStatus(), "l");
        whereClauses.add(visibility.jpql());
        params.putAll(visibility.params());

        if (condition.agentId() != null) {
            whereClauses.add("l.agentId = :agentId");
            params.put("agentId", condition.agentId());
        }
        if (StringUtils.hasText(condition.keyword())) {
            whereClauses.add("(lower(l.title) like :keyword or lower(l.description) like :keyword "
                    + "or lower(l.location) like :keyword)");
            params.put("keyword", likePattern(condition.keyword()));
        }
        if (condition.propertyType() != null) {
            whereClauses.add("l.propertyType = :propertyType");
            params.put("propertyType", condition.propertyType());
        }
        if (condition.purpose() != null) {
            whereClauses.add("l.purpose = :purpose");
            params.put("purpose", condition.purpose());
        }
        if (condition.marketStatus() != null) {
            whereClauses.add("l.marketStatus = :marketStatus");
            params.put("marketStatus", condition.marketStatus());
        }
        if (condition.minPrice() != null) {
            whereClauses.add("l.price >= :minPrice");
            params.put("minPrice", condition.minPrice());
        }
        if (condition.maxPrice() != null) {
            whereClauses.add("l.price <= :maxPrice");
            params.put("maxPrice", condition.maxPrice());
        }
        if (condition.minBedrooms() != null) {
            whereClauses.add("l.bedrooms >= :minBedrooms");
            params.put("minBedrooms", condition.minBedrooms());
        }
        if (condition.minBathrooms() != null) {
            whereClauses.add("l.bathrooms >= :minBathrooms");
            params.put("minBathrooms", condition.minBathrooms());
        }
        if (StringUtils.hasText(condition.city())) {
            whereClauses.add("lower(l.location) like :city");
            params.put("city", likePattern(condition.city()));
        }
        if (StringUtils.hasText(condition.state())) {
            whereClauses.add("lower(l.location) like :state");
            params.put("state", likePattern(condition.state()));
        }

        String whereJpql = " where " + String.join(" and ", whereClauses);

        TypedQuery<Long> countQuery = entityManager.createQuery(
                "select count(l) from Listing l" + whereJpql, Long.class);
        params.forEach(countQuery::setParameter);
        long total = countQuery.getSingleResult();
        if (total == 0) {
            return new PageImpl<>(List.of(), pageable, 0);
        }

        TypedQuery<UUID> idQuery = entityManager.createQuery(
                "select l.id from Listing l" + whereJpql + orderBy(pageable.getSort()), UUID.class);
        params.forEach(idQuery::setParameter);
        idQuery.setFirstResult((int) pageable.getOffset());
        idQuery.setMaxResults(pageable.getPageSize());
        List<UUID> ids = idQuery.getResultList();
        if (ids.isEmpty()) {
            return new PageImpl<>(List.of(), pageable, total);
        }

        Map<UUID, Listing> byId = entityManager.createQuery("""
                        select l
                          from Listing l
                          join fetch l.agent
                         where l.id in :ids
                        """, Listing.class)
                .setParameter("ids", ids)
                .getResultList()
                .stream()
                .collect(Collectors.toMap(Listing::getId, Function.identity()));

        List<Listing> ordered = ids.stream().map(byId::get).filter(Objects::nonNull).toList();
        return new PageImpl<>(ordered, pageable, total);
    }

    static String orderBy(Sort sort) {
        List<String> parts = new ArrayList<>();
        for (Sort.Order order : sort) {
            if (!SORTABLE.contains(order.getProperty())) {
                throw new IllegalArgumentException("Unsupported listing sort property: " + order.getProperty());
            }
            parts.add("l." + order.getProperty() + (order.isAscending() ? " asc" : " desc"));
        }
        if (parts.isEmpty()) {
            parts.add("l.createdAt desc");
        }
        parts.add("l.id");
        return " order by " + String.join(", ", parts);
    }

    private static String likePattern(String value) {
        return "%" + value.trim().toLowerCase(Locale.ROOT) + "%";
    }
}
