package com.realtyhub.backend.modules.lead;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.realtyhub.backend.modules.lead.application.LeadScoringPolicy;
import com.realtyhub.backend.modules.lead.domain.BudgetRange;
import com.realtyhub.backend.modules.lead.domain.Lead;
import com.realtyhub.backend.modules.lead.domain.PreferredLocation;
import com.realtyhub.backend.support.TestProperties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LeadScoringPolicyTest {

    private final LeadScoringPolicy policy = new LeadScoringPolicy(TestProperties.defaults());

    @Test
    @DisplayName("이름과 전화번호만 있으면 25점, 이메일 추가 시 35점, 120자 메시지 추가 시 50점")
    void scoreGrowsWithContactDetails() {
        Lead lead = new Lead();
        lead.setName("Jane");
        lead.setPhoneNumber("5551234567");
        assertThat(policy.score(lead)).isEqualTo(25);

        lead.setEmail("jane@example.com");
        assertThat(policy.score(lead)).isEqualTo(35);

        lead.setMessage("m".repeat(120));
        assertThat(policy.score(lead)).isEqualTo(50);
    }

    @Test
    @DisplayName("메시지는 50자를 넘어야 가산된다")
    void messageThresholdIsExclusive() {
        Lead lead = new Lead();
        lead.setPhoneNumber("5551234567");
        lead.setMessage("m".repeat(50));
        assertThat(policy.score(lead)).isEqualTo(15);

        lead.setMessage("m".repeat(51));
        assertThat(policy.score(lead)).isEqualTo(25);

        lead.setMessage("m".repeat(101));
        assertThat(policy.score(lead)).isEqualTo(30);
    }

    @Test
    @DisplayName("예산과 선호 지역은 존재 여부와 세부 항목별로 가산된다")
    void budgetAndLocationSignals() {
        Lead lead = new Lead();
        lead.setBudget(new BudgetRange(BigDecimal.ZERO, null));
        assertThat(policy.score(lead)).isEqualTo(15);

        lead.setBudget(new BudgetRange(new BigDecimal("100000"), new BigDecimal("250000")));
        assertThat(policy.score(lead)).isEqualTo(25);

        lead.setPreferredLocation(new PreferredLocation("Austin", "TX", null));
        assertThat(policy.score(lead)).isEqualTo(45);
    }

    @Test
    @DisplayName("모든 신호가 있어도 점수는 100을 넘지 않는다")
    void scoreIsCappedAtHundred() {
        Lead lead = fullyQualifiedLead();
        List<String> tags = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            tags.add("tag-" + i);
        }
        lead.replaceTags(tags);

        assertThat(policy.score(lead)).isEqualTo(100);
    }

    @Test
    @DisplayName("중복된 태그와 관심 매물도 항목마다 가산된다")
    void repeatedEntriesCountEachTime() {
        Lead lead = new Lead();
        lead.setName("Jane");
        lead.setPhoneNumber("5551234567");
        lead.replaceTags(List.of("vip", "vip"));
        assertThat(policy.score(lead)).isEqualTo(29);

        UUID listingId = UUID.randomUUID();
        lead.replacePropertyInterests(List.of(listingId, listingId));
        assertThat(policy.score(lead)).isEqualTo(39);
        assertThat(lead.getTags()).containsExactly("vip", "vip");
    }

    @Test
    @DisplayName("빈 리드는 0점이다")
    void emptyLeadScoresZero() {
        assertThat(policy.score(new Lead())).isZero();
    }

    @Test
    @DisplayName("신호를 하나씩 추가해도 점수는 줄어들지 않고 항상 0~100 사이다")
    void scoreIsMonotonicAndBounded() {
        Lead lead = new Lead();
        List<Runnable> signals = List.of(
                () -> lead.setName("Jane"),
                () -> lead.setPhoneNumber("5551234567"),
                () -> lead.setEmail("jane@example.com"),
                () -> lead.setMessage("m".repeat(60)),
                () -> lead.setMessage("m".repeat(150)),
                () -> lead.setBudget(new BudgetRange(null, null)),
                () -> lead.setBudget(new BudgetRange(new BigDecimal("1"), new BigDecimal("2"))),
                () -> lead.setPreferredLocation(new PreferredLocation(null, null, "78701")),
                () -> lead.setPreferredLocation(new PreferredLocation("Austin", "TX", "78701")),
                () -> lead.replacePropertyInterests(List.of(UUID.randomUUID(), UUID.randomUUID())),
                () -> lead.replaceTags(List.of("hot", "cash-buyer", "relocating"))
        );

        int previous = policy.score(lead);
        for (Runnable signal : signals) {
            signal.run();
            int current = policy.score(lead);
            assertThat(current).isGreaterThanOrEqualTo(previous).isBetween(0, 100);
            previous = current;
        }
    }

    private static Lead fullyQualifiedLead() {
        Lead lead = new Lead();
        lead.setName("Jane");
        lead.setPhoneNumber("5551234567");
        lead.setEmail("jane@example.com");
        lead.setMessage("m".repeat(150));
        lead.setBudget(new BudgetRange(new BigDecimal("1"), new BigDecimal("2")));
        lead.setPreferredLocation(new PreferredLocation("Austin", "TX", "78701"));
        lead.replacePropertyInterests(List.of(UUID.randomUUID()));
        return lead;
    }
}
