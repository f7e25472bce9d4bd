package com.ryuqq.pipeline.resolution.merge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Canonicalizer 테스트.
 *
 * <ul>
 *   <li>기준 레코드 선택 (quality_score → 완전성 → 입력 순서)</li>
 *   <li>KEEP_BEST: 기준 레코드 필드 + 연관 단체 / provenance / 별칭</li>
 *   <li>MERGE_ALL: 빈 필드 채우기, 목록 합집합, 수치 최대값</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class CanonicalizerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private Canonicalizer canonicalizer;

    @BeforeEach
    void setUp() {
        canonicalizer = new Canonicalizer(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Map<String, Object> record(Object... keyValues) {
        Map<String, Object> record = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put((String) keyValues[i], keyValues[i + 1]);
        }
        return record;
    }

    @Test
    void canonicalize_quality_score가_가장_높은_레코드가_기준() {
        // given
        List<Map<String, Object>> members = List.of(
            record("company_name", "Acme", "quality_score", 40),
            record("company_name", "Acme Corporation", "quality_score", 90),
            record("company_name", "ACME Inc", "quality_score", 70)
        );

        // when
        CanonicalRecord canonical = canonicalizer.canonicalize(members, MergeStrategy.KEEP_BEST);

        // then
        assertThat(canonical.record()).containsEntry("company_name", "Acme Corporation");
        assertThat(canonical.aliases()).containsExactly("ACME Inc", "Acme");
        assertThat(canonical.record()).containsEntry("merged_from_count", 3);
        assertThat(canonical.record()).containsEntry("merged_at", NOW.toString());
    }

    @Test
    void canonicalize_quality_score_동점은_입력_순서가_빠른_레코드() {
        // given
        List<Map<String, Object>> members = List.of(
            record("company_name", "First", "quality_score", 80),
            record("company_name", "Second", "quality_score", 80)
        );

        // when
        CanonicalRecord canonical = canonicalizer.canonicalize(members, MergeStrategy.KEEP_BEST);

        // then
        assertThat(canonical.record()).containsEntry("company_name", "First");
    }

    @Test
    void canonicalize_quality_score가_없으면_완전성_점수() {
        // given
        List<Map<String, Object>> members = List.of(
            record("company_name", "Sparse"),
            record("company_name", "Rich", "website", "rich.com", "city", "Austin", "state", "TX")
        );

        // when
        CanonicalRecord canonical = canonicalizer.canonicalize(members, MergeStrategy.KEEP_BEST);

        // then
        assertThat(canonical.record()).containsEntry("company_name", "Rich");
        assertThat(Canonicalizer.completeness(members.get(1))).isEqualTo(40);
    }

    @Test
    void keepBest_연관_단체와_provenance_합침_다른_필드는_유지하지_않음() {
        // given
        List<Map<String, Object>> members = List.of(
            record("company_name", "Acme", "quality_score", 90, "association", "PMA",
                "provenance", List.of(Map.of("source_url", "https://pma.org/m/1"))),
            record("company_name", "Acme Inc", "quality_score", 50, "associations", List.of("NTMA", "AMT"),
                "industry", "Machining", "provenance", Map.of("source_url", "https://ntma.org/m/9"))
        );

        // when
        CanonicalRecord canonical = canonicalizer.canonicalize(members, MergeStrategy.KEEP_BEST);

        // then
        assertThat(canonical.record().get("associations")).isEqualTo(List.of("AMT", "NTMA", "PMA"));
        assertThat((List<?>) canonical.record().get("provenance")).hasSize(2);
        assertThat(canonical.record()).doesNotContainKey("industry");
    }

    @Test
    void mergeAll_수치_필드_최대값과_연락처_email_기준_합집합() {
        // given
        List<Map<String, Object>> members = List.of(
            record("company_name", "Acme", "website", "acme.com", "employee_count_min", 50,
                "contacts", List.of(Map.of("email", "a@acme.com", "name", "Ann"))),
            record("company_name", "Acme", "website", "acme.com", "employee_count_min", 200,
                "contacts", List.of(Map.of("email", "a@acme.com", "name", "Ann B"), Map.of("email", "b@acme.com"))),
            record("company_name", "Acme", "website", "acme.com", "employee_count_min", 120,
                "contacts", List.of(Map.of("name", "Cy")))
        );

        // when
        CanonicalRecord canonical = canonicalizer.canonicalize(members, MergeStrategy.MERGE_ALL);

        // then
        assertThat(canonical.record()).containsEntry("employee_count_min", 200);
        List<?> contacts = (List<?>) canonical.record().get("contacts");
        assertThat(contacts).hasSize(3);
        assertThat(contacts).extracting(c -> (Object) ((Map<?, ?>) c).get("email"))
            .containsExactly("a@acme.com", "b@acme.com", null);
        assertThat(canonical.aliases()).isEmpty();
    }

    @Test
    void mergeAll_빈_필드_채우기와_tech_stack_값_기준_합집합() {
        // given
        List<Map<String, Object>> members = List.of(
            record("company_name", "Acme", "quality_score", 90, "tech_stack", List.of("SAP", "Salesforce")),
            record("company_name", "Acme", "quality_score", 60, "tech_stack", List.of("Salesforce", "HubSpot"),
                "industry", "Machining", "id", "should-not-copy")
        );

        // when
        CanonicalRecord canonical = canonicalizer.canonicalize(members, MergeStrategy.MERGE_ALL);

        // then
        assertThat(canonical.record().get("tech_stack")).isEqualTo(List.of("SAP", "Salesforce", "HubSpot"));
        assertThat(canonical.record()).containsEntry("industry", "Machining");
        assertThat(canonical.record()).doesNotContainKey("id");
        assertThat(canonical.record()).containsEntry("quality_score", 90);
    }

    @Test
    void mergeAll_매칭_신호_필드는_다른_구성원_값으로_채우지_않음() {
        // given
        List<Map<String, Object>> members = List.of(
            record("company_name", "Acme", "quality_score", 90, "city", "Cleveland"),
            record("company_name", "Acme Tooling", "quality_score", 60, "website", "acme.com",
                "phone", "216-555-0100", "state", "OH", "industry", "Machining")
        );

        // when
        CanonicalRecord canonical = canonicalizer.canonicalize(members, MergeStrategy.MERGE_ALL);

        // then
        assertThat(canonical.record())
            .containsEntry("company_name", "Acme")
            .containsEntry("city", "Cleveland")
            .containsEntry("industry", "Machining")
            .doesNotContainKeys("website", "phone", "state");
        assertThat(canonical.aliases()).containsExactly("Acme Tooling");
    }

    @Test
    void canonicalize_단일_구성원은_복사본_그대로() {
        // given
        Map<String, Object> only = record("company_name", "Solo");

        // when
        CanonicalRecord canonical = canonicalizer.canonicalize(List.of(only), MergeStrategy.MERGE_ALL);

        // then
        assertThat(canonical.record()).isEqualTo(only).isNotSameAs(only);
        assertThat(canonical.record()).doesNotContainKey("merged_at");
    }

    @Test
    void canonicalize_빈_그룹은_거부() {
        assertThatThrownBy(() -> canonicalizer.canonicalize(List.of(), MergeStrategy.KEEP_BEST))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergeStrategy_외부_표기_변환() {
        assertThat(MergeStrategy.from("merge_all")).isEqualTo(MergeStrategy.MERGE_ALL);
        assertThat(MergeStrategy.from(" KEEP_BEST ")).isEqualTo(MergeStrategy.KEEP_BEST);
        assertThatThrownBy(() -> MergeStrategy.from("newest")).isInstanceOf(IllegalArgumentException.class);
    }
}
