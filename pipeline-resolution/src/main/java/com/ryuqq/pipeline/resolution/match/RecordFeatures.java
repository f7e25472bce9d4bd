package com.ryuqq.pipeline.resolution.match;

import com.ryuqq.pipeline.resolution.normalize.AddressNormalizer;
import com.ryuqq.pipeline.resolution.normalize.CompanyNameNormalizer;
import com.ryuqq.pipeline.resolution.normalize.DomainExtractor;
import com.ryuqq.pipeline.resolution.normalize.PhoneNormalizer;
import com.ryuqq.pipeline.resolution.normalize.RecordFields;

import java.util.Locale;
import java.util.Map;

/**
 * 매칭에 사용하는 레코드의 정규화된 특징값.
 *
 * <p>레코드마다 한 번만 계산하여 blocking과 pairwise 비교에서 재사용합니다.
 * 비어있는 값은 ""입니다.</p>
 *
 * @param domain 정규화 도메인 (website, 없으면 domain 필드)
 * @param nameToken 기본 정규화 이름의 첫 토큰
 * @param name 심층 정규화 이름
 * @param phoneKey 전화번호 끝 10자리
 * @param address city + state + full_address 비교 문자열
 * @param city 소문자 city
 * @param state 소문자 state
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record RecordFeatures(
    String domain,
    String nameToken,
    String name,
    String phoneKey,
    String address,
    String city,
    String state
) {

    /**
     * 레코드에서 특징값 추출.
     *
     * @param record 원본 레코드
     * @return 특징값
     * @throws IllegalArgumentException record가 null인 경우
     */
    public static RecordFeatures of(Map<String, Object> record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        String companyName = RecordFields.text(record, "company_name");
        return new RecordFeatures(
            DomainExtractor.extract(RecordFields.firstText(record, "website", "domain")),
            CompanyNameNormalizer.firstToken(companyName),
            CompanyNameNormalizer.deepNormalize(companyName),
            PhoneNormalizer.matchKey(RecordFields.text(record, "phone")),
            AddressNormalizer.normalize(record),
            RecordFields.text(record, "city").toLowerCase(Locale.ROOT),
            RecordFields.text(record, "state").toLowerCase(Locale.ROOT)
        );
    }
}
