package com.ryuqq.pipeline.resolution.match;

import com.ryuqq.pipeline.resolution.normalize.StringSimilarity;

import java.util.OptionalDouble;

/**
 * 레코드 쌍 비교 신호.
 *
 * <p>각 신호는 양쪽 레코드 모두 값이 있을 때만 유사도를 반환합니다.
 * 한쪽이라도 비어있으면 empty이며, 해당 신호의 가중치는 점수 계산에서 제외됩니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum MatchSignal {

    /** 도메인 완전 일치 (1.0 / 0.0) */
    DOMAIN {
        @Override
        public OptionalDouble similarity(RecordFeatures a, RecordFeatures b) {
            return exact(a.domain(), b.domain());
        }
    },

    /** 심층 정규화 회사명 문자열 유사도 */
    NAME {
        @Override
        public OptionalDouble similarity(RecordFeatures a, RecordFeatures b) {
            if (a.name().isEmpty() || b.name().isEmpty()) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(StringSimilarity.ratio(a.name(), b.name()));
        }
    },

    /** 전화번호 끝 10자리 완전 일치 */
    PHONE {
        @Override
        public OptionalDouble similarity(RecordFeatures a, RecordFeatures b) {
            return exact(a.phoneKey(), b.phoneKey());
        }
    },

    /** city + state + 주소 문자열 유사도 */
    ADDRESS {
        @Override
        public OptionalDouble similarity(RecordFeatures a, RecordFeatures b) {
            if (a.address().isEmpty() || b.address().isEmpty()) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(StringSimilarity.ratio(a.address(), b.address()));
        }
    },

    /** city 대소문자 무시 일치 */
    CITY {
        @Override
        public OptionalDouble similarity(RecordFeatures a, RecordFeatures b) {
            return exact(a.city(), b.city());
        }
    },

    /** state 대소문자 무시 일치 */
    STATE {
        @Override
        public OptionalDouble similarity(RecordFeatures a, RecordFeatures b) {
            return exact(a.state(), b.state());
        }
    };

    /**
     * 두 레코드의 신호 유사도.
     *
     * @param a 첫 번째 레코드 특징값
     * @param b 두 번째 레코드 특징값
     * @return 0.0 ~ 1.0 (어느 한쪽 값이 없으면 empty)
     */
    public abstract OptionalDouble similarity(RecordFeatures a, RecordFeatures b);

    private static OptionalDouble exact(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(a.equals(b) ? 1.0 : 0.0);
    }
}
