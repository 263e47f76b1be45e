package com.ryuqq.policyreplica.core.codec;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 영속 저장소에 기록되는 Policy 표현.
 *
 * <p>Policy와 같은 필드를 가지지만 effect는 문자열이고, conditions는 저장소가 해석하지 않는
 * 불투명 직렬화 payload(JSON 텍스트)입니다. 필드 이름은 wire 계약이며 호환 저장소 구현은
 * 바이트 단위로 보존해야 합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>subjects/resources/actions: null이면 빈 목록</li>
 *   <li>description: null이면 빈 문자열</li>
 *   <li>conditions: null 또는 빈 문자열 허용 (조건 없음)</li>
 *   <li>id, effect: 검증하지 않음 ({@link PolicyCodec#decode(WireRecord)}에서 검증)</li>
 * </ul>
 *
 * @param id 식별자
 * @param description 설명
 * @param subjects subject 패턴
 * @param effect effect 문자열
 * @param resources resource 패턴
 * @param actions action 패턴
 * @param conditions 조건 payload (null 허용)
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public record WireRecord(
    @JsonProperty(WireRecord.FIELD_ID) String id,
    @JsonProperty(WireRecord.FIELD_DESCRIPTION) String description,
    @JsonProperty(WireRecord.FIELD_SUBJECTS) List<String> subjects,
    @JsonProperty(WireRecord.FIELD_EFFECT) String effect,
    @JsonProperty(WireRecord.FIELD_RESOURCES) List<String> resources,
    @JsonProperty(WireRecord.FIELD_ACTIONS) List<String> actions,
    @JsonProperty(WireRecord.FIELD_CONDITIONS) String conditions
) {

    public static final String FIELD_ID = "id";
    public static final String FIELD_DESCRIPTION = "description";
    public static final String FIELD_SUBJECTS = "subjects";
    public static final String FIELD_EFFECT = "effect";
    public static final String FIELD_RESOURCES = "resources";
    public static final String FIELD_ACTIONS = "actions";
    public static final String FIELD_CONDITIONS = "conditions";

    /**
     * Compact Constructor.
     */
    public WireRecord {
        description = description == null ? "" : description;
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
        resources = resources == null ? List.of() : List.copyOf(resources);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * 조건 payload가 비어 있는지 확인.
     *
     * @return null이거나 공백뿐이면 true
     */
    public boolean hasNoConditions() {
        return conditions == null || conditions.isBlank();
    }
}
