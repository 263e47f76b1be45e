package com.ryuqq.policyreplica.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.policyreplica.core.condition.Condition;
import com.ryuqq.policyreplica.core.condition.ConditionRegistry;
import com.ryuqq.policyreplica.core.condition.Conditions;
import com.ryuqq.policyreplica.core.exception.PolicyDecodeException;
import com.ryuqq.policyreplica.core.exception.PolicyEncodeException;
import com.ryuqq.policyreplica.core.model.Effect;
import com.ryuqq.policyreplica.core.model.Policy;
import com.ryuqq.policyreplica.core.model.PolicyChange;
import com.ryuqq.policyreplica.core.spi.ChangeEvent;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Policy ↔ {@link WireRecord} 변환기.
 *
 * <p>조건 직렬화를 이 클래스 안에 격리합니다. 저장소는 조건 payload를 해석하지 않습니다.</p>
 *
 * <p><strong>조건 payload 형식:</strong></p>
 * <pre>
 * {
 *   "owner":    { "type": "EqualsSubjectCondition", "options": {} },
 *   "clientIp": { "type": "CIDRCondition", "options": { "cidr": "10.0.0.0/8" } }
 * }
 * </pre>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>encode: 조건 객체가 직렬화에 실패한 경우에만 {@link PolicyEncodeException}</li>
 *   <li>decode: payload가 null/빈 문자열/{@code null} 리터럴이면 빈 조건 집합 (오류 아님)</li>
 *   <li>decode: 구조 오류, 미등록 타입 태그, 잘못된 options, 알 수 없는 effect,
 *       빈 식별자는 {@link PolicyDecodeException}</li>
 *   <li>왕복 법칙: {@code decode(encode(p)).equals(p)}</li>
 * </ul>
 *
 * <p>Thread-safe: 인스턴스를 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public final class PolicyCodec {

    static final String TYPE_FIELD = "type";
    static final String OPTIONS_FIELD = "options";

    private final ConditionRegistry registry;
    private final ObjectMapper mapper;

    /**
     * 기본 조건 레지스트리로 생성.
     */
    public PolicyCodec() {
        this(ConditionRegistry.defaults());
    }

    /**
     * 커스텀 조건 레지스트리로 생성.
     *
     * @param registry 조건 타입 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public PolicyCodec(ConditionRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
        this.mapper = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Policy를 Wire Record로 변환.
     *
     * @param policy 도메인 Policy
     * @return Wire Record
     * @throws IllegalArgumentException policy가 null인 경우
     * @throws PolicyEncodeException 조건 직렬화 실패 시
     */
    public WireRecord encode(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        return new WireRecord(
            policy.getId(),
            policy.getDescription(),
            policy.getSubjects(),
            policy.getEffect().getValue(),
            policy.getResources(),
            policy.getActions(),
            encodeConditions(policy.getConditions())
        );
    }

    /**
     * Wire Record를 Policy로 복원.
     *
     * @param record Wire Record
     * @return 도메인 Policy
     * @throws IllegalArgumentException record가 null인 경우
     * @throws PolicyDecodeException 레코드를 Policy로 복원할 수 없는 경우
     */
    public Policy decode(WireRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        String id = record.id();
        if (id == null || id.isBlank()) {
            throw new PolicyDecodeException(id, "Wire record has no id");
        }

        Effect effect;
        try {
            effect = Effect.fromValue(record.effect());
        } catch (IllegalArgumentException e) {
            throw new PolicyDecodeException(id, "Invalid effect for policy " + id + ": " + record.effect(), e);
        }

        try {
            return Policy.builder()
                .id(id)
                .description(record.description())
                .effect(effect)
                .subjects(record.subjects())
                .resources(record.resources())
                .actions(record.actions())
                .conditions(record.hasNoConditions() ? Conditions.empty() : decodeConditions(id, record.conditions()))
                .build();
        } catch (PolicyDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PolicyDecodeException(id, "Invalid wire record for policy " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * 변경 이벤트 양쪽을 복원.
     *
     * <p>old를 먼저, new를 나중에 복원하며 어느 쪽이든 실패하면 이벤트 전체가 실패합니다.</p>
     *
     * @param event 저장소 변경 이벤트
     * @return 복원된 변경
     * @throws PolicyDecodeException 한쪽이라도 복원할 수 없는 경우
     */
    public PolicyChange decodeChange(ChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        Policy oldPolicy = event.oldValue() == null ? null : decode(event.oldValue());
        Policy newPolicy = event.newValue() == null ? null : decode(event.newValue());
        return new PolicyChange(oldPolicy, newPolicy);
    }

    /**
     * 조건 집합을 payload로 직렬화.
     *
     * @param conditions 조건 집합
     * @return JSON 텍스트 (빈 집합이면 {@code {}})
     * @throws PolicyEncodeException 조건 직렬화 실패 시
     */
    public String encodeConditions(Conditions conditions) {
        ObjectNode root = mapper.createObjectNode();
        if (conditions == null) {
            return root.toString();
        }
        for (Map.Entry<String, Condition> entry : conditions.asMap().entrySet()) {
            Condition condition = entry.getValue();
            ObjectNode node = root.putObject(entry.getKey());
            node.put(TYPE_FIELD, condition.type());
            try {
                node.set(OPTIONS_FIELD, mapper.valueToTree(condition));
            } catch (IllegalArgumentException e) {
                throw new PolicyEncodeException(
                    "Failed to serialize condition " + entry.getKey() + " (" + condition.type() + ")", e
                );
            }
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new PolicyEncodeException("Failed to serialize conditions", e);
        }
    }

    /**
     * payload를 조건 집합으로 복원.
     *
     * @param policyId 오류 보고용 식별자
     * @param payload JSON 텍스트 (null/빈 문자열 허용)
     * @return 조건 집합
     * @throws PolicyDecodeException payload 구조 오류 또는 미등록 타입 태그
     */
    public Conditions decodeConditions(String policyId, String payload) {
        if (payload == null || payload.isBlank()) {
            return Conditions.empty();
        }

        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new PolicyDecodeException(policyId, "Malformed conditions payload for policy " + policyId, e);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            return Conditions.empty();
        }
        if (!root.isObject()) {
            throw new PolicyDecodeException(policyId, "Conditions payload must be a JSON object for policy " + policyId);
        }

        Map<String, Condition> conditions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            conditions.put(field.getKey(), decodeCondition(policyId, field.getKey(), field.getValue()));
        }
        return Conditions.of(conditions);
    }

    private Condition decodeCondition(String policyId, String name, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new PolicyDecodeException(policyId, "Condition " + name + " must be a JSON object");
        }
        JsonNode typeNode = node.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new PolicyDecodeException(policyId, "Condition " + name + " has no type");
        }
        String type = typeNode.asText();
        Class<? extends Condition> conditionClass = registry.resolve(type)
            .orElseThrow(() -> new PolicyDecodeException(
                policyId, "Unknown condition type " + type + " for condition " + name
            ));

        JsonNode options = node.get(OPTIONS_FIELD);
        if (options == null || options.isNull()) {
            options = mapper.createObjectNode();
        }
        try {
            return mapper.treeToValue(options, conditionClass);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PolicyDecodeException(
                policyId, "Invalid options for condition " + name + " (" + type + ")", e
            );
        }
    }
}
