package com.ryuqq.policyreplica.core.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.policyreplica.core.condition.CidrCondition;
import com.ryuqq.policyreplica.core.condition.Condition;
import com.ryuqq.policyreplica.core.condition.ConditionRegistry;
import com.ryuqq.policyreplica.core.condition.Conditions;
import com.ryuqq.policyreplica.core.condition.EqualsSubjectCondition;
import com.ryuqq.policyreplica.core.condition.StringEqualCondition;
import com.ryuqq.policyreplica.core.condition.StringMatchCondition;
import com.ryuqq.policyreplica.core.condition.StringPairsEqualCondition;
import com.ryuqq.policyreplica.core.exception.PolicyDecodeException;
import com.ryuqq.policyreplica.core.exception.PolicyEncodeException;
import com.ryuqq.policyreplica.core.model.AccessRequest;
import com.ryuqq.policyreplica.core.model.ChangeType;
import com.ryuqq.policyreplica.core.model.Effect;
import com.ryuqq.policyreplica.core.model.Policy;
import com.ryuqq.policyreplica.core.model.PolicyChange;
import com.ryuqq.policyreplica.core.spi.ChangeEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PolicyCodec 테스트.
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
class PolicyCodecTest {

    private final PolicyCodec codec = new PolicyCodec();

    static Stream<Policy> policies() {
        Policy minimal = Policy.builder().id("minimal").effect(Effect.ALLOW).build();
        Policy full = Policy.builder()
            .id("full")
            .description("full policy")
            .effect(Effect.DENY)
            .subjects(List.of("user:<.*>", "group:admins"))
            .resources(List.of("articles:<[0-9]+>"))
            .actions(List.of("create", "delete"))
            .conditions(Conditions.of(Map.of(
                "owner", new EqualsSubjectCondition(),
                "clientIp", new CidrCondition("10.0.0.0/8"),
                "dept", new StringEqualCondition("engineering"),
                "agent", new StringMatchCondition("^Mozilla.*"),
                "pairs", new StringPairsEqualCondition()
            )))
            .build();
        Policy emptyLists = Policy.builder()
            .id("empty-lists")
            .description("")
            .effect(Effect.DENY)
            .subjects(List.of())
            .resources(List.of())
            .actions(List.of())
            .build();
        Policy singleCondition = minimal.toBuilder()
            .id("single")
            .conditions(Conditions.of("ip", new CidrCondition("2001:db8::/32")))
            .build();
        return Stream.of(minimal, full, emptyLists, singleCondition);
    }

    // ============================================================
    // 1. 왕복
    // ============================================================

    @ParameterizedTest
    @MethodSource("policies")
    void decode_EncodedPolicy_ReturnsEqualPolicy(Policy policy) {
        // when
        Policy decoded = codec.decode(codec.encode(policy));

        // then
        assertThat(decoded).isEqualTo(policy);
    }

    @Test
    void encode_CopiesFieldsToWireRecord() {
        // given
        Policy policy = Policy.builder()
            .id("p1")
            .description("desc")
            .effect(Effect.ALLOW)
            .subjects(List.of("user:alice"))
            .resources(List.of("articles:1"))
            .actions(List.of("read"))
            .build();

        // when
        WireRecord record = codec.encode(policy);

        // then
        assertThat(record.id()).isEqualTo("p1");
        assertThat(record.description()).isEqualTo("desc");
        assertThat(record.effect()).isEqualTo("allow");
        assertThat(record.subjects()).containsExactly("user:alice");
        assertThat(record.resources()).containsExactly("articles:1");
        assertThat(record.actions()).containsExactly("read");
        assertThat(record.conditions()).isEqualTo("{}");
    }

    @Test
    void encodeConditions_UsesTypeAndOptionsEnvelope() throws Exception {
        // when
        String payload = codec.encodeConditions(Conditions.of("ip", new CidrCondition("10.0.0.0/8")));

        // then
        var node = new ObjectMapper().readTree(payload);
        assertThat(node.get("ip").get("type").asText()).isEqualTo("CIDRCondition");
        assertThat(node.get("ip").get("options").get("cidr").asText()).isEqualTo("10.0.0.0/8");
    }

    @Test
    void decodeConditions_DecodedConditionsStillEvaluate() {
        // given
        String payload = "{\"ip\":{\"type\":\"CIDRCondition\",\"options\":{\"cidr\":\"10.0.0.0/8\"}}}";

        // when
        Conditions conditions = codec.decodeConditions("p1", payload);

        // then
        AccessRequest inside = new AccessRequest("user:a", "r", "read", Map.of("ip", "10.2.3.4"));
        AccessRequest outside = new AccessRequest("user:a", "r", "read", Map.of("ip", "192.168.0.1"));
        assertThat(conditions.fulfillsAll(inside)).isTrue();
        assertThat(conditions.fulfillsAll(outside)).isFalse();
    }

    @Test
    void decode_WireRecordWithImmutableLists_ReturnsPolicy() {
        // given
        WireRecord record = new WireRecord(
            "p1", "desc", List.of("user:alice", "user:bob"), "deny",
            List.of("articles:1"), List.of("read", "write"), null);

        // when
        Policy policy = codec.decode(record);

        // then
        assertThat(policy.getId()).isEqualTo("p1");
        assertThat(policy.allows()).isFalse();
        assertThat(policy.getSubjects()).containsExactly("user:alice", "user:bob");
        assertThat(policy.getResources()).containsExactly("articles:1");
        assertThat(policy.getActions()).containsExactly("read", "write");
        assertThat(policy.getConditions().isEmpty()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  "})
    void decode_BlankConditions_ReturnsPolicyWithoutConditions(String conditions) {
        WireRecord record = new WireRecord("p1", "", List.of(), "allow", List.of(), List.of(), conditions);

        assertThat(record.hasNoConditions()).isTrue();
        assertThat(codec.decode(record).getConditions()).isEqualTo(Conditions.empty());
    }

    // ============================================================
    // 2. 빈 payload
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "null", "{}"})
    void decodeConditions_EmptyPayload_ReturnsEmptyConditions(String payload) {
        assertThat(codec.decodeConditions("p1", payload).isEmpty()).isTrue();
    }

    @Test
    void decodeConditions_NullPayload_ReturnsEmptyConditions() {
        assertThat(codec.decodeConditions("p1", null)).isEqualTo(Conditions.empty());
    }

    @Test
    void decodeConditions_MissingOptions_UsesDefaults() {
        Conditions conditions = codec.decodeConditions("p1", "{\"owner\":{\"type\":\"EqualsSubjectCondition\"}}");

        assertThat(conditions.get("owner")).isEqualTo(new EqualsSubjectCondition());
    }

    // ============================================================
    // 3. 복원 실패
    // ============================================================

    @Test
    void decodeConditions_UnknownType_ThrowsDecodeException() {
        String payload = "{\"c\":{\"type\":\"NoSuchCondition\",\"options\":{}}}";

        assertThatThrownBy(() -> codec.decodeConditions("p1", payload))
            .isInstanceOfSatisfying(PolicyDecodeException.class, e -> {
                assertThat(e.getPolicyId()).isEqualTo("p1");
                assertThat(e.getMessage()).contains("NoSuchCondition");
            });
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{not json",
        "[1,2,3]",
        "\"text\"",
        "{\"c\":42}",
        "{\"c\":{\"options\":{}}}",
        "{\"c\":{\"type\":\"CIDRCondition\",\"options\":{\"cidr\":[1,2]}}}",
        "{}]",
        "{} {\"c\":42}",
        "{\"a\":{\"type\":\"EqualsSubjectCondition\"}} garbage"
    })
    void decodeConditions_MalformedPayload_ThrowsDecodeException(String payload) {
        assertThatThrownBy(() -> codec.decodeConditions("p1", payload))
            .isInstanceOf(PolicyDecodeException.class);
    }

    @Test
    void decode_UnknownEffect_ThrowsDecodeException() {
        WireRecord record = new WireRecord("p1", "", List.of(), "maybe", List.of(), List.of(), "{}");

        assertThatThrownBy(() -> codec.decode(record))
            .isInstanceOf(PolicyDecodeException.class)
            .hasMessageContaining("maybe");
    }

    @Test
    void decode_BlankId_ThrowsDecodeException() {
        WireRecord record = new WireRecord(" ", "", List.of(), "allow", List.of(), List.of(), null);

        assertThatThrownBy(() -> codec.decode(record)).isInstanceOf(PolicyDecodeException.class);
    }

    @Test
    void decode_CustomRegistryWithoutType_ThrowsDecodeException() {
        // given
        PolicyCodec restricted = new PolicyCodec(new ConditionRegistry()
            .register(StringEqualCondition.TYPE, StringEqualCondition.class));
        WireRecord record = codec.encode(Policy.builder()
            .id("p1")
            .effect(Effect.ALLOW)
            .conditions(Conditions.of("ip", new CidrCondition("10.0.0.0/8")))
            .build());

        // then
        assertThatThrownBy(() -> restricted.decode(record)).isInstanceOf(PolicyDecodeException.class);
    }

    // ============================================================
    // 4. 직렬화 실패 / 변경 이벤트
    // ============================================================

    @Test
    void encode_UnserializableCondition_ThrowsEncodeException() {
        // given
        Condition broken = new Condition() {
            @Override
            public String type() {
                return "Broken";
            }

            @Override
            public boolean fulfills(Object value, AccessRequest request) {
                return false;
            }

            @SuppressWarnings("unused")
            public Object getSelf() {
                return this;
            }
        };
        Policy policy = Policy.builder()
            .id("p1")
            .effect(Effect.ALLOW)
            .conditions(Conditions.of("broken", broken))
            .build();

        // then
        assertThatThrownBy(() -> codec.encode(policy)).isInstanceOf(PolicyEncodeException.class);
    }

    @Test
    void decodeChange_UpdateEvent_DecodesBothSides() {
        // given
        Policy before = Policy.builder().id("p1").effect(Effect.ALLOW).build();
        Policy after = before.toBuilder().effect(Effect.DENY).build();
        ChangeEvent event = ChangeEvent.update(codec.encode(before), codec.encode(after));

        // when
        PolicyChange change = codec.decodeChange(event);

        // then
        assertThat(change.type()).isEqualTo(ChangeType.UPDATE);
        assertThat(change.oldPolicy()).isEqualTo(before);
        assertThat(change.newPolicy()).isEqualTo(after);
    }

    @Test
    void decodeChange_UndecodableNewSide_ThrowsDecodeException() {
        WireRecord broken = new WireRecord("p1", "", List.of(), "allow", List.of(), List.of(), "{\"c\":{\"type\":\"X\"}}");

        assertThatThrownBy(() -> codec.decodeChange(ChangeEvent.insert(broken)))
            .isInstanceOf(PolicyDecodeException.class);
    }
}
