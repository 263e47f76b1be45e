package com.ryuqq.policyreplica.core.condition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.policyreplica.core.model.AccessRequest;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * 값이 CIDR 블록에 포함된 IP 주소인지 확인하는 조건.
 *
 * <p>options: {@code {"cidr": "192.168.0.0/16"}}. IPv4/IPv6 리터럴만 허용하며
 * 호스트 이름은 조회하지 않습니다.</p>
 *
 * @param cidr CIDR 표기 (예: 10.0.0.0/8)
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public record CidrCondition(@JsonProperty("cidr") String cidr) implements Condition {

    public static final String TYPE = "CIDRCondition";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean fulfills(Object value, AccessRequest request) {
        if (!(value instanceof String address) || cidr == null) {
            return false;
        }
        int slash = cidr.indexOf('/');
        if (slash <= 0) {
            return false;
        }
        byte[] network = parseLiteral(cidr.substring(0, slash));
        byte[] candidate = parseLiteral(address);
        if (network == null || candidate == null || network.length != candidate.length) {
            return false;
        }
        int prefix;
        try {
            prefix = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            return false;
        }
        if (prefix < 0 || prefix > network.length * 8) {
            return false;
        }
        return samePrefix(network, candidate, prefix);
    }

    private static boolean samePrefix(byte[] network, byte[] candidate, int prefix) {
        int fullBytes = prefix / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (network[i] != candidate[i]) {
                return false;
            }
        }
        int remainingBits = prefix % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (network[fullBytes] & mask) == (candidate[fullBytes] & mask);
    }

    /**
     * IP 리터럴 파싱 (DNS 조회 없음).
     *
     * @return 주소 바이트, 리터럴이 아니면 null
     */
    private static byte[] parseLiteral(String literal) {
        String trimmed = literal.trim();
        if (trimmed.isEmpty() || !trimmed.matches("[0-9a-fA-F:.]+")) {
            return null;
        }
        if (trimmed.indexOf(':') < 0 && !trimmed.matches("\\d{1,3}(\\.\\d{1,3}){3}")) {
            return null;
        }
        try {
            return InetAddress.getByName(trimmed).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }
}
