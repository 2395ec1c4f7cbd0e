package com.ryuqq.lifecycle.core.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 계약 버전 (major.minor.patch).
 *
 * <p><strong>호환성 규칙:</strong></p>
 * <ul>
 *   <li>major가 같고, 로드된 버전이 요청 버전보다 오래되지 않았을 때만 호환</li>
 *   <li>런타임 중에는 버전이 바뀌지 않음 (재로드는 새 Contract 값을 만든다)</li>
 * </ul>
 *
 * @param major major 버전 (0 이상)
 * @param minor minor 버전 (0 이상)
 * @param patch patch 버전 (0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ContractVersion(int major, int minor, int patch) implements Comparable<ContractVersion> {

    private static final Pattern SEMVER = Pattern.compile("^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)$");

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 음수 구성 요소가 있는 경우
     */
    public ContractVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException(
                String.format("Version components must be non-negative (current: %d.%d.%d)", major, minor, patch));
        }
    }

    /**
     * ContractVersion 생성.
     *
     * @param major major
     * @param minor minor
     * @param patch patch
     * @return ContractVersion 인스턴스
     */
    public static ContractVersion of(int major, int minor, int patch) {
        return new ContractVersion(major, minor, patch);
    }

    /**
     * "M.m.p" 형식 문자열 파싱.
     *
     * @param value 버전 문자열
     * @return ContractVersion 인스턴스
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static ContractVersion parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        Matcher matcher = SEMVER.matcher(value.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed semantic version: '" + value + "'");
        }
        try {
            return new ContractVersion(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed semantic version: '" + value + "'", e);
        }
    }

    /**
     * 요청된 버전을 만족하는지 확인.
     *
     * @param required 요청 버전 (최소 버전)
     * @return major가 같고 이 버전이 required 이상이면 true
     * @throws IllegalArgumentException required가 null인 경우
     */
    public boolean satisfies(ContractVersion required) {
        if (required == null) {
            throw new IllegalArgumentException("required cannot be null");
        }
        return major == required.major && compareTo(required) >= 0;
    }

    @Override
    public int compareTo(ContractVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
