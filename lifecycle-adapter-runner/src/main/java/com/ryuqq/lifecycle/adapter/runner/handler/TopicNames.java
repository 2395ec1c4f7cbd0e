package com.ryuqq.lifecycle.adapter.runner.handler;

import java.util.Locale;

/**
 * 이벤트 버스 토픽 명명 규칙.
 *
 * <ul>
 *   <li>관측 토픽: {@code lifecycle.evt.<node>.v1}</li>
 *   <li>명령 토픽 (접근 제한): {@code lifecycle.cmd.<node>.v1}</li>
 * </ul>
 *
 * <p>토픽 ACL은 버스 책임이며 여기서 강제하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TopicNames {

    public static final String RUNTIME_TOPIC = "lifecycle.evt.runtime.v1";

    /** action_config.topic_tier 값 */
    public static final String COMMAND_TIER = "command";

    private TopicNames() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String events(String nodeName) {
        return "lifecycle.evt." + normalize(nodeName) + ".v1";
    }

    public static String commands(String nodeName) {
        return "lifecycle.cmd." + normalize(nodeName) + ".v1";
    }

    private static String normalize(String nodeName) {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("nodeName cannot be null or blank");
        }
        return nodeName.trim().toLowerCase(Locale.ROOT);
    }
}
