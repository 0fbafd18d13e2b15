package com.titan.prepress.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One preflight problem. Immutable; collected into {@link Issues}.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Issue {

    public static final String TOOL_MISSING = "TOOL_MISSING";

    Severity severity;
    String code;
    String message;
    Integer page;
    BoundingBox bbox;
    @Singular("metaEntry")
    Map<String, Object> meta;

    public static Issue blocker(String code, String message) {
        return Issue.builder().severity(Severity.BLOCKER).code(code).message(message).build();
    }

    public static Issue warning(String code, String message) {
        return Issue.builder().severity(Severity.WARNING).code(code).message(message).build();
    }

    public static Issue info(String code, String message) {
        return Issue.builder().severity(Severity.INFO).code(code).message(message).build();
    }

    public static Issue toolMissing(String toolKey) {
        return Issue.builder()
                .severity(Severity.WARNING)
                .code(TOOL_MISSING)
                .message("Tool '" + toolKey + "' is not available. Some checks will be skipped.")
                .metaEntry("tool", toolKey)
                .build();
    }
}
