package io.github.drompincen.iterablemcp.runtime.policy;

import io.github.drompincen.iterablemcp.protocol.api.PermissionConfig;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a tool may be listed or invoked under a {@link PermissionConfig}.
 * Checks run in a fixed order (PII, then writes, then sends) and the first failing
 * check supplies the reason.
 */
@Component
public class PermissionEvaluator {

    static final String PII_REASON = "This tool exposes user PII. Enable with ITERABLE_USER_PII=true";
    static final String WRITE_REASON = "This tool modifies data. Enable with ITERABLE_ENABLE_WRITES=true";
    static final String SEND_REASON = "This tool can send messages. Enable with ITERABLE_ENABLE_SENDS=true";
    static final String UNKNOWN_REASON = "This tool is not recognized.";

    public boolean isAllowed(String toolName, PermissionConfig config) {
        return blockedReason(toolName, config).isEmpty();
    }

    public Optional<String> blockedReason(String toolName, PermissionConfig config) {
        if (!config.allowUserPii() && !CapabilityTaxonomy.isNonPii(toolName)) {
            return Optional.of(PII_REASON);
        }
        if (!config.allowWrites() && !CapabilityTaxonomy.isReadOnly(toolName)) {
            return Optional.of(WRITE_REASON);
        }
        if (!config.allowSends() && CapabilityTaxonomy.isSend(toolName)) {
            return Optional.of(SEND_REASON);
        }
        if (!CapabilityTaxonomy.isKnown(toolName)) {
            return Optional.of(UNKNOWN_REASON);
        }
        return Optional.empty();
    }
}
