package io.github.drompincen.iterablemcp.gateway.config;

import io.github.drompincen.iterablemcp.protocol.api.PermissionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * Raw permission flags as read from the environment at startup. Each request gets
 * its own {@link PermissionConfig} built from them.
 */
@Component
public class PermissionSettings {

    private static final Logger log = LoggerFactory.getLogger(PermissionSettings.class);

    private final String userPii;
    private final String enableWrites;
    private final String enableSends;

    public PermissionSettings(@Value("${iterable.permissions.user-pii:false}") String userPii,
                              @Value("${iterable.permissions.enable-writes:false}") String enableWrites,
                              @Value("${iterable.permissions.enable-sends:false}") String enableSends) {
        this.userPii = userPii;
        this.enableWrites = enableWrites;
        this.enableSends = enableSends;
    }

    @PostConstruct
    void logFlags() {
        PermissionConfig config = current();
        log.info("Permissions: userPii={} writes={} sends={}",
                config.allowUserPii(), config.allowWrites(), config.allowSends());
    }

    public PermissionConfig current() {
        return PermissionConfig.parse(userPii, enableWrites, enableSends);
    }
}
