package com.chatwave.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "chat.live")
public class LiveChatProperties {

    /** Idle time after which a typing entry expires without an explicit stop */
    private Duration typingTtl = Duration.ofSeconds(6);

    /** How long after creation the sender may delete a message for everyone */
    private Duration deleteWindow = Duration.ofHours(24);

    private String deletedPlaceholder = "This message was deleted";

    private int historyPageSize = 50;

    private int historyMaxPageSize = 100;

    private boolean seedDemoData = false;

    private Jwt jwt = new Jwt();

    @Data
    public static class Jwt {
        /** HMAC-SHA key, at least 32 bytes */
        private String secret;
        private String issuer = "chatwave";
    }
}
