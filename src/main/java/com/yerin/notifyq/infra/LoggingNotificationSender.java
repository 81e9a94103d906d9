package com.yerin.notifyq.infra;

import com.yerin.notifyq.domain.NotificationSender;
import com.yerin.notifyq.domain.SendResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.UUID;

/**
 * 실제 발송 없이 로그만 남기는 기본 발송기. failAlways 는 재시도/소진 경로 확인용.
 */
@Slf4j
public class LoggingNotificationSender implements NotificationSender {

    private final boolean failAlways;

    public LoggingNotificationSender(boolean failAlways) {
        this.failAlways = failAlways;
    }

    @Override
    public SendResult send(String recipient, Map<String, String> templateParams) {
        String template = templateParams.get("template");
        if (failAlways) {
            log.warn("[Sender] simulated failure template={}, recipient={}", template, recipient);
            return SendResult.failed("simulated failure");
        }
        String messageId = "local-" + UUID.randomUUID();
        log.info("[Sender] simulated send template={}, recipient={}, messageId={}", template, recipient, messageId);
        return SendResult.ok(messageId);
    }
}
