package com.yerin.notifyq.domain;

import java.util.Map;

/**
 * 실제 메시지 구성/발송은 외부 협력자. templateParams 의 "template" 항목이 템플릿 이름이다.
 */
public interface NotificationSender {
    SendResult send(String recipient, Map<String, String> templateParams);
}
