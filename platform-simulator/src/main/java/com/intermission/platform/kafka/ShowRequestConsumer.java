package com.intermission.platform.kafka;

import com.intermission.common.model.ShowRequest;
import com.intermission.platform.service.PlatformService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ShowRequestConsumer {

    private final PlatformService platformService;

    @KafkaListener(
            topics = "${intermission.topics.command:intermission.platform.command}",
            containerFactory = "showRequestListenerFactory"
    )
    public void onShowRequest(ShowRequest request) {
        log.info("⬇️ Received ShowRequest: {}", request);
        platformService.handle(request);
    }
}
