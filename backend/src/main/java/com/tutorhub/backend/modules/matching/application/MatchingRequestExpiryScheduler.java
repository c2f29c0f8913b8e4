package com.tutorhub.backend.modules.matching.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class MatchingRequestExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(MatchingRequestExpiryScheduler.class);

    private final MatchingRequestService matchingRequestService;

    public MatchingRequestExpiryScheduler(MatchingRequestService matchingRequestService) {
        this.matchingRequestService = matchingRequestService;
    }

    @Scheduled(cron = "${tutorhub.matching.expiry-cron:0 */15 * * * *}")
    public void expireOverdueRequests() {
        try {
            int expired = matchingRequestService.expireOverdueRequests();
            log.debug("Matching expiry sweep finished expired={}", expired);
        } catch (RuntimeException ex) {
            // 다음 주기에서 같은 요청을 다시 처리한다
            log.warn("[ALERT][Batch][MATCHING_EXPIRY] detail={}", ex.getMessage(), ex);
        }
    }
}
