package com.carelink.backend.modules.verification.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.carelink.backend.modules.verification.infrastructure.persistence.VerificationRequirementRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RequirementExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(RequirementExpiryScheduler.class);
    private static final String ERROR_EXPIRY_FAILED = "REQUIREMENT_EXPIRY_FAILED";

    private final VerificationRequirementRepository requirementRepository;
    private final Clock clock;

    public RequirementExpiryScheduler(VerificationRequirementRepository requirementRepository, Clock clock) {
        this.requirementRepository = requirementRepository;
        this.clock = clock;
    }

    @Scheduled(cron = "0 0 2 * * *", zone = "UTC")
    @Transactional
    public void runDailyBatch() {
        expireApprovedRequirements();
    }

    /**
     * Marks approved documents whose expiry date has passed as EXPIRED.
     *
     * @return number of documents expired in this run
     */
    @Transactional
    public int expireApprovedRequirements() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            int expired = requirementRepository.expireApprovedBefore(now);
            log.info("[Batch][RequirementExpiry] expired={} cutoff={}", expired, now);
            return expired;
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Batch][RequirementExpiry] errorCode={} detail={}", ERROR_EXPIRY_FAILED, ex.getMessage(), ex);
            throw ex;
        }
    }
}
