package se.bazaar_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.bazaar_be.repository.UserRepository;

@Service
@RequiredArgsConstructor
@Slf4j
public class TrustScoreService {

    public static final int VERIFICATION_BONUS = 50;

    private final UserRepository userRepository;

    /**
     * Credits the seller's user account once verification succeeds and flags the account as verified.
     */
    @Transactional
    public void awardVerificationBonus(Long userId) {
        int updated = userRepository.addVerificationBonus(userId, VERIFICATION_BONUS);
        if (updated == 0) {
            log.warn("User {} not found, verification bonus not applied", userId);
            return;
        }
        log.info("Added verification bonus of {} to trust score of user {}", VERIFICATION_BONUS, userId);
    }
}
