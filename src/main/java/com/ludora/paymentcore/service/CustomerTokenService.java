package com.ludora.paymentcore.service;

import com.ludora.paymentcore.dto.ProviderPaymentData;
import com.ludora.paymentcore.entity.CustomerToken;
import com.ludora.paymentcore.repository.CustomerTokenRepository;
import com.ludora.paymentcore.util.AesGcmEncryptor;
import com.ludora.paymentcore.util.CardUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Keeps the provider card token of a completed payment for recurring billing.
 *
 * Runs in its own database transaction: token capture never decides whether a payment
 * is granted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerTokenService {

    private final CustomerTokenRepository tokenRepo;
    private final AesGcmEncryptor encryptor;
    private final Clock clock;

    /**
     * Stores the token unless the user already has it. The user's first token becomes
     * the default one.
     *
     * @return the stored or refreshed token, empty if the payload carried none
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<CustomerToken> saveFromProviderData(String userId, ProviderPaymentData data) {
        if (data == null || !data.hasToken()) {
            return Optional.empty();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String fingerprint = DigestUtils.sha256Hex(data.getToken());

        Optional<CustomerToken> existing = tokenRepo.findByUserIdAndTokenFingerprint(userId, fingerprint);
        if (existing.isPresent()) {
            CustomerToken token = existing.get();
            token.setActive(true);
            token.setLastUsedAt(now);
            log.info("[TOKEN] Token already stored, refreshed. userId={}, tokenId={}", userId, token.getId());
            return Optional.of(tokenRepo.save(token));
        }

        boolean first = !tokenRepo.existsByUserIdAndDefaultTokenTrueAndActiveTrue(userId);
        AesGcmEncryptor.Result enc = encryptor.encrypt(data.getToken(), aad(userId, fingerprint));

        CustomerToken token = new CustomerToken();
        token.setUserId(userId);
        token.setProviderCustomerUid(data.getCustomerUid());
        token.setTokenFingerprint(fingerprint);
        token.setEncToken(enc.ciphertext);
        token.setIv(enc.iv);
        token.setTag(enc.tag);
        token.setDekKid(enc.dekKid);
        token.setCardMask(CardUtils.masked(data.getCardLast4()));
        token.setCardBrand(CardUtils.brand(data.getCardBrand()));
        token.setExpiryMonth(data.getExpiryMonth());
        token.setExpiryYear(data.getExpiryYear());
        token.setDefaultToken(first);
        token.setLastUsedAt(now);
        token.setCreatedAt(now);

        CustomerToken saved = tokenRepo.save(token);
        log.info("[TOKEN] Token stored. userId={}, tokenId={}, card={}, default={}",
                userId, saved.getId(), saved.getCardMask(), first);
        return Optional.of(saved);
    }

    private static byte[] aad(String userId, String fingerprint) {
        return (userId + "|" + fingerprint).getBytes(StandardCharsets.UTF_8);
    }
}
