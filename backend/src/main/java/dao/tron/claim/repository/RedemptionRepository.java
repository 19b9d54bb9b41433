package dao.tron.claim.repository;

import dao.tron.claim.model.RedemptionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Redemption flags keyed by canonical recipient address. Entries are only ever added, except for the
 * rollback of a claim whose transfer failed.
 */
public interface RedemptionRepository {

    /**
     * @return true if the record was stored, false if the recipient already has one
     */
    boolean markClaimed(RedemptionRecord record);

    /**
     * Remove {@code record} only if it is still the stored entry for its recipient.
     */
    boolean rollback(RedemptionRecord record);

    Optional<RedemptionRecord> findByAddressKey(String addressKey);

    List<RedemptionRecord> findAll();

    int count();
}
