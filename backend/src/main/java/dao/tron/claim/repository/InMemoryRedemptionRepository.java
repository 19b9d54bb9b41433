package dao.tron.claim.repository;

import dao.tron.claim.model.RedemptionRecord;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryRedemptionRepository implements RedemptionRepository {

    // key: 20-byte address hex
    private final Map<String, RedemptionRecord> byAddressKey = new ConcurrentHashMap<>();

    @Override
    public boolean markClaimed(RedemptionRecord record) {
        return byAddressKey.putIfAbsent(record.addressKey(), record) == null;
    }

    @Override
    public boolean rollback(RedemptionRecord record) {
        return byAddressKey.remove(record.addressKey(), record);
    }

    @Override
    public Optional<RedemptionRecord> findByAddressKey(String addressKey) {
        return Optional.ofNullable(byAddressKey.get(addressKey));
    }

    @Override
    public List<RedemptionRecord> findAll() {
        List<RedemptionRecord> all = new ArrayList<>(byAddressKey.values());
        all.sort(Comparator.comparingLong(RedemptionRecord::claimedAt));
        return all;
    }

    @Override
    public int count() {
        return byAddressKey.size();
    }
}
