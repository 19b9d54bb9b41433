package dao.tron.claim.service;

import dao.tron.claim.config.TokenProperties;
import dao.tron.claim.model.TransferInstruction;
import dao.tron.claim.model.TransferResult;
import dao.tron.claim.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Balance book used for local runs and tests. The distributor pays every claim and sweep; a payout
 * larger than its balance is rejected.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "token", name = "mode", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryTokenLedger implements TokenLedger {

    // key: asset -> holder -> balance
    private final Map<String, Map<String, BigInteger>> balances = new HashMap<>();
    private final AtomicLong referenceSeq = new AtomicLong(1);
    private final String claimToken;
    private final String distributor;

    public InMemoryTokenLedger(TokenProperties tokenProps) {
        this.claimToken = tokenProps.getAddress();
        this.distributor = tokenProps.getDistributor();
        BigInteger supply = tokenProps.getInitialSupply();
        if (supply != null && supply.signum() > 0) {
            mint(claimToken, distributor, supply);
        }
        log.info("InMemoryTokenLedger initialized: token={}, distributor={}, supply={}", claimToken, distributor, supply);
    }

    @Override
    public TransferResult transfer(TransferInstruction instruction) {
        return move(claimToken, instruction.to(), instruction.amount());
    }

    @Override
    public TransferResult sweep(String asset, String to, BigInteger amount) {
        return move(asset, to, amount);
    }

    @Override
    public synchronized BigInteger balanceOf(String asset, String holder) {
        return balances.getOrDefault(key(asset), Map.of()).getOrDefault(key(holder), BigInteger.ZERO);
    }

    @Override
    public String getDistributorAddress() {
        return distributor;
    }

    /**
     * Credit {@code holder}; used to fund the distributor and to simulate assets sent to it by mistake.
     */
    public synchronized void mint(String asset, String holder, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Mint amount must be positive");
        }
        balances.computeIfAbsent(key(asset), k -> new HashMap<>())
                .merge(key(holder), amount, BigInteger::add);
    }

    private synchronized TransferResult move(String asset, String to, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            return TransferResult.failed("Amount must be positive");
        }
        Map<String, BigInteger> book = balances.computeIfAbsent(key(asset), k -> new HashMap<>());
        BigInteger available = book.getOrDefault(key(distributor), BigInteger.ZERO);
        if (available.compareTo(amount) < 0) {
            log.warn("Transfer rejected: asset={}, to={}, amount={}, distributorBalance={}", asset, to, amount, available);
            return TransferResult.failed("Insufficient distributor balance");
        }
        book.put(key(distributor), available.subtract(amount));
        book.merge(key(to), amount, BigInteger::add);
        return TransferResult.ok("local-" + referenceSeq.getAndIncrement());
    }

    private static String key(String holder) {
        if (holder == null) {
            throw new IllegalArgumentException("Holder is null");
        }
        return CryptoUtil.isValidAddress(holder) ? CryptoUtil.addressKey(holder) : holder;
    }
}
