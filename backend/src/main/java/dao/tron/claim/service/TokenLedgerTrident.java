package dao.tron.claim.service;

import dao.tron.claim.config.NodeProperties;
import dao.tron.claim.config.TokenProperties;
import dao.tron.claim.model.TransferInstruction;
import dao.tron.claim.model.TransferResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.FunctionReturnDecoder;
import org.tron.trident.abi.TypeReference;
import org.tron.trident.abi.datatypes.Address;
import org.tron.trident.abi.datatypes.Bool;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.Type;
import org.tron.trident.abi.datatypes.generated.Uint256;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.core.NodeType;
import org.tron.trident.proto.Chain;
import org.tron.trident.proto.Response;
import org.tron.trident.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * TRC20 payouts signed with the distributor key. A transfer only counts as done once its receipt says SUCCESS;
 * a broadcast transaction without a receipt is reported as unconfirmed, never as rejected.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "token", name = "mode", havingValue = "trident")
public class TokenLedgerTrident implements TokenLedger {

    private final ApiWrapper wrapper;
    @Getter
    private final String distributorAddress;
    private final String tokenAddress;
    private final long feeLimit;
    private final NodeProperties.Polling polling;
    /**
     * Guard signing/broadcasting so concurrent claims don't trip over non-thread-safe internals.
     * Receipt polling is done outside this lock.
     */
    private final Object broadcastLock = new Object();

    public TokenLedgerTrident(NodeProperties nodeProps, TokenProperties tokenProps) {
        this.tokenAddress = tokenProps.getAddress();
        this.feeLimit = nodeProps.getFeeLimit();
        this.polling = nodeProps.getPolling();

        String privateKey = nodeProps.getPrivateKey();
        if (privateKey == null || privateKey.isBlank()) {
            log.warn("No distributor private key configured. Set DISTRIBUTOR_PRIVATE_KEY to enable payouts.");
            this.wrapper = null;
            this.distributorAddress = "NOT_CONFIGURED";
            return;
        }

        if (privateKey.length() % 2 != 0) {
            log.error("Invalid private key format: odd-length hex string");
            this.wrapper = null;
            this.distributorAddress = "INVALID_KEY_FORMAT";
            return;
        }

        ApiWrapper tempWrapper;
        String tempDistributor;
        try {
            String endpoint = nodeProps.getEndpoint();
            if (endpoint == null || endpoint.isBlank()) {
                tempWrapper = ApiWrapper.ofNile(privateKey);
            } else {
                tempWrapper = new ApiWrapper(endpoint, nodeProps.getSolidityEndpoint(), privateKey);
            }
            tempDistributor = tempWrapper.keyPair.toBase58CheckAddress();
            log.info("TokenLedgerTrident initialized: distributor={}, token={}", tempDistributor, tokenAddress);
        } catch (Exception e) {
            log.error("Failed to initialize: {}", e.getMessage());
            tempWrapper = null;
            tempDistributor = "INIT_FAILED";
        }

        this.wrapper = tempWrapper;
        this.distributorAddress = tempDistributor;
    }

    @Override
    public TransferResult transfer(TransferInstruction instruction) {
        return trc20Transfer(tokenAddress, instruction.to(), instruction.amount());
    }

    @Override
    public TransferResult sweep(String asset, String to, BigInteger amount) {
        return trc20Transfer(asset, to, amount);
    }

    @Override
    public BigInteger balanceOf(String asset, String holder) {
        requireWrapper();
        Function fn = new Function(
                "balanceOf",
                Collections.singletonList(new Address(holder)),
                Collections.singletonList(new TypeReference<Uint256>() {})
        );
        String encodedHex = FunctionEncoder.encode(fn);
        Response.TransactionExtention txn = wrapper.triggerConstantContract(
                distributorAddress,
                asset,
                encodedHex,
                NodeType.FULL_NODE
        );
        if (!txn.getResult().getResult() || txn.getConstantResultCount() == 0) {
            throw new IllegalStateException("balanceOf query failed: " + txn.getResult().getMessage().toStringUtf8());
        }
        String resultHex = Numeric.toHexString(txn.getConstantResult(0).toByteArray());
        @SuppressWarnings("rawtypes")
        List<Type> decoded = FunctionReturnDecoder.decode(resultHex, fn.getOutputParameters());
        if (decoded.isEmpty()) {
            throw new IllegalStateException("Unexpected balanceOf outputs=0");
        }
        return ((Uint256) decoded.get(0)).getValue();
    }

    private TransferResult trc20Transfer(String contract, String to, BigInteger amount) {
        if (wrapper == null) {
            log.error("TRC20 transfer skipped: ledger not configured (distributor={})", distributorAddress);
            return TransferResult.failed("Token ledger not configured");
        }
        // set once broadcast; from then on a missing receipt is not a rejection
        String txId = null;
        try {
            Function transferFn = new Function(
                    "transfer",
                    Arrays.asList(new Address(to), new Uint256(amount)),
                    Collections.singletonList(new TypeReference<Bool>() {})
            );
            String encodedHex = FunctionEncoder.encode(transferFn);

            Response.TransactionExtention txnExt = wrapper.triggerContract(
                    distributorAddress,
                    contract,
                    encodedHex,
                    0L,
                    0L,
                    null,
                    feeLimit
            );
            if (!txnExt.getResult().getResult()) {
                String msg = txnExt.getResult().getMessage().toStringUtf8();
                log.error("TRC20 transfer trigger failed: contract={}, to={}, error={}", contract, to, msg);
                return TransferResult.failed("transfer trigger failed: " + msg);
            }

            synchronized (broadcastLock) {
                Chain.Transaction signed = wrapper.signTransaction(txnExt);
                txId = wrapper.broadcastTransaction(signed);
            }

            Response.TransactionInfo txInfo = waitForTxInfo(
                    txId,
                    Duration.ofSeconds(polling.getTxInfoTimeoutSeconds()),
                    Duration.ofMillis(polling.getTxInfoPollInitialMs()),
                    Duration.ofMillis(polling.getTxInfoPollMaxMs())
            );
            if (txInfo == null) {
                log.error("TRC20 transfer has no TransactionInfo after timeout, outcome unknown: txId={}", txId);
                return TransferResult.unconfirmed(txId, "no TransactionInfo after timeout. txId=" + txId);
            }
            if (txInfo.getResult() != Response.TransactionInfo.code.SUCESS) {
                String errorMsg = txInfo.getResMessage() != null ? txInfo.getResMessage().toStringUtf8() : "Unknown error";
                log.error("TRC20 transfer failed on-chain: txId={}, error={}", txId, errorMsg);
                return TransferResult.failed(txId, "transfer failed on-chain: " + errorMsg + ". txId=" + txId);
            }

            log.info("TRC20 transfer SUCCESS: contract={}, to={}, amount={}, txId={}", contract, to, amount, txId);
            return TransferResult.ok(txId);
        } catch (Exception e) {
            if (txId != null) {
                log.error("TRC20 transfer outcome unknown after broadcast: contract={}, to={}, txId={}", contract, to, txId, e);
                return TransferResult.unconfirmed(txId, "receipt lookup failed: " + e.getMessage() + ". txId=" + txId);
            }
            log.error("TRC20 transfer failed: contract={}, to={}", contract, to, e);
            return TransferResult.failed("transfer failed: " + e.getMessage());
        }
    }

    private Response.TransactionInfo waitForTxInfo(String txId, Duration timeout, Duration pollInitial, Duration pollMax) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        long sleepMs = Math.max(100, pollInitial.toMillis());
        long maxSleepMs = Math.max(sleepMs, pollMax.toMillis());
        while (System.currentTimeMillis() < deadline) {
            try {
                Response.TransactionInfo info = wrapper.getTransactionInfoById(txId);
                if (info != null && !info.getId().isEmpty()) return info;
            } catch (Exception e) {
                // not yet indexed by the node
                log.debug("TransactionInfo not available yet: txId={}, reason={}", txId, e.getMessage());
            }
            try {
                long jitter = ThreadLocalRandom.current().nextLong(0, 150);
                Thread.sleep(sleepMs + jitter);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return null;
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        return null;
    }

    private void requireWrapper() {
        if (wrapper == null) {
            throw new IllegalStateException("Token ledger not configured (distributor=" + distributorAddress + ")");
        }
    }
}
