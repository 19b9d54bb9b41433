package dao.tron.claim.service;

import dao.tron.claim.config.TokenProperties;
import dao.tron.claim.model.TransferInstruction;
import dao.tron.claim.model.TransferResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTokenLedgerTest {

    private static final String TOKEN = "TR7NHqjeKQxGTCi8q8ZY4pL8otSzgjLj6t";
    private static final String FOREIGN = "TXYZopYRdj2D9XRtbG411XZZ3kM5VkAeBf";
    private static final String BOB = "TToEDBXQkGuYGsnyJASTM5JZweb7Rvrnfn";
    private static final String BOB_HEX = "41c38f1d1d75ad46fdc007be94da081a5091bb25cd";

    private InMemoryTokenLedger tokenLedger;

    @BeforeEach
    void setUp() {
        TokenProperties props = new TokenProperties();
        props.setAddress(TOKEN);
        props.setInitialSupply(BigInteger.valueOf(100));
        tokenLedger = new InMemoryTokenLedger(props);
    }

    @Test
    @DisplayName("Transfer moves claim token from distributor to recipient")
    void testTransfer() {
        TransferResult result = tokenLedger.transfer(new TransferInstruction(BOB, BigInteger.valueOf(30)));

        assertTrue(result.success());
        assertNotNull(result.reference());
        assertEquals(BigInteger.valueOf(30), tokenLedger.balanceOf(TOKEN, BOB));
        assertEquals(BigInteger.valueOf(30), tokenLedger.balanceOf(TOKEN, BOB_HEX));
        assertEquals(BigInteger.valueOf(70), tokenLedger.balanceOf(TOKEN, "distributor"));
    }

    @Test
    @DisplayName("Insufficient distributor balance is reported, not thrown")
    void testInsufficientBalance() {
        TransferResult result = tokenLedger.transfer(new TransferInstruction(BOB, BigInteger.valueOf(101)));

        assertFalse(result.success());
        assertEquals(BigInteger.ZERO, tokenLedger.balanceOf(TOKEN, BOB));
        assertEquals(BigInteger.valueOf(100), tokenLedger.balanceOf(TOKEN, "distributor"));
        assertFalse(tokenLedger.transfer(new TransferInstruction(BOB, BigInteger.ZERO)).success());
    }

    @Test
    @DisplayName("Sweep moves foreign assets held by the distributor")
    void testSweep() {
        tokenLedger.mint(FOREIGN, "distributor", BigInteger.valueOf(5));

        assertTrue(tokenLedger.sweep(FOREIGN, BOB, BigInteger.valueOf(5)).success());
        assertEquals(BigInteger.valueOf(5), tokenLedger.balanceOf(FOREIGN, BOB));
        assertFalse(tokenLedger.sweep(FOREIGN, BOB, BigInteger.ONE).success());
        assertEquals(BigInteger.valueOf(100), tokenLedger.balanceOf(TOKEN, "distributor"));
    }
}
