package com.schemeengine.ledger;

import com.schemeengine.common.exception.InsufficientAllowanceException;
import com.schemeengine.common.exception.InsufficientBalanceException;
import com.schemeengine.common.exception.InvalidTransferException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the share ledger bookkeeping.
 */
class ShareLedgerTest {

    private ShareLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new ShareLedger("ledger-1");
    }

    @Test
    void testMintAndBurnKeepSupplyInSync() {
        ledger.mint("alice", BigInteger.valueOf(100));
        ledger.mint("bob", BigInteger.valueOf(200));
        ledger.burn("alice", BigInteger.valueOf(40));

        assertEquals(BigInteger.valueOf(60), ledger.balanceOf("alice"));
        assertEquals(BigInteger.valueOf(260), ledger.getTotalSupply());
        assertTrue(ledger.isConsistent());
    }

    @Test
    void testParticipantsAreDeduplicated() {
        ledger.mint("alice", BigInteger.TEN);
        ledger.mint("bob", BigInteger.TEN);
        ledger.mint("alice", BigInteger.TEN);
        ledger.transfer("bob", "alice", BigInteger.ONE);
        ledger.transfer("alice", "carol", BigInteger.ONE);

        assertEquals(List.of("alice", "bob", "carol"), ledger.getParticipants());
    }

    @Test
    void testBurnMoreThanBalanceLeavesLedgerUntouched() {
        ledger.mint("alice", BigInteger.valueOf(50));

        assertThrows(InsufficientBalanceException.class,
            () -> ledger.burn("alice", BigInteger.valueOf(51)));

        assertEquals(BigInteger.valueOf(50), ledger.balanceOf("alice"));
        assertEquals(BigInteger.valueOf(50), ledger.getTotalSupply());
    }

    @Test
    void testSelfTransferRejectedRegardlessOfBalance() {
        ledger.mint("alice", BigInteger.valueOf(100));

        assertThrows(InvalidTransferException.class,
            () -> ledger.transfer("alice", "alice", BigInteger.ONE));
        assertThrows(InvalidTransferException.class,
            () -> ledger.transfer("nobody", "nobody", BigInteger.ZERO));

        assertEquals(BigInteger.valueOf(100), ledger.balanceOf("alice"));
    }

    @Test
    void testTransferToBlankRecipientRejected() {
        ledger.mint("alice", BigInteger.valueOf(100));

        assertThrows(InvalidTransferException.class,
            () -> ledger.transfer("alice", null, BigInteger.ONE));
        assertThrows(InvalidTransferException.class,
            () -> ledger.transfer("alice", " ", BigInteger.ONE));
    }

    @Test
    void testTransferMovesBalance() {
        ledger.mint("alice", BigInteger.valueOf(100));

        ledger.transfer("alice", "bob", BigInteger.valueOf(30));

        assertEquals(BigInteger.valueOf(70), ledger.balanceOf("alice"));
        assertEquals(BigInteger.valueOf(30), ledger.balanceOf("bob"));
        assertEquals(BigInteger.valueOf(100), ledger.getTotalSupply());
        assertTrue(ledger.isConsistent());
    }

    @Test
    void testTransferFromConsumesAllowance() {
        ledger.mint("alice", BigInteger.valueOf(100));
        ledger.approve("alice", "broker", BigInteger.valueOf(50));

        ledger.transferFrom("broker", "alice", "bob", BigInteger.valueOf(20));

        assertEquals(BigInteger.valueOf(30), ledger.allowance("alice", "broker"));
        assertEquals(BigInteger.valueOf(20), ledger.balanceOf("bob"));
    }

    @Test
    void testTransferFromAboveAllowanceChangesNothing() {
        ledger.mint("alice", BigInteger.valueOf(100));
        ledger.approve("alice", "broker", BigInteger.valueOf(10));

        assertThrows(InsufficientAllowanceException.class,
            () -> ledger.transferFrom("broker", "alice", "bob", BigInteger.valueOf(11)));

        assertEquals(BigInteger.valueOf(100), ledger.balanceOf("alice"));
        assertEquals(BigInteger.ZERO, ledger.balanceOf("bob"));
        assertEquals(BigInteger.valueOf(10), ledger.allowance("alice", "broker"));
        assertEquals(List.of("alice"), ledger.getParticipants());
    }

    @Test
    void testUnlimitedAllowanceIsNeverDecremented() {
        ledger.mint("alice", BigInteger.valueOf(100));
        ledger.approve("alice", "broker", ShareLedger.UNLIMITED_ALLOWANCE);

        ledger.transferFrom("broker", "alice", "bob", BigInteger.valueOf(60));

        assertEquals(ShareLedger.UNLIMITED_ALLOWANCE, ledger.allowance("alice", "broker"));
    }

    @Test
    void testApproveOverwritesPreviousAllowance() {
        ledger.approve("alice", "broker", BigInteger.valueOf(50));
        ledger.approve("alice", "broker", BigInteger.valueOf(5));

        assertEquals(BigInteger.valueOf(5), ledger.allowance("alice", "broker"));
    }

    @Test
    void testNegativeAmountsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ledger.mint("alice", BigInteger.valueOf(-1)));
        assertThrows(IllegalArgumentException.class,
            () -> ledger.approve("alice", "broker", BigInteger.valueOf(-1)));
    }
}
