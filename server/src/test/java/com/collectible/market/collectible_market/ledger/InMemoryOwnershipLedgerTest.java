package com.collectible.market.collectible_market.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.collectible.market.collectible_market.error.ErrorCode;
import com.collectible.market.collectible_market.error.MarketException;
import com.collectible.market.collectible_market.execution.TransactionJournal;

class InMemoryOwnershipLedgerTest {

    private static final String OWNER = "0xowner";
    private static final String OPERATOR = "0xoperator";
    private static final String OTHER = "0xother";

    private final InMemoryOwnershipLedger ledger = new InMemoryOwnershipLedger(new TransactionJournal());

    @Test
    void mintsSequentialIdsFromZero() {
        assertThat(ledger.mint(OWNER, "ipfs://a")).isZero();
        assertThat(ledger.mint(OWNER, "ipfs://b")).isEqualTo(1);
        assertThat(ledger.tokenUri(1)).isEqualTo("ipfs://b");
        assertThat(ledger.ownerOf(0)).isEqualTo(OWNER);
    }

    @Test
    void unknownTokensAreNotFound() {
        assertThatThrownBy(() -> ledger.ownerOf(7))
                .isInstanceOf(MarketException.class)
                .extracting(e -> ((MarketException) e).getCode())
                .isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(ledger.exists(7)).isFalse();
    }

    @Nested
    class Transfers {

        @Test
        void ownerCanTransfer() {
            long id = ledger.mint(OWNER, "uri");

            ledger.transfer(OWNER, OWNER, OTHER, id);

            assertThat(ledger.ownerOf(id)).isEqualTo(OTHER);
        }

        @Test
        void unapprovedOperatorIsRejected() {
            long id = ledger.mint(OWNER, "uri");

            assertThatThrownBy(() -> ledger.transfer(OPERATOR, OWNER, OTHER, id))
                    .isInstanceOf(MarketException.class)
                    .extracting(e -> ((MarketException) e).getCode())
                    .isEqualTo(ErrorCode.NOT_APPROVED_OR_OWNER);
            assertThat(ledger.ownerOf(id)).isEqualTo(OWNER);
        }

        @Test
        void operatorApprovedForAllCanTransfer() {
            long id = ledger.mint(OWNER, "uri");
            ledger.setApprovalForAll(OWNER, OPERATOR, true);

            ledger.transfer(OPERATOR, OWNER, OTHER, id);

            assertThat(ledger.ownerOf(id)).isEqualTo(OTHER);
        }

        @Test
        void singleTokenApprovalIsClearedByTransfer() {
            long id = ledger.mint(OWNER, "uri");
            ledger.approve(OWNER, OPERATOR, id);

            ledger.transfer(OPERATOR, OWNER, OTHER, id);

            assertThat(ledger.getApproved(id)).isNull();
            assertThat(ledger.canOperate(OPERATOR, id)).isFalse();
        }

        @Test
        void wrongFromIsRejectedEvenForApprovedOperator() {
            long id = ledger.mint(OWNER, "uri");
            ledger.setApprovalForAll(OWNER, OPERATOR, true);

            assertThatThrownBy(() -> ledger.transfer(OPERATOR, OTHER, OPERATOR, id))
                    .isInstanceOf(MarketException.class)
                    .extracting(e -> ((MarketException) e).getCode())
                    .isEqualTo(ErrorCode.NOT_APPROVED_OR_OWNER);
        }
    }

    @Nested
    class Burns {

        @Test
        void burnRequiresApproval() {
            long id = ledger.mint(OWNER, "uri");

            assertThatThrownBy(() -> ledger.burn(OTHER, id))
                    .isInstanceOf(MarketException.class)
                    .extracting(e -> ((MarketException) e).getCode())
                    .isEqualTo(ErrorCode.NOT_APPROVED);
        }

        @Test
        void burnRemovesTokenAndUri() {
            long id = ledger.mint(OWNER, "uri");

            ledger.burn(OWNER, id);

            assertThat(ledger.exists(id)).isFalse();
            assertThatThrownBy(() -> ledger.tokenUri(id)).isInstanceOf(MarketException.class);
            assertThatThrownBy(() -> ledger.burn(OWNER, id))
                    .isInstanceOf(MarketException.class)
                    .extracting(e -> ((MarketException) e).getCode())
                    .isEqualTo(ErrorCode.NOT_FOUND);
        }
    }
}
