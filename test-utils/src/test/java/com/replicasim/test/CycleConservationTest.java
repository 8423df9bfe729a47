package com.replicasim.test;

import com.replicasim.canister.CanisterContext;
import com.replicasim.canister.CanisterHandler;
import com.replicasim.types.CallReply;
import com.replicasim.types.Principal;
import com.replicasim.types.RejectionCode;
import com.replicasim.types.RequestId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cycles move between balances and callers but are never created or lost, whatever the
 * outcome of the calls carrying them.
 */
@Timeout(value = 60, unit = TimeUnit.SECONDS)
class CycleConservationTest {

    /**
     * Keeps what it is sent and pays four canisters, each of which handles the payment differently.
     */
    static class Hub implements CanisterHandler {
        @Override
        public void onRequest(CanisterContext context) {
            context.msgCyclesAccept(context.msgCyclesAvailable());
            context.call(Principal.of("keeper"), "pay", new byte[0], 300);
            context.call(Principal.of("ghost"), "pay", new byte[0], 200);
            context.call(Principal.of("trapper"), "pay", new byte[0], 150);
            context.call(Principal.of("rejecter"), "pay", new byte[0], 50);
        }
    }

    @Test
    void refundsAndBalancesAddUp() {
        try (ReplicaTestKit kit = ReplicaTestKit.create()) {
            kit.deploy("hub", new Hub(), 20_000);
            kit.deploy("keeper", context -> context.msgCyclesAccept(100), 1_000);
            kit.deploy("trapper", context -> {
                context.msgCyclesAccept(150);
                context.trap("refusing payment");
            });
            kit.deploy("rejecter", context -> {
                context.msgCyclesAccept(20);
                context.reject("partial");
            });
            long before = kit.totalBalance();

            long sent = 0;
            long refunded = 0;
            for (int i = 0; i < 20; i++) {
                long payment = 100 + i;
                CallReply reply = kit.call("hub", "spread", "", payment);
                assertTrue(reply.isSuccess());
                sent += payment;
                refunded += reply.cyclesRefunded();
            }
            kit.awaitIdle();

            assertEquals(0, refunded);
            assertEquals(before + sent - refunded, kit.totalBalance());
            assertEquals(1_000 + 20 * 100, kit.balance("keeper"));
            assertEquals(0, kit.balance("trapper"));
            assertEquals(20 * 20, kit.balance("rejecter"));
            assertEquals(20 * 200, kit.replica().metrics().getCyclesRefunded());
        }
    }

    @Test
    void unacceptedCyclesReturnToExternalCaller() {
        try (ReplicaTestKit kit = ReplicaTestKit.create()) {
            kit.deploy("half", context -> context.msgCyclesAccept(context.msgCyclesAvailable() / 2));

            CallReply reply = kit.call("half", "m", "", 1_001);
            CallReply missing = kit.call("nobody", "m", "", 500);

            assertEquals(501, reply.cyclesRefunded());
            assertEquals(500, kit.balance("half"));
            assertEquals(RejectionCode.DESTINATION_INVALID, ((CallReply.Reject) missing).rejectionCode());
            assertEquals(500, missing.cyclesRefunded());
        }
    }

    @Test
    void callbackSeesRefundOfRejectedCall() {
        try (ReplicaTestKit kit = ReplicaTestKit.create()) {
            RecordingHandler payer = RecordingHandler.wrap(new CanisterHandler() {
                @Override
                public void onRequest(CanisterContext context) {
                    context.call(Principal.of("ghost"), "pay", new byte[0], 70);
                }

                @Override
                public void onReply(RequestId requestId, CallReply reply, CanisterContext context) {
                    assertEquals(70, context.msgCyclesRefunded());
                    assertEquals(100, context.balance());
                }
            });
            kit.deploy("payer", payer, 100);

            kit.call("payer", "go", "");
            AsyncAssertion.awaitValue(() -> payer.replies().size(), 1, kit.getDefaultTimeout());

            CallReply outcome = payer.replies().get(0).outcome();
            assertEquals(RejectionCode.DESTINATION_INVALID, ((CallReply.Reject) outcome).rejectionCode());
            assertEquals(100, kit.balance("payer"));
        }
    }
}
