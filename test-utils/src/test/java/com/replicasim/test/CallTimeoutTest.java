package com.replicasim.test;

import com.replicasim.canister.CanisterContext;
import com.replicasim.canister.CanisterHandler;
import com.replicasim.canister.DeferredReply;
import com.replicasim.config.ReplicaConfig;
import com.replicasim.types.CallReply;
import com.replicasim.types.Principal;
import com.replicasim.types.RejectionCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class CallTimeoutTest {

    @Test
    void lateReplyIsIgnoredAfterTimeout() {
        ReplicaConfig config = new ReplicaConfig().setCallTimeout(Duration.ofMillis(150));
        try (ReplicaTestKit kit = ReplicaTestKit.create(config)) {
            AtomicReference<DeferredReply> parked = new AtomicReference<>();
            kit.deploy("slow", context -> {
                if (context.methodName().equals("hold")) {
                    parked.set(context.deferReply());
                } else {
                    parked.get().reply("too late");
                }
            });
            RecordingHandler caller = RecordingHandler.wrap(new CanisterHandler() {
                @Override
                public void onRequest(CanisterContext context) {
                    context.call(Principal.of("slow"), "hold", new byte[0], 40);
                }
            });
            kit.deploy("caller", caller, 40);

            kit.call("caller", "go", "");
            AsyncAssertion.awaitValue(() -> caller.replies().size(), 1, kit.getDefaultTimeout());

            CallReply.Reject reject = (CallReply.Reject) caller.replies().get(0).outcome();
            assertEquals(RejectionCode.SYS_TRANSIENT, reject.rejectionCode());
            assertEquals(40, reject.cyclesRefunded());
            assertTrue(parked.get().isDone());

            assertTrue(kit.call("slow", "release", "").isSuccess());
            kit.awaitIdle();
            assertEquals(1, caller.replies().size());
            assertEquals(40, kit.balance("caller"));
        }
    }

    @Test
    void timedOutPaidCallCreatesNoCycles() {
        ReplicaConfig config = new ReplicaConfig().setCallTimeout(Duration.ofMillis(100));
        try (ReplicaTestKit kit = ReplicaTestKit.create(config)) {
            kit.deploy("slow", context -> {
                context.msgCyclesAccept(context.msgCyclesAvailable());
                context.reply("kept");
            });
            RecordingHandler caller = RecordingHandler.wrap(new CanisterHandler() {
                @Override
                public void onRequest(CanisterContext context) {
                    context.call(Principal.of("slow"), "pay", new byte[0], 100);
                }
            });
            kit.deploy("caller", caller, 100);
            long before = kit.totalBalance();

            kit.handle("slow").custom(() -> Thread.sleep(400));
            kit.call("caller", "go", "");
            AsyncAssertion.awaitValue(() -> caller.replies().size(), 1, kit.getDefaultTimeout());

            CallReply.Reject reject = (CallReply.Reject) caller.replies().get(0).outcome();
            assertEquals(RejectionCode.SYS_TRANSIENT, reject.rejectionCode());
            assertEquals(100, reject.cyclesRefunded());

            kit.awaitIdle();
            assertEquals(100, kit.balance("caller"));
            assertEquals(0, kit.balance("slow"));
            assertEquals(before, kit.totalBalance());
        }
    }

    @Test
    void noTimeoutByDefault() {
        assertTrue(new ReplicaConfig().getCallTimeout().isEmpty());
    }
}
