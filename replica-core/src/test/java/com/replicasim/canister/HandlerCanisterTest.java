package com.replicasim.canister;

import com.replicasim.types.CallReply;
import com.replicasim.types.CanisterCall;
import com.replicasim.types.EntryMode;
import com.replicasim.types.Env;
import com.replicasim.types.Message;
import com.replicasim.types.Principal;
import com.replicasim.types.RejectionCode;
import com.replicasim.types.RequestId;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives a HandlerCanister directly, without a replica, one message at a time.
 */
class HandlerCanisterTest {

    private static final Principal ID = Principal.of("wallet");
    private static final Principal OTHER = Principal.of("ledger");
    private static final Principal ALICE = Principal.of("alice");

    private static Message request(String method, long cycles) {
        return new Message.Request(RequestId.next(),
                Env.update(method).withSender(ALICE).withCyclesAvailable(cycles));
    }

    private static CallReply run(HandlerCanister canister, Message message) {
        CompletableFuture<CallReply> replySender = new CompletableFuture<>();
        canister.processMessage(message, replySender);
        return replySender.getNow(null);
    }

    @Test
    void acceptedCyclesAreKeptAndTheRestRefunded() {
        HandlerCanister canister = new HandlerCanister(ID, context -> {
            assertEquals(ALICE, context.caller());
            assertEquals(1_000, context.msgCyclesAvailable());
            assertEquals(300, context.msgCyclesAccept(300));
            context.reply("ok");
        });

        CallReply reply = run(canister, request("deposit", 1_000));

        assertEquals(CallReply.success("ok", 700), reply);
        assertEquals(300, canister.balance());
    }

    @Test
    void acceptIsCappedAtAvailableCycles() {
        HandlerCanister canister = new HandlerCanister(ID, context -> assertEquals(50, context.msgCyclesAccept(500)));

        CallReply reply = run(canister, request("deposit", 50));

        assertEquals(0, reply.cyclesRefunded());
        assertEquals(50, canister.balance());
    }

    @Test
    void requestWithoutExplicitReplyGetsEmptySuccess() {
        HandlerCanister canister = new HandlerCanister(ID, context -> { });

        CallReply reply = run(canister, request("noop", 40));

        assertEquals(CallReply.success(new byte[0], 40), reply);
    }

    @Test
    void rejectRefundsUnacceptedCycles() {
        HandlerCanister canister = new HandlerCanister(ID, context -> {
            context.msgCyclesAccept(10);
            context.reject("not today");
        });

        CallReply.Reject reject = (CallReply.Reject) run(canister, request("m", 100));

        assertEquals(RejectionCode.CANISTER_REJECT, reject.rejectionCode());
        assertEquals("not today", reject.rejectionMessage());
        assertEquals(90, reject.cyclesRefunded());
    }

    @Test
    void trapRollsBackAndRefundsEverything() {
        HandlerCanister canister = new HandlerCanister(ID, context -> {
            context.msgCyclesAccept(100);
            context.call(OTHER, "ping", "x");
            context.trap("boom");
        }, 500);

        CompletableFuture<CallReply> replySender = new CompletableFuture<>();
        List<CanisterCall> calls = canister.processMessage(request("m", 100), replySender);

        CallReply.Reject reject = (CallReply.Reject) replySender.join();
        assertEquals(RejectionCode.CANISTER_ERROR, reject.rejectionCode());
        assertTrue(reject.rejectionMessage().contains("boom"));
        assertEquals(100, reject.cyclesRefunded());
        assertTrue(calls.isEmpty());
        assertEquals(500, canister.balance());
    }

    @Test
    void callWithdrawsAttachedCycles() {
        AtomicReference<RequestId> issued = new AtomicReference<>();
        HandlerCanister canister = new HandlerCanister(ID, context -> {
            issued.set(context.call(OTHER, "pay", "1".getBytes(), 200));
            assertEquals(800, context.balance());
        }, 1_000);

        List<CanisterCall> calls = canister.processMessage(request("m", 0), new CompletableFuture<>());

        assertEquals(1, calls.size());
        CanisterCall call = calls.get(0);
        assertEquals(issued.get(), call.requestId());
        assertEquals(ID, call.sender());
        assertEquals(OTHER, call.callee());
        assertEquals(200, call.cycles());
        assertEquals(800, canister.balance());
    }

    @Test
    void callWithInsufficientBalanceTraps() {
        HandlerCanister canister = new HandlerCanister(ID, context -> context.call(OTHER, "pay", new byte[0], 10), 5);

        CallReply.Reject reject = (CallReply.Reject) run(canister, request("m", 0));

        assertEquals(RejectionCode.CANISTER_ERROR, reject.rejectionCode());
        assertTrue(reject.rejectionMessage().contains("Insufficient cycles"));
        assertEquals(5, canister.balance());
    }

    @Test
    void queriesCannotCall() {
        HandlerCanister canister = new HandlerCanister(ID, context -> context.call(OTHER, "x", ""));

        CompletableFuture<CallReply> replySender = new CompletableFuture<>();
        List<CanisterCall> calls = canister.processMessage(
                new Message.Request(RequestId.next(), Env.query("read")), replySender);

        assertTrue(calls.isEmpty());
        assertEquals(RejectionCode.CANISTER_ERROR, ((CallReply.Reject) replySender.join()).rejectionCode());
    }

    @Test
    void replyingTwiceTraps() {
        HandlerCanister canister = new HandlerCanister(ID, context -> {
            context.reply("one");
            context.reply("two");
        });

        assertFalse(run(canister, request("m", 0)).isSuccess());
    }

    @Test
    void lifecycleHooksAreDispatched() {
        List<EntryMode> seen = new ArrayList<>();
        CanisterHandler handler = new CanisterHandler() {
            @Override
            public void init(CanisterContext context) {
                seen.add(context.entryMode());
            }

            @Override
            public void heartbeat(CanisterContext context) {
                seen.add(context.entryMode());
            }

            @Override
            public void postUpgrade(CanisterContext context) {
                seen.add(context.entryMode());
            }

            @Override
            public void onRequest(CanisterContext context) {
                fail("no request expected");
            }
        };
        HandlerCanister canister = new HandlerCanister(ID, handler);

        assertTrue(run(canister, new Message.Request(RequestId.next(), Env.init())).isSuccess());
        assertTrue(run(canister, new Message.Request(RequestId.next(), Env.heartbeat())).isSuccess());
        assertTrue(run(canister, new Message.Request(RequestId.next(), Env.postUpgrade())).isSuccess());

        assertEquals(List.of(EntryMode.INIT, EntryMode.HEARTBEAT, EntryMode.POST_UPGRADE), seen);
    }

    @Test
    void customTaskRunsAndFailuresAreRejected() {
        HandlerCanister canister = new HandlerCanister(ID, context -> { });
        AtomicReference<String> ran = new AtomicReference<>();

        CallReply ok = run(canister, new Message.CustomTask(RequestId.next(), () -> ran.set("yes"),
                Env.customTask().withCyclesAvailable(9)));
        CallReply failed = run(canister, new Message.CustomTask(RequestId.next(), () -> {
            throw new Exception("task failed");
        }, Env.customTask().withCyclesAvailable(9)));

        assertEquals("yes", ran.get());
        assertEquals(CallReply.success(new byte[0], 9), ok);
        assertEquals(RejectionCode.CANISTER_ERROR, ((CallReply.Reject) failed).rejectionCode());
        assertEquals(9, failed.cyclesRefunded());
    }

    @Test
    void deferredReplyIsCompletedFromCallback() {
        AtomicReference<DeferredReply> pending = new AtomicReference<>();
        CanisterHandler handler = new CanisterHandler() {
            @Override
            public void onRequest(CanisterContext context) {
                context.call(OTHER, "fetch", "");
                pending.set(context.deferReply());
            }

            @Override
            public void onReply(RequestId requestId, CallReply reply, CanisterContext context) {
                assertEquals(OTHER, context.caller());
                assertEquals(EntryMode.REPLY_CALLBACK, context.entryMode());
                assertEquals(5, context.msgCyclesRefunded());
                pending.get().forward(reply);
            }
        };
        HandlerCanister canister = new HandlerCanister(ID, handler);

        CompletableFuture<CallReply> replySender = new CompletableFuture<>();
        List<CanisterCall> calls = canister.processMessage(request("proxy", 0), replySender);
        assertFalse(replySender.isDone());
        assertEquals(1, calls.size());

        List<CanisterCall> more = canister.processMessage(
                CallReply.success("data", 5).toMessage(calls.get(0).requestId()), null);

        assertTrue(more.isEmpty());
        assertEquals(CallReply.success("data", 0), replySender.join());
        assertEquals(5, canister.balance());
        assertTrue(pending.get().isDone());
        assertThrows(IllegalStateException.class, () -> pending.get().reply("again"));
    }

    @Test
    void requestWhoseCallerAlreadyHasAnOutcomeIsSkipped() {
        AtomicReference<String> ran = new AtomicReference<>();
        HandlerCanister canister = new HandlerCanister(ID, context -> {
            ran.set(context.methodName());
            context.msgCyclesAccept(context.msgCyclesAvailable());
        }, 20);
        CallReply timedOut = CallReply.reject(RejectionCode.SYS_TRANSIENT, "timed out", 100);
        CompletableFuture<CallReply> replySender = CompletableFuture.completedFuture(timedOut);

        List<CanisterCall> calls = canister.processMessage(request("deposit", 100), replySender);

        assertTrue(calls.isEmpty());
        assertNull(ran.get());
        assertEquals(20, canister.balance());
        assertSame(timedOut, replySender.join());
    }

    @Test
    void outcomeArrivingWhileRunningDropsTheMessageEffects() {
        CompletableFuture<CallReply> replySender = new CompletableFuture<>();
        CallReply timedOut = CallReply.reject(RejectionCode.SYS_TRANSIENT, "timed out", 100);
        HandlerCanister canister = new HandlerCanister(ID, context -> {
            context.msgCyclesAccept(100);
            context.call(OTHER, "pay", new byte[0], 10);
            replySender.complete(timedOut);
            context.reply("ok");
        }, 50);

        List<CanisterCall> calls = canister.processMessage(request("deposit", 100), replySender);

        assertTrue(calls.isEmpty());
        assertEquals(50, canister.balance());
        assertSame(timedOut, replySender.join());
    }

    private static CanisterHandler acceptThenForward(long accept, AtomicReference<DeferredReply> pending) {
        return new CanisterHandler() {
            @Override
            public void onRequest(CanisterContext context) {
                context.msgCyclesAccept(accept);
                context.call(OTHER, "fetch", "");
                pending.set(context.deferReply());
            }

            @Override
            public void onReply(RequestId requestId, CallReply reply, CanisterContext context) {
                pending.get().forward(reply);
            }
        };
    }

    @Test
    void deferredRequestKeepsAcceptedCyclesOnlyOnceAnswered() {
        AtomicReference<DeferredReply> pending = new AtomicReference<>();
        HandlerCanister canister = new HandlerCanister(ID, acceptThenForward(30, pending));

        CompletableFuture<CallReply> replySender = new CompletableFuture<>();
        List<CanisterCall> calls = canister.processMessage(request("proxy", 100), replySender);
        assertEquals(0, canister.balance());

        canister.processMessage(CallReply.success("data", 0).toMessage(calls.get(0).requestId()), null);

        assertEquals(CallReply.success("data", 70), replySender.join());
        assertEquals(30, canister.balance());
    }

    @Test
    void deferredAnswerAfterTimeoutIsDroppedWithoutCredit() {
        AtomicReference<DeferredReply> pending = new AtomicReference<>();
        HandlerCanister canister = new HandlerCanister(ID, acceptThenForward(30, pending));

        CompletableFuture<CallReply> replySender = new CompletableFuture<>();
        List<CanisterCall> calls = canister.processMessage(request("proxy", 100), replySender);
        CallReply timedOut = CallReply.reject(RejectionCode.SYS_TRANSIENT, "timed out", 100);
        replySender.complete(timedOut);

        List<CanisterCall> more = assertDoesNotThrow(() -> canister.processMessage(
                CallReply.success("data", 0).toMessage(calls.get(0).requestId()), null));

        assertTrue(more.isEmpty());
        assertSame(timedOut, replySender.join());
        assertEquals(0, canister.balance());
        assertTrue(pending.get().isDone());
    }

    @Test
    void deferredReplyCannotBeSentFromTheDeferringMessage() {
        HandlerCanister canister = new HandlerCanister(ID, context -> {
            context.msgCyclesAccept(10);
            context.deferReply().reply("now");
        });

        CallReply reply = run(canister, request("hurry", 40));

        assertEquals(RejectionCode.CANISTER_ERROR, ((CallReply.Reject) reply).rejectionCode());
        assertEquals(40, reply.cyclesRefunded());
        assertEquals(0, canister.balance());
    }

    @Test
    void refundSurvivesTrapInCallback() {
        CanisterHandler handler = new CanisterHandler() {
            @Override
            public void onRequest(CanisterContext context) {
                context.call(OTHER, "pay", new byte[0], 100);
            }

            @Override
            public void onReply(RequestId requestId, CallReply reply, CanisterContext context) {
                assertEquals(EntryMode.REJECT_CALLBACK, context.entryMode());
                context.trap("callback failed");
            }
        };
        HandlerCanister canister = new HandlerCanister(ID, handler, 100);
        List<CanisterCall> calls = canister.processMessage(request("m", 0), new CompletableFuture<>());
        assertEquals(0, canister.balance());

        canister.processMessage(CallReply.reject(RejectionCode.DESTINATION_INVALID, "gone", 100)
                .toMessage(calls.get(0).requestId()), null);

        assertEquals(100, canister.balance());
    }

    @Test
    void replyForUnknownCallIsIgnored() {
        HandlerCanister canister = new HandlerCanister(ID, context -> { }, 10);

        List<CanisterCall> calls = canister.processMessage(
                CallReply.success("x", 99).toMessage(RequestId.next()), null);

        assertTrue(calls.isEmpty());
        assertEquals(10, canister.balance());
    }

    @Test
    void timeComesFromClock() {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(2, 5), ZoneOffset.UTC);
        AtomicReference<Long> time = new AtomicReference<>();
        HandlerCanister canister = new HandlerCanister(ID, context -> time.set(context.time()), 0, clock);

        run(canister, request("m", 0));

        assertEquals(2_000_000_005L, time.get());
    }
}
