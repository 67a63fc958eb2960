package org.httpstub;

import org.httpstub.config.StubConfig;
import org.httpstub.interfaces.PortSelector;
import org.httpstub.server.BindExhaustedException;
import org.httpstub.server.HttpStub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.BindException;
import java.net.ServerSocket;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.httpstub.NetTestUtils.HTTP;
import static org.httpstub.NetTestUtils.get;
import static org.junit.jupiter.api.Assertions.*;

class HttpStubBindingTest {

    private static final StubConfig LOOPBACK =
            new StubConfig("127.0.0.1", 1, 65535, 5, 5_000, 2_000L);

    private final List<ServerSocket> occupied = new ArrayList<>();

    @AfterEach
    void releasePorts() throws IOException {
        for (ServerSocket ss : occupied) ss.close();
    }

    private int occupy() throws IOException {
        ServerSocket ss = NetTestUtils.occupyPort();
        occupied.add(ss);
        return ss.getLocalPort();
    }

    @Test
    void retriesPastOccupiedPorts() throws Exception {
        Deque<Integer> candidates = new ArrayDeque<>();
        for (int i = 0; i < 4; i++) candidates.add(occupy());
        int free = NetTestUtils.freePort();
        candidates.add(free);

        AtomicInteger picks = new AtomicInteger();
        PortSelector selector = (min, max) -> {
            picks.incrementAndGet();
            return candidates.poll();
        };

        try (HttpStub stub = new HttpStub(ctx -> ctx.response().body("bound"), 1, LOOPBACK, selector)) {
            assertEquals(5, picks.get());
            assertEquals(free, stub.port());
            assertEquals("http://127.0.0.1:" + free + "/", stub.uri().toString());

            assertEquals("bound", HTTP.bodyOf(get(stub.uri(), "/")));
            assertTrue(stub.awaitCompletion(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void givesUpAfterFiveContendedAttempts() throws Exception {
        int taken = occupy();
        AtomicInteger picks = new AtomicInteger();

        BindExhaustedException e = assertThrows(BindExhaustedException.class,
                () -> new HttpStub(ctx -> {}, 1, LOOPBACK, (min, max) -> {
                    picks.incrementAndGet();
                    return taken;
                }));

        assertEquals(5, picks.get());
        assertEquals(5, e.attempts());
        assertInstanceOf(BindException.class, e.getCause());
    }

    @Test
    void attemptBoundComesFromConfig() throws Exception {
        int taken = occupy();
        AtomicInteger picks = new AtomicInteger();

        assertThrows(BindExhaustedException.class,
                () -> new HttpStub(ctx -> {}, 1, LOOPBACK.withMaxBindAttempts(2), (min, max) -> {
                    picks.incrementAndGet();
                    return taken;
                }));

        assertEquals(2, picks.get());
    }

    @Test
    void selectorIsAskedWithinConfiguredRange() throws Exception {
        int free = NetTestUtils.freePort();
        List<int[]> ranges = new ArrayList<>();
        try (HttpStub stub = new HttpStub(ctx -> {}, 1, LOOPBACK.withPortRange(free, free), (min, max) -> {
            ranges.add(new int[]{min, max});
            return min;
        })) {
            assertEquals(free, stub.port());
            assertEquals(1, ranges.size());
            assertArrayEquals(new int[]{free, free}, ranges.get(0));
        }
    }
}
