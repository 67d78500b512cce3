/*
 * Copyright (c) 2013-2025 Cinchapi Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.cinchapi.fmdata.session;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.junit.Assert;
import org.junit.Test;

import com.cinchapi.fmdata.ErrorCode;
import com.cinchapi.fmdata.LoginRetriedTooFastException;
import com.cinchapi.fmdata.SessionException;
import com.cinchapi.fmdata.result.Result;
import com.google.common.base.Ticker;
import com.google.common.collect.Lists;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Unit tests for {@link SessionController}.
 *
 * @author Jeff Nelson
 */
public class SessionControllerTest {

    /**
     * A {@link Ticker} that only moves when told to.
     */
    private static final class ManualTicker extends Ticker {

        private final AtomicLong nanos = new AtomicLong(0);

        void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }

        @Override
        public long read() {
            return nanos.get();
        }

    }

    /**
     * A login that issues {@code token-1}, {@code token-2}, ... and counts
     * its calls.
     */
    private static final class CountingLogin implements Supplier<String> {

        private final AtomicInteger calls = new AtomicInteger(0);

        @Override
        public String get() {
            return "token-" + calls.incrementAndGet();
        }

    }

    private static Result result(int code) {
        JsonObject message = new JsonObject();
        message.addProperty("code", String.valueOf(code));
        message.addProperty("message", code == 0 ? "OK" : "Error " + code);
        JsonArray messages = new JsonArray();
        messages.add(message);
        JsonObject raw = new JsonObject();
        raw.add("messages", messages);
        raw.add("response", new JsonObject());
        return new Result(raw);
    }

    @Test
    public void testLogsInLazily() {
        CountingLogin login = new CountingLogin();
        SessionController session = new SessionController(login, null);
        Assert.assertEquals(SessionState.NO_SESSION, session.state());
        Assert.assertEquals(0, login.calls.get());
        List<String> used = Lists.newArrayList();
        session.callWithAutoRetry(token -> {
            used.add(token);
            return result(0);
        });
        session.callWithAutoRetry(token -> {
            used.add(token);
            return result(0);
        });
        Assert.assertEquals(Lists.newArrayList("token-1", "token-1"), used);
        Assert.assertEquals(1, login.calls.get());
        Assert.assertTrue(session.isActive());
    }

    @Test
    public void testInvalidTokenIsRetriedOnce() {
        CountingLogin login = new CountingLogin();
        SessionController session = new SessionController(login, null);
        List<String> used = Lists.newArrayList();
        Result result = session.callWithAutoRetry(token -> {
            used.add(token);
            return used.size() == 1
                    ? result(ErrorCode.INVALID_DATA_API_TOKEN.code())
                    : result(0);
        });
        Assert.assertFalse(result.hasErrors());
        Assert.assertEquals(Lists.newArrayList("token-1", "token-2"), used);
        Assert.assertEquals(2, session.loginAttempts());
    }

    @Test
    public void testSecondInvalidTokenIsTerminal() {
        CountingLogin login = new CountingLogin();
        SessionController session = new SessionController(login, null);
        AtomicInteger calls = new AtomicInteger(0);
        try {
            session.callWithAutoRetry(token -> {
                calls.incrementAndGet();
                return result(ErrorCode.INVALID_DATA_API_TOKEN.code());
            });
            Assert.fail();
        }
        catch (SessionException e) {
            Assert.assertEquals(ErrorCode.INVALID_DATA_API_TOKEN.code(),
                    e.error().code());
        }
        Assert.assertEquals(2, calls.get());
        Assert.assertEquals(SessionState.INVALIDATED, session.state());
    }

    @Test
    public void testBusinessErrorIsNotRetried() {
        CountingLogin login = new CountingLogin();
        SessionController session = new SessionController(login, null);
        AtomicInteger calls = new AtomicInteger(0);
        Result result = session.callWithAutoRetry(token -> {
            calls.incrementAndGet();
            return result(ErrorCode.RECORD_MISSING.code());
        });
        Assert.assertTrue(result.hasError(ErrorCode.RECORD_MISSING));
        Assert.assertEquals(1, calls.get());
        Assert.assertTrue(session.isActive());
    }

    @Test
    public void testCallNeedsActiveSession() {
        CountingLogin login = new CountingLogin();
        SessionController session = new SessionController(login, null);
        try {
            session.call(token -> result(0));
            Assert.fail();
        }
        catch (SessionException e) {
            Assert.assertEquals(0, login.calls.get());
        }
        session.ensureLoggedIn();
        Assert.assertFalse(session.call(token -> result(0)).hasErrors());
    }

    @Test
    public void testCallDoesNotRetryInvalidToken() {
        CountingLogin login = new CountingLogin();
        SessionController session = new SessionController(login, null);
        session.ensureLoggedIn();
        try {
            session.call(token -> result(
                    ErrorCode.INVALID_DATA_API_TOKEN.code()));
            Assert.fail();
        }
        catch (SessionException e) {
            Assert.assertEquals(SessionState.INVALIDATED, session.state());
        }
        Assert.assertEquals(1, login.calls.get());
    }

    @Test
    public void testStaleInvalidationIsIgnored() {
        CountingLogin login = new CountingLogin();
        SessionController session = new SessionController(login, null);
        session.ensureLoggedIn();
        session.invalidate();
        String current = session.ensureLoggedIn();
        session.invalidate("token-1");
        Assert.assertTrue(session.isActive());
        Assert.assertEquals("token-2", current);
        session.invalidate(current);
        Assert.assertEquals(SessionState.INVALIDATED, session.state());
    }

    @Test
    public void testFailedLoginIsGuardedByCoolDown() {
        ManualTicker ticker = new ManualTicker();
        AtomicInteger calls = new AtomicInteger(0);
        SessionController session = new SessionController(() -> {
            if(calls.incrementAndGet() == 1) {
                throw new SessionException("Invalid user account");
            }
            return "token";
        }, Duration.ofSeconds(5), ticker);
        try {
            session.ensureLoggedIn();
            Assert.fail();
        }
        catch (SessionException e) {
            Assert.assertEquals(SessionState.FAILED, session.state());
        }
        ticker.advance(Duration.ofSeconds(1));
        try {
            session.ensureLoggedIn();
            Assert.fail();
        }
        catch (LoginRetriedTooFastException e) {
            Assert.assertEquals(1, calls.get());
        }
        ticker.advance(Duration.ofSeconds(5));
        Assert.assertEquals("token", session.ensureLoggedIn());
    }

    @Test
    public void testAutomaticLoginBypassesCoolDown() {
        ManualTicker ticker = new ManualTicker();
        CountingLogin login = new CountingLogin();
        SessionController session = new SessionController(login,
                Duration.ofSeconds(5), ticker);
        session.ensureLoggedIn();
        session.invalidate();
        Assert.assertFalse(
                session.callWithAutoRetry(token -> result(0)).hasErrors());
        Assert.assertEquals(2, login.calls.get());
    }

    @Test
    public void testConcurrentCallersShareOneLogin() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger(0);
        SessionController session = new SessionController(() -> {
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "shared";
        }, null);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = Lists.newArrayList();
            futures.add(executor.submit(() -> session.ensureLoggedIn(false)));
            Assert.assertTrue(entered.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 7; ++i) {
                futures.add(
                        executor.submit(() -> session.ensureLoggedIn(false)));
            }
            release.countDown();
            for (Future<String> future : futures) {
                Assert.assertEquals("shared",
                        future.get(5, TimeUnit.SECONDS));
            }
        }
        finally {
            executor.shutdownNow();
        }
        Assert.assertEquals(1, calls.get());
    }

    @Test
    public void testWaitersShareLoginFailure() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger(0);
        SessionController session = new SessionController(() -> {
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new SessionException("Invalid user account");
        }, null);
        int waiters = 4;
        CountDownLatch ready = new CountDownLatch(waiters);
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(waiters + 1);
        try {
            List<Future<?>> futures = Lists.newArrayList();
            futures.add(executor.submit(() -> {
                try {
                    session.ensureLoggedIn(false);
                }
                catch (SessionException e) {
                    failures.add(e);
                }
            }));
            Assert.assertTrue(entered.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < waiters; ++i) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    try {
                        session.ensureLoggedIn(false);
                    }
                    catch (SessionException e) {
                        failures.add(e);
                    }
                }));
            }
            Assert.assertTrue(ready.await(5, TimeUnit.SECONDS));
            Thread.sleep(200);
            release.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        }
        finally {
            executor.shutdownNow();
        }
        Assert.assertEquals(waiters + 1, failures.size());
        Assert.assertEquals(1, calls.get());
        Assert.assertEquals(SessionState.FAILED, session.state());
    }

    @Test
    public void testLogout() {
        CountingLogin login = new CountingLogin();
        SessionController session = new SessionController(login, null);
        Assert.assertNull(session.logout(token -> result(0)));
        session.ensureLoggedIn();
        List<String> used = Lists.newArrayList();
        Result result = session.logout(token -> {
            used.add(token);
            return result(0);
        });
        Assert.assertFalse(result.hasErrors());
        Assert.assertEquals(Lists.newArrayList("token-1"), used);
        Assert.assertEquals(SessionState.NO_SESSION, session.state());
    }

    @Test
    public void testLogoutClearsTokenEvenIfCallFails() {
        CountingLogin login = new CountingLogin();
        SessionController session = new SessionController(login, null);
        session.ensureLoggedIn();
        try {
            session.logout(token -> {
                throw new IllegalStateException("unreachable");
            });
            Assert.fail();
        }
        catch (IllegalStateException e) {
            Assert.assertFalse(session.isActive());
        }
    }

}
