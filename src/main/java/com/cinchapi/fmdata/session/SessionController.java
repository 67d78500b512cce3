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
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cinchapi.common.base.AnyStrings;
import com.cinchapi.fmdata.ErrorCode;
import com.cinchapi.fmdata.LoginRetriedTooFastException;
import com.cinchapi.fmdata.SessionException;
import com.cinchapi.fmdata.result.Message;
import com.cinchapi.fmdata.result.Result;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Ticker;

/**
 * Owns the session token that every authenticated call depends on.
 * <p>
 * All paths that may log in acquire the same lock, and the lock is held for
 * the state transition, the network login and the settling of the new state.
 * As a result, concurrent callers that find no active session trigger exactly
 * one login; the others wait for it and share its outcome.
 * </p>
 * <p>
 * If a cool-down is configured, an explicit {@link #ensureLoggedIn()} that
 * would start a login within the cool-down of the previous attempt fails with
 * a {@link LoginRetriedTooFastException} instead of contacting the remote
 * service again.
 * </p>
 *
 * @author Jeff Nelson
 */
@ThreadSafe
public final class SessionController {

    private static final Logger log = LoggerFactory
            .getLogger(SessionController.class);

    /**
     * Performs the network login and returns the new token.
     */
    private final Supplier<String> login;

    /**
     * The minimum time between two login attempts that go through the retry
     * guard, or {@code null} if the guard is disabled.
     */
    @Nullable
    private final Duration coolDown;

    /**
     * The source of time for the retry guard.
     */
    private final Ticker ticker;

    /**
     * Serializes login, invalidation and logout.
     */
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * The number of login attempts made so far.
     */
    private final AtomicLong attempts = new AtomicLong(0);

    /**
     * The number of login attempts that finished, successfully or not.
     */
    private final AtomicLong completed = new AtomicLong(0);

    private volatile SessionState state = SessionState.NO_SESSION;

    @Nullable
    private volatile String token = null;

    /**
     * The {@link #ticker} reading taken when the last login attempt finished.
     */
    @GuardedBy("lock")
    private long lastAttemptAt;

    /**
     * The failure of the most recent login attempt, shared with the callers
     * that waited for it.
     */
    @GuardedBy("lock")
    @Nullable
    private RuntimeException lastFailure = null;

    /**
     * Construct a new instance.
     *
     * @param login performs the network login and returns the token
     * @param coolDown the retry guard window; {@code null} or zero disables
     *            the guard
     */
    public SessionController(Supplier<String> login,
            @Nullable Duration coolDown) {
        this(login, coolDown, Ticker.systemTicker());
    }

    /**
     * Construct a new instance.
     *
     * @param login performs the network login and returns the token
     * @param coolDown the retry guard window; {@code null} or zero disables
     *            the guard
     * @param ticker
     */
    public SessionController(Supplier<String> login,
            @Nullable Duration coolDown, Ticker ticker) {
        this.login = login;
        this.coolDown = coolDown == null || coolDown.isZero()
                || coolDown.isNegative() ? null : coolDown;
        this.ticker = ticker;
    }

    /**
     * Run {@code op} with the active token, logging in first if necessary.
     * <p>
     * If the result reports an invalid token, the session is invalidated and
     * {@code op} is run exactly once more after a new login. A second invalid
     * token is terminal. Every other result, including one that carries a
     * business error, is returned unchanged.
     * </p>
     *
     * @param op the authenticated operation
     * @return the result of the last invocation of {@code op}
     * @throws SessionException if the login fails or the token is rejected
     *             twice
     */
    public <R extends Result> R callWithAutoRetry(Function<String, R> op) {
        String used = ensureLoggedIn(false);
        R result = op.apply(used);
        if(result.hasError(ErrorCode.INVALID_DATA_API_TOKEN)) {
            log.warn("The session token was rejected; logging in again");
            invalidate(used);
            used = ensureLoggedIn(false);
            result = op.apply(used);
            Message error = result.error(ErrorCode.INVALID_DATA_API_TOKEN)
                    .orElse(null);
            if(error != null) {
                invalidate(used);
                throw new SessionException(error);
            }
        }
        return result;
    }

    /**
     * Run {@code op} with the active token without ever logging in.
     *
     * @param op the authenticated operation
     * @return the result
     * @throws SessionException if there is no active session or the token is
     *             rejected
     */
    public <R extends Result> R call(Function<String, R> op) {
        String used = token;
        if(state != SessionState.ACTIVE || used == null) {
            throw new SessionException(
                    "There is no active session and automatic session management is disabled");
        }
        R result = op.apply(used);
        Message error = result.error(ErrorCode.INVALID_DATA_API_TOKEN)
                .orElse(null);
        if(error != null) {
            invalidate(used);
            throw new SessionException(error);
        }
        return result;
    }

    /**
     * Make sure there is an active session, subject to the retry guard.
     *
     * @return the active token
     * @throws LoginRetriedTooFastException if a login is needed within the
     *             cool-down of the previous attempt
     * @throws SessionException if the login fails
     */
    public String ensureLoggedIn() {
        return ensureLoggedIn(true);
    }

    /**
     * Make sure there is an active session.
     *
     * @param guard whether the retry guard applies
     * @return the active token
     */
    String ensureLoggedIn(boolean guard) {
        String current = token;
        if(state == SessionState.ACTIVE && current != null) {
            return current;
        }
        long observed = completed.get();
        lock.lock();
        try {
            current = token;
            if(state == SessionState.ACTIVE && current != null) {
                return current;
            }
            else if(completed.get() != observed && lastFailure != null) {
                // Another caller attempted the login while this one waited.
                throw lastFailure;
            }
            else if(guard && isWithinCoolDown()) {
                throw new LoginRetriedTooFastException(AnyStrings.format(
                        "A login was attempted less than {} ago", coolDown));
            }
            else {
                return login();
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Mark the session invalid if {@code used} is still the active token. A
     * stale token that was already replaced by another caller's login leaves
     * the session alone.
     *
     * @param used the token that was rejected
     */
    public void invalidate(String used) {
        lock.lock();
        try {
            if(state == SessionState.ACTIVE && Objects.equals(token, used)) {
                token = null;
                state = SessionState.INVALIDATED;
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Mark the active session invalid, whatever its token.
     */
    public void invalidate() {
        lock.lock();
        try {
            if(state == SessionState.ACTIVE) {
                token = null;
                state = SessionState.INVALIDATED;
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * End the active session by running {@code op} with its token. The token
     * is cleared whether or not {@code op} succeeds. If there is no active
     * session this does nothing.
     *
     * @param op the logout call
     * @return the result of {@code op} or {@code null} if there was no active
     *         session
     */
    @Nullable
    public <R extends Result> R logout(Function<String, R> op) {
        lock.lock();
        try {
            String current = token;
            if(state != SessionState.ACTIVE || current == null) {
                return null;
            }
            try {
                log.debug("Logging out of the active session");
                return op.apply(current);
            }
            finally {
                token = null;
                state = SessionState.NO_SESSION;
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Return {@code true} if a token is held and believed to be valid.
     *
     * @return a boolean
     */
    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }

    /**
     * Return the current {@link SessionState}.
     *
     * @return the state
     */
    public SessionState state() {
        return state;
    }

    /**
     * Return the number of login attempts made so far.
     *
     * @return the attempt count
     */
    @VisibleForTesting
    long loginAttempts() {
        return attempts.get();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("state", state)
                .add("attempts", attempts.get()).toString();
    }

    /**
     * Return {@code true} if the previous login attempt finished within the
     * {@link #coolDown}.
     *
     * @return a boolean
     */
    @GuardedBy("lock")
    private boolean isWithinCoolDown() {
        if(coolDown == null || attempts.get() == 0) {
            return false;
        }
        long elapsed = ticker.read() - lastAttemptAt;
        return elapsed < coolDown.toNanos();
    }

    /**
     * Perform the network login. The caller must hold the {@link #lock}.
     *
     * @return the new token
     */
    @GuardedBy("lock")
    private String login() {
        state = SessionState.LOGGING_IN;
        attempts.incrementAndGet();
        long start = ticker.read();
        try {
            String issued = login.get();
            token = issued;
            lastFailure = null;
            state = SessionState.ACTIVE;
            log.debug("Logged in after {} ms", TimeUnit.NANOSECONDS
                    .toMillis(ticker.read() - start));
            return issued;
        }
        catch (RuntimeException e) {
            token = null;
            lastFailure = e;
            state = SessionState.FAILED;
            log.debug("Login failed: {}", e.getMessage());
            throw e;
        }
        finally {
            lastAttemptAt = ticker.read();
            completed.incrementAndGet();
        }
    }

}
