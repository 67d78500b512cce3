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
package com.cinchapi.fmdata.paginate;

import java.util.Objects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.cinchapi.fmdata.ValidationException;
import com.google.common.base.MoreObjects;

/**
 * A half-open, 0-based {@code [start, stop)} range of records. A {@code null}
 * {@link #stop()} means the range is unbounded.
 *
 * @author Jeff Nelson
 */
@Immutable
public final class Window {

    /**
     * The {@link Window} that covers every record.
     */
    public static final Window ALL = new Window(0, null);

    /**
     * Return a {@link Window} for {@code [start, stop)}.
     *
     * @param start
     * @param stop
     * @return the window
     * @throws ValidationException if a bound is negative or {@code stop} is
     *             not greater than {@code start}
     */
    public static Window of(int start, @Nullable Integer stop) {
        check(start, stop);
        return new Window(start, stop);
    }

    /**
     * Validate slice bounds.
     *
     * @param start
     * @param stop
     */
    private static void check(int start, @Nullable Integer stop) {
        if(start < 0 || (stop != null && stop < 0)) {
            throw ValidationException.format(
                    "Slice bounds must not be negative: [{}, {})", start,
                    stop);
        }
        else if(stop != null && stop <= start) {
            throw ValidationException.format(
                    "Slice stop must be greater than start: [{}, {})", start,
                    stop);
        }
    }

    private final int start;

    @Nullable
    private final Integer stop;

    /**
     * Construct a new instance.
     *
     * @param start
     * @param stop
     */
    private Window(int start, @Nullable Integer stop) {
        this.start = start;
        this.stop = stop;
    }

    /**
     * Return the {@link Window} that results from slicing this one with
     * {@code [start, stop)}, where both bounds are relative to this window's
     * start. The result never extends past this window.
     *
     * @param start
     * @param stop
     * @return the composed window
     * @throws ValidationException if the bounds are invalid
     */
    public Window compose(int start, @Nullable Integer stop) {
        check(start, stop);
        if(this.stop != null) {
            int newStop = stop == null ? this.stop
                    : Math.min(this.stop, this.start + stop);
            int newStart = Math.min(newStop, this.start + start);
            return new Window(newStart, newStop);
        }
        else {
            return new Window(this.start + start,
                    stop == null ? null : this.start + stop);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof Window) {
            return start == ((Window) obj).start
                    && Objects.equals(stop, ((Window) obj).stop);
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, stop);
    }

    /**
     * Return {@code true} if this window can contain no records.
     *
     * @return a boolean
     */
    public boolean isEmpty() {
        return stop != null && stop <= start;
    }

    /**
     * Return the number of records this window can hold or {@code null} if
     * it is unbounded.
     *
     * @return the size
     */
    @Nullable
    public Integer size() {
        return stop == null ? null : stop - start;
    }

    public int start() {
        return start;
    }

    @Nullable
    public Integer stop() {
        return stop;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("start", start)
                .add("stop", stop).toString();
    }

}
