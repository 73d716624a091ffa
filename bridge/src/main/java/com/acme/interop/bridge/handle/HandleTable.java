package com.acme.interop.bridge.handle;

import com.acme.interop.bridge.util.BridgeDefaults;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Striped table of strongly held objects addressed by generation-stamped {@link Handle}s.
 *
 * <p>Slots are split across N independent stripes, each guarded by its own lock. A handle's
 * index encodes both the stripe ({@code index & mask}) and the slot inside it
 * ({@code index >>> shift}). Registration prefers the calling thread's stripe and tries all
 * others before reporting exhaustion.</p>
 *
 * <p>Every slot carries a reference count. {@link #register} starts it at one,
 * {@link #retain} adds one, {@link #release} drops one and frees the slot at zero. Freeing bumps
 * the slot generation, so every outstanding copy of the handle turns stale at once. Releasing a
 * stale handle is a no-op that reports {@link ReleaseResult#STALE}.</p>
 */
public final class HandleTable implements ReleaseSink {
    private static final Logger LOG = Logger.getLogger(HandleTable.class.getName());
    private static final int FIRST_GENERATION = 1;
    private static final int RETIRED_GENERATION = Integer.MAX_VALUE;

    private final Stripe[] stripes;
    private final int mask;
    private final int shift;
    private final int capacity;
    private final BiConsumer<Handle, Object> freedListener;
    private final AtomicLong registerCount = new AtomicLong();
    private final AtomicLong releaseCount = new AtomicLong();
    private final AtomicLong staleReleaseCount = new AtomicLong();
    private final AtomicLong exhaustedCount = new AtomicLong();

    public HandleTable(int capacity, int stripeCount) {
        this(capacity, stripeCount, null);
    }

    /**
     * @param freedListener invoked outside any lock after a slot is freed, with the handle that
     *                      just turned stale and the object it held; may be {@code null}
     */
    public HandleTable(int capacity, int stripeCount, BiConsumer<Handle, Object> freedListener) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive, got " + stripeCount);
        }
        if ((stripeCount & (stripeCount - 1)) != 0) {
            throw new IllegalArgumentException("stripeCount must be a power of two, got " + stripeCount);
        }
        if (capacity < stripeCount) {
            throw new IllegalArgumentException(
                "capacity (" + capacity + ") must be >= stripeCount (" + stripeCount + ")");
        }
        if (capacity > BridgeDefaults.MAX_HANDLE_CAPACITY) {
            throw new IllegalArgumentException(
                "capacity (" + capacity + ") exceeds maximum " + BridgeDefaults.MAX_HANDLE_CAPACITY);
        }

        int perStripe = capacity / stripeCount;
        this.mask = stripeCount - 1;
        this.shift = Integer.numberOfTrailingZeros(stripeCount);
        this.capacity = perStripe * stripeCount;
        this.freedListener = freedListener;
        this.stripes = new Stripe[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new Stripe(i, perStripe);
        }
    }

    public RegisterResult tryRegister(Object object) {
        Objects.requireNonNull(object, "object");
        int preferred = (int) (Thread.currentThread().getId() & mask);
        for (int i = 0; i <= mask; i++) {
            int stripe = (preferred + i) & mask;
            Handle handle = stripes[stripe].register(object, shift);
            if (handle != null) {
                registerCount.incrementAndGet();
                return new RegisterResult.Registered(handle);
            }
        }
        exhaustedCount.incrementAndGet();
        return new RegisterResult.Exhausted(liveCount(), capacity);
    }

    /**
     * Registers {@code object} and returns its handle. The table keeps the object strongly
     * reachable until the handle is released.
     *
     * @throws HandleTableExhaustedException if no stripe has a free slot
     */
    public Handle register(Object object) {
        RegisterResult result = tryRegister(object);
        if (result instanceof RegisterResult.Registered registered) {
            return registered.handle();
        }
        LOG.warning("Handle table exhausted capacity=" + capacity);
        throw new HandleTableExhaustedException(capacity);
    }

    /**
     * @throws StaleHandleException if the slot is empty or its generation differs
     */
    public Object resolve(Handle handle) {
        Objects.requireNonNull(handle, "handle");
        Stripe stripe = stripeOf(handle);
        Object value = stripe == null ? null : stripe.get(handle.index() >>> shift, handle.generation());
        if (value == null) {
            throw new StaleHandleException(handle.toRaw());
        }
        return value;
    }

    public Object resolve(long rawHandle) {
        return resolve(Handle.fromRaw(rawHandle));
    }

    public <T> T resolve(Handle handle, Class<T> type) {
        return type.cast(resolve(handle));
    }

    public boolean isLive(Handle handle) {
        Stripe stripe = stripeOf(handle);
        return stripe != null && stripe.get(handle.index() >>> shift, handle.generation()) != null;
    }

    /** Returns the slot's reference count, or zero for a stale handle. */
    public int refCount(Handle handle) {
        Stripe stripe = stripeOf(handle);
        return stripe == null ? 0 : stripe.refCount(handle.index() >>> shift, handle.generation());
    }

    /**
     * Adds one reference to a live handle.
     *
     * @throws StaleHandleException if the handle is stale
     */
    public Handle retain(Handle handle) {
        Stripe stripe = stripeOf(handle);
        if (stripe == null || !stripe.retain(handle.index() >>> shift, handle.generation())) {
            throw new StaleHandleException(handle.toRaw());
        }
        return handle;
    }

    /** Like {@link #retain} but reports a stale handle as {@code false}. */
    public boolean tryRetain(Handle handle) {
        Stripe stripe = stripeOf(handle);
        return stripe != null && stripe.retain(handle.index() >>> shift, handle.generation());
    }

    public ReleaseResult release(Handle handle) {
        Objects.requireNonNull(handle, "handle");
        Stripe stripe = stripeOf(handle);
        if (stripe == null) {
            staleReleaseCount.incrementAndGet();
            return ReleaseResult.STALE;
        }
        Stripe.Outcome outcome = stripe.release(handle.index() >>> shift, handle.generation());
        switch (outcome.result()) {
            case STALE -> {
                staleReleaseCount.incrementAndGet();
                LOG.fine(() -> "Ignoring release of stale " + handle);
            }
            case RELEASED -> {
                releaseCount.incrementAndGet();
                notifyFreed(handle, outcome.freed());
            }
            case RETAINED -> {
            }
        }
        return outcome.result();
    }

    @Override
    public ReleaseResult release(long rawHandle) {
        return release(Handle.fromRaw(rawHandle));
    }

    public int liveCount() {
        int live = 0;
        for (Stripe stripe : stripes) {
            live += stripe.live();
        }
        return live;
    }

    public int capacity() {
        return capacity;
    }

    public int stripeCount() {
        return stripes.length;
    }

    public HandleTableStats stats() {
        return new HandleTableStats(
            liveCount(),
            capacity,
            registerCount.get(),
            releaseCount.get(),
            staleReleaseCount.get(),
            exhaustedCount.get()
        );
    }

    /**
     * Frees every live slot regardless of reference counts. Shutdown path only.
     *
     * @return number of slots freed
     */
    public int clear() {
        int cleared = 0;
        for (Stripe stripe : stripes) {
            List<Object[]> freed = stripe.clear(shift);
            for (Object[] pair : freed) {
                releaseCount.incrementAndGet();
                notifyFreed((Handle) pair[0], pair[1]);
            }
            cleared += freed.size();
        }
        if (cleared > 0) {
            LOG.info("Handle table cleared liveHandles=" + cleared);
        }
        return cleared;
    }

    private Stripe stripeOf(Handle handle) {
        int index = handle.index();
        if (index < 0) {
            return null;
        }
        return stripes[index & mask];
    }

    private void notifyFreed(Handle handle, Object freed) {
        if (freedListener == null) {
            return;
        }
        try {
            freedListener.accept(handle, freed);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Slot-freed listener failed for " + handle, e);
        }
    }

    /**
     * One lock-guarded group of slots. Arrays grow by doubling up to {@code maxSlots}.
     */
    static final class Stripe {
        private final ReentrantLock lock = new ReentrantLock();
        private final int id;
        private final int maxSlots;

        private Object[] objects;
        private int[] generations;
        private int[] refCounts;
        private int[] freeSlots;
        private int freeTop;
        private int used;
        private int live;

        Stripe(int id, int maxSlots) {
            this.id = id;
            this.maxSlots = maxSlots;
            int initial = Math.min(BridgeDefaults.INITIAL_SLOTS_PER_STRIPE, maxSlots);
            this.objects = new Object[initial];
            this.generations = new int[initial];
            this.refCounts = new int[initial];
            this.freeSlots = new int[initial];
        }

        Handle register(Object object, int shift) {
            lock.lock();
            try {
                int local;
                if (freeTop > 0) {
                    local = freeSlots[--freeTop];
                } else if (used < objects.length) {
                    local = used++;
                } else if (objects.length < maxSlots) {
                    grow();
                    local = used++;
                } else {
                    return null;
                }
                if (generations[local] == 0) {
                    generations[local] = FIRST_GENERATION;
                }
                objects[local] = object;
                refCounts[local] = 1;
                live++;
                return new Handle((local << shift) | id, generations[local]);
            } finally {
                lock.unlock();
            }
        }

        Object get(int local, int generation) {
            lock.lock();
            try {
                if (local >= used || generations[local] != generation) {
                    return null;
                }
                return objects[local];
            } finally {
                lock.unlock();
            }
        }

        int refCount(int local, int generation) {
            lock.lock();
            try {
                if (local >= used || generations[local] != generation || objects[local] == null) {
                    return 0;
                }
                return refCounts[local];
            } finally {
                lock.unlock();
            }
        }

        boolean retain(int local, int generation) {
            lock.lock();
            try {
                if (local >= used || generations[local] != generation || objects[local] == null) {
                    return false;
                }
                if (refCounts[local] == Integer.MAX_VALUE) {
                    throw new IllegalStateException("Reference count overflow for slot " + local + " of stripe " + id);
                }
                refCounts[local]++;
                return true;
            } finally {
                lock.unlock();
            }
        }

        Outcome release(int local, int generation) {
            lock.lock();
            try {
                if (local >= used || generations[local] != generation || objects[local] == null) {
                    return Outcome.STALE;
                }
                if (--refCounts[local] > 0) {
                    return Outcome.RETAINED;
                }
                Object freed = objects[local];
                free(local);
                return new Outcome(ReleaseResult.RELEASED, freed);
            } finally {
                lock.unlock();
            }
        }

        List<Object[]> clear(int shift) {
            List<Object[]> freed = new ArrayList<>();
            lock.lock();
            try {
                for (int local = 0; local < used; local++) {
                    if (objects[local] != null) {
                        freed.add(new Object[]{new Handle((local << shift) | id, generations[local]), objects[local]});
                        free(local);
                    }
                }
            } finally {
                lock.unlock();
            }
            return freed;
        }

        int live() {
            lock.lock();
            try {
                return live;
            } finally {
                lock.unlock();
            }
        }

        private void free(int local) {
            objects[local] = null;
            refCounts[local] = 0;
            live--;
            int next = generations[local] + 1;
            generations[local] = next;
            if (next == RETIRED_GENERATION) {
                LOG.fine(() -> "Retiring slot " + local + " of stripe " + id + " after generation wrap");
                return;
            }
            freeSlots[freeTop++] = local;
        }

        private void grow() {
            int newLength = (int) Math.min((long) objects.length << 1, maxSlots);
            objects = Arrays.copyOf(objects, newLength);
            generations = Arrays.copyOf(generations, newLength);
            refCounts = Arrays.copyOf(refCounts, newLength);
            freeSlots = Arrays.copyOf(freeSlots, newLength);
        }

        record Outcome(ReleaseResult result, Object freed) {
            static final Outcome STALE = new Outcome(ReleaseResult.STALE, null);
            static final Outcome RETAINED = new Outcome(ReleaseResult.RETAINED, null);
        }
    }
}
